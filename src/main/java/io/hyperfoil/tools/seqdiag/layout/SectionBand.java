package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.model.Section;

public class SectionBand {

    private final Section section;
    private final double y;
    private final double x;
    private final double width;
    private final double height;
    private final boolean collapsed;
    private final int messageCount;
    private final String displayLabel;

    public SectionBand(Section section, double y, double x, double width, double height, boolean collapsed, int messageCount){
        this.section = section;
        this.y = y;
        this.x = x;
        this.width = width;
        this.height = height;
        this.collapsed = collapsed;
        this.messageCount = messageCount;
        this.displayLabel = collapsed ?
                section.getLabel()+" ("+messageCount+" "+(messageCount == 1 ? "message" : "messages")+")" :
                section.getLabel();
    }

    public Section getSection(){return section;}
    public int getLineNumber(){return section.getLineNumber();}

    /**
     * @return y of the divider line, the band is centered on it
     */
    public double getY(){return y;}
    public double getX(){return x;}
    public double getWidth(){return width;}
    public double getHeight(){return height;}
    public boolean isCollapsed(){return collapsed;}
    public int getMessageCount(){return messageCount;}
    public String getDisplayLabel(){return displayLabel;}

    @Override
    public String toString(){
        return displayLabel+"@"+y;
    }
}
