package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.model.Group;

public class GroupBox {

    private final Group group;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final double labelX;
    private final double labelY;

    public GroupBox(Group group, double x, double y, double width, double height, double labelX, double labelY){
        this.group = group;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.labelX = labelX;
        this.labelY = labelY;
    }

    public Group getGroup(){return group;}
    public String getName(){return group.getName();}
    public double getX(){return x;}
    public double getY(){return y;}
    public double getWidth(){return width;}
    public double getHeight(){return height;}
    public double getLabelX(){return labelX;}
    public double getLabelY(){return labelY;}

    @Override
    public String toString(){
        return group.getName()+" ["+x+","+y+" "+width+"x"+height+"]";
    }
}
