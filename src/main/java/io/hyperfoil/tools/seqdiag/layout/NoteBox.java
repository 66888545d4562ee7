package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.model.Note;

import java.util.List;

public class NoteBox {

    private final Note note;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final double fold;
    private final boolean collapsed;
    private final List<String> lines;
    private final List<List<InlineMarkdown.Span>> spans;

    public NoteBox(Note note, double x, double y, double width, double height, double fold, boolean collapsed, List<String> lines, List<List<InlineMarkdown.Span>> spans){
        this.note = note;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.fold = fold;
        this.collapsed = collapsed;
        this.lines = List.copyOf(lines);
        this.spans = List.copyOf(spans);
    }

    public Note getNote(){return note;}
    public int getLineNumber(){return note.getLineNumber();}
    public double getX(){return x;}
    public double getY(){return y;}
    public double getWidth(){return width;}
    public double getHeight(){return height;}
    public double getBottom(){return y + height;}

    /**
     * @return size of the folded corner, 0 when collapsed
     */
    public double getFold(){return fold;}
    public boolean isCollapsed(){return collapsed;}
    public List<String> getLines(){return lines;}
    public List<List<InlineMarkdown.Span>> getSpans(){return spans;}

    @Override
    public String toString(){
        return "note:"+note.getLineNumber()+" ["+x+","+y+" "+width+"x"+height+"]"+(collapsed ? " collapsed" : "");
    }
}
