package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.model.Block;

import java.util.List;

public class BlockFrame {

    private final Block block;
    private final int depth;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final String label;
    private final List<FrameDivider> dividers;

    public BlockFrame(Block block, int depth, double x, double y, double width, double height, String label, List<FrameDivider> dividers){
        this.block = block;
        this.depth = depth;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.label = label;
        this.dividers = List.copyOf(dividers);
    }

    public Block getBlock(){return block;}
    public int getDepth(){return depth;}
    public double getX(){return x;}
    public double getY(){return y;}
    public double getWidth(){return width;}
    public double getHeight(){return height;}
    public String getLabel(){return label;}
    public List<FrameDivider> getDividers(){return dividers;}
    public int getLineNumber(){return block.getLineNumber();}

    @Override
    public String toString(){
        return label+" ["+x+","+y+" "+width+"x"+height+"] "+dividers;
    }
}
