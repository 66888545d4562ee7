package io.hyperfoil.tools.seqdiag.layout;

/**
 * The line between two branches of an if frame.
 */
public class FrameDivider {

    private final double y;
    private final String label;
    private final int lineNumber;

    public FrameDivider(double y, String label, int lineNumber){
        this.y = y;
        this.label = label;
        this.lineNumber = lineNumber;
    }

    public double getY(){return y;}
    public String getLabel(){return label;}

    /**
     * @return line of the <code>else if</code>, 0 for a plain <code>else</code>
     */
    public int getLineNumber(){return lineNumber;}

    @Override
    public String toString(){
        return label+"@"+y;
    }
}
