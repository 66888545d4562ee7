package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.render.RenderStep;

/**
 * Position of one visible render step. For a self call the arrow leaves at <code>x1</code> and loops out to <code>x2</code>.
 */
public class StepGeometry {

    private final RenderStep step;
    private final int lineNumber;
    private final double y;
    private final double x1;
    private final double x2;
    private final boolean selfCall;

    public StepGeometry(RenderStep step, int lineNumber, double y, double x1, double x2, boolean selfCall){
        this.step = step;
        this.lineNumber = lineNumber;
        this.y = y;
        this.x1 = x1;
        this.x2 = x2;
        this.selfCall = selfCall;
    }

    public RenderStep getStep(){return step;}
    public int getLineNumber(){return lineNumber;}
    public double getY(){return y;}
    public double getX1(){return x1;}
    public double getX2(){return x2;}
    public boolean isSelfCall(){return selfCall;}

    @Override
    public String toString(){
        return step+" y="+y+" x="+x1+".."+x2;
    }
}
