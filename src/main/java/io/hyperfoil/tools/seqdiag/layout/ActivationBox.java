package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.render.Activation;

public class ActivationBox {

    private final Activation activation;
    private final double x;
    private final double y1;
    private final double y2;
    private final double width;

    public ActivationBox(Activation activation, double x, double y1, double y2, double width){
        this.activation = activation;
        this.x = x;
        this.y1 = y1;
        this.y2 = y2;
        this.width = width;
    }

    public Activation getActivation(){return activation;}
    public String getParticipantId(){return activation.getParticipantId();}
    public int getDepth(){return activation.getDepth();}
    public double getX(){return x;}
    public double getY1(){return y1;}
    public double getY2(){return y2;}
    public double getWidth(){return width;}
    public double getHeight(){return y2 - y1;}

    @Override
    public String toString(){
        return activation+" x="+x+" y="+y1+".."+y2;
    }
}
