package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.model.Participant;

public class ParticipantBox {

    private final Participant participant;
    private final int slot;
    private final double centerX;
    private final double y;
    private final double width;
    private final double height;
    private final double lifelineStartY;
    private final double lifelineEndY;

    public ParticipantBox(Participant participant, int slot, double centerX, double y, double width, double height, double lifelineStartY, double lifelineEndY){
        this.participant = participant;
        this.slot = slot;
        this.centerX = centerX;
        this.y = y;
        this.width = width;
        this.height = height;
        this.lifelineStartY = lifelineStartY;
        this.lifelineEndY = lifelineEndY;
    }

    public Participant getParticipant(){return participant;}
    public String getId(){return participant.getId();}
    public int getSlot(){return slot;}
    public double getCenterX(){return centerX;}
    public double getX(){return centerX - width/2;}
    public double getY(){return y;}
    public double getWidth(){return width;}
    public double getHeight(){return height;}
    public double getLifelineStartY(){return lifelineStartY;}
    public double getLifelineEndY(){return lifelineEndY;}

    @Override
    public String toString(){
        return participant.getId()+"@"+centerX;
    }
}
