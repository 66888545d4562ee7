package io.hyperfoil.tools.seqdiag.render;

import java.util.Objects;

public class Activation {

    private final String participantId;
    private final int startStep;
    private final int endStep;
    private final int depth;

    public Activation(String participantId, int startStep, int endStep, int depth){
        this.participantId = participantId;
        this.startStep = startStep;
        this.endStep = endStep;
        this.depth = depth;
    }

    public String getParticipantId(){return participantId;}
    public int getStartStep(){return startStep;}
    public int getEndStep(){return endStep;}

    /**
     * @return number of activations still open on the same participant, used to offset nested bars
     */
    public int getDepth(){return depth;}

    public boolean covers(int step){
        return startStep <= step && step <= endStep;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Activation that = (Activation) o;
        return startStep == that.startStep && endStep == that.endStep && depth == that.depth && participantId.equals(that.participantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(participantId, startStep, endStep, depth);
    }

    @Override
    public String toString(){
        return participantId+"["+startStep+".."+endStep+"]@"+depth;
    }
}
