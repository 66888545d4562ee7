package io.hyperfoil.tools.seqdiag.model;

import java.util.Objects;

public class Participant {

    private final String id;
    private final String label;
    private final ParticipantType type;
    private final int lineNumber;
    private final Integer position;

    public Participant(String id, ParticipantType type, int lineNumber){
        this(id,id,type,lineNumber,null);
    }
    public Participant(String id, String label, ParticipantType type, int lineNumber, Integer position){
        this.id = id;
        this.label = label == null || label.isEmpty() ? id : label;
        this.type = type == null ? ParticipantType.DEFAULT : type;
        this.lineNumber = lineNumber;
        this.position = position;
    }

    public String getId(){return id;}
    public String getLabel(){return label;}
    public ParticipantType getType(){return type;}
    public int getLineNumber(){return lineNumber;}

    /**
     * explicit slot, 0 based from the left or negative from the right (-1 is last)
     */
    public Integer getPosition(){return position;}
    public boolean hasPosition(){return position != null;}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Participant)) return false;
        Participant that = (Participant) o;
        return lineNumber == that.lineNumber &&
                id.equals(that.id) &&
                label.equals(that.label) &&
                type == that.type &&
                Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, type, lineNumber, position);
    }

    @Override
    public String toString(){
        return id + (label.equals(id) ? "" : " aka " + label) + " is a " + type + (position == null ? "" : " position " + position);
    }
}
