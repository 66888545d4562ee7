package io.hyperfoil.tools.seqdiag.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Group {

    private final String name;
    private final String color;
    private final int lineNumber;
    private List<String> participantIds;

    public Group(String name, String color, int lineNumber){
        this.name = name;
        this.color = color;
        this.lineNumber = lineNumber;
        this.participantIds = new ArrayList<>();
    }

    public String getName(){return name;}
    public String getColor(){return color;}
    public boolean hasColor(){return color != null;}
    public int getLineNumber(){return lineNumber;}
    public List<String> getParticipantIds(){return participantIds;}
    public boolean contains(String participantId){return participantIds.contains(participantId);}

    public void addParticipant(String participantId){
        if(!participantIds.contains(participantId)){
            participantIds.add(participantId);
        }
    }

    void freeze(){
        participantIds = Collections.unmodifiableList(participantIds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Group)) return false;
        Group group = (Group) o;
        return lineNumber == group.lineNumber &&
                name.equals(group.name) &&
                Objects.equals(color, group.color) &&
                participantIds.equals(group.participantIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, color, lineNumber, participantIds);
    }

    @Override
    public String toString(){
        return "## " + name + (color == null ? "" : "(" + color + ")") + " " + participantIds;
    }
}
