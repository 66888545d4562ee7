package io.hyperfoil.tools.seqdiag.model;

import java.util.Objects;

public class Note implements SequenceElement {

    private final String text;
    private final NotePosition position;
    private final String participantId;
    private final int lineNumber;

    public Note(String text, NotePosition position, String participantId, int lineNumber){
        this.text = text;
        this.position = position == null ? NotePosition.RIGHT : position;
        this.participantId = participantId;
        this.lineNumber = lineNumber;
    }

    @Override
    public Kind getKind(){return Kind.NOTE;}

    /**
     * @return the note text, lines of a multi-line note are joined with \n
     */
    public String getText(){return text;}
    public NotePosition getPosition(){return position;}
    public String getParticipantId(){return participantId;}
    @Override
    public int getLineNumber(){return lineNumber;}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Note)) return false;
        Note note = (Note) o;
        return lineNumber == note.lineNumber &&
                text.equals(note.text) &&
                position == note.position &&
                participantId.equals(note.participantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, position, participantId, lineNumber);
    }

    @Override
    public String toString(){
        return "note " + position + " of " + participantId + ": " + text;
    }
}
