package io.hyperfoil.tools.seqdiag.model;

import java.util.Objects;

/**
 * A labeled horizontal divider. Top level sections own the messages that follow them up to the next section.
 */
public class Section implements SequenceElement {

    private final String label;
    private final String color;
    private final int lineNumber;

    public Section(String label, String color, int lineNumber){
        this.label = label;
        this.color = color;
        this.lineNumber = lineNumber;
    }

    @Override
    public Kind getKind(){return Kind.SECTION;}

    public String getLabel(){return label;}
    public String getColor(){return color;}
    public boolean hasColor(){return color != null;}
    @Override
    public int getLineNumber(){return lineNumber;}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Section)) return false;
        Section section = (Section) o;
        return lineNumber == section.lineNumber && label.equals(section.label) && Objects.equals(color, section.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, color, lineNumber);
    }

    @Override
    public String toString(){
        return "== " + label + (color == null ? "" : "(" + color + ")") + " ==";
    }
}
