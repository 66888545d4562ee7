package io.hyperfoil.tools.seqdiag.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class ElseIfBranch {

    private final String label;
    private final int lineNumber;
    private List<SequenceElement> children;

    public ElseIfBranch(String label, int lineNumber){
        this.label = label;
        this.lineNumber = lineNumber;
        this.children = new ArrayList<>();
    }

    public String getLabel(){return label;}
    public int getLineNumber(){return lineNumber;}
    public List<SequenceElement> getChildren(){return children;}

    void freeze(){
        children.forEach(Block::freezeElement);
        children = Collections.unmodifiableList(children);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElseIfBranch)) return false;
        ElseIfBranch that = (ElseIfBranch) o;
        return lineNumber == that.lineNumber && label.equals(that.label) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, lineNumber, children);
    }
}
