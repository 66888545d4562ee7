package io.hyperfoil.tools.seqdiag.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An if, loop or parallel frame around a nested run of elements.
 * The child lists are appended to while parsing and become read-only once the owning {@link Document} is built.
 */
public class Block implements SequenceElement {

    private final BlockType type;
    private final String label;
    private final int lineNumber;
    private List<SequenceElement> children;
    private List<SequenceElement> elseChildren;
    private List<ElseIfBranch> elseIfBranches;
    private int elseLineNumber;

    public Block(BlockType type, String label, int lineNumber){
        this.type = type;
        this.label = label == null ? "" : label;
        this.lineNumber = lineNumber;
        this.children = new ArrayList<>();
        this.elseChildren = new ArrayList<>();
        this.elseIfBranches = new ArrayList<>();
    }

    @Override
    public Kind getKind(){return Kind.BLOCK;}

    public BlockType getType(){return type;}
    public String getLabel(){return label;}
    @Override
    public int getLineNumber(){return lineNumber;}
    public List<SequenceElement> getChildren(){return children;}
    public List<SequenceElement> getElseChildren(){return elseChildren;}
    public List<ElseIfBranch> getElseIfBranches(){return elseIfBranches;}
    public boolean hasElse(){return !elseChildren.isEmpty();}
    public boolean hasElseIf(){return !elseIfBranches.isEmpty();}
    /**
     * @return line of the <code>else</code> keyword, 0 when there is none
     */
    public int getElseLineNumber(){return elseLineNumber;}

    public void setElseLineNumber(int elseLineNumber){
        if(!type.isBranching()){
            throw new IllegalStateException(type+" blocks do not support else");
        }
        this.elseLineNumber = elseLineNumber;
    }

    /**
     * Starts a new else if branch. Only valid for {@link BlockType#IF}.
     */
    public ElseIfBranch addElseIf(String label, int lineNumber){
        if(!type.isBranching()){
            throw new IllegalStateException(type+" blocks do not support else if");
        }
        ElseIfBranch branch = new ElseIfBranch(label,lineNumber);
        elseIfBranches.add(branch);
        return branch;
    }

    /**
     * children, then every else if branch in order, then the else children
     */
    public List<List<SequenceElement>> getBranches(){
        List<List<SequenceElement>> rtrn = new ArrayList<>();
        rtrn.add(children);
        elseIfBranches.forEach(branch->rtrn.add(branch.getChildren()));
        rtrn.add(elseChildren);
        return rtrn;
    }

    void freeze(){
        children.forEach(Block::freezeElement);
        elseChildren.forEach(Block::freezeElement);
        elseIfBranches.forEach(ElseIfBranch::freeze);
        children = Collections.unmodifiableList(children);
        elseChildren = Collections.unmodifiableList(elseChildren);
        elseIfBranches = Collections.unmodifiableList(elseIfBranches);
    }

    static void freezeElement(SequenceElement element){
        if(element instanceof Block){
            ((Block)element).freeze();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        Block block = (Block) o;
        return lineNumber == block.lineNumber &&
                elseLineNumber == block.elseLineNumber &&
                type == block.type &&
                label.equals(block.label) &&
                children.equals(block.children) &&
                elseChildren.equals(block.elseChildren) &&
                elseIfBranches.equals(block.elseIfBranches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, label, lineNumber, elseLineNumber, children, elseChildren, elseIfBranches);
    }

    @Override
    public String toString(){
        return type + (label.isEmpty() ? "" : " " + label);
    }
}
