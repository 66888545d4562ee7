package io.hyperfoil.tools.seqdiag.model;

public enum BlockType {
    IF("if",true),
    LOOP("loop",false),
    PARALLEL("parallel",false);

    private final String keyword;
    private final boolean branching;

    BlockType(String keyword, boolean branching){
        this.keyword = keyword;
        this.branching = branching;
    }

    public String getKeyword(){return keyword;}

    /**
     * @return true if the block accepts else and else if branches
     */
    public boolean isBranching(){return branching;}

    @Override
    public String toString(){return keyword;}
}
