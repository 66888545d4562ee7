package io.hyperfoil.tools.seqdiag.model;

/**
 * A node in the ordered element tree of a {@link Document}.
 */
public interface SequenceElement {

    enum Kind {MESSAGE, BLOCK, SECTION, NOTE}

    Kind getKind();

    int getLineNumber();

    default boolean isMessage(){return getKind() == Kind.MESSAGE;}
    default boolean isBlock(){return getKind() == Kind.BLOCK;}
    default boolean isSection(){return getKind() == Kind.SECTION;}
    default boolean isNote(){return getKind() == Kind.NOTE;}
}
