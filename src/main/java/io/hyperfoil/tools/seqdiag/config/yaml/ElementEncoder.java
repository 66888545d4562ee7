package io.hyperfoil.tools.seqdiag.config.yaml;

import io.hyperfoil.tools.seqdiag.model.SequenceElement;

public interface ElementEncoder<T extends SequenceElement> {

    public Object encode(T element);
}
