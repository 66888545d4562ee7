package io.hyperfoil.tools.seqdiag.config;

import java.util.Collections;
import java.util.List;

public class LayoutConfigException extends RuntimeException {

    private final List<String> errors;

    public LayoutConfigException(String message){
        this(message, Collections.emptyList());
    }
    public LayoutConfigException(String message, Throwable cause){
        super(message,cause);
        this.errors = Collections.emptyList();
    }
    public LayoutConfigException(String message, List<String> errors){
        super(errors.isEmpty() ? message : message+": "+String.join(", ",errors));
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<String> getErrors(){return errors;}
}
