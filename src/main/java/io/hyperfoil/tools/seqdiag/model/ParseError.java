package io.hyperfoil.tools.seqdiag.model;

import java.util.Objects;

/**
 * The fatal problem that stopped parsing a document.
 */
public class ParseError {

    public enum Kind {
        /** malformed or misplaced syntax on a specific line */
        STRUCTURAL,
        /** the input as a whole is not a sequence diagram */
        CONTENT
    }

    private final Kind kind;
    private final int lineNumber;
    private final String message;

    public ParseError(Kind kind, int lineNumber, String message){
        this.kind = kind;
        this.lineNumber = lineNumber;
        this.message = message;
    }

    public Kind getKind(){return kind;}

    /**
     * @return 1 based line number or 0 when the error is not tied to a line
     */
    public int getLineNumber(){return lineNumber;}
    public String getMessage(){return message;}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseError)) return false;
        ParseError that = (ParseError) o;
        return lineNumber == that.lineNumber && kind == that.kind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, lineNumber, message);
    }

    @Override
    public String toString(){
        return "Error: "+message;
    }
}
