package io.hyperfoil.tools.seqdiag.model;

public class SequenceParseException extends RuntimeException {

    private final ParseError error;

    public SequenceParseException(ParseError error){
        super(error.getMessage());
        this.error = error;
    }

    public static SequenceParseException structural(int lineNumber, String message){
        return new SequenceParseException(new ParseError(ParseError.Kind.STRUCTURAL,lineNumber,"Line "+lineNumber+": "+message));
    }
    public static SequenceParseException content(String message){
        return new SequenceParseException(new ParseError(ParseError.Kind.CONTENT,0,message));
    }

    public ParseError getError(){return error;}
    public int getLineNumber(){return error.getLineNumber();}
    public ParseError.Kind getKind(){return error.getKind();}
}
