package io.hyperfoil.tools.seqdiag.parse;

/**
 * One line of input as seen by the {@link LineRule}s.
 */
public class SourceLine {

    private final String raw;
    private final String trimmed;
    private final int lineNumber;
    private final int indent;

    public SourceLine(String raw, int lineNumber){
        this.raw = raw;
        this.trimmed = raw.trim();
        this.lineNumber = lineNumber;
        this.indent = IndentTracker.measure(raw);
    }

    public String getRaw(){return raw;}
    public String getTrimmed(){return trimmed;}
    public int getLineNumber(){return lineNumber;}
    public int getIndent(){return indent;}
    public boolean isBlank(){return trimmed.isEmpty();}
    public boolean isIndented(){return indent > 0;}

    @Override
    public String toString(){
        return lineNumber + ": " + raw;
    }
}
