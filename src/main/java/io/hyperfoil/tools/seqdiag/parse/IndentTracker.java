package io.hyperfoil.tools.seqdiag.parse;

/**
 * Measures the leading whitespace of a line. A tab counts as four spaces.
 */
public class IndentTracker {

    public static final int TAB_WIDTH = 4;

    private IndentTracker(){}

    public static int measure(String line){
        if(line == null){
            return 0;
        }
        int indent = 0;
        for(int i=0; i<line.length(); i++){
            char c = line.charAt(i);
            if(c == ' '){
                indent++;
            }else if (c == '\t'){
                indent+=TAB_WIDTH;
            }else{
                break;
            }
        }
        return indent;
    }
}
