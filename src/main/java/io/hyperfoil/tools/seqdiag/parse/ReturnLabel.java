package io.hyperfoil.tools.seqdiag.parse;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the text after a sync arrow's colon into the call label and an optional return label.
 * <p>
 * Checked in order: <code>call &lt;- result</code>, <code>method(args): Type</code>, then the last <code>:</code>
 * that is not a URL scheme separator and has text on both sides.
 */
public class ReturnLabel {

    private static final Pattern ARROW_RETURN = Pattern.compile("^(.+?)\\s*<-\\s*(.+)$");
    private static final Pattern UML_RETURN = Pattern.compile("^(\\w+\\([^)]*\\))\\s*:\\s*(.+)$");

    private final String label;
    private final String returnLabel;

    private ReturnLabel(String label, String returnLabel){
        this.label = label;
        this.returnLabel = returnLabel;
    }

    public static ReturnLabel parse(String raw){
        if(raw == null || raw.isEmpty()){
            return new ReturnLabel("",null);
        }
        Matcher matcher = ARROW_RETURN.matcher(raw);
        if(matcher.matches()){
            return new ReturnLabel(matcher.group(1).trim(),matcher.group(2).trim());
        }
        matcher = UML_RETURN.matcher(raw);
        if(matcher.matches()){
            return new ReturnLabel(matcher.group(1).trim(),matcher.group(2).trim());
        }
        int lastColon = raw.lastIndexOf(':');
        if(lastColon > 0 && lastColon < raw.length() - 1){
            String after = raw.substring(lastColon + 1);
            if(!after.startsWith("//")){
                String request = raw.substring(0,lastColon).trim();
                String response = after.trim();
                if(!request.isEmpty() && !response.isEmpty()){
                    return new ReturnLabel(request,response);
                }
            }
        }
        return new ReturnLabel(raw,null);
    }

    /**
     * Async messages never get a return label
     */
    public static ReturnLabel async(String raw){
        return new ReturnLabel(raw == null ? "" : raw,null);
    }

    public String getLabel(){return label;}
    public String getReturnLabel(){return returnLabel;}
    public boolean hasReturnLabel(){return returnLabel != null;}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReturnLabel)) return false;
        ReturnLabel that = (ReturnLabel) o;
        return label.equals(that.label) && Objects.equals(returnLabel, that.returnLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, returnLabel);
    }

    @Override
    public String toString(){
        return returnLabel == null ? label : label + " <- " + returnLabel;
    }
}
