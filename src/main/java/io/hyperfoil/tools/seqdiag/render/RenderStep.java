package io.hyperfoil.tools.seqdiag.render;

import java.util.Objects;

/**
 * One call or return arrow in the linear timeline built from the message list.
 */
public class RenderStep {

    public enum Type {CALL, RETURN}

    private final Type type;
    private final String from;
    private final String to;
    private final String label;
    private final int messageIndex;
    private final boolean async;

    public static RenderStep call(String from, String to, String label, int messageIndex, boolean async){
        return new RenderStep(Type.CALL,from,to,label,messageIndex,async);
    }

    public static RenderStep ret(String from, String to, String label, int messageIndex){
        return new RenderStep(Type.RETURN,from,to,label,messageIndex,false);
    }

    private RenderStep(Type type, String from, String to, String label, int messageIndex, boolean async){
        this.type = type;
        this.from = from;
        this.to = to;
        this.label = label == null ? "" : label;
        this.messageIndex = messageIndex;
        this.async = async;
    }

    public Type getType(){return type;}
    public boolean isCall(){return Type.CALL.equals(type);}
    public boolean isReturn(){return Type.RETURN.equals(type);}
    public String getFrom(){return from;}
    public String getTo(){return to;}
    public String getLabel(){return label;}
    public boolean hasLabel(){return !label.isEmpty();}
    public int getMessageIndex(){return messageIndex;}
    public boolean isAsync(){return async;}
    public boolean isSelf(){return from.equals(to);}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RenderStep that = (RenderStep) o;
        return messageIndex == that.messageIndex && async == that.async && type == that.type &&
                from.equals(that.from) && to.equals(that.to) && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, from, to, label, messageIndex, async);
    }

    @Override
    public String toString(){
        return type.name().toLowerCase()+" "+from+(async ? " ~> " : " -> ")+to+(label.isEmpty() ? "" : ": "+label)+" #"+messageIndex;
    }
}
