package io.hyperfoil.tools.seqdiag.model;

import java.util.Objects;

public class Message implements SequenceElement {

    private final String from;
    private final String to;
    private final String label;
    private final String returnLabel;
    private final int lineNumber;
    private final boolean async;
    private final int index;

    public Message(String from, String to, String label, String returnLabel, int lineNumber, boolean async, int index){
        this.from = from;
        this.to = to;
        this.label = label == null ? "" : label;
        this.returnLabel = returnLabel;
        this.lineNumber = lineNumber;
        this.async = async;
        this.index = index;
    }

    @Override
    public Kind getKind(){return Kind.MESSAGE;}

    public String getFrom(){return from;}
    public String getTo(){return to;}
    public String getLabel(){return label;}
    public String getReturnLabel(){return returnLabel;}
    public boolean hasReturnLabel(){return returnLabel != null;}
    @Override
    public int getLineNumber(){return lineNumber;}
    public boolean isAsync(){return async;}
    public boolean isSelfCall(){return from.equals(to);}

    /**
     * @return position of this message in {@link Document#getMessages()}
     */
    public int getIndex(){return index;}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message message = (Message) o;
        return lineNumber == message.lineNumber &&
                async == message.async &&
                index == message.index &&
                from.equals(message.from) &&
                to.equals(message.to) &&
                label.equals(message.label) &&
                Objects.equals(returnLabel, message.returnLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, label, returnLabel, lineNumber, async, index);
    }

    @Override
    public String toString(){
        return from + (async ? " ~> " : " -> ") + to + ": " + label + (returnLabel == null ? "" : " <- " + returnLabel);
    }
}
