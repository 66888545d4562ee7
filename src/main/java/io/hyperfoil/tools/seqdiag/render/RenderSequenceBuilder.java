package io.hyperfoil.tools.seqdiag.render;

import io.hyperfoil.tools.seqdiag.model.Message;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns messages into call and return steps by simulating a call stack.
 * A return is placed once the callee stops being the sender, so nested calls finish before their caller's return.
 */
public class RenderSequenceBuilder {

    private RenderSequenceBuilder(){}

    public static List<RenderStep> build(List<Message> messages){
        List<RenderStep> rtrn = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        for(int i=0; i<messages.size(); i++){
            Message message = messages.get(i);
            while(!stack.isEmpty() && !messages.get(stack.peek()).getTo().equals(message.getFrom())){
                rtrn.add(returnOf(messages,stack.pop()));
            }
            rtrn.add(RenderStep.call(message.getFrom(),message.getTo(),message.getLabel(),i,message.isAsync()));
            if(message.isAsync()){
                continue;
            }
            if(message.isSelfCall()){
                rtrn.add(RenderStep.ret(message.getTo(),message.getFrom(),message.getReturnLabel(),i));
            }else{
                stack.push(i);
            }
        }
        while(!stack.isEmpty()){
            rtrn.add(returnOf(messages,stack.pop()));
        }
        return rtrn;
    }

    /**
     * @param index position in the list given to {@link #build(List)}, the same index the call step carries
     */
    private static RenderStep returnOf(List<Message> messages, int index){
        Message message = messages.get(index);
        return RenderStep.ret(message.getTo(),message.getFrom(),message.getReturnLabel(),index);
    }
}
