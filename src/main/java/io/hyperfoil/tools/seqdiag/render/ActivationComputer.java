package io.hyperfoil.tools.seqdiag.render;

import java.util.*;

public class ActivationComputer {

    private ActivationComputer(){}

    /**
     * Pairs each call with the callee's next return. Returns without an open call are ignored.
     */
    public static List<Activation> compute(List<RenderStep> steps){
        List<Activation> rtrn = new ArrayList<>();
        Map<String,Deque<Integer>> stacks = new HashMap<>();
        for(int i=0; i<steps.size(); i++){
            RenderStep step = steps.get(i);
            if(step.isCall()){
                stacks.computeIfAbsent(step.getTo(),k->new ArrayDeque<>()).push(i);
            }else{
                Deque<Integer> stack = stacks.get(step.getFrom());
                if(stack != null && !stack.isEmpty()){
                    int start = stack.pop();
                    rtrn.add(new Activation(step.getFrom(),start,i,stack.size()));
                }
            }
        }
        return rtrn;
    }
}
