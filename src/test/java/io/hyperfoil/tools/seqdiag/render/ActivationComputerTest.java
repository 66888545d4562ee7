package io.hyperfoil.tools.seqdiag.render;

import io.hyperfoil.tools.seqdiag.SeqdiagTestBase;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ActivationComputerTest extends SeqdiagTestBase {

    private static List<Activation> compute(String...lines){
        return ActivationComputer.compute(RenderSequenceBuilder.build(parseValid(lines).getMessages()));
    }

    @Test
    public void single_call(){
        assertEquals(List.of(new Activation("B",0,1,0)),compute("A -> B: request : response"));
    }

    @Test
    public void nested_depth(){
        //A->B, B->B, return B, return B->A
        List<Activation> activations = compute(
                "A -> B: outer",
                "B -> B: inner"
        );
        assertEquals(2,activations.size());
        assertEquals(new Activation("B",1,2,1),activations.get(0));
        assertEquals(new Activation("B",0,3,0),activations.get(1));
    }

    @Test
    public void async_opens_without_closing(){
        assertTrue(compute("A ~> B: fire").isEmpty());
    }

    @Test
    public void unmatched_return_ignored(){
        List<RenderStep> steps = List.of(RenderStep.ret("B","A","",0));
        assertTrue(ActivationComputer.compute(steps).isEmpty());
    }

    @Test
    public void covers(){
        Activation activation = new Activation("B",2,4,0);
        assertFalse(activation.covers(1));
        assertTrue(activation.covers(2));
        assertTrue(activation.covers(4));
        assertFalse(activation.covers(5));
    }
}
