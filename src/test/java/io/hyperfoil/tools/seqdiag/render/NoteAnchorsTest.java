package io.hyperfoil.tools.seqdiag.render;

import io.hyperfoil.tools.seqdiag.SeqdiagTestBase;
import io.hyperfoil.tools.seqdiag.model.Document;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class NoteAnchorsTest extends SeqdiagTestBase {

    @Test
    public void anchors_to_preceding_message(){
        Document document = parseValid(
                "A -> B: one",
                "note: first",
                "if ok",
                "  B -> C: two",
                "  note right of C: inside",
                "note left of A: after block"
        );
        Map<Integer,Integer> anchors = NoteAnchors.build(document.getElements());
        assertEquals(3,anchors.size());
        assertEquals(Integer.valueOf(1),anchors.get(2));
        assertEquals(Integer.valueOf(4),anchors.get(5));
        assertEquals(Integer.valueOf(4),anchors.get(6));
    }

    @Test
    public void no_anchor_without_message(){
        assertTrue(NoteAnchors.build(parseValid("chart: sequence").getElements()).isEmpty());
    }
}
