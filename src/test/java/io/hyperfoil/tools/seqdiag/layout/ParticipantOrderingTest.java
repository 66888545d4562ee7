package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.SeqdiagTestBase;
import io.hyperfoil.tools.seqdiag.model.Document;
import io.hyperfoil.tools.seqdiag.model.Participant;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class ParticipantOrderingTest extends SeqdiagTestBase {

    private static List<String> order(String...lines){
        Document document = parseValid(lines);
        return ParticipantOrdering.order(document.getParticipants(),document.getGroups()).stream()
                .map(Participant::getId)
                .collect(Collectors.toList());
    }

    @Test
    public void no_overrides_keeps_order(){
        assertEquals(List.of("A","B","C"),order("A -> B: x","B -> C: y"));
    }

    @Test
    public void negative_position_is_last(){
        assertEquals(List.of("B","C","A"),order(
                "A position -1",
                "A -> B: x",
                "B -> C: y"
        ));
    }

    @Test
    public void last_regardless_of_declaration_order(){
        assertEquals("A",order(
                "B -> C: y",
                "C -> D: z",
                "A position -1",
                "D -> A: w"
        ).get(3));
    }

    @Test
    public void collision_moves_to_next_slot(){
        assertEquals(List.of("A","B","C"),order(
                "A position 0",
                "B position 0",
                "A -> C: x",
                "B -> C: y"
        ));
    }

    @Test
    public void collision_searches_both_directions(){
        List<String> order = order(
                "A position 1",
                "B position 1",
                "C position 1",
                "A -> D: x",
                "B -> C: y"
        );
        assertEquals(List.of("C","A","B","D"),order);
        assertEquals("no duplicate slots",order.size(),new HashSet<>(order).size());
    }

    @Test
    public void out_of_range_is_clamped(){
        assertEquals(List.of("B","C","A"),order(
                "A position 10",
                "A -> B: x",
                "B -> C: y"
        ));
        assertEquals(List.of("C","A","B"),order(
                "C position -10",
                "A -> B: x",
                "B -> C: y"
        ));
    }

    @Test
    public void huge_positions_are_clamped(){
        assertEquals(List.of("B","A"),order(
                "A position 99999999999",
                "A -> B: x"
        ));
        assertEquals(List.of("B","A"),order(
                "B position -99999999999",
                "A -> B: x"
        ));
    }

    @Test
    public void groups_are_adjacent(){
        assertEquals(List.of("B","Y","A","X"),order(
                "X is a service",
                "A is a service",
                "## One",
                "  B",
                "## Two",
                "  Y",
                "  A",
                "X -> A: x",
                "A -> B: y"
        ));
    }

    @Test
    public void positions_apply_after_groups(){
        assertEquals(List.of("X","A","B"),order(
                "## Pair",
                "  A",
                "  B",
                "X position 0",
                "A -> X: go"
        ));
    }
}
