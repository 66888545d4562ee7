package io.hyperfoil.tools.seqdiag.parse;

import org.junit.Test;

import static org.junit.Assert.*;

public class IndentTrackerTest {

    @Test
    public void spaces_and_tabs(){
        assertEquals(0,IndentTracker.measure("A -> B"));
        assertEquals(2,IndentTracker.measure("  A -> B"));
        assertEquals(IndentTracker.TAB_WIDTH,IndentTracker.measure("\tA -> B"));
        assertEquals(IndentTracker.TAB_WIDTH+1,IndentTracker.measure("\t A"));
    }

    @Test
    public void blank_and_null(){
        assertEquals(0,IndentTracker.measure(null));
        assertEquals(0,IndentTracker.measure(""));
        assertEquals(3,IndentTracker.measure("   "));
    }
}
