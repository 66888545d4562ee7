package io.hyperfoil.tools.seqdiag.layout;

import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.*;

public class LayoutOptionsTest {

    @Test
    public void defaults(){
        LayoutOptions options = LayoutOptions.defaults();
        assertFalse(options.isSectionCollapsed(1));
        assertFalse("notes are expanded until a set is given",options.isNoteCollapsed(1));
        assertEquals(0,options.getContainerWidth(),0.0);
    }

    @Test
    public void expanded_notes(){
        LayoutOptions options = LayoutOptions.defaults().withExpandedNotes(Set.of(3));
        assertFalse(options.isNoteCollapsed(3));
        assertTrue(options.isNoteCollapsed(4));
        assertFalse(options.withExpandedNotes(null).isNoteCollapsed(4));
    }

    @Test
    public void copies_are_independent(){
        Set<Integer> lines = new HashSet<>(Set.of(2));
        LayoutOptions options = LayoutOptions.defaults().withCollapsedSections(lines);
        lines.add(5);
        assertTrue(options.isSectionCollapsed(2));
        assertFalse(options.isSectionCollapsed(5));
        assertFalse(LayoutOptions.defaults().isSectionCollapsed(2));
    }

    @Test
    public void negative_width_is_zero(){
        assertEquals(0,LayoutOptions.defaults().withContainerWidth(-5).getContainerWidth(),0.0);
    }
}
