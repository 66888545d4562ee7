package io.hyperfoil.tools.seqdiag.layout;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Per call view state for {@link SequenceLayoutEngine}. Changing it never requires parsing again.
 */
public class LayoutOptions {

    private static final LayoutOptions DEFAULTS = new LayoutOptions(Collections.emptySet(),null,0);

    public static LayoutOptions defaults(){return DEFAULTS;}

    private final Set<Integer> collapsedSections;
    private final Set<Integer> expandedNoteLines;
    private final double containerWidth;

    private LayoutOptions(Set<Integer> collapsedSections, Set<Integer> expandedNoteLines, double containerWidth){
        this.collapsedSections = collapsedSections;
        this.expandedNoteLines = expandedNoteLines;
        this.containerWidth = containerWidth;
    }

    /**
     * @param sectionLines line numbers of the sections to collapse
     */
    public LayoutOptions withCollapsedSections(Set<Integer> sectionLines){
        return new LayoutOptions(copy(sectionLines),expandedNoteLines,containerWidth);
    }

    /**
     * Collapses every note except those on the given lines. Pass null to expand all notes.
     */
    public LayoutOptions withExpandedNotes(Set<Integer> noteLines){
        return new LayoutOptions(collapsedSections,noteLines == null ? null : copy(noteLines),containerWidth);
    }

    public LayoutOptions withContainerWidth(double containerWidth){
        return new LayoutOptions(collapsedSections,expandedNoteLines,Math.max(0,containerWidth));
    }

    public Set<Integer> getCollapsedSections(){return collapsedSections;}
    public boolean isSectionCollapsed(int sectionLine){return collapsedSections.contains(sectionLine);}
    public Set<Integer> getExpandedNoteLines(){return expandedNoteLines;}
    public boolean isNoteCollapsed(int noteLine){
        return expandedNoteLines != null && !expandedNoteLines.contains(noteLine);
    }
    public double getContainerWidth(){return containerWidth;}

    private static Set<Integer> copy(Set<Integer> values){
        return values == null || values.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(new HashSet<>(values));
    }

    @Override
    public String toString(){
        return "LayoutOptions{collapsed="+collapsedSections+" expandedNotes="+expandedNoteLines+" width="+containerWidth+"}";
    }
}
