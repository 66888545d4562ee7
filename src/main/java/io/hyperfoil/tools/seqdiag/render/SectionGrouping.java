package io.hyperfoil.tools.seqdiag.render;

import io.hyperfoil.tools.seqdiag.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assigns messages to the top level section that precedes them.
 * Sections nested inside blocks do not start a group and messages before the first section belong to no group.
 */
public class SectionGrouping {

    public static class SectionMessageGroup {
        private final Section section;
        private final List<Integer> messageIndices;

        SectionMessageGroup(Section section){
            this.section = section;
            this.messageIndices = new ArrayList<>();
        }

        public Section getSection(){return section;}
        public List<Integer> getMessageIndices(){return Collections.unmodifiableList(messageIndices);}
        public int getMessageCount(){return messageIndices.size();}
        public boolean isEmpty(){return messageIndices.isEmpty();}
    }

    private SectionGrouping(){}

    public static List<SectionMessageGroup> group(List<SequenceElement> elements){
        List<SectionMessageGroup> rtrn = new ArrayList<>();
        SectionMessageGroup current = null;
        for(SequenceElement element : elements){
            if(element.isSection()){
                current = new SectionMessageGroup((Section)element);
                rtrn.add(current);
            }else if(current != null){
                collectMessageIndices(element,current.messageIndices);
            }
        }
        return rtrn;
    }

    /**
     * @return indices of the messages before the first top level section
     */
    public static List<Integer> ungrouped(List<SequenceElement> elements){
        List<Integer> rtrn = new ArrayList<>();
        for(SequenceElement element : elements){
            if(element.isSection()){
                break;
            }
            collectMessageIndices(element,rtrn);
        }
        return rtrn;
    }

    /**
     * Adds the index of every message in the element subtree, in document order.
     */
    public static void collectMessageIndices(SequenceElement element, List<Integer> indices){
        if(element.isMessage()){
            indices.add(((Message)element).getIndex());
        }else if(element.isBlock()){
            for(List<SequenceElement> branch : ((Block)element).getBranches()){
                for(SequenceElement child : branch){
                    collectMessageIndices(child,indices);
                }
            }
        }
    }

    public static List<Integer> collectMessageIndices(List<SequenceElement> elements){
        List<Integer> rtrn = new ArrayList<>();
        elements.forEach(element->collectMessageIndices(element,rtrn));
        return rtrn;
    }
}
