package io.hyperfoil.tools.seqdiag.render;

import io.hyperfoil.tools.seqdiag.model.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class NoteAnchors {

    private NoteAnchors(){}

    /**
     * Maps the line of each note to the line of the message that precedes it in document order.
     * Notes before the first message are left out.
     */
    public static Map<Integer,Integer> build(List<SequenceElement> elements){
        Map<Integer,Integer> rtrn = new LinkedHashMap<>();
        walk(elements,new int[]{-1},rtrn);
        return rtrn;
    }

    private static void walk(List<SequenceElement> elements, int[] lastMessageLine, Map<Integer,Integer> anchors){
        for(SequenceElement element : elements){
            switch (element.getKind()){
                case MESSAGE:
                    lastMessageLine[0] = element.getLineNumber();
                    break;
                case NOTE:
                    if(lastMessageLine[0] >= 0){
                        anchors.put(element.getLineNumber(),lastMessageLine[0]);
                    }
                    break;
                case BLOCK:
                    for(List<SequenceElement> branch : ((Block)element).getBranches()){
                        walk(branch,lastMessageLine,anchors);
                    }
                    break;
                default:
                    break;
            }
        }
    }
}
