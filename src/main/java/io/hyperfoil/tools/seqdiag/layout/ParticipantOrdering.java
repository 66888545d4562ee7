package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.model.Group;
import io.hyperfoil.tools.seqdiag.model.Participant;

import java.util.*;

/**
 * Left to right order of participants. Group members are made adjacent first, then explicit positions are applied.
 */
public class ParticipantOrdering {

    private ParticipantOrdering(){}

    public static List<Participant> order(List<Participant> participants, List<Group> groups){
        return applyPositionOverrides(applyGroupOrdering(participants,groups));
    }

    /**
     * Members of each group in group declaration order, then every ungrouped participant in its original order.
     */
    public static List<Participant> applyGroupOrdering(List<Participant> participants, List<Group> groups){
        if(groups.isEmpty()){
            return participants;
        }
        Map<String,Participant> byId = new LinkedHashMap<>();
        participants.forEach(p->byId.put(p.getId(),p));
        List<Participant> rtrn = new ArrayList<>(participants.size());
        Set<String> placed = new HashSet<>();
        for(Group group : groups){
            for(String id : group.getParticipantIds()){
                Participant participant = byId.get(id);
                if(participant != null && placed.add(id)){
                    rtrn.add(participant);
                }
            }
        }
        for(Participant participant : participants){
            if(placed.add(participant.getId())){
                rtrn.add(participant);
            }
        }
        return rtrn;
    }

    /**
     * Moves participants with a position to that slot. Negative positions count from the end and out of range
     * positions are clamped. A taken slot moves the participant to the nearest free slot, checking +1 before -1.
     */
    public static List<Participant> applyPositionOverrides(List<Participant> participants){
        if(participants.stream().noneMatch(Participant::hasPosition)){
            return participants;
        }
        int total = participants.size();
        List<int[]> positioned = new ArrayList<>();
        List<Participant> unpositioned = new ArrayList<>();
        for(int i=0; i<total; i++){
            Participant participant = participants.get(i);
            if(participant.hasPosition()){
                int position = participant.getPosition();
                int slot = position < 0 ? total + position : position;
                slot = Math.max(0,Math.min(total-1,slot));
                positioned.add(new int[]{i,slot});
            }else{
                unpositioned.add(participant);
            }
        }
        //stable so equal targets keep declaration order
        positioned.sort(Comparator.comparingInt(entry->entry[1]));

        Participant[] slots = new Participant[total];
        for(int[] entry : positioned){
            int slot = entry[1];
            if(slots[slot] != null){
                for(int offset=1; offset<total; offset++){
                    if(slot+offset < total && slots[slot+offset] == null){
                        slot = slot+offset;
                        break;
                    }
                    if(slot-offset >= 0 && slots[slot-offset] == null){
                        slot = slot-offset;
                        break;
                    }
                }
            }
            slots[slot] = participants.get(entry[0]);
        }
        Iterator<Participant> remaining = unpositioned.iterator();
        for(int i=0; i<total; i++){
            if(slots[i] == null){
                slots[i] = remaining.next();
            }
        }
        return Arrays.asList(slots);
    }
}
