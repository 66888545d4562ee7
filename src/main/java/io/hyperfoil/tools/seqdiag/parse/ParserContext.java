package io.hyperfoil.tools.seqdiag.parse;

import io.hyperfoil.tools.seqdiag.model.*;

import java.util.*;

/**
 * Mutable state for parsing one document. Created per call to {@link SequenceParser#parse(String)} and never shared.
 */
public class ParserContext {

    /**
     * An open block and the indent of the line that opened it.
     */
    public static class BlockScope {
        private final Block block;
        private final int indent;
        private boolean inElse;
        private ElseIfBranch activeElseIf;

        BlockScope(Block block, int indent){
            this.block = block;
            this.indent = indent;
        }

        public Block getBlock(){return block;}
        public int getIndent(){return indent;}
        public boolean isInElse(){return inElse;}
        public ElseIfBranch getActiveElseIf(){return activeElseIf;}

        void startElseIf(ElseIfBranch branch){
            this.activeElseIf = branch;
            this.inElse = false;
        }
        void startElse(){
            this.activeElseIf = null;
            this.inElse = true;
        }

        List<SequenceElement> container(){
            if(activeElseIf != null){
                return activeElseIf.getChildren();
            }
            return inElse ? block.getElseChildren() : block.getChildren();
        }
    }

    private final List<SourceLine> lines;
    private int index = 0;

    private String title;
    private final List<Participant> participants = new ArrayList<>();
    private final Map<String,Participant> participantsById = new HashMap<>();
    private final List<Message> messages = new ArrayList<>();
    private final List<SequenceElement> elements = new ArrayList<>();
    private final List<Group> groups = new ArrayList<>();
    private final List<Section> sections = new ArrayList<>();
    private final Map<String,String> options = new LinkedHashMap<>();

    private final Deque<BlockScope> blockStack = new ArrayDeque<>();
    private Group activeGroup;
    private final Map<String,String> participantGroup = new HashMap<>();

    private boolean explicitChart = false;
    private boolean contentStarted = false;
    private boolean bodyStarted = false;
    private String lastMessageFrom;

    public ParserContext(String content){
        String[] split = content.split("\n",-1);
        lines = new ArrayList<>(split.length);
        for(int i=0; i<split.length; i++){
            lines.add(new SourceLine(split[i],i+1));
        }
    }

    public List<SourceLine> getLines(){return lines;}

    public boolean hasNext(){return index < lines.size();}

    public SourceLine next(){
        return lines.get(index++);
    }

    /**
     * @return the line after the current one without consuming it, or null at end of input
     */
    public SourceLine peek(){
        return index < lines.size() ? lines.get(index) : null;
    }

    //header state

    public void setTitle(String title){this.title = title;}
    public void setOption(String key, String value){options.put(key,value);}
    public void markExplicitChart(){explicitChart = true;}
    public boolean isExplicitChart(){return explicitChart;}
    public void markContentStarted(){contentStarted = true;}
    public boolean isContentStarted(){return contentStarted;}

    /**
     * messages, blocks, sections and notes start the body, group headings are not allowed after that
     */
    public void markBodyStarted(){
        contentStarted = true;
        bodyStarted = true;
    }
    public boolean isBodyStarted(){return bodyStarted;}

    //participants

    public boolean hasParticipant(String id){
        return participantsById.containsKey(id);
    }

    public Participant getParticipant(String id){
        return participantsById.get(id);
    }

    /**
     * Registers the participant unless the id is already known. The first declaration wins.
     */
    public Participant registerParticipant(String id, String label, ParticipantType type, int lineNumber, Integer position){
        Participant existing = participantsById.get(id);
        if(existing != null){
            return existing;
        }
        Participant participant = new Participant(id,label,type,lineNumber,position);
        participants.add(participant);
        participantsById.put(id,participant);
        return participant;
    }

    public Participant registerInferred(String id, int lineNumber){
        return registerParticipant(id,id,ParticipantInference.infer(id),lineNumber,null);
    }

    public List<Participant> getParticipants(){return participants;}

    //groups

    public void startGroup(Group group){
        groups.add(group);
        activeGroup = group;
    }
    public Group getActiveGroup(){return activeGroup;}
    public boolean hasActiveGroup(){return activeGroup != null;}
    public void clearActiveGroup(){activeGroup = null;}

    /**
     * Adds the participant to the active group, if there is one.
     * @throws SequenceParseException if the participant already belongs to another group
     */
    public void joinActiveGroup(String id, int lineNumber){
        if(activeGroup == null || activeGroup.contains(id)){
            return;
        }
        String existing = participantGroup.get(id);
        if(existing != null){
            throw SequenceParseException.structural(lineNumber,
                    "Participant '"+id+"' is already in group '"+existing+"' - participants can only belong to one group");
        }
        activeGroup.addParticipant(id);
        participantGroup.put(id,activeGroup.getName());
    }

    //messages and elements

    public Message addMessage(String from, String to, ReturnLabel label, int lineNumber, boolean async){
        Message message = new Message(from,to,label.getLabel(),label.getReturnLabel(),lineNumber,async,messages.size());
        messages.add(message);
        currentContainer().add(message);
        lastMessageFrom = from;
        return message;
    }
    public List<Message> getMessages(){return messages;}
    public String getLastMessageFrom(){return lastMessageFrom;}

    public void addSection(Section section){
        sections.add(section);
        currentContainer().add(section);
    }

    public void addNote(Note note){
        currentContainer().add(note);
    }

    //block stack

    public List<SequenceElement> currentContainer(){
        BlockScope top = blockStack.peek();
        return top == null ? elements : top.container();
    }

    public void openBlock(Block block, int indent){
        currentContainer().add(block);
        blockStack.push(new BlockScope(block,indent));
    }

    public BlockScope topBlock(){
        return blockStack.peek();
    }

    public int blockDepth(){return blockStack.size();}

    /**
     * Pops every block opened at an indent greater than or equal to <code>indent</code>.
     * @param keepBranchAtIndent keep a branching block open when it was opened at exactly this indent
     */
    public void closeBlocks(int indent, boolean keepBranchAtIndent){
        while(!blockStack.isEmpty()){
            BlockScope top = blockStack.peek();
            if(indent > top.getIndent()){
                break;
            }
            if(keepBranchAtIndent && indent == top.getIndent() &&
                    (top.getBlock().getType() == BlockType.IF || top.getBlock().getType() == BlockType.PARALLEL)){
                break;
            }
            blockStack.pop();
        }
    }

    public void startElseIf(BlockScope scope, String label, int lineNumber){
        scope.startElseIf(scope.getBlock().addElseIf(label,lineNumber));
    }

    public void startElse(BlockScope scope, int lineNumber){
        scope.getBlock().setElseLineNumber(lineNumber);
        scope.startElse();
    }

    public Document toDocument(ParseError error){
        return new Document(title,participants,messages,elements,groups,sections,options,error);
    }
}
