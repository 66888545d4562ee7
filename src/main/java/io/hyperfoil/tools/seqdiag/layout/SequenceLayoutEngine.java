package io.hyperfoil.tools.seqdiag.layout;

import io.hyperfoil.tools.seqdiag.config.LayoutConfig;
import io.hyperfoil.tools.seqdiag.model.*;
import io.hyperfoil.tools.seqdiag.render.*;
import io.hyperfoil.tools.seqdiag.render.SectionGrouping.SectionMessageGroup;
import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Computes the geometry of a parsed {@link Document}.
 * <p>
 * The vertical layout is a single pass over the visible render steps. Steps of collapsed sections and returns
 * without a label are not visible. Sections, block headers and notes push the following steps down.
 * Horizontal positions come from the participant order and the activations open at each step.
 * <p>
 * The engine holds no per call state and can be shared between threads. The document is never modified.
 */
public class SequenceLayoutEngine {

    private static final XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    public static final String ACTIVATIONS_OPTION = "activations";
    public static final String COLLAPSE_NOTES_OPTION = "collapse-notes";
    public static final String COLLAPSED_NOTE_TEXT = "…";

    private enum Side {LEFT, RIGHT}

    /**
     * A note sized before the vertical pass, positioned once participant x is known.
     */
    private static class PendingNote {
        final Note note;
        final boolean collapsed;
        final List<String> lines;
        final double width;
        final double height;
        final double fold;
        double top;

        PendingNote(Note note, boolean collapsed, List<String> lines, double width, double height, double fold){
            this.note = note;
            this.collapsed = collapsed;
            this.lines = lines;
            this.width = width;
            this.height = height;
            this.fold = fold;
        }
    }

    private final LayoutConfig config;

    public SequenceLayoutEngine(){
        this(LayoutConfig.defaults());
    }

    public SequenceLayoutEngine(LayoutConfig config){
        this.config = Objects.requireNonNull(config,"config");
    }

    public LayoutConfig getConfig(){return config;}

    public SequenceLayout layout(Document document){
        return layout(document,LayoutOptions.defaults());
    }

    /**
     * @throws IllegalArgumentException if the document failed to parse
     */
    public SequenceLayout layout(Document document, LayoutOptions options){
        if(document.hasError()){
            throw new IllegalArgumentException("cannot lay out a document with a parse error: "+document.getError());
        }
        List<Participant> participants = ParticipantOrdering.order(document.getParticipants(),document.getGroups());
        List<Message> messages = document.getMessages();
        List<SequenceElement> elements = document.getElements();
        boolean activationsOff = "off".equalsIgnoreCase(trim(document.getOption(ACTIVATIONS_OPTION)));
        boolean notesAlwaysExpanded = "no".equalsIgnoreCase(trim(document.getOption(COLLAPSE_NOTES_OPTION)));

        //hidden messages
        List<SectionMessageGroup> sectionGroups = SectionGrouping.group(elements);
        Set<Integer> hidden = new HashSet<>();
        for(SectionMessageGroup group : sectionGroups){
            if(options.isSectionCollapsed(group.getSection().getLineNumber())){
                hidden.addAll(group.getMessageIndices());
            }
        }

        //the full sequence keeps the call stack correct, filtering happens after
        List<RenderStep> allSteps = RenderSequenceBuilder.build(messages);
        List<RenderStep> steps = new ArrayList<>();
        Map<Integer,Integer> originalToVisible = new HashMap<>();
        Map<Integer,Integer> allFirstStep = new HashMap<>();
        for(int i=0; i<allSteps.size(); i++){
            RenderStep step = allSteps.get(i);
            allFirstStep.putIfAbsent(step.getMessageIndex(),i);
            if(!hidden.contains(step.getMessageIndex()) && (step.isCall() || step.hasLabel())){
                originalToVisible.put(i,steps.size());
                steps.add(step);
            }
        }
        List<Activation> activations = activationsOff ? Collections.emptyList() : ActivationComputer.compute(steps);

        Map<Integer,Integer> firstStep = new HashMap<>();
        Map<Integer,Integer> lastStep = new HashMap<>();
        for(int i=0; i<steps.size(); i++){
            firstStep.putIfAbsent(steps.get(i).getMessageIndex(),i);
            lastStep.put(steps.get(i).getMessageIndex(),i);
        }

        //block header and trailing space
        Map<Integer,Double> extraBefore = new HashMap<>();
        markBlockSpacing(elements,hidden,extraBefore);

        //sections are anchored against the unfiltered steps so collapsing one does not move the others
        Map<Integer,List<Section>> sectionsBefore = new HashMap<>();
        List<Section> trailingSections = new ArrayList<>();
        for(SectionMessageGroup group : sectionGroups){
            Integer insertAt = null;
            if(!group.isEmpty()){
                Integer original = allFirstStep.get(group.getMessageIndices().get(0));
                for(int i = original == null ? allSteps.size() : original; i<allSteps.size() && insertAt == null; i++){
                    insertAt = originalToVisible.get(i);
                }
            }
            if(insertAt == null){
                trailingSections.add(group.getSection());
            }else{
                sectionsBefore.computeIfAbsent(insertAt,k->new ArrayList<>()).add(group.getSection());
            }
        }

        //notes
        List<PendingNote> leadingNotes = new ArrayList<>();
        Map<Integer,List<PendingNote>> notesAtStep = new HashMap<>();
        placeNotesOnSteps(elements,messages,steps,hidden,options,notesAlwaysExpanded,leadingNotes,notesAtStep);

        //vertical pass
        double titleOffset = document.hasTitle() ? config.getTitleHeight() : 0;
        double groupOffset = document.getGroups().isEmpty() ? 0 : config.getGroupPaddingTop() + config.getGroupLabelSize();
        double participantStartY = config.getTopMargin() + titleOffset + config.getParticipantYOffset() + groupOffset;
        double lifelineStartY = participantStartY + config.getBoxHeight();
        boolean hasActors = participants.stream().anyMatch(p->ParticipantType.ACTOR.equals(p.getType()));
        double messageStartOffset = config.getMessageStartOffset() + (hasActors ? config.getActorExtraOffset() : 0);

        double[] stepY = new double[steps.size()];
        Map<Integer,Double> sectionY = new HashMap<>();
        double cursor = lifelineStartY + messageStartOffset;
        if(!leadingNotes.isEmpty()){
            cursor = stackNotes(leadingNotes,cursor,cursor);
        }
        for(int i=0; i<steps.size(); i++){
            List<Section> before = sectionsBefore.get(i);
            if(before != null){
                for(Section section : before){
                    cursor += config.getSectionTopPad();
                    sectionY.put(section.getLineNumber(),cursor);
                    cursor += config.getSectionBottomPad();
                }
            }
            RenderStep step = steps.get(i);
            if(firstStep.get(step.getMessageIndex()) == i){
                cursor += extraBefore.getOrDefault(step.getMessageIndex(),0.0);
            }
            stepY[i] = cursor;
            cursor += config.getStepSpacing();
            List<PendingNote> notes = notesAtStep.get(i);
            if(notes != null){
                cursor = stackNotes(notes,stepY[i] + config.getNoteOffsetY(),cursor);
            }
        }
        for(Section section : trailingSections){
            cursor += config.getSectionTopPad();
            sectionY.put(section.getLineNumber(),cursor);
            cursor += config.getSectionBottomPad();
        }
        double layoutEndY = cursor;
        double contentBottomY = steps.isEmpty() ? layoutEndY : Math.max(stepY[steps.size()-1] + config.getStepSpacing(),layoutEndY);
        double lifelineLength = contentBottomY - lifelineStartY + config.getLifelineTail();
        double totalHeight = participantStartY + config.getBoxHeight() + Math.max(lifelineLength,config.getMinLifeline()) + config.getBottomMargin();

        //horizontal pass
        double gap = config.getParticipantGap();
        double totalWidth = Math.max(participants.size() * gap, config.getBoxWidth() + 40);
        double width = Math.max(totalWidth,options.getContainerWidth());
        double diagramWidth = participants.size() * gap;
        double offsetX = Math.max(0,(width - diagramWidth) / 2) + gap / 2;
        Map<String,Double> participantX = new LinkedHashMap<>();
        List<ParticipantBox> participantBoxes = new ArrayList<>();
        for(int i=0; i<participants.size(); i++){
            Participant participant = participants.get(i);
            double x = offsetX + i * gap;
            participantX.put(participant.getId(),x);
            participantBoxes.add(new ParticipantBox(participant,i,x,participantStartY,config.getBoxWidth(),config.getBoxHeight(),
                    lifelineStartY,lifelineStartY + lifelineLength));
        }

        List<GroupBox> groupBoxes = layoutGroups(document.getGroups(),participantX,participantStartY);
        List<BlockFrame> frames = new ArrayList<>();
        layoutFrames(elements,0,messages,firstStep,lastStep,stepY,participantX,frames);

        List<ActivationBox> activationBoxes = new ArrayList<>();
        for(Activation activation : activations){
            Double px = participantX.get(activation.getParticipantId());
            if(px == null){
                continue;
            }
            double x = px - config.getActivationWidth() / 2 + activation.getDepth() * config.getActivationNestOffset();
            activationBoxes.add(new ActivationBox(activation,x,stepY[activation.getStartStep()],stepY[activation.getEndStep()],config.getActivationWidth()));
        }

        List<SectionBand> sectionBands = layoutSections(sectionGroups,sectionY,participantX,options,width);

        List<StepGeometry> stepGeometry = new ArrayList<>();
        for(int i=0; i<steps.size(); i++){
            RenderStep step = steps.get(i);
            Double fromX = participantX.get(step.getFrom());
            Double toX = participantX.get(step.getTo());
            if(fromX == null || toX == null){
                continue;
            }
            int lineNumber = messages.get(step.getMessageIndex()).getLineNumber();
            if(step.isSelf()){
                double x = arrowEdgeX(step.getFrom(),fromX,i,Side.RIGHT,activations);
                stepGeometry.add(new StepGeometry(step,lineNumber,stepY[i],x,x + config.getSelfCallWidth(),true));
            }else{
                boolean goingRight = fromX < toX;
                double x1 = arrowEdgeX(step.getFrom(),fromX,i,goingRight ? Side.RIGHT : Side.LEFT,activations);
                double x2 = arrowEdgeX(step.getTo(),toX,i,goingRight ? Side.LEFT : Side.RIGHT,activations);
                stepGeometry.add(new StepGeometry(step,lineNumber,stepY[i],x1,x2,false));
            }
        }

        List<NoteBox> noteBoxes = new ArrayList<>();
        List<PendingNote> pending = new ArrayList<>(leadingNotes);
        notesAtStep.keySet().stream().sorted().forEach(i->pending.addAll(notesAtStep.get(i)));
        for(PendingNote note : pending){
            Double px = participantX.get(note.note.getParticipantId());
            if(px == null){
                continue;
            }
            double x = NotePosition.LEFT.equals(note.note.getPosition()) ?
                    px - config.getNoteOffsetX() - note.width :
                    px + config.getNoteOffsetX();
            List<List<InlineMarkdown.Span>> spans = note.lines.stream().map(InlineMarkdown::parse).collect(Collectors.toList());
            noteBoxes.add(new NoteBox(note.note,x,note.top,note.width,note.height,note.fold,note.collapsed,note.lines,spans));
            width = Math.max(width,x + note.width);
        }

        SequenceLayout rtrn = new SequenceLayout(width,totalHeight,document.getTitle(),config.getTopMargin() + config.getTitleHeight() * 0.7,
                participantBoxes,stepGeometry,activationBoxes,frames,sectionBands,noteBoxes,groupBoxes);
        logger.debug("layout {} steps={} hidden={} activations={} frames={} notes={}",
                rtrn,steps.size(),hidden.size(),activationBoxes.size(),frames.size(),noteBoxes.size());
        return rtrn;
    }

    private static String trim(String value){
        return value == null ? null : value.trim();
    }

    /**
     * First visible message in document order, searching every branch of nested blocks.
     */
    private static int firstVisibleMessage(List<SequenceElement> elements, Set<Integer> hidden){
        for(SequenceElement element : elements){
            if(element.isBlock()){
                for(List<SequenceElement> branch : ((Block)element).getBranches()){
                    int index = firstVisibleMessage(branch,hidden);
                    if(index >= 0){
                        return index;
                    }
                }
            }else if(element.isMessage()){
                int index = ((Message)element).getIndex();
                if(!hidden.contains(index)){
                    return index;
                }
            }
        }
        return -1;
    }

    private void markBlockSpacing(List<SequenceElement> elements, Set<Integer> hidden, Map<Integer,Double> extraBefore){
        for(int i=0; i<elements.size(); i++){
            if(!elements.get(i).isBlock()){
                continue;
            }
            Block block = (Block) elements.get(i);
            for(List<SequenceElement> branch : block.getBranches()){
                int first = firstVisibleMessage(branch,hidden);
                if(first >= 0){
                    extraBefore.merge(first,config.getBlockHeaderSpace(),Double::sum);
                }
                markBlockSpacing(branch,hidden,extraBefore);
            }
            if(i+1 < elements.size()){
                int next = firstVisibleMessage(elements.subList(i+1,i+2),hidden);
                if(next >= 0){
                    extraBefore.merge(next,config.getBlockAfterSpace(),Double::sum);
                }
            }
        }
    }

    private static void collectNotes(List<SequenceElement> elements, List<Note> notes){
        for(SequenceElement element : elements){
            if(element.isNote()){
                notes.add((Note)element);
            }else if(element.isBlock()){
                ((Block)element).getBranches().forEach(branch->collectNotes(branch,notes));
            }
        }
    }

    /**
     * @return lines of notes that sit in a collapsed top level section
     */
    private static Set<Integer> notesInCollapsedSections(List<SequenceElement> elements, LayoutOptions options){
        Set<Integer> rtrn = new HashSet<>();
        boolean collapsed = false;
        for(SequenceElement element : elements){
            if(element.isSection()){
                collapsed = options.isSectionCollapsed(element.getLineNumber());
            }else if(collapsed){
                List<Note> notes = new ArrayList<>();
                collectNotes(List.of(element),notes);
                notes.forEach(note->rtrn.add(note.getLineNumber()));
            }
        }
        return rtrn;
    }

    /**
     * Sizes every note and assigns it to the step it follows. A note follows the last visible step of the message
     * before it that comes before the next message's call. A labelled return deferred past later messages is
     * ignored so the note stays next to the call it describes.
     */
    private void placeNotesOnSteps(List<SequenceElement> elements, List<Message> messages, List<RenderStep> steps, Set<Integer> hidden,
                                   LayoutOptions options, boolean notesAlwaysExpanded,
                                   List<PendingNote> leadingNotes, Map<Integer,List<PendingNote>> notesAtStep){
        List<Note> notes = new ArrayList<>();
        collectNotes(elements,notes);
        if(notes.isEmpty()){
            return;
        }
        Map<Integer,Integer> anchors = NoteAnchors.build(elements);
        Map<Integer,Integer> messageByLine = new HashMap<>();
        messages.forEach(message->messageByLine.put(message.getLineNumber(),message.getIndex()));
        Set<Integer> collapsedSectionNotes = notesInCollapsedSections(elements,options);

        for(Note note : notes){
            if(collapsedSectionNotes.contains(note.getLineNumber())){
                continue;
            }
            boolean collapsed = !notesAlwaysExpanded && options.isNoteCollapsed(note.getLineNumber());
            PendingNote pending = size(note,collapsed);
            Integer anchorLine = anchors.get(note.getLineNumber());
            if(anchorLine == null){
                leadingNotes.add(pending);
                continue;
            }
            int messageIndex = messageByLine.get(anchorLine);
            if(hidden.contains(messageIndex)){
                logger.debug("note on line {} follows hidden message on line {}",note.getLineNumber(),anchorLine);
                continue;
            }
            int boundary = steps.size();
            for(int i=0; i<steps.size(); i++){
                if(steps.get(i).isCall() && steps.get(i).getMessageIndex() > messageIndex){
                    boundary = i;
                    break;
                }
            }
            int anchorStep = -1;
            for(int i=0; i<boundary; i++){
                if(steps.get(i).getMessageIndex() == messageIndex){
                    anchorStep = i;
                }
            }
            if(anchorStep < 0){
                logger.debug("note on line {} has no visible step to follow",note.getLineNumber());
                continue;
            }
            notesAtStep.computeIfAbsent(anchorStep,k->new ArrayList<>()).add(pending);
        }
    }

    private PendingNote size(Note note, boolean collapsed){
        if(collapsed){
            return new PendingNote(note,true,List.of(COLLAPSED_NOTE_TEXT),config.getCollapsedNoteWidth(),config.getCollapsedNoteHeight(),0);
        }
        List<String> lines = NoteText.wrap(note.getText(),config.getNoteMaxChars());
        double padding = config.getNotePadding();
        double width = Math.min(config.getNoteMaxWidth(),NoteText.longest(lines) * config.getNoteCharWidth() + 2 * padding);
        double height = lines.size() * config.getNoteLineHeight() + 2 * padding;
        return new PendingNote(note,false,lines,width,height,config.getNoteFold());
    }

    /**
     * Stacks the notes per side starting at <code>top</code>.
     * @return the cursor moved below the lowest note
     */
    private double stackNotes(List<PendingNote> notes, double top, double cursor){
        Map<NotePosition,Double> nextTop = new EnumMap<>(NotePosition.class);
        double bottom = top;
        for(PendingNote note : notes){
            double y = nextTop.getOrDefault(note.note.getPosition(),top);
            note.top = y;
            nextTop.put(note.note.getPosition(),y + note.height + config.getNoteGap());
            bottom = Math.max(bottom,y + note.height);
        }
        return Math.max(cursor,bottom + config.getNoteGap());
    }

    private List<GroupBox> layoutGroups(List<Group> groups, Map<String,Double> participantX, double participantStartY){
        List<GroupBox> rtrn = new ArrayList<>();
        for(Group group : groups){
            DoubleSummaryStatistics xs = group.getParticipantIds().stream()
                    .map(participantX::get)
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .summaryStatistics();
            if(xs.getCount() == 0){
                continue;
            }
            double minX = xs.getMin() - config.getBoxWidth() / 2 - config.getGroupPaddingX();
            double maxX = xs.getMax() + config.getBoxWidth() / 2 + config.getGroupPaddingX();
            double y = participantStartY - config.getGroupPaddingTop();
            double height = config.getBoxHeight() + config.getGroupPaddingTop() + config.getGroupPaddingBottom();
            rtrn.add(new GroupBox(group,minX,y,maxX - minX,height,minX + 8,y + config.getGroupLabelSize() + 4));
        }
        return rtrn;
    }

    private void layoutFrames(List<SequenceElement> elements, int depth, List<Message> messages,
                              Map<Integer,Integer> firstStep, Map<Integer,Integer> lastStep, double[] stepY,
                              Map<String,Double> participantX, List<BlockFrame> frames){
        for(SequenceElement element : elements){
            if(!element.isBlock()){
                continue;
            }
            Block block = (Block) element;
            List<Integer> indices = new ArrayList<>();
            SectionGrouping.collectMessageIndices(block,indices);
            int minStep = Integer.MAX_VALUE;
            int maxStep = Integer.MIN_VALUE;
            double minX = Double.MAX_VALUE;
            double maxX = -Double.MAX_VALUE;
            for(int index : indices){
                Integer first = firstStep.get(index);
                Integer last = lastStep.get(index);
                if(first != null){
                    minStep = Math.min(minStep,first);
                }
                if(last != null){
                    maxStep = Math.max(maxStep,last);
                }
                Message message = messages.get(index);
                for(String id : List.of(message.getFrom(),message.getTo())){
                    Double x = participantX.get(id);
                    if(x != null){
                        minX = Math.min(minX,x);
                        maxX = Math.max(maxX,x);
                    }
                }
            }
            if(minStep == Integer.MAX_VALUE || minX == Double.MAX_VALUE){
                logger.debug("block on line {} has no visible steps",block.getLineNumber());
                continue;
            }
            double x = minX - config.getFramePaddingX();
            double y = stepY[minStep] - config.getFramePaddingTop();
            double width = maxX - minX + config.getFramePaddingX() * 2;
            double height = stepY[maxStep] - stepY[minStep] + config.getFramePaddingTop() + config.getFramePaddingBottom();

            List<FrameDivider> dividers = new ArrayList<>();
            for(ElseIfBranch branch : block.getElseIfBranches()){
                divider(branch.getChildren(),"else if "+branch.getLabel(),branch.getLineNumber(),firstStep,stepY)
                        .ifPresent(dividers::add);
            }
            if(block.hasElse()){
                divider(block.getElseChildren(),"else",block.getElseLineNumber(),firstStep,stepY).ifPresent(dividers::add);
            }
            String label = (block.getType().getKeyword()+" "+block.getLabel()).trim();
            frames.add(new BlockFrame(block,depth,x,y,width,height,label,dividers));
            for(List<SequenceElement> branch : block.getBranches()){
                layoutFrames(branch,depth+1,messages,firstStep,lastStep,stepY,participantX,frames);
            }
        }
    }

    private Optional<FrameDivider> divider(List<SequenceElement> branch, String label, int lineNumber,
                                           Map<Integer,Integer> firstStep, double[] stepY){
        int first = SectionGrouping.collectMessageIndices(branch).stream()
                .map(firstStep::get)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .min()
                .orElse(-1);
        if(first < 0){
            return Optional.empty();
        }
        double y = first > 0 ? (stepY[first-1] + stepY[first]) / 2 : stepY[first] - config.getStepSpacing() / 2;
        return Optional.of(new FrameDivider(y,label,lineNumber));
    }

    private List<SectionBand> layoutSections(List<SectionMessageGroup> sectionGroups, Map<Integer,Double> sectionY,
                                             Map<String,Double> participantX, LayoutOptions options, double width){
        double x;
        double bandWidth;
        if(participantX.isEmpty()){
            x = 0;
            bandWidth = width;
        }else{
            double lineX1 = Collections.min(participantX.values()) - config.getBoxWidth() / 2 - 10;
            double lineX2 = Collections.max(participantX.values()) + config.getBoxWidth() / 2 + 10;
            x = lineX1 - 10;
            bandWidth = lineX2 - lineX1 + 20;
        }
        List<SectionBand> rtrn = new ArrayList<>();
        for(SectionMessageGroup group : sectionGroups){
            Section section = group.getSection();
            Double y = sectionY.get(section.getLineNumber());
            if(y == null){
                continue;
            }
            rtrn.add(new SectionBand(section,y,x,bandWidth,config.getSectionBandHeight(),
                    options.isSectionCollapsed(section.getLineNumber()),group.getMessageCount()));
        }
        return rtrn;
    }

    /**
     * @return deepest activation depth of the participant at the step, -1 when none is open
     */
    static int activeDepthAt(String participantId, int step, List<Activation> activations){
        int rtrn = -1;
        for(Activation activation : activations){
            if(activation.getParticipantId().equals(participantId) && activation.covers(step) && activation.getDepth() > rtrn){
                rtrn = activation.getDepth();
            }
        }
        return rtrn;
    }

    private double arrowEdgeX(String participantId, double px, int step, Side side, List<Activation> activations){
        int depth = activeDepthAt(participantId,step,activations);
        if(depth < 0){
            return px;
        }
        double offset = depth * config.getActivationNestOffset();
        return Side.RIGHT.equals(side) ?
                px + config.getActivationWidth() / 2 + offset :
                px - config.getActivationWidth() / 2 + offset;
    }
}
