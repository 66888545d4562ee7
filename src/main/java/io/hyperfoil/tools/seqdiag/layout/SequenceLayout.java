package io.hyperfoil.tools.seqdiag.layout;

import java.util.List;
import java.util.Optional;

/**
 * Everything an external renderer needs to draw the diagram. Coordinates are absolute, the origin is top left.
 */
public class SequenceLayout {

    private final double width;
    private final double height;
    private final String title;
    private final double titleY;
    private final List<ParticipantBox> participants;
    private final List<StepGeometry> steps;
    private final List<ActivationBox> activations;
    private final List<BlockFrame> frames;
    private final List<SectionBand> sections;
    private final List<NoteBox> notes;
    private final List<GroupBox> groups;

    public SequenceLayout(double width, double height, String title, double titleY,
                          List<ParticipantBox> participants, List<StepGeometry> steps, List<ActivationBox> activations,
                          List<BlockFrame> frames, List<SectionBand> sections, List<NoteBox> notes, List<GroupBox> groups){
        this.width = width;
        this.height = height;
        this.title = title;
        this.titleY = titleY;
        this.participants = List.copyOf(participants);
        this.steps = List.copyOf(steps);
        this.activations = List.copyOf(activations);
        this.frames = List.copyOf(frames);
        this.sections = List.copyOf(sections);
        this.notes = List.copyOf(notes);
        this.groups = List.copyOf(groups);
    }

    public double getWidth(){return width;}
    public double getHeight(){return height;}
    public String getTitle(){return title;}
    public boolean hasTitle(){return title != null && !title.isEmpty();}
    public double getTitleY(){return titleY;}
    public List<ParticipantBox> getParticipants(){return participants;}
    public List<StepGeometry> getSteps(){return steps;}
    public List<ActivationBox> getActivations(){return activations;}
    public List<BlockFrame> getFrames(){return frames;}
    public List<SectionBand> getSections(){return sections;}
    public List<NoteBox> getNotes(){return notes;}
    public List<GroupBox> getGroups(){return groups;}

    public Optional<ParticipantBox> getParticipant(String id){
        return participants.stream().filter(p->p.getId().equals(id)).findFirst();
    }

    public Optional<SectionBand> getSection(int lineNumber){
        return sections.stream().filter(s->s.getLineNumber() == lineNumber).findFirst();
    }

    public Optional<NoteBox> getNote(int lineNumber){
        return notes.stream().filter(n->n.getLineNumber() == lineNumber).findFirst();
    }

    @Override
    public String toString(){
        return "SequenceLayout{"+width+"x"+height+" participants="+participants.size()+" steps="+steps.size()+"}";
    }
}
