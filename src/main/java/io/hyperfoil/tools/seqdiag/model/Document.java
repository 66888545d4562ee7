package io.hyperfoil.tools.seqdiag.model;

import java.util.*;

/**
 * The parsed form of a sequence diagram. Read-only once constructed.
 */
public class Document {

    private final String title;
    private final List<Participant> participants;
    private final List<Message> messages;
    private final List<SequenceElement> elements;
    private final List<Group> groups;
    private final List<Section> sections;
    private final Map<String,String> options;
    private final ParseError error;

    public Document(String title,
                    List<Participant> participants,
                    List<Message> messages,
                    List<SequenceElement> elements,
                    List<Group> groups,
                    List<Section> sections,
                    Map<String,String> options,
                    ParseError error){
        this.title = title;
        this.participants = Collections.unmodifiableList(new ArrayList<>(participants));
        this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
        elements.forEach(Block::freezeElement);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        groups.forEach(Group::freeze);
        this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
        this.sections = Collections.unmodifiableList(new ArrayList<>(sections));
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        this.error = error;
    }

    public String getTitle(){return title;}
    public boolean hasTitle(){return title != null && !title.isEmpty();}
    public List<Participant> getParticipants(){return participants;}
    public List<Message> getMessages(){return messages;}
    public List<SequenceElement> getElements(){return elements;}
    public List<Group> getGroups(){return groups;}
    public List<Section> getSections(){return sections;}
    public Map<String,String> getOptions(){return options;}
    public String getOption(String key){return options.get(key);}
    public ParseError getError(){return error;}
    public boolean hasError(){return error != null;}

    public Participant getParticipant(String id){
        for(Participant participant : participants){
            if(participant.getId().equals(id)){
                return participant;
            }
        }
        return null;
    }

    /**
     * @return this document when it parsed without error
     * @throws SequenceParseException with the parse error otherwise
     */
    public Document requireValid(){
        if(error != null){
            throw new SequenceParseException(error);
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document)) return false;
        Document document = (Document) o;
        return Objects.equals(title, document.title) &&
                participants.equals(document.participants) &&
                messages.equals(document.messages) &&
                elements.equals(document.elements) &&
                groups.equals(document.groups) &&
                sections.equals(document.sections) &&
                options.equals(document.options) &&
                Objects.equals(error, document.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, participants, messages, elements, groups, sections, options, error);
    }

    @Override
    public String toString(){
        return "Document{title=" + title + ", participants=" + participants.size() + ", messages=" + messages.size() +
                (error == null ? "" : ", error=" + error.getMessage()) + "}";
    }
}
