package io.hyperfoil.tools.seqdiag.config.yaml;

import io.hyperfoil.tools.seqdiag.layout.*;
import io.hyperfoil.tools.seqdiag.model.*;
import io.hyperfoil.tools.seqdiag.render.RenderStep;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Converts documents and layouts into plain maps and lists and dumps them as yaml for an external renderer.
 */
public class SequenceEncoder {

    public static SequenceEncoder getInstance(){
        SequenceEncoder rtrn = new SequenceEncoder();
        rtrn.addElement(Message.class,(message)->{
            Map<Object,Object> map = new LinkedHashMap<>();
            map.put("message",message.getLabel());
            map.put("from",message.getFrom());
            map.put("to",message.getTo());
            if(message.hasReturnLabel()){
                map.put("return",message.getReturnLabel());
            }
            if(message.isAsync()){
                map.put("async",true);
            }
            map.put("line",message.getLineNumber());
            return map;
        });
        rtrn.addElement(Section.class,(section)->{
            Map<Object,Object> map = new LinkedHashMap<>();
            map.put("section",section.getLabel());
            if(section.hasColor()){
                map.put("color",section.getColor());
            }
            map.put("line",section.getLineNumber());
            return map;
        });
        rtrn.addElement(Note.class,(note)->{
            Map<Object,Object> map = new LinkedHashMap<>();
            map.put("note",note.getText());
            map.put("position",note.getPosition().toString());
            map.put("participant",note.getParticipantId());
            map.put("line",note.getLineNumber());
            return map;
        });
        rtrn.addElement(Block.class,(block)->{
            Map<Object,Object> map = new LinkedHashMap<>();
            map.put(block.getType().getKeyword(),block.getLabel());
            map.put("line",block.getLineNumber());
            map.put("then",rtrn.encodeElements(block.getChildren()));
            if(block.hasElseIf()){
                map.put("else-if",block.getElseIfBranches().stream().map(branch->{
                    Map<Object,Object> branchMap = new LinkedHashMap<>();
                    branchMap.put("if",branch.getLabel());
                    branchMap.put("line",branch.getLineNumber());
                    branchMap.put("then",rtrn.encodeElements(branch.getChildren()));
                    return branchMap;
                }).collect(Collectors.toList()));
            }
            if(block.hasElse()){
                map.put("else",rtrn.encodeElements(block.getElseChildren()));
            }
            return map;
        });
        return rtrn;
    }

    private final Map<Class<?>,ElementEncoder<?>> encoders;
    private final Yaml yaml;

    private SequenceEncoder(){
        encoders = new HashMap<>();
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setWidth(1024);
        dumperOptions.setIndent(2);
        yaml = new Yaml(dumperOptions);
    }

    public <T extends SequenceElement> void addElement(Class<T> clazz, ElementEncoder<T> encoder){
        encoders.put(clazz,encoder);
    }

    @SuppressWarnings("unchecked")
    public Object encodeElement(SequenceElement element){
        ElementEncoder<SequenceElement> encoder = (ElementEncoder<SequenceElement>) encoders.get(element.getClass());
        return encoder == null ? element.toString() : encoder.encode(element);
    }

    public List<Object> encodeElements(List<SequenceElement> elements){
        return elements.stream().map(this::encodeElement).collect(Collectors.toList());
    }

    public Map<Object,Object> encode(Document document){
        Map<Object,Object> rtrn = new LinkedHashMap<>();
        if(document.hasTitle()){
            rtrn.put("title",document.getTitle());
        }
        if(!document.getOptions().isEmpty()){
            rtrn.put("options",new LinkedHashMap<>(document.getOptions()));
        }
        rtrn.put("participants",document.getParticipants().stream().map(participant->{
            Map<Object,Object> map = new LinkedHashMap<>();
            map.put("id",participant.getId());
            if(!participant.getLabel().equals(participant.getId())){
                map.put("label",participant.getLabel());
            }
            map.put("type",participant.getType().getName());
            if(participant.hasPosition()){
                map.put("position",participant.getPosition());
            }
            map.put("line",participant.getLineNumber());
            return map;
        }).collect(Collectors.toList()));
        if(!document.getGroups().isEmpty()){
            rtrn.put("groups",document.getGroups().stream().map(group->{
                Map<Object,Object> map = new LinkedHashMap<>();
                map.put("name",group.getName());
                if(group.hasColor()){
                    map.put("color",group.getColor());
                }
                map.put("participants",new ArrayList<>(group.getParticipantIds()));
                return map;
            }).collect(Collectors.toList()));
        }
        rtrn.put("elements",encodeElements(document.getElements()));
        if(document.hasError()){
            Map<Object,Object> error = new LinkedHashMap<>();
            error.put("kind",document.getError().getKind().name().toLowerCase());
            error.put("line",document.getError().getLineNumber());
            error.put("message",document.getError().getMessage());
            rtrn.put("error",error);
        }
        return rtrn;
    }

    public Map<Object,Object> encode(SequenceLayout layout){
        Map<Object,Object> rtrn = new LinkedHashMap<>();
        rtrn.put("width",layout.getWidth());
        rtrn.put("height",layout.getHeight());
        if(layout.hasTitle()){
            rtrn.put("title",layout.getTitle());
            rtrn.put("title-y",layout.getTitleY());
        }
        rtrn.put("participants",layout.getParticipants().stream().map(box->{
            Map<Object,Object> map = new LinkedHashMap<>();
            map.put("id",box.getId());
            map.put("label",box.getParticipant().getLabel());
            map.put("type",box.getParticipant().getType().getName());
            map.put("x",box.getCenterX());
            map.put("y",box.getY());
            map.put("lifeline",List.of(box.getLifelineStartY(),box.getLifelineEndY()));
            return map;
        }).collect(Collectors.toList()));
        rtrn.put("steps",layout.getSteps().stream().map(geometry->{
            RenderStep step = geometry.getStep();
            Map<Object,Object> map = new LinkedHashMap<>();
            map.put(step.isCall() ? "call" : "return",step.getLabel());
            map.put("from",step.getFrom());
            map.put("to",step.getTo());
            if(step.isAsync()){
                map.put("async",true);
            }
            if(geometry.isSelfCall()){
                map.put("self",true);
            }
            map.put("y",geometry.getY());
            map.put("x",List.of(geometry.getX1(),geometry.getX2()));
            map.put("line",geometry.getLineNumber());
            return map;
        }).collect(Collectors.toList()));
        if(!layout.getActivations().isEmpty()){
            rtrn.put("activations",layout.getActivations().stream().map(box->{
                Map<Object,Object> map = new LinkedHashMap<>();
                map.put("participant",box.getParticipantId());
                map.put("depth",box.getDepth());
                map.put("x",box.getX());
                map.put("y",List.of(box.getY1(),box.getY2()));
                return map;
            }).collect(Collectors.toList()));
        }
        if(!layout.getFrames().isEmpty()){
            rtrn.put("frames",layout.getFrames().stream().map(frame->{
                Map<Object,Object> map = new LinkedHashMap<>();
                map.put("label",frame.getLabel());
                map.put("depth",frame.getDepth());
                map.put("bounds",bounds(frame.getX(),frame.getY(),frame.getWidth(),frame.getHeight()));
                if(!frame.getDividers().isEmpty()){
                    map.put("dividers",frame.getDividers().stream().map(divider->{
                        Map<Object,Object> dividerMap = new LinkedHashMap<>();
                        dividerMap.put("label",divider.getLabel());
                        dividerMap.put("y",divider.getY());
                        if(divider.getLineNumber() > 0){
                            dividerMap.put("line",divider.getLineNumber());
                        }
                        return dividerMap;
                    }).collect(Collectors.toList()));
                }
                return map;
            }).collect(Collectors.toList()));
        }
        if(!layout.getSections().isEmpty()){
            rtrn.put("sections",layout.getSections().stream().map(band->{
                Map<Object,Object> map = new LinkedHashMap<>();
                map.put("label",band.getDisplayLabel());
                map.put("y",band.getY());
                map.put("collapsed",band.isCollapsed());
                map.put("line",band.getLineNumber());
                return map;
            }).collect(Collectors.toList()));
        }
        if(!layout.getNotes().isEmpty()){
            rtrn.put("notes",layout.getNotes().stream().map(note->{
                Map<Object,Object> map = new LinkedHashMap<>();
                map.put("bounds",bounds(note.getX(),note.getY(),note.getWidth(),note.getHeight()));
                map.put("lines",new ArrayList<>(note.getLines()));
                map.put("fold",note.getFold());
                map.put("collapsed",note.isCollapsed());
                map.put("line",note.getLineNumber());
                return map;
            }).collect(Collectors.toList()));
        }
        if(!layout.getGroups().isEmpty()){
            rtrn.put("groups",layout.getGroups().stream().map(box->{
                Map<Object,Object> map = new LinkedHashMap<>();
                map.put("name",box.getName());
                if(box.getGroup().hasColor()){
                    map.put("color",box.getGroup().getColor());
                }
                map.put("bounds",bounds(box.getX(),box.getY(),box.getWidth(),box.getHeight()));
                return map;
            }).collect(Collectors.toList()));
        }
        return rtrn;
    }

    private static Map<Object,Object> bounds(double x, double y, double width, double height){
        Map<Object,Object> rtrn = new LinkedHashMap<>();
        rtrn.put("x",x);
        rtrn.put("y",y);
        rtrn.put("width",width);
        rtrn.put("height",height);
        return rtrn;
    }

    public String dump(Document document){
        return yaml.dump(encode(document));
    }

    public String dump(SequenceLayout layout){
        return yaml.dump(encode(layout));
    }
}
