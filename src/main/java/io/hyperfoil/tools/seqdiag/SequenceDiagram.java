package io.hyperfoil.tools.seqdiag;

import io.hyperfoil.tools.seqdiag.config.LayoutConfig;
import io.hyperfoil.tools.seqdiag.config.yaml.SequenceEncoder;
import io.hyperfoil.tools.seqdiag.layout.LayoutOptions;
import io.hyperfoil.tools.seqdiag.layout.SequenceLayout;
import io.hyperfoil.tools.seqdiag.layout.SequenceLayoutEngine;
import io.hyperfoil.tools.seqdiag.model.Document;
import io.hyperfoil.tools.seqdiag.parse.SequenceParser;

/**
 * Parses diagram text and lays it out with one shared parser and engine.
 * <pre>
 * SequenceDiagram diagram = new SequenceDiagram();
 * Document document = diagram.parse(text);
 * if(!document.hasError()){
 *     SequenceLayout layout = diagram.layout(document, LayoutOptions.defaults());
 * }
 * </pre>
 */
public class SequenceDiagram {

    private final SequenceParser parser;
    private final SequenceLayoutEngine engine;
    private final SequenceEncoder encoder;

    public SequenceDiagram(){
        this(LayoutConfig.defaults());
    }

    public SequenceDiagram(LayoutConfig config){
        this.parser = SequenceParser.getInstance();
        this.engine = new SequenceLayoutEngine(config);
        this.encoder = SequenceEncoder.getInstance();
    }

    public Document parse(String content){
        return parser.parse(content);
    }

    public SequenceLayout layout(Document document, LayoutOptions options){
        return engine.layout(document,options);
    }

    /**
     * Parses and lays out in one call.
     * @throws io.hyperfoil.tools.seqdiag.model.SequenceParseException if the text does not parse
     */
    public SequenceLayout layout(String content, LayoutOptions options){
        return engine.layout(parser.parse(content).requireValid(),options);
    }

    public SequenceLayout layout(String content){
        return layout(content,LayoutOptions.defaults());
    }

    public String toYaml(Document document){
        return encoder.dump(document);
    }

    public String toYaml(SequenceLayout layout){
        return encoder.dump(layout);
    }

    public static boolean looksLikeSequence(String content){
        return SequenceParser.looksLikeSequence(content);
    }

    public SequenceParser getParser(){return parser;}
    public SequenceLayoutEngine getEngine(){return engine;}
}
