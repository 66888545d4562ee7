package io.hyperfoil.tools.seqdiag.config.yaml;

import io.hyperfoil.tools.seqdiag.SeqdiagTestBase;
import io.hyperfoil.tools.seqdiag.layout.SequenceLayout;
import io.hyperfoil.tools.seqdiag.layout.SequenceLayoutEngine;
import io.hyperfoil.tools.seqdiag.model.Document;
import org.junit.Test;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

@SuppressWarnings("unchecked")
public class SequenceEncoderTest extends SeqdiagTestBase {

    private static final String[] CHECKOUT = {
            "title: Checkout",
            "User is an actor aka Shopper",
            "User -> Api: buy : ok",
            "if paid",
            "  Api ~> Queue: publish",
            "else",
            "  Api -> User: retry",
            "note right of Api: **done**"
    };

    private final SequenceEncoder encoder = SequenceEncoder.getInstance();

    @Test
    public void encode_document(){
        Map<Object,Object> map = encoder.encode(parseValid(CHECKOUT));
        assertEquals("Checkout",map.get("title"));

        List<Object> participants = (List<Object>) map.get("participants");
        assertEquals(3,participants.size());
        Map<Object,Object> user = (Map<Object,Object>) participants.get(0);
        assertEquals("User",user.get("id"));
        assertEquals("Shopper",user.get("label"));
        assertEquals("actor",user.get("type"));
        assertEquals(2,user.get("line"));
        assertFalse("label omitted when it matches the id",((Map<Object,Object>)participants.get(1)).containsKey("label"));

        List<Object> elements = (List<Object>) map.get("elements");
        assertEquals(3,elements.size());
        Map<Object,Object> message = (Map<Object,Object>) elements.get(0);
        assertEquals("buy",message.get("message"));
        assertEquals("ok",message.get("return"));
        assertEquals(3,message.get("line"));
        assertFalse(message.containsKey("async"));

        Map<Object,Object> block = (Map<Object,Object>) elements.get(1);
        assertEquals("paid",block.get("if"));
        List<Object> then = (List<Object>) block.get("then");
        assertEquals(1,then.size());
        assertEquals(true,((Map<Object,Object>)then.get(0)).get("async"));
        assertEquals(1,((List<Object>) block.get("else")).size());
        assertFalse(block.containsKey("else-if"));

        Map<Object,Object> note = (Map<Object,Object>) elements.get(2);
        assertEquals("**done**",note.get("note"));
        assertEquals("right",note.get("position"));
        assertEquals("Api",note.get("participant"));
        assertFalse(map.containsKey("error"));
    }

    @Test
    public void encode_error(){
        Document document = parse("A -> B: x","# heading");
        Map<Object,Object> map = encoder.encode(document);
        Map<Object,Object> error = (Map<Object,Object>) map.get("error");
        assertNotNull(error);
        assertEquals("structural",error.get("kind"));
        assertEquals(2,error.get("line"));
        assertEquals("partial content is kept",1,((List<Object>)map.get("elements")).size());
    }

    @Test
    public void encode_layout(){
        SequenceLayout layout = new SequenceLayoutEngine().layout(parseValid(CHECKOUT));
        Map<Object,Object> map = encoder.encode(layout);
        assertEquals(layout.getWidth(),map.get("width"));
        assertEquals(layout.getHeight(),map.get("height"));
        assertEquals("Checkout",map.get("title"));
        List<Object> steps = (List<Object>) map.get("steps");
        assertEquals(layout.getSteps().size(),steps.size());
        assertEquals("buy",((Map<Object,Object>)steps.get(0)).get("call"));
        assertTrue(map.containsKey("frames"));
        assertTrue(map.containsKey("notes"));
        assertFalse(map.containsKey("groups"));
    }

    @Test
    public void dump_is_block_yaml(){
        String dumped = encoder.dump(parseValid(CHECKOUT));
        assertTrue(dumped,dumped.contains("title: Checkout"));
        assertTrue(dumped,dumped.contains("- message: buy"));
        assertFalse("block style only",dumped.contains("{"));

        Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(dumped);
        assertEquals(encoder.encode(parseValid(CHECKOUT)),loaded);
    }

    @Test
    public void message_encodes_as_map(){
        assertTrue(encoder.encodeElement(parseValid("A -> B: x").getElements().get(0)) instanceof Map);
    }
}
