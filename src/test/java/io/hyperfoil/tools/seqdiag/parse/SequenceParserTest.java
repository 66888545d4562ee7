package io.hyperfoil.tools.seqdiag.parse;

import io.hyperfoil.tools.seqdiag.SeqdiagTestBase;
import io.hyperfoil.tools.seqdiag.model.*;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class SequenceParserTest extends SeqdiagTestBase {

    private static Message only(Document document){
        assertEquals("expected one message "+document.getMessages(),1,document.getMessages().size());
        return document.getMessages().get(0);
    }

    @Test
    public void message_whitespace_tolerant(){
        for(String line : Arrays.asList("A->B:msg","A -> B: msg","A  ->  B  :  msg")){
            Message message = only(parseValid(line));
            assertEquals(line,"A",message.getFrom());
            assertEquals(line,"B",message.getTo());
            assertEquals(line,"msg",message.getLabel());
            assertNull(line,message.getReturnLabel());
        }
    }

    @Test
    public void message_return_label_arrow(){
        Message message = only(parseValid("A -> B: L <- R"));
        assertEquals("L",message.getLabel());
        assertEquals("R",message.getReturnLabel());
    }

    @Test
    public void message_return_label_method_type(){
        Message message = only(parseValid("A -> B: fn(): T"));
        assertEquals("fn()",message.getLabel());
        assertEquals("T",message.getReturnLabel());
    }

    @Test
    public void message_return_label_last_colon(){
        Message message = only(parseValid("A -> B: a:b"));
        assertEquals("a",message.getLabel());
        assertEquals("b",message.getReturnLabel());
    }

    @Test
    public void message_return_label_not_split_on_url(){
        Message message = only(parseValid("A -> B: http://x.com"));
        assertEquals("http://x.com",message.getLabel());
        assertFalse("url should not produce a return label",message.hasReturnLabel());
    }

    @Test
    public void message_async_keeps_raw_label(){
        Message message = only(parseValid("A ~> B: fire : forget"));
        assertTrue(message.isAsync());
        assertEquals("fire : forget",message.getLabel());
        assertNull(message.getReturnLabel());
    }

    @Test
    public void message_without_label(){
        Message message = only(parseValid("A -> B"));
        assertEquals("",message.getLabel());
        assertFalse(message.hasReturnLabel());
    }

    @Test
    public void message_registers_participants_in_order(){
        Document document = parseValid(
                "User -> OrderService: place",
                "OrderService -> OrdersDB: insert"
        );
        assertEquals(3,document.getParticipants().size());
        assertEquals("User",document.getParticipants().get(0).getId());
        assertEquals(ParticipantType.ACTOR,document.getParticipants().get(0).getType());
        assertEquals("OrderService",document.getParticipants().get(1).getId());
        assertEquals(ParticipantType.SERVICE,document.getParticipants().get(1).getType());
        assertEquals("OrdersDB",document.getParticipants().get(2).getId());
        assertEquals(ParticipantType.DATABASE,document.getParticipants().get(2).getType());
        assertEquals(1,document.getMessages().get(1).getIndex());
        assertEquals(2,document.getMessages().get(1).getLineNumber());
    }

    @Test
    public void declaration_with_alias_and_position(){
        Document document = parseValid(
                "Api is a service aka Public API position 2",
                "Api -> Store: read"
        );
        Participant api = document.getParticipant("Api");
        assertNotNull(api);
        assertEquals("Public API",api.getLabel());
        assertEquals(ParticipantType.SERVICE,api.getType());
        assertEquals(Integer.valueOf(2),api.getPosition());
        assertEquals(1,api.getLineNumber());
    }

    @Test
    public void declaration_unknown_type_is_default(){
        Document document = parseValid(
                "Thing is a widget",
                "Thing -> Other: hi"
        );
        assertEquals(ParticipantType.DEFAULT,document.getParticipant("Thing").getType());
        assertEquals("Thing",document.getParticipant("Thing").getLabel());
    }

    @Test
    public void declaration_first_one_wins(){
        Document document = parseValid(
                "Store is a database",
                "Store is a cache",
                "A -> Store: get"
        );
        assertEquals(ParticipantType.DATABASE,document.getParticipant("Store").getType());
    }

    @Test
    public void declaration_position_only(){
        Document document = parseValid(
                "Redis position -1",
                "A -> Redis: get"
        );
        Participant redis = document.getParticipant("Redis");
        assertEquals(Integer.valueOf(-1),redis.getPosition());
        assertEquals(ParticipantType.CACHE,redis.getType());
    }

    @Test
    public void position_beyond_int_range_is_clamped(){
        Document document = parseValid(
                "API position 99999999999",
                "API is a service position -99999999999",
                "API -> DB: q"
        );
        assertEquals(Integer.valueOf(Integer.MAX_VALUE),document.getParticipant("API").getPosition());

        document = parseValid(
                "API is a service position -99999999999",
                "API -> DB: q"
        );
        assertEquals(Integer.valueOf(Integer.MIN_VALUE),document.getParticipant("API").getPosition());
        assertEquals(ParticipantType.SERVICE,document.getParticipant("API").getType());
    }

    @Test
    public void group_end_to_end(){
        Document document = parseValid(
                "## Backend(blue)",
                "  API",
                "API -> DB: query"
        );
        assertEquals(1,document.getGroups().size());
        Group group = document.getGroups().get(0);
        assertEquals("Backend",group.getName());
        assertEquals("blue",group.getColor());
        assertEquals(List.of("API"),group.getParticipantIds());
        assertEquals(2,document.getParticipants().size());
        assertEquals("API",document.getParticipants().get(0).getId());
        assertEquals("DB",document.getParticipants().get(1).getId());
        assertEquals(ParticipantType.DATABASE,document.getParticipants().get(1).getType());
        assertEquals(1,document.getMessages().size());
    }

    @Test
    public void group_ends_at_blank_line(){
        Document document = parseValid(
                "## Front",
                "  Web",
                "",
                "  Mobile",
                "Web -> Api: call"
        );
        assertEquals(List.of("Web"),document.getGroups().get(0).getParticipantIds());
    }

    @Test
    public void group_members_can_be_declarations(){
        Document document = parseValid(
                "## Data(teal)",
                "  Orders is a database",
                "  Events is a queue",
                "## Edge",
                "  Gateway",
                "Gateway -> Orders: save"
        );
        assertEquals(2,document.getGroups().size());
        assertEquals(List.of("Orders","Events"),document.getGroups().get(0).getParticipantIds());
        assertEquals(List.of("Gateway"),document.getGroups().get(1).getParticipantIds());
        assertNull(document.getGroups().get(1).getColor());
    }

    @Test
    public void error_group_duplicate_membership(){
        Document document = parse(
                "## One",
                "  A",
                "## Two",
                "  A",
                "A -> B: hi"
        );
        assertTrue(document.hasError());
        assertEquals(4,document.getError().getLineNumber());
        assertEquals(ParseError.Kind.STRUCTURAL,document.getError().getKind());
        assertTrue(document.getError().getMessage(),document.getError().getMessage().contains("already in group 'One'"));
    }

    @Test
    public void error_group_after_message(){
        Document document = parse(
                "A -> B: hi",
                "## Late"
        );
        assertTrue(document.hasError());
        assertEquals(2,document.getError().getLineNumber());
        assertTrue(document.getError().getMessage(),document.getError().getMessage().startsWith("Line 2: "));
    }

    @Test
    public void error_group_hex_color(){
        Document document = parse(
                "## Backend(#ff0000)",
                "  API",
                "API -> DB: query"
        );
        assertEquals("Line 1: "+SequenceParser.HEX_COLOR_ERROR,document.getError().getMessage());
    }

    @Test
    public void error_section_hex_color(){
        Document document = parse(
                "A -> B: hi",
                "== Phase(#fff) =="
        );
        assertEquals("Line 2: "+SequenceParser.HEX_COLOR_ERROR,document.getError().getMessage());
    }

    @Test
    public void error_hash_comment(){
        Document document = parse(
                "# not a comment",
                "A -> B: hi"
        );
        assertEquals("Line 1: Use // for comments. # is reserved for group headings (##)",document.getError().getMessage());
    }

    @Test
    public void comments_are_skipped(){
        Document document = parseValid(
                "// A -> C: not a message",
                "A -> B: hi"
        );
        assertEquals(1,document.getMessages().size());
        assertNull(document.getParticipant("C"));
    }

    @Test
    public void error_option_after_content(){
        Document document = parse(
                "A -> B: hi",
                "title: late"
        );
        assertEquals("Line 2: Options like 'title: late' must appear before the first message or declaration",
                document.getError().getMessage());
    }

    @Test
    public void error_option_after_declaration(){
        Document document = parse(
                "A is a service",
                "activations: off",
                "A -> B: hi"
        );
        assertTrue(document.hasError());
        assertEquals(2,document.getError().getLineNumber());
    }

    @Test
    public void error_async_prefix(){
        Document document = parse("async A -> B: go");
        assertEquals("Line 1: Use ~> for async messages: A ~> B: message",document.getError().getMessage());
    }

    @Test
    public void error_chart_type(){
        Document document = parse(
                "chart: flowchart",
                "A -> B: hi"
        );
        assertTrue(document.hasError());
        assertTrue(document.getError().getMessage(),document.getError().getMessage().contains("Expected chart type \"sequence\", got \"flowchart\""));
    }

    @Test
    public void error_empty_content(){
        for(String content : Arrays.asList(null,"","   \n  ")){
            Document document = SequenceParser.getInstance().parse(content);
            assertTrue(document.hasError());
            assertEquals(ParseError.Kind.CONTENT,document.getError().getKind());
            assertEquals("Empty content",document.getError().getMessage());
        }
    }

    @Test
    public void error_no_sequence_content(){
        Document document = parse("title: nothing here");
        assertTrue(document.hasError());
        assertEquals(ParseError.Kind.CONTENT,document.getError().getKind());
        assertEquals("No \"chart: sequence\" header and no sequence content detected",document.getError().getMessage());
    }

    @Test
    public void explicit_chart_without_messages(){
        Document document = parseValid(
                "chart: sequence",
                "title: Empty",
                "style: compact"
        );
        assertEquals("Empty",document.getTitle());
        assertEquals("compact",document.getOption("style"));
        assertTrue(document.getMessages().isEmpty());
    }

    @Test
    public void error_keeps_content_parsed_before_it(){
        Document document = parse(
                "A -> B: one",
                "async A -> B: two"
        );
        assertTrue(document.hasError());
        assertEquals(1,document.getMessages().size());
    }

    @Test
    public void require_valid_throws(){
        Document document = parse("# bad");
        try {
            document.requireValid();
            fail("expected a SequenceParseException");
        }catch (SequenceParseException e){
            assertEquals(1,e.getLineNumber());
            assertEquals(ParseError.Kind.STRUCTURAL,e.getKind());
        }
    }

    @Test
    public void if_else_if_else_chain(){
        Document document = parseValid(
                "if ok",
                "  A -> B: one",
                "  A -> B: two",
                "else if retry",
                "  A -> C: three",
                "else if fail",
                "  A -> D: four",
                "else",
                "  A -> E: five",
                "B -> A: after"
        );
        assertEquals(2,document.getElements().size());
        Block block = (Block) document.getElements().get(0);
        assertEquals(BlockType.IF,block.getType());
        assertEquals("ok",block.getLabel());
        assertEquals(2,block.getChildren().size());
        assertEquals(2,block.getElseIfBranches().size());
        assertEquals("retry",block.getElseIfBranches().get(0).getLabel());
        assertEquals(4,block.getElseIfBranches().get(0).getLineNumber());
        assertEquals("fail",block.getElseIfBranches().get(1).getLabel());
        assertEquals(1,block.getElseIfBranches().get(1).getChildren().size());
        assertEquals(1,block.getElseChildren().size());
        assertTrue(document.getElements().get(1).isMessage());
        assertEquals(6,document.getMessages().size());
    }

    @Test
    public void if_without_else(){
        Document document = parseValid(
                "if cached",
                "  A -> Cache: get"
        );
        Block block = (Block) document.getElements().get(0);
        assertEquals(1,block.getChildren().size());
        assertTrue(block.getElseIfBranches().isEmpty());
        assertFalse(block.hasElse());
    }

    @Test
    public void else_at_other_indent_is_ignored(){
        Document document = parseValid(
                "if x",
                "  A -> B: one",
                "  else",
                "  A -> B: two"
        );
        Block block = (Block) document.getElements().get(0);
        assertEquals(2,block.getChildren().size());
        assertFalse(block.hasElse());
    }

    @Test
    public void error_parallel_else(){
        Document document = parse(
                "parallel",
                "  A -> B: one",
                "else",
                "  A -> C: two"
        );
        assertTrue(document.hasError());
        assertEquals(3,document.getError().getLineNumber());
        assertTrue(document.getError().getMessage(),document.getError().getMessage().contains("parallel blocks don't support else"));
    }

    @Test
    public void error_parallel_else_if(){
        Document document = parse(
                "parallel fan out",
                "  A -> B: one",
                "else if slow",
                "  A -> C: two"
        );
        assertTrue(document.hasError());
        assertEquals(3,document.getError().getLineNumber());
        assertTrue(document.getError().getMessage(),document.getError().getMessage().contains("parallel blocks don't support else if"));
    }

    @Test
    public void nested_blocks_close_by_indent(){
        Document document = parseValid(
                "loop retry",
                "  A -> B: try",
                "  if failed",
                "    B -> C: log",
                "  A -> B: again",
                "parallel",
                "  A -> D: x",
                "B -> A: done"
        );
        assertEquals(3,document.getElements().size());
        Block loop = (Block) document.getElements().get(0);
        assertEquals(BlockType.LOOP,loop.getType());
        assertEquals(3,loop.getChildren().size());
        Block inner = (Block) loop.getChildren().get(1);
        assertEquals(BlockType.IF,inner.getType());
        assertEquals(1,inner.getChildren().size());
        Block parallel = (Block) document.getElements().get(1);
        assertEquals(BlockType.PARALLEL,parallel.getType());
        assertEquals("",parallel.getLabel());
        assertTrue(document.getElements().get(2).isMessage());
    }

    @Test
    public void sections_with_color(){
        Document document = parseValid(
                "A -> B: one",
                "== Phase Two(green) ==",
                "A -> B: two",
                "== Done"
        );
        assertEquals(2,document.getSections().size());
        Section first = document.getSections().get(0);
        assertEquals("Phase Two",first.getLabel());
        assertEquals("green",first.getColor());
        assertEquals(2,first.getLineNumber());
        assertEquals("Done",document.getSections().get(1).getLabel());
        assertFalse(document.getSections().get(1).hasColor());
        assertEquals(4,document.getElements().size());
        assertTrue(document.getElements().get(1).isSection());
    }

    @Test
    public void section_closes_blocks(){
        Document document = parseValid(
                "loop forever",
                "  A -> B: ping",
                "== Later ==",
                "A -> B: pong"
        );
        assertEquals(3,document.getElements().size());
        assertTrue(document.getElements().get(1).isSection());
    }

    @Test
    public void notes_single_line(){
        Document document = parseValid(
                "A -> B: hi",
                "note: thinking",
                "note left of B: stored",
                "note right of Ghost: skipped"
        );
        assertEquals(3,document.getElements().size());
        Note first = (Note) document.getElements().get(1);
        assertEquals("thinking",first.getText());
        assertEquals(NotePosition.RIGHT,first.getPosition());
        assertEquals("A",first.getParticipantId());
        Note second = (Note) document.getElements().get(2);
        assertEquals(NotePosition.LEFT,second.getPosition());
        assertEquals("B",second.getParticipantId());
        assertEquals(3,second.getLineNumber());
    }

    @Test
    public void notes_multi_line(){
        Document document = parseValid(
                "A -> B: hi",
                "note right of B",
                "  line one",
                "  line two",
                "A -> B: next",
                "note left of A"
        );
        assertEquals(3,document.getElements().size());
        Note note = (Note) document.getElements().get(1);
        assertEquals("line one\nline two",note.getText());
        assertEquals(2,note.getLineNumber());
        assertEquals(2,document.getMessages().size());
    }

    @Test
    public void note_before_messages_is_skipped(){
        Document document = parseValid(
                "chart: sequence",
                "note: too early"
        );
        assertTrue(document.getElements().isEmpty());
    }

    @Test
    public void parse_is_idempotent(){
        String content = join(
                "title: Checkout",
                "## Shop(purple)",
                "  Web",
                "User -> Web: buy",
                "if in stock",
                "  Web -> Stock: reserve : ok",
                "else",
                "  Web -> User: sorry",
                "== Payment ==",
                "Web ~> Queue: charge",
                "note: async"
        );
        SequenceParser parser = SequenceParser.getInstance();
        Document first = parser.parse(content);
        Document second = parser.parse(content);
        assertFalse(first.hasError());
        assertEquals(first,second);
        assertEquals(first.hashCode(),second.hashCode());
    }

    @Test
    public void looks_like_sequence(){
        assertTrue(SequenceParser.looksLikeSequence("A -> B"));
        assertTrue(SequenceParser.looksLikeSequence("title: x\nA ~> B: go"));
        assertFalse(SequenceParser.looksLikeSequence("// A -> B"));
        assertFalse(SequenceParser.looksLikeSequence("just text"));
        assertFalse(SequenceParser.looksLikeSequence(""));
        assertFalse(SequenceParser.looksLikeSequence(null));
    }

    @Test
    public void rules_in_dispatch_order(){
        List<String> names = List.copyOf(SequenceParser.getInstance().getRuleNames());
        assertEquals("blank",names.get(0));
        assertTrue("group heading before comment",names.indexOf("group-heading") < names.indexOf("comment"));
        assertTrue("message before block keywords",names.indexOf("message") < names.indexOf("block"));
        assertTrue("else if before else",names.indexOf("else-if") < names.indexOf("else"));
    }
}
