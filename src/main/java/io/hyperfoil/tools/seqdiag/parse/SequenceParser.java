package io.hyperfoil.tools.seqdiag.parse;

import io.hyperfoil.tools.seqdiag.model.*;
import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses sequence diagram text into a {@link Document}.
 * <p>
 * Each line is offered to an ordered list of {@link LineRule}s and the first rule that consumes it wins.
 * The order is significant, e.g. group headings are checked before comments because <code>##</code> starts with <code>#</code>.
 * All parse state lives in a {@link ParserContext} created per call so one parser can be shared between threads.
 */
public class SequenceParser {

    private static final XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    public static final String CHART_TYPE = "sequence";
    public static final String HEX_COLOR_ERROR = "Use a named color instead of hex (e.g., blue, red, teal)";

    static final Pattern GROUP_HEADING = Pattern.compile("^##\\s+(.+?)(?:\\(([^)]+)\\))?\\s*$");
    static final Pattern SECTION = Pattern.compile("^==\\s+(.+?)(?:\\s*==)?\\s*$");
    static final Pattern LABEL_COLOR = Pattern.compile("^(.+?)\\(([^)]+)\\)$");
    static final Pattern ARROW = Pattern.compile("\\S+\\s*(?:->|~>)\\s*\\S+");
    static final Pattern IS_A = Pattern.compile("^(\\S+)\\s+is\\s+an?\\s+(\\w+)(?:\\s+(.+))?$",Pattern.CASE_INSENSITIVE);
    static final Pattern AKA = Pattern.compile("\\baka\\s+(.+?)(?:\\s+position\\s+-?\\d+\\s*$|$)",Pattern.CASE_INSENSITIVE);
    static final Pattern POSITION = Pattern.compile("\\bposition\\s+(-?\\d+)",Pattern.CASE_INSENSITIVE);
    static final Pattern POSITION_ONLY = Pattern.compile("^(\\S+)\\s+position\\s+(-?\\d+)$",Pattern.CASE_INSENSITIVE);
    static final Pattern BARE_NAME = Pattern.compile("^\\S+$");
    static final Pattern ASYNC_PREFIX = Pattern.compile("^async\\s+(.+)$",Pattern.CASE_INSENSITIVE);
    static final Pattern ASYNC_ARROW = Pattern.compile("^(\\S+)\\s*~>\\s*([^\\s:]+)\\s*(?::\\s*(.+))?$");
    static final Pattern SYNC_ARROW = Pattern.compile("^(\\S+)\\s*->\\s*([^\\s:]+)\\s*(?::\\s*(.+))?$");
    static final Pattern IF = Pattern.compile("^if\\s+(.+)$",Pattern.CASE_INSENSITIVE);
    static final Pattern LOOP = Pattern.compile("^loop\\s+(.+)$",Pattern.CASE_INSENSITIVE);
    static final Pattern PARALLEL = Pattern.compile("^parallel(?:\\s+(.+))?$",Pattern.CASE_INSENSITIVE);
    static final Pattern ELSE_IF = Pattern.compile("^else\\s+if\\s+(.+)$",Pattern.CASE_INSENSITIVE);
    static final Pattern ELSE = Pattern.compile("^else$",Pattern.CASE_INSENSITIVE);
    static final Pattern NOTE_SINGLE = Pattern.compile("^note(?:\\s+(right|left)\\s+of\\s+(\\S+))?\\s*:\\s*(.+)$",Pattern.CASE_INSENSITIVE);
    static final Pattern NOTE_MULTI = Pattern.compile("^note(?:\\s+(right|left)\\s+of\\s+(\\S+))?\\s*$",Pattern.CASE_INSENSITIVE);

    private final LinkedHashMap<String,LineRule> rules;

    public static SequenceParser getInstance(){
        SequenceParser rtrn = new SequenceParser();
        rtrn.addRule("blank", SequenceParser::blank);
        rtrn.addRule("group-heading", SequenceParser::groupHeading);
        rtrn.addRule("group-scope", SequenceParser::groupScope);
        rtrn.addRule("comment", SequenceParser::comment);
        rtrn.addRule("section", SequenceParser::section);
        rtrn.addRule("header", SequenceParser::header);
        rtrn.addRule("is-a", SequenceParser::declaration);
        rtrn.addRule("position", SequenceParser::positionDeclaration);
        rtrn.addRule("group-member", SequenceParser::groupMember);
        rtrn.addRule("block-scope", SequenceParser::blockScope);
        rtrn.addRule("async-prefix", SequenceParser::asyncPrefix);
        rtrn.addRule("message", SequenceParser::message);
        rtrn.addRule("block", SequenceParser::blockOpener);
        rtrn.addRule("else-if", SequenceParser::elseIf);
        rtrn.addRule("else", SequenceParser::elseBranch);
        rtrn.addRule("note", SequenceParser::singleLineNote);
        rtrn.addRule("multi-line-note", SequenceParser::multiLineNote);
        return rtrn;
    }

    private SequenceParser(){
        rules = new LinkedHashMap<>();
    }

    public void addRule(String name, LineRule rule){
        rules.put(name,rule);
    }

    public Set<String> getRuleNames(){
        return Collections.unmodifiableSet(rules.keySet());
    }

    /**
     * @return the parsed document, check {@link Document#getError()} before using it
     */
    public Document parse(String content){
        if(content == null || content.isBlank()){
            return new ParserContext("").toDocument(SequenceParseException.content("Empty content").getError());
        }
        ParserContext context = new ParserContext(content);
        try {
            while (context.hasNext()) {
                SourceLine line = context.next();
                dispatch(line, context);
            }
            validate(context);
        }catch (SequenceParseException e){
            logger.debug("stopped parsing: {}",e.getMessage());
            return context.toDocument(e.getError());
        }
        Document rtrn = context.toDocument(null);
        logger.debug("parsed {}",rtrn);
        return rtrn;
    }

    private void dispatch(SourceLine line, ParserContext context){
        for(Map.Entry<String,LineRule> entry : rules.entrySet()){
            if(entry.getValue().apply(line,context)){
                logger.trace("line {} matched {}",line.getLineNumber(),entry.getKey());
                return;
            }
        }
        logger.trace("line {} ignored: {}",line.getLineNumber(),line.getTrimmed());
    }

    private static void validate(ParserContext context){
        if(!context.isExplicitChart() && context.getMessages().isEmpty()){
            boolean hasArrows = context.getLines().stream()
                    .anyMatch(line -> ARROW.matcher(line.getTrimmed()).find());
            if(!hasArrows){
                throw SequenceParseException.content("No \"chart: sequence\" header and no sequence content detected");
            }
        }
    }

    /**
     * @return true if any non comment line contains an arrow
     */
    public static boolean looksLikeSequence(String content){
        if(content == null || content.isEmpty()){
            return false;
        }
        return Arrays.stream(content.split("\n"))
                .map(String::trim)
                .filter(line -> !line.startsWith("//"))
                .anyMatch(line -> ARROW.matcher(line).find());
    }

    /**
     * Positions beyond the int range are clamped, layout clamps them to the participant count anyway.
     */
    static int parsePosition(String value){
        try {
            return Integer.parseInt(value);
        }catch (NumberFormatException e){
            //the pattern only captures digits so this is an overflow
            return value.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
    }

    static boolean isHexColor(String color){
        return color != null && color.trim().startsWith("#");
    }

    //rules, in dispatch order

    static boolean blank(SourceLine line, ParserContext context){
        if(line.isBlank()){
            context.clearActiveGroup();
            return true;
        }
        return false;
    }

    static boolean groupHeading(SourceLine line, ParserContext context){
        Matcher matcher = GROUP_HEADING.matcher(line.getTrimmed());
        if(!matcher.matches()){
            return false;
        }
        String color = matcher.group(2) == null ? null : matcher.group(2).trim();
        if(isHexColor(color)){
            throw SequenceParseException.structural(line.getLineNumber(),HEX_COLOR_ERROR);
        }
        if(context.isBodyStarted()){
            throw SequenceParseException.structural(line.getLineNumber(),
                    "Group headings like '"+line.getTrimmed()+"' must appear before the first message");
        }
        context.markContentStarted();
        context.startGroup(new Group(matcher.group(1).trim(),color == null || color.isEmpty() ? null : color,line.getLineNumber()));
        return true;
    }

    /**
     * any line at indent 0 ends the active group, never consumes the line
     */
    static boolean groupScope(SourceLine line, ParserContext context){
        if(context.hasActiveGroup() && !line.isIndented()){
            context.clearActiveGroup();
        }
        return false;
    }

    static boolean comment(SourceLine line, ParserContext context){
        String trimmed = line.getTrimmed();
        if(trimmed.startsWith("//")){
            return true;
        }
        if(trimmed.startsWith("#") && !trimmed.startsWith("##")){
            throw SequenceParseException.structural(line.getLineNumber(),"Use // for comments. # is reserved for group headings (##)");
        }
        return false;
    }

    static boolean section(SourceLine line, ParserContext context){
        Matcher matcher = SECTION.matcher(line.getTrimmed());
        if(!matcher.matches()){
            return false;
        }
        context.closeBlocks(line.getIndent(),false);
        String label = matcher.group(1).trim();
        String color = null;
        Matcher colorMatcher = LABEL_COLOR.matcher(label);
        if(colorMatcher.matches()){
            color = colorMatcher.group(2).trim();
            if(isHexColor(color)){
                throw SequenceParseException.structural(line.getLineNumber(),HEX_COLOR_ERROR);
            }
            label = colorMatcher.group(1).trim();
        }
        context.markBodyStarted();
        context.addSection(new Section(label,color,line.getLineNumber()));
        return true;
    }

    static boolean header(SourceLine line, ParserContext context){
        String trimmed = line.getTrimmed();
        int colonIndex = trimmed.indexOf(':');
        if(colonIndex <= 0 || trimmed.contains("->") || trimmed.contains("~>")){
            return false;
        }
        String key = trimmed.substring(0,colonIndex).trim().toLowerCase(Locale.ROOT);
        if(key.equals("note") || key.startsWith("note ")){
            return false;
        }
        String value = trimmed.substring(colonIndex+1).trim();
        if("chart".equals(key)){
            context.markExplicitChart();
            if(!CHART_TYPE.equals(value.toLowerCase(Locale.ROOT))){
                throw SequenceParseException.structural(line.getLineNumber(),"Expected chart type \""+CHART_TYPE+"\", got \""+value+"\"");
            }
            return true;
        }
        if(context.isContentStarted()){
            throw SequenceParseException.structural(line.getLineNumber(),
                    "Options like '"+key+": "+value+"' must appear before the first message or declaration");
        }
        if("title".equals(key)){
            context.setTitle(value);
        }else{
            context.setOption(key,value);
        }
        return true;
    }

    static boolean declaration(SourceLine line, ParserContext context){
        Matcher matcher = IS_A.matcher(line.getTrimmed());
        if(!matcher.matches()){
            return false;
        }
        context.markContentStarted();
        String id = matcher.group(1);
        ParticipantType type = ParticipantType.fromDeclaration(matcher.group(2));
        String remainder = matcher.group(3) == null ? "" : matcher.group(3).trim();

        Matcher akaMatcher = AKA.matcher(remainder);
        String alias = akaMatcher.find() ? akaMatcher.group(1).trim() : null;
        Matcher positionMatcher = POSITION.matcher(remainder);
        Integer position = positionMatcher.find() ? parsePosition(positionMatcher.group(1)) : null;

        context.registerParticipant(id,alias,type == null ? ParticipantType.DEFAULT : type,line.getLineNumber(),position);
        context.joinActiveGroup(id,line.getLineNumber());
        return true;
    }

    static boolean positionDeclaration(SourceLine line, ParserContext context){
        Matcher matcher = POSITION_ONLY.matcher(line.getTrimmed());
        if(!matcher.matches()){
            return false;
        }
        context.markContentStarted();
        String id = matcher.group(1);
        context.registerParticipant(id,id,ParticipantInference.infer(id),line.getLineNumber(),parsePosition(matcher.group(2)));
        context.joinActiveGroup(id,line.getLineNumber());
        return true;
    }

    static boolean groupMember(SourceLine line, ParserContext context){
        if(!context.hasActiveGroup() || !line.isIndented() || !BARE_NAME.matcher(line.getTrimmed()).matches()){
            return false;
        }
        context.markContentStarted();
        String id = line.getTrimmed();
        context.registerInferred(id,line.getLineNumber());
        context.joinActiveGroup(id,line.getLineNumber());
        return true;
    }

    /**
     * closes blocks that this line's indent has left, never consumes the line
     */
    static boolean blockScope(SourceLine line, ParserContext context){
        String trimmed = line.getTrimmed();
        boolean branch = ELSE.matcher(trimmed).matches() || ELSE_IF.matcher(trimmed).matches();
        context.closeBlocks(line.getIndent(),branch);
        return false;
    }

    static boolean asyncPrefix(SourceLine line, ParserContext context){
        Matcher matcher = ASYNC_PREFIX.matcher(line.getTrimmed());
        if(matcher.matches() && ARROW.matcher(matcher.group(1)).find()){
            throw SequenceParseException.structural(line.getLineNumber(),"Use ~> for async messages: A ~> B: message");
        }
        return false;
    }

    static boolean message(SourceLine line, ParserContext context){
        String trimmed = line.getTrimmed();
        boolean async = true;
        Matcher matcher = ASYNC_ARROW.matcher(trimmed);
        if(!matcher.matches()){
            async = false;
            matcher = SYNC_ARROW.matcher(trimmed);
            if(!matcher.matches()){
                return false;
            }
        }
        context.markBodyStarted();
        String from = matcher.group(1);
        String to = matcher.group(2);
        String rawLabel = matcher.group(3) == null ? "" : matcher.group(3).trim();
        ReturnLabel label = async ? ReturnLabel.async(rawLabel) : ReturnLabel.parse(rawLabel);
        context.addMessage(from,to,label,line.getLineNumber(),async);
        context.registerInferred(from,line.getLineNumber());
        context.registerInferred(to,line.getLineNumber());
        return true;
    }

    static boolean blockOpener(SourceLine line, ParserContext context){
        String trimmed = line.getTrimmed();
        Block block = null;
        Matcher matcher;
        if((matcher = IF.matcher(trimmed)).matches()){
            block = new Block(BlockType.IF,matcher.group(1).trim(),line.getLineNumber());
        }else if((matcher = LOOP.matcher(trimmed)).matches()){
            block = new Block(BlockType.LOOP,matcher.group(1).trim(),line.getLineNumber());
        }else if((matcher = PARALLEL.matcher(trimmed)).matches()){
            block = new Block(BlockType.PARALLEL,matcher.group(1) == null ? "" : matcher.group(1).trim(),line.getLineNumber());
        }
        if(block == null){
            return false;
        }
        context.markBodyStarted();
        context.openBlock(block,line.getIndent());
        return true;
    }

    static boolean elseIf(SourceLine line, ParserContext context){
        Matcher matcher = ELSE_IF.matcher(line.getTrimmed());
        if(!matcher.matches()){
            return false;
        }
        ParserContext.BlockScope top = context.topBlock();
        if(top != null && top.getIndent() == line.getIndent()){
            if(top.getBlock().getType() == BlockType.PARALLEL){
                throw SequenceParseException.structural(line.getLineNumber(),
                        "parallel blocks don't support else if - list all concurrent messages directly inside the block");
            }
            if(top.getBlock().getType().isBranching()){
                context.startElseIf(top,matcher.group(1).trim(),line.getLineNumber());
            }
        }else{
            logger.debug("line {}: else if without a matching if",line.getLineNumber());
        }
        return true;
    }

    static boolean elseBranch(SourceLine line, ParserContext context){
        if(!ELSE.matcher(line.getTrimmed()).matches()){
            return false;
        }
        ParserContext.BlockScope top = context.topBlock();
        if(top != null && top.getIndent() == line.getIndent()){
            if(top.getBlock().getType() == BlockType.PARALLEL){
                throw SequenceParseException.structural(line.getLineNumber(),
                        "parallel blocks don't support else - list all concurrent messages directly inside the block");
            }
            if(top.getBlock().getType().isBranching()){
                context.startElse(top,line.getLineNumber());
            }
        }else{
            logger.debug("line {}: else without a matching if",line.getLineNumber());
        }
        return true;
    }

    static boolean singleLineNote(SourceLine line, ParserContext context){
        Matcher matcher = NOTE_SINGLE.matcher(line.getTrimmed());
        if(!matcher.matches()){
            return false;
        }
        String participant = noteParticipant(matcher.group(2),line,context);
        if(participant != null){
            context.markBodyStarted();
            context.addNote(new Note(matcher.group(3).trim(),NotePosition.parse(matcher.group(1)),participant,line.getLineNumber()));
        }
        return true;
    }

    static boolean multiLineNote(SourceLine line, ParserContext context){
        Matcher matcher = NOTE_MULTI.matcher(line.getTrimmed());
        if(!matcher.matches()){
            return false;
        }
        String participant = noteParticipant(matcher.group(2),line,context);
        if(participant == null){
            return true;
        }
        List<String> body = new ArrayList<>();
        SourceLine next;
        while((next = context.peek()) != null && !next.isBlank() && next.getIndent() > line.getIndent()){
            body.add(next.getTrimmed());
            context.next();
        }
        if(body.isEmpty()){
            logger.debug("line {}: note without a body yet",line.getLineNumber());
            return true;
        }
        context.markBodyStarted();
        context.addNote(new Note(String.join("\n",body),NotePosition.parse(matcher.group(1)),participant,line.getLineNumber()));
        return true;
    }

    /**
     * @return the participant the note belongs to, or null when the note is incomplete and should be skipped
     */
    private static String noteParticipant(String explicit, SourceLine line, ParserContext context){
        String participant = explicit;
        if(participant == null){
            participant = context.getLastMessageFrom();
            if(participant == null){
                logger.debug("line {}: note without a participant or a preceding message",line.getLineNumber());
                return null;
            }
        }
        if(!context.hasParticipant(participant)){
            logger.debug("line {}: note for unknown participant {}",line.getLineNumber(),participant);
            return null;
        }
        return participant;
    }
}
