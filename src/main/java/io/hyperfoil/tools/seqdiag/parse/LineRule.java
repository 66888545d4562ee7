package io.hyperfoil.tools.seqdiag.parse;

/**
 * One entry of the parser's ordered dispatch table.
 * The parser offers each line to its rules in registration order and stops at the first rule that consumes it.
 */
@FunctionalInterface
public interface LineRule {

    /**
     * @return true if the line was consumed, false to offer it to the next rule
     * @throws io.hyperfoil.tools.seqdiag.model.SequenceParseException to stop parsing
     */
    boolean apply(SourceLine line, ParserContext context);
}
