package io.hyperfoil.tools.seqdiag;

import io.hyperfoil.tools.seqdiag.model.Document;
import io.hyperfoil.tools.seqdiag.parse.SequenceParser;

import java.util.Arrays;
import java.util.stream.Collectors;

import static org.junit.Assert.assertFalse;

public class SeqdiagTestBase {

    public static String join(String...args){
        return Arrays.asList(args).stream().collect(Collectors.joining("\n"));
    }

    public static Document parse(String...lines){
        return SequenceParser.getInstance().parse(join(lines));
    }

    public static Document parseValid(String...lines){
        Document document = parse(lines);
        assertFalse("unexpected error "+document.getError(),document.hasError());
        return document;
    }
}
