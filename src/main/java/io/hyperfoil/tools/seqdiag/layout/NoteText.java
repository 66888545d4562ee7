package io.hyperfoil.tools.seqdiag.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrapping for note text using a fixed number of characters per line.
 */
public class NoteText {

    private NoteText(){}

    /**
     * Wraps each line of <code>text</code> separately. Blank lines are kept and words longer than a line are split.
     */
    public static List<String> wrap(String text, int maxChars){
        List<String> rtrn = new ArrayList<>();
        if(text == null){
            return rtrn;
        }
        int limit = Math.max(1,maxChars);
        for(String line : text.split("\n",-1)){
            wrapLine(line.trim(),limit,rtrn);
        }
        return rtrn;
    }

    private static void wrapLine(String line, int limit, List<String> lines){
        if(line.isEmpty()){
            lines.add("");
            return;
        }
        StringBuilder current = new StringBuilder();
        for(String word : line.split("\\s+")){
            while(word.length() > limit){
                if(current.length() > 0){
                    lines.add(current.toString());
                    current.setLength(0);
                }
                lines.add(word.substring(0,limit));
                word = word.substring(limit);
            }
            if(word.isEmpty()){
                continue;
            }
            if(current.length() == 0){
                current.append(word);
            }else if(current.length() + 1 + word.length() <= limit){
                current.append(' ').append(word);
            }else{
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        if(current.length() > 0){
            lines.add(current.toString());
        }
    }

    public static int longest(List<String> lines){
        return lines.stream().mapToInt(String::length).max().orElse(0);
    }
}
