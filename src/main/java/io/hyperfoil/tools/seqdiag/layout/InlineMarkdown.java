package io.hyperfoil.tools.seqdiag.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one line of note text into styled spans. Supports <code>**bold**</code>, <code>*italic*</code>,
 * <code>_italic_</code>, <code>`code`</code>, <code>[text](url)</code> and bare http, https and www. links.
 * Markers do not nest.
 */
public class InlineMarkdown {

    public static class Span {
        private final String text;
        private final boolean bold;
        private final boolean italic;
        private final boolean code;
        private final String href;

        public Span(String text, boolean bold, boolean italic, boolean code, String href){
            this.text = text;
            this.bold = bold;
            this.italic = italic;
            this.code = code;
            this.href = href;
        }

        public static Span plain(String text){return new Span(text,false,false,false,null);}

        public String getText(){return text;}
        public boolean isBold(){return bold;}
        public boolean isItalic(){return italic;}
        public boolean isCode(){return code;}
        public String getHref(){return href;}
        public boolean isLink(){return href != null;}
        public boolean isPlain(){return !bold && !italic && !code && href == null;}

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Span span = (Span) o;
            return bold == span.bold && italic == span.italic && code == span.code && text.equals(span.text) && Objects.equals(href, span.href);
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, bold, italic, code, href);
        }

        @Override
        public String toString(){
            StringBuilder sb = new StringBuilder();
            if(bold) sb.append("b:");
            if(italic) sb.append("i:");
            if(code) sb.append("c:");
            sb.append(text);
            if(href != null) sb.append("->").append(href);
            return sb.toString();
        }
    }

    private static final Pattern TOKEN = Pattern.compile(
            "\\*\\*(?<bold>.+?)\\*\\*"+
            "|`(?<code>[^`]+)`"+
            "|\\[(?<linkText>[^\\]]+)\\]\\((?<linkHref>[^)\\s]+)\\)"+
            "|(?<url>(?:https?://|www\\.)[^\\s)\\]]+)"+
            "|\\*(?<star>[^*]+)\\*"+
            "|(?<![\\w])_(?<under>[^_]+)_(?![\\w])"
    );

    private InlineMarkdown(){}

    public static List<Span> parse(String line){
        if(line == null || line.isEmpty()){
            return Collections.emptyList();
        }
        List<Span> rtrn = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(line);
        int last = 0;
        while(matcher.find()){
            if(matcher.start() > last){
                rtrn.add(Span.plain(line.substring(last,matcher.start())));
            }
            if(matcher.group("bold") != null){
                rtrn.add(new Span(matcher.group("bold"),true,false,false,null));
            }else if(matcher.group("code") != null){
                rtrn.add(new Span(matcher.group("code"),false,false,true,null));
            }else if(matcher.group("linkText") != null){
                rtrn.add(new Span(matcher.group("linkText"),false,false,false,href(matcher.group("linkHref"))));
            }else if(matcher.group("url") != null){
                String url = stripTrailingPunctuation(matcher.group("url"));
                rtrn.add(new Span(url,false,false,false,href(url)));
                //punctuation after a url stays plain text
                if(url.length() < matcher.group("url").length()){
                    rtrn.add(Span.plain(matcher.group("url").substring(url.length())));
                }
            }else if(matcher.group("star") != null){
                rtrn.add(new Span(matcher.group("star"),false,true,false,null));
            }else{
                rtrn.add(new Span(matcher.group("under"),false,true,false,null));
            }
            last = matcher.end();
        }
        if(last < line.length()){
            rtrn.add(Span.plain(line.substring(last)));
        }
        return rtrn;
    }

    static String href(String url){
        return url.startsWith("www.") ? "https://"+url : url;
    }

    private static String stripTrailingPunctuation(String url){
        int end = url.length();
        while(end > 0 && ".,;:!?".indexOf(url.charAt(end-1)) >= 0){
            end--;
        }
        return url.substring(0,end);
    }
}
