package faberromanus.faberc.compiler.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * A layout document. Documents describe text together with the places
 * where it may be broken onto multiple lines, and are turned into text
 * by {@link DocRenderer}.
 */
public final class Doc {

    public static record Text(
        String text
    ) {}

    public static record Nested(
        Doc content
    ) {}

    public static record Concat(
        List<Doc> parts
    ) {}

    public enum Type {
        TEXT,     // Text
        LINE,     // = null, a space if the enclosing group fits
        SOFTLINE, // = null, nothing if the enclosing group fits
        HARDLINE, // = null, always a line break
        INDENT,   // Nested
        GROUP,    // Nested
        CONCAT    // Concat
    }

    public static final Doc EMPTY = new Doc(Type.CONCAT, new Concat(List.of()));
    public static final Doc LINE = new Doc(Type.LINE, null);
    public static final Doc SOFTLINE = new Doc(Type.SOFTLINE, null);
    public static final Doc HARDLINE = new Doc(Type.HARDLINE, null);

    public final Type type;
    private final Object value;

    private Doc(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public static Doc text(String text) {
        if(text.indexOf('\n') != -1) {
            throw new IllegalArgumentException(
                "Text documents may not contain line breaks!"
            );
        }
        return new Doc(Type.TEXT, new Text(text));
    }

    /**
     * Text that is printed exactly as given, even across line breaks.
     * Lines after the first are not indented.
     */
    public static Doc literal(String text) {
        return new Doc(Type.TEXT, new Text(text));
    }

    public static Doc indent(Doc... content) {
        return new Doc(Type.INDENT, new Nested(Doc.concat(content)));
    }

    public static Doc group(Doc... content) {
        return new Doc(Type.GROUP, new Nested(Doc.concat(content)));
    }

    public static Doc concat(Doc... parts) {
        if(parts.length == 1) { return parts[0]; }
        return new Doc(Type.CONCAT, new Concat(List.of(parts)));
    }

    public static Doc concat(List<Doc> parts) {
        return Doc.concat(parts.toArray(new Doc[0]));
    }

    /** Places the separator between each two of the given documents. */
    public static Doc join(Doc separator, List<Doc> docs) {
        List<Doc> parts = new ArrayList<>();
        for(int i = 0; i < docs.size(); i += 1) {
            if(i > 0) { parts.add(separator); }
            parts.add(docs.get(i));
        }
        return Doc.concat(parts);
    }

    /** Whether rendering this document always produces a line break. */
    public boolean hasHardline() {
        switch(this.type) {
            case HARDLINE: return true;
            case TEXT: return this.<Text>getValue().text().indexOf('\n') != -1;
            case INDENT:
            case GROUP:
                return this.<Nested>getValue().content().hasHardline();
            case CONCAT: {
                for(Doc part: this.<Concat>getValue().parts()) {
                    if(part.hasHardline()) { return true; }
                }
                return false;
            }
            default: return false;
        }
    }

    @Override
    public String toString() {
        switch(this.type) {
            case TEXT: return "\"" + this.<Text>getValue().text() + "\"";
            case LINE: return "line";
            case SOFTLINE: return "softline";
            case HARDLINE: return "hardline";
            case INDENT:
                return "indent(" + this.<Nested>getValue().content() + ")";
            case GROUP:
                return "group(" + this.<Nested>getValue().content() + ")";
            case CONCAT: return this.<Concat>getValue().parts().toString();
            default: throw new IllegalStateException("unhandled doc type!");
        }
    }

}
