package faberromanus.faberc.compiler.backend;

/**
 * Rendering of string values as double-quoted literals, which both
 * targets accept with the same escapes.
 */
public class Literals {

    private Literals() {}

    public static String escape(String value) {
        StringBuilder out = new StringBuilder();
        for(int i = 0; i < value.length(); i += 1) {
            char c = value.charAt(i);
            switch(c) {
                case '\\': out.append("\\\\"); break;
                case '"': out.append("\\\""); break;
                case '\n': out.append("\\n"); break;
                case '\t': out.append("\\t"); break;
                case '\r': out.append("\\r"); break;
                default: {
                    if(c < 0x20) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }

    public static String quote(String value) {
        return "\"" + Literals.escape(value) + "\"";
    }

}
