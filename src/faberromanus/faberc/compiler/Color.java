package faberromanus.faberc.compiler;

/** Terminal styles used when rendering errors. */
public enum Color {
    BOLD("1"),
    RED("31"),
    GREEN("32"),
    GRAY("90"),
    BRIGHT_BLUE("94");

    private final String code;

    private Color(String code) {
        this.code = code;
    }

    /**
     * The escape sequence that resets all styles and then applies the
     * given ones. Without styles it only resets.
     */
    public static String escape(Color... styles) {
        StringBuilder out = new StringBuilder("\033[0");
        for(Color style: styles) {
            out.append(";").append(style.code);
        }
        return out.append("m").toString();
    }

}
