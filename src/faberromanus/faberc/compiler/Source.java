package faberromanus.faberc.compiler;

public record Source(String file, int line, int startOffset, int endOffset) {

    public static final String SYNTHESIZED_FILE = "<synthesized>";

    public static final Source SYNTHESIZED = new Source(
        SYNTHESIZED_FILE, 0, 0, 0
    );

    public Source(Source start, Source end) {
        this(start.file, start.line, start.startOffset, end.endOffset);
        if(!start.file.equals(end.file)) {
            throw new IllegalArgumentException(
                "Provided source locations are not from the same file!"
            );
        }
    }

    public boolean isSynthesized() {
        return this.file.equals(SYNTHESIZED_FILE);
    }

    public boolean contains(int offset) {
        return this.startOffset <= offset && offset < this.endOffset;
    }

    @Override
    public String toString() {
        return "@\"" + this.file + "\":" + this.line;
    }

}
