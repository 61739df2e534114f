package faberromanus.faberc.compiler;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record Error(
    String message,
    Marking[] markings,
    Optional<String> hint
) {

    public static record Marking(Type type, Source location, String note) {

        public enum Type {
            ERROR('^', Color.RED),
            INFO('~', Color.BRIGHT_BLUE),
            HELP('*', Color.GREEN);

            private final char marker;
            private final Color color;

            private Type(char marker, Color color) {
                this.marker = marker;
                this.color = color;
            }
        }

        public static Marking error(Source location, String note) {
            return new Marking(Type.ERROR, location, note);
        }

        public static Marking info(Source location, String note) {
            return new Marking(Type.INFO, location, note);
        }

        public static Marking help(Source location, String note) {
            return new Marking(Type.HELP, location, note);
        }

    }

    public Error(String message, Marking... markings) {
        this(message, markings, Optional.empty());
    }

    public Error(String message, String hint, Marking... markings) {
        this(message, markings, Optional.of(hint));
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.message.equals(other.message)
            && Arrays.equals(this.markings, other.markings)
            && this.hint.equals(other.hint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            this.message, Arrays.hashCode(this.markings), this.hint
        );
    }

    @Override
    public String toString() {
        return this.render(Map.of(), false);
    }

    public String render(Map<String, String> files, boolean colored) {
        String errorWordColor = colored
            ? Color.escape(Color.BOLD, Color.RED) : "";
        String errorMessageColor = colored
            ? Color.escape(Color.RED) : "";
        String grayColor = colored
            ? Color.escape(Color.GRAY) : "";
        String resetColor = colored
            ? Color.escape() : "";
        StringBuilder output = new StringBuilder();
        output.append(errorWordColor);
        output.append("error: ");
        output.append(errorMessageColor);
        output.append(this.message);
        output.append(resetColor);
        output.append("\n");
        for(Marking marked: this.markings) {
            Source location = marked.location;
            String markingColor = colored
                ? Color.escape(marked.type.color) : "";
            String lineNumber = String.valueOf(location.line());
            String padding = " ".repeat(lineNumber.length() + 2);
            output.append(padding);
            output.append(grayColor);
            output.append("╭─ ");
            output.append(location.file());
            output.append(":");
            output.append(location.line());
            output.append(resetColor);
            output.append("\n");
            String fileContent = files.get(location.file());
            if(fileContent == null || location.isSynthesized()) {
                output.append(padding);
                output.append(grayColor);
                output.append("┊ ");
                output.append(markingColor);
                output.append(marked.note);
                output.append(resetColor);
                output.append("\n");
                continue;
            }
            int lineStart = Math.min(location.startOffset(), fileContent.length());
            while(lineStart > 0 && fileContent.charAt(lineStart - 1) != '\n') {
                lineStart -= 1;
            }
            int lineEnd = fileContent.indexOf('\n', lineStart);
            if(lineEnd == -1) { lineEnd = fileContent.length(); }
            String lineText = fileContent.substring(lineStart, lineEnd);
            int markStart = location.startOffset() - lineStart;
            int markEnd = Math.min(location.endOffset(), lineEnd) - lineStart;
            if(markEnd <= markStart) { markEnd = markStart + 1; }
            output.append(grayColor);
            output.append(" ");
            output.append(lineNumber);
            output.append(" │ ");
            output.append(resetColor);
            output.append(lineText);
            output.append("\n");
            output.append(padding);
            output.append(grayColor);
            output.append("┊ ");
            output.append(" ".repeat(Math.max(markStart, 0)));
            output.append(markingColor);
            output.append(String.valueOf(marked.type.marker)
                .repeat(markEnd - markStart));
            output.append(" ");
            output.append(marked.note);
            output.append(resetColor);
            output.append("\n");
        }
        if(this.hint.isPresent()) {
            output.append(colored? Color.escape(Color.BOLD, Color.GREEN) : "");
            output.append("help: ");
            output.append(resetColor);
            output.append(this.hint.get());
            output.append("\n");
        }
        return output.toString();
    }

}
