package faberromanus.faberc.compiler.canonical;

import faberromanus.faberc.compiler.Source;

public record Comment(Kind kind, String text, Source source) {

    public enum Kind {
        LINE,  // # ...
        BLOCK, // /* ... */
        DOC    // /** ... */
    }

    public int start() {
        return this.source.startOffset();
    }

    public int end() {
        return this.source.endOffset();
    }

}
