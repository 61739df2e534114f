package faberromanus.faberc.compiler.layout;

import faberromanus.faberc.compiler.ErrorException;

/**
 * A language that can be formatted. A plugin turns source text into a
 * tree and the tree into a layout document.
 *
 * @param <N> the node type of the language's syntax tree
 */
public interface FormatterPlugin<N> {

    N parse(String fileName, String text) throws ErrorException;

    Doc print(N root);

    /** The offset in the source text at which the given node starts. */
    int locStart(N node);

    /** The offset in the source text just past the end of the given node. */
    int locEnd(N node);

}
