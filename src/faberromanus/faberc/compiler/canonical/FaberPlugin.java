package faberromanus.faberc.compiler.canonical;

import faberromanus.faberc.compiler.ErrorException;
import faberromanus.faberc.compiler.Options;
import faberromanus.faberc.compiler.frontend.AstNode;
import faberromanus.faberc.compiler.frontend.Lexer;
import faberromanus.faberc.compiler.frontend.SourceParser;
import faberromanus.faberc.compiler.layout.Doc;
import faberromanus.faberc.compiler.layout.FormatterPlugin;

/**
 * Formats Faber source. Comments are collected while parsing and kept
 * until the parsed tree is printed, so one instance formats one file at
 * a time.
 */
public class FaberPlugin implements FormatterPlugin<AstNode> {

    private final Options options;
    private String text = null;
    private CommentAttacher.Attached comments = CommentAttacher.Attached.NONE;

    public FaberPlugin(Options options) {
        this.options = options;
    }

    @Override
    public AstNode parse(String fileName, String text) throws ErrorException {
        AstNode program = new SourceParser(new Lexer(fileName, text))
            .parseProgram();
        this.attach(program, text);
        return program;
    }

    /** Collects the comments of the text the given tree was parsed from. */
    public void attach(AstNode program, String text) throws ErrorException {
        this.text = text;
        this.comments = CommentAttacher.attach(
            program, CommentScanner.scan(program.source.file(), text), text
        );
    }

    @Override
    public Doc print(AstNode root) {
        return new FabPrinter(this.options, this.text, this.comments)
            .print(root);
    }

    @Override
    public int locStart(AstNode node) {
        return node.source.startOffset();
    }

    @Override
    public int locEnd(AstNode node) {
        return node.source.endOffset();
    }

}
