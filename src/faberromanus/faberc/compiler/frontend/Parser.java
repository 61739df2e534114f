package faberromanus.faberc.compiler.frontend;

import java.util.ArrayList;
import java.util.List;

import faberromanus.faberc.compiler.ErrorException;
import faberromanus.faberc.compiler.Source;

public abstract class Parser {

    protected final Lexer lexer;
    private final List<Token> tokens;
    private int position;
    protected Token current;
    protected Token previous;

    public Parser(Lexer lexer) throws ErrorException {
        this.lexer = lexer;
        this.tokens = new ArrayList<>();
        while(true) {
            Token token = lexer.nextFilteredToken();
            this.tokens.add(token);
            if(token.type == Token.Type.FILE_END) { break; }
        }
        this.position = 0;
        this.current = this.tokens.get(0);
        this.previous = this.current;
    }

    protected void throwUnexpected(String expected) throws ErrorException {
        throw ErrorException.at(
            this.current.source, "Unexpected syntax",
            "expected " + expected + ", but " + (
                this.current.type == Token.Type.FILE_END
                    ? "reached the end of the file"
                    : "got '" + this.current.content + "' instead"
            )
        );
    }

    protected void next() {
        this.previous = this.current;
        if(this.position < this.tokens.size() - 1) {
            this.position += 1;
        }
        this.current = this.tokens.get(this.position);
    }

    protected Token peek(int offset) {
        int index = Math.min(this.position + offset, this.tokens.size() - 1);
        return this.tokens.get(index);
    }

    protected int mark() {
        return this.position;
    }

    protected void reset(int mark) {
        this.position = mark;
        this.current = this.tokens.get(mark);
        this.previous = mark > 0? this.tokens.get(mark - 1) : this.current;
    }

    /**
     * Splits a '>>' token into two '>' tokens, so that nested type
     * arguments can be closed one at a time.
     */
    protected void splitShiftRight() {
        if(this.current.type != Token.Type.SHIFT_RIGHT) { return; }
        Source s = this.current.source;
        Token first = new Token(
            Token.Type.GREATER_THAN, ">",
            new Source(s.file(), s.line(), s.startOffset(), s.startOffset() + 1)
        );
        Token second = new Token(
            Token.Type.GREATER_THAN, ">",
            new Source(s.file(), s.line(), s.startOffset() + 1, s.endOffset())
        );
        this.tokens.set(this.position, first);
        this.tokens.add(this.position + 1, second);
        this.current = first;
    }

    protected boolean accept(Token.Type type) {
        if(this.current.type != type) { return false; }
        this.next();
        return true;
    }

    protected void expect(Token.Type... allowedTypes) throws ErrorException {
        if(!List.of(allowedTypes).contains(this.current.type)) {
            StringBuilder expected = new StringBuilder();
            for(int expIdx = 0; expIdx < allowedTypes.length; expIdx += 1) {
                if(expIdx > 0) { expected.append(
                    expIdx < allowedTypes.length - 1? ", " : " or "
                ); }
                expected.append(allowedTypes[expIdx].description);
            }
            this.throwUnexpected(expected.toString());
        }
    }

    protected Token consume(Token.Type... allowedTypes) throws ErrorException {
        this.expect(allowedTypes);
        Token token = this.current;
        this.next();
        return token;
    }

}
