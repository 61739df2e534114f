package faberromanus.faberc.compiler.frontend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import faberromanus.faberc.compiler.ErrorException;

class LexerTest {

    private static List<Token> tokens(String text) throws ErrorException {
        Lexer lexer = new Lexer("test.fab", text);
        List<Token> tokens = new ArrayList<>();
        while(true) {
            Token token = lexer.nextFilteredToken();
            tokens.add(token);
            if(token.type == Token.Type.FILE_END) { return tokens; }
        }
    }

    private static List<Token.Type> types(String text) throws ErrorException {
        List<Token.Type> types = new ArrayList<>();
        for(Token token: LexerTest.tokens(text)) {
            types.add(token.type);
        }
        return types;
    }

    @Test
    void lexesAVariableDeclaration() throws ErrorException {
        assertThat(LexerTest.types("fixum numerus x = 1 # the answer"))
            .containsExactly(
                Token.Type.KEYWORD_FIXUM,
                Token.Type.IDENTIFIER,
                Token.Type.IDENTIFIER,
                Token.Type.EQUALS,
                Token.Type.NUMBER,
                Token.Type.FILE_END
            );
    }

    @Test
    void keepsCommentsWhenUnfiltered() throws ErrorException {
        Lexer lexer = new Lexer("test.fab", "# line\n/* block */ /** doc */");
        List<Token.Type> types = new ArrayList<>();
        while(true) {
            Token token = lexer.nextToken();
            if(token.type == Token.Type.FILE_END) { break; }
            if(token.type != Token.Type.WHITESPACE) { types.add(token.type); }
        }
        assertThat(types).containsExactly(
            Token.Type.COMMENT, Token.Type.COMMENT, Token.Type.DOC_COMMENT
        );
    }

    @Test
    void emptyBlockCommentIsNoDocComment() throws ErrorException {
        Token token = new Lexer("test.fab", "/**/").nextToken();
        assertThat(token.type).isEqualTo(Token.Type.COMMENT);
        assertThat(token.content).isEqualTo("/**/");
    }

    @Test
    void decodesStringEscapes() throws ErrorException {
        Token token = LexerTest.tokens("\"a\\tb\\n\\x41\"").get(0);
        assertThat(token.type).isEqualTo(Token.Type.STRING);
        assertThat(token.content).isEqualTo("a\tb\nA");
    }

    @Test
    void keepsContextualWordsAsIdentifiers() throws ErrorException {
        assertThat(LexerTest.types("cura post omnia in lege lineam sed"))
            .containsExactly(
                Token.Type.KEYWORD_CURA,
                Token.Type.IDENTIFIER,
                Token.Type.IDENTIFIER,
                Token.Type.KEYWORD_IN,
                Token.Type.IDENTIFIER,
                Token.Type.IDENTIFIER,
                Token.Type.KEYWORD_SED,
                Token.Type.FILE_END
            );
    }

    @Test
    void keepsTemplateTextRaw() throws ErrorException {
        Token token = LexerTest.tokens("`sum: ${a + b}`").get(0);
        assertThat(token.type).isEqualTo(Token.Type.TEMPLATE);
        assertThat(token.content).isEqualTo("sum: ${a + b}");
    }

    @Test
    void readsAccessOperatorsOnlyAfterOperands() throws ErrorException {
        assertThat(LexerTest.types("a?.b c!.d"))
            .contains(Token.Type.QUESTION_DOT, Token.Type.EXCLAMATION_DOT);
        assertThat(LexerTest.types("x ? y : z"))
            .contains(Token.Type.QUESTION_MARK)
            .doesNotContain(Token.Type.QUESTION_DOT);
    }

    @Test
    void lexesFractionsAndRanges() throws ErrorException {
        List<Token> tokens = LexerTest.tokens("1.5 0..10");
        assertThat(tokens.get(0).content).isEqualTo("1.5");
        assertThat(tokens.get(1).content).isEqualTo("0");
        assertThat(tokens.get(2).type).isEqualTo(Token.Type.DOUBLE_DOT);
        assertThat(tokens.get(3).content).isEqualTo("10");
    }

    @Test
    void tracksLineNumbers() throws ErrorException {
        List<Token> tokens = LexerTest.tokens("a\n\nb");
        assertThat(tokens.get(0).source.line()).isEqualTo(1);
        assertThat(tokens.get(1).source.line()).isEqualTo(3);
    }

    @Test
    void reportsUnclosedStrings() {
        assertThatThrownBy(() -> LexerTest.tokens("\"open"))
            .isInstanceOf(ErrorException.class)
            .hasMessage("Unclosed string literal");
    }

    @Test
    void reportsInvalidCharacters() {
        assertThatThrownBy(() -> LexerTest.tokens("a @ b"))
            .isInstanceOf(ErrorException.class)
            .hasMessage("Invalid character");
    }

    @Test
    void knowsReservedWords() {
        assertThat(Lexer.isKeyword("fixum")).isTrue();
        assertThat(Lexer.isKeyword("discerne")).isTrue();
        assertThat(Lexer.isKeyword("numerus")).isFalse();
        assertThat(Lexer.isKeyword("count")).isFalse();
    }

}
