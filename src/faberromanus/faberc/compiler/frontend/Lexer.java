package faberromanus.faberc.compiler.frontend;

import java.util.function.Function;

import faberromanus.faberc.compiler.ErrorException;
import faberromanus.faberc.compiler.Source;

public class Lexer {

    private final String fileName;
    private final String fileContent;
    private final int endPos;

    private int currentPos;
    private int currentLine;
    private int tokenStartPos;
    private int tokenStartLine;

    public Lexer(String fileName, String fileContent) {
        this(fileName, fileContent, 0, fileContent.length(), 1);
    }

    /**
     * Creates a lexer that only reads the region between the given offsets
     * of the file, reporting positions relative to the whole file.
     */
    public Lexer(
        String fileName, String fileContent,
        int startPos, int endPos, int startLine
    ) {
        this.fileName = fileName;
        this.fileContent = fileContent;
        this.endPos = endPos;
        this.currentPos = startPos;
        this.currentLine = startLine;
    }

    public String fileName() {
        return this.fileName;
    }

    public String fileContent() {
        return this.fileContent;
    }

    public static boolean isDigit(char c) {
        return '0' <= c && c <= '9';
    }

    public static boolean isHexDigit(char c) {
        return Lexer.isDigit(c)
            || ('a' <= c && c <= 'f')
            || ('A' <= c && c <= 'F');
    }

    public static boolean isAlphanumeral(char c) {
        return ('0' <= c && c <= '9')
            || ('A' <= c && c <= 'Z')
            || ('a' <= c && c <= 'z')
            || c == '_'
            || (c > 127 && Character.isLetter(c));
    }

    public static boolean isWhitespace(char c) {
        return c == 9   // horizontal tab
            || c == 10  // line feed
            || c == 13  // carriage feed
            || c == 32; // space
    }

    private char current() {
        if(this.atEnd()) { return '\0'; }
        return this.fileContent.charAt(this.currentPos);
    }

    private char peek() {
        if(this.currentPos + 1 >= this.endPos) { return '\0'; }
        return this.fileContent.charAt(this.currentPos + 1);
    }

    private void next() {
        this.currentPos += 1;
    }

    public boolean atEnd() {
        return this.currentPos >= this.endPos;
    }

    // whether the character before the current one ends an operand
    // with no whitespace in between
    private boolean followsOperand() {
        if(this.currentPos == 0) { return false; }
        char before = this.fileContent.charAt(this.currentPos - 1);
        return Lexer.isAlphanumeral(before) || before == ')' || before == ']';
    }

    private int find(Function<Character, Boolean> f) {
        int pos = this.currentPos;
        while(true) {
            if(pos >= this.endPos) { break; }
            if(f.apply(this.fileContent.charAt(pos))) { break; }
            pos += 1;
        }
        return pos;
    }

    private Source tokenSource() {
        return new Source(
            this.fileName, this.tokenStartLine,
            this.tokenStartPos, this.currentPos
        );
    }

    private Token makeToken(String content, Token.Type type) {
        Token token = new Token(type, content, this.tokenSource());
        for(int i = this.tokenStartPos; i < this.currentPos; i += 1) {
            if(this.fileContent.charAt(i) == '\n') {
                this.currentLine += 1;
            }
        }
        return token;
    }

    private Token makeSymbol(String content, Token.Type type) {
        this.currentPos = this.tokenStartPos + content.length();
        return this.makeToken(content, type);
    }

    private ErrorException error(String message, String note) {
        int end = Math.min(this.currentPos + 1, this.fileContent.length());
        return ErrorException.at(
            new Source(
                this.fileName, this.tokenStartLine,
                this.tokenStartPos, Math.max(end, this.tokenStartPos + 1)
            ),
            message, note
        );
    }

    /** Whether the given word is reserved and cannot name anything. */
    public static boolean isKeyword(String word) {
        return Lexer.keywordType(word) != Token.Type.IDENTIFIER;
    }

    private static Token.Type keywordType(String content) {
        switch(content) {
            case "ex": return Token.Type.KEYWORD_EX;
            case "de": return Token.Type.KEYWORD_DE;
            case "importa": return Token.Type.KEYWORD_IMPORTA;
            case "ut": return Token.Type.KEYWORD_UT;
            case "varia": return Token.Type.KEYWORD_VARIA;
            case "fixum": return Token.Type.KEYWORD_FIXUM;
            case "figendum": return Token.Type.KEYWORD_FIGENDUM;
            case "variandum": return Token.Type.KEYWORD_VARIANDUM;
            case "functio": return Token.Type.KEYWORD_FUNCTIO;
            case "futura": return Token.Type.KEYWORD_FUTURA;
            case "cursor": return Token.Type.KEYWORD_CURSOR;
            case "fit": return Token.Type.KEYWORD_FIT;
            case "fiet": return Token.Type.KEYWORD_FIET;
            case "fiunt": return Token.Type.KEYWORD_FIUNT;
            case "fient": return Token.Type.KEYWORD_FIENT;
            case "typus": return Token.Type.KEYWORD_TYPUS;
            case "ordo": return Token.Type.KEYWORD_ORDO;
            case "discretio": return Token.Type.KEYWORD_DISCRETIO;
            case "genus": return Token.Type.KEYWORD_GENUS;
            case "implet": return Token.Type.KEYWORD_IMPLET;
            case "privatus": return Token.Type.KEYWORD_PRIVATUS;
            case "generis": return Token.Type.KEYWORD_GENERIS;
            case "pactum": return Token.Type.KEYWORD_PACTUM;
            case "si": return Token.Type.KEYWORD_SI;
            case "aliter": return Token.Type.KEYWORD_ALITER;
            case "secus": return Token.Type.KEYWORD_SECUS;
            case "sic": return Token.Type.KEYWORD_SIC;
            case "dum": return Token.Type.KEYWORD_DUM;
            case "pro": return Token.Type.KEYWORD_PRO;
            case "elige": return Token.Type.KEYWORD_ELIGE;
            case "discerne": return Token.Type.KEYWORD_DISCERNE;
            case "casu": return Token.Type.KEYWORD_CASU;
            case "custodi": return Token.Type.KEYWORD_CUSTODI;
            case "adfirma": return Token.Type.KEYWORD_ADFIRMA;
            case "redde": return Token.Type.KEYWORD_REDDE;
            case "rumpe": return Token.Type.KEYWORD_RUMPE;
            case "perge": return Token.Type.KEYWORD_PERGE;
            case "iace": return Token.Type.KEYWORD_IACE;
            case "mori": return Token.Type.KEYWORD_MORI;
            case "scribe": return Token.Type.KEYWORD_SCRIBE;
            case "vide": return Token.Type.KEYWORD_VIDE;
            case "mone": return Token.Type.KEYWORD_MONE;
            case "tempta": return Token.Type.KEYWORD_TEMPTA;
            case "cape": return Token.Type.KEYWORD_CAPE;
            case "demum": return Token.Type.KEYWORD_DEMUM;
            case "fac": return Token.Type.KEYWORD_FAC;
            case "et": return Token.Type.KEYWORD_ET;
            case "aut": return Token.Type.KEYWORD_AUT;
            case "vel": return Token.Type.KEYWORD_VEL;
            case "non": return Token.Type.KEYWORD_NON;
            case "est": return Token.Type.KEYWORD_EST;
            case "nulla": return Token.Type.KEYWORD_NULLA;
            case "nonnulla": return Token.Type.KEYWORD_NONNULLA;
            case "cede": return Token.Type.KEYWORD_CEDE;
            case "novum": return Token.Type.KEYWORD_NOVUM;
            case "qua": return Token.Type.KEYWORD_QUA;
            case "ego": return Token.Type.KEYWORD_EGO;
            case "verum": return Token.Type.KEYWORD_VERUM;
            case "falsum": return Token.Type.KEYWORD_FALSUM;
            case "nihil": return Token.Type.KEYWORD_NIHIL;
            case "ceteri": return Token.Type.KEYWORD_CETERI;
            case "sparge": return Token.Type.KEYWORD_SPARGE;
            case "praefixum": return Token.Type.KEYWORD_PRAEFIXUM;
            case "scriptum": return Token.Type.KEYWORD_SCRIPTUM;
            case "finge": return Token.Type.KEYWORD_FINGE;
            case "ante": return Token.Type.KEYWORD_ANTE;
            case "usque": return Token.Type.KEYWORD_USQUE;
            case "per": return Token.Type.KEYWORD_PER;
            case "cura": return Token.Type.KEYWORD_CURA;
            case "praepara": return Token.Type.KEYWORD_PRAEPARA;
            case "praeparabit": return Token.Type.KEYWORD_PRAEPARABIT;
            case "postpara": return Token.Type.KEYWORD_POSTPARA;
            case "postparabit": return Token.Type.KEYWORD_POSTPARABIT;
            case "incipit": return Token.Type.KEYWORD_INCIPIT;
            case "incipiet": return Token.Type.KEYWORD_INCIPIET;
            case "in": return Token.Type.KEYWORD_IN;
            case "probandum": return Token.Type.KEYWORD_PROBANDUM;
            case "proba": return Token.Type.KEYWORD_PROBA;
            case "sed": return Token.Type.KEYWORD_SED;
            default: return Token.Type.IDENTIFIER;
        }
    }

    private Token lexString(char quote) throws ErrorException {
        this.next();
        StringBuilder content = new StringBuilder();
        boolean escaped = false;
        while(escaped || this.current() != quote) {
            if(this.atEnd() || (!escaped && this.current() == '\n')) {
                throw this.error("Unclosed string literal", "starts here");
            }
            if(escaped) {
                char a = this.current();
                switch(a) {
                    case '0': a = 0; break;  // null
                    case 't': a = 9; break;  // horizontal tab
                    case 'n': a = 10; break; // line feed
                    case 'r': a = 13; break; // carriage feed
                    case 'x': {
                        int value = 0;
                        for(int digitI = 0; digitI < 2; digitI += 1) {
                            this.next();
                            if(!Lexer.isHexDigit(this.current())) {
                                throw this.error(
                                    "Invalid hexadecimal character escape",
                                    "should be [0-9], [a-f] or [A-F]"
                                );
                            }
                            value = value * 16
                                + Character.digit(this.current(), 16);
                        }
                        a = (char) value;
                    } break;
                    default: break;
                }
                content.append(a);
                escaped = false;
            } else {
                escaped = this.current() == '\\';
                if(!escaped) { content.append(this.current()); }
            }
            this.next();
        }
        this.next();
        return this.makeToken(content.toString(), Token.Type.STRING);
    }

    private Token lexTemplate() throws ErrorException {
        this.next();
        int depth = 0;
        while(depth > 0 || this.current() != '`') {
            if(this.atEnd()) {
                throw this.error("Unclosed template string", "starts here");
            }
            char c = this.current();
            if(c == '\\') {
                this.next();
            } else if(c == '$' && this.peek() == '{') {
                depth += 1;
                this.next();
            } else if(c == '}' && depth > 0) {
                depth -= 1;
            }
            this.next();
        }
        this.next();
        String raw = this.fileContent.substring(
            this.tokenStartPos + 1, this.currentPos - 1
        );
        return this.makeToken(raw, Token.Type.TEMPLATE);
    }

    private Token lexComment() {
        boolean isBlock = this.current() == '/';
        if(!isBlock) {
            int endIdx = this.find(c -> c == '\n' || c == '\r');
            this.currentPos = endIdx;
            return this.makeToken(
                this.fileContent.substring(this.tokenStartPos, endIdx),
                Token.Type.COMMENT
            );
        }
        boolean isDoc = this.currentPos + 2 < this.endPos
            && this.fileContent.charAt(this.currentPos + 2) == '*'
            && !(this.currentPos + 3 < this.endPos
                && this.fileContent.charAt(this.currentPos + 3) == '/');
        int close = this.fileContent.indexOf("*/", this.currentPos + 2);
        this.currentPos = close == -1 || close + 2 > this.endPos
            ? this.endPos
            : close + 2;
        return this.makeToken(
            this.fileContent.substring(this.tokenStartPos, this.currentPos),
            isDoc? Token.Type.DOC_COMMENT : Token.Type.COMMENT
        );
    }

    public Token nextToken() throws ErrorException {
        this.tokenStartPos = this.currentPos;
        this.tokenStartLine = this.currentLine;
        if(this.atEnd()) {
            return new Token(
                Token.Type.FILE_END, "", new Source(
                    this.fileName, this.currentLine,
                    this.currentPos, this.currentPos
                )
            );
        }
        if(Lexer.isWhitespace(this.current())) {
            int endIdx = this.find(c -> !Lexer.isWhitespace(c));
            this.currentPos = endIdx;
            return this.makeToken(
                this.fileContent.substring(this.tokenStartPos, endIdx),
                Token.Type.WHITESPACE
            );
        }
        if(Lexer.isDigit(this.current())) {
            if(this.current() == '0'
                    && (this.peek() == 'x' || this.peek() == 'X')) {
                this.next();
                this.next();
                if(!Lexer.isHexDigit(this.current())) {
                    throw this.error(
                        "Incomplete hexadecimal number",
                        "expected [0-9], [a-f] or [A-F] after '0x'"
                    );
                }
                this.currentPos = this.find(c -> !Lexer.isHexDigit(c));
            } else {
                boolean isFraction = false;
                while(!this.atEnd() && (
                    Lexer.isDigit(this.current()) || (
                        this.current() == '.' && Lexer.isDigit(this.peek())
                            && !isFraction
                    )
                )) {
                    if(this.current() == '.') { isFraction = true; }
                    this.next();
                }
            }
            return this.makeToken(
                this.fileContent.substring(
                    this.tokenStartPos, this.currentPos
                ),
                Token.Type.NUMBER
            );
        }
        if(this.current() == '"' || this.current() == '\'') {
            return this.lexString(this.current());
        }
        if(this.current() == '`') {
            return this.lexTemplate();
        }
        if(this.current() == '#'
                || (this.current() == '/' && this.peek() == '*')) {
            return this.lexComment();
        }
        if(Lexer.isAlphanumeral(this.current())) {
            int endIdx = this.find(c -> !Lexer.isAlphanumeral(c));
            String content = this.fileContent.substring(
                this.currentPos, endIdx
            );
            this.currentPos = endIdx;
            return this.makeToken(content, Lexer.keywordType(content));
        }
        char c = this.current();
        char p = this.peek();
        char pp = this.currentPos + 2 < this.endPos
            ? this.fileContent.charAt(this.currentPos + 2) : '\0';
        switch(c) {
            case '=':
                if(p == '=' && pp == '=') {
                    return this.makeSymbol("===", Token.Type.TRIPLE_EQUALS);
                }
                if(p == '=') {
                    return this.makeSymbol("==", Token.Type.DOUBLE_EQUALS);
                }
                if(p == '>') {
                    return this.makeSymbol("=>", Token.Type.FAT_ARROW);
                }
                return this.makeSymbol("=", Token.Type.EQUALS);
            case '!':
                if(p == '=' && pp == '=') {
                    return this.makeSymbol(
                        "!==", Token.Type.NOT_DOUBLE_EQUALS
                    );
                }
                if(p == '=') {
                    return this.makeSymbol("!=", Token.Type.NOT_EQUALS);
                }
                if(this.followsOperand()) {
                    if(p == '.') {
                        return this.makeSymbol(
                            "!.", Token.Type.EXCLAMATION_DOT
                        );
                    }
                    if(p == '[') {
                        return this.makeSymbol(
                            "![", Token.Type.EXCLAMATION_BRACKET
                        );
                    }
                    if(p == '(') {
                        return this.makeSymbol(
                            "!(", Token.Type.EXCLAMATION_PAREN
                        );
                    }
                }
                return this.makeSymbol("!", Token.Type.EXCLAMATION_MARK);
            case '?':
                if(p == '?') {
                    return this.makeSymbol(
                        "??", Token.Type.DOUBLE_QUESTION_MARK
                    );
                }
                if(this.followsOperand()) {
                    if(p == '.') {
                        return this.makeSymbol("?.", Token.Type.QUESTION_DOT);
                    }
                    if(p == '[') {
                        return this.makeSymbol(
                            "?[", Token.Type.QUESTION_BRACKET
                        );
                    }
                    if(p == '(') {
                        return this.makeSymbol(
                            "?(", Token.Type.QUESTION_PAREN
                        );
                    }
                }
                return this.makeSymbol("?", Token.Type.QUESTION_MARK);
            case '<':
                if(p == '<') {
                    return this.makeSymbol("<<", Token.Type.SHIFT_LEFT);
                }
                if(p == '=') {
                    return this.makeSymbol("<=", Token.Type.LESS_THAN_EQUAL);
                }
                return this.makeSymbol("<", Token.Type.LESS_THAN);
            case '>':
                if(p == '>') {
                    return this.makeSymbol(">>", Token.Type.SHIFT_RIGHT);
                }
                if(p == '=') {
                    return this.makeSymbol(
                        ">=", Token.Type.GREATER_THAN_EQUAL
                    );
                }
                return this.makeSymbol(">", Token.Type.GREATER_THAN);
            case '.':
                if(p == '.') {
                    return this.makeSymbol("..", Token.Type.DOUBLE_DOT);
                }
                return this.makeSymbol(".", Token.Type.DOT);
            case '-':
                if(p == '>') {
                    return this.makeSymbol("->", Token.Type.ARROW);
                }
                if(p == '=') {
                    return this.makeSymbol("-=", Token.Type.MINUS_EQUALS);
                }
                return this.makeSymbol("-", Token.Type.MINUS);
            case '+':
                if(p == '=') {
                    return this.makeSymbol("+=", Token.Type.PLUS_EQUALS);
                }
                return this.makeSymbol("+", Token.Type.PLUS);
            case '*':
                if(p == '=') {
                    return this.makeSymbol("*=", Token.Type.ASTERISK_EQUALS);
                }
                return this.makeSymbol("*", Token.Type.ASTERISK);
            case '/':
                if(p == '=') {
                    return this.makeSymbol("/=", Token.Type.SLASH_EQUALS);
                }
                return this.makeSymbol("/", Token.Type.SLASH);
            case '&':
                if(p == '&') {
                    return this.makeSymbol("&&", Token.Type.DOUBLE_AMPERSAND);
                }
                if(p == '=') {
                    return this.makeSymbol(
                        "&=", Token.Type.AMPERSAND_EQUALS
                    );
                }
                return this.makeSymbol("&", Token.Type.AMPERSAND);
            case '|':
                if(p == '|') {
                    return this.makeSymbol("||", Token.Type.DOUBLE_PIPE);
                }
                if(p == '=') {
                    return this.makeSymbol("|=", Token.Type.PIPE_EQUALS);
                }
                return this.makeSymbol("|", Token.Type.PIPE);
            case '%': return this.makeSymbol("%", Token.Type.PERCENT);
            case '^': return this.makeSymbol("^", Token.Type.CARET);
            case '~': return this.makeSymbol("~", Token.Type.TILDE);
            case ':': return this.makeSymbol(":", Token.Type.COLON);
            case ',': return this.makeSymbol(",", Token.Type.COMMA);
            case ';': return this.makeSymbol(";", Token.Type.SEMICOLON);
            case '(': return this.makeSymbol("(", Token.Type.PAREN_OPEN);
            case ')': return this.makeSymbol(")", Token.Type.PAREN_CLOSE);
            case '[': return this.makeSymbol("[", Token.Type.BRACKET_OPEN);
            case ']': return this.makeSymbol("]", Token.Type.BRACKET_CLOSE);
            case '{': return this.makeSymbol("{", Token.Type.BRACE_OPEN);
            case '}': return this.makeSymbol("}", Token.Type.BRACE_CLOSE);
            default: break;
        }
        throw this.error(
            "Invalid character",
            "'" + c + "' is not a valid character"
        );
    }

    public Token nextFilteredToken() throws ErrorException {
        while(true) {
            Token c = this.nextToken();
            boolean keep = c.type != Token.Type.WHITESPACE
                && c.type != Token.Type.COMMENT
                && c.type != Token.Type.DOC_COMMENT;
            if(keep) { return c; }
        }
    }

}
