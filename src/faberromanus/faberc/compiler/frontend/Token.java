package faberromanus.faberc.compiler.frontend;

import faberromanus.faberc.compiler.Source;

public class Token {

    public enum Type {
        WHITESPACE("a whitespace"),
        COMMENT("a comment"),
        DOC_COMMENT("a documentation comment"),
        FILE_END("the end of the file"),

        IDENTIFIER("an identifier"),
        NUMBER("a number"),
        STRING("a string"),
        TEMPLATE("a template string"),
        EQUALS("'='", 16),
        PLUS_EQUALS("'+='", 16),
        MINUS_EQUALS("'-='", 16),
        ASTERISK_EQUALS("'*='", 16),
        SLASH_EQUALS("'/='", 16),
        AMPERSAND_EQUALS("'&='", 16),
        PIPE_EQUALS("'|='", 16),
        QUESTION_MARK("'?'", 15),
        COLON("':'"),
        DOUBLE_PIPE("'||'", 14),
        DOUBLE_QUESTION_MARK("'??'", 14),
        DOUBLE_AMPERSAND("'&&'", 13),
        DOUBLE_EQUALS("'=='", 12),
        NOT_EQUALS("'!='", 12),
        TRIPLE_EQUALS("'==='", 12),
        NOT_DOUBLE_EQUALS("'!=='", 12),
        LESS_THAN("'<'", 11),
        GREATER_THAN("'>'", 11),
        LESS_THAN_EQUAL("'<='", 11),
        GREATER_THAN_EQUAL("'>='", 11),
        PIPE("'|'", 10),
        CARET("'^'", 9),
        AMPERSAND("'&'", 8),
        SHIFT_LEFT("'<<'", 7),
        SHIFT_RIGHT("'>>'", 7),
        DOUBLE_DOT("'..'", 6),
        PLUS("'+'", 5),
        MINUS("'-'", 5),
        ASTERISK("'*'", 4),
        SLASH("'/'", 4),
        PERCENT("'%'", 4),
        TILDE("'~'"),
        EXCLAMATION_MARK("'!'"),
        DOT("'.'", 1),
        QUESTION_DOT("'?.'", 1),
        QUESTION_BRACKET("'?['", 1),
        QUESTION_PAREN("'?('", 1),
        EXCLAMATION_DOT("'!.'", 1),
        EXCLAMATION_BRACKET("'!['", 1),
        EXCLAMATION_PAREN("'!('", 1),
        COMMA("','"),
        SEMICOLON("';'"),
        ARROW("'->'"),
        FAT_ARROW("'=>'"),
        PAREN_OPEN("'('", 1),
        PAREN_CLOSE("')'"),
        BRACKET_OPEN("'['", 1),
        BRACKET_CLOSE("']'"),
        BRACE_OPEN("'{'"),
        BRACE_CLOSE("'}'"),

        KEYWORD_EX("'ex'"),
        KEYWORD_DE("'de'"),
        KEYWORD_IMPORTA("'importa'"),
        KEYWORD_UT("'ut'"),
        KEYWORD_VARIA("'varia'"),
        KEYWORD_FIXUM("'fixum'"),
        KEYWORD_FIGENDUM("'figendum'"),
        KEYWORD_VARIANDUM("'variandum'"),
        KEYWORD_FUNCTIO("'functio'"),
        KEYWORD_FUTURA("'futura'"),
        KEYWORD_CURSOR("'cursor'"),
        KEYWORD_FIT("'fit'"),
        KEYWORD_FIET("'fiet'"),
        KEYWORD_FIUNT("'fiunt'"),
        KEYWORD_FIENT("'fient'"),
        KEYWORD_TYPUS("'typus'"),
        KEYWORD_ORDO("'ordo'"),
        KEYWORD_DISCRETIO("'discretio'"),
        KEYWORD_GENUS("'genus'"),
        KEYWORD_IMPLET("'implet'"),
        KEYWORD_PRIVATUS("'privatus'"),
        KEYWORD_GENERIS("'generis'"),
        KEYWORD_PACTUM("'pactum'"),
        KEYWORD_SI("'si'"),
        KEYWORD_ALITER("'aliter'"),
        KEYWORD_SECUS("'secus'"),
        KEYWORD_SIC("'sic'", 15),
        KEYWORD_DUM("'dum'"),
        KEYWORD_PRO("'pro'"),
        KEYWORD_ELIGE("'elige'"),
        KEYWORD_DISCERNE("'discerne'"),
        KEYWORD_CASU("'casu'"),
        KEYWORD_CUSTODI("'custodi'"),
        KEYWORD_ADFIRMA("'adfirma'"),
        KEYWORD_REDDE("'redde'"),
        KEYWORD_RUMPE("'rumpe'"),
        KEYWORD_PERGE("'perge'"),
        KEYWORD_IACE("'iace'"),
        KEYWORD_MORI("'mori'"),
        KEYWORD_SCRIBE("'scribe'"),
        KEYWORD_VIDE("'vide'"),
        KEYWORD_MONE("'mone'"),
        KEYWORD_TEMPTA("'tempta'"),
        KEYWORD_CAPE("'cape'"),
        KEYWORD_DEMUM("'demum'"),
        KEYWORD_FAC("'fac'"),
        KEYWORD_ET("'et'", 13),
        KEYWORD_AUT("'aut'", 14),
        KEYWORD_VEL("'vel'", 14),
        KEYWORD_NON("'non'", 12),
        KEYWORD_EST("'est'", 12),
        KEYWORD_NULLA("'nulla'"),
        KEYWORD_NONNULLA("'nonnulla'"),
        KEYWORD_CEDE("'cede'"),
        KEYWORD_NOVUM("'novum'"),
        KEYWORD_QUA("'qua'", 2),
        KEYWORD_EGO("'ego'"),
        KEYWORD_VERUM("'verum'"),
        KEYWORD_FALSUM("'falsum'"),
        KEYWORD_NIHIL("'nihil'"),
        KEYWORD_CETERI("'ceteri'"),
        KEYWORD_SPARGE("'sparge'"),
        KEYWORD_PRAEFIXUM("'praefixum'"),
        KEYWORD_SCRIPTUM("'scriptum'"),
        KEYWORD_FINGE("'finge'"),
        KEYWORD_ANTE("'ante'", 6),
        KEYWORD_USQUE("'usque'", 6),
        KEYWORD_PER("'per'"),
        KEYWORD_CURA("'cura'"),
        KEYWORD_PRAEPARA("'praepara'"),
        KEYWORD_PRAEPARABIT("'praeparabit'"),
        KEYWORD_POSTPARA("'postpara'"),
        KEYWORD_POSTPARABIT("'postparabit'"),
        KEYWORD_INCIPIT("'incipit'"),
        KEYWORD_INCIPIET("'incipiet'"),
        KEYWORD_IN("'in'"),
        KEYWORD_PROBANDUM("'probandum'"),
        KEYWORD_PROBA("'proba'"),
        KEYWORD_SED("'sed'");

        public static final int PREFIX_PRECEDENCE = 3;
        public static final int TOP_PRECEDENCE = 999;

        public final String description;
        // lower values bind tighter, 0 means not an infix operator
        public final int infixPrecedence;

        private Type(String description, int infixPrecedence) {
            this.description = description;
            this.infixPrecedence = infixPrecedence;
        }
        private Type(String description) {
            this.description = description;
            this.infixPrecedence = 0;
        }
    }

    public final Type type;
    public final String content;
    public final Source source;

    Token(Type type, String content, Source source) {
        this.type = type;
        this.content = content;
        this.source = source;
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("[");
        output.append(this.type);
        output.append(" - '");
        output.append(this.content);
        output.append("']");
        return output.toString();
    }

}
