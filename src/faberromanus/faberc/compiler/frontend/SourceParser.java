package faberromanus.faberc.compiler.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import faberromanus.faberc.compiler.ErrorException;
import faberromanus.faberc.compiler.Source;

public class SourceParser extends Parser {

    public SourceParser(Lexer lexer) throws ErrorException {
        super(lexer);
    }

    public AstNode parseProgram() throws ErrorException {
        List<AstNode> body = this.parseStatements();
        this.expect(Token.Type.FILE_END);
        String content = this.lexer.fileContent();
        return new AstNode(
            AstNode.Type.PROGRAM,
            new AstNode.Program(body),
            new Source(this.lexer.fileName(), 1, 0, content.length())
        );
    }

    public AstNode parseStandaloneExpression() throws ErrorException {
        AstNode expr = this.parseExpression();
        this.expect(Token.Type.FILE_END);
        return expr;
    }

    private Source since(Token start) {
        return new Source(start.source, this.previous.source);
    }

    private List<AstNode> parseStatements() throws ErrorException {
        List<AstNode> nodes = new ArrayList<>();
        while(true) {
            while(this.accept(Token.Type.SEMICOLON)) {}
            if(this.current.type == Token.Type.BRACE_CLOSE
                    || this.current.type == Token.Type.FILE_END) {
                break;
            }
            nodes.add(this.parseStatement());
        }
        return nodes;
    }

    private AstNode parseBlock() throws ErrorException {
        Token start = this.consume(Token.Type.BRACE_OPEN);
        List<AstNode> body = this.parseStatements();
        this.consume(Token.Type.BRACE_CLOSE);
        return new AstNode(
            AstNode.Type.BLOCK, new AstNode.Block(body), this.since(start)
        );
    }

    private String parseIdentifier() throws ErrorException {
        return this.consume(Token.Type.IDENTIFIER).content;
    }

    private static boolean isVarKind(Token.Type type) {
        switch(type) {
            case KEYWORD_VARIA:
            case KEYWORD_FIXUM:
            case KEYWORD_FIGENDUM:
            case KEYWORD_VARIANDUM:
                return true;
            default:
                return false;
        }
    }

    private AstNode.VarKind parseVarKind() throws ErrorException {
        Token kind = this.consume(
            Token.Type.KEYWORD_VARIA, Token.Type.KEYWORD_FIXUM,
            Token.Type.KEYWORD_FIGENDUM, Token.Type.KEYWORD_VARIANDUM
        );
        switch(kind.type) {
            case KEYWORD_VARIA: return AstNode.VarKind.VARIA;
            case KEYWORD_FIXUM: return AstNode.VarKind.FIXUM;
            case KEYWORD_FIGENDUM: return AstNode.VarKind.FIGENDUM;
            default: return AstNode.VarKind.VARIANDUM;
        }
    }

    private Optional<AstNode.CatchClause> parseCatchClause()
            throws ErrorException {
        if(!this.accept(Token.Type.KEYWORD_CAPE)) {
            return Optional.empty();
        }
        String name = this.parseIdentifier();
        AstNode body = this.parseBlock();
        return Optional.of(new AstNode.CatchClause(name, body));
    }

    private boolean isContextual(String word) {
        return this.current.type == Token.Type.IDENTIFIER
            && this.current.content.equals(word);
    }

    private boolean acceptContextual(String word) {
        if(!this.isContextual(word)) { return false; }
        this.next();
        return true;
    }

    private boolean acceptOtherwise() {
        return this.accept(Token.Type.KEYWORD_ALITER)
            || this.accept(Token.Type.KEYWORD_SECUS);
    }

    private AstNode parseStatement() throws ErrorException {
        Token start = this.current;
        switch(this.current.type) {
            case KEYWORD_EX: return this.parseEx();
            case KEYWORD_DE: {
                this.next();
                AstNode iterable = this.parseExpression();
                this.consume(Token.Type.KEYWORD_PRO);
                String binding = this.parseIdentifier();
                AstNode body = this.parseBlock();
                Optional<AstNode.CatchClause> cape = this.parseCatchClause();
                return new AstNode(
                    AstNode.Type.ITERATIO,
                    new AstNode.Iteratio(
                        AstNode.IterKind.DE, iterable, binding, body, cape
                    ),
                    this.since(start)
                );
            }
            case KEYWORD_VARIA:
            case KEYWORD_FIXUM:
            case KEYWORD_FIGENDUM:
            case KEYWORD_VARIANDUM:
                return this.parseVariable();
            case KEYWORD_FUTURA:
            case KEYWORD_CURSOR:
            case KEYWORD_FUNCTIO:
                return this.parseFunction(false, false);
            case KEYWORD_TYPUS: {
                this.next();
                String name = this.parseIdentifier();
                this.consume(Token.Type.EQUALS);
                AstNode type = this.parseType();
                return new AstNode(
                    AstNode.Type.TYPE_ALIAS,
                    new AstNode.TypeAlias(name, type),
                    this.since(start)
                );
            }
            case KEYWORD_ORDO: return this.parseOrdo();
            case KEYWORD_DISCRETIO: return this.parseDiscretio();
            case KEYWORD_GENUS: return this.parseGenus();
            case KEYWORD_PACTUM: return this.parsePactum();
            case KEYWORD_SI: return this.parseSi();
            case KEYWORD_DUM: {
                this.next();
                AstNode condition = this.parseExpression();
                AstNode body = this.parseBlock();
                Optional<AstNode.CatchClause> cape = this.parseCatchClause();
                return new AstNode(
                    AstNode.Type.DUM,
                    new AstNode.Dum(condition, body, cape),
                    this.since(start)
                );
            }
            case KEYWORD_ELIGE: return this.parseElige();
            case KEYWORD_DISCERNE: return this.parseDiscerne();
            case KEYWORD_CUSTODI: {
                this.next();
                this.consume(Token.Type.BRACE_OPEN);
                List<AstNode.Guard> guards = new ArrayList<>();
                while(this.current.type != Token.Type.BRACE_CLOSE) {
                    this.consume(Token.Type.KEYWORD_SI);
                    AstNode condition = this.parseExpression();
                    AstNode body = this.parseBlock();
                    guards.add(new AstNode.Guard(condition, body));
                }
                this.next();
                return new AstNode(
                    AstNode.Type.CUSTODI,
                    new AstNode.Custodi(guards),
                    this.since(start)
                );
            }
            case KEYWORD_ADFIRMA: {
                this.next();
                AstNode condition = this.parseExpression();
                Optional<AstNode> message = Optional.empty();
                if(this.accept(Token.Type.COMMA)) {
                    message = Optional.of(this.parseExpression());
                }
                return new AstNode(
                    AstNode.Type.ADFIRMA,
                    new AstNode.Adfirma(condition, message),
                    this.since(start)
                );
            }
            case KEYWORD_REDDE: {
                this.next();
                Optional<AstNode> value = Optional.empty();
                boolean hasValue = this.current.source.line()
                        == start.source.line()
                    && this.current.type != Token.Type.BRACE_CLOSE
                    && this.current.type != Token.Type.SEMICOLON
                    && this.current.type != Token.Type.FILE_END;
                if(hasValue) {
                    value = Optional.of(this.parseExpression());
                }
                return new AstNode(
                    AstNode.Type.REDDE,
                    new AstNode.Redde(value),
                    this.since(start)
                );
            }
            case KEYWORD_RUMPE:
                this.next();
                return new AstNode(AstNode.Type.RUMPE, null, start.source);
            case KEYWORD_PERGE:
                this.next();
                return new AstNode(AstNode.Type.PERGE, null, start.source);
            case KEYWORD_IACE:
            case KEYWORD_MORI: {
                boolean fatal = this.current.type == Token.Type.KEYWORD_MORI;
                this.next();
                AstNode value = this.parseExpression();
                return new AstNode(
                    AstNode.Type.IACE,
                    new AstNode.Iace(value, fatal),
                    this.since(start)
                );
            }
            case KEYWORD_SCRIBE:
            case KEYWORD_VIDE:
            case KEYWORD_MONE: {
                AstNode.ScribeLevel level =
                    this.current.type == Token.Type.KEYWORD_SCRIBE
                        ? AstNode.ScribeLevel.SCRIBE
                        : this.current.type == Token.Type.KEYWORD_VIDE
                            ? AstNode.ScribeLevel.VIDE
                            : AstNode.ScribeLevel.MONE;
                this.next();
                List<AstNode> arguments = new ArrayList<>();
                arguments.add(this.parseExpression());
                while(this.accept(Token.Type.COMMA)) {
                    arguments.add(this.parseExpression());
                }
                return new AstNode(
                    AstNode.Type.SCRIBE,
                    new AstNode.Scribe(level, arguments),
                    this.since(start)
                );
            }
            case KEYWORD_TEMPTA: {
                this.next();
                AstNode body = this.parseBlock();
                Optional<AstNode.CatchClause> cape = this.parseCatchClause();
                Optional<AstNode> demum = Optional.empty();
                if(this.accept(Token.Type.KEYWORD_DEMUM)) {
                    demum = Optional.of(this.parseBlock());
                }
                return new AstNode(
                    AstNode.Type.TEMPTA,
                    new AstNode.Tempta(body, cape, demum),
                    this.since(start)
                );
            }
            case KEYWORD_FAC: {
                this.next();
                AstNode body = this.parseBlock();
                Optional<AstNode.CatchClause> cape = this.parseCatchClause();
                return new AstNode(
                    AstNode.Type.FAC,
                    new AstNode.Fac(body, cape),
                    this.since(start)
                );
            }
            case KEYWORD_CURA: return this.parseCura();
            case KEYWORD_PRAEPARA:
            case KEYWORD_PRAEPARABIT:
            case KEYWORD_POSTPARA:
            case KEYWORD_POSTPARABIT: {
                this.next();
                boolean after = start.type == Token.Type.KEYWORD_POSTPARA
                    || start.type == Token.Type.KEYWORD_POSTPARABIT;
                boolean async = start.type == Token.Type.KEYWORD_PRAEPARABIT
                    || start.type == Token.Type.KEYWORD_POSTPARABIT;
                boolean all = this.acceptContextual("omnia");
                AstNode body = this.parseBlock();
                return new AstNode(
                    AstNode.Type.PRAEPARA,
                    new AstNode.Praepara(after, all, async, body),
                    this.since(start)
                );
            }
            case KEYWORD_INCIPIT:
            case KEYWORD_INCIPIET: {
                this.next();
                AstNode body = this.acceptContextual("ergo")
                    ? this.parseStatement()
                    : this.parseBlock();
                return new AstNode(
                    AstNode.Type.INCIPIT,
                    new AstNode.Incipit(
                        start.type == Token.Type.KEYWORD_INCIPIET, body
                    ),
                    this.since(start)
                );
            }
            case KEYWORD_IN: {
                this.next();
                AstNode object = this.parseExpression();
                AstNode body = this.parseBlock();
                return new AstNode(
                    AstNode.Type.IN,
                    new AstNode.In(object, body),
                    this.since(start)
                );
            }
            case KEYWORD_PROBANDUM: return this.parseProbandum();
            case KEYWORD_PROBA: {
                this.next();
                Optional<AstNode.ProbaModifier> modifier = Optional.empty();
                Optional<String> reason = Optional.empty();
                for(AstNode.ProbaModifier m: AstNode.ProbaModifier.values()) {
                    if(this.acceptContextual(m.keyword)) {
                        modifier = Optional.of(m);
                        reason = Optional.of(
                            this.consume(Token.Type.STRING).content
                        );
                        break;
                    }
                }
                String name = this.consume(Token.Type.STRING).content;
                AstNode body = this.parseBlock();
                return new AstNode(
                    AstNode.Type.PROBA,
                    new AstNode.Proba(name, modifier, reason, body),
                    this.since(start)
                );
            }
            case BRACE_OPEN:
                return this.parseBlock();
            default: {
                AstNode expr = this.parseExpression();
                return new AstNode(
                    AstNode.Type.EXPRESSION_STATEMENT,
                    new AstNode.MonoOp(expr),
                    this.since(start)
                );
            }
        }
    }

    private static boolean isBindingVerb(Token.Type type) {
        return type == Token.Type.KEYWORD_PRO
            || type == Token.Type.KEYWORD_FIT
            || type == Token.Type.KEYWORD_FIET;
    }

    private AstNode parseCura() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_CURA);
        if(this.current.type == Token.Type.KEYWORD_ANTE
                || this.isContextual("post")) {
            boolean after = this.current.type != Token.Type.KEYWORD_ANTE;
            this.next();
            boolean all = this.acceptContextual("omnia");
            AstNode body = this.parseBlock();
            return new AstNode(
                AstNode.Type.PRAEPARA,
                new AstNode.Praepara(after, all, false, body),
                this.since(start)
            );
        }
        Optional<String> curator = Optional.empty();
        Optional<AstNode> resource = Optional.empty();
        if((this.isContextual("arena") || this.isContextual("page"))
                && SourceParser.isBindingVerb(this.peek(1).type)) {
            curator = Optional.of(this.current.content);
            this.next();
        } else {
            resource = Optional.of(this.parseExpression());
        }
        Token verb = this.consume(
            Token.Type.KEYWORD_PRO, Token.Type.KEYWORD_FIT,
            Token.Type.KEYWORD_FIET
        );
        Optional<AstNode> type = Optional.empty();
        if(this.isTypeStart()) {
            type = Optional.of(this.parseType());
        }
        String binding = this.parseIdentifier();
        AstNode body = this.parseBlock();
        Optional<AstNode.CatchClause> cape = this.parseCatchClause();
        return new AstNode(
            AstNode.Type.CURA,
            new AstNode.Cura(
                curator, resource, type, binding,
                verb.type == Token.Type.KEYWORD_FIET, body, cape
            ),
            this.since(start)
        );
    }

    private AstNode parseProbandum() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_PROBANDUM);
        String name = this.consume(Token.Type.STRING).content;
        this.consume(Token.Type.BRACE_OPEN);
        List<AstNode> body = this.parseStatements();
        this.consume(Token.Type.BRACE_CLOSE);
        for(AstNode member: body) {
            switch(member.type) {
                case PROBA:
                case PROBANDUM:
                case PRAEPARA:
                    break;
                default:
                    throw ErrorException.at(
                        member.source, "Statement in test suite",
                        "only tests, nested suites and setup blocks"
                            + " may appear here"
                    );
            }
        }
        return new AstNode(
            AstNode.Type.PROBANDUM,
            new AstNode.Probandum(name, body),
            this.since(start)
        );
    }

    private List<AstNode.Specifier> parseSpecifiers() throws ErrorException {
        List<AstNode.Specifier> specifiers = new ArrayList<>();
        do {
            String imported = this.parseIdentifier();
            Optional<String> local = Optional.empty();
            if(this.accept(Token.Type.KEYWORD_UT)) {
                local = Optional.of(this.parseIdentifier());
            }
            specifiers.add(new AstNode.Specifier(imported, local));
        } while(this.accept(Token.Type.COMMA));
        return specifiers;
    }

    private AstNode parseEx() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_EX);
        boolean isImport = this.current.type == Token.Type.STRING
            || (this.current.type == Token.Type.IDENTIFIER
                && this.peek(1).type == Token.Type.KEYWORD_IMPORTA);
        if(isImport) {
            String source = this.current.content;
            this.next();
            this.consume(Token.Type.KEYWORD_IMPORTA);
            if(this.accept(Token.Type.ASTERISK)) {
                return new AstNode(
                    AstNode.Type.IMPORT,
                    new AstNode.Import(source, List.of(), true),
                    this.since(start)
                );
            }
            List<AstNode.Specifier> specifiers = this.parseSpecifiers();
            return new AstNode(
                AstNode.Type.IMPORT,
                new AstNode.Import(source, specifiers, false),
                this.since(start)
            );
        }
        AstNode iterable = this.parseExpression();
        if(SourceParser.isVarKind(this.current.type)) {
            AstNode.VarKind kind = this.parseVarKind();
            List<AstNode.Specifier> specifiers = this.parseSpecifiers();
            return new AstNode(
                AstNode.Type.DESTRUCTURE,
                new AstNode.Destructure(iterable, kind, specifiers),
                this.since(start)
            );
        }
        this.consume(Token.Type.KEYWORD_PRO);
        String binding = this.parseIdentifier();
        AstNode body = this.parseBlock();
        Optional<AstNode.CatchClause> cape = this.parseCatchClause();
        return new AstNode(
            AstNode.Type.ITERATIO,
            new AstNode.Iteratio(
                AstNode.IterKind.EX, iterable, binding, body, cape
            ),
            this.since(start)
        );
    }

    private boolean isTypeStart() {
        if(this.current.type != Token.Type.IDENTIFIER) { return false; }
        Token.Type after = this.peek(1).type;
        return after == Token.Type.IDENTIFIER
            || after == Token.Type.LESS_THAN
            || (after == Token.Type.QUESTION_MARK
                && this.peek(2).type == Token.Type.IDENTIFIER)
            || (after == Token.Type.BRACKET_OPEN
                && this.peek(2).type == Token.Type.BRACKET_CLOSE);
    }

    private AstNode parseType() throws ErrorException {
        Token start = this.current;
        String name = this.parseIdentifier();
        List<AstNode> arguments = new ArrayList<>();
        if(this.accept(Token.Type.LESS_THAN)) {
            do {
                arguments.add(this.parseType());
                this.splitShiftRight();
            } while(this.accept(Token.Type.COMMA));
            this.consume(Token.Type.GREATER_THAN);
        }
        boolean nullable = this.accept(Token.Type.QUESTION_MARK);
        int arrayDepth = 0;
        while(this.current.type == Token.Type.BRACKET_OPEN
                && this.peek(1).type == Token.Type.BRACKET_CLOSE) {
            this.next();
            this.next();
            arrayDepth += 1;
        }
        return new AstNode(
            AstNode.Type.TYPE,
            new AstNode.TypeAnnotation(name, arguments, nullable, arrayDepth),
            this.since(start)
        );
    }

    private List<String> parseTypeParams() throws ErrorException {
        List<String> typeParams = new ArrayList<>();
        if(this.accept(Token.Type.LESS_THAN)) {
            do {
                typeParams.add(this.parseIdentifier());
            } while(this.accept(Token.Type.COMMA));
            this.consume(Token.Type.GREATER_THAN);
        }
        return typeParams;
    }

    private AstNode parseVariable() throws ErrorException {
        Token start = this.current;
        AstNode.VarKind kind = this.parseVarKind();
        Optional<AstNode> type = Optional.empty();
        if(this.isTypeStart()) {
            type = Optional.of(this.parseType());
        }
        AstNode target;
        Token targetStart = this.current;
        switch(this.current.type) {
            case IDENTIFIER: {
                this.next();
                target = new AstNode(
                    AstNode.Type.IDENTIFIER,
                    new AstNode.Identifier(targetStart.content),
                    targetStart.source
                );
            } break;
            case BRACE_OPEN: {
                this.next();
                List<AstNode.PatternProperty> properties = new ArrayList<>();
                Optional<String> rest = Optional.empty();
                while(this.current.type != Token.Type.BRACE_CLOSE) {
                    if(this.accept(Token.Type.KEYWORD_CETERI)) {
                        rest = Optional.of(this.parseIdentifier());
                    } else {
                        String key = this.parseIdentifier();
                        String local = key;
                        if(this.accept(Token.Type.COLON)
                                || this.accept(Token.Type.KEYWORD_UT)) {
                            local = this.parseIdentifier();
                        }
                        properties.add(new AstNode.PatternProperty(key, local));
                    }
                    if(!this.accept(Token.Type.COMMA)) { break; }
                }
                this.consume(Token.Type.BRACE_CLOSE);
                target = new AstNode(
                    AstNode.Type.OBJECT_PATTERN,
                    new AstNode.ObjectPattern(properties, rest),
                    this.since(targetStart)
                );
            } break;
            case BRACKET_OPEN: {
                this.next();
                List<Optional<String>> elements = new ArrayList<>();
                Optional<String> rest = Optional.empty();
                while(this.current.type != Token.Type.BRACKET_CLOSE) {
                    if(this.accept(Token.Type.KEYWORD_CETERI)) {
                        rest = Optional.of(this.parseIdentifier());
                    } else {
                        String name = this.parseIdentifier();
                        elements.add(
                            name.equals("_")
                                ? Optional.empty()
                                : Optional.of(name)
                        );
                    }
                    if(!this.accept(Token.Type.COMMA)) { break; }
                }
                this.consume(Token.Type.BRACKET_CLOSE);
                target = new AstNode(
                    AstNode.Type.ARRAY_PATTERN,
                    new AstNode.ArrayPattern(elements, rest),
                    this.since(targetStart)
                );
            } break;
            default:
                this.throwUnexpected("a variable name or a pattern");
                return null;
        }
        Optional<AstNode> value = Optional.empty();
        if(this.accept(Token.Type.EQUALS)) {
            value = Optional.of(this.parseExpression());
        }
        return new AstNode(
            AstNode.Type.VARIABLE,
            new AstNode.Variable(kind, type, target, value),
            this.since(start)
        );
    }

    private List<AstNode> parseParams(Token.Type closing)
            throws ErrorException {
        List<AstNode> params = new ArrayList<>();
        while(this.current.type != closing) {
            Token start = this.current;
            boolean rest = this.accept(Token.Type.KEYWORD_CETERI);
            Optional<AstNode> type = Optional.empty();
            if(this.isTypeStart()) {
                type = Optional.of(this.parseType());
            }
            String name = this.parseIdentifier();
            Optional<AstNode> defaultValue = Optional.empty();
            if(this.accept(Token.Type.KEYWORD_VEL)) {
                defaultValue = Optional.of(this.parseExpression());
            }
            params.add(new AstNode(
                AstNode.Type.PARAMETER,
                new AstNode.Parameter(name, type, rest, defaultValue),
                this.since(start)
            ));
            if(!this.accept(Token.Type.COMMA)) { break; }
        }
        this.consume(closing);
        return params;
    }

    private AstNode parseFunction(
        boolean isPrivate, boolean isStatic
    ) throws ErrorException {
        Token start = this.current;
        boolean futura = false;
        boolean cursor = false;
        while(true) {
            if(this.accept(Token.Type.KEYWORD_FUTURA)) {
                futura = true;
            } else if(this.accept(Token.Type.KEYWORD_CURSOR)) {
                cursor = true;
            } else {
                break;
            }
        }
        this.consume(Token.Type.KEYWORD_FUNCTIO);
        String name = this.parseIdentifier();
        List<String> typeParams = this.parseTypeParams();
        this.consume(Token.Type.PAREN_OPEN);
        List<AstNode> params = this.parseParams(Token.Type.PAREN_CLOSE);
        AstNode.ReturnVerb verb = AstNode.ReturnVerb.ARROW;
        Optional<AstNode> returnType = Optional.empty();
        switch(this.current.type) {
            case ARROW: verb = AstNode.ReturnVerb.ARROW; break;
            case KEYWORD_FIT: verb = AstNode.ReturnVerb.FIT; break;
            case KEYWORD_FIET: verb = AstNode.ReturnVerb.FIET; break;
            case KEYWORD_FIUNT: verb = AstNode.ReturnVerb.FIUNT; break;
            case KEYWORD_FIENT: verb = AstNode.ReturnVerb.FIENT; break;
            default: break;
        }
        boolean hasReturn = this.current.type == Token.Type.ARROW
            || verb != AstNode.ReturnVerb.ARROW;
        if(hasReturn) {
            this.next();
            returnType = Optional.of(this.parseType());
        }
        Optional<AstNode> body = Optional.empty();
        if(this.current.type == Token.Type.BRACE_OPEN) {
            body = Optional.of(this.parseBlock());
        }
        return new AstNode(
            AstNode.Type.FUNCTION,
            new AstNode.Function(
                name, typeParams, params, returnType, verb,
                futura, cursor, isPrivate, isStatic, body
            ),
            this.since(start)
        );
    }

    private AstNode parseOrdo() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_ORDO);
        String name = this.parseIdentifier();
        this.consume(Token.Type.BRACE_OPEN);
        List<AstNode.OrdoMember> members = new ArrayList<>();
        while(this.current.type != Token.Type.BRACE_CLOSE) {
            String memberName = this.parseIdentifier();
            Optional<AstNode> value = Optional.empty();
            if(this.accept(Token.Type.EQUALS)) {
                value = Optional.of(this.parseExpression());
            }
            members.add(new AstNode.OrdoMember(memberName, value));
            this.accept(Token.Type.COMMA);
        }
        this.next();
        return new AstNode(
            AstNode.Type.ORDO,
            new AstNode.Ordo(name, members),
            this.since(start)
        );
    }

    private AstNode parseDiscretio() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_DISCRETIO);
        String name = this.parseIdentifier();
        List<String> typeParams = this.parseTypeParams();
        this.consume(Token.Type.BRACE_OPEN);
        List<AstNode.VariantDecl> variants = new ArrayList<>();
        while(this.current.type != Token.Type.BRACE_CLOSE) {
            String variantName = this.parseIdentifier();
            List<AstNode.VariantField> fields = new ArrayList<>();
            if(this.accept(Token.Type.BRACE_OPEN)) {
                while(this.current.type != Token.Type.BRACE_CLOSE) {
                    AstNode type = this.parseType();
                    String fieldName = this.parseIdentifier();
                    fields.add(new AstNode.VariantField(type, fieldName));
                    this.accept(Token.Type.COMMA);
                }
                this.next();
            }
            variants.add(new AstNode.VariantDecl(variantName, fields));
            this.accept(Token.Type.COMMA);
        }
        this.next();
        return new AstNode(
            AstNode.Type.DISCRETIO,
            new AstNode.Discretio(name, typeParams, variants),
            this.since(start)
        );
    }

    private AstNode parseGenus() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_GENUS);
        String name = this.parseIdentifier();
        List<String> typeParams = this.parseTypeParams();
        List<String> implemented = new ArrayList<>();
        if(this.accept(Token.Type.KEYWORD_IMPLET)) {
            do {
                implemented.add(this.parseIdentifier());
            } while(this.accept(Token.Type.COMMA));
        }
        this.consume(Token.Type.BRACE_OPEN);
        List<AstNode> members = new ArrayList<>();
        while(true) {
            while(this.accept(Token.Type.COMMA)
                || this.accept(Token.Type.SEMICOLON)) {}
            if(this.current.type == Token.Type.BRACE_CLOSE) { break; }
            Token memberStart = this.current;
            boolean isPrivate = this.accept(Token.Type.KEYWORD_PRIVATUS);
            boolean isStatic = this.accept(Token.Type.KEYWORD_GENERIS);
            switch(this.current.type) {
                case KEYWORD_FUNCTIO:
                case KEYWORD_FUTURA:
                case KEYWORD_CURSOR: {
                    AstNode method = this.parseFunction(isPrivate, isStatic);
                    members.add(new AstNode(
                        method.type, method.getValue(),
                        this.since(memberStart)
                    ));
                } break;
                default: {
                    AstNode type = this.parseType();
                    String fieldName = this.parseIdentifier();
                    Optional<AstNode> init = Optional.empty();
                    if(this.accept(Token.Type.COLON)
                            || this.accept(Token.Type.EQUALS)) {
                        init = Optional.of(this.parseExpression());
                    }
                    members.add(new AstNode(
                        AstNode.Type.GENUS_FIELD,
                        new AstNode.GenusField(
                            type, fieldName, isPrivate, isStatic, init
                        ),
                        this.since(memberStart)
                    ));
                }
            }
        }
        this.next();
        return new AstNode(
            AstNode.Type.GENUS,
            new AstNode.Genus(name, typeParams, implemented, members),
            this.since(start)
        );
    }

    private AstNode parsePactum() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_PACTUM);
        String name = this.parseIdentifier();
        List<String> typeParams = this.parseTypeParams();
        this.consume(Token.Type.BRACE_OPEN);
        List<AstNode> methods = new ArrayList<>();
        while(true) {
            while(this.accept(Token.Type.COMMA)
                || this.accept(Token.Type.SEMICOLON)) {}
            if(this.current.type == Token.Type.BRACE_CLOSE) { break; }
            AstNode method = this.parseFunction(false, false);
            if(method.<AstNode.Function>getValue().body().isPresent()) {
                throw ErrorException.at(
                    method.source, "Method body in interface",
                    "methods of a 'pactum' may only be declared"
                );
            }
            methods.add(method);
        }
        this.next();
        return new AstNode(
            AstNode.Type.PACTUM,
            new AstNode.Pactum(name, typeParams, methods),
            this.since(start)
        );
    }

    private AstNode parseSi() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_SI);
        AstNode condition = this.parseExpression();
        AstNode then = this.parseBlock();
        Optional<AstNode.CatchClause> cape = this.parseCatchClause();
        Optional<AstNode> otherwise = Optional.empty();
        if(this.acceptOtherwise()) {
            otherwise = Optional.of(
                this.current.type == Token.Type.KEYWORD_SI
                    ? this.parseSi()
                    : this.parseBlock()
            );
        }
        return new AstNode(
            AstNode.Type.SI,
            new AstNode.Si(condition, then, cape, otherwise),
            this.since(start)
        );
    }

    private AstNode parseElige() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_ELIGE);
        AstNode subject = this.parseExpression();
        this.consume(Token.Type.BRACE_OPEN);
        List<AstNode.EligeCase> cases = new ArrayList<>();
        Optional<AstNode> otherwise = Optional.empty();
        while(this.current.type != Token.Type.BRACE_CLOSE) {
            if(this.acceptOtherwise()) {
                otherwise = Optional.of(this.parseBlock());
                break;
            }
            this.expect(Token.Type.KEYWORD_SI, Token.Type.KEYWORD_CASU);
            this.next();
            AstNode value = this.parseExpression();
            AstNode body = this.parseBlock();
            cases.add(new AstNode.EligeCase(value, body));
        }
        this.consume(Token.Type.BRACE_CLOSE);
        Optional<AstNode.CatchClause> cape = this.parseCatchClause();
        return new AstNode(
            AstNode.Type.ELIGE,
            new AstNode.Elige(subject, cases, otherwise, cape),
            this.since(start)
        );
    }

    private AstNode parseDiscerne() throws ErrorException {
        Token start = this.consume(Token.Type.KEYWORD_DISCERNE);
        AstNode subject = this.parseExpression();
        this.consume(Token.Type.BRACE_OPEN);
        List<AstNode.DiscerneCase> cases = new ArrayList<>();
        Optional<AstNode> otherwise = Optional.empty();
        while(this.current.type != Token.Type.BRACE_CLOSE) {
            if(this.acceptOtherwise()) {
                otherwise = Optional.of(this.parseBlock());
                break;
            }
            this.expect(Token.Type.KEYWORD_SI, Token.Type.KEYWORD_CASU);
            this.next();
            String variant = this.parseIdentifier();
            Optional<String> alias = Optional.empty();
            List<String> bindings = new ArrayList<>();
            if(this.accept(Token.Type.KEYWORD_UT)) {
                alias = Optional.of(this.parseIdentifier());
            } else if(this.accept(Token.Type.KEYWORD_PRO)) {
                do {
                    bindings.add(this.parseIdentifier());
                } while(this.accept(Token.Type.COMMA));
            }
            AstNode body = this.parseBlock();
            cases.add(new AstNode.DiscerneCase(variant, alias, bindings, body));
        }
        this.consume(Token.Type.BRACE_CLOSE);
        return new AstNode(
            AstNode.Type.DISCERNE,
            new AstNode.Discerne(subject, cases, otherwise),
            this.since(start)
        );
    }

    public AstNode parseExpression() throws ErrorException {
        return this.parseExpression(Token.Type.TOP_PRECEDENCE);
    }

    private static String binaryOperator(Token.Type type) {
        switch(type) {
            case PLUS: return "+";
            case MINUS: return "-";
            case ASTERISK: return "*";
            case SLASH: return "/";
            case PERCENT: return "%";
            case LESS_THAN: return "<";
            case GREATER_THAN: return ">";
            case LESS_THAN_EQUAL: return "<=";
            case GREATER_THAN_EQUAL: return ">=";
            case DOUBLE_EQUALS: return "==";
            case NOT_EQUALS: return "!=";
            case TRIPLE_EQUALS: return "===";
            case NOT_DOUBLE_EQUALS: return "!==";
            case PIPE: return "|";
            case CARET: return "^";
            case AMPERSAND: return "&";
            case SHIFT_LEFT: return "<<";
            case SHIFT_RIGHT: return ">>";
            case DOUBLE_AMPERSAND:
            case KEYWORD_ET: return "et";
            case DOUBLE_PIPE:
            case KEYWORD_AUT: return "aut";
            case DOUBLE_QUESTION_MARK:
            case KEYWORD_VEL: return "vel";
            default: throw new IllegalArgumentException("invalid token type!");
        }
    }

    private static AstNode.Access accessOf(Token.Type type) {
        switch(type) {
            case QUESTION_DOT:
            case QUESTION_BRACKET:
            case QUESTION_PAREN:
                return AstNode.Access.OPTIONAL;
            case EXCLAMATION_DOT:
            case EXCLAMATION_BRACKET:
            case EXCLAMATION_PAREN:
                return AstNode.Access.NON_NULL;
            default:
                return AstNode.Access.NORMAL;
        }
    }

    private List<AstNode> parseArguments(Token.Type closing)
            throws ErrorException {
        List<AstNode> arguments = new ArrayList<>();
        while(this.current.type != closing) {
            arguments.add(this.parseExpression());
            if(!this.accept(Token.Type.COMMA)) { break; }
        }
        this.consume(closing);
        return arguments;
    }

    private AstNode parseExpression(int precedence) throws ErrorException {
        Optional<AstNode> previous = Optional.empty();
        while(true) {
            int currentPrecedence = this.current.type.infixPrecedence;
            if(previous.isPresent() && currentPrecedence >= precedence) {
                return previous.get();
            }
            Token start = this.current;
            if(previous.isPresent()) {
                AstNode left = previous.get();
                switch(this.current.type) {
                    case PAREN_OPEN:
                    case QUESTION_PAREN:
                    case EXCLAMATION_PAREN: {
                        this.next();
                        List<AstNode> arguments = this.parseArguments(
                            Token.Type.PAREN_CLOSE
                        );
                        previous = Optional.of(new AstNode(
                            AstNode.Type.CALL,
                            new AstNode.Call(
                                left, arguments,
                                SourceParser.accessOf(start.type)
                            ),
                            new Source(left.source, this.previous.source)
                        ));
                        continue;
                    }
                    case DOT:
                    case QUESTION_DOT:
                    case EXCLAMATION_DOT: {
                        this.next();
                        Token name = this.consume(Token.Type.IDENTIFIER);
                        AstNode property = new AstNode(
                            AstNode.Type.IDENTIFIER,
                            new AstNode.Identifier(name.content),
                            name.source
                        );
                        previous = Optional.of(new AstNode(
                            AstNode.Type.MEMBER,
                            new AstNode.Member(
                                left, property, false,
                                SourceParser.accessOf(start.type)
                            ),
                            new Source(left.source, name.source)
                        ));
                        continue;
                    }
                    case BRACKET_OPEN:
                    case QUESTION_BRACKET:
                    case EXCLAMATION_BRACKET: {
                        this.next();
                        AstNode index = this.parseExpression();
                        this.consume(Token.Type.BRACKET_CLOSE);
                        previous = Optional.of(new AstNode(
                            AstNode.Type.MEMBER,
                            new AstNode.Member(
                                left, index, true,
                                SourceParser.accessOf(start.type)
                            ),
                            new Source(left.source, this.previous.source)
                        ));
                        continue;
                    }
                    case KEYWORD_QUA: {
                        this.next();
                        AstNode type = this.parseType();
                        previous = Optional.of(new AstNode(
                            AstNode.Type.QUA,
                            new AstNode.Qua(left, type),
                            new Source(left.source, type.source)
                        ));
                        continue;
                    }
                    case PLUS:
                    case MINUS:
                    case ASTERISK:
                    case SLASH:
                    case PERCENT:
                    case LESS_THAN:
                    case GREATER_THAN:
                    case LESS_THAN_EQUAL:
                    case GREATER_THAN_EQUAL:
                    case DOUBLE_EQUALS:
                    case NOT_EQUALS:
                    case TRIPLE_EQUALS:
                    case NOT_DOUBLE_EQUALS:
                    case PIPE:
                    case CARET:
                    case AMPERSAND:
                    case SHIFT_LEFT:
                    case SHIFT_RIGHT:
                    case DOUBLE_AMPERSAND:
                    case DOUBLE_PIPE:
                    case DOUBLE_QUESTION_MARK:
                    case KEYWORD_ET:
                    case KEYWORD_AUT:
                    case KEYWORD_VEL: {
                        this.next();
                        AstNode right = this.parseExpression(
                            start.type.infixPrecedence
                        );
                        previous = Optional.of(new AstNode(
                            AstNode.Type.BINARY,
                            new AstNode.Binary(
                                SourceParser.binaryOperator(start.type),
                                left, right
                            ),
                            new Source(left.source, right.source)
                        ));
                        continue;
                    }
                    case KEYWORD_EST:
                    case KEYWORD_NON: {
                        boolean negated = this.accept(Token.Type.KEYWORD_NON);
                        this.consume(Token.Type.KEYWORD_EST);
                        AstNode target = this.parseExpression(
                            Token.Type.KEYWORD_EST.infixPrecedence
                        );
                        previous = Optional.of(new AstNode(
                            AstNode.Type.EST,
                            new AstNode.Est(left, target, negated),
                            new Source(left.source, target.source)
                        ));
                        continue;
                    }
                    case DOUBLE_DOT:
                    case KEYWORD_ANTE:
                    case KEYWORD_USQUE: {
                        this.next();
                        AstNode end = this.parseExpression(
                            start.type.infixPrecedence
                        );
                        Optional<AstNode> step = Optional.empty();
                        if(this.accept(Token.Type.KEYWORD_PER)) {
                            step = Optional.of(this.parseExpression(
                                start.type.infixPrecedence
                            ));
                        }
                        AstNode.RangeKind kind =
                            start.type == Token.Type.KEYWORD_USQUE
                                ? AstNode.RangeKind.INCLUSIVE
                                : AstNode.RangeKind.EXCLUSIVE;
                        previous = Optional.of(new AstNode(
                            AstNode.Type.RANGE,
                            new AstNode.Range(left, end, kind, step),
                            new Source(left.source, this.previous.source)
                        ));
                        continue;
                    }
                    case QUESTION_MARK:
                    case KEYWORD_SIC: {
                        this.next();
                        AstNode then = this.parseExpression();
                        this.consume(
                            start.type == Token.Type.QUESTION_MARK
                                ? Token.Type.COLON
                                : Token.Type.KEYWORD_SECUS
                        );
                        AstNode otherwise = this.parseExpression(
                            start.type.infixPrecedence + 1
                        );
                        previous = Optional.of(new AstNode(
                            AstNode.Type.CONDITIONAL,
                            new AstNode.Conditional(left, then, otherwise),
                            new Source(left.source, otherwise.source)
                        ));
                        continue;
                    }
                    case EQUALS:
                    case PLUS_EQUALS:
                    case MINUS_EQUALS:
                    case ASTERISK_EQUALS:
                    case SLASH_EQUALS:
                    case AMPERSAND_EQUALS:
                    case PIPE_EQUALS: {
                        if(!left.isAssignable()) {
                            throw ErrorException.at(
                                left.source,
                                "Assignment to a non-assignable expression",
                                "this expression may not be assigned to"
                            );
                        }
                        this.next();
                        AstNode value = this.parseExpression(
                            start.type.infixPrecedence + 1
                        );
                        previous = Optional.of(new AstNode(
                            AstNode.Type.ASSIGNMENT,
                            new AstNode.Assignment(start.content, left, value),
                            new Source(left.source, value.source)
                        ));
                        continue;
                    }
                    default: {
                        return left;
                    }
                }
            }
            previous = Optional.of(this.parsePrefix());
        }
    }

    private AstNode parseUnary(String operator, Token start)
            throws ErrorException {
        this.next();
        AstNode operand = this.parseExpression(Token.Type.PREFIX_PRECEDENCE);
        return new AstNode(
            AstNode.Type.UNARY,
            new AstNode.Unary(operator, operand),
            new Source(start.source, operand.source)
        );
    }

    private boolean isArrowAhead() {
        int depth = 0;
        for(int offset = 0; ; offset += 1) {
            Token token = this.peek(offset);
            switch(token.type) {
                case PAREN_OPEN: depth += 1; break;
                case PAREN_CLOSE: {
                    depth -= 1;
                    if(depth == 0) {
                        return this.peek(offset + 1).type
                            == Token.Type.FAT_ARROW;
                    }
                } break;
                case FILE_END: return false;
                default: break;
            }
        }
    }

    private List<AstNode.Property> parseProperties() throws ErrorException {
        this.consume(Token.Type.BRACE_OPEN);
        List<AstNode.Property> properties = new ArrayList<>();
        while(this.current.type != Token.Type.BRACE_CLOSE) {
            if(this.current.type == Token.Type.KEYWORD_SPARGE) {
                properties.add(new AstNode.Property("", this.parsePrefix()));
            } else {
                Token key = this.consume(
                    Token.Type.IDENTIFIER, Token.Type.STRING
                );
                AstNode value;
                if(this.accept(Token.Type.COLON)) {
                    value = this.parseExpression();
                } else if(key.type == Token.Type.IDENTIFIER) {
                    value = new AstNode(
                        AstNode.Type.IDENTIFIER,
                        new AstNode.Identifier(key.content),
                        key.source
                    );
                } else {
                    this.throwUnexpected(Token.Type.COLON.description);
                    return properties;
                }
                properties.add(new AstNode.Property(key.content, value));
            }
            if(!this.accept(Token.Type.COMMA)) { break; }
        }
        this.consume(Token.Type.BRACE_CLOSE);
        return properties;
    }

    private AstNode parseTemplate(Token token) throws ErrorException {
        String raw = token.content;
        int rawStart = token.source.startOffset() + 1;
        String fileContent = this.lexer.fileContent();
        List<String> quasis = new ArrayList<>();
        List<AstNode> expressions = new ArrayList<>();
        StringBuilder quasi = new StringBuilder();
        int line = token.source.line();
        for(int i = 0; i < raw.length(); i += 1) {
            char c = raw.charAt(i);
            if(c == '\\' && i + 1 < raw.length()) {
                quasi.append(c);
                quasi.append(raw.charAt(i + 1));
                i += 1;
                continue;
            }
            if(c == '\n') { line += 1; }
            if(c != '$' || i + 1 >= raw.length() || raw.charAt(i + 1) != '{') {
                quasi.append(c);
                continue;
            }
            int depth = 1;
            int exprStart = i + 2;
            int exprEnd = exprStart;
            while(exprEnd < raw.length()) {
                char e = raw.charAt(exprEnd);
                if(e == '{') { depth += 1; }
                if(e == '}') {
                    depth -= 1;
                    if(depth == 0) { break; }
                }
                exprEnd += 1;
            }
            SourceParser inner = new SourceParser(new Lexer(
                this.lexer.fileName(), fileContent,
                rawStart + exprStart, rawStart + exprEnd, line
            ));
            quasis.add(quasi.toString());
            quasi.setLength(0);
            expressions.add(inner.parseStandaloneExpression());
            i = exprEnd;
        }
        quasis.add(quasi.toString());
        return new AstNode(
            AstNode.Type.TEMPLATE,
            new AstNode.Template(quasis, expressions),
            token.source
        );
    }

    private AstNode parsePrefix() throws ErrorException {
        Token start = this.current;
        switch(this.current.type) {
            case MINUS: return this.parseUnary("-", start);
            case PLUS: return this.parseUnary("+", start);
            case TILDE: return this.parseUnary("~", start);
            case EXCLAMATION_MARK:
            case KEYWORD_NON:
                return this.parseUnary("non", start);
            case KEYWORD_NULLA: return this.parseUnary("nulla", start);
            case KEYWORD_NONNULLA: return this.parseUnary("nonnulla", start);
            case KEYWORD_CEDE:
            case KEYWORD_SPARGE: {
                this.next();
                AstNode value = this.parseExpression(
                    Token.Type.PREFIX_PRECEDENCE
                );
                return new AstNode(
                    start.type == Token.Type.KEYWORD_CEDE
                        ? AstNode.Type.CEDE
                        : AstNode.Type.SPREAD,
                    new AstNode.MonoOp(value),
                    new Source(start.source, value.source)
                );
            }
            case IDENTIFIER:
                this.next();
                if(start.content.equals("lege")
                        && this.current.type != Token.Type.PAREN_OPEN) {
                    boolean line = this.acceptContextual("lineam");
                    return new AstNode(
                        AstNode.Type.LEGE,
                        new AstNode.Lege(line),
                        this.since(start)
                    );
                }
                return new AstNode(
                    AstNode.Type.IDENTIFIER,
                    new AstNode.Identifier(start.content),
                    start.source
                );
            case KEYWORD_EGO:
                this.next();
                return new AstNode(AstNode.Type.EGO, null, start.source);
            case NUMBER:
                this.next();
                return new AstNode(
                    AstNode.Type.LITERAL,
                    new AstNode.Literal(
                        AstNode.LiteralKind.NUMBER, start.content
                    ),
                    start.source
                );
            case STRING:
                this.next();
                return new AstNode(
                    AstNode.Type.LITERAL,
                    new AstNode.Literal(
                        AstNode.LiteralKind.STRING, start.content
                    ),
                    start.source
                );
            case TEMPLATE:
                this.next();
                return this.parseTemplate(start);
            case KEYWORD_SED: {
                this.next();
                Token pattern = this.consume(Token.Type.STRING);
                String flags = "";
                if(this.current.type == Token.Type.IDENTIFIER
                        && this.current.source.line() == pattern.source.line()
                        && this.current.content.matches("[imsu]+")) {
                    flags = this.current.content;
                    this.next();
                }
                return new AstNode(
                    AstNode.Type.REGEX,
                    new AstNode.Regex(pattern.content, flags),
                    this.since(start)
                );
            }
            case KEYWORD_VERUM:
            case KEYWORD_FALSUM:
                this.next();
                return new AstNode(
                    AstNode.Type.LITERAL,
                    new AstNode.Literal(
                        AstNode.LiteralKind.BOOLEAN, start.content
                    ),
                    start.source
                );
            case KEYWORD_NIHIL:
                this.next();
                return new AstNode(
                    AstNode.Type.LITERAL,
                    new AstNode.Literal(
                        AstNode.LiteralKind.NIHIL, start.content
                    ),
                    start.source
                );
            case BRACKET_OPEN: {
                this.next();
                List<AstNode> elements = this.parseArguments(
                    Token.Type.BRACKET_CLOSE
                );
                return new AstNode(
                    AstNode.Type.ARRAY,
                    new AstNode.Elements(elements),
                    this.since(start)
                );
            }
            case BRACE_OPEN: {
                List<AstNode.Property> properties = this.parseProperties();
                return new AstNode(
                    AstNode.Type.OBJECT,
                    new AstNode.ObjectLiteral(properties),
                    this.since(start)
                );
            }
            case PAREN_OPEN: {
                if(this.isArrowAhead()) {
                    this.next();
                    List<AstNode> params = this.parseParams(
                        Token.Type.PAREN_CLOSE
                    );
                    this.consume(Token.Type.FAT_ARROW);
                    AstNode body = this.current.type == Token.Type.BRACE_OPEN
                        ? this.parseBlock()
                        : this.parseExpression();
                    return new AstNode(
                        AstNode.Type.ARROW,
                        new AstNode.Arrow(params, body),
                        this.since(start)
                    );
                }
                this.next();
                AstNode inner = this.parseExpression();
                this.consume(Token.Type.PAREN_CLOSE);
                return inner;
            }
            case KEYWORD_PRO: {
                this.next();
                List<String> params = new ArrayList<>();
                while(this.current.type == Token.Type.IDENTIFIER) {
                    params.add(this.parseIdentifier());
                    if(!this.accept(Token.Type.COMMA)) { break; }
                }
                AstNode body;
                if(this.current.type == Token.Type.BRACE_OPEN) {
                    body = this.parseBlock();
                } else {
                    this.consume(Token.Type.KEYWORD_REDDE);
                    body = this.parseExpression();
                }
                return new AstNode(
                    AstNode.Type.LAMBDA,
                    new AstNode.Lambda(params, body),
                    this.since(start)
                );
            }
            case KEYWORD_PRAEFIXUM: {
                this.next();
                AstNode body;
                if(this.current.type == Token.Type.BRACE_OPEN) {
                    body = this.parseBlock();
                } else {
                    this.consume(Token.Type.PAREN_OPEN);
                    body = this.parseExpression();
                    this.consume(Token.Type.PAREN_CLOSE);
                }
                return new AstNode(
                    AstNode.Type.PRAEFIXUM,
                    new AstNode.Praefixum(body),
                    this.since(start)
                );
            }
            case KEYWORD_SCRIPTUM: {
                this.next();
                this.consume(Token.Type.PAREN_OPEN);
                String format = this.consume(Token.Type.STRING).content;
                List<AstNode> arguments = List.of();
                if(this.accept(Token.Type.COMMA)) {
                    arguments = this.parseArguments(Token.Type.PAREN_CLOSE);
                } else {
                    this.consume(Token.Type.PAREN_CLOSE);
                }
                return new AstNode(
                    AstNode.Type.SCRIPTUM,
                    new AstNode.Scriptum(format, arguments),
                    this.since(start)
                );
            }
            case KEYWORD_FINGE: {
                this.next();
                String variant = this.parseIdentifier();
                List<AstNode.Property> fields = List.of();
                if(this.current.type == Token.Type.BRACE_OPEN) {
                    fields = this.parseProperties();
                }
                Optional<String> unionName = Optional.empty();
                if(this.accept(Token.Type.KEYWORD_QUA)) {
                    unionName = Optional.of(this.parseIdentifier());
                }
                return new AstNode(
                    AstNode.Type.FINGE,
                    new AstNode.Finge(variant, fields, unionName),
                    this.since(start)
                );
            }
            case KEYWORD_NOVUM: {
                this.next();
                String className = this.parseIdentifier();
                List<AstNode> arguments = List.of();
                if(this.accept(Token.Type.PAREN_OPEN)) {
                    arguments = this.parseArguments(Token.Type.PAREN_CLOSE);
                }
                Optional<AstNode> overrides = Optional.empty();
                if(this.current.type == Token.Type.BRACE_OPEN) {
                    Token objectStart = this.current;
                    List<AstNode.Property> properties = this.parseProperties();
                    overrides = Optional.of(new AstNode(
                        AstNode.Type.OBJECT,
                        new AstNode.ObjectLiteral(properties),
                        this.since(objectStart)
                    ));
                }
                return new AstNode(
                    AstNode.Type.NOVUM,
                    new AstNode.Novum(className, arguments, overrides),
                    this.since(start)
                );
            }
            default:
                this.throwUnexpected("an expression");
                return null;
        }
    }

}
