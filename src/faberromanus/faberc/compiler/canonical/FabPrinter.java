package faberromanus.faberc.compiler.canonical;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import faberromanus.faberc.compiler.Options;
import faberromanus.faberc.compiler.UnknownNodeException;
import faberromanus.faberc.compiler.backend.Literals;
import faberromanus.faberc.compiler.backend.Precedence;
import faberromanus.faberc.compiler.frontend.AstNode;
import faberromanus.faberc.compiler.frontend.Lexer;
import faberromanus.faberc.compiler.layout.Doc;
import faberromanus.faberc.compiler.layout.DocRenderer;

/**
 * Builds the layout document of a Faber syntax tree. The printed text
 * parses back into a tree of the same shape, and printing that tree
 * again yields the same text.
 */
public class FabPrinter {

    private static final String NAME = "canonical printer";

    private final Options options;
    private final String text;
    private final CommentAttacher.Attached comments;

    /**
     * @param text the text the tree was parsed from, used to keep blank
     * lines between statements, or {@code null} if there is none
     */
    public FabPrinter(
        Options options, String text, CommentAttacher.Attached comments
    ) {
        this.options = options;
        this.text = text;
        this.comments = comments;
    }

    public Doc print(AstNode program) {
        if(program.type != AstNode.Type.PROGRAM) {
            throw new UnknownNodeException(NAME, program.type, program.source);
        }
        Doc body = this.statementList(program);
        if(CommentAttacher.childrenOf(program).isEmpty()
                && this.comments.dangling(program).isEmpty()) {
            return Doc.EMPTY;
        }
        return Doc.concat(body, Doc.HARDLINE);
    }

    // layout helpers

    private static Doc text(String text) {
        return Doc.text(text);
    }

    private Doc delimited(
        String open, List<Doc> items, String close, boolean padded
    ) {
        if(items.isEmpty()) {
            return FabPrinter.text(open + close);
        }
        String pad = padded? " " : "";
        if(items.size() < this.options.breakThreshold()) {
            return Doc.concat(
                FabPrinter.text(open + pad),
                Doc.join(FabPrinter.text(", "), items),
                FabPrinter.text(pad + close)
            );
        }
        Doc edge = padded? Doc.LINE : Doc.SOFTLINE;
        return Doc.group(
            FabPrinter.text(open),
            Doc.indent(
                edge,
                Doc.join(Doc.concat(FabPrinter.text(","), Doc.LINE), items)
            ),
            edge,
            FabPrinter.text(close)
        );
    }

    private Doc bare(List<Doc> items) {
        if(items.size() < this.options.breakThreshold()) {
            return Doc.join(FabPrinter.text(", "), items);
        }
        return Doc.group(Doc.indent(
            Doc.join(Doc.concat(FabPrinter.text(","), Doc.LINE), items)
        ));
    }

    private static String typeParams(List<String> typeParams) {
        return typeParams.isEmpty()
            ? ""
            : "<" + String.join(", ", typeParams) + ">";
    }

    private static Doc firstText(Doc doc) {
        switch(doc.type) {
            case TEXT: {
                return doc.<Doc.Text>getValue().text().isEmpty()? null : doc;
            }
            case INDENT:
            case GROUP:
                return FabPrinter.firstText(
                    doc.<Doc.Nested>getValue().content()
                );
            case CONCAT: {
                for(Doc part: doc.<Doc.Concat>getValue().parts()) {
                    Doc found = FabPrinter.firstText(part);
                    if(found != null) { return found; }
                }
                return null;
            }
            default:
                return null;
        }
    }

    // comments and statement lists

    private Doc comment(Comment comment) {
        if(comment.kind() == Comment.Kind.LINE) {
            return FabPrinter.text(comment.text().stripTrailing());
        }
        String[] lines = comment.text().split("\n", -1);
        List<Doc> parts = new ArrayList<>();
        for(int i = 0; i < lines.length; i += 1) {
            String line = i == 0? lines[i] : lines[i].strip();
            if(i > 0 && line.startsWith("*")) {
                line = " " + line;
            }
            parts.add(FabPrinter.text(line.stripTrailing()));
        }
        return Doc.join(Doc.HARDLINE, parts);
    }

    private boolean hasGap(int end, int start) {
        if(this.text == null || end >= start || start > this.text.length()) {
            return false;
        }
        int newlines = 0;
        for(int i = end; i < start; i += 1) {
            if(this.text.charAt(i) == '\n') { newlines += 1; }
        }
        return newlines >= 2;
    }

    private int startWithComments(AstNode node) {
        List<Comment> leading = this.comments.leading(node);
        return leading.isEmpty()
            ? node.source.startOffset()
            : Math.min(leading.get(0).start(), node.source.startOffset());
    }

    private int endWithComments(AstNode node) {
        int end = node.source.endOffset();
        for(Comment comment: this.comments.trailing(node)) {
            end = Math.max(end, comment.end());
        }
        return end;
    }

    private Doc withComments(AstNode node, Doc doc) {
        List<Doc> parts = new ArrayList<>();
        List<Comment> leading = this.comments.leading(node);
        for(int i = 0; i < leading.size(); i += 1) {
            parts.add(this.comment(leading.get(i)));
            parts.add(Doc.HARDLINE);
            int nextStart = i + 1 < leading.size()
                ? leading.get(i + 1).start()
                : node.source.startOffset();
            if(this.hasGap(leading.get(i).end(), nextStart)) {
                parts.add(Doc.HARDLINE);
            }
        }
        parts.add(doc);
        for(Comment comment: this.comments.trailing(node)) {
            parts.add(FabPrinter.text(" "));
            parts.add(this.comment(comment));
        }
        return Doc.concat(parts);
    }

    private Doc statementList(AstNode container) {
        List<Doc> parts = new ArrayList<>();
        int previousEnd = -1;
        for(AstNode child: CommentAttacher.childrenOf(container)) {
            if(previousEnd != -1) {
                parts.add(Doc.HARDLINE);
                if(this.hasGap(previousEnd, this.startWithComments(child))) {
                    parts.add(Doc.HARDLINE);
                }
            }
            parts.add(this.withComments(child, this.statement(child)));
            previousEnd = this.endWithComments(child);
        }
        for(Comment comment: this.comments.dangling(container)) {
            if(previousEnd != -1) {
                parts.add(Doc.HARDLINE);
                if(this.hasGap(previousEnd, comment.start())) {
                    parts.add(Doc.HARDLINE);
                }
            }
            parts.add(this.comment(comment));
            previousEnd = comment.end();
        }
        return Doc.concat(parts);
    }

    private Doc body(AstNode container) {
        if(CommentAttacher.childrenOf(container).isEmpty()
                && this.comments.dangling(container).isEmpty()) {
            return FabPrinter.text("{}");
        }
        return Doc.concat(
            FabPrinter.text("{"),
            Doc.indent(Doc.HARDLINE, this.statementList(container)),
            Doc.HARDLINE,
            FabPrinter.text("}")
        );
    }

    private Doc lines(String head, List<Doc> entries) {
        if(entries.isEmpty()) {
            return FabPrinter.text(head + "{}");
        }
        return Doc.concat(
            FabPrinter.text(head + "{"),
            Doc.indent(Doc.HARDLINE, Doc.join(Doc.HARDLINE, entries)),
            Doc.HARDLINE,
            FabPrinter.text("}")
        );
    }

    private Doc cape(Optional<AstNode.CatchClause> cape) {
        if(cape.isEmpty()) { return Doc.EMPTY; }
        return Doc.concat(
            FabPrinter.text(" cape " + cape.get().name() + " "),
            this.body(cape.get().body())
        );
    }

    // statements

    public Doc statement(AstNode node) {
        switch(node.type) {
            case IMPORT: {
                AstNode.Import data = node.getValue();
                String head = "ex " + Literals.quote(data.source())
                    + " importa ";
                if(data.wildcard()) {
                    return FabPrinter.text(head + "*");
                }
                return Doc.concat(
                    FabPrinter.text(head), this.specifiers(data.specifiers())
                );
            }
            case DESTRUCTURE: {
                AstNode.Destructure data = node.getValue();
                return Doc.concat(
                    FabPrinter.text("ex "),
                    this.exSource(data.source()),
                    FabPrinter.text(" " + data.kind().keyword + " "),
                    this.specifiers(data.specifiers())
                );
            }
            case VARIABLE: {
                AstNode.Variable data = node.getValue();
                List<Doc> parts = new ArrayList<>();
                parts.add(FabPrinter.text(data.kind().keyword + " "));
                if(data.type().isPresent()) {
                    parts.add(this.type(data.type().get()));
                    parts.add(FabPrinter.text(" "));
                }
                parts.add(this.target(data.target()));
                if(data.value().isPresent()) {
                    parts.add(FabPrinter.text(" = "));
                    parts.add(this.expression(data.value().get()));
                }
                return Doc.concat(parts);
            }
            case FUNCTION:
                return this.function(node);
            case TYPE_ALIAS: {
                AstNode.TypeAlias data = node.getValue();
                return Doc.concat(
                    FabPrinter.text("typus " + data.name() + " = "),
                    this.type(data.type())
                );
            }
            case ORDO: {
                AstNode.Ordo data = node.getValue();
                List<Doc> members = new ArrayList<>();
                for(AstNode.OrdoMember member: data.members()) {
                    members.add(member.value().isEmpty()
                        ? FabPrinter.text(member.name())
                        : Doc.concat(
                            FabPrinter.text(member.name() + " = "),
                            this.expression(member.value().get())
                        )
                    );
                }
                return Doc.concat(
                    FabPrinter.text("ordo " + data.name() + " "),
                    this.delimited("{", members, "}", true)
                );
            }
            case DISCRETIO: {
                AstNode.Discretio data = node.getValue();
                List<Doc> variants = new ArrayList<>();
                for(AstNode.VariantDecl variant: data.variants()) {
                    if(variant.fields().isEmpty()) {
                        variants.add(FabPrinter.text(variant.name()));
                        continue;
                    }
                    List<Doc> fields = new ArrayList<>();
                    for(AstNode.VariantField field: variant.fields()) {
                        fields.add(Doc.concat(
                            this.type(field.type()),
                            FabPrinter.text(" " + field.name())
                        ));
                    }
                    variants.add(Doc.concat(
                        FabPrinter.text(variant.name() + " "),
                        this.delimited("{", fields, "}", true)
                    ));
                }
                return this.lines(
                    "discretio " + data.name()
                        + FabPrinter.typeParams(data.typeParams()) + " ",
                    variants
                );
            }
            case GENUS: {
                AstNode.Genus data = node.getValue();
                String head = "genus " + data.name()
                    + FabPrinter.typeParams(data.typeParams());
                if(!data.implemented().isEmpty()) {
                    head += " implet " + String.join(", ", data.implemented());
                }
                return Doc.concat(FabPrinter.text(head + " "), this.body(node));
            }
            case GENUS_FIELD: {
                AstNode.GenusField data = node.getValue();
                List<Doc> parts = new ArrayList<>();
                parts.add(FabPrinter.text(
                    FabPrinter.modifiers(data.isPrivate(), data.isStatic())
                ));
                parts.add(this.type(data.type()));
                parts.add(FabPrinter.text(" " + data.name()));
                if(data.init().isPresent()) {
                    parts.add(FabPrinter.text(": "));
                    parts.add(this.expression(data.init().get()));
                }
                return Doc.concat(parts);
            }
            case PACTUM: {
                AstNode.Pactum data = node.getValue();
                return Doc.concat(
                    FabPrinter.text(
                        "pactum " + data.name()
                            + FabPrinter.typeParams(data.typeParams()) + " "
                    ),
                    this.body(node)
                );
            }
            case EXPRESSION_STATEMENT: {
                AstNode expr = node.<AstNode.MonoOp>getValue().value();
                Doc doc = this.expression(expr);
                if(FabPrinter.leftmost(expr).type == AstNode.Type.OBJECT) {
                    doc = FabPrinter.parens(doc);
                }
                Doc first = FabPrinter.firstText(doc);
                String start = first == null
                    ? ""
                    : first.<Doc.Text>getValue().text();
                boolean continuesPrevious = start.startsWith("(")
                    || start.startsWith("[")
                    || start.startsWith("-")
                    || start.startsWith("+");
                return continuesPrevious
                    ? Doc.concat(FabPrinter.text(";"), doc)
                    : doc;
            }
            case SI:
                return this.si(node);
            case DUM: {
                AstNode.Dum data = node.getValue();
                return Doc.concat(
                    FabPrinter.text("dum "),
                    this.head(data.condition()),
                    FabPrinter.text(" "),
                    this.body(data.body()),
                    this.cape(data.cape())
                );
            }
            case ITERATIO: {
                AstNode.Iteratio data = node.getValue();
                boolean ex = data.kind() == AstNode.IterKind.EX;
                return Doc.concat(
                    FabPrinter.text(ex? "ex " : "de "),
                    ex? this.exSource(data.iterable())
                        : this.head(data.iterable()),
                    FabPrinter.text(" pro " + data.binding() + " "),
                    this.body(data.body()),
                    this.cape(data.cape())
                );
            }
            case ELIGE: {
                AstNode.Elige data = node.getValue();
                List<Doc> cases = new ArrayList<>();
                for(AstNode.EligeCase c: data.cases()) {
                    cases.add(Doc.concat(
                        FabPrinter.text("si "),
                        this.head(c.value()),
                        FabPrinter.text(" "),
                        this.body(c.body())
                    ));
                }
                if(data.otherwise().isPresent()) {
                    cases.add(Doc.concat(
                        FabPrinter.text("aliter "),
                        this.body(data.otherwise().get())
                    ));
                }
                return Doc.concat(
                    FabPrinter.text("elige "),
                    this.head(data.subject()),
                    this.lines(" ", cases),
                    this.cape(data.cape())
                );
            }
            case DISCERNE: {
                AstNode.Discerne data = node.getValue();
                List<Doc> cases = new ArrayList<>();
                for(AstNode.DiscerneCase c: data.cases()) {
                    String pattern = "si " + c.variant();
                    if(c.alias().isPresent()) {
                        pattern += " ut " + c.alias().get();
                    } else if(!c.bindings().isEmpty()) {
                        pattern += " pro " + String.join(", ", c.bindings());
                    }
                    cases.add(Doc.concat(
                        FabPrinter.text(pattern + " "), this.body(c.body())
                    ));
                }
                if(data.otherwise().isPresent()) {
                    cases.add(Doc.concat(
                        FabPrinter.text("aliter "),
                        this.body(data.otherwise().get())
                    ));
                }
                return Doc.concat(
                    FabPrinter.text("discerne "),
                    this.head(data.subject()),
                    this.lines(" ", cases)
                );
            }
            case CUSTODI: {
                List<Doc> guards = new ArrayList<>();
                for(AstNode.Guard guard: node.<AstNode.Custodi>getValue()
                        .guards()) {
                    guards.add(Doc.concat(
                        FabPrinter.text("si "),
                        this.head(guard.condition()),
                        FabPrinter.text(" "),
                        this.body(guard.body())
                    ));
                }
                return this.lines("custodi ", guards);
            }
            case ADFIRMA: {
                AstNode.Adfirma data = node.getValue();
                Doc condition = Doc.concat(
                    FabPrinter.text("adfirma "),
                    this.expression(data.condition())
                );
                if(data.message().isEmpty()) { return condition; }
                return Doc.concat(
                    condition,
                    FabPrinter.text(", "),
                    this.expression(data.message().get())
                );
            }
            case REDDE: {
                Optional<AstNode> value = node.<AstNode.Redde>getValue()
                    .value();
                if(value.isEmpty()) { return FabPrinter.text("redde"); }
                return Doc.concat(
                    FabPrinter.text("redde "), this.expression(value.get())
                );
            }
            case RUMPE:
                return FabPrinter.text("rumpe");
            case PERGE:
                return FabPrinter.text("perge");
            case BLOCK:
                return this.body(node);
            case IACE: {
                AstNode.Iace data = node.getValue();
                return Doc.concat(
                    FabPrinter.text(data.fatal()? "mori " : "iace "),
                    this.expression(data.value())
                );
            }
            case SCRIBE: {
                AstNode.Scribe data = node.getValue();
                return Doc.concat(
                    FabPrinter.text(data.level().keyword + " "),
                    this.bare(this.expressions(data.arguments()))
                );
            }
            case TEMPTA: {
                AstNode.Tempta data = node.getValue();
                List<Doc> parts = new ArrayList<>();
                parts.add(FabPrinter.text("tempta "));
                parts.add(this.body(data.body()));
                parts.add(this.cape(data.cape()));
                if(data.demum().isPresent()) {
                    parts.add(FabPrinter.text(" demum "));
                    parts.add(this.body(data.demum().get()));
                }
                return Doc.concat(parts);
            }
            case CURA:
                return this.cura(node.getValue());
            case PRAEPARA: {
                AstNode.Praepara data = node.getValue();
                String keyword = (data.after()? "post" : "prae") + "para"
                    + (data.async()? "bit" : "");
                return Doc.concat(
                    FabPrinter.text(keyword + (data.all()? " omnia " : " ")),
                    this.body(data.body())
                );
            }
            case INCIPIT: {
                AstNode.Incipit data = node.getValue();
                String keyword = data.async()? "incipiet " : "incipit ";
                if(data.body().type != AstNode.Type.BLOCK) {
                    return Doc.concat(
                        FabPrinter.text(keyword + "ergo "),
                        this.statement(data.body())
                    );
                }
                return Doc.concat(
                    FabPrinter.text(keyword), this.body(data.body())
                );
            }
            case IN: {
                AstNode.In data = node.getValue();
                return Doc.concat(
                    FabPrinter.text("in "),
                    this.head(data.object()),
                    FabPrinter.text(" "),
                    this.body(data.body())
                );
            }
            case PROBANDUM: {
                AstNode.Probandum data = node.getValue();
                return Doc.concat(
                    FabPrinter.text(
                        "probandum " + Literals.quote(data.name()) + " "
                    ),
                    this.body(node)
                );
            }
            case PROBA: {
                AstNode.Proba data = node.getValue();
                String head = "proba ";
                if(data.modifier().isPresent()) {
                    head += data.modifier().get().keyword + " "
                        + Literals.quote(data.reason().orElse("")) + " ";
                }
                return Doc.concat(
                    FabPrinter.text(head + Literals.quote(data.name()) + " "),
                    this.body(data.body())
                );
            }
            case FAC: {
                AstNode.Fac data = node.getValue();
                return Doc.concat(
                    FabPrinter.text("fac "),
                    this.body(data.body()),
                    this.cape(data.cape())
                );
            }
            default:
                throw new UnknownNodeException(NAME, node.type, node.source);
        }
    }

    private Doc cura(AstNode.Cura data) {
        List<Doc> parts = new ArrayList<>();
        parts.add(FabPrinter.text("cura "));
        if(data.curator().isPresent()) {
            parts.add(FabPrinter.text(data.curator().get()));
        } else {
            parts.add(this.expression(data.resource().get()));
        }
        parts.add(FabPrinter.text(data.async()? " fiet " : " pro "));
        data.type().ifPresent(t -> {
            parts.add(this.type(t));
            parts.add(FabPrinter.text(" "));
        });
        parts.add(FabPrinter.text(data.binding() + " "));
        parts.add(this.body(data.body()));
        parts.add(this.cape(data.cape()));
        return Doc.concat(parts);
    }

    private static String modifiers(boolean isPrivate, boolean isStatic) {
        return (isPrivate? "privatus " : "") + (isStatic? "generis " : "");
    }

    private Doc specifiers(List<AstNode.Specifier> specifiers) {
        List<Doc> items = new ArrayList<>();
        for(AstNode.Specifier specifier: specifiers) {
            items.add(FabPrinter.text(
                specifier.imported()
                    + specifier.local().map(l -> " ut " + l).orElse("")
            ));
        }
        return this.bare(items);
    }

    private Doc target(AstNode target) {
        switch(target.type) {
            case IDENTIFIER:
                return FabPrinter.text(
                    target.<AstNode.Identifier>getValue().name()
                );
            case OBJECT_PATTERN: {
                AstNode.ObjectPattern data = target.getValue();
                List<Doc> items = new ArrayList<>();
                for(AstNode.PatternProperty property: data.properties()) {
                    items.add(FabPrinter.text(
                        property.key().equals(property.local())
                            ? property.key()
                            : property.key() + ": " + property.local()
                    ));
                }
                data.rest().ifPresent(
                    rest -> items.add(FabPrinter.text("ceteri " + rest))
                );
                return this.delimited("{", items, "}", true);
            }
            case ARRAY_PATTERN: {
                AstNode.ArrayPattern data = target.getValue();
                List<Doc> items = new ArrayList<>();
                for(Optional<String> element: data.elements()) {
                    items.add(FabPrinter.text(element.orElse("_")));
                }
                data.rest().ifPresent(
                    rest -> items.add(FabPrinter.text("ceteri " + rest))
                );
                return this.delimited("[", items, "]", false);
            }
            default:
                throw new UnknownNodeException(NAME, target.type, target.source);
        }
    }

    private Doc function(AstNode node) {
        AstNode.Function data = node.getValue();
        List<Doc> parts = new ArrayList<>();
        parts.add(FabPrinter.text(
            FabPrinter.modifiers(data.isPrivate(), data.isStatic())
                + (data.futura()? "futura " : "")
                + (data.cursor()? "cursor " : "")
                + "functio " + data.name()
                + FabPrinter.typeParams(data.typeParams())
        ));
        parts.add(this.params(data.params()));
        if(data.returnType().isPresent()) {
            parts.add(FabPrinter.text(" " + data.verb().keyword + " "));
            parts.add(this.type(data.returnType().get()));
        }
        if(data.body().isPresent()) {
            parts.add(FabPrinter.text(" "));
            parts.add(this.body(data.body().get()));
        }
        return Doc.concat(parts);
    }

    private Doc params(List<AstNode> params) {
        List<Doc> items = new ArrayList<>();
        for(AstNode param: params) {
            items.add(this.parameter(param));
        }
        return this.delimited("(", items, ")", false);
    }

    private Doc parameter(AstNode node) {
        if(node.type != AstNode.Type.PARAMETER) {
            throw new UnknownNodeException(NAME, node.type, node.source);
        }
        AstNode.Parameter data = node.getValue();
        List<Doc> parts = new ArrayList<>();
        if(data.rest()) {
            parts.add(FabPrinter.text("ceteri "));
        }
        if(data.type().isPresent()) {
            parts.add(this.type(data.type().get()));
            parts.add(FabPrinter.text(" "));
        }
        parts.add(FabPrinter.text(data.name()));
        if(data.defaultValue().isPresent()) {
            parts.add(FabPrinter.text(" vel "));
            parts.add(this.expression(data.defaultValue().get()));
        }
        return Doc.concat(parts);
    }

    private Doc si(AstNode node) {
        AstNode.Si data = node.getValue();
        List<Doc> parts = new ArrayList<>();
        parts.add(FabPrinter.text("si "));
        parts.add(this.head(data.condition()));
        parts.add(FabPrinter.text(" "));
        parts.add(this.body(data.then()));
        parts.add(this.cape(data.cape()));
        if(data.otherwise().isPresent()) {
            AstNode otherwise = data.otherwise().get();
            parts.add(FabPrinter.text(" aliter "));
            parts.add(otherwise.type == AstNode.Type.SI
                ? this.si(otherwise)
                : this.body(otherwise)
            );
        }
        return Doc.concat(parts);
    }

    /**
     * Prints an expression that is directly followed by a block. A
     * trailing 'novum' or 'finge' without braces would take the block
     * as its own, so such expressions are parenthesized.
     */
    private Doc head(AstNode expr) {
        Doc doc = this.expression(expr);
        return FabPrinter.endsOpen(expr)? FabPrinter.parens(doc) : doc;
    }

    /** Prints the expression after 'ex', which may not read as an import. */
    private Doc exSource(AstNode expr) {
        boolean isString = expr.type == AstNode.Type.LITERAL
            && expr.<AstNode.Literal>getValue().kind()
                == AstNode.LiteralKind.STRING;
        return isString? FabPrinter.parens(this.expression(expr))
            : this.head(expr);
    }

    private static boolean endsOpen(AstNode expr) {
        switch(expr.type) {
            case NOVUM:
                return expr.<AstNode.Novum>getValue().overrides().isEmpty();
            case FINGE: {
                AstNode.Finge data = expr.getValue();
                return data.fields().isEmpty() && data.unionName().isEmpty();
            }
            case BINARY:
                return FabPrinter.endsOpen(
                    expr.<AstNode.Binary>getValue().right()
                );
            case UNARY:
                return FabPrinter.endsOpen(
                    expr.<AstNode.Unary>getValue().operand()
                );
            case CEDE:
            case SPREAD:
                return FabPrinter.endsOpen(
                    expr.<AstNode.MonoOp>getValue().value()
                );
            case EST:
                return FabPrinter.endsOpen(expr.<AstNode.Est>getValue().target());
            case RANGE: {
                AstNode.Range data = expr.getValue();
                return FabPrinter.endsOpen(data.step().orElse(data.end()));
            }
            case CONDITIONAL:
                return FabPrinter.endsOpen(
                    expr.<AstNode.Conditional>getValue().otherwise()
                );
            case ASSIGNMENT:
                return FabPrinter.endsOpen(
                    expr.<AstNode.Assignment>getValue().value()
                );
            case LAMBDA:
                return FabPrinter.endsOpen(
                    expr.<AstNode.Lambda>getValue().body()
                );
            case ARROW:
                return FabPrinter.endsOpen(
                    expr.<AstNode.Arrow>getValue().body()
                );
            default:
                return false;
        }
    }

    private static AstNode leftmost(AstNode expr) {
        switch(expr.type) {
            case BINARY:
                return FabPrinter.leftmost(expr.<AstNode.Binary>getValue().left());
            case EST:
                return FabPrinter.leftmost(expr.<AstNode.Est>getValue().value());
            case QUA:
                return FabPrinter.leftmost(expr.<AstNode.Qua>getValue().value());
            case RANGE:
                return FabPrinter.leftmost(expr.<AstNode.Range>getValue().start());
            case CALL:
                return FabPrinter.leftmost(expr.<AstNode.Call>getValue().callee());
            case MEMBER:
                return FabPrinter.leftmost(
                    expr.<AstNode.Member>getValue().object()
                );
            case ASSIGNMENT:
                return FabPrinter.leftmost(
                    expr.<AstNode.Assignment>getValue().target()
                );
            case CONDITIONAL:
                return FabPrinter.leftmost(
                    expr.<AstNode.Conditional>getValue().condition()
                );
            default:
                return expr;
        }
    }

    // expressions

    private static Doc parens(Doc doc) {
        return Doc.concat(FabPrinter.text("("), doc, FabPrinter.text(")"));
    }

    /** Prints an operand that the parser reads before an operator. */
    private Doc before(AstNode operand, int precedence) {
        Doc doc = this.expression(operand);
        return Precedence.of(operand) > precedence
            ? FabPrinter.parens(doc)
            : doc;
    }

    /** Prints an operand that the parser reads at the given precedence. */
    private Doc after(AstNode operand, int precedence) {
        Doc doc = this.expression(operand);
        int child = Precedence.of(operand);
        return child != 0 && child >= precedence
            ? FabPrinter.parens(doc)
            : doc;
    }

    private Doc receiver(AstNode object, boolean isCall) {
        Doc doc = this.expression(object);
        boolean number = object.type == AstNode.Type.LITERAL
            && object.<AstNode.Literal>getValue().kind()
                == AstNode.LiteralKind.NUMBER;
        boolean wrap = Precedence.of(object) > 0
            || number
            || (isCall && object.type == AstNode.Type.NOVUM);
        return wrap? FabPrinter.parens(doc) : doc;
    }

    private List<Doc> expressions(List<AstNode> nodes) {
        List<Doc> docs = new ArrayList<>();
        for(AstNode node: nodes) {
            docs.add(this.expression(node));
        }
        return docs;
    }

    private static boolean isPlainKey(String key) {
        if(key.isEmpty() || Lexer.isDigit(key.charAt(0))) { return false; }
        for(int i = 0; i < key.length(); i += 1) {
            if(!Lexer.isAlphanumeral(key.charAt(i))) { return false; }
        }
        return !Lexer.isKeyword(key);
    }

    private Doc properties(List<AstNode.Property> properties) {
        List<Doc> items = new ArrayList<>();
        for(AstNode.Property property: properties) {
            AstNode value = property.value();
            if(property.key().isEmpty()) {
                items.add(this.expression(value));
                continue;
            }
            boolean plain = FabPrinter.isPlainKey(property.key());
            boolean shorthand = plain
                && value.type == AstNode.Type.IDENTIFIER
                && value.<AstNode.Identifier>getValue().name()
                    .equals(property.key());
            if(shorthand) {
                items.add(FabPrinter.text(property.key()));
                continue;
            }
            String key = plain
                ? property.key()
                : Literals.quote(property.key());
            items.add(Doc.concat(
                FabPrinter.text(key + ": "), this.expression(value)
            ));
        }
        return this.delimited("{", items, "}", true);
    }

    private static String accessPrefix(AstNode.Access access) {
        switch(access) {
            case OPTIONAL: return "?";
            case NON_NULL: return "!";
            default: return "";
        }
    }

    private String flat(AstNode expr) {
        return new DocRenderer(Integer.MAX_VALUE, this.options.indent())
            .render(this.expression(expr));
    }

    public Doc expression(AstNode node) {
        switch(node.type) {
            case IDENTIFIER:
                return FabPrinter.text(
                    node.<AstNode.Identifier>getValue().name()
                );
            case EGO:
                return FabPrinter.text("ego");
            case LITERAL: {
                AstNode.Literal data = node.getValue();
                switch(data.kind()) {
                    case STRING:
                        return FabPrinter.text(Literals.quote(data.value()));
                    case NIHIL:
                        return FabPrinter.text("nihil");
                    default:
                        return FabPrinter.text(data.value());
                }
            }
            case TEMPLATE: {
                AstNode.Template data = node.getValue();
                StringBuilder out = new StringBuilder("`");
                for(int i = 0; i < data.quasis().size(); i += 1) {
                    out.append(data.quasis().get(i));
                    if(i < data.expressions().size()) {
                        out.append("${");
                        out.append(this.flat(data.expressions().get(i)));
                        out.append("}");
                    }
                }
                out.append("`");
                return Doc.literal(out.toString());
            }
            case ARRAY:
                return this.delimited(
                    "[",
                    this.expressions(node.<AstNode.Elements>getValue().elements()),
                    "]", false
                );
            case OBJECT:
                return this.properties(
                    node.<AstNode.ObjectLiteral>getValue().properties()
                );
            case SPREAD:
            case CEDE: {
                AstNode value = node.<AstNode.MonoOp>getValue().value();
                return Doc.concat(
                    FabPrinter.text(
                        node.type == AstNode.Type.SPREAD? "sparge " : "cede "
                    ),
                    this.before(value, Precedence.PREFIX)
                );
            }
            case RANGE: {
                AstNode.Range data = node.getValue();
                int precedence = Precedence.of(node);
                List<Doc> parts = new ArrayList<>();
                parts.add(this.before(data.start(), precedence));
                parts.add(FabPrinter.text(
                    data.kind() == AstNode.RangeKind.INCLUSIVE
                        ? " usque "
                        : " .. "
                ));
                parts.add(this.after(data.end(), precedence));
                if(data.step().isPresent()) {
                    parts.add(FabPrinter.text(" per "));
                    parts.add(this.after(data.step().get(), precedence));
                }
                return Doc.concat(parts);
            }
            case BINARY: {
                AstNode.Binary data = node.getValue();
                int precedence = Precedence.of(node);
                return Doc.concat(
                    this.before(data.left(), precedence),
                    FabPrinter.text(" " + data.operator() + " "),
                    this.after(data.right(), precedence)
                );
            }
            case UNARY: {
                AstNode.Unary data = node.getValue();
                String operator = data.operator();
                boolean word = Character.isLetter(operator.charAt(0));
                Doc operand = this.before(data.operand(), Precedence.PREFIX);
                boolean doubled = !word
                    && data.operand().type == AstNode.Type.UNARY
                    && data.operand().<AstNode.Unary>getValue().operator()
                        .equals(operator);
                if(doubled) {
                    operand = FabPrinter.parens(operand);
                }
                return Doc.concat(
                    FabPrinter.text(word? operator + " " : operator), operand
                );
            }
            case EST: {
                AstNode.Est data = node.getValue();
                int precedence = Precedence.of(node);
                return Doc.concat(
                    this.before(data.value(), precedence),
                    FabPrinter.text(data.negated()? " non est " : " est "),
                    this.after(data.target(), precedence)
                );
            }
            case QUA: {
                AstNode.Qua data = node.getValue();
                Doc value = this.before(data.value(), Precedence.of(node));
                if(data.value().type == AstNode.Type.FINGE) {
                    value = FabPrinter.parens(value);
                }
                return Doc.concat(
                    value, FabPrinter.text(" qua "), this.type(data.type())
                );
            }
            case CALL: {
                AstNode.Call data = node.getValue();
                return Doc.concat(
                    this.receiver(data.callee(), true),
                    this.delimited(
                        FabPrinter.accessPrefix(data.access()) + "(",
                        this.expressions(data.arguments()), ")", false
                    )
                );
            }
            case MEMBER: {
                AstNode.Member data = node.getValue();
                String access = FabPrinter.accessPrefix(data.access());
                Doc object = this.receiver(data.object(), false);
                if(data.computed()) {
                    return Doc.concat(
                        object,
                        FabPrinter.text(access + "["),
                        this.expression(data.property()),
                        FabPrinter.text("]")
                    );
                }
                return Doc.concat(
                    object,
                    FabPrinter.text(access + "."),
                    this.expression(data.property())
                );
            }
            case LAMBDA: {
                AstNode.Lambda data = node.getValue();
                String head = data.params().isEmpty()
                    ? "pro "
                    : "pro " + String.join(", ", data.params()) + " ";
                if(data.body().type == AstNode.Type.BLOCK) {
                    return Doc.concat(
                        FabPrinter.text(head), this.body(data.body())
                    );
                }
                return Doc.concat(
                    FabPrinter.text(head + "redde "),
                    this.expression(data.body())
                );
            }
            case ARROW: {
                AstNode.Arrow data = node.getValue();
                Doc body;
                if(data.body().type == AstNode.Type.BLOCK) {
                    body = this.body(data.body());
                } else {
                    body = this.expression(data.body());
                    if(FabPrinter.leftmost(data.body()).type
                            == AstNode.Type.OBJECT) {
                        body = FabPrinter.parens(body);
                    }
                }
                return Doc.concat(
                    this.params(data.params()), FabPrinter.text(" => "), body
                );
            }
            case ASSIGNMENT: {
                AstNode.Assignment data = node.getValue();
                return Doc.concat(
                    this.expression(data.target()),
                    FabPrinter.text(" " + data.operator() + " "),
                    this.expression(data.value())
                );
            }
            case CONDITIONAL: {
                AstNode.Conditional data = node.getValue();
                Doc condition = this.expression(data.condition());
                if(Precedence.of(data.condition()) >= Precedence.CONDITIONAL) {
                    condition = FabPrinter.parens(condition);
                }
                return Doc.concat(
                    condition,
                    FabPrinter.text(" ? "),
                    this.expression(data.then()),
                    FabPrinter.text(" : "),
                    this.after(data.otherwise(), Precedence.ASSIGNMENT)
                );
            }
            case NOVUM: {
                AstNode.Novum data = node.getValue();
                List<Doc> parts = new ArrayList<>();
                parts.add(FabPrinter.text("novum " + data.className()));
                if(!data.arguments().isEmpty()) {
                    parts.add(this.delimited(
                        "(", this.expressions(data.arguments()), ")", false
                    ));
                }
                if(data.overrides().isPresent()) {
                    parts.add(FabPrinter.text(" "));
                    parts.add(this.expression(data.overrides().get()));
                }
                return Doc.concat(parts);
            }
            case PRAEFIXUM: {
                AstNode body = node.<AstNode.Praefixum>getValue().body();
                if(body.type == AstNode.Type.BLOCK) {
                    return Doc.concat(
                        FabPrinter.text("praefixum "), this.body(body)
                    );
                }
                return Doc.concat(
                    FabPrinter.text("praefixum("),
                    this.expression(body),
                    FabPrinter.text(")")
                );
            }
            case SCRIPTUM: {
                AstNode.Scriptum data = node.getValue();
                List<Doc> arguments = new ArrayList<>();
                arguments.add(FabPrinter.text(Literals.quote(data.format())));
                arguments.addAll(this.expressions(data.arguments()));
                return this.delimited("scriptum(", arguments, ")", false);
            }
            case REGEX: {
                AstNode.Regex data = node.getValue();
                return FabPrinter.text(
                    "sed " + Literals.quote(data.pattern())
                        + (data.flags().isEmpty()? "" : " " + data.flags())
                );
            }
            case LEGE:
                return FabPrinter.text(
                    node.<AstNode.Lege>getValue().line()? "lege lineam" : "lege"
                );
            case FINGE: {
                AstNode.Finge data = node.getValue();
                List<Doc> parts = new ArrayList<>();
                parts.add(FabPrinter.text("finge " + data.variant()));
                if(!data.fields().isEmpty()) {
                    parts.add(FabPrinter.text(" "));
                    parts.add(this.properties(data.fields()));
                }
                data.unionName().ifPresent(
                    union -> parts.add(FabPrinter.text(" qua " + union))
                );
                return Doc.concat(parts);
            }
            default:
                throw new UnknownNodeException(NAME, node.type, node.source);
        }
    }

    public Doc type(AstNode node) {
        if(node.type != AstNode.Type.TYPE) {
            throw new UnknownNodeException(NAME, node.type, node.source);
        }
        AstNode.TypeAnnotation data = node.getValue();
        List<Doc> parts = new ArrayList<>();
        parts.add(FabPrinter.text(data.name()));
        if(!data.arguments().isEmpty()) {
            List<Doc> arguments = new ArrayList<>();
            for(AstNode argument: data.arguments()) {
                arguments.add(this.type(argument));
            }
            parts.add(FabPrinter.text("<"));
            parts.add(Doc.join(FabPrinter.text(", "), arguments));
            parts.add(FabPrinter.text(">"));
        }
        parts.add(FabPrinter.text(
            (data.nullable()? "?" : "") + "[]".repeat(data.arrayDepth())
        ));
        return Doc.concat(parts);
    }

}
