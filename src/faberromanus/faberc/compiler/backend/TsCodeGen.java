package faberromanus.faberc.compiler.backend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import faberromanus.faberc.compiler.Options;
import faberromanus.faberc.compiler.Target;
import faberromanus.faberc.compiler.UnknownNodeException;
import faberromanus.faberc.compiler.UnsupportedConstructException;
import faberromanus.faberc.compiler.frontend.AstNode;
import faberromanus.faberc.compiler.frontend.DataType;

public class TsCodeGen implements CodeGen {

    private static final Logger LOGGER = Logger.getLogger(
        TsCodeGen.class.getName()
    );

    private static final Map<String, String> TYPE_NAMES = Map.ofEntries(
        Map.entry("textus", "string"),
        Map.entry("numerus", "number"),
        Map.entry("fractus", "number"),
        Map.entry("decimus", "Decimal"),
        Map.entry("magnus", "bigint"),
        Map.entry("bivalens", "boolean"),
        Map.entry("nihil", "null"),
        Map.entry("vacuum", "void"),
        Map.entry("numquam", "never"),
        Map.entry("octeti", "Uint8Array"),
        Map.entry("lista", "Array"),
        Map.entry("tabula", "Map"),
        Map.entry("copia", "Set"),
        Map.entry("promissum", "Promise"),
        Map.entry("erratum", "Error"),
        Map.entry("cursor", "Iterator"),
        Map.entry("objectum", "object"),
        Map.entry("ignotum", "unknown")
    );

    private static final Map<String, String> TYPEOF_NAMES = Map.of(
        "textus", "string",
        "numerus", "number",
        "fractus", "number",
        "magnus", "bigint",
        "bivalens", "boolean"
    );

    @FunctionalInterface
    private static interface Emitter {
        void emit(StringBuilder out);
    }

    private final Options options;
    private final Features features;
    private final List<FunctionMode> modeStack;
    private final Map<String, String> mathesisNames;
    private int depth;
    private int tempCounter;

    public TsCodeGen(Options options) {
        this.options = options;
        this.features = new Features();
        this.modeStack = new LinkedList<>();
        this.mathesisNames = new HashMap<>();
        this.depth = 0;
        this.tempCounter = 0;
    }

    public Features features() {
        return this.features;
    }

    @Override
    public String generate(AstNode program) {
        if(program.type != AstNode.Type.PROGRAM) {
            throw new UnknownNodeException(
                "TsCodeGen", program.type, program.source
            );
        }
        StringBuilder body = new StringBuilder();
        for(AstNode statement: program.<AstNode.Program>getValue().body()) {
            this.genStatement(statement, body);
        }
        String preamble = Preamble.render(Target.TYPESCRIPT, this.features);
        LOGGER.log(Level.FINE, "Generated TypeScript with features {0}",
            this.features);
        return preamble + body.toString();
    }

    private String indent() {
        return this.options.indent().repeat(this.depth);
    }

    private String semi() {
        return this.options.semicolons()? ";" : "";
    }

    private FunctionMode mode() {
        if(this.modeStack.isEmpty()) { return FunctionMode.TOP_LEVEL; }
        return this.modeStack.get(this.modeStack.size() - 1);
    }

    private void enterMode(FunctionMode mode) {
        this.modeStack.add(mode);
    }

    private void exitMode() {
        this.modeStack.remove(this.modeStack.size() - 1);
    }

    private String temp(String base) {
        String name = "_" + base + this.tempCounter;
        this.tempCounter += 1;
        return name;
    }

    private void line(String text, StringBuilder out) {
        out.append(this.indent());
        out.append(text);
        out.append("\n");
    }

    private void statementLine(String text, StringBuilder out) {
        this.line(text + this.semi(), out);
    }

    /** Appends "{", the statements of the block and a closing "}". */
    private void emitBlock(AstNode block, StringBuilder out) {
        out.append("{\n");
        this.depth += 1;
        this.emitStatements(block, out);
        this.depth -= 1;
        out.append(this.indent());
        out.append("}");
    }

    private void emitStatements(AstNode block, StringBuilder out) {
        for(AstNode statement: block.<AstNode.Block>getValue().body()) {
            this.genStatement(statement, out);
        }
    }

    private void withCape(
        Optional<AstNode.CatchClause> cape, StringBuilder out, Emitter inner
    ) {
        if(cape.isEmpty()) {
            inner.emit(out);
            return;
        }
        this.line("try {", out);
        this.depth += 1;
        inner.emit(out);
        this.depth -= 1;
        out.append(this.indent());
        out.append("} catch (");
        out.append(cape.get().name());
        out.append(") ");
        this.emitBlock(cape.get().body(), out);
        out.append("\n");
    }

    public void genStatement(AstNode node, StringBuilder out) {
        switch(node.type) {
            case IMPORT: {
                AstNode.Import data = node.getValue();
                if(data.source().equals(Mathesis.MODULE)) {
                    for(AstNode.Specifier specifier: data.specifiers()) {
                        this.mathesisNames.put(
                            specifier.localName(), specifier.imported()
                        );
                    }
                    return;
                }
                if(data.source().startsWith("norma")) {
                    return;
                }
                if(data.wildcard()) {
                    this.statementLine(
                        "import * as " + TsCodeGen.moduleAlias(data.source())
                            + " from " + Literals.quote(data.source()),
                        out
                    );
                    return;
                }
                List<String> specifiers = new ArrayList<>();
                for(AstNode.Specifier specifier: data.specifiers()) {
                    specifiers.add(specifier.local().isPresent()
                        ? specifier.imported() + " as " + specifier.local().get()
                        : specifier.imported()
                    );
                }
                this.statementLine(
                    "import { " + String.join(", ", specifiers) + " } from "
                        + Literals.quote(data.source()),
                    out
                );
            } break;
            case DESTRUCTURE: {
                AstNode.Destructure data = node.getValue();
                List<String> specifiers = new ArrayList<>();
                for(AstNode.Specifier specifier: data.specifiers()) {
                    specifiers.add(specifier.local().isPresent()
                        ? specifier.imported() + ": " + specifier.local().get()
                        : specifier.imported()
                    );
                }
                String source = this.genExpression(data.source());
                if(data.kind().isAwaited) { source = "await " + source; }
                this.statementLine(
                    (data.kind().isMutable? "let" : "const")
                        + " { " + String.join(", ", specifiers) + " } = "
                        + source,
                    out
                );
            } break;
            case VARIABLE: {
                AstNode.Variable data = node.getValue();
                StringBuilder text = new StringBuilder();
                text.append(data.kind().isMutable? "let " : "const ");
                text.append(this.genPattern(data.target()));
                if(data.type().isPresent()) {
                    text.append(": ");
                    text.append(this.genType(data.type().get()));
                }
                if(data.value().isPresent()) {
                    text.append(" = ");
                    if(data.kind().isAwaited) { text.append("await "); }
                    text.append(this.genExpression(data.value().get()));
                }
                this.statementLine(text.toString(), out);
            } break;
            case FUNCTION: {
                this.emitFunction(node, false, out);
            } break;
            case TYPE_ALIAS: {
                AstNode.TypeAlias data = node.getValue();
                this.statementLine(
                    "type " + data.name() + " = " + this.genType(data.type()),
                    out
                );
            } break;
            case ORDO: {
                AstNode.Ordo data = node.getValue();
                this.line("enum " + data.name() + " {", out);
                this.depth += 1;
                for(AstNode.OrdoMember member: data.members()) {
                    this.line(
                        member.name() + member.value()
                            .map(v -> " = " + this.genExpression(v))
                            .orElse("") + ",",
                        out
                    );
                }
                this.depth -= 1;
                this.line("}", out);
            } break;
            case DISCRETIO: {
                this.emitDiscretio(node, out);
            } break;
            case GENUS: {
                this.emitGenus(node, out);
            } break;
            case PACTUM: {
                AstNode.Pactum data = node.getValue();
                this.line(
                    "interface " + data.name()
                        + TsCodeGen.typeParams(data.typeParams()) + " {",
                    out
                );
                this.depth += 1;
                for(AstNode method: data.methods()) {
                    this.emitFunction(method, true, out);
                }
                this.depth -= 1;
                this.line("}", out);
            } break;
            case EXPRESSION_STATEMENT: {
                AstNode.MonoOp data = node.getValue();
                this.statementLine(this.genExpression(data.value()), out);
            } break;
            case SI: {
                AstNode.Si data = node.getValue();
                this.withCape(data.cape(), out, o -> {
                    o.append(this.indent());
                    this.emitSiChain(node, o);
                    o.append("\n");
                });
            } break;
            case DUM: {
                AstNode.Dum data = node.getValue();
                this.withCape(data.cape(), out, o -> {
                    o.append(this.indent());
                    o.append("while (");
                    o.append(this.genExpression(data.condition()));
                    o.append(") ");
                    this.emitBlock(data.body(), o);
                    o.append("\n");
                });
            } break;
            case ITERATIO: {
                AstNode.Iteratio data = node.getValue();
                this.withCape(data.cape(), out, o -> {
                    o.append(this.indent());
                    o.append(this.genLoopHeader(data));
                    o.append(" ");
                    this.emitBlock(data.body(), o);
                    o.append("\n");
                });
            } break;
            case ELIGE: {
                AstNode.Elige data = node.getValue();
                this.withCape(data.cape(), out, o -> this.emitElige(data, o));
            } break;
            case DISCERNE: {
                this.emitDiscerne(node, out);
            } break;
            case CUSTODI: {
                AstNode.Custodi data = node.getValue();
                for(AstNode.Guard guard: data.guards()) {
                    out.append(this.indent());
                    out.append("if (");
                    out.append(this.genExpression(guard.condition()));
                    out.append(") ");
                    this.emitBlock(guard.body(), out);
                    out.append("\n");
                }
            } break;
            case ADFIRMA: {
                AstNode.Adfirma data = node.getValue();
                String condition = this.genExpression(data.condition());
                String message = data.message().isPresent()
                    ? this.genExpression(data.message().get())
                    : Literals.quote("Assertion failed: " + condition);
                this.line(
                    "if (!(" + condition + ")) { throw new Error("
                        + message + ")" + this.semi() + " }",
                    out
                );
            } break;
            case REDDE: {
                AstNode.Redde data = node.getValue();
                Optional<String> value = data.value()
                    .map(v -> this.genExpression(v));
                FunctionMode mode = this.mode();
                if(!mode.isVerb()) {
                    this.statementLine(
                        value.map(v -> "return " + v).orElse("return"), out
                    );
                    return;
                }
                if(mode.isStream()) {
                    if(value.isPresent()) {
                        this.statementLine(
                            "yield respond.item(" + value.get() + ")", out
                        );
                    }
                } else {
                    this.statementLine(
                        "yield respond.ok(" + value.orElse("undefined") + ")",
                        out
                    );
                }
                this.statementLine("return", out);
            } break;
            case RUMPE: {
                this.statementLine("break", out);
            } break;
            case PERGE: {
                this.statementLine("continue", out);
            } break;
            case BLOCK: {
                out.append(this.indent());
                this.emitBlock(node, out);
                out.append("\n");
            } break;
            case IACE: {
                this.emitIace(node, out);
            } break;
            case SCRIBE: {
                AstNode.Scribe data = node.getValue();
                String method;
                switch(data.level()) {
                    case VIDE: method = "console.debug"; break;
                    case MONE: method = "console.warn"; break;
                    default: method = "console.log"; break;
                }
                this.statementLine(
                    method + "(" + this.genArguments(data.arguments()) + ")",
                    out
                );
            } break;
            case TEMPTA: {
                AstNode.Tempta data = node.getValue();
                out.append(this.indent());
                out.append("try ");
                this.emitBlock(data.body(), out);
                if(data.cape().isPresent()) {
                    out.append(" catch (");
                    out.append(data.cape().get().name());
                    out.append(") ");
                    this.emitBlock(data.cape().get().body(), out);
                }
                if(data.demum().isPresent() || data.cape().isEmpty()) {
                    out.append(" finally ");
                    if(data.demum().isPresent()) {
                        this.emitBlock(data.demum().get(), out);
                    } else {
                        out.append("{}");
                    }
                }
                out.append("\n");
            } break;
            case CURA: {
                this.emitCura(node.getValue(), out);
            } break;
            case PRAEPARA: {
                AstNode.Praepara data = node.getValue();
                String hook = (data.after()? "after" : "before")
                    + (data.all()? "All" : "Each");
                this.emitCallback(
                    hook + "(", ")", data.async(), data.body(), out
                );
            } break;
            case INCIPIT: {
                AstNode.Incipit data = node.getValue();
                if(!data.async()) {
                    if(data.body().type == AstNode.Type.BLOCK) {
                        this.emitStatements(data.body(), out);
                    } else {
                        this.genStatement(data.body(), out);
                    }
                    return;
                }
                this.emitCallback("(", ")()", true, data.body(), out);
            } break;
            case IN: {
                AstNode.In data = node.getValue();
                String object = this.hoistSubject(data.object(), "in", out);
                for(AstNode statement: data.body().<AstNode.Block>getValue()
                        .body()) {
                    Optional<AstNode.Assignment> field = Statements
                        .fieldAssignment(statement);
                    if(field.isEmpty()) {
                        this.genStatement(statement, out);
                        continue;
                    }
                    String name = field.get().target()
                        .<AstNode.Identifier>getValue().name();
                    this.statementLine(
                        object + "." + name + " " + field.get().operator()
                            + " " + this.genExpression(field.get().value()),
                        out
                    );
                }
            } break;
            case PROBANDUM: {
                AstNode.Probandum data = node.getValue();
                this.line(
                    "describe(" + Literals.quote(data.name()) + ", () => {",
                    out
                );
                this.depth += 1;
                for(AstNode member: data.body()) {
                    this.genStatement(member, out);
                }
                this.depth -= 1;
                this.statementLine("})", out);
            } break;
            case PROBA: {
                AstNode.Proba data = node.getValue();
                String runner = "test";
                if(data.modifier().isPresent()) {
                    runner = data.modifier().get()
                        == AstNode.ProbaModifier.OMITTE
                            ? "test.skip"
                            : "test.todo";
                }
                this.emitCallback(
                    runner + "(" + Literals.quote(Statements.testLabel(data))
                        + ", ",
                    ")", false, data.body(), out
                );
            } break;
            case FAC: {
                AstNode.Fac data = node.getValue();
                this.withCape(data.cape(), out, o -> {
                    o.append(this.indent());
                    this.emitBlock(data.body(), o);
                    o.append("\n");
                });
            } break;
            default: {
                throw new UnknownNodeException(
                    "TsCodeGen.genStatement", node.type, node.source
                );
            }
        }
    }

    /**
     * Emits an arrow function with the given body between a prefix and a
     * suffix, as the last argument of a call or as an invoked function.
     */
    private void emitCallback(
        String prefix, String suffix, boolean async, AstNode body,
        StringBuilder out
    ) {
        out.append(this.indent());
        out.append(prefix);
        out.append(async? "async () => " : "() => ");
        this.enterMode(new FunctionMode(
            AstNode.ReturnVerb.ARROW, async, false, this.mode().inMethod()
        ));
        try {
            if(body.type == AstNode.Type.BLOCK) {
                this.emitBlock(body, out);
            } else {
                out.append("{\n");
                this.depth += 1;
                this.genStatement(body, out);
                this.depth -= 1;
                out.append(this.indent());
                out.append("}");
            }
        } finally {
            this.exitMode();
        }
        out.append(suffix);
        out.append(this.semi());
        out.append("\n");
    }

    private void emitCura(AstNode.Cura data, StringBuilder out) {
        if(data.resource().isEmpty()) {
            // allocators have no counterpart
            this.withCape(data.cape(), out, o -> {
                o.append(this.indent());
                this.emitBlock(data.body(), o);
                o.append("\n");
            });
            return;
        }
        this.line("{", out);
        this.depth += 1;
        String resource = this.genExpression(data.resource().get());
        if(data.async() && data.resource().get().type != AstNode.Type.CEDE) {
            resource = "await " + resource;
        }
        this.statementLine(
            "const " + data.binding()
                + data.type().map(t -> ": " + this.genType(t)).orElse("")
                + " = " + resource,
            out
        );
        out.append(this.indent());
        out.append("try ");
        this.emitBlock(data.body(), out);
        if(data.cape().isPresent()) {
            out.append(" catch (");
            out.append(data.cape().get().name());
            out.append(") ");
            this.emitBlock(data.cape().get().body(), out);
        }
        out.append(" finally {\n");
        this.depth += 1;
        this.statementLine(data.binding() + ".solve?.()", out);
        this.depth -= 1;
        this.line("}", out);
        this.depth -= 1;
        this.line("}", out);
    }

    private static String moduleAlias(String source) {
        String base = source.substring(source.lastIndexOf('/') + 1);
        StringBuilder alias = new StringBuilder();
        for(int i = 0; i < base.length(); i += 1) {
            char c = base.charAt(i);
            alias.append(Character.isLetterOrDigit(c)? c : '_');
        }
        return alias.toString();
    }

    private static String typeParams(List<String> params) {
        if(params.isEmpty()) { return ""; }
        return "<" + String.join(", ", params) + ">";
    }

    private void emitSiChain(AstNode node, StringBuilder out) {
        AstNode.Si data = node.getValue();
        out.append("if (");
        out.append(this.genExpression(data.condition()));
        out.append(") ");
        this.emitBlock(data.then(), out);
        if(data.otherwise().isEmpty()) { return; }
        AstNode otherwise = data.otherwise().get();
        out.append(" else ");
        if(otherwise.type == AstNode.Type.SI
                && otherwise.<AstNode.Si>getValue().cape().isEmpty()) {
            this.emitSiChain(otherwise, out);
        } else if(otherwise.type == AstNode.Type.SI) {
            out.append("{\n");
            this.depth += 1;
            this.genStatement(otherwise, out);
            this.depth -= 1;
            out.append(this.indent());
            out.append("}");
        } else {
            this.emitBlock(otherwise, out);
        }
    }

    private String genLoopHeader(AstNode.Iteratio data) {
        if(data.kind() == AstNode.IterKind.DE) {
            return "for (const " + data.binding() + " in "
                + this.genExpression(data.iterable()) + ")";
        }
        if(data.iterable().type != AstNode.Type.RANGE) {
            return "for (const " + data.binding() + " of "
                + this.genExpression(data.iterable()) + ")";
        }
        AstNode.Range range = data.iterable().getValue();
        String i = data.binding();
        String comparison = range.kind() == AstNode.RangeKind.INCLUSIVE
            ? " <= " : " < ";
        String step = range.step()
            .map(s -> i + " += " + this.genExpression(s))
            .orElse(i + "++");
        return "for (let " + i + " = " + this.genExpression(range.start())
            + "; " + i + comparison
            + this.genOperand(range.end(), comparison.trim(), true)
            + "; " + step + ")";
    }

    private String hoistSubject(AstNode subject, String base, StringBuilder out) {
        String text = this.genExpression(subject);
        if(subject.type == AstNode.Type.IDENTIFIER
                || subject.type == AstNode.Type.EGO) {
            return text;
        }
        String name = this.temp(base);
        this.statementLine("const " + name + " = " + text, out);
        return name;
    }

    private void emitElige(AstNode.Elige data, StringBuilder out) {
        String subject = this.hoistSubject(data.subject(), "elige", out);
        out.append(this.indent());
        boolean first = true;
        for(AstNode.EligeCase eligeCase: data.cases()) {
            if(!first) { out.append(" else "); }
            first = false;
            out.append("if (");
            out.append(subject);
            out.append(" === ");
            out.append(this.genExpression(eligeCase.value()));
            out.append(") ");
            this.emitBlock(eligeCase.body(), out);
        }
        if(data.otherwise().isPresent()) {
            if(!first) { out.append(" else "); }
            this.emitBlock(data.otherwise().get(), out);
        }
        out.append("\n");
    }

    private void emitDiscerne(AstNode node, StringBuilder out) {
        AstNode.Discerne data = node.getValue();
        String subject = this.hoistSubject(data.subject(), "discerne", out);
        Optional<DataType> subjectType = data.subject().resolvedType;
        out.append(this.indent());
        boolean first = true;
        for(AstNode.DiscerneCase discerneCase: data.cases()) {
            if(!first) { out.append(" else "); }
            first = false;
            out.append("if (");
            out.append(subject);
            out.append(".tag === ");
            out.append(Literals.quote(discerneCase.variant()));
            out.append(") {\n");
            this.depth += 1;
            if(discerneCase.alias().isPresent()) {
                this.statementLine(
                    "const " + discerneCase.alias().get() + " = " + subject,
                    out
                );
            }
            if(!discerneCase.bindings().isEmpty()) {
                this.emitBindings(
                    subject, subjectType, discerneCase, out
                );
            }
            this.emitStatements(discerneCase.body(), out);
            this.depth -= 1;
            out.append(this.indent());
            out.append("}");
        }
        if(data.otherwise().isPresent()) {
            if(!first) { out.append(" else "); }
            this.emitBlock(data.otherwise().get(), out);
        }
        out.append("\n");
    }

    private void emitBindings(
        String subject, Optional<DataType> subjectType,
        AstNode.DiscerneCase discerneCase, StringBuilder out
    ) {
        Optional<DataType.Variant> variant = subjectType
            .flatMap(t -> t.findVariant(discerneCase.variant()));
        if(variant.isEmpty()) {
            LOGGER.log(
                Level.FINE,
                "No resolved union type for variant ''{0}'',"
                    + " binding fields by name",
                discerneCase.variant()
            );
            this.statementLine(
                "const { " + String.join(", ", discerneCase.bindings())
                    + " } = " + subject,
                out
            );
            return;
        }
        List<String> fields = variant.get().fieldNames();
        for(int i = 0; i < discerneCase.bindings().size(); i += 1) {
            if(i >= fields.size()) { break; }
            this.statementLine(
                "const " + discerneCase.bindings().get(i) + " = " + subject
                    + "." + fields.get(i),
                out
            );
        }
    }

    private String errorMessage(AstNode value) {
        String text = this.genExpression(value);
        boolean isString = value.type == AstNode.Type.TEMPLATE
            || value.type == AstNode.Type.SCRIPTUM
            || (value.type == AstNode.Type.LITERAL
                && value.<AstNode.Literal>getValue().kind()
                    == AstNode.LiteralKind.STRING);
        return isString? text : "String(" + text + ")";
    }

    private void emitIace(AstNode node, StringBuilder out) {
        AstNode.Iace data = node.getValue();
        if(data.fatal()) {
            this.features.add(Feature.PANIC);
            this.statementLine(
                "throw new Panic(" + this.errorMessage(data.value()) + ")",
                out
            );
            return;
        }
        if(this.mode().isVerb()) {
            this.statementLine(
                "yield respond.error(\"EFAIL\", "
                    + this.errorMessage(data.value()) + ")",
                out
            );
            this.statementLine("return", out);
            return;
        }
        String message = this.errorMessage(data.value());
        if(message.startsWith("String(")) {
            this.statementLine(
                "throw " + this.genExpression(data.value()), out
            );
        } else {
            this.statementLine("throw new Error(" + message + ")", out);
        }
    }

    private void emitDiscretio(AstNode node, StringBuilder out) {
        AstNode.Discretio data = node.getValue();
        this.line(
            "type " + data.name() + TsCodeGen.typeParams(data.typeParams())
                + " =",
            out
        );
        this.depth += 1;
        for(int v = 0; v < data.variants().size(); v += 1) {
            AstNode.VariantDecl variant = data.variants().get(v);
            StringBuilder text = new StringBuilder();
            text.append("| { tag: ");
            text.append(Literals.quote(variant.name()));
            for(AstNode.VariantField field: variant.fields()) {
                text.append("; ");
                text.append(field.name());
                text.append(": ");
                text.append(this.genType(field.type()));
            }
            text.append(" }");
            if(v == data.variants().size() - 1) { text.append(this.semi()); }
            this.line(text.toString(), out);
        }
        this.depth -= 1;
    }

    private void emitGenus(AstNode node, StringBuilder out) {
        AstNode.Genus data = node.getValue();
        StringBuilder header = new StringBuilder();
        header.append("class ");
        header.append(data.name());
        header.append(TsCodeGen.typeParams(data.typeParams()));
        if(!data.implemented().isEmpty()) {
            header.append(" implements ");
            header.append(String.join(", ", data.implemented()));
        }
        header.append(" {");
        this.line(header.toString(), out);
        this.depth += 1;
        List<AstNode.GenusField> instanceFields = new ArrayList<>();
        boolean hasFields = false;
        for(AstNode member: data.members()) {
            if(member.type != AstNode.Type.GENUS_FIELD) { continue; }
            AstNode.GenusField field = member.getValue();
            hasFields = true;
            if(!field.isStatic()) { instanceFields.add(field); }
            StringBuilder text = new StringBuilder();
            if(field.isPrivate()) { text.append("private "); }
            if(field.isStatic()) { text.append("static "); }
            text.append(field.name());
            text.append(": ");
            text.append(this.genType(field.type()));
            if(field.init().isPresent()) {
                text.append(" = ");
                text.append(this.genExpression(field.init().get()));
            }
            this.statementLine(text.toString(), out);
        }
        if(!instanceFields.isEmpty()) {
            out.append("\n");
            this.line(
                "constructor(overrides: Partial<" + data.name() + "> = {}) {",
                out
            );
            this.depth += 1;
            for(AstNode.GenusField field: instanceFields) {
                this.line(
                    "if (overrides." + field.name() + " !== undefined) this."
                        + field.name() + " = overrides." + field.name()
                        + this.semi(),
                    out
                );
            }
            this.depth -= 1;
            this.line("}", out);
        }
        boolean first = !hasFields;
        for(AstNode member: data.members()) {
            if(member.type != AstNode.Type.FUNCTION) { continue; }
            if(!first) { out.append("\n"); }
            first = false;
            this.emitFunction(member, true, out);
        }
        this.depth -= 1;
        this.line("}", out);
    }

    private String genParams(List<AstNode> params) {
        List<String> result = new ArrayList<>();
        for(AstNode param: params) {
            AstNode.Parameter data = param.getValue();
            StringBuilder text = new StringBuilder();
            if(data.rest()) { text.append("..."); }
            text.append(data.name());
            if(data.type().isPresent()) {
                String type = this.genType(data.type().get());
                text.append(": ");
                if(!data.rest()) {
                    text.append(type);
                } else if(type.contains(" ")) {
                    text.append("(").append(type).append(")[]");
                } else {
                    text.append(type).append("[]");
                }
            }
            if(data.defaultValue().isPresent()) {
                text.append(" = ");
                text.append(this.genExpression(data.defaultValue().get()));
            }
            result.add(text.toString());
        }
        return String.join(", ", result);
    }

    private static String wrapReturnType(FunctionMode mode, String type) {
        switch(mode.verb()) {
            case FIT: return type;
            case FIET: return "Promise<" + type + ">";
            case FIUNT: return "Generator<" + type + ">";
            case FIENT: return "AsyncGenerator<" + type + ">";
            default: break;
        }
        if(mode.isAsync() && mode.isGenerator()) {
            return "AsyncGenerator<" + type + ">";
        }
        if(mode.isGenerator()) { return "Generator<" + type + ">"; }
        if(mode.isAsync()) { return "Promise<" + type + ">"; }
        return type;
    }

    private void emitFunction(AstNode node, boolean inMethod, StringBuilder out) {
        AstNode.Function data = node.getValue();
        FunctionMode mode = FunctionMode.of(data, inMethod);
        boolean outerAsync = mode.isAsync();
        boolean outerGenerator = mode.isVerb()
            ? mode.isStream()
            : mode.isGenerator();
        StringBuilder signature = new StringBuilder();
        if(inMethod) {
            if(data.isPrivate()) { signature.append("private "); }
            if(data.isStatic()) { signature.append("static "); }
            if(outerAsync && data.body().isPresent()) {
                signature.append("async ");
            }
            if(outerGenerator && data.body().isPresent()) {
                signature.append("*");
            }
            signature.append(data.name());
        } else {
            if(data.body().isEmpty()) { signature.append("declare "); }
            if(outerAsync) { signature.append("async "); }
            signature.append("function");
            if(outerGenerator) { signature.append("*"); }
            signature.append(" ");
            signature.append(data.name());
        }
        signature.append(TsCodeGen.typeParams(data.typeParams()));
        signature.append("(");
        signature.append(this.genParams(data.params()));
        signature.append(")");
        if(data.returnType().isPresent()) {
            signature.append(": ");
            signature.append(TsCodeGen.wrapReturnType(
                mode, this.genType(data.returnType().get())
            ));
        }
        if(data.body().isEmpty()) {
            this.statementLine(signature.toString(), out);
            return;
        }
        this.enterMode(mode);
        try {
            out.append(this.indent());
            out.append(signature);
            out.append(" ");
            if(!mode.isVerb()) {
                this.emitBlock(data.body().get(), out);
                out.append("\n");
                return;
            }
            this.emitVerbBody(mode, data.body().get(), out);
        } finally {
            this.exitMode();
        }
    }

    private void emitVerbBody(FunctionMode mode, AstNode body, StringBuilder out) {
        String open;
        switch(mode.verb()) {
            case FIT:
                this.features.add(Feature.FLUMINA);
                open = "return drain((function* () {";
                break;
            case FIET:
                this.features.add(Feature.FLUMINA_ASYNC);
                open = "return drainAsync((async function* () {";
                break;
            case FIUNT:
                this.features.add(Feature.FLUMINA);
                open = "yield* flow((function* () {";
                break;
            case FIENT:
                this.features.add(Feature.FLUMINA_ASYNC);
                open = "yield* flowAsync((async function* () {";
                break;
            default:
                throw new IllegalArgumentException("not a verb!");
        }
        String invocation = mode.inMethod()? ".call(this)" : "()";
        out.append("{\n");
        this.depth += 1;
        this.line(open, out);
        this.depth += 1;
        this.emitStatements(body, out);
        this.statementLine("yield respond.done()", out);
        this.depth -= 1;
        this.statementLine("})" + invocation + ")", out);
        this.depth -= 1;
        this.line("}", out);
    }

    public String genType(AstNode node) {
        if(node.type != AstNode.Type.TYPE) {
            throw new UnknownNodeException(
                "TsCodeGen.genType", node.type, node.source
            );
        }
        AstNode.TypeAnnotation data = node.getValue();
        if(data.name().equals("decimus")) {
            this.features.add(Feature.DECIMAL);
        }
        String result = TYPE_NAMES.getOrDefault(data.name(), data.name());
        if(!data.arguments().isEmpty()) {
            List<String> arguments = new ArrayList<>();
            for(AstNode argument: data.arguments()) {
                arguments.add(this.genType(argument));
            }
            result += "<" + String.join(", ", arguments) + ">";
        }
        if(data.nullable()) {
            result += " | null";
            if(data.arrayDepth() > 0) { result = "(" + result + ")"; }
        }
        for(int i = 0; i < data.arrayDepth(); i += 1) {
            result += "[]";
        }
        return result;
    }

    private String genPattern(AstNode node) {
        switch(node.type) {
            case IDENTIFIER:
                return node.<AstNode.Identifier>getValue().name();
            case OBJECT_PATTERN: {
                AstNode.ObjectPattern data = node.getValue();
                List<String> parts = new ArrayList<>();
                for(AstNode.PatternProperty property: data.properties()) {
                    parts.add(property.key().equals(property.local())
                        ? property.key()
                        : property.key() + ": " + property.local()
                    );
                }
                data.rest().ifPresent(r -> parts.add("..." + r));
                return "{ " + String.join(", ", parts) + " }";
            }
            case ARRAY_PATTERN: {
                AstNode.ArrayPattern data = node.getValue();
                List<String> parts = new ArrayList<>();
                for(Optional<String> element: data.elements()) {
                    parts.add(element.orElse(""));
                }
                data.rest().ifPresent(r -> parts.add("..." + r));
                return "[" + String.join(", ", parts) + "]";
            }
            default:
                throw new UnknownNodeException(
                    "TsCodeGen.genPattern", node.type, node.source
                );
        }
    }

    private String genArguments(List<AstNode> arguments) {
        List<String> result = new ArrayList<>();
        for(AstNode argument: arguments) {
            result.add(this.genExpression(argument));
        }
        return String.join(", ", result);
    }

    private List<String> genArgumentList(List<AstNode> arguments) {
        List<String> result = new ArrayList<>();
        for(AstNode argument: arguments) {
            result.add(this.genExpression(argument));
        }
        return result;
    }

    /** Generates an expression used as the receiver of a postfix operator. */
    private String genReceiver(AstNode node) {
        String text = this.genExpression(node);
        boolean needsParens = Precedence.of(node) > 0
            || node.type == AstNode.Type.OBJECT
            || node.type == AstNode.Type.FINGE
            || (node.type == AstNode.Type.LITERAL
                && node.<AstNode.Literal>getValue().kind()
                    == AstNode.LiteralKind.NUMBER);
        return needsParens? "(" + text + ")" : text;
    }

    private String genOperand(AstNode node, String operator, boolean isRight) {
        String text = this.genExpression(node);
        return Precedence.needsParens(node, operator, isRight)
            ? "(" + text + ")"
            : text;
    }

    private static String binaryOperator(String operator) {
        switch(operator) {
            case "et": return "&&";
            case "aut": return "||";
            case "vel": return "??";
            case "==": return "===";
            case "!=": return "!==";
            default: return operator;
        }
    }

    private static String nullGuard(String receiver, String expression) {
        return "(" + receiver + " == null ? undefined : " + expression + ")";
    }

    public String genExpression(AstNode node) {
        switch(node.type) {
            case IDENTIFIER: {
                String name = node.<AstNode.Identifier>getValue().name();
                if(this.mathesisNames.containsKey(name)) {
                    Optional<Mathesis.Entry> constant = Mathesis.constant(
                        this.mathesisNames.get(name)
                    );
                    if(constant.isPresent()) {
                        return constant.get().ts().emit(List.of());
                    }
                }
                return name;
            }
            case EGO: return "this";
            case LITERAL: {
                AstNode.Literal data = node.getValue();
                switch(data.kind()) {
                    case NUMBER: return data.value();
                    case STRING: return Literals.quote(data.value());
                    case BOOLEAN:
                        return data.value().equals("verum")? "true" : "false";
                    case NIHIL: return "null";
                    default: throw new IllegalArgumentException(
                        "unhandled literal kind!"
                    );
                }
            }
            case TEMPLATE: {
                AstNode.Template data = node.getValue();
                StringBuilder out = new StringBuilder("`");
                for(int i = 0; i < data.quasis().size(); i += 1) {
                    out.append(data.quasis().get(i));
                    if(i < data.expressions().size()) {
                        out.append("${");
                        out.append(this.genExpression(data.expressions().get(i)));
                        out.append("}");
                    }
                }
                out.append("`");
                return out.toString();
            }
            case ARRAY: {
                AstNode.Elements data = node.getValue();
                return "[" + this.genArguments(data.elements()) + "]";
            }
            case OBJECT: {
                AstNode.ObjectLiteral data = node.getValue();
                return this.genObject(data.properties(), List.of());
            }
            case SPREAD: {
                AstNode.MonoOp data = node.getValue();
                return "..." + this.genReceiver(data.value());
            }
            case RANGE: {
                AstNode.Range data = node.getValue();
                String start = this.genExpression(data.start());
                String startOperand = Precedence.needsParens(
                    data.start(), "-", true
                )? "(" + start + ")" : start;
                String end = data.kind() == AstNode.RangeKind.EXCLUSIVE
                    ? this.genOperand(data.end(), "-", false)
                    : Ranges.exclusiveEnd(data, this.genExpression(data.end()));
                String length = end + " - " + startOperand;
                if(data.step().isEmpty()) {
                    return "Array.from({ length: " + length + " }, (_, i) => "
                        + startOperand + " + i)";
                }
                String step = this.genOperand(data.step().get(), "*", true);
                return "Array.from({ length: Math.ceil((" + length + ") / "
                    + step + ") }, (_, i) => " + startOperand + " + i * "
                    + step + ")";
            }
            case BINARY: {
                AstNode.Binary data = node.getValue();
                return this.genOperand(data.left(), data.operator(), false)
                    + " " + TsCodeGen.binaryOperator(data.operator()) + " "
                    + this.genOperand(data.right(), data.operator(), true);
            }
            case UNARY: {
                AstNode.Unary data = node.getValue();
                String operand = this.genExpression(data.operand());
                String wrapped = Precedence.of(data.operand()) > 0
                    ? "(" + operand + ")"
                    : operand;
                switch(data.operator()) {
                    case "non": return "!" + wrapped;
                    case "nulla":
                        return "(" + wrapped + " == null || (Array.isArray("
                            + wrapped + ") || typeof " + wrapped
                            + " === \"string\" ? " + wrapped
                            + ".length === 0 : typeof " + wrapped
                            + " === \"object\" ? Object.keys(" + wrapped
                            + ").length === 0 : !" + wrapped + "))";
                    case "nonnulla":
                        return "(" + wrapped + " != null && (Array.isArray("
                            + wrapped + ") || typeof " + wrapped
                            + " === \"string\" ? " + wrapped
                            + ".length > 0 : typeof " + wrapped
                            + " === \"object\" ? Object.keys(" + wrapped
                            + ").length > 0 : Boolean(" + wrapped + ")))";
                    default: return data.operator() + wrapped;
                }
            }
            case EST: {
                AstNode.Est data = node.getValue();
                return this.genEst(data);
            }
            case QUA: {
                AstNode.Qua data = node.getValue();
                return "(" + this.genReceiver(data.value()) + " as "
                    + this.genType(data.type()) + ")";
            }
            case CALL: {
                return this.genCall(node);
            }
            case MEMBER: {
                return this.genMember(node);
            }
            case LAMBDA: {
                AstNode.Lambda data = node.getValue();
                return "(" + String.join(", ", data.params()) + ") => "
                    + this.genFunctionBody(data.body());
            }
            case ARROW: {
                AstNode.Arrow data = node.getValue();
                return "(" + this.genParams(data.params()) + ") => "
                    + this.genFunctionBody(data.body());
            }
            case ASSIGNMENT: {
                AstNode.Assignment data = node.getValue();
                return this.genExpression(data.target()) + " "
                    + data.operator() + " " + this.genExpression(data.value());
            }
            case CONDITIONAL: {
                AstNode.Conditional data = node.getValue();
                String condition = this.genExpression(data.condition());
                if(Precedence.of(data.condition()) >= Precedence.CONDITIONAL) {
                    condition = "(" + condition + ")";
                }
                return condition + " ? " + this.genExpression(data.then())
                    + " : " + this.genExpression(data.otherwise());
            }
            case CEDE: {
                AstNode.MonoOp data = node.getValue();
                return this.genCede(node, this.genReceiver(data.value()));
            }
            case NOVUM: {
                AstNode.Novum data = node.getValue();
                List<String> arguments = this.genArgumentList(data.arguments());
                if(data.overrides().isPresent()) {
                    arguments.add(this.genExpression(data.overrides().get()));
                }
                return "new " + data.className() + "("
                    + String.join(", ", arguments) + ")";
            }
            case PRAEFIXUM: {
                AstNode.Praefixum data = node.getValue();
                if(data.body().type != AstNode.Type.BLOCK) {
                    return "(" + this.genExpression(data.body()) + ")";
                }
                this.enterMode(FunctionMode.nested(this.mode()));
                try {
                    StringBuilder out = new StringBuilder("(() => ");
                    this.emitBlock(data.body(), out);
                    out.append(")()");
                    return out.toString();
                } finally {
                    this.exitMode();
                }
            }
            case SCRIPTUM: {
                AstNode.Scriptum data = node.getValue();
                if(data.arguments().isEmpty()) {
                    return Literals.quote(data.format());
                }
                String[] parts = data.format().split("§", -1);
                StringBuilder out = new StringBuilder("`");
                for(int i = 0; i < parts.length; i += 1) {
                    out.append(parts[i]
                        .replace("\\", "\\\\")
                        .replace("`", "\\`")
                        .replace("${", "\\${"));
                    if(i < parts.length - 1) {
                        out.append("${");
                        out.append(i < data.arguments().size()
                            ? this.genExpression(data.arguments().get(i))
                            : "undefined");
                        out.append("}");
                    }
                }
                out.append("`");
                return out.toString();
            }
            case REGEX: {
                AstNode.Regex data = node.getValue();
                return "/" + data.pattern().replace("/", "\\/") + "/"
                    + data.flags();
            }
            case LEGE: {
                AstNode.Lege data = node.getValue();
                if(!data.line()) { return "await Bun.stdin.text()"; }
                return "(await (async () => { const rl = require(\"readline\")"
                    + ".createInterface({ input: process.stdin });"
                    + " for await (const line of rl) { rl.close(); return line; }"
                    + " return \"\"; })())";
            }
            case FINGE: {
                AstNode.Finge data = node.getValue();
                return this.genObject(
                    data.fields(),
                    List.of("tag: " + Literals.quote(data.variant()))
                );
            }
            default: {
                throw new UnknownNodeException(
                    "TsCodeGen.genExpression", node.type, node.source
                );
            }
        }
    }

    private String genObject(List<AstNode.Property> properties, List<String> leading) {
        List<String> parts = new ArrayList<>(leading);
        for(AstNode.Property property: properties) {
            AstNode value = property.value();
            if(value.type == AstNode.Type.SPREAD) {
                parts.add(this.genExpression(value));
                continue;
            }
            boolean shorthand = value.type == AstNode.Type.IDENTIFIER
                && value.<AstNode.Identifier>getValue().name()
                    .equals(property.key());
            String key = TsCodeGen.isIdentifier(property.key())
                ? property.key()
                : Literals.quote(property.key());
            parts.add(shorthand? key : key + ": " + this.genExpression(value));
        }
        if(parts.isEmpty()) { return "{}"; }
        return "{ " + String.join(", ", parts) + " }";
    }

    static boolean isIdentifier(String text) {
        if(text.isEmpty() || Character.isDigit(text.charAt(0))) {
            return false;
        }
        for(int i = 0; i < text.length(); i += 1) {
            char c = text.charAt(i);
            if(!Character.isLetterOrDigit(c) && c != '_' && c != '$') {
                return false;
            }
        }
        return true;
    }

    private String genFunctionBody(AstNode body) {
        this.enterMode(FunctionMode.nested(this.mode()));
        try {
            if(body.type == AstNode.Type.BLOCK) {
                StringBuilder out = new StringBuilder();
                this.emitBlock(body, out);
                return out.toString();
            }
            String text = this.genExpression(body);
            return body.type == AstNode.Type.OBJECT? "(" + text + ")" : text;
        } finally {
            this.exitMode();
        }
    }

    private String genCede(AstNode node, String value) {
        FunctionMode mode = this.mode();
        switch(mode.verb()) {
            case FIT:
                throw new UnsupportedConstructException(
                    "cede", Target.TYPESCRIPT,
                    "declare the function with 'fiet' to await values"
                        + " or with 'fiunt' to yield them",
                    node.source
                );
            case FIET: return "await " + value;
            case FIUNT: return "yield respond.item(" + value + ")";
            case FIENT: return "yield respond.item(await " + value + ")";
            default: break;
        }
        return mode.isGenerator()? "yield " + value : "await " + value;
    }

    private String genEst(AstNode.Est data) {
        String value = this.genReceiver(data.value());
        AstNode target = data.target();
        if(target.type == AstNode.Type.LITERAL
                && target.<AstNode.Literal>getValue().kind()
                    == AstNode.LiteralKind.NIHIL) {
            return value + (data.negated()? " !== null" : " === null");
        }
        if(target.type == AstNode.Type.IDENTIFIER) {
            String name = target.<AstNode.Identifier>getValue().name();
            if(TYPEOF_NAMES.containsKey(name)) {
                return "typeof " + value + (data.negated()? " !== " : " === ")
                    + Literals.quote(TYPEOF_NAMES.get(name));
            }
            if(name.equals("lista")) {
                return (data.negated()? "!" : "") + "Array.isArray("
                    + this.genExpression(data.value()) + ")";
            }
            String typeName = TYPE_NAMES.getOrDefault(name, name);
            String check = value + " instanceof " + typeName;
            return data.negated()? "!(" + check + ")" : check;
        }
        String check = value + " instanceof " + this.genReceiver(target);
        return data.negated()? "!(" + check + ")" : check;
    }

    private String genSlice(String receiver, AstNode.Range range) {
        String start = this.genExpression(range.start());
        String slice;
        if(Ranges.isOpenEnded(range)) {
            slice = receiver + ".slice(" + start + ")";
        } else {
            String end = Ranges.exclusiveEnd(
                range, this.genExpression(range.end())
            );
            slice = receiver + ".slice(" + start + ", " + end + ")";
        }
        if(range.step().isPresent()) {
            slice += ".filter((_, i) => i % "
                + this.genOperand(range.step().get(), "%", true)
                + " === 0)";
        }
        return slice;
    }

    private String genMember(AstNode node) {
        AstNode.Member data = node.getValue();
        String receiver = this.genReceiver(data.object());
        boolean optional = data.access() == AstNode.Access.OPTIONAL;
        String nonNull = data.access() == AstNode.Access.NON_NULL? "!" : "";
        if(!data.computed()) {
            String name = data.property().<AstNode.Identifier>getValue().name();
            Optional<CollectionMethod> method = MethodRegistry.lookupProperty(
                data.object().resolvedType, name
            );
            if(method.isPresent()) {
                String emitted = method.get().ts().emit(
                    receiver + nonNull, List.of()
                );
                return optional
                    ? TsCodeGen.nullGuard(receiver, emitted)
                    : emitted;
            }
            return receiver + (optional? "?." : nonNull + ".") + name;
        }
        AstNode index = data.property();
        if(index.type == AstNode.Type.RANGE) {
            String slice = this.genSlice(
                receiver + nonNull, index.<AstNode.Range>getValue()
            );
            return optional? TsCodeGen.nullGuard(receiver, slice) : slice;
        }
        String indexText = this.genExpression(index);
        if(Ranges.isNegativeLiteral(index)) {
            return receiver + (optional? "?." : nonNull + ".")
                + "at(" + indexText + ")";
        }
        return receiver + (optional? "?.[" : nonNull + "[") + indexText + "]";
    }

    private String genCall(AstNode node) {
        AstNode.Call data = node.getValue();
        AstNode callee = data.callee();
        List<String> arguments = this.genArgumentList(data.arguments());
        if(callee.type == AstNode.Type.IDENTIFIER) {
            String name = callee.<AstNode.Identifier>getValue().name();
            if(this.mathesisNames.containsKey(name)) {
                Optional<Mathesis.Entry> function = Mathesis.function(
                    this.mathesisNames.get(name)
                );
                if(function.isPresent()) {
                    return function.get().ts().emit(arguments);
                }
            }
        }
        if(callee.type == AstNode.Type.MEMBER
                && !callee.<AstNode.Member>getValue().computed()) {
            AstNode.Member member = callee.getValue();
            String name = member.property()
                .<AstNode.Identifier>getValue().name();
            Optional<CollectionMethod> method = MethodRegistry.lookup(
                member.object().resolvedType, name
            );
            if(method.isPresent()) {
                String receiver = this.genReceiver(member.object());
                String nonNull = member.access() == AstNode.Access.NON_NULL
                    ? "!" : "";
                String emitted = method.get().ts().emit(
                    receiver + nonNull, arguments
                );
                return member.access() == AstNode.Access.OPTIONAL
                    ? TsCodeGen.nullGuard(receiver, emitted)
                    : emitted;
            }
        }
        String calleeText = this.genReceiver(callee);
        String args = String.join(", ", arguments);
        switch(data.access()) {
            case OPTIONAL: return calleeText + "?.(" + args + ")";
            case NON_NULL: return calleeText + "!(" + args + ")";
            default: return calleeText + "(" + args + ")";
        }
    }

}
