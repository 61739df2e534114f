package faberromanus.faberc.compiler.backend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import faberromanus.faberc.compiler.Options;
import faberromanus.faberc.compiler.Target;
import faberromanus.faberc.compiler.UnknownNodeException;
import faberromanus.faberc.compiler.UnsupportedConstructException;
import faberromanus.faberc.compiler.frontend.AstNode;
import faberromanus.faberc.compiler.frontend.DataType;

public class PyCodeGen implements CodeGen {

    private static final Logger LOGGER = Logger.getLogger(
        PyCodeGen.class.getName()
    );

    private static final Map<String, String> TYPE_NAMES = Map.ofEntries(
        Map.entry("textus", "str"),
        Map.entry("numerus", "int"),
        Map.entry("fractus", "float"),
        Map.entry("decimus", "Decimal"),
        Map.entry("magnus", "int"),
        Map.entry("bivalens", "bool"),
        Map.entry("nihil", "None"),
        Map.entry("vacuum", "None"),
        Map.entry("numquam", "None"),
        Map.entry("octeti", "bytes"),
        Map.entry("lista", "list"),
        Map.entry("tabula", "dict"),
        Map.entry("copia", "set"),
        Map.entry("erratum", "Exception"),
        Map.entry("cursor", "Iterator"),
        Map.entry("functio", "Callable"),
        Map.entry("objectum", "Any"),
        Map.entry("ignotum", "Any")
    );

    private static final Map<String, String> INSTANCE_NAMES = Map.of(
        "textus", "str",
        "numerus", "int",
        "fractus", "float",
        "magnus", "int",
        "bivalens", "bool",
        "lista", "list",
        "tabula", "dict",
        "copia", "set",
        "erratum", "Exception"
    );

    @FunctionalInterface
    private static interface Emitter {
        void emit(StringBuilder out);
    }

    /** A member access chain together with the null checks it needs. */
    private static record Chain(String text, List<String> guards) {}

    private final Options options;
    private final Features features;
    private final List<FunctionMode> modeStack;
    private final Map<String, String> mathesisNames;
    private final Set<String> declaredTypeVars;
    private int depth;
    private int tempCounter;
    private int suiteDepth;

    public PyCodeGen(Options options) {
        this.options = options;
        this.features = new Features();
        this.modeStack = new LinkedList<>();
        this.mathesisNames = new HashMap<>();
        this.declaredTypeVars = new HashSet<>();
        this.depth = 0;
        this.tempCounter = 0;
        this.suiteDepth = 0;
    }

    public Features features() {
        return this.features;
    }

    @Override
    public String generate(AstNode program) {
        if(program.type != AstNode.Type.PROGRAM) {
            throw new UnknownNodeException(
                "PyCodeGen", program.type, program.source
            );
        }
        StringBuilder body = new StringBuilder();
        for(AstNode statement: program.<AstNode.Program>getValue().body()) {
            this.genStatement(statement, body);
        }
        String preamble = Preamble.render(Target.PYTHON, this.features);
        LOGGER.log(Level.FINE, "Generated Python with features {0}",
            this.features);
        return preamble + body.toString();
    }

    private String indent() {
        return this.options.indent().repeat(this.depth);
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

    /**
     * Emits the statements of a block one level deeper, writing "pass"
     * when they produce no output.
     */
    private void emitSuite(AstNode block, StringBuilder out) {
        this.depth += 1;
        int before = out.length();
        this.emitStatements(block, out);
        if(out.length() == before) {
            this.line("pass", out);
        }
        this.depth -= 1;
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
        this.line("try:", out);
        this.depth += 1;
        inner.emit(out);
        this.depth -= 1;
        this.line("except Exception as " + cape.get().name() + ":", out);
        this.emitSuite(cape.get().body(), out);
    }

    public void genStatement(AstNode node, StringBuilder out) {
        switch(node.type) {
            case IMPORT: {
                this.emitImport(node.getValue(), out);
            } break;
            case DESTRUCTURE: {
                AstNode.Destructure data = node.getValue();
                String source = this.genExpression(data.source());
                if(data.kind().isAwaited) { source = "await " + source; }
                String holder = source;
                if(data.source().type != AstNode.Type.IDENTIFIER
                        || data.kind().isAwaited) {
                    holder = this.temp("ex");
                    this.line(holder + " = " + source, out);
                }
                for(AstNode.Specifier specifier: data.specifiers()) {
                    this.line(
                        specifier.localName() + " = " + holder + "."
                            + specifier.imported(),
                        out
                    );
                }
            } break;
            case VARIABLE: {
                this.emitVariable(node.getValue(), out);
            } break;
            case FUNCTION: {
                this.emitFunction(node, false, out);
            } break;
            case TYPE_ALIAS: {
                AstNode.TypeAlias data = node.getValue();
                this.line(data.name() + " = " + this.genType(data.type()), out);
            } break;
            case ORDO: {
                this.emitOrdo(node.getValue(), out);
            } break;
            case DISCRETIO: {
                this.emitDiscretio(node.getValue(), out);
            } break;
            case GENUS: {
                this.emitGenus(node.getValue(), out);
            } break;
            case PACTUM: {
                AstNode.Pactum data = node.getValue();
                this.features.add(Feature.TYPING_PROTOCOL);
                this.declareTypeVars(data.typeParams(), out);
                this.line("class " + data.name() + "(Protocol):", out);
                this.depth += 1;
                if(data.methods().isEmpty()) {
                    this.line("pass", out);
                }
                for(AstNode method: data.methods()) {
                    this.emitFunction(method, true, out);
                }
                this.depth -= 1;
            } break;
            case EXPRESSION_STATEMENT: {
                AstNode.MonoOp data = node.getValue();
                this.line(this.genExpression(data.value()), out);
            } break;
            case SI: {
                AstNode.Si data = node.getValue();
                this.withCape(data.cape(), out, o -> {
                    this.emitSiChain(node, "if ", o);
                });
            } break;
            case DUM: {
                AstNode.Dum data = node.getValue();
                this.withCape(data.cape(), out, o -> {
                    this.line(
                        "while " + this.genExpression(data.condition()) + ":",
                        o
                    );
                    this.emitSuite(data.body(), o);
                });
            } break;
            case ITERATIO: {
                AstNode.Iteratio data = node.getValue();
                this.withCape(data.cape(), out, o -> {
                    this.line(
                        "for " + data.binding() + " in "
                            + this.genIterable(data.iterable()) + ":",
                        o
                    );
                    this.emitSuite(data.body(), o);
                });
            } break;
            case ELIGE: {
                AstNode.Elige data = node.getValue();
                this.withCape(data.cape(), out, o -> this.emitElige(data, o));
            } break;
            case DISCERNE: {
                this.emitDiscerne(node.getValue(), out);
            } break;
            case CUSTODI: {
                AstNode.Custodi data = node.getValue();
                for(AstNode.Guard guard: data.guards()) {
                    this.line(
                        "if " + this.genExpression(guard.condition()) + ":",
                        out
                    );
                    this.emitSuite(guard.body(), out);
                }
            } break;
            case ADFIRMA: {
                AstNode.Adfirma data = node.getValue();
                String condition = this.genExpression(data.condition());
                String message = data.message().isPresent()
                    ? this.genExpression(data.message().get())
                    : Literals.quote("Assertion failed: " + condition);
                this.line("assert " + condition + ", " + message, out);
            } break;
            case REDDE: {
                AstNode.Redde data = node.getValue();
                Optional<String> value = data.value()
                    .map(v -> this.genExpression(v));
                FunctionMode mode = this.mode();
                if(!mode.isVerb()) {
                    this.line(
                        value.map(v -> "return " + v).orElse("return"), out
                    );
                    return;
                }
                if(mode.isStream()) {
                    if(value.isPresent()) {
                        this.line("yield respond.item(" + value.get() + ")", out);
                    }
                } else {
                    this.line(
                        "yield respond.ok(" + value.orElse("None") + ")", out
                    );
                }
                this.line("return", out);
            } break;
            case RUMPE: {
                this.line("break", out);
            } break;
            case PERGE: {
                this.line("continue", out);
            } break;
            case BLOCK: {
                // blocks do not introduce a scope
                this.emitStatements(node, out);
            } break;
            case IACE: {
                this.emitIace(node.getValue(), out);
            } break;
            case SCRIBE: {
                this.emitScribe(node.getValue(), out);
            } break;
            case TEMPTA: {
                AstNode.Tempta data = node.getValue();
                this.line("try:", out);
                this.emitSuite(data.body(), out);
                if(data.cape().isPresent()) {
                    this.line(
                        "except Exception as " + data.cape().get().name()
                            + ":",
                        out
                    );
                    this.emitSuite(data.cape().get().body(), out);
                }
                if(data.demum().isPresent()) {
                    this.line("finally:", out);
                    this.emitSuite(data.demum().get(), out);
                } else if(data.cape().isEmpty()) {
                    this.line("finally:", out);
                    this.depth += 1;
                    this.line("pass", out);
                    this.depth -= 1;
                }
            } break;
            case CURA: {
                AstNode.Cura data = node.getValue();
                this.withCape(data.cape(), out, o -> this.emitCura(data, o));
            } break;
            case PRAEPARA: {
                this.emitPraepara(node.getValue(), out);
            } break;
            case INCIPIT: {
                this.emitIncipit(node.getValue(), out);
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
                    this.line(
                        object + "." + name + " " + field.get().operator()
                            + " " + this.genExpression(field.get().value()),
                        out
                    );
                }
            } break;
            case PROBANDUM: {
                AstNode.Probandum data = node.getValue();
                this.line("class Test" + PyCodeGen.pascalName(data.name())
                    + ":", out);
                this.depth += 1;
                this.suiteDepth += 1;
                int before = out.length();
                for(AstNode member: data.body()) {
                    this.genStatement(member, out);
                }
                if(out.length() == before) { this.line("pass", out); }
                this.suiteDepth -= 1;
                this.depth -= 1;
            } break;
            case PROBA: {
                this.emitProba(node.getValue(), out);
            } break;
            case FAC: {
                AstNode.Fac data = node.getValue();
                if(data.cape().isEmpty()) {
                    this.emitStatements(data.body(), out);
                    return;
                }
                this.line("try:", out);
                this.emitSuite(data.body(), out);
                this.line(
                    "except Exception as " + data.cape().get().name() + ":",
                    out
                );
                this.emitSuite(data.cape().get().body(), out);
            } break;
            default: {
                throw new UnknownNodeException(
                    "PyCodeGen.genStatement", node.type, node.source
                );
            }
        }
    }

    private void emitCura(AstNode.Cura data, StringBuilder out) {
        if(data.resource().isEmpty()) {
            // allocators have no counterpart
            int before = out.length();
            this.emitStatements(data.body(), out);
            if(out.length() == before) { this.line("pass", out); }
            return;
        }
        AstNode resource = data.resource().get();
        String context = resource.type == AstNode.Type.CEDE
            ? this.genExpression(resource.<AstNode.MonoOp>getValue().value())
            : this.genExpression(resource);
        this.line(
            (data.async()? "async with " : "with ") + context + " as "
                + data.binding() + ":",
            out
        );
        this.emitSuite(data.body(), out);
    }

    private void emitPraepara(AstNode.Praepara data, StringBuilder out) {
        String phase = data.after()? "teardown" : "setup";
        String def = data.async()? "async def " : "def ";
        if(this.suiteDepth > 0) {
            if(data.all()) {
                this.line("@classmethod", out);
                this.line(def + phase + "_class(cls):", out);
            } else {
                this.line(def + phase + "_method(self):", out);
            }
        } else {
            this.line(
                def + phase + (data.all()? "_module" : "_function") + "():",
                out
            );
        }
        this.emitCallbackBody(data.async(), data.body(), out);
    }

    private void emitIncipit(AstNode.Incipit data, StringBuilder out) {
        this.line("if __name__ == \"__main__\":", out);
        if(!data.async()) {
            this.emitCallbackBody(false, data.body(), out);
            return;
        }
        this.features.add(Feature.ASYNCIO);
        this.depth += 1;
        this.line("async def _incipiet():", out);
        this.emitCallbackBody(true, data.body(), out);
        this.line("asyncio.run(_incipiet())", out);
        this.depth -= 1;
    }

    private void emitProba(AstNode.Proba data, StringBuilder out) {
        this.features.add(Feature.PYTEST);
        if(data.modifier().isPresent()) {
            String reason = data.reason().orElse("");
            if(data.modifier().get() == AstNode.ProbaModifier.FUTURUM) {
                reason = "todo: " + reason;
            }
            this.line(
                "@pytest.mark.skip(reason=" + Literals.quote(reason) + ")",
                out
            );
        }
        this.line(
            "def test_" + PyCodeGen.snakeName(data.name())
                + (this.suiteDepth > 0? "(self):" : "():"),
            out
        );
        this.emitCallbackBody(false, data.body(), out);
    }

    /**
     * Emits the body of a hook, test or entry point one level deeper as
     * a function body of its own.
     */
    private void emitCallbackBody(
        boolean async, AstNode body, StringBuilder out
    ) {
        int suites = this.suiteDepth;
        this.suiteDepth = 0;
        this.enterMode(new FunctionMode(
            AstNode.ReturnVerb.ARROW, async, false, this.mode().inMethod()
        ));
        try {
            if(body.type == AstNode.Type.BLOCK) {
                this.emitSuite(body, out);
            } else {
                this.depth += 1;
                this.genStatement(body, out);
                this.depth -= 1;
            }
        } finally {
            this.exitMode();
            this.suiteDepth = suites;
        }
    }

    /** "adds two numbers" becomes "AddsTwoNumbers". */
    static String pascalName(String text) {
        StringBuilder out = new StringBuilder();
        boolean upper = true;
        for(int i = 0; i < text.length(); i += 1) {
            char c = text.charAt(i);
            if(!Character.isLetterOrDigit(c)) {
                upper = true;
                continue;
            }
            out.append(upper? Character.toUpperCase(c) : c);
            upper = false;
        }
        return out.toString();
    }

    /** "Adds two numbers" becomes "adds_two_numbers". */
    static String snakeName(String text) {
        StringBuilder out = new StringBuilder();
        boolean separate = false;
        for(int i = 0; i < text.length(); i += 1) {
            char c = text.charAt(i);
            if(!Character.isLetterOrDigit(c)) {
                separate = out.length() > 0;
                continue;
            }
            if(separate) { out.append('_'); }
            out.append(Character.toLowerCase(c));
            separate = false;
        }
        return out.toString();
    }

    /**
     * Converts an import path to a dotted module name. Leading "./" and
     * "../" segments become leading dots.
     */
    static String moduleName(String source) {
        StringBuilder dots = new StringBuilder();
        String rest = source;
        while(true) {
            if(rest.startsWith("./")) {
                if(dots.length() == 0) { dots.append("."); }
                rest = rest.substring(2);
            } else if(rest.startsWith("../")) {
                dots.append(dots.length() == 0? ".." : ".");
                rest = rest.substring(3);
            } else {
                break;
            }
        }
        if(rest.endsWith(".fab")) {
            rest = rest.substring(0, rest.length() - 4);
        }
        return dots + rest.replace('/', '.').replace('-', '_');
    }

    private void emitImport(AstNode.Import data, StringBuilder out) {
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
        String module = PyCodeGen.moduleName(data.source());
        if(data.wildcard()) {
            int split = module.lastIndexOf('.');
            String last = module.substring(split + 1);
            if(split < 0) {
                this.line("import " + module, out);
            } else {
                String parent = module.substring(0, split);
                if(parent.isEmpty() || parent.chars().allMatch(c -> c == '.')) {
                    parent = module.substring(0, split + 1);
                }
                this.line("from " + parent + " import " + last, out);
            }
            return;
        }
        List<String> specifiers = new ArrayList<>();
        for(AstNode.Specifier specifier: data.specifiers()) {
            specifiers.add(specifier.local().isPresent()
                ? specifier.imported() + " as " + specifier.local().get()
                : specifier.imported()
            );
        }
        this.line(
            "from " + module + " import " + String.join(", ", specifiers),
            out
        );
    }

    private void emitVariable(AstNode.Variable data, StringBuilder out) {
        Optional<String> value = data.value().map(v ->
            (data.kind().isAwaited? "await " : "") + this.genExpression(v)
        );
        AstNode target = data.target();
        switch(target.type) {
            case IDENTIFIER: {
                String name = target.<AstNode.Identifier>getValue().name();
                String annotation = data.type()
                    .map(t -> ": " + this.genType(t))
                    .orElse("");
                if(value.isPresent()) {
                    this.line(name + annotation + " = " + value.get(), out);
                } else if(!annotation.isEmpty()) {
                    this.line(name + annotation + " = None", out);
                } else {
                    this.line(name + " = None", out);
                }
            } break;
            case OBJECT_PATTERN: {
                AstNode.ObjectPattern pattern = target.getValue();
                String holder = this.temp("obj");
                this.line(holder + " = " + value.orElse("{}"), out);
                List<String> taken = new ArrayList<>();
                for(AstNode.PatternProperty property: pattern.properties()) {
                    taken.add(Literals.quote(property.key()));
                    this.line(
                        property.local() + " = " + holder + "["
                            + Literals.quote(property.key()) + "]",
                        out
                    );
                }
                if(pattern.rest().isPresent()) {
                    this.line(
                        pattern.rest().get() + " = { k: v for k, v in "
                            + holder + ".items() if k not in ("
                            + String.join(", ", taken)
                            + (taken.size() == 1? "," : "") + ") }",
                        out
                    );
                }
            } break;
            case ARRAY_PATTERN: {
                AstNode.ArrayPattern pattern = target.getValue();
                List<String> parts = new ArrayList<>();
                for(Optional<String> element: pattern.elements()) {
                    parts.add(element.orElse("_"));
                }
                pattern.rest().ifPresent(r -> parts.add("*" + r));
                String targets = String.join(", ", parts);
                if(parts.size() == 1) { targets += ","; }
                this.line(targets + " = " + value.orElse("[]"), out);
            } break;
            default: {
                throw new UnknownNodeException(
                    "PyCodeGen.emitVariable", target.type, target.source
                );
            }
        }
    }

    private void emitOrdo(AstNode.Ordo data, StringBuilder out) {
        this.features.add(Feature.ENUM);
        this.line("class " + data.name() + "(Enum):", out);
        this.depth += 1;
        if(data.members().isEmpty()) {
            this.line("pass", out);
        }
        long next = 0;
        for(AstNode.OrdoMember member: data.members()) {
            if(member.value().isEmpty()) {
                this.line(member.name() + " = " + next, out);
                next += 1;
                continue;
            }
            AstNode value = member.value().get();
            Optional<Long> integer = Ranges.integerLiteral(value);
            if(integer.isPresent()) {
                next = integer.get() + 1;
            }
            this.line(member.name() + " = " + this.genExpression(value), out);
        }
        this.depth -= 1;
    }

    static String variantClass(String union, String variant) {
        return union + "_" + variant;
    }

    private void emitDiscretio(AstNode.Discretio data, StringBuilder out) {
        this.features.add(Feature.DATACLASS);
        this.declareTypeVars(data.typeParams(), out);
        List<String> classes = new ArrayList<>();
        for(AstNode.VariantDecl variant: data.variants()) {
            String className = PyCodeGen.variantClass(
                data.name(), variant.name()
            );
            classes.add(className);
            this.line("@dataclass", out);
            this.line("class " + className + ":", out);
            this.depth += 1;
            for(AstNode.VariantField field: variant.fields()) {
                this.line(
                    field.name() + ": " + this.genType(field.type()), out
                );
            }
            this.line("tag: str = " + Literals.quote(variant.name()), out);
            this.depth -= 1;
            out.append("\n");
        }
        if(classes.isEmpty()) {
            this.line(data.name() + " = None", out);
            return;
        }
        this.line(data.name() + " = " + String.join(" | ", classes), out);
    }

    private void emitGenus(AstNode.Genus data, StringBuilder out) {
        this.declareTypeVars(data.typeParams(), out);
        String bases = data.implemented().isEmpty()
            ? ""
            : "(" + String.join(", ", data.implemented()) + ")";
        this.line("class " + data.name() + bases + ":", out);
        this.depth += 1;
        List<AstNode.GenusField> instanceFields = new ArrayList<>();
        boolean hasContent = false;
        for(AstNode member: data.members()) {
            if(member.type != AstNode.Type.GENUS_FIELD) { continue; }
            AstNode.GenusField field = member.getValue();
            hasContent = true;
            if(!field.isStatic()) { instanceFields.add(field); }
            String init = field.init()
                .map(i -> " = " + this.genExpression(i))
                .orElse("");
            this.line(
                field.name() + ": " + this.genType(field.type()) + init, out
            );
        }
        if(!instanceFields.isEmpty()) {
            out.append("\n");
            this.line("def __init__(self, overrides: dict = {}):", out);
            this.depth += 1;
            for(AstNode.GenusField field: instanceFields) {
                String key = Literals.quote(field.name());
                this.line("if " + key + " in overrides:", out);
                this.depth += 1;
                this.line(
                    "self." + field.name() + " = overrides[" + key + "]", out
                );
                this.depth -= 1;
            }
            this.depth -= 1;
            hasContent = true;
        }
        for(AstNode member: data.members()) {
            if(member.type != AstNode.Type.FUNCTION) { continue; }
            if(hasContent) { out.append("\n"); }
            hasContent = true;
            this.emitFunction(member, true, out);
        }
        if(!hasContent) {
            this.line("pass", out);
        }
        this.depth -= 1;
    }

    private void declareTypeVars(List<String> typeParams, StringBuilder out) {
        for(String param: typeParams) {
            if(!this.declaredTypeVars.add(param)) { continue; }
            this.features.add(Feature.TYPING_TYPEVAR);
            this.line(param + " = TypeVar(" + Literals.quote(param) + ")", out);
        }
    }

    private String genParams(List<AstNode> params, boolean inMethod, boolean isStatic) {
        List<String> result = new ArrayList<>();
        if(inMethod && !isStatic) { result.add("self"); }
        for(AstNode param: params) {
            AstNode.Parameter data = param.getValue();
            StringBuilder text = new StringBuilder();
            if(data.rest()) { text.append("*"); }
            text.append(data.name());
            if(data.type().isPresent() && !data.rest()) {
                text.append(": ");
                text.append(this.genType(data.type().get()));
            }
            if(data.defaultValue().isPresent()) {
                text.append(data.type().isPresent()? " = " : "=");
                text.append(this.genExpression(data.defaultValue().get()));
            }
            result.add(text.toString());
        }
        return String.join(", ", result);
    }

    private String wrapReturnType(FunctionMode mode, String type) {
        boolean stream = mode.isVerb()? mode.isStream() : mode.isGenerator();
        if(!stream) { return type; }
        if(mode.isAsync()) {
            this.features.add(Feature.TYPING_ASYNC_ITERATOR);
            return "AsyncIterator[" + type + "]";
        }
        this.features.add(Feature.TYPING_ITERATOR);
        return "Iterator[" + type + "]";
    }

    private void emitFunction(AstNode node, boolean inMethod, StringBuilder out) {
        AstNode.Function data = node.getValue();
        FunctionMode mode = FunctionMode.of(data, inMethod);
        this.declareTypeVars(data.typeParams(), out);
        if(inMethod && data.isStatic()) {
            this.line("@staticmethod", out);
        }
        StringBuilder signature = new StringBuilder();
        if(mode.isAsync()) { signature.append("async "); }
        signature.append("def ");
        signature.append(data.name());
        signature.append("(");
        signature.append(this.genParams(data.params(), inMethod, data.isStatic()));
        signature.append(")");
        if(data.returnType().isPresent()) {
            signature.append(" -> ");
            signature.append(this.wrapReturnType(
                mode, this.genType(data.returnType().get())
            ));
        }
        signature.append(":");
        if(data.body().isEmpty()) {
            this.line(signature + " ...", out);
            return;
        }
        this.enterMode(mode);
        try {
            this.line(signature.toString(), out);
            if(!mode.isVerb()) {
                this.emitSuite(data.body().get(), out);
                return;
            }
            this.emitVerbBody(mode, data.body().get(), out);
        } finally {
            this.exitMode();
        }
    }

    private void emitVerbBody(FunctionMode mode, AstNode body, StringBuilder out) {
        boolean async = mode.isAsync();
        this.features.add(async? Feature.FLUMINA_ASYNC : Feature.FLUMINA);
        this.depth += 1;
        this.line((async? "async def" : "def") + " _fluxus():", out);
        this.depth += 1;
        this.emitStatements(body, out);
        this.line("yield respond.done()", out);
        this.depth -= 1;
        switch(mode.verb()) {
            case FIT:
                this.line("return drain(_fluxus())", out);
                break;
            case FIET:
                this.line("return await drain_async(_fluxus())", out);
                break;
            case FIUNT:
                this.line("yield from flow(_fluxus())", out);
                break;
            case FIENT:
                this.line("async for _res in flow_async(_fluxus()):", out);
                this.depth += 1;
                this.line("yield _res", out);
                this.depth -= 1;
                break;
            default:
                throw new IllegalArgumentException("not a verb!");
        }
        this.depth -= 1;
    }

    private void emitSiChain(AstNode node, String keyword, StringBuilder out) {
        AstNode.Si data = node.getValue();
        this.line(keyword + this.genExpression(data.condition()) + ":", out);
        this.emitSuite(data.then(), out);
        if(data.otherwise().isEmpty()) { return; }
        AstNode otherwise = data.otherwise().get();
        if(otherwise.type == AstNode.Type.SI
                && otherwise.<AstNode.Si>getValue().cape().isEmpty()) {
            this.emitSiChain(otherwise, "elif ", out);
            return;
        }
        this.line("else:", out);
        if(otherwise.type == AstNode.Type.SI) {
            this.depth += 1;
            this.genStatement(otherwise, out);
            this.depth -= 1;
        } else {
            this.emitSuite(otherwise, out);
        }
    }

    private String genIterable(AstNode iterable) {
        if(iterable.type != AstNode.Type.RANGE) {
            return this.genExpression(iterable);
        }
        return this.genRangeCall(iterable.getValue());
    }

    private String genRangeCall(AstNode.Range range) {
        String start = this.genExpression(range.start());
        String end = Ranges.exclusiveEnd(range, this.genExpression(range.end()));
        String step = range.step()
            .map(s -> ", " + this.genExpression(s))
            .orElse("");
        return "range(" + start + ", " + end + step + ")";
    }

    private String hoistSubject(AstNode subject, String base, StringBuilder out) {
        String text = this.genExpression(subject);
        if(subject.type == AstNode.Type.IDENTIFIER
                || subject.type == AstNode.Type.EGO) {
            return text;
        }
        String name = this.temp(base);
        this.line(name + " = " + text, out);
        return name;
    }

    private void emitElige(AstNode.Elige data, StringBuilder out) {
        String subject = this.hoistSubject(data.subject(), "elige", out);
        boolean first = true;
        for(AstNode.EligeCase eligeCase: data.cases()) {
            this.line(
                (first? "if " : "elif ") + subject + " == "
                    + this.genExpression(eligeCase.value()) + ":",
                out
            );
            this.emitSuite(eligeCase.body(), out);
            first = false;
        }
        if(data.otherwise().isPresent()) {
            if(first) {
                this.emitStatements(data.otherwise().get(), out);
            } else {
                this.line("else:", out);
                this.emitSuite(data.otherwise().get(), out);
            }
        }
    }

    private void emitDiscerne(AstNode.Discerne data, StringBuilder out) {
        Optional<DataType> subjectType = data.subject().resolvedType;
        Optional<String> unionName = subjectType
            .filter(t -> t.type == DataType.Type.DISCRETIO)
            .map(t -> t.<DataType.Discretio>getValue().name());
        this.line("match " + this.genExpression(data.subject()) + ":", out);
        this.depth += 1;
        for(AstNode.DiscerneCase discerneCase: data.cases()) {
            this.line(
                "case " + this.genCasePattern(
                    subjectType, unionName, discerneCase
                ) + ":",
                out
            );
            this.emitSuite(discerneCase.body(), out);
        }
        if(data.otherwise().isPresent()) {
            this.line("case _:", out);
            this.emitSuite(data.otherwise().get(), out);
        }
        this.depth -= 1;
    }

    private String genCasePattern(
        Optional<DataType> subjectType, Optional<String> unionName,
        AstNode.DiscerneCase discerneCase
    ) {
        Optional<DataType.Variant> variant = subjectType
            .flatMap(t -> t.findVariant(discerneCase.variant()));
        List<String> arguments = new ArrayList<>();
        String pattern;
        if(unionName.isPresent() && variant.isPresent()) {
            List<String> fields = variant.get().fieldNames();
            for(int i = 0; i < discerneCase.bindings().size(); i += 1) {
                if(i >= fields.size()) { break; }
                arguments.add(
                    fields.get(i) + "=" + discerneCase.bindings().get(i)
                );
            }
            pattern = PyCodeGen.variantClass(
                unionName.get(), discerneCase.variant()
            ) + "(" + String.join(", ", arguments) + ")";
        } else {
            if(!discerneCase.bindings().isEmpty()) {
                LOGGER.log(
                    Level.FINE,
                    "No resolved union type for variant ''{0}'',"
                        + " binding fields by name",
                    discerneCase.variant()
                );
            }
            arguments.add("tag=" + Literals.quote(discerneCase.variant()));
            for(String binding: discerneCase.bindings()) {
                arguments.add(binding + "=" + binding);
            }
            pattern = "object(" + String.join(", ", arguments) + ")";
        }
        if(discerneCase.alias().isPresent()) {
            pattern += " as " + discerneCase.alias().get();
        }
        return pattern;
    }

    private String errorMessage(AstNode value) {
        String text = this.genExpression(value);
        boolean isString = value.type == AstNode.Type.TEMPLATE
            || value.type == AstNode.Type.SCRIPTUM
            || (value.type == AstNode.Type.LITERAL
                && value.<AstNode.Literal>getValue().kind()
                    == AstNode.LiteralKind.STRING);
        return isString? text : "str(" + text + ")";
    }

    private void emitIace(AstNode.Iace data, StringBuilder out) {
        if(data.fatal()) {
            this.features.add(Feature.PANIC);
            this.line(
                "raise Panic(" + this.errorMessage(data.value()) + ")", out
            );
            return;
        }
        if(this.mode().isVerb()) {
            this.line(
                "yield respond.error(\"EFAIL\", "
                    + this.errorMessage(data.value()) + ")",
                out
            );
            this.line("return", out);
            return;
        }
        String message = this.errorMessage(data.value());
        if(message.startsWith("str(")) {
            this.line("raise " + this.genExpression(data.value()), out);
        } else {
            this.line("raise Exception(" + message + ")", out);
        }
    }

    private void emitScribe(AstNode.Scribe data, StringBuilder out) {
        List<String> arguments = this.genArgumentList(data.arguments());
        switch(data.level()) {
            case VIDE: {
                this.features.add(Feature.SYS);
                arguments.add("file=sys.stderr");
                this.line("print(" + String.join(", ", arguments) + ")", out);
            } break;
            case MONE: {
                this.features.add(Feature.WARNINGS);
                String message;
                if(arguments.size() == 1) {
                    message = this.errorMessage(data.arguments().get(0));
                } else {
                    message = "\" \".join(map(str, ["
                        + String.join(", ", arguments) + "]))";
                }
                this.line("warnings.warn(" + message + ")", out);
            } break;
            default: {
                this.line("print(" + String.join(", ", arguments) + ")", out);
            } break;
        }
    }

    public String genType(AstNode node) {
        if(node.type != AstNode.Type.TYPE) {
            throw new UnknownNodeException(
                "PyCodeGen.genType", node.type, node.source
            );
        }
        AstNode.TypeAnnotation data = node.getValue();
        String result;
        switch(data.name()) {
            case "decimus": this.features.add(Feature.DECIMAL); break;
            case "cursor": this.features.add(Feature.TYPING_ITERATOR); break;
            case "functio": this.features.add(Feature.TYPING_CALLABLE); break;
            case "objectum":
            case "ignotum":
                this.features.add(Feature.TYPING_ANY);
                break;
            default: break;
        }
        if(data.name().equals("promissum")) {
            if(data.arguments().isEmpty()) {
                this.features.add(Feature.TYPING_ANY);
                result = "Any";
            } else {
                result = this.genType(data.arguments().get(0));
            }
        } else {
            result = TYPE_NAMES.getOrDefault(data.name(), data.name());
            if(!data.arguments().isEmpty()) {
                List<String> arguments = new ArrayList<>();
                for(AstNode argument: data.arguments()) {
                    arguments.add(this.genType(argument));
                }
                result += "[" + String.join(", ", arguments) + "]";
            }
        }
        for(int i = 0; i < data.arrayDepth(); i += 1) {
            result = "list[" + result + "]";
        }
        if(data.nullable()) {
            result += " | None";
        }
        return result;
    }

    private List<String> genArgumentList(List<AstNode> arguments) {
        List<String> result = new ArrayList<>();
        for(AstNode argument: arguments) {
            result.add(this.genExpression(argument));
        }
        return result;
    }

    private String genReceiver(AstNode node) {
        String text = this.genExpression(node);
        boolean needsParens = Precedence.of(node) > 0
            && node.type != AstNode.Type.QUA;
        return needsParens? "(" + text + ")" : text;
    }

    private static boolean isComparison(String operator) {
        int precedence = Precedence.ofOperator(operator);
        return precedence == 11 || precedence == 12;
    }

    private String genOperand(AstNode node, String operator, boolean isRight) {
        String text = this.genExpression(node);
        boolean needsParens = Precedence.needsParens(node, operator, isRight);
        // 'not' binds looser than comparisons
        if(node.type == AstNode.Type.UNARY
                && node.<AstNode.Unary>getValue().operator().equals("non")
                && Precedence.ofOperator(operator) < 13) {
            needsParens = true;
        }
        // comparisons chain
        if(PyCodeGen.isComparison(operator)
                && (node.type == AstNode.Type.EST
                    || (node.type == AstNode.Type.BINARY
                        && PyCodeGen.isComparison(
                            node.<AstNode.Binary>getValue().operator()
                        )))) {
            needsParens = true;
        }
        return needsParens? "(" + text + ")" : text;
    }

    private static boolean isNihil(AstNode node) {
        return node.type == AstNode.Type.LITERAL
            && node.<AstNode.Literal>getValue().kind()
                == AstNode.LiteralKind.NIHIL;
    }

    private String genBinary(AstNode.Binary data) {
        String operator = data.operator();
        if(operator.equals("vel")) {
            String left = this.genOperand(data.left(), "vel", false);
            return "(" + left + " if " + left + " is not None else "
                + this.genOperand(data.right(), "vel", true) + ")";
        }
        String pyOperator;
        switch(operator) {
            case "et": pyOperator = "and"; break;
            case "aut": pyOperator = "or"; break;
            case "===":
            case "==":
                pyOperator = PyCodeGen.isNihil(data.left())
                    || PyCodeGen.isNihil(data.right())? "is" : "==";
                break;
            case "!==":
            case "!=":
                pyOperator = PyCodeGen.isNihil(data.left())
                    || PyCodeGen.isNihil(data.right())? "is not" : "!=";
                break;
            default: pyOperator = operator; break;
        }
        return this.genOperand(data.left(), operator, false) + " "
            + pyOperator + " " + this.genOperand(data.right(), operator, true);
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
                        if(constant.get().needsMath()) {
                            this.features.add(Feature.MATH);
                        }
                        return constant.get().py().emit(List.of());
                    }
                }
                return name;
            }
            case EGO: return "self";
            case LITERAL: {
                AstNode.Literal data = node.getValue();
                switch(data.kind()) {
                    case NUMBER: return data.value();
                    case STRING: return Literals.quote(data.value());
                    case BOOLEAN:
                        return data.value().equals("verum")? "True" : "False";
                    case NIHIL: return "None";
                    default: throw new IllegalArgumentException(
                        "unhandled literal kind!"
                    );
                }
            }
            case TEMPLATE: {
                AstNode.Template data = node.getValue();
                StringBuilder out = new StringBuilder("f\"");
                for(int i = 0; i < data.quasis().size(); i += 1) {
                    out.append(PyCodeGen.fStringText(data.quasis().get(i)));
                    if(i < data.expressions().size()) {
                        out.append("{");
                        out.append(this.genExpression(data.expressions().get(i)));
                        out.append("}");
                    }
                }
                out.append("\"");
                return out.toString();
            }
            case ARRAY: {
                AstNode.Elements data = node.getValue();
                return "[" + String.join(", ", this.genArgumentList(
                    data.elements()
                )) + "]";
            }
            case OBJECT: {
                AstNode.ObjectLiteral data = node.getValue();
                List<String> parts = new ArrayList<>();
                for(AstNode.Property property: data.properties()) {
                    if(property.value().type == AstNode.Type.SPREAD) {
                        AstNode spread = property.value()
                            .<AstNode.MonoOp>getValue().value();
                        parts.add("**" + this.genReceiver(spread));
                        continue;
                    }
                    parts.add(Literals.quote(property.key()) + ": "
                        + this.genExpression(property.value()));
                }
                return "{" + String.join(", ", parts) + "}";
            }
            case SPREAD: {
                AstNode.MonoOp data = node.getValue();
                return "*" + this.genReceiver(data.value());
            }
            case RANGE: {
                return "list(" + this.genRangeCall(node.getValue()) + ")";
            }
            case BINARY: {
                return this.genBinary(node.getValue());
            }
            case UNARY: {
                AstNode.Unary data = node.getValue();
                String operand = this.genExpression(data.operand());
                String wrapped = Precedence.of(data.operand()) > 0
                    ? "(" + operand + ")"
                    : operand;
                switch(data.operator()) {
                    case "non": return "not " + wrapped;
                    case "nulla": return "(not " + wrapped + ")";
                    case "nonnulla": return "bool(" + operand + ")";
                    default: return data.operator() + wrapped;
                }
            }
            case EST: {
                return this.genEst(node.getValue());
            }
            case QUA: {
                return this.genExpression(
                    node.<AstNode.Qua>getValue().value()
                );
            }
            case CALL: {
                return this.genCall(node);
            }
            case MEMBER: {
                Chain chain = this.genChain(node);
                if(chain.guards().isEmpty()) {
                    return chain.text();
                }
                return "(" + chain.text() + " if "
                    + String.join(" and ", chain.guards()) + " else None)";
            }
            case LAMBDA: {
                AstNode.Lambda data = node.getValue();
                return "lambda" + (data.params().isEmpty()? "" : " ")
                    + String.join(", ", data.params()) + ": "
                    + this.genLambdaBody(data.body());
            }
            case ARROW: {
                AstNode.Arrow data = node.getValue();
                List<String> params = new ArrayList<>();
                for(AstNode param: data.params()) {
                    AstNode.Parameter parameter = param.getValue();
                    params.add((parameter.rest()? "*" : "") + parameter.name()
                        + parameter.defaultValue()
                            .map(d -> "=" + this.genExpression(d))
                            .orElse(""));
                }
                return "lambda" + (params.isEmpty()? "" : " ")
                    + String.join(", ", params) + ": "
                    + this.genLambdaBody(data.body());
            }
            case ASSIGNMENT: {
                AstNode.Assignment data = node.getValue();
                return this.genExpression(data.target()) + " "
                    + data.operator() + " " + this.genExpression(data.value());
            }
            case CONDITIONAL: {
                AstNode.Conditional data = node.getValue();
                return "(" + this.genExpression(data.then()) + " if "
                    + this.genExpression(data.condition()) + " else "
                    + this.genExpression(data.otherwise()) + ")";
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
                return data.className() + "("
                    + String.join(", ", arguments) + ")";
            }
            case PRAEFIXUM: {
                return this.genPraefixum(node.getValue());
            }
            case SCRIPTUM: {
                AstNode.Scriptum data = node.getValue();
                String format = data.format()
                    .replace("{", "{{")
                    .replace("}", "}}")
                    .replace("§", "{}");
                if(data.arguments().isEmpty()) {
                    return Literals.quote(data.format());
                }
                return Literals.quote(format) + ".format("
                    + String.join(", ", this.genArgumentList(data.arguments()))
                    + ")";
            }
            case REGEX: {
                AstNode.Regex data = node.getValue();
                this.features.add(Feature.RE);
                String pattern = data.flags().isEmpty()
                    ? data.pattern()
                    : "(?" + data.flags() + ")" + data.pattern();
                String quote = pattern.contains("\"")? "'" : "\"";
                return "re.compile(r" + quote + pattern + quote + ")";
            }
            case LEGE: {
                AstNode.Lege data = node.getValue();
                if(data.line()) { return "input()"; }
                this.features.add(Feature.SYS);
                return "sys.stdin.read()";
            }
            case FINGE: {
                return this.genFinge(node);
            }
            default: {
                throw new UnknownNodeException(
                    "PyCodeGen.genExpression", node.type, node.source
                );
            }
        }
    }

    /** Escapes raw template text for use inside a double-quoted f-string. */
    static String fStringText(String raw) {
        StringBuilder out = new StringBuilder();
        for(int i = 0; i < raw.length(); i += 1) {
            char c = raw.charAt(i);
            switch(c) {
                case '{': out.append("{{"); break;
                case '}': out.append("}}"); break;
                case '"': out.append("\\\""); break;
                case '\n': out.append("\\n"); break;
                case '\\': {
                    if(i + 1 < raw.length() && raw.charAt(i + 1) == '`') {
                        out.append('`');
                        i += 1;
                    } else if(i + 1 < raw.length()) {
                        out.append(c);
                        out.append(raw.charAt(i + 1));
                        i += 1;
                    } else {
                        out.append("\\\\");
                    }
                } break;
                default: out.append(c);
            }
        }
        return out.toString();
    }

    private String genLambdaBody(AstNode body) {
        this.enterMode(FunctionMode.nested(this.mode()));
        try {
            if(body.type != AstNode.Type.BLOCK) {
                return this.genExpression(body);
            }
            Optional<AstNode> value = PyCodeGen.singleReturnValue(body);
            if(value.isPresent()) {
                return this.genExpression(value.get());
            }
            throw new UnsupportedConstructException(
                "lambda with a statement body", Target.PYTHON,
                "declare a named 'functio' and pass it instead",
                body.source
            );
        } finally {
            this.exitMode();
        }
    }

    /** The returned value of a block that only consists of 'redde x'. */
    private static Optional<AstNode> singleReturnValue(AstNode block) {
        List<AstNode> statements = block.<AstNode.Block>getValue().body();
        if(statements.size() != 1
                || statements.get(0).type != AstNode.Type.REDDE) {
            return Optional.empty();
        }
        return statements.get(0).<AstNode.Redde>getValue().value();
    }

    private String genPraefixum(AstNode.Praefixum data) {
        if(data.body().type != AstNode.Type.BLOCK) {
            return "(" + this.genExpression(data.body()) + ")";
        }
        Optional<AstNode> value = PyCodeGen.singleReturnValue(data.body());
        if(value.isPresent()) {
            return "(" + this.genExpression(value.get()) + ")";
        }
        LOGGER.log(
            Level.FINE,
            "Block praefixum needs the runtime helper for Python"
        );
        this.features.add(Feature.PRAEFIXUM);
        int outerDepth = this.depth;
        this.enterMode(FunctionMode.nested(this.mode()));
        StringBuilder code = new StringBuilder("def __block__():\n");
        try {
            this.depth = 0;
            this.emitSuite(data.body(), code);
        } finally {
            this.depth = outerDepth;
            this.exitMode();
        }
        String escaped = code.toString()
            .replace("\\", "\\\\")
            .replace("\"\"\"", "\\\"\\\"\\\"");
        return "__praefixum__(\"\"\"" + escaped + "\"\"\")";
    }

    private String genFinge(AstNode node) {
        AstNode.Finge data = node.getValue();
        Optional<String> unionName = data.unionName().or(() ->
            node.resolvedType
                .filter(t -> t.type == DataType.Type.DISCRETIO)
                .map(t -> t.<DataType.Discretio>getValue().name())
        );
        List<String> arguments = new ArrayList<>();
        for(AstNode.Property field: data.fields()) {
            arguments.add(
                field.key() + "=" + this.genExpression(field.value())
            );
        }
        if(unionName.isPresent()) {
            return PyCodeGen.variantClass(unionName.get(), data.variant())
                + "(" + String.join(", ", arguments) + ")";
        }
        this.features.add(Feature.SIMPLE_NAMESPACE);
        arguments.add(0, "tag=" + Literals.quote(data.variant()));
        return "SimpleNamespace(" + String.join(", ", arguments) + ")";
    }

    private String genCede(AstNode node, String value) {
        FunctionMode mode = this.mode();
        switch(mode.verb()) {
            case FIT:
                throw new UnsupportedConstructException(
                    "cede", Target.PYTHON,
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
        if(PyCodeGen.isNihil(target)) {
            return value + (data.negated()? " is not None" : " is None");
        }
        String typeName;
        if(target.type == AstNode.Type.IDENTIFIER) {
            String name = target.<AstNode.Identifier>getValue().name();
            typeName = INSTANCE_NAMES.getOrDefault(name, name);
        } else {
            typeName = this.genExpression(target);
        }
        String check = "isinstance(" + this.genExpression(data.value())
            + ", " + typeName + ")";
        return data.negated()? "not " + check : check;
    }

    private String genSlice(String receiver, AstNode.Range range) {
        String start = this.genExpression(range.start());
        String end = Ranges.isOpenEnded(range)
            ? ""
            : Ranges.exclusiveEnd(range, this.genExpression(range.end()));
        String step = range.step()
            .map(s -> ":" + this.genExpression(s))
            .orElse("");
        return receiver + "[" + start + ":" + end + step + "]";
    }

    /**
     * Generates a member access, collecting one null check for each
     * optional link so that the whole chain is guarded once.
     */
    private Chain genChain(AstNode node) {
        AstNode.Member data = node.getValue();
        Chain object;
        if(data.object().type == AstNode.Type.MEMBER
                && this.isChainLink(data.object())) {
            object = this.genChain(data.object());
        } else {
            object = new Chain(this.genReceiver(data.object()), List.of());
        }
        List<String> guards = new ArrayList<>(object.guards());
        boolean optional = data.access() == AstNode.Access.OPTIONAL;
        if(!data.computed()) {
            String name = data.property().<AstNode.Identifier>getValue().name();
            Optional<CollectionMethod> method = MethodRegistry.lookupProperty(
                data.object().resolvedType, name
            );
            if(method.isPresent()) {
                String receiver = PyCodeGen.guarded(object);
                method.get().pyFeatures().forEach(this.features::add);
                String emitted = method.get().py().emit(receiver, List.of());
                return optional
                    ? new Chain(emitted, List.of(receiver + " is not None"))
                    : new Chain(emitted, List.of());
            }
            if(optional) { guards.add(object.text() + " is not None"); }
            return new Chain(object.text() + "." + name, guards);
        }
        AstNode index = data.property();
        if(index.type == AstNode.Type.RANGE) {
            String receiver = PyCodeGen.guarded(object);
            String slice = this.genSlice(receiver, index.getValue());
            return optional
                ? new Chain(slice, List.of(receiver + " is not None"))
                : new Chain(slice, List.of());
        }
        if(optional) { guards.add(object.text() + " is not None"); }
        return new Chain(
            object.text() + "[" + this.genExpression(index) + "]", guards
        );
    }

    /** Whether a member node extends a chain instead of ending it. */
    private boolean isChainLink(AstNode member) {
        AstNode.Member data = member.getValue();
        if(data.computed()) {
            return data.property().type != AstNode.Type.RANGE;
        }
        String name = data.property().<AstNode.Identifier>getValue().name();
        return MethodRegistry.lookupProperty(
            data.object().resolvedType, name
        ).isEmpty();
    }

    private static String guarded(Chain chain) {
        if(chain.guards().isEmpty()) { return chain.text(); }
        return "(" + chain.text() + " if "
            + String.join(" and ", chain.guards()) + " else None)";
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
                    if(function.get().needsMath()) {
                        this.features.add(Feature.MATH);
                    }
                    return function.get().py().emit(arguments);
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
                method.get().pyFeatures().forEach(this.features::add);
                String receiver = this.genReceiver(member.object());
                String emitted = method.get().py().emit(receiver, arguments);
                return member.access() == AstNode.Access.OPTIONAL
                    ? "(" + emitted + " if " + receiver
                        + " is not None else None)"
                    : emitted;
            }
        }
        String calleeText = this.genReceiver(callee);
        String call = calleeText + "(" + String.join(", ", arguments) + ")";
        if(data.access() == AstNode.Access.OPTIONAL) {
            return "(" + call + " if " + calleeText + " is not None else None)";
        }
        return call;
    }

}
