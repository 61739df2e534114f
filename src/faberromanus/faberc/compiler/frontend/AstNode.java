package faberromanus.faberc.compiler.frontend;

import java.lang.reflect.Constructor;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

import faberromanus.faberc.compiler.Source;

public class AstNode {

    public enum VarKind {
        VARIA("varia", true, false),
        FIXUM("fixum", false, false),
        FIGENDUM("figendum", false, true),
        VARIANDUM("variandum", true, true);

        public final String keyword;
        public final boolean isMutable;
        public final boolean isAwaited;

        private VarKind(String keyword, boolean isMutable, boolean isAwaited) {
            this.keyword = keyword;
            this.isMutable = isMutable;
            this.isAwaited = isAwaited;
        }
    }

    public enum ReturnVerb {
        ARROW("->"),
        FIT("fit"),
        FIET("fiet"),
        FIUNT("fiunt"),
        FIENT("fient");

        public final String keyword;

        private ReturnVerb(String keyword) {
            this.keyword = keyword;
        }
    }

    public enum LiteralKind { NUMBER, STRING, BOOLEAN, NIHIL }

    public enum RangeKind { EXCLUSIVE, INCLUSIVE }

    public enum Access { NORMAL, OPTIONAL, NON_NULL }

    public enum IterKind { EX, DE }

    public enum ScribeLevel {
        SCRIBE("scribe"),
        VIDE("vide"),
        MONE("mone");

        public final String keyword;

        private ScribeLevel(String keyword) {
            this.keyword = keyword;
        }
    }

    public static record Program(
        List<AstNode> body
    ) {}

    public static record Specifier(
        String imported,
        Optional<String> local
    ) {
        public String localName() {
            return this.local.orElse(this.imported);
        }
    }

    public static record Import(
        String source,
        List<Specifier> specifiers,
        boolean wildcard
    ) {}

    public static record Destructure(
        AstNode source,
        VarKind kind,
        List<Specifier> specifiers
    ) {}

    public static record Variable(
        VarKind kind,
        Optional<AstNode> type,
        AstNode target,
        Optional<AstNode> value
    ) {}

    public static record Function(
        String name,
        List<String> typeParams,
        List<AstNode> params,
        Optional<AstNode> returnType,
        ReturnVerb verb,
        boolean futura,
        boolean cursor,
        boolean isPrivate,
        boolean isStatic,
        Optional<AstNode> body
    ) {}

    public static record Parameter(
        String name,
        Optional<AstNode> type,
        boolean rest,
        Optional<AstNode> defaultValue
    ) {}

    public static record TypeAlias(
        String name,
        AstNode type
    ) {}

    public static record OrdoMember(
        String name,
        Optional<AstNode> value
    ) {}

    public static record Ordo(
        String name,
        List<OrdoMember> members
    ) {}

    public static record VariantField(
        AstNode type,
        String name
    ) {}

    public static record VariantDecl(
        String name,
        List<VariantField> fields
    ) {}

    public static record Discretio(
        String name,
        List<String> typeParams,
        List<VariantDecl> variants
    ) {}

    public static record Genus(
        String name,
        List<String> typeParams,
        List<String> implemented,
        List<AstNode> members
    ) {}

    public static record GenusField(
        AstNode type,
        String name,
        boolean isPrivate,
        boolean isStatic,
        Optional<AstNode> init
    ) {}

    public static record Pactum(
        String name,
        List<String> typeParams,
        List<AstNode> methods
    ) {}

    public static record CatchClause(
        String name,
        AstNode body
    ) {}

    public static record Si(
        AstNode condition,
        AstNode then,
        Optional<CatchClause> cape,
        Optional<AstNode> otherwise
    ) {}

    public static record Dum(
        AstNode condition,
        AstNode body,
        Optional<CatchClause> cape
    ) {}

    public static record Iteratio(
        IterKind kind,
        AstNode iterable,
        String binding,
        AstNode body,
        Optional<CatchClause> cape
    ) {}

    public static record EligeCase(
        AstNode value,
        AstNode body
    ) {}

    public static record Elige(
        AstNode subject,
        List<EligeCase> cases,
        Optional<AstNode> otherwise,
        Optional<CatchClause> cape
    ) {}

    public static record DiscerneCase(
        String variant,
        Optional<String> alias,
        List<String> bindings,
        AstNode body
    ) {}

    public static record Discerne(
        AstNode subject,
        List<DiscerneCase> cases,
        Optional<AstNode> otherwise
    ) {}

    public static record Guard(
        AstNode condition,
        AstNode body
    ) {}

    public static record Custodi(
        List<Guard> guards
    ) {}

    public static record Adfirma(
        AstNode condition,
        Optional<AstNode> message
    ) {}

    public static record Redde(
        Optional<AstNode> value
    ) {}

    public static record Block(
        List<AstNode> body
    ) {}

    public static record Iace(
        AstNode value,
        boolean fatal
    ) {}

    public static record Scribe(
        ScribeLevel level,
        List<AstNode> arguments
    ) {}

    public static record Tempta(
        AstNode body,
        Optional<CatchClause> cape,
        Optional<AstNode> demum
    ) {}

    public static record Fac(
        AstNode body,
        Optional<CatchClause> cape
    ) {}

    /**
     * A scoped resource. Without a resource expression the curator names
     * an allocator kind that non-native targets drop.
     */
    public static record Cura(
        Optional<String> curator,
        Optional<AstNode> resource,
        Optional<AstNode> type,
        String binding,
        boolean async,
        AstNode body,
        Optional<CatchClause> cape
    ) {}

    public static record Praepara(
        boolean after,
        boolean all,
        boolean async,
        AstNode body
    ) {}

    /** Body is a block, or a single statement for the 'ergo' form. */
    public static record Incipit(
        boolean async,
        AstNode body
    ) {}

    public static record In(
        AstNode object,
        AstNode body
    ) {}

    public static record Probandum(
        String name,
        List<AstNode> body
    ) {}

    public enum ProbaModifier {
        OMITTE("omitte"),
        FUTURUM("futurum");

        public final String keyword;

        private ProbaModifier(String keyword) {
            this.keyword = keyword;
        }
    }

    public static record Proba(
        String name,
        Optional<ProbaModifier> modifier,
        Optional<String> reason,
        AstNode body
    ) {}

    public static record Identifier(
        String name
    ) {}

    public static record Literal(
        LiteralKind kind,
        String value
    ) {}

    public static record Template(
        List<String> quasis,
        List<AstNode> expressions
    ) {}

    public static record Elements(
        List<AstNode> elements
    ) {}

    public static record Property(
        String key,
        AstNode value
    ) {}

    public static record ObjectLiteral(
        List<Property> properties
    ) {}

    public static record Range(
        AstNode start,
        AstNode end,
        RangeKind kind,
        Optional<AstNode> step
    ) {}

    public static record Binary(
        String operator,
        AstNode left,
        AstNode right
    ) {}

    public static record Unary(
        String operator,
        AstNode operand
    ) {}

    public static record Est(
        AstNode value,
        AstNode target,
        boolean negated
    ) {}

    public static record Qua(
        AstNode value,
        AstNode type
    ) {}

    public static record Call(
        AstNode callee,
        List<AstNode> arguments,
        Access access
    ) {}

    public static record Member(
        AstNode object,
        AstNode property,
        boolean computed,
        Access access
    ) {}

    public static record Lambda(
        List<String> params,
        AstNode body
    ) {}

    public static record Arrow(
        List<AstNode> params,
        AstNode body
    ) {}

    public static record Assignment(
        String operator,
        AstNode target,
        AstNode value
    ) {}

    public static record Conditional(
        AstNode condition,
        AstNode then,
        AstNode otherwise
    ) {}

    public static record Novum(
        String className,
        List<AstNode> arguments,
        Optional<AstNode> overrides
    ) {}

    public static record Praefixum(
        AstNode body
    ) {}

    public static record Scriptum(
        String format,
        List<AstNode> arguments
    ) {}

    public static record Finge(
        String variant,
        List<Property> fields,
        Optional<String> unionName
    ) {}

    public static record Regex(
        String pattern,
        String flags
    ) {}

    public static record Lege(
        boolean line
    ) {}

    public static record TypeAnnotation(
        String name,
        List<AstNode> arguments,
        boolean nullable,
        int arrayDepth
    ) {}

    public static record PatternProperty(
        String key,
        String local
    ) {}

    public static record ObjectPattern(
        List<PatternProperty> properties,
        Optional<String> rest
    ) {}

    public static record ArrayPattern(
        List<Optional<String>> elements,
        Optional<String> rest
    ) {}

    public static record MonoOp(
        AstNode value
    ) {}

    public enum Type {
        // statements
        PROGRAM,              // Program
        IMPORT,               // Import
        DESTRUCTURE,          // Destructure
        VARIABLE,             // Variable
        FUNCTION,             // Function
        TYPE_ALIAS,           // TypeAlias
        ORDO,                 // Ordo
        DISCRETIO,            // Discretio
        GENUS,                // Genus
        GENUS_FIELD,          // GenusField
        PACTUM,               // Pactum
        EXPRESSION_STATEMENT, // MonoOp
        SI,                   // Si
        DUM,                  // Dum
        ITERATIO,             // Iteratio
        ELIGE,                // Elige
        DISCERNE,             // Discerne
        CUSTODI,              // Custodi
        ADFIRMA,              // Adfirma
        REDDE,                // Redde
        RUMPE,                // = null
        PERGE,                // = null
        BLOCK,                // Block
        IACE,                 // Iace
        SCRIBE,               // Scribe
        TEMPTA,               // Tempta
        CURA,                 // Cura
        PRAEPARA,             // Praepara
        INCIPIT,              // Incipit
        IN,                   // In
        PROBANDUM,            // Probandum
        PROBA,                // Proba
        FAC,                  // Fac
        // expressions
        IDENTIFIER,           // Identifier
        EGO,                  // = null
        LITERAL,              // Literal
        TEMPLATE,             // Template
        ARRAY,                // Elements
        OBJECT,               // ObjectLiteral
        SPREAD,               // MonoOp
        RANGE,                // Range
        BINARY,               // Binary
        UNARY,                // Unary
        EST,                  // Est
        QUA,                  // Qua
        CALL,                 // Call
        MEMBER,               // Member
        LAMBDA,               // Lambda
        ARROW,                // Arrow
        ASSIGNMENT,           // Assignment
        CONDITIONAL,          // Conditional
        CEDE,                 // MonoOp
        NOVUM,                // Novum
        PRAEFIXUM,            // Praefixum
        SCRIPTUM,             // Scriptum
        FINGE,                // Finge
        REGEX,                // Regex
        LEGE,                 // Lege
        // auxiliary
        TYPE,                 // TypeAnnotation
        PARAMETER,            // Parameter
        OBJECT_PATTERN,       // ObjectPattern
        ARRAY_PATTERN         // ArrayPattern
    }

    public final Type type;
    private final Object value;
    public final Source source;
    public final Optional<DataType> resolvedType;

    public AstNode(Type type, Object value, Source source) {
        this(type, value, source, Optional.empty());
    }

    public AstNode(
        Type type, Object value, Source source, Optional<DataType> resolvedType
    ) {
        this.type = type;
        this.value = value;
        this.source = source;
        this.resolvedType = resolvedType;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public AstNode withResolvedType(DataType resolvedType) {
        return new AstNode(
            this.type, this.value, this.source, Optional.of(resolvedType)
        );
    }

    public AstNode withValue(Object value) {
        return new AstNode(this.type, value, this.source, this.resolvedType);
    }

    public boolean isStatement() {
        return this.type.ordinal() <= Type.FAC.ordinal();
    }

    public boolean isAssignable() {
        switch(this.type) {
            case IDENTIFIER:
            case MEMBER:
                return true;
            default:
                return false;
        }
    }

    /**
     * Rebuilds this tree bottom-up, replacing every node with the result
     * of applying the given function to it after its children have been
     * rebuilt.
     */
    public AstNode transform(UnaryOperator<AstNode> f) {
        Object newValue = AstNode.transformValue(this.value, f);
        AstNode rebuilt = newValue == this.value
            ? this
            : this.withValue(newValue);
        return f.apply(rebuilt);
    }

    private static Object transformValue(
        Object value, UnaryOperator<AstNode> f
    ) {
        if(value instanceof AstNode) {
            return ((AstNode) value).transform(f);
        }
        if(value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> result = new ArrayList<>(list.size());
            boolean changed = false;
            for(Object element: list) {
                Object transformed = AstNode.transformValue(element, f);
                changed |= transformed != element;
                result.add(transformed);
            }
            return changed? List.copyOf(result) : value;
        }
        if(value instanceof Optional) {
            Optional<?> optional = (Optional<?>) value;
            if(optional.isEmpty()) { return value; }
            Object transformed = AstNode.transformValue(optional.get(), f);
            return transformed == optional.get()
                ? value
                : Optional.of(transformed);
        }
        if(value instanceof Record) {
            RecordComponent[] components = value.getClass()
                .getRecordComponents();
            Object[] values = new Object[components.length];
            Class<?>[] types = new Class<?>[components.length];
            boolean changed = false;
            try {
                for(int i = 0; i < components.length; i += 1) {
                    Object old = components[i].getAccessor().invoke(value);
                    values[i] = AstNode.transformValue(old, f);
                    types[i] = components[i].getType();
                    changed |= values[i] != old;
                }
                if(!changed) { return value; }
                Constructor<?> constructor = value.getClass()
                    .getDeclaredConstructor(types);
                return constructor.newInstance(values);
            } catch(ReflectiveOperationException e) {
                throw new IllegalStateException(
                    "Unable to rebuild node value " + value, e
                );
            }
        }
        return value;
    }

    /**
     * Compares two trees by structure, ignoring source positions and
     * resolved types.
     */
    public static boolean sameShape(Object a, Object b) {
        if(a instanceof AstNode && b instanceof AstNode) {
            AstNode na = (AstNode) a;
            AstNode nb = (AstNode) b;
            return na.type == nb.type && AstNode.sameShape(na.value, nb.value);
        }
        if(a instanceof List && b instanceof List) {
            List<?> la = (List<?>) a;
            List<?> lb = (List<?>) b;
            if(la.size() != lb.size()) { return false; }
            for(int i = 0; i < la.size(); i += 1) {
                if(!AstNode.sameShape(la.get(i), lb.get(i))) { return false; }
            }
            return true;
        }
        if(a instanceof Optional && b instanceof Optional) {
            Optional<?> oa = (Optional<?>) a;
            Optional<?> ob = (Optional<?>) b;
            if(oa.isEmpty() || ob.isEmpty()) {
                return oa.isEmpty() && ob.isEmpty();
            }
            return AstNode.sameShape(oa.get(), ob.get());
        }
        if(a instanceof Record && b instanceof Record) {
            if(a.getClass() != b.getClass()) { return false; }
            try {
                for(RecordComponent c: a.getClass().getRecordComponents()) {
                    Object va = c.getAccessor().invoke(a);
                    Object vb = c.getAccessor().invoke(b);
                    if(!AstNode.sameShape(va, vb)) { return false; }
                }
            } catch(ReflectiveOperationException e) {
                throw new IllegalStateException(
                    "Unable to compare node values", e
                );
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    @Override
    public String toString() {
        return this.type + (this.value == null? "" : this.value.toString());
    }

}
