package faberromanus.faberc.compiler.frontend;

import java.util.List;
import java.util.Optional;

/**
 * A type resolved by semantic analysis and attached to syntax tree nodes.
 */
public final class DataType {

    public static record Primitive(
        String name
    ) {}

    public static record Generic(
        String name,
        List<DataType> arguments
    ) {}

    public static record Variant(
        String name,
        List<String> fieldNames
    ) {}

    public static record Discretio(
        String name,
        List<Variant> variants
    ) {}

    public static record User(
        String name
    ) {}

    public enum Type {
        PRIMITIVE, // Primitive
        GENERIC,   // Generic
        DISCRETIO, // Discretio
        USER,      // User
        FUNCTION,  // = null
        UNKNOWN    // = null
    }

    public final Type type;
    private final Object value;

    private DataType(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static DataType primitive(String name) {
        return new DataType(Type.PRIMITIVE, new Primitive(name));
    }

    public static DataType generic(String name, DataType... arguments) {
        return new DataType(
            Type.GENERIC, new Generic(name, List.of(arguments))
        );
    }

    public static DataType discretio(String name, List<Variant> variants) {
        return new DataType(
            Type.DISCRETIO, new Discretio(name, List.copyOf(variants))
        );
    }

    public static DataType user(String name) {
        return new DataType(Type.USER, new User(name));
    }

    public static DataType function() {
        return new DataType(Type.FUNCTION, null);
    }

    public static DataType unknown() {
        return new DataType(Type.UNKNOWN, null);
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    /**
     * Returns the name of the collection this type refers to, if it is
     * one of the generic collection types.
     */
    public Optional<String> genericName() {
        if(this.type != Type.GENERIC) {
            return Optional.empty();
        }
        return Optional.of(this.<Generic>getValue().name());
    }

    public Optional<Variant> findVariant(String variantName) {
        if(this.type != Type.DISCRETIO) {
            return Optional.empty();
        }
        for(Variant variant: this.<Discretio>getValue().variants()) {
            if(variant.name().equals(variantName)) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof DataType)) { return false; }
        DataType other = (DataType) otherRaw;
        if(this.type != other.type) { return false; }
        return this.value == null
            ? other.value == null
            : this.value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return this.type.hashCode() * 31
            + (this.value == null? 0 : this.value.hashCode());
    }

    @Override
    public String toString() {
        switch(this.type) {
            case PRIMITIVE: return this.<Primitive>getValue().name();
            case GENERIC: {
                Generic data = this.getValue();
                StringBuilder out = new StringBuilder(data.name());
                out.append("<");
                for(int argI = 0; argI < data.arguments().size(); argI += 1) {
                    if(argI > 0) { out.append(", "); }
                    out.append(data.arguments().get(argI));
                }
                out.append(">");
                return out.toString();
            }
            case DISCRETIO: return this.<Discretio>getValue().name();
            case USER: return this.<User>getValue().name();
            case FUNCTION: return "functio";
            case UNKNOWN: return "?";
            default: throw new IllegalStateException("unhandled type!");
        }
    }

}
