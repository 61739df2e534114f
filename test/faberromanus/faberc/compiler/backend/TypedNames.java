package faberromanus.faberc.compiler.backend;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import faberromanus.faberc.compiler.Analyzer;
import faberromanus.faberc.compiler.frontend.AstNode;
import faberromanus.faberc.compiler.frontend.DataType;

/**
 * Stands in for semantic analysis by attaching fixed types to every
 * identifier with a known name.
 */
final class TypedNames implements Analyzer {

    static final DataType NUMERUS = DataType.primitive("numerus");
    static final DataType TEXTUS = DataType.primitive("textus");
    static final DataType FORMA = DataType.discretio("Forma", List.of(
        new DataType.Variant("Circulus", List.of("radius")),
        new DataType.Variant("Punctum", List.of())
    ));

    private final Map<String, DataType> types;

    TypedNames() {
        this.types = new HashMap<>();
    }

    TypedNames with(String name, DataType type) {
        this.types.put(name, type);
        return this;
    }

    static DataType lista(DataType element) {
        return DataType.generic("lista", element);
    }

    static DataType tabula(DataType key, DataType value) {
        return DataType.generic("tabula", key, value);
    }

    @Override
    public AstNode analyze(AstNode program) {
        return program.transform(node -> {
            if(node.type != AstNode.Type.IDENTIFIER) { return node; }
            DataType type = this.types.get(
                node.<AstNode.Identifier>getValue().name()
            );
            return type == null? node : node.withResolvedType(type);
        });
    }

}
