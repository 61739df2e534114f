package faberromanus.faberc.compiler.backend;

import java.util.Map;

import faberromanus.faberc.compiler.Options;
import faberromanus.faberc.compiler.frontend.AstNode;

public interface CodeGen {

    @FunctionalInterface
    public static interface Constructor {
        CodeGen create(Options options, Map<String, String> sourceFiles);
    }

    String generate(AstNode program);

}
