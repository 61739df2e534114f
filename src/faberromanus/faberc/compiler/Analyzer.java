package faberromanus.faberc.compiler;

import faberromanus.faberc.compiler.frontend.AstNode;

@FunctionalInterface
public interface Analyzer {

    Analyzer NONE = program -> program;

    AstNode analyze(AstNode program) throws ErrorException;

}
