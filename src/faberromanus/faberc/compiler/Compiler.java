package faberromanus.faberc.compiler;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import faberromanus.faberc.compiler.backend.CodeGen;
import faberromanus.faberc.compiler.frontend.AstNode;
import faberromanus.faberc.compiler.frontend.Lexer;
import faberromanus.faberc.compiler.frontend.SourceParser;

public class Compiler {

    private static final Logger LOGGER = Logger.getLogger(
        Compiler.class.getName()
    );

    public static Result<AstNode> parse(String fileName, String content) {
        try {
            SourceParser parser = new SourceParser(
                new Lexer(fileName, content)
            );
            return Result.ofValue(parser.parseProgram());
        } catch(ErrorException e) {
            return Result.ofError(e.error);
        }
    }

    public static Result<String> compile(
        Map<String, String> files, String fileName, Options options
    ) {
        return Compiler.compile(files, fileName, options, Analyzer.NONE);
    }

    /**
     * Parses the given file, hands the tree to the analyzer and lowers
     * the result for the target selected in the options. Unsupported
     * constructs and syntax errors become errors of the result, unknown
     * node kinds propagate as {@link UnknownNodeException}.
     */
    public static Result<String> compile(
        Map<String, String> files, String fileName, Options options,
        Analyzer analyzer
    ) {
        String content = files.get(fileName);
        if(content == null) {
            return Result.ofError(new Error(
                "The file '" + fileName + "' was not provided"
            ));
        }
        if(!fileName.endsWith(Target.FABER.fileExtension)) {
            return Result.ofError(new Error(
                "Unsupported file extension for file '" + fileName + "'"
            ));
        }
        Result<AstNode> parsed = Compiler.parse(fileName, content);
        if(parsed.isError()) {
            return Result.ofError(parsed.getError());
        }
        AstNode program;
        try {
            program = analyzer.analyze(parsed.getValue());
        } catch(ErrorException e) {
            return Result.ofError(e.error);
        }
        CodeGen codeGen = options.target().codeGen.create(options, files);
        try {
            String output = codeGen.generate(program);
            LOGGER.log(Level.FINE, "Lowered {0} to {1}", new Object[] {
                fileName, options.target().targetName
            });
            return Result.ofValue(output);
        } catch(UnsupportedConstructException e) {
            return Result.ofError(e.error);
        }
    }

}
