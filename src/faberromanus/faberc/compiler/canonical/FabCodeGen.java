package faberromanus.faberc.compiler.canonical;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import faberromanus.faberc.compiler.ErrorException;
import faberromanus.faberc.compiler.Options;
import faberromanus.faberc.compiler.backend.CodeGen;
import faberromanus.faberc.compiler.frontend.AstNode;
import faberromanus.faberc.compiler.layout.Formatter;

/**
 * Emits Faber source in its canonical layout. The comments of the input
 * are carried over when its text is among the provided files.
 */
public class FabCodeGen implements CodeGen {

    private static final Logger LOGGER = Logger.getLogger(
        FabCodeGen.class.getName()
    );

    private final Options options;
    private final Map<String, String> sourceFiles;

    public FabCodeGen(Options options, Map<String, String> sourceFiles) {
        this.options = options;
        this.sourceFiles = sourceFiles;
    }

    @Override
    public String generate(AstNode program) {
        FaberPlugin plugin = new FaberPlugin(this.options);
        String text = this.sourceFiles.get(program.source.file());
        if(text == null) {
            LOGGER.log(Level.FINE,
                "No source text for {0}, printing without comments",
                program.source.file()
            );
        } else {
            try {
                plugin.attach(program, text);
            } catch(ErrorException e) {
                throw new IllegalStateException(
                    "Source of a parsed program no longer lexes: "
                        + e.error.message(),
                    e
                );
            }
        }
        return new Formatter<>(plugin, this.options).print(program);
    }

}
