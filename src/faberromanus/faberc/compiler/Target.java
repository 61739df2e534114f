package faberromanus.faberc.compiler;

import java.util.Optional;

import faberromanus.faberc.compiler.backend.CodeGen;
import faberromanus.faberc.compiler.backend.PyCodeGen;
import faberromanus.faberc.compiler.backend.TsCodeGen;
import faberromanus.faberc.compiler.canonical.FabCodeGen;

public enum Target {
    TYPESCRIPT("ts", ".ts", (options, files) -> new TsCodeGen(options)),
    PYTHON("py", ".py", (options, files) -> new PyCodeGen(options)),
    FABER("fab", ".fab", FabCodeGen::new);

    public final String targetName;
    public final String fileExtension;
    public final CodeGen.Constructor codeGen;

    private Target(
        String targetName, String fileExtension, CodeGen.Constructor codeGen
    ) {
        this.targetName = targetName;
        this.fileExtension = fileExtension;
        this.codeGen = codeGen;
    }

    public static Optional<Target> fromName(String name) {
        for(Target target: Target.values()) {
            if(target.targetName.equals(name)) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }
}
