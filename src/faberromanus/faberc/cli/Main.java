package faberromanus.faberc.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import faberromanus.faberc.compiler.Compiler;
import faberromanus.faberc.compiler.Error;
import faberromanus.faberc.compiler.ErrorException;
import faberromanus.faberc.compiler.Options;
import faberromanus.faberc.compiler.Result;
import faberromanus.faberc.compiler.Target;

public class Main {

    private static final Logger LOGGER = Logger.getLogger(
        Main.class.getName()
    );

    private static final String USAGE = "faberc [options] <file.fab>...";

    private static final Cli.OptionalArgument TARGET = new Cli.OptionalArgument(
        't', "target", "specifies the target language (default 'ts')",
        String.join(
            " / ",
            Arrays.stream(Target.values())
                .map(t -> "'" + t.targetName + "'")
                .toArray(String[]::new)
        )
    );
    private static final Cli.OptionalArgument OUTPUT = new Cli.OptionalArgument(
        'o', "output",
        "specifies the output file, or the output directory when lowering"
            + " several files (standard output if absent)",
        "output path"
    );
    private static final Cli.OptionalArgument INDENT = new Cli.OptionalArgument(
        'i', "indent", "specifies the number of spaces per indentation level",
        "spaces"
    );
    private static final Cli.OptionalArgument SEMICOLONS
        = new Cli.OptionalArgument(
            's', "semicolons", "enables or disables semicolons in TypeScript",
            "'on' / 'off'"
        );
    private static final Cli.OptionalArgument BREAK_THRESHOLD
        = new Cli.OptionalArgument(
            'b', "break-threshold",
            "specifies the item count from which canonical lists may break",
            "count"
        );
    private static final Cli.OptionalArgument CONFIG = new Cli.OptionalArgument(
        'f', "config", "specifies a JSON options file", "options file path"
    );
    private static final Cli.Flag NO_COLOR = new Cli.Flag(
        'c', "nocolor", "disables colored output"
    );
    private static final Cli.Flag VERBOSE = new Cli.Flag(
        'v', "verbose", "logs details about the lowering"
    );

    private static class ExitException extends Exception {
        private final List<Error> errors;

        private ExitException(List<Error> errors) {
            super(errors.get(0).message());
            this.errors = errors;
        }

        private ExitException(Error error) {
            this(List.of(error));
        }
    }

    public static void main(String[] args) {
        Main.configureLogging();
        System.exit(Main.run(args, System.out, System.err));
    }

    private static void configureLogging() {
        try(InputStream config = Main.class.getResourceAsStream(
            "/logging.properties"
        )) {
            if(config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch(IOException e) {
            LOGGER.log(Level.WARNING, "Unable to load the logging setup", e);
        }
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for(Handler handler: root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    /** Runs the command line and returns the exit status. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        // color is always disabled if we think we are on Windows
        boolean onWindows = System.getProperty("os.name")
            .toLowerCase().contains("win");
        Cli cli = new Cli()
            .add(TARGET).add(OUTPUT).add(INDENT).add(SEMICOLONS)
            .add(BREAK_THRESHOLD).add(CONFIG)
            .add(NO_COLOR).add(VERBOSE);
        Result<Cli.Values> parsed = cli.parse(args);
        if(parsed.isError()) {
            return Main.printErrors(parsed.getError(), Map.of(), false, err);
        }
        Cli.Values values = parsed.getValue();
        if(values.get(Cli.HELP)) {
            out.print(cli.helpText(USAGE));
            return 0;
        }
        if(values.get(VERBOSE)) {
            Main.enableVerboseLogging();
        }
        boolean colored = !values.get(NO_COLOR) && !onWindows;
        Map<String, String> files = new LinkedHashMap<>();
        try {
            if(values.free().isEmpty()) {
                throw new ExitException(new Error(
                    "No input files were given", "usage: " + USAGE
                ));
            }
            for(String fileName: values.free()) {
                files.put(fileName, Main.readFile(fileName));
            }
            Options options = Main.options(values);
            Map<String, String> outputs = new LinkedHashMap<>();
            for(String fileName: files.keySet()) {
                Result<String> lowered = Compiler.compile(
                    files, fileName, options
                );
                if(lowered.isError()) {
                    throw new ExitException(lowered.getError());
                }
                outputs.put(fileName, lowered.getValue());
            }
            Main.writeOutputs(
                outputs, values.get(OUTPUT), options.target(), out
            );
        } catch(ExitException e) {
            return Main.printErrors(e.errors, files, colored, err);
        }
        return 0;
    }

    /**
     * Combines the default options, the options file and the command line
     * flags, each overriding the ones before.
     */
    private static Options options(Cli.Values values) throws ExitException {
        Options options = Options.DEFAULT;
        Optional<String> config = values.get(CONFIG);
        if(config.isPresent()) {
            try {
                options = options.merge(
                    config.get(), Main.readFile(config.get())
                );
            } catch(ErrorException e) {
                throw new ExitException(e.error);
            }
        }
        if(values.get(TARGET).isPresent()) {
            String name = values.get(TARGET).get();
            Target target = Target.fromName(name).orElseThrow(
                () -> new ExitException(new Error(
                    "'" + name + "' is not a valid target language"
                ))
            );
            options = options.withTarget(target);
        }
        if(values.get(INDENT).isPresent()) {
            int spaces = Main.parseCount(INDENT, values.get(INDENT).get(), 0);
            options = options.withIndent(Options.spaces(spaces));
        }
        if(values.get(SEMICOLONS).isPresent()) {
            String value = values.get(SEMICOLONS).get();
            if(!value.equals("on") && !value.equals("off")) {
                throw new ExitException(new Error(
                    "'" + value + "' is not a valid value for '--semicolons'",
                    "use 'on' or 'off'"
                ));
            }
            options = options.withSemicolons(value.equals("on"));
        }
        if(values.get(BREAK_THRESHOLD).isPresent()) {
            options = options.withBreakThreshold(Main.parseCount(
                BREAK_THRESHOLD, values.get(BREAK_THRESHOLD).get(), 1
            ));
        }
        LOGGER.log(Level.FINE, "Effective options: {0}", options);
        return options;
    }

    private static int parseCount(
        Cli.OptionalArgument arg, String value, int minimum
    ) throws ExitException {
        int count;
        try {
            count = Integer.parseInt(value);
        } catch(NumberFormatException e) {
            count = minimum - 1;
        }
        if(count < minimum) {
            throw new ExitException(new Error(
                "'" + value + "' is not a valid value for '--"
                    + arg.longName() + "'",
                "expected a whole number of at least " + minimum
            ));
        }
        return count;
    }

    private static String readFile(String fileName) throws ExitException {
        try {
            byte[] fileBytes = Files.readAllBytes(Paths.get(fileName));
            return new String(fileBytes, StandardCharsets.UTF_8);
        } catch(IOException e) {
            throw new ExitException(new Error(
                "Unable to read file '" + fileName + "': "
                    + "'" + e.getMessage() + "'"
            ));
        }
    }

    private static void writeOutputs(
        Map<String, String> outputs, Optional<String> output, Target target,
        PrintStream out
    ) throws ExitException {
        if(output.isEmpty()) {
            for(String code: outputs.values()) {
                out.print(code);
            }
            return;
        }
        if(outputs.size() == 1) {
            Main.writeFile(
                outputs.values().iterator().next(), Paths.get(output.get())
            );
            return;
        }
        Path directory = Paths.get(output.get());
        for(Map.Entry<String, String> entry: outputs.entrySet()) {
            String name = Paths.get(entry.getKey()).getFileName().toString();
            String base = name.endsWith(Target.FABER.fileExtension)
                ? name.substring(
                    0, name.length() - Target.FABER.fileExtension.length()
                )
                : name;
            Main.writeFile(
                entry.getValue(),
                directory.resolve(base + target.fileExtension)
            );
        }
    }

    private static void writeFile(
        String content, Path path
    ) throws ExitException {
        byte[] contentBytes = content.getBytes(StandardCharsets.UTF_8);
        try {
            if(path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.write(path, contentBytes);
        } catch(IOException e) {
            throw new ExitException(new Error(
                "Unable to write to file '" + path + "': "
                    + "'" + e.getMessage() + "'"
            ));
        }
        LOGGER.log(Level.INFO, "Wrote {0}", path);
    }

    private static int printErrors(
        List<Error> errors, Map<String, String> files, boolean colored,
        PrintStream err
    ) {
        for(Error error: errors) {
            err.print(error.render(files, colored));
        }
        return 1;
    }

}
