package faberromanus.faberc.compiler;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public record Options(
    String indent,
    boolean semicolons,
    Target target,
    int breakThreshold,
    int printWidth
) {

    private static final Logger LOGGER = Logger.getLogger(
        Options.class.getName()
    );

    public static final Options DEFAULT = new Options(
        "    ", true, Target.TYPESCRIPT, 3, 100
    );

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static class OptionsFile {
        @JsonProperty("indent") JsonNode indent;
        @JsonProperty("semicolons") Boolean semicolons;
        @JsonProperty("target") String target;
        @JsonProperty("breakThreshold") Integer breakThreshold;
        @JsonProperty("printWidth") Integer printWidth;
    }

    public Options {
        if(!indent.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException(
                "Indentation may only consist of spaces and tabs!"
            );
        }
        if(breakThreshold < 1) {
            throw new IllegalArgumentException(
                "The break threshold must be at least 1!"
            );
        }
        if(printWidth < 1) {
            throw new IllegalArgumentException(
                "The print width must be at least 1!"
            );
        }
    }

    public Options withIndent(String indent) {
        return new Options(
            indent, this.semicolons, this.target,
            this.breakThreshold, this.printWidth
        );
    }

    public Options withSemicolons(boolean semicolons) {
        return new Options(
            this.indent, semicolons, this.target,
            this.breakThreshold, this.printWidth
        );
    }

    public Options withTarget(Target target) {
        return new Options(
            this.indent, this.semicolons, target,
            this.breakThreshold, this.printWidth
        );
    }

    public Options withBreakThreshold(int breakThreshold) {
        return new Options(
            this.indent, this.semicolons, this.target,
            breakThreshold, this.printWidth
        );
    }

    public Options withPrintWidth(int printWidth) {
        return new Options(
            this.indent, this.semicolons, this.target,
            this.breakThreshold, printWidth
        );
    }

    public static String spaces(int count) {
        return " ".repeat(count);
    }

    private static ErrorException invalid(
        String fileName, String property, String problem
    ) {
        return new ErrorException(new Error(
            "Invalid options file '" + fileName + "'",
            "property '" + property + "' " + problem,
            new Error.Marking[0]
        ));
    }

    /**
     * Overrides the values of these options with those present in the
     * given JSON document. Properties missing from the document keep
     * their current values, unknown properties are ignored.
     */
    public Options merge(
        String fileName, String json
    ) throws ErrorException {
        OptionsFile file;
        try {
            file = MAPPER.readValue(json, OptionsFile.class);
        } catch(JsonProcessingException e) {
            throw new ErrorException(new Error(
                "Unable to parse options file '" + fileName + "': "
                    + "'" + e.getOriginalMessage() + "'"
            ));
        }
        if(file == null) {
            return this;
        }
        Options result = this;
        if(file.indent != null && !file.indent.isNull()) {
            if(file.indent.isInt()) {
                int count = file.indent.intValue();
                if(count < 0) {
                    throw Options.invalid(
                        fileName, "indent", "may not be negative"
                    );
                }
                result = result.withIndent(Options.spaces(count));
            } else if(file.indent.isTextual()) {
                String indent = file.indent.textValue();
                if(!indent.chars().allMatch(c -> c == ' ' || c == '\t')) {
                    throw Options.invalid(
                        fileName, "indent",
                        "may only contain spaces and tabs"
                    );
                }
                result = result.withIndent(indent);
            } else {
                throw Options.invalid(
                    fileName, "indent", "must be a string or a number"
                );
            }
        }
        if(file.semicolons != null) {
            result = result.withSemicolons(file.semicolons);
        }
        if(file.target != null) {
            Target target = Target.fromName(file.target).orElseThrow(
                () -> Options.invalid(
                    fileName, "target",
                    "names unknown target '" + file.target + "'"
                )
            );
            result = result.withTarget(target);
        }
        if(file.breakThreshold != null) {
            if(file.breakThreshold < 1) {
                throw Options.invalid(
                    fileName, "breakThreshold", "must be at least 1"
                );
            }
            result = result.withBreakThreshold(file.breakThreshold);
        }
        if(file.printWidth != null) {
            if(file.printWidth < 1) {
                throw Options.invalid(
                    fileName, "printWidth", "must be at least 1"
                );
            }
            result = result.withPrintWidth(file.printWidth);
        }
        LOGGER.log(Level.FINE, "Loaded options from {0}: {1}", new Object[] {
            fileName, result
        });
        return result;
    }

}
