package faberromanus.faberc.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import faberromanus.faberc.compiler.Error;
import faberromanus.faberc.compiler.Result;

public class Cli {

    private interface Argument {
        char shortName();
        String longName();
        String description();
        String valueDescription();
        boolean hasValue();
    }

    public static record OptionalArgument(
        char shortName, String longName, String description,
        String valueDescription
    ) implements Argument {
        @Override public boolean hasValue() { return true; }
    }

    public static record Flag(
        char shortName, String longName, String description
    ) implements Argument {
        @Override public boolean hasValue() { return false; }
        @Override public String valueDescription() { return null; }
    }

    public static final Flag HELP = new Flag(
        'h', "help", "displays a list of all available arguments"
    );


    public static class Values {

        private final Map<OptionalArgument, Optional<String>> optional;
        private final Map<Flag, Boolean> flags;
        private final List<String> free;

        private Values(
            Map<OptionalArgument, Optional<String>> optional,
            Map<Flag, Boolean> flags,
            List<String> free
        ) {
            this.optional = optional;
            this.flags = flags;
            this.free = free;
        }

        public Optional<String> get(OptionalArgument arg) {
            if(!this.optional.containsKey(arg)) {
                throw new IllegalArgumentException(
                    "The given argument was not registered!"
                );
            }
            return this.optional.get(arg);
        }

        public boolean get(Flag flag) {
            if(!this.flags.containsKey(flag)) {
                throw new IllegalArgumentException(
                    "The given flag was not registered!"
                );
            }
            return this.flags.get(flag);
        }

        /** The arguments that are neither flags nor argument values. */
        public List<String> free() {
            return this.free;
        }

    }


    private final List<OptionalArgument> optional;
    private final List<Flag> flags;
    private final Set<String> registered;

    public Cli() {
        this.optional = new ArrayList<>();
        this.flags = new ArrayList<>();
        this.registered = new HashSet<>();
        this.add(HELP);
    }

    private void register(Argument arg) {
        if(!this.registered.add(arg.longName())) {
            throw new IllegalArgumentException(
                "The argument '" + arg.longName() + "' was already registered!"
            );
        }
    }

    public Cli add(OptionalArgument arg) {
        this.register(arg);
        this.optional.add(arg);
        return this;
    }

    public Cli add(Flag flag) {
        this.register(flag);
        this.flags.add(flag);
        return this;
    }

    private static Result<Values> invalidArgument(String arg) {
        return Result.ofError(new Error(
            "'" + arg + "' is not a valid argument"
        ));
    }

    private static Result<Values> missingValue(String arg) {
        return Result.ofError(new Error(
            "'" + arg + "' does not have a value specified"
        ));
    }

    private Argument lookUpArgument(String longName) {
        for(OptionalArgument arg: this.optional) {
            if(arg.longName.equals(longName)) { return arg; }
        }
        for(Flag arg: this.flags) {
            if(arg.longName.equals(longName)) { return arg; }
        }
        return null;
    }

    private Argument lookUpArgument(char shortName) {
        for(OptionalArgument arg: this.optional) {
            if(arg.shortName == shortName) { return arg; }
        }
        for(Flag arg: this.flags) {
            if(arg.shortName == shortName) { return arg; }
        }
        return null;
    }

    private static void appendArgumentHelp(StringBuilder out, Argument arg) {
        String value = arg.hasValue()
            ? " <" + arg.valueDescription() + ">"
            : "";
        out.append("    -").append(arg.shortName()).append(value)
            .append("\n");
        out.append("    --").append(arg.longName()).append(value)
            .append("\n");
        out.append("                ").append(arg.description())
            .append("\n");
    }

    public String helpText(String usage) {
        StringBuilder out = new StringBuilder();
        out.append("Usage: ").append(usage).append("\n");
        out.append("List of available arguments:\n");
        for(OptionalArgument arg: this.optional) {
            Cli.appendArgumentHelp(out, arg);
        }
        for(Flag arg: this.flags) {
            Cli.appendArgumentHelp(out, arg);
        }
        return out.toString();
    }

    /**
     * Parses the given arguments. Values follow their argument or are
     * attached with '=' ('--target=py'), and everything after '--' is a
     * free argument.
     */
    public Result<Values> parse(String[] args) {
        Map<OptionalArgument, Optional<String>> optional = new HashMap<>();
        Map<Flag, Boolean> flags = new HashMap<>();
        List<String> free = new ArrayList<>();
        boolean onlyFree = false;
        for(int argIdx = 0; argIdx < args.length; argIdx += 1) {
            String arg = args[argIdx];
            if(onlyFree) {
                free.add(arg);
                continue;
            }
            if(arg.equals("--")) {
                onlyFree = true;
                continue;
            }
            String name = arg;
            String attached = null;
            Argument argObj;
            if(arg.startsWith("--")) {
                int equals = arg.indexOf('=');
                if(equals != -1) {
                    name = arg.substring(0, equals);
                    attached = arg.substring(equals + 1);
                }
                argObj = this.lookUpArgument(name.substring(2));
            } else if(arg.startsWith("-") && arg.length() > 1) {
                if(arg.length() > 2) {
                    return Cli.invalidArgument(arg);
                }
                argObj = this.lookUpArgument(arg.charAt(1));
            } else {
                free.add(arg);
                continue;
            }
            if(argObj == null) {
                return Cli.invalidArgument(name);
            }
            if(!argObj.hasValue()) {
                if(attached != null) {
                    return Cli.invalidArgument(arg);
                }
                flags.put((Flag) argObj, true);
                continue;
            }
            if(attached == null) {
                if(argIdx + 1 >= args.length
                        || args[argIdx + 1].startsWith("-")) {
                    return Cli.missingValue(arg);
                }
                attached = args[argIdx + 1];
                argIdx += 1;
            } else if(attached.isEmpty()) {
                return Cli.missingValue(name);
            }
            optional.put((OptionalArgument) argObj, Optional.of(attached));
        }
        for(OptionalArgument arg: this.optional) {
            optional.putIfAbsent(arg, Optional.empty());
        }
        for(Flag arg: this.flags) {
            flags.putIfAbsent(arg, false);
        }
        return Result.ofValue(new Values(optional, flags, free));
    }

}
