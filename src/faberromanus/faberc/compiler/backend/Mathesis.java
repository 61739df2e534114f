package faberromanus.faberc.compiler.backend;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import faberromanus.faberc.compiler.Target;

/**
 * Translations of the functions and constants importable from
 * 'norma/mathesis'.
 */
public class Mathesis {

    public static final String MODULE = "norma/mathesis";

    @FunctionalInterface
    public static interface Emission {
        String emit(List<String> args);
    }

    public static record Entry(Emission ts, Emission py, boolean needsMath) {
        public Emission emission(Target target) {
            return target == Target.PYTHON? this.py : this.ts;
        }
    }

    private Mathesis() {}

    private static final Map<String, Entry> FUNCTIONS = new HashMap<>();
    private static final Map<String, Entry> CONSTANTS = new HashMap<>();

    private static String a(List<String> args, int index) {
        return ListaMethods.arg(args, index, "0");
    }

    private static void unary(String name, String ts, String py) {
        boolean needsMath = py.startsWith("math.");
        FUNCTIONS.put(name, new Entry(
            args -> ts + "(" + a(args, 0) + ")",
            args -> py + "(" + a(args, 0) + ")",
            needsMath
        ));
    }

    static {
        unary("pavimentum", "Math.floor", "math.floor");
        unary("tectum", "Math.ceil", "math.ceil");
        unary("rotundum", "Math.round", "round");
        unary("truncatum", "Math.trunc", "math.trunc");
        unary("radix", "Math.sqrt", "math.sqrt");
        unary("logarithmus", "Math.log", "math.log");
        unary("logarithmus10", "Math.log10", "math.log10");
        unary("exponens", "Math.exp", "math.exp");
        unary("sinus", "Math.sin", "math.sin");
        unary("cosinus", "Math.cos", "math.cos");
        unary("tangens", "Math.tan", "math.tan");
        unary("absolutum", "Math.abs", "abs");
        FUNCTIONS.put("potentia", new Entry(
            args -> "Math.pow(" + a(args, 0) + ", " + a(args, 1) + ")",
            args -> "math.pow(" + a(args, 0) + ", " + a(args, 1) + ")",
            true
        ));
        FUNCTIONS.put("signum", new Entry(
            args -> "Math.sign(" + a(args, 0) + ")",
            args -> "(1 if " + a(args, 0) + " > 0 else (-1 if "
                + a(args, 0) + " < 0 else 0))",
            false
        ));
        FUNCTIONS.put("minimus", new Entry(
            args -> "Math.min(" + String.join(", ", args) + ")",
            args -> "min(" + String.join(", ", args) + ")",
            false
        ));
        FUNCTIONS.put("maximus", new Entry(
            args -> "Math.max(" + String.join(", ", args) + ")",
            args -> "max(" + String.join(", ", args) + ")",
            false
        ));
        FUNCTIONS.put("constringens", new Entry(
            args -> "Math.min(Math.max(" + a(args, 0) + ", " + a(args, 1)
                + "), " + a(args, 2) + ")",
            args -> "max(" + a(args, 1) + ", min(" + a(args, 2) + ", "
                + a(args, 0) + "))",
            false
        ));
        CONSTANTS.put("PI", new Entry(
            args -> "Math.PI", args -> "math.pi", true
        ));
        CONSTANTS.put("E", new Entry(
            args -> "Math.E", args -> "math.e", true
        ));
        CONSTANTS.put("TAU", new Entry(
            args -> "(2 * Math.PI)", args -> "math.tau", true
        ));
    }

    public static Optional<Entry> function(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name));
    }

    public static Optional<Entry> constant(String name) {
        return Optional.ofNullable(CONSTANTS.get(name));
    }

}
