package corridor.testbed;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Runs generated corridor instances through {@link TestEnvironment} and reports the outcome.
 *
 * <p>Arguments are {@code --key=value} pairs; {@code --help} lists them. The exit status is 0 when
 * every instance passed, 1 when one failed a check, 2 when the arguments were rejected.</p>
 */
public class Main {

    enum Mode { SMALL, BATCH, BIG }

    static class Options {
        Mode mode = Mode.BATCH;
        int instances = 5;
        int n = 12;
        int cap = 50;
        double density = 0.4;
        Long seed = 123L;   // null: derived from System.nanoTime()
        boolean help = false;
        boolean invalid = false;
    }

    private static final String[][] OPTION_HELP = {
            {"--mode=small|batch|big", "preset batches, or one batch from the flags below (batch)"},
            {"--instances=<int>", "instances in the batch (5)"},
            {"--n=<int>", "rooms per instance, at least 2 (12)"},
            {"--cap=<int>", "largest corridor capacity (50)"},
            {"--density=<double>", "corridor probability in (0, 1] (0.4)"},
            {"--seed=<long>|auto", "random seed (123)"},
            {"--help, -h", "show this text"},
    };

    public static void main(String[] args) {
        Options opt = parseArgs(args);
        if (opt.help || opt.invalid) {
            printUsage();
            if (opt.invalid) System.exit(2);
            return;
        }

        TestEnvironment.Summary summary = run(opt);
        if (!summary.allPassed()) System.exit(1);
    }

    static TestEnvironment.Summary run(Options opt) {
        long seed = opt.seed != null ? opt.seed : System.nanoTime();
        printHeader(opt, seed);

        TestEnvironment.Summary summary =
                TestEnvironment.runBatches(batchesFor(opt), new Random(seed), Main::println);

        println(String.format(Locale.ROOT, "%d instances, %d failed, %d min-cut mismatches -> %s",
                summary.instances, summary.failed, summary.minCutMismatches,
                summary.allPassed() ? "PASS" : "FAIL"));
        return summary;
    }

    static List<TestEnvironment.BatchConfig> batchesFor(Options opt) {
        List<TestEnvironment.BatchConfig> batches = new ArrayList<>();
        switch (opt.mode) {
            case SMALL:
                batches.add(new TestEnvironment.BatchConfig(3, 8, 50, 0.5));
                batches.add(new TestEnvironment.BatchConfig(2, 14, 50, 0.3));
                break;
            case BIG:
                batches.add(new TestEnvironment.BatchConfig(20, 16, 2_000_000, 0.4));
                batches.add(new TestEnvironment.BatchConfig(15, 30, 2_000_000, 0.3));
                batches.add(new TestEnvironment.BatchConfig(10, 50, 2_000_000, 0.2));
                break;
            case BATCH:
            default:
                batches.add(new TestEnvironment.BatchConfig(opt.instances, opt.n, opt.cap, opt.density));
                break;
        }
        return batches;
    }

    /* ============================= Arguments ============================= */

    static Options parseArgs(String[] args) {
        Options o = new Options();
        if (args == null) return o;

        for (String raw : args) {
            if (raw == null || raw.isBlank()) continue;
            String arg = raw.trim();

            int eq = arg.indexOf('=');
            String key = eq < 0 ? arg : arg.substring(0, eq);
            String value = eq < 0 ? null : arg.substring(eq + 1).trim();

            try {
                apply(o, key, value);
            } catch (IllegalArgumentException e) {
                System.err.println(arg + ": " + e.getMessage());
                o.invalid = true;
            }
        }
        return o;
    }

    private static void apply(Options o, String key, String value) {
        switch (key) {
            case "--help":
            case "-h":
                o.help = true;
                return;
            case "--mode":
                try {
                    o.mode = Mode.valueOf(required(value).toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("mode must be one of small, batch, big");
                }
                return;
            case "--instances":
                o.instances = positive(value);
                return;
            case "--n":
                o.n = positive(value);
                if (o.n < 2) throw new IllegalArgumentException("need at least 2 rooms");
                return;
            case "--cap":
                o.cap = positive(value);
                return;
            case "--density":
                double d = number(value);
                if (!(d > 0.0 && d <= 1.0)) throw new IllegalArgumentException("density must be in (0, 1]");
                o.density = d;
                return;
            case "--seed":
                o.seed = "auto".equalsIgnoreCase(required(value)) ? null : Long.valueOf(value);
                return;
            default:
                throw new IllegalArgumentException("unknown option");
        }
    }

    private static String required(String value) {
        if (value == null || value.isEmpty()) throw new IllegalArgumentException("missing value");
        return value;
    }

    private static int positive(String value) {
        int v = Integer.parseInt(required(value));
        if (v <= 0) throw new IllegalArgumentException("must be positive");
        return v;
    }

    private static double number(String value) {
        return Double.parseDouble(required(value));
    }

    /* ============================= Output ============================= */

    private static void printUsage() {
        StringBuilder sb = new StringBuilder("corridor-flow testbed, options:\n");
        for (String[] row : OPTION_HELP) {
            sb.append(String.format(Locale.ROOT, "  %-26s %s%n", row[0], row[1]));
        }
        System.out.print(sb);
    }

    private static void printHeader(Options opt, long seed) {
        String params = opt.mode == Mode.BATCH
                ? String.format(Locale.ROOT, " instances=%d n=%d cap=%d density=%.2f",
                        opt.instances, opt.n, opt.cap, opt.density)
                : "";
        println("mode=" + opt.mode.name().toLowerCase(Locale.ROOT) + params
                + " seed=" + seed + (opt.seed == null ? " (auto)" : ""));
        println("");
    }

    private static void println(String s) {
        System.out.println(s);
    }
}
