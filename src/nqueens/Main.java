package nqueens;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import nqueens.core.RunResult;
import nqueens.ga.AbstractSolver;
import nqueens.ga.SolverConfig;
import nqueens.ga.SolverType;

/**
 * Command-line driver: runs one solver over a range of seeds, prints the
 * fastest run, exports every run to CSV and prints batch statistics.
 */
public class Main {
    static final int MIN_QUEENS = 4;
    static final int MAX_QUEENS = 512;
    static final String DEFAULT_CSV = "summary.csv";
    static final String CONFIG_RESOURCE = "/nqueens.properties";

    private static final String USAGE =
        "Usage: Main <n: 4-512> <Genetic|Tournament> <maxSeed> [csvFile] [propertiesFile]";

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 3) {
            err.println(USAGE);
            return 1;
        }

        int nQueens;
        int maxSeed;
        SolverType type;
        SolverConfig config;
        try {
            nQueens = Integer.parseInt(args[0].trim());
            if (nQueens < MIN_QUEENS || nQueens > MAX_QUEENS) {
                throw new IllegalArgumentException("Number of queens must be in [" + MIN_QUEENS + ", " + MAX_QUEENS + "]");
            }
            type = SolverType.parse(args[1]);
            maxSeed = Integer.parseInt(args[2].trim());
            if (maxSeed < 0) {
                throw new IllegalArgumentException("Seed range must not be negative");
            }
            config = loadConfig(type, args.length > 4 ? Paths.get(args[4]) : null);
        } catch (IOException e) {
            err.println("Error reading configuration: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Invalid arguments: " + e.getMessage());
            err.println(USAGE);
            return 1;
        }

        Path csvFile = Paths.get(args.length > 3 ? args[3] : DEFAULT_CSV);
        SummaryCsvWriter csv = new SummaryCsvWriter(csvFile);
        StatisticsAnalyzer statistics = new StatisticsAnalyzer();
        AbstractSolver solver = type.create(config);

        out.printf("Running %s: N=%d, Seeds=0..%d\n", solver.getName(), nQueens, maxSeed);
        out.println(config);

        long totalStart = System.currentTimeMillis();
        RunResult fastest = null;
        for (int seed = 0; seed <= maxSeed; seed++) {
            RunResult result = solver.solve(nQueens, seed);
            statistics.recordExecution(result);
            out.printf("Seed %d, Queens %d, Time: %s, Generations: %d, Intersections: %d\n",
                seed, nQueens, result.formatElapsed(), result.getGenerations(), result.getConflicts());

            try {
                csv.append(result, type.getLabel());
                if (seed == 0) {
                    writeConvergenceDataToFile(csvFile, result, type);
                }
            } catch (IOException e) {
                err.println("Error exporting CSV: " + e.getMessage());
            }
            if (!result.isSolved()) {
                out.printf("Seed %d did not reach a solution. Intersections = %d\n", seed, result.getConflicts());
            }

            if (fastest == null || result.getElapsed().compareTo(fastest.getElapsed()) < 0) {
                fastest = result;
            }
        }

        printBestResult(out, fastest);
        out.println(statistics.generateReport());
        out.printf("\nTotal Process Time: %s\n",
            RunResult.formatDuration(Duration.ofMillis(System.currentTimeMillis() - totalStart)));
        return 0;
    }

    /**
     * Classpath defaults first, then the optional properties file on top,
     * both applied to the algorithm's preset.
     */
    static SolverConfig loadConfig(SolverType type, Path propertiesFile) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Main.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        }
        if (propertiesFile != null) {
            try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        }
        return SolverConfig.fromProperties(props, type.defaultConfig());
    }

    private static void writeConvergenceDataToFile(Path csvFile, RunResult result, SolverType type) throws IOException {
        Path dir = csvFile.toAbsolutePath().getParent();
        String name = String.format("convergence_N%d_%s.csv", result.getN(), type.getLabel());
        SummaryCsvWriter.writeConvergence(dir == null ? Paths.get(name) : dir.resolve(name), result);
    }

    private static void printBestResult(PrintStream out, RunResult best) {
        if (best == null) {
            return;
        }
        out.printf("\nBest Result (Seed with shortest runtime: %s):\n", best.formatElapsed());
        out.println("Algorithm Used: " + best.getAlgorithm());
        out.println("Number of Generations: " + best.getGenerations());
        if (best.getN() <= 64) {
            out.print(best.getBestBoard().render(3));
        } else {
            out.println("Board too large to display.");
        }
        out.println("1D Representation: " + best.getBestBoard());
        out.println(best.summary());
    }
}
