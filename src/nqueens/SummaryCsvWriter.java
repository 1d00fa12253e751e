package nqueens;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import nqueens.core.RunResult;

/**
 * Appends run summaries to a CSV file for later analysis, one row per run.
 */
public class SummaryCsvWriter {
    public static final String HEADER = "Id,DateTime,AlgorithmType,NQueens,Seed,MutationRate,FinalMutationRate,"
        + "Generations,PopulationSize,Complexity,ElapsedTimeSeconds,StagnationCount,"
        + "StagnationMutationThresholdHigh,StagnationMutationThresholdLow,Intersections,Failures";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    private final Path file;

    public SummaryCsvWriter(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Appends one row; writes the header first when the file is new.
     * Ids continue from the number of lines already in the file.
     * @return the id given to the row
     */
    public synchronized int append(RunResult result, String algorithmType) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        boolean exists = Files.exists(file) && Files.size(file) > 0;
        int nextId = 1;
        if (!exists) {
            Files.write(file, List.of(HEADER), StandardCharsets.UTF_8);
        } else {
            try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
                nextId = (int) lines.filter(line -> !line.isBlank()).count();
            }
        }

        String line = String.join(",",
            String.valueOf(nextId),
            LocalDateTime.now().format(TIMESTAMP),
            algorithmType,
            String.valueOf(result.getN()),
            String.valueOf(result.getSeed()),
            String.format(Locale.ROOT, "%.3f", result.getInitialMutationRate()),
            String.format(Locale.ROOT, "%.3f", result.getFinalMutationRate()),
            String.valueOf(result.getGenerations()),
            String.valueOf(result.getPopulationSize()),
            String.format(Locale.ROOT, "%.2f", result.getComplexity()),
            String.format(Locale.ROOT, "%.3f", result.getElapsedMillis() / 1000.0),
            String.valueOf(result.getStagnationCount()),
            String.valueOf(result.getStagnationThresholdHigh()),
            String.valueOf(result.getStagnationThresholdLow()),
            String.valueOf(result.getConflicts()),
            result.isSolved() ? "0" : "1");
        Files.write(file, List.of(line), StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        return nextId;
    }

    /**
     * Writes the best-so-far conflicts of every generation of one run.
     */
    public static void writeConvergence(Path target, RunResult result) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             PrintWriter out = new PrintWriter(writer)) {
            out.println("Generation,BestConflicts");
            int[] data = result.getConvergence();
            for (int i = 0; i < data.length; i++) {
                out.printf(Locale.ROOT, "%d,%d%n", i + 1, data[i]);
            }
            if (out.checkError()) {
                throw new IOException("Failed to write convergence data to " + target);
            }
        }
    }
}
