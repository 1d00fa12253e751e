package nqueens;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import nqueens.ga.SolverConfig;
import nqueens.ga.SolverType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void testBadArgumentsPrintUsage() {
        assertEquals(1, run("8", "Genetic"));
        assertEquals(1, run("3", "Genetic", "0"));
        assertEquals(1, run("513", "Tournament", "0"));
        assertEquals(1, run("8", "Annealing", "0"));
        assertEquals(1, run("eight", "Genetic", "0"));
        assertEquals(1, run("8", "Genetic", "-1"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void testRunsEverySeedAndExportsCsv() throws Exception {
        Path csv = tempDir.resolve("summary.csv");
        assertEquals(0, run("8", "Genetic", "2", csv.toString()));

        assertEquals(4, Files.readAllLines(csv, StandardCharsets.UTF_8).size());
        assertTrue(Files.exists(tempDir.resolve("convergence_N8_Genetic.csv")));
        String console = out.toString(StandardCharsets.UTF_8);
        assertTrue(console.contains("Seed 0, Queens 8"));
        assertTrue(console.contains("Seed 2, Queens 8"));
        assertTrue(console.contains("Statistics (3 runs)"));
        assertTrue(console.contains("Algorithm Analysis"));
    }

    @Test
    void testPropertiesFileOverridesDefaults() throws Exception {
        Path props = tempDir.resolve("run.properties");
        Files.writeString(props, "nqueens.maxGenerations=77\nnqueens.crossover=OX\n");
        SolverConfig config = Main.loadConfig(SolverType.TOURNAMENT, props);
        assertEquals(77, config.getMaxGenerations());
        assertEquals(SolverConfig.Crossover.OX, config.getCrossover());

        Files.writeString(props, "nqueens.maxGenerations=many\n");
        assertEquals(1, run("8", "Tournament", "0", tempDir.resolve("s.csv").toString(), props.toString()));
    }

    @Test
    void testClasspathDefaultsKeepThePreset() throws Exception {
        SolverConfig config = Main.loadConfig(SolverType.GENETIC, null);
        assertEquals(SolverConfig.Crossover.MIXED, config.getCrossover());
        assertFalse(config.isVerbose());
    }
}
