package nqueens;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class StatisticsAnalyzerTest {

    @Test
    void testEmptyBatch() {
        StatisticsAnalyzer analyzer = new StatisticsAnalyzer();
        assertEquals(0, analyzer.getBest());
        assertEquals(0, analyzer.getWorst());
        assertEquals(0.0, analyzer.getAverage());
        assertEquals(0.0, analyzer.getStandardDeviation());
        assertEquals(0.0, analyzer.getSuccessRate());
    }

    @Test
    void testBatchStatistics() {
        StatisticsAnalyzer analyzer = new StatisticsAnalyzer();
        analyzer.recordExecution(10, 1000, true);
        analyzer.recordExecution(20, 3000, false);
        analyzer.recordExecution(30, 2000, true);

        assertEquals(10, analyzer.getBest());
        assertEquals(30, analyzer.getWorst());
        assertEquals(20.0, analyzer.getAverage(), 1e-12);
        assertEquals(10.0, analyzer.getStandardDeviation(), 1e-12);
        assertEquals(2.0, analyzer.getAverageRunningTime(), 1e-12);
        assertEquals(3, analyzer.getExecutionCount());
        assertEquals(1, analyzer.getFailureCount());
        assertEquals(2.0 / 3.0, analyzer.getSuccessRate(), 1e-12);

        StatisticsAnalyzer.StatisticsReport report = analyzer.generateReport();
        assertEquals(10, report.getBest());
        assertTrue(report.toString().startsWith("Statistics (3 runs):"));
        assertTrue(report.toTableRow(8).startsWith("8\t10\t30\t20.0\t10.00"));

        analyzer.clear();
        assertEquals(0, analyzer.getExecutionCount());
        assertEquals(0, analyzer.getFailureCount());
    }

    @Test
    void testSingleRunHasNoDeviation() {
        StatisticsAnalyzer analyzer = new StatisticsAnalyzer();
        analyzer.recordExecution(42, 5, true);
        assertEquals(0.0, analyzer.getStandardDeviation());
        assertEquals(1.0, analyzer.getSuccessRate());
    }
}
