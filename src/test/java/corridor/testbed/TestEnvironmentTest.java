package corridor.testbed;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class TestEnvironmentTest {

    @Test
    void smallBatchesPassEveryCheck() {
        List<TestEnvironment.BatchConfig> batches = new ArrayList<>();
        batches.add(new TestEnvironment.BatchConfig(5, 8, 50, 0.5));
        batches.add(new TestEnvironment.BatchConfig(3, 20, 1_000, 0.3));

        List<String> lines = new ArrayList<>();
        TestEnvironment.Summary summary = TestEnvironment.runBatches(batches, new Random(42), lines::add);

        assertEquals(8, summary.instances);
        assertEquals(0, summary.failed);
        assertEquals(0, summary.minCutMismatches);
        assertEquals(8, summary.sanityDetected);
        assertTrue(summary.allPassed());

        assertEquals("=== Corridor Max-Flow Test Report ===", lines.get(0));
        assertEquals("=== End of Report ===", lines.get(lines.size() - 1));
        assertTrue(lines.stream().anyMatch(l -> l.contains("[min cut OK]")));
        assertTrue(lines.stream().noneMatch(l -> l.contains("FAIL")));
    }

    @Test
    void largeInstancesSkipExhaustiveCut() {
        List<TestEnvironment.BatchConfig> batches = new ArrayList<>();
        batches.add(new TestEnvironment.BatchConfig(2, 40, 100, 0.2));

        List<String> lines = new ArrayList<>();
        TestEnvironment.Summary summary = TestEnvironment.runBatches(batches, new Random(1), lines::add);

        assertTrue(summary.allPassed());
        assertTrue(lines.stream().anyMatch(l -> l.contains("[min cut skipped]")));
    }
}
