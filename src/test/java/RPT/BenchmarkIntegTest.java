package RPT;

import RPT.Model.ExactThreshold;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Times exact simulation and the property tester on random binary words of doubling length.
 * Results are written as space-separated columns to target/benchmark.
 */
@Tag("IntegTest")
public class BenchmarkIntegTest {
    private static final int INPUTS = 20;
    private static final int MAX_LENGTH = 1 << 17;
    private static final double[][] PRECISIONS = {{0.5, 0.3}, {0.3, 0.3}, {0.1, 0.1}};
    private static final Path OUTPUT_DIR = Paths.get("target", "benchmark");

    @Test
    void testZeroStarOnePlus() throws IOException {
        Path table = benchmarkTime("time01.txt", RandomNFA.zeroStarOnePlus(), new Random(1));
        Assertions.assertTrue(Files.size(table) > 0);
    }

    @Test
    void testRandomAutomaton() throws IOException {
        Random random = new Random(2);
        Path table = benchmarkTime("time_random.txt", RandomNFA.edgeProbability(random, 10, 0.3, 0.1), random);
        Assertions.assertTrue(Files.size(table) > 0);
    }

    private static Path benchmarkTime(String fileName, AutomatonGraph<Character> nfa, Random random) throws IOException {
        Files.createDirectories(OUTPUT_DIR);
        final Path table = OUTPUT_DIR.resolve(fileName);
        try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(table, StandardCharsets.UTF_8))) {
            final StringBuilder header = new StringBuilder("l exact");
            for (double[] precision : PRECISIONS) {
                header.append(" approx").append(precision[0]).append(',').append(precision[1]);
            }
            header.append(" sampled").append(PRECISIONS[1][0]).append(',').append(PRECISIONS[1][1]);
            out.println(header);

            for (int l = 1; l < MAX_LENGTH; l *= 2) {
                final List<Word<Character>> inputs = new ArrayList<>(INPUTS);
                for (int i = 0; i < INPUTS; i++) {
                    inputs.add(RandomNFA.randomBinaryWord(random, l));
                }
                final StringBuilder row = new StringBuilder().append(l);
                row.append(' ').append(time(inputs, nfa::accepts));
                final PropertyTester tester = new PropertyTester(random);
                for (double[] precision : PRECISIONS) {
                    row.append(' ').append(time(inputs, u -> tester.test(nfa, u, precision[0], precision[1])));
                }
                final PropertyTester sampled = new PropertyTester(ExactThreshold.neverExact(), random);
                row.append(' ').append(time(inputs, u -> sampled.test(nfa, u, PRECISIONS[1][0], PRECISIONS[1][1])));
                out.println(row);
            }
        }
        return table;
    }

    /**
     * @return total duration in microseconds
     */
    private static long time(List<Word<Character>> inputs, Predicate<Word<Character>> f) {
        final long before = System.nanoTime();
        for (Word<Character> u : inputs) {
            f.test(u);
        }
        return (System.nanoTime() - before) / 1000;
    }
}
