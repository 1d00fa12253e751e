package nqueens.ga;

import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class SwapMutationTest {

    @Test
    void testAdaptiveProbability() {
        assertEquals(0.2, SwapMutation.adaptiveProbability(0.2, 0), 1e-12);
        assertEquals(0.2 + Math.log(100) * 0.05, SwapMutation.adaptiveProbability(0.2, 99), 1e-12);
        assertEquals(0.9, SwapMutation.adaptiveProbability(0.8, 10_000), 1e-12);
        assertEquals(0.9, SwapMutation.adaptive(0.4, 1_000_000).getProbability(), 1e-12);
    }

    @Test
    void testFixedZero_ReturnsInputUntouched() {
        int[] state = {0, 1, 2, 3, 4};
        int[] result = SwapMutation.fixed(0.0).mutate(state, new Random(1));
        assertSame(state, result);
    }

    @Test
    void testFixedOne_SwapsExactlyTwoRows() {
        int[] state = {0, 1, 2, 3, 4, 5, 6, 7};
        Random random = new Random(3);
        for (int trial = 0; trial < 25; trial++) {
            int[] mutated = SwapMutation.fixed(1.0).mutate(state, random);
            int differences = 0;
            for (int i = 0; i < state.length; i++) {
                if (state[i] != mutated[i]) {
                    differences++;
                }
            }
            assertEquals(2, differences);
        }
        assertArrayEquals(new int[] {0, 1, 2, 3, 4, 5, 6, 7}, state);
    }

    @Test
    void testSingleRowIsNeverMutated() {
        int[] state = {0};
        assertSame(state, SwapMutation.fixed(1.0).mutate(state, new Random(0)));
    }

    @Test
    void testScramble_WorksOnACopy() {
        int[] state = {0, 1, 2, 3, 4, 5};
        int[] scrambled = SwapMutation.scramble(state, 1, new Random(8));
        assertNotSame(state, scrambled);
        assertArrayEquals(new int[] {0, 1, 2, 3, 4, 5}, state);
        assertFalse(Arrays.equals(state, scrambled));
    }

    @Test
    void testFixed_RejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> SwapMutation.fixed(1.5));
        assertThrows(IllegalArgumentException.class, () -> SwapMutation.fixed(-0.1));
    }
}
