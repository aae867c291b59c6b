package com.hellblazer.radiance.common;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DeterministicMath - binary reduction tree summation.
 *
 * @author hal.hildebrand
 */
class DeterministicMathTest {

    private static final double EPSILON = 1e-12;

    @Test
    void testStableSum_EmptyArray() {
        assertEquals(0.0, DeterministicMath.stableSum(new double[0]));
    }

    @Test
    void testStableSum_SingleElement() {
        assertEquals(42.5, DeterministicMath.stableSum(new double[] { 42.5 }));
    }

    @Test
    void testStableSum_MatchesNaiveSum() {
        var values = new double[] { 1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0 };
        assertEquals(28.0, DeterministicMath.stableSum(values), EPSILON);
    }

    @Test
    void testStableSum_Range() {
        var values = new double[] { 1.0, 2.0, 3.0, 4.0 };
        assertEquals(5.0, DeterministicMath.stableSum(values, 1, 3), EPSILON);
        assertEquals(0.0, DeterministicMath.stableSum(values, 2, 2));
        assertThrows(IllegalArgumentException.class, () -> DeterministicMath.stableSum(values, 3, 1));
        assertThrows(IllegalArgumentException.class, () -> DeterministicMath.stableSum(values, 0, 5));
    }

    @Test
    void testStableSum_Repeatable() {
        var random = new Random(17);
        var values = new double[1000];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextDouble() * Math.pow(10, random.nextInt(12) - 6);
        }
        double first = DeterministicMath.stableSum(values);
        for (int run = 0; run < 10; run++) {
            assertEquals(first, DeterministicMath.stableSum(values.clone()), "Sum must be bit-identical across runs");
        }
    }

    @Test
    void testStableDot() {
        var a = new double[] { 1.0, 2.0, 3.0 };
        var b = new double[] { 0.5, 0.25, 2.0 };
        assertEquals(7.0, DeterministicMath.stableDot(a, b), EPSILON);
        assertThrows(IllegalArgumentException.class, () -> DeterministicMath.stableDot(a, new double[2]));
    }

    @Test
    void testStableWeightedSum() {
        List<double[]> vectors = List.of(new double[] { 1.0, 10.0 }, new double[] { 3.0, 30.0 });
        var sum = DeterministicMath.stableWeightedSum(new double[] { 0.25, 0.75 }, vectors, 2);
        assertArrayEquals(new double[] { 2.5, 25.0 }, sum, EPSILON);
    }

    @Test
    void testStableWeightedSum_DimensionMismatch() {
        List<double[]> vectors = List.of(new double[] { 1.0, 2.0 }, new double[] { 1.0 });
        assertThrows(IllegalArgumentException.class,
                     () -> DeterministicMath.stableWeightedSum(new double[] { 1.0, 1.0 }, vectors, 2));
    }

    @Test
    void testStableWeightedSum_CountMismatch() {
        List<double[]> vectors = List.of(new double[] { 1.0 });
        assertThrows(IllegalArgumentException.class,
                     () -> DeterministicMath.stableWeightedSum(new double[] { 1.0, 2.0 }, vectors, 1));
    }

    @Test
    void testStableSum_CanonicalOrderIsPermutationInvariant() {
        var random = new Random(3);
        var values = new ArrayList<Double>();
        for (int i = 0; i < 257; i++) {
            values.add(random.nextGaussian() * 1e8);
        }
        var canonical = values.stream().sorted().mapToDouble(Double::doubleValue).toArray();
        double expected = DeterministicMath.stableSum(canonical);

        Collections.shuffle(values, new Random(99));
        var reSorted = values.stream().sorted().mapToDouble(Double::doubleValue).toArray();
        assertEquals(expected, DeterministicMath.stableSum(reSorted));
    }
}
