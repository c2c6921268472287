package rhmm.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class AlgebraTest {

	@Test
	public void testNormalize() {
		double[] a = new double[]{1, 3};
		assertSame(a, Algebra.normalize(a));
		assertArrayEquals(new double[]{0.25, 0.75}, a, 1e-15);
		double[] z = new double[]{0, 0, 0};
		Algebra.normalize(z);
		assertArrayEquals(new double[]{0, 0, 0}, z, 0);
	}

	@Test
	public void testMaxIndex() {
		assertEquals(-1, Algebra.maxIndex(new double[0]));
		assertEquals(1, Algebra.maxIndex(new double[]{0.1, 0.5, 0.5}));
		assertEquals(0, Algebra.maxIndex(new double[]{Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY}));
		assertEquals(2, Algebra.maxIndex(new double[]{Double.NEGATIVE_INFINITY, -3, -1}));
	}

	@Test
	public void testSafeLog() {
		assertEquals(Double.NEGATIVE_INFINITY, Algebra.safeLog(0), 0);
		assertEquals(0, Algebra.safeLog(1), 0);
	}

	@Test
	public void testCopyAndStochastic() {
		double[][] m = new double[][]{{0.5, 0.5}, {1, 0}};
		double[][] c = Algebra.copyOf(m);
		assertNotSame(m[0], c[0]);
		assertArrayEquals(m[1], c[1], 0);
		assertTrue(Algebra.isStochastic(c[0], 1e-12));
		assertFalse(Algebra.isStochastic(new double[]{0.7, 0.7}, 1e-12));
		assertFalse(Algebra.isStochastic(new double[]{1.5, -0.5}, 1e-12));
		assertFalse(Algebra.isStochastic(new double[]{Double.NaN, 1}, 1e-12));
	}
}
