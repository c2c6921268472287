package rhmm.hmm.model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.Test;

import rhmm.util.Constants;

public class ForwardBackwardTest {

	private final int[] obs = new int[]{0, 0, 1, 2, 2};

	private static HiddenMarkovModel skewed() {
		return new HiddenMarkovModel(
				new double[]{0.6, 0.3, 0.1},
				new double[][]{{0.7, 0.2, 0.1}, {0.3, 0.5, 0.2}, {0.25, 0.25, 0.5}},
				new double[][]{{0.5, 0.4, 0.1}, {0.1, 0.3, 0.6}, {0.3, 0.3, 0.4}});
	}

	@Test
	public void testForwardRowsSumToOne() {
		FBUnit fw = ForwardBackward.forward(HiddenMarkovModel.canonical(), obs);
		assertFalse(fw.isBackward());
		assertEquals(obs.length, fw.length());
		for(double[] row : fw.getProbsMat())
			assertEquals(1.0, StatUtils.sum(row), 1e-12);
		for(double s : fw.getScale())
			assertTrue(s>0);
	}

	@Test
	public void testLikelihood() {
		HiddenMarkovModel hmm = skewed();
		FBUnit fw = ForwardBackward.forward(hmm, obs);
		assertEquals(Math.log(BruteForce.likelihood(hmm, obs)), fw.probability(), 1e-12);
	}

	@Test
	public void testFirstStep() {
		HiddenMarkovModel hmm = skewed();
		FBUnit fw = ForwardBackward.forward(hmm, new int[]{1});
		double s = 0.6*0.4+0.3*0.3+0.1*0.3;
		assertEquals(s, fw.getScale()[0], 1e-15);
		assertArrayEquals(new double[]{0.24/s, 0.09/s, 0.03/s}, fw.getProbsMat()[0], 1e-15);
		FBUnit bw = ForwardBackward.backward(hmm, new int[]{1}, fw);
		assertArrayEquals(new double[]{1, 1, 1}, bw.getProbsMat()[0], 0);
	}

	@Test
	public void testBackwardSharesScale() {
		HiddenMarkovModel hmm = skewed();
		FBUnit fw = ForwardBackward.forward(hmm, obs);
		FBUnit bw = ForwardBackward.backward(hmm, obs, fw);
		assertTrue(bw.isBackward());
		assertSame(fw.getScale(), bw.getScale());
		assertThrows(IllegalArgumentException.class, 
				() -> ForwardBackward.backward(hmm, obs, bw));
		assertThrows(IllegalArgumentException.class, 
				() -> ForwardBackward.backward(hmm, new int[]{0, 1}, fw));
	}

	@Test
	public void testPosteriorsMatchEnumeration() {
		HiddenMarkovModel hmm = skewed();
		FBUnit fw = ForwardBackward.forward(hmm, obs);
		FBUnit bw = ForwardBackward.backward(hmm, obs, fw);
		PosteriorUnit post = PosteriorUnit.estimate(hmm, obs, fw, bw);

		double[][] gamma = BruteForce.gamma(hmm, obs);
		for(int t=0; t<obs.length; t++) {
			assertArrayEquals(gamma[t], post.getGamma()[t], 1e-12);
			assertEquals(1.0, StatUtils.sum(post.getGamma()[t]), 1e-9);
		}
		double[][][] xi = BruteForce.xi(hmm, obs);
		for(int t=0; t<obs.length-1; t++)
			for(int i=0; i<3; i++)
				assertArrayEquals(xi[t][i], post.getXi()[t][i], 1e-12);
		assertTrue(post.maxDeviation()<1e-9);
	}

	@Test
	public void testLongSequenceDoesNotUnderflow() {
		Constants.seeding(7L);
		int[] seq = new int[20000];
		for(int t=0; t<seq.length; t++) seq[t] = Constants.rand.nextInt(3);
		HiddenMarkovModel hmm = HiddenMarkovModel.canonical();
		FBUnit fw = ForwardBackward.forward(hmm, seq);
		FBUnit bw = ForwardBackward.backward(hmm, seq, fw);
		PosteriorUnit post = PosteriorUnit.estimate(hmm, seq, fw, bw);
		assertTrue(Double.isFinite(fw.probability()));
		assertTrue(fw.probability()<-1000);
		assertTrue(post.maxDeviation()<1e-9);
	}

	@Test
	public void testImpossibleFirstObservation() {
		HiddenMarkovModel hmm = new HiddenMarkovModel(
				new double[]{0.5, 0.5},
				new double[][]{{0.5, 0.5}, {0.5, 0.5}},
				new double[][]{{0, 1}, {0, 1}});
		int[] seq = new int[]{0, 1, 1};
		FBUnit fw = ForwardBackward.forward(hmm, seq);
		assertEquals(0, fw.getScale()[0], 0);
		assertArrayEquals(new double[]{0, 0}, fw.getProbsMat()[0], 0);
		assertTrue(fw.isDegenerate());
		assertEquals(Double.NEGATIVE_INFINITY, fw.probability(), 0);
		FBUnit bw = ForwardBackward.backward(hmm, seq, fw);
		PosteriorUnit post = PosteriorUnit.estimate(hmm, seq, fw, bw);
		for(double[] g : post.getGamma())
			for(double x : g) assertFalse(Double.isNaN(x));
	}

	@Test
	public void testInvalidInput() {
		HiddenMarkovModel hmm = HiddenMarkovModel.canonical();
		assertThrows(IllegalArgumentException.class, 
				() -> ForwardBackward.forward(hmm, new int[0]));
		assertThrows(InvalidObservationException.class, 
				() -> ForwardBackward.forward(hmm, new int[]{0, 3}));
		FBUnit fw = ForwardBackward.forward(hmm, obs);
		int[] bad = obs.clone();
		bad[4] = 5;
		assertThrows(InvalidObservationException.class, 
				() -> ForwardBackward.backward(hmm, bad, fw));
	}
}
