package rhmm.util;

import java.util.Random;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

public class Constants {

	public static long seed = System.nanoTime();
	public static Random rand = new Random(seed);
	public static RandomGenerator rg = new Well19937c(seed);

	public final static double eps = 1e-12;
	public final static double tolerance = 1e-9;

	// informative prior for the three regime model
	public final static double[] _init_pi = new double[]{1.0/3.0, 1.0/3.0, 1.0/3.0};
	public final static double[][] _init_trans = new double[][]{
		{0.8, 0.1, 0.1},
		{0.1, 0.8, 0.1},
		{0.1, 0.1, 0.8}};
	public final static double[][] _init_emiss = new double[][]{
		{0.6, 0.3, 0.1},
		{0.2, 0.6, 0.2},
		{0.1, 0.3, 0.6}};

	public final static int _n_states = 3;
	public final static int _n_bins = 3;
	public final static int _max_iter = 900;
	public final static double _diri_u = 1.0;

	public static void seeding(long s) {
		seed = s;
		setRandomGenerator();
	}

	public static void seeding() {
		seeding(System.nanoTime());
	}

	public static void setRandomGenerator() {
		rand = new Random(seed);
		rg = new Well19937c(seed);
	}
}
