package rhmm.util;

import java.util.Arrays;

import org.apache.commons.math3.stat.StatUtils;

import cern.jet.random.Gamma;
import cern.jet.random.engine.RandomEngine;

/**
 * Dirichlet sampler built on independent Gamma draws. Draws come from the
 * global generator in {@link Constants}, so a fixed seed reproduces them.
 */
public class Dirichlet extends Sampler {

	private static final long serialVersionUID = -6620931742318573105L;
	private final Gamma[] g;

	public Dirichlet(double[] dist, double u) {
		super(dist, u);
		if(!(u>0) || Double.isInfinite(u))
			throw new IllegalArgumentException("Concentration must be a positive finite number: "+u);
		this.g = new Gamma[dist.length];
		for(int i=0; i<g.length; i++)
			if(this.dist[i]>0) g[i] = new Gamma(this.dist[i]*u, 1, re);
	}

	public Dirichlet(int length, double u) {
		this(getUniform(length), u);
	}

	private static double[] getUniform(int length) {
		double[] res = new double[length];
		Arrays.fill(res, 1.0/length);
		return res;
	}

	private final RandomEngine re = new RandomEngine() {
		private static final long serialVersionUID = 
				2907651148410265836L;

		@Override
		public int nextInt() {
			return Constants.rg.nextInt();
		}
	};

	@Override
	public double[] sample() {
		double[] res = new double[dist.length];
		for(int i=0; i<res.length; i++)
			res[i] = g[i]==null ? 0 : 
				Math.max(Constants.eps, g[i].nextDouble());
		double s = StatUtils.sum(res);
		for(int i=0; i<res.length; i++) res[i] /= s;
		return res;
	}

	public double u() {
		return u;
	}
}
