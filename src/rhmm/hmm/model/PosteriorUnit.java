package rhmm.hmm.model;

import org.apache.commons.math3.stat.StatUtils;

/**
 * Posterior state occupancies (gamma) and posterior transitions (xi) of one
 * forward-backward pass.
 */
public class PosteriorUnit {
	protected final double[][] gamma; // N x S
	protected final double[][][] xi; // (N-1) x S x S

	private PosteriorUnit(final int N, final int S) {
		this.gamma = new double[N][S];
		this.xi = new double[N-1][S][S];
	}

	/**
	 * No normalisation is done here. Rows of gamma sum to one because alpha
	 * and beta were scaled with the same factors.
	 */
	public static PosteriorUnit estimate(HiddenMarkovModel hmm,
			int[] obs,
			FBUnit fw,
			FBUnit bw) {
		if(fw.backward || !bw.backward || fw.scale!=bw.scale)
			throw new IllegalArgumentException("Forward and backward units do not belong to the same pass.");
		final int N = obs.length, S = hmm.S;
		if(fw.length()!=N)
			throw new IllegalArgumentException("Sequence length "+N+
					" does not match forward-backward length "+fw.length()+".");
		final double[][] trans = hmm.trans, emiss = hmm.emiss;
		final double[][] alpha = fw.probsMat, beta = bw.probsMat;
		final double[] scale = fw.scale;

		PosteriorUnit post = new PosteriorUnit(N, S);

		for(int t=0; t<N; t++)
			for(int i=0; i<S; i++)
				post.gamma[t][i] = alpha[t][i]*beta[t][i];

		double[][] xi_t;
		double p;
		int o;
		for(int t=0; t<N-1; t++) {
			xi_t = post.xi[t];
			o = obs[t+1];
			for(int i=0; i<S; i++) {
				for(int j=0; j<S; j++) {
					p = alpha[t][i]*
							trans[i][j]*
							emiss[j][o]*
							beta[t+1][j];
					xi_t[i][j] = scale[t+1]>0 ? p/scale[t+1] : p;
				}
			}
		}
		return post;
	}

	public int length() {
		return gamma.length;
	}

	public double[][] getGamma() {
		return gamma;
	}

	public double[][][] getXi() {
		return xi;
	}

	/** largest deviation of a gamma row sum from one */
	public double maxDeviation() {
		double d = 0;
		for(double[] g : gamma)
			d = Math.max(d, Math.abs(StatUtils.sum(g)-1.0));
		return d;
	}
}
