package rhmm.hmm.model;

/**
 * Scaled forward and backward recursions.
 * <p>
 * Every forward row is divided by its sum, the scale factor, so that each
 * row of alpha sums to one. The backward pass starts from one and divides
 * step {@code t} by the scale factor of step {@code t+1}, which makes
 * {@code alpha[t][i]*beta[t][i]} the posterior state probability without any
 * further normalisation. A backward unit is only meaningful
 * together with the forward unit whose scale factors it used.
 */
public class ForwardBackward {

	private ForwardBackward() {}

	/**
	 * @param hmm current parameters
	 * @param obs observation symbols, at least one
	 * @return forward unit holding alpha, the scale factors and the sequence
	 * log-likelihood
	 * @throws InvalidObservationException if a symbol is out of range
	 */
	public static FBUnit forward(HiddenMarkovModel hmm, int[] obs) {
		checkSequence(hmm, obs);
		final int N = obs.length, S = hmm.S;
		final double[] pi = hmm.pi;
		final double[][] trans = hmm.trans, emiss = hmm.emiss;

		FBUnit fw = new FBUnit(N, S);
		double[][] alpha = fw.probsMat;

		for(int k=0; k<S; k++)
			alpha[0][k] = pi[k]*emiss[k][obs[0]];
		fw.scale(0);

		double tmp;
		for(int t=1; t<N; t++) {
			for(int j=0; j<S; j++) {
				tmp = 0;
				for(int i=0; i<S; i++)
					tmp += alpha[t-1][i]*trans[i][j];
				alpha[t][j] = tmp*emiss[j][obs[t]];
			}
			fw.scale(t);
		}
		fw.finalise();
		return fw;
	}

	/**
	 * @param hmm the parameters used for {@code fw}
	 * @param obs the observations used for {@code fw}
	 * @param fw forward unit of the same pass
	 * @return backward unit holding beta
	 */
	public static FBUnit backward(HiddenMarkovModel hmm, int[] obs, FBUnit fw) {
		checkSequence(hmm, obs);
		if(fw.backward || fw.length()!=obs.length)
			throw new IllegalArgumentException("Backward pass needs the forward unit of the same sequence.");
		final int N = obs.length, S = hmm.S;
		final double[][] trans = hmm.trans, emiss = hmm.emiss;
		final double[] scale = fw.scale;

		FBUnit bw = new FBUnit(N, S, scale);
		double[][] beta = bw.probsMat;

		for(int k=0; k<S; k++) beta[N-1][k] = 1.0;

		double tmp, c;
		int o;
		for(int t=N-2; t>=0; t--) {
			o = obs[t+1];
			c = scale[t+1];
			for(int i=0; i<S; i++) {
				tmp = 0;
				for(int j=0; j<S; j++)
					tmp += trans[i][j]*emiss[j][o]*beta[t+1][j];
				beta[t][i] = c>0 ? tmp/c : tmp;
			}
		}
		return bw;
	}

	private static void checkSequence(HiddenMarkovModel hmm, int[] obs) {
		if(obs.length==0)
			throw new IllegalArgumentException("Empty observation sequence.");
		hmm.checkObservations(obs);
	}
}
