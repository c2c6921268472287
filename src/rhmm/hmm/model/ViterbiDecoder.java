package rhmm.hmm.model;

/**
 * Most probable hidden state path by dynamic programming in the log domain.
 * <p>
 * Zero probabilities are mapped to negative infinity without taking a
 * logarithm, and an impossible predecessor never contributes to a
 * candidate. Ties, including the all-impossible case, go to the lowest state
 * index. The decoder only reads its model.
 */
public class ViterbiDecoder {

	private final HiddenMarkovModel hmm;

	public ViterbiDecoder(HiddenMarkovModel hmm) {
		this.hmm = hmm;
	}

	/**
	 * @return the decoded state path, same length as {@code obs}
	 * @throws InvalidObservationException if a symbol is out of range
	 */
	public int[] decode(int[] obs) {
		return findPath(obs).getPath();
	}

	/**
	 * Decodes and keeps the raw scores, which lets callers detect a sequence
	 * of zero probability with {@link ViterbiUnit#isImpossible()}.
	 */
	public ViterbiUnit findPath(int[] obs) {
		hmm.checkObservations(obs);
		final int N = obs.length, S = hmm.S;
		final double[] pi = hmm.pi;
		final double[][] trans = hmm.trans, emiss = hmm.emiss;

		ViterbiUnit vb = new ViterbiUnit(N, S);
		if(N==0) return vb;
		double[][] v = vb.v;
		int[][] trace = vb.trace;

		double p;
		for(int k=0; k<S; k++) {
			p = pi[k]*emiss[k][obs[0]];
			v[0][k] = p>0 ? Math.log(p) : Double.NEGATIVE_INFINITY;
		}

		double a, c, e;
		int s;
		for(int t=1; t<N; t++) {
			for(int j=0; j<S; j++) {
				c = Double.NEGATIVE_INFINITY;
				s = 0;
				for(int i=0; i<S; i++) {
					a = v[t-1][i]==Double.NEGATIVE_INFINITY || trans[i][j]<=0 ?
							Double.NEGATIVE_INFINITY :
								v[t-1][i]+Math.log(trans[i][j]);
					if(a>c) {
						c = a;
						s = i;
					}
				}
				e = emiss[j][obs[t]];
				v[t][j] = e>0 && c!=Double.NEGATIVE_INFINITY ? 
						c+Math.log(e) : Double.NEGATIVE_INFINITY;
				trace[t][j] = s;
			}
		}
		vb.finalise();
		return vb;
	}

	public HiddenMarkovModel getModel() {
		return hmm;
	}
}
