package rhmm.hmm.model;

import rhmm.util.Algebra;

/**
 * Log-domain Viterbi scores and back pointers for one observation sequence.
 */
public class ViterbiUnit {
	protected final double[][] v; // N x S log scores
	protected final int[][] trace; // N x S back pointers, row 0 unused
	protected final int[] path;
	protected int ends = -1; // end state
	protected double probability = Double.NEGATIVE_INFINITY;

	protected ViterbiUnit(final int N, final int S) {
		this.v = new double[N][S];
		this.trace = new int[N][S];
		this.path = new int[N];
	}

	/** picks the best end state, lowest index on ties, and walks back */
	protected void finalise() {
		if(path.length==0) return;
		int M = path.length;
		this.ends = Algebra.maxIndex(v[M-1]);
		this.probability = v[M-1][ends];
		this.trace();
	}

	protected void trace() {
		int tr = ends;
		int M = path.length;
		this.path[M-1] = tr;
		for(int t=M-1; t>0; t--) {
			tr = trace[t][tr];
			this.path[t-1] = tr;
		}
	}

	/** log-probability of the best path, negative infinity when no path is possible */
	public double probability() {
		return probability;
	}

	/**
	 * True when every path has zero probability. The path is then only the
	 * tie-broken result of the recursion and carries no meaning.
	 */
	public boolean isImpossible() {
		return path.length>0 && probability==Double.NEGATIVE_INFINITY;
	}

	public int[] getPath() {
		return path.clone();
	}

	public double[][] getScores() {
		return v;
	}

	public int[][] getTrace() {
		return trace;
	}

	public int length() {
		return path.length;
	}
}
