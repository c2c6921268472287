package rhmm.hmm.model;

import org.apache.commons.math3.stat.StatUtils;

/** forward/backward unit */
public class FBUnit {
	protected final double[][] probsMat; // N x S
	protected final double[] scale; // per-step normalisers, shared with the backward pass
	protected final boolean backward;
	protected double probability = Double.NaN;

	/** forward unit owning a fresh scale vector */
	protected FBUnit(final int N, final int S) {
		this.probsMat = new double[N][S];
		this.scale = new double[N];
		this.backward = false;
	}

	/** backward unit reading the scale vector of its forward pass */
	protected FBUnit(final int N, final int S, final double[] scale) {
		this.probsMat = new double[N][S];
		this.scale = scale;
		this.backward = true;
	}

	/**
	 * Divides row {@code t} by its sum and records the sum as the scale
	 * factor. A zero row is kept as it is.
	 */
	protected void scale(final int t) {
		double[] probs = this.probsMat[t];
		double s = StatUtils.sum(probs);
		this.scale[t] = s;
		if(s>0)
			for(int k=0; k<probs.length; k++) probs[k] /= s;
	}

	/** log-likelihood of the sequence, the sum of the log scale factors */
	protected void finalise() {
		double p = 0;
		for(double s : scale) {
			if(s>0) p += Math.log(s);
			else {
				p = Double.NEGATIVE_INFINITY;
				break;
			}
		}
		this.probability = p;
	}

	/**
	 * @return log-likelihood of the observations for a forward unit, NaN for a
	 * backward unit
	 */
	public double probability() {
		return this.probability;
	}

	/** true when some step had a zero scale factor */
	public boolean isDegenerate() {
		return this.probability==Double.NEGATIVE_INFINITY;
	}

	public int length() {
		return this.probsMat.length;
	}

	public double[][] getProbsMat() {
		return this.probsMat;
	}

	public double[] getScale() {
		return this.scale;
	}

	public boolean isBackward() {
		return this.backward;
	}
}
