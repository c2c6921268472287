package rhmm.util;

import java.io.Serializable;

import org.apache.commons.lang3.ArrayUtils;

public abstract class Sampler implements Serializable {

	private static final long serialVersionUID = 4381902275186044173L;
	protected final double[] dist;
	protected final double u;

	public Sampler(double[] dist, double u) {
		if(dist.length==0)
			throw new IllegalArgumentException("Empty base distribution.");
		this.dist = ArrayUtils.clone(dist);
		this.u = u;
	}

	public int dimension() {
		return this.dist.length;
	}

	public abstract double[] sample();
}
