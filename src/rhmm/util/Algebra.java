package rhmm.util;

import org.apache.commons.math3.stat.StatUtils;

public class Algebra {

	/*** normalise in place
	 * @param array
	 * @return the same array
	 * a zero-sum array is returned untouched
	 */
	public static double[] normalize(double[] array) {
		double s = StatUtils.sum(array);
		if(s>0) 
			for(int i=0; i<array.length; i++) array[i]/=s;
		return array;
	}

	/*** index of the largest element, lowest index on ties
	 * @param array
	 * @return -1 for an empty array
	 */
	public static int maxIndex(double[] array) {
		if(array.length<1) return -1;
		double d = array[0];
		int index = 0;
		for(int i=1; i<array.length; i++) {
			if(array[i]>d) {
				d = array[i];
				index = i;
			}
		}
		return index;
	}

	public static double safeLog(double p) {
		return p>0 ? Math.log(p) : Double.NEGATIVE_INFINITY;
	}

	public static double[][] copyOf(double[][] mat) {
		double[][] c = new double[mat.length][];
		for(int i=0; i<mat.length; i++)
			c[i] = mat[i].clone();
		return c;
	}

	public static boolean isStochastic(double[] array, double tol) {
		for(double a : array) 
			if(a<0 || Double.isNaN(a)) return false;
		return Math.abs(StatUtils.sum(array)-1.0)<=tol;
	}
}
