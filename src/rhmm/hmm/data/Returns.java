package rhmm.hmm.data;

public class Returns {

	private Returns() {}

	/**
	 * @return {@code ln(p[i]/p[i-1])} for every consecutive pair, empty for
	 * fewer than two prices
	 */
	public static double[] logReturns(double[] prices) {
		for(int i=0; i<prices.length; i++)
			if(!(prices[i]>0) || Double.isInfinite(prices[i]))
				throw new IllegalArgumentException("Price "+prices[i]+
						" at "+i+" is not a positive number.");
		if(prices.length<2) return new double[0];
		double[] r = new double[prices.length-1];
		for(int i=1; i<prices.length; i++)
			r[i-1] = Math.log(prices[i]/prices[i-1]);
		return r;
	}
}
