package rhmm.hmm.data;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import rhmm.util.Utils;

/**
 * Maps real values to {@code bins} symbols at empirical quantiles.
 * <p>
 * The cut points are {@code sorted[i*n/bins]} for {@code i = 1..bins-1},
 * with integer division. A value gets the index of the first cut point it
 * does not exceed, or {@code bins-1} if it exceeds them all. Heavy ties can
 * therefore leave some symbols unused.
 */
public class QuantileDiscretizer {

	private final static Logger myLogger = LogManager.getLogger(QuantileDiscretizer.class);

	private final int bins;
	private double[] thresholds = null;

	public QuantileDiscretizer(int bins) {
		if(bins<1)
			throw new IllegalArgumentException("Number of bins must be positive: "+bins);
		this.bins = bins;
	}

	/** computes the cut points from {@code values} and discretises them */
	public int[] fitTransform(double[] values) {
		if(values.length==0) {
			this.thresholds = new double[0];
			return new int[0];
		}
		double[] sorted = values.clone();
		Arrays.sort(sorted);
		this.thresholds = new double[bins-1];
		for(int i=1; i<bins; i++)
			thresholds[i-1] = sorted[i*sorted.length/bins];
		return transform(values);
	}

	/** discretises with the cut points of the last {@link #fitTransform(double[])} */
	public int[] transform(double[] values) {
		if(thresholds==null)
			throw new IllegalStateException("Thresholds have not been fitted.");
		int[] symbols = new int[values.length];
		for(int i=0; i<values.length; i++) {
			int k = 0;
			while(k<thresholds.length && values[i]>thresholds[k]) ++k;
			symbols[i] = k;
		}
		return symbols;
	}

	public double[] getThresholds() {
		return thresholds==null ? null : thresholds.clone();
	}

	public int getBins() {
		return bins;
	}

	/** one symbol per line */
	public static void writeObservations(int[] symbols, String file) {
		try (BufferedWriter bw = Utils.getBufferedWriter(file)) {
			for(int s : symbols) bw.write(s+"\n");
		} catch (IOException e) {
			myLogger.error("Error writing observation file "+file);
			throw new RuntimeException(e);
		}
	}

	public static int[] readObservations(String file) {
		List<Integer> symbols = new ArrayList<Integer>();
		try (BufferedReader br = Utils.getBufferedReader(file)) {
			String line;
			int n = 0;
			while( (line=br.readLine())!=null ) {
				++n;
				line = line.trim();
				if(line.isEmpty() || line.startsWith("#")) continue;
				try {
					symbols.add(Integer.parseInt(line));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Line "+n+" of "+file+
							" is not an observation symbol: \""+line+"\".");
				}
			}
		} catch (IOException e) {
			myLogger.error("Error reading observation file "+file);
			throw new RuntimeException(e);
		}
		return ArrayUtils.toPrimitive(symbols.toArray(new Integer[symbols.size()]));
	}
}
