package rhmm.hmm.tools;

import java.io.BufferedWriter;
import java.io.IOException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;

import rhmm.hmm.data.PriceData;
import rhmm.hmm.data.QuantileDiscretizer;
import rhmm.hmm.data.Returns;
import rhmm.util.Constants;
import rhmm.util.Executor;
import rhmm.util.Utils;

/**
 * Turns a price file into a discrete observation sequence.
 */
public class DataPreparation extends Executor {

	private String in_file = null;
	private String out_prefix = null;
	private int bins = Constants._n_bins;

	public DataPreparation() {}

	public DataPreparation(String in_file,
			String out_prefix,
			int bins) {
		this.in_file = in_file;
		this.out_prefix = out_prefix;
		this.bins = bins;
	}

	@Override
	public void printUsage() {
		myLogger.info(
				"\n\nUsage is as follows:\n"
						+" -i/--input                   Input price file (CSV/TSV with a header, may be gzipped).\n"
						+" -o/--prefix                  Output file prefix.\n"
						+" -b/--bins                    Number of quantile bins (default 3).\n\n");
	}

	@Override
	public void setParameters(String[] args) {
		if (args.length == 0) {
			printUsage();
			throw new IllegalArgumentException("\n\nPlease use the above arguments/options.\n\n");
		}

		if (options == null) {
			options = new Options();
			options.addOption("i", "input", true, "input price file.");
			options.addOption("o", "prefix", true, "output file prefix.");
			options.addOption("b", "bins", true, "number of quantile bins.");
		}
		CommandLine line = parse(args);

		if(line.hasOption("i")) {
			in_file = line.getOptionValue("i");
		} else {
			printUsage();
			throw new IllegalArgumentException("Please specify your input price file.");
		}

		if(line.hasOption("o")) {
			out_prefix = line.getOptionValue("o");
		} else {
			printUsage();
			throw new IllegalArgumentException("Please specify your output file prefix.");
		}

		bins = parseInt(line, "b", Constants._n_bins);
		if(bins<1)
			throw new IllegalArgumentException("Number of bins must be positive.");
	}

	@Override
	public void run() {
		PriceData prices = PriceData.read(in_file);
		double[] returns = Returns.logReturns(prices.getClose());
		QuantileDiscretizer discretizer = new QuantileDiscretizer(bins);
		int[] obs = discretizer.fitTransform(returns);

		QuantileDiscretizer.writeObservations(obs, out_prefix+".obs.txt");
		try (BufferedWriter bw = Utils.getBufferedWriter(out_prefix+".thresholds.txt")) {
			double[] thresholds = discretizer.getThresholds();
			for(int i=0; i<thresholds.length; i++)
				bw.write(i+"\t"+thresholds[i]+"\n");
		} catch (IOException e) {
			myLogger.error("Error writing thresholds for "+out_prefix);
			throw new RuntimeException(e);
		}
		myLogger.info("Wrote "+obs.length+" observations in "+bins+" bins to "+out_prefix+".obs.txt");
	}
}
