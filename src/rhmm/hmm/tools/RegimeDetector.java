package rhmm.hmm.tools;

import java.io.BufferedWriter;
import java.io.IOException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;

import rhmm.hmm.data.PriceData;
import rhmm.hmm.data.QuantileDiscretizer;
import rhmm.hmm.data.Returns;
import rhmm.hmm.model.BaumWelchTrainer;
import rhmm.hmm.model.HiddenMarkovModel;
import rhmm.hmm.model.ViterbiDecoder;
import rhmm.hmm.model.ViterbiUnit;
import rhmm.plot.RegimePlot;
import rhmm.util.Constants;
import rhmm.util.Executor;
import rhmm.util.Utils;

/**
 * Fits a discrete HMM to quantile-binned log returns and labels every day
 * with its most probable regime.
 */
public class RegimeDetector extends Executor {

	private String in_file = null;
	private String out_prefix = null;
	private int states = Constants._n_states;
	private int bins = Constants._n_bins;
	private int max_iter = Constants._max_iter;
	private boolean random_init = false;
	private boolean plot = false;

	private HiddenMarkovModel hmm = null;
	private int[] path = null;

	public RegimeDetector() {}

	public RegimeDetector(String in_file,
			String out_prefix,
			int states,
			int bins,
			int max_iter,
			boolean random_init,
			boolean plot) {
		this.in_file = in_file;
		this.out_prefix = out_prefix;
		this.states = states;
		this.bins = bins;
		this.max_iter = max_iter;
		this.random_init = random_init;
		this.plot = plot;
	}

	@Override
	public void printUsage() {
		myLogger.info(
				"\n\nUsage is as follows:\n"
						+" -i/--input                   Input price file (CSV/TSV with a header, may be gzipped).\n"
						+" -o/--prefix                  Output file prefix.\n"
						+" -s/--states                  Number of hidden states (default 3).\n"
						+" -b/--bins                    Number of quantile bins of the returns (default 3).\n"
						+" -x/--max-iter                Number of Baum-Welch iterations (default 900).\n"
						+" -r/--random-init             Sample the initial model instead of using the \n"
						+"                              three regime prior. Always on unless 3 states \n"
						+"                              and 3 bins are used.\n"
						+" -S/--random-seed             Random seed for this run.\n"
						+" -pp/--print-plot             Write a PNG plot of prices and regimes.\n\n");
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
			options.addOption("s", "states", true, "number of hidden states.");
			options.addOption("b", "bins", true, "number of quantile bins.");
			options.addOption("x", "max-iter", true, "number of iterations.");
			options.addOption("r", "random-init", false, "random initial model.");
			options.addOption("S", "random-seed", true, "random seed.");
			options.addOption("pp", "print-plot", false, "write regime plot.");
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

		states = parseInt(line, "s", Constants._n_states);
		bins = parseInt(line, "b", Constants._n_bins);
		max_iter = parseInt(line, "x", Constants._max_iter);
		if(states<1 || bins<1)
			throw new IllegalArgumentException("Numbers of states and bins must be positive.");
		if(max_iter<0)
			throw new IllegalArgumentException("Number of iterations must not be negative.");

		random_init = line.hasOption("r");
		plot = line.hasOption("pp");

		if(line.hasOption("S")) {
			try {
				Constants.seeding(Long.parseLong(line.getOptionValue("S")));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Option -S expects an integer seed.");
			}
		}
	}

	@Override
	public void run() {
		myLogger.info("Regime detection started "+Utils.getSystemTime());
		PriceData prices = PriceData.read(in_file);
		double[] returns = Returns.logReturns(prices.getClose());
		if(returns.length==0)
			throw new IllegalArgumentException("Need at least two prices, got "+prices.size()+".");
		QuantileDiscretizer discretizer = new QuantileDiscretizer(bins);
		int[] obs = discretizer.fitTransform(returns);

		if(!random_init && (states!=Constants._n_states || bins!=Constants._n_bins)) {
			myLogger.info("No informative prior for "+states+" states and "+
					bins+" bins, using a random initial model.");
			random_init = true;
		}
		hmm = random_init ? HiddenMarkovModel.random(states, bins) :
			HiddenMarkovModel.canonical();
		if(random_init) myLogger.info("Random seed "+Constants.seed);
		myLogger.info("Initial model:");
		hmm.print();

		BaumWelchTrainer trainer = new BaumWelchTrainer(hmm);
		trainer.train(obs, max_iter);
		myLogger.info("Trained model:");
		hmm.print();

		ViterbiUnit vb = new ViterbiDecoder(hmm).findPath(obs);
		if(vb.isImpossible())
			myLogger.warn("The observation sequence has zero probability under the trained model; "
					+ "the decoded regimes are not meaningful.");
		path = vb.getPath();

		write(prices, returns, obs, path);

		if(plot) new RegimePlot(prices.getId()+" regimes", 800, 600).
			save(prices.getClose(), path, out_prefix+".regimes.png");
		usage();
		myLogger.info("Regime detection finished "+Utils.getSystemTime());
	}

	private void write(PriceData prices, double[] returns, int[] obs, int[] path) {
		String[] date = prices.getDate();
		double[] close = prices.getClose();
		String out = out_prefix+".regimes.txt";
		try (BufferedWriter bw = Utils.getBufferedWriter(out)) {
			bw.write("index\tdate\tclose\treturn\tsymbol\tstate\tsignal\n");
			for(int t=0; t<path.length; t++) {
				int d = t+1;
				bw.write(d+"\t"+
						(date[d]==null ? "NA" : date[d])+"\t"+
						close[d]+"\t"+
						returns[t]+"\t"+
						obs[t]+"\t"+
						path[t]+"\t"+
						TradingSignal.fromState(path[t]).position()+"\n");
			}
		} catch (IOException e) {
			myLogger.error("Error writing regimes to "+out);
			throw new RuntimeException(e);
		}
		myLogger.info("Regimes written to "+out);
	}

	public HiddenMarkovModel getModel() {
		return hmm;
	}

	public int[] getPath() {
		return path;
	}
}
