package rhmm.util;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public abstract class Executor {

	protected final static int mb = 1024*1024;
	protected final static Runtime instance = Runtime.getRuntime();

	protected final static Logger myLogger =
			LogManager.getLogger(Executor.class);

	protected Options options = null;

	public abstract void printUsage();

	public abstract void setParameters(String[] args);

	public abstract void run();

	protected CommandLine parse(String[] args) {
		CommandLineParser parser = new DefaultParser();
		try {
			return parser.parse(options, args);
		} catch (ParseException e) {
			printUsage();
			throw new IllegalArgumentException(e.getMessage(), e);
		}
	}

	protected static int parseInt(CommandLine line, String opt, int dflt) {
		if(!line.hasOption(opt)) return dflt;
		String v = line.getOptionValue(opt);
		try {
			return Integer.parseInt(v);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Option -"+opt+
					" expects an integer, got \""+v+"\".");
		}
	}

	protected static double maxMemory() {
		return instance.maxMemory() / mb;
	}

	protected static double totalMemory() {
		return instance.totalMemory() / mb;
	}

	protected static double freeMemory() {
		return instance.freeMemory() / mb;
	}

	protected static double usedMemory() {
		return totalMemory()-freeMemory();
	}

	protected static void usage() {
		myLogger.info("Max Memory: "+maxMemory());
		myLogger.info("Total Memory: "+totalMemory());
		myLogger.info("Free Memory: "+freeMemory());
		myLogger.info("Used Memory: "+usedMemory());
	}
}
