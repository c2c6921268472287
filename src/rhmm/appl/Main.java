package rhmm.appl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import rhmm.hmm.tools.DataPreparation;
import rhmm.hmm.tools.RegimeDetector;

public class Main {

	protected final static Logger myLogger =
			LogManager.getLogger(Main.class);

	public static void main(String[] args) {

		if(args.length<1) {
			printUsage();
			throw new RuntimeException("Undefined tool!!!");
		}
		String[] args2 = new String[args.length-1];
		System.arraycopy(args, 1, args2, 0, args2.length);
		switch(args[0].toLowerCase()) {
		case "datapreparation":
			DataPreparation datapreparation = new DataPreparation();
			datapreparation.setParameters(args2);
			datapreparation.run();
			break;
		case "regimedetection":
			RegimeDetector regimedetector = new RegimeDetector();
			regimedetector.setParameters(args2);
			regimedetector.run();
			break;
		default:
			printUsage();
			throw new RuntimeException("Undefined tool!!!");
		}
	}

	private static void printUsage() {
		myLogger.info(
				"\n\nUsage is as follows:\n"
						+ " datapreparation     Discretise daily log returns of a price file into symbols.\n"
						+ " regimedetection     Train an HMM on a price file and decode market regimes.\n");
	}
}
