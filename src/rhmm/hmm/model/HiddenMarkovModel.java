package rhmm.hmm.model;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import rhmm.util.Algebra;
import rhmm.util.Constants;
import rhmm.util.Dirichlet;
import rhmm.util.Utils;

/**
 * Parameter store of a discrete hidden Markov model: the initial state
 * distribution, the state transition matrix and the emission matrix.
 * <p>
 * The tables have a fixed shape, decided at construction. They are mutated
 * in place by {@link BaumWelchTrainer} and only read by
 * {@link ViterbiDecoder}. Instances are not thread-safe; a model must not be
 * decoded while it is being trained. Use {@link #copy()} to run independent
 * trainings from the same starting point.
 */
public class HiddenMarkovModel {

	private final static Logger myLogger = LogManager.getLogger(HiddenMarkovModel.class);

	protected final int S; // #hidden states
	protected final int O; // #observation symbols

	protected final double[] pi; // initial distribution
	protected final double[][] trans; // S x S
	protected final double[][] emiss; // S x O

	/**
	 * Builds a model from explicit tables. Shapes are taken from the tables and
	 * checked for consistency, then every row is normalised.
	 *
	 * @throws InvalidShapeException if the tables are inconsistent
	 */
	public HiddenMarkovModel(double[] pi,
			double[][] trans,
			double[][] emiss) {
		this(pi==null ? 0 : pi.length,
				emiss==null||emiss.length==0||emiss[0]==null ? 0 : emiss[0].length,
				pi, trans, emiss);
	}

	/**
	 * Builds a model with declared numbers of states and symbols.
	 *
	 * @throws InvalidShapeException if any table disagrees with {@code S} or {@code O}
	 */
	public HiddenMarkovModel(int S,
			int O,
			double[] pi,
			double[][] trans,
			double[][] emiss) {
		if(S<1) throw new InvalidShapeException("Number of states must be positive: "+S);
		if(O<1) throw new InvalidShapeException("Number of observation symbols must be positive: "+O);
		this.S = S;
		this.O = O;
		check("initial distribution", pi, S);
		check("transition matrix", trans, S, S);
		check("emission matrix", emiss, S, O);
		this.pi = pi.clone();
		this.trans = Algebra.copyOf(trans);
		this.emiss = Algebra.copyOf(emiss);
		this.normalize();
	}

	/**
	 * Informative three-regime prior: uniform start, persistent states and
	 * emissions skewed towards low, middle and high return bins.
	 */
	public static HiddenMarkovModel canonical() {
		return new HiddenMarkovModel(Constants._n_states,
				Constants._n_bins,
				Constants._init_pi,
				Constants._init_trans,
				Constants._init_emiss);
	}

	/**
	 * Samples every row from a symmetric Dirichlet using the global generator,
	 * see {@link Constants#seeding(long)}.
	 */
	public static HiddenMarkovModel random(int S, int O) {
		if(S<1 || O<1)
			throw new InvalidShapeException("Number of states and symbols must be positive: "
					+S+", "+O);
		Dirichlet diriS = new Dirichlet(S, S*Constants._diri_u);
		Dirichlet diriO = new Dirichlet(O, O*Constants._diri_u);
		double[] pi = diriS.sample();
		double[][] trans = new double[S][];
		for(int i=0; i<S; i++) trans[i] = diriS.sample();
		double[][] emiss = new double[S][];
		for(int i=0; i<S; i++) emiss[i] = diriO.sample();
		myLogger.debug("Random model initialised with seed "+Constants.seed);
		return new HiddenMarkovModel(S, O, pi, trans, emiss);
	}

	private HiddenMarkovModel(HiddenMarkovModel model) {
		this.S = model.S;
		this.O = model.O;
		this.pi = model.pi.clone();
		this.trans = Algebra.copyOf(model.trans);
		this.emiss = Algebra.copyOf(model.emiss);
	}

	/** Independent snapshot, bit-identical to this model. */
	public HiddenMarkovModel copy() {
		return new HiddenMarkovModel(this);
	}

	private static void check(String name, double[] array, int n) {
		if(array==null)
			throw new InvalidShapeException("Missing "+name+".");
		if(array.length!=n)
			throw new InvalidShapeException("The "+name+" has length "+
					array.length+", expected "+n+".");
		for(int i=0; i<n; i++)
			if(!(array[i]>=0) || Double.isInfinite(array[i]))
				throw new InvalidShapeException("The "+name+" has an invalid entry "+
						array[i]+" at "+i+".");
	}

	private static void check(String name, double[][] mat, int n, int m) {
		if(mat==null)
			throw new InvalidShapeException("Missing "+name+".");
		if(mat.length!=n)
			throw new InvalidShapeException("The "+name+" has "+
					mat.length+" rows, expected "+n+".");
		for(int i=0; i<n; i++)
			check(name+" row "+i, mat[i], m);
	}

	/**
	 * Divides every row of the three tables by its sum. Rows summing to zero
	 * are left as they are.
	 */
	public void normalize() {
		Algebra.normalize(pi);
		for(double[] row : trans) Algebra.normalize(row);
		for(double[] row : emiss) Algebra.normalize(row);
	}

	/**
	 * @throws InvalidObservationException at the first symbol outside {@code [0, O)}
	 */
	public void checkObservations(int[] observations) {
		for(int t=0; t<observations.length; t++)
			if(observations[t]<0 || observations[t]>=O)
				throw new InvalidObservationException(t, observations[t], O);
	}

	public int numStates() {
		return S;
	}

	public int numSymbols() {
		return O;
	}

	public double[] getInitial() {
		return pi.clone();
	}

	public double[][] getTransition() {
		return Algebra.copyOf(trans);
	}

	public double[][] getEmission() {
		return Algebra.copyOf(emiss);
	}

	public double initial(int i) {
		return pi[i];
	}

	public double trans(int from, int to) {
		return trans[from][to];
	}

	public double emiss(int state, int symbol) {
		return emiss[state][symbol];
	}

	public void print() {
		myLogger.info("\n"+this.toString());
	}

	@Override
	public String toString() {
		StringBuilder os = new StringBuilder();
		os.append("Initial probabilities:\n[");
		os.append(Utils.paste(pi, ", "));
		os.append("]\nTransition matrix:\n");
		os.append(Utils.paste(trans, ", "));
		os.append("\nEmission matrix:\n");
		os.append(Utils.paste(emiss, ", "));
		return os.toString();
	}

	@Override
	public boolean equals(Object obj) {
		if(this==obj) return true;
		if(!(obj instanceof HiddenMarkovModel)) return false;
		HiddenMarkovModel that = (HiddenMarkovModel) obj;
		return Arrays.equals(pi, that.pi) &&
				Arrays.deepEquals(trans, that.trans) &&
				Arrays.deepEquals(emiss, that.emiss);
	}

	@Override
	public int hashCode() {
		return 31*(31*Arrays.hashCode(pi)+Arrays.deepHashCode(trans))+
				Arrays.deepHashCode(emiss);
	}
}
