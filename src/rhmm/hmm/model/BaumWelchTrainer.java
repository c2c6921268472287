package rhmm.hmm.model;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Baum-Welch re-estimation of a {@link HiddenMarkovModel} from a single
 * observation sequence.
 * <p>
 * Training runs a fixed number of iterations, there is no convergence test.
 * Each iteration computes the scaled forward and backward variables under
 * the current parameters, the posteriors gamma and xi, and then overwrites
 * the parameters of the model in place. Rows whose re-estimation
 * denominator is zero keep their previous values.
 * <p>
 * The trainer owns its model while training; it is not thread-safe.
 */
public class BaumWelchTrainer implements ForwardBackwardTrainer {

	private final static Logger myLogger = LogManager.getLogger(BaumWelchTrainer.class);

	private final static double maxDeviation = 1e-6;

	private final HiddenMarkovModel hmm;
	private int[] obs = null;
	private FBUnit forward, backward;
	private PosteriorUnit posterior;
	private int iteration = 0;

	public BaumWelchTrainer(HiddenMarkovModel hmm) {
		this.hmm = hmm;
	}

	/**
	 * Runs exactly {@code iterations} rounds of expectation-maximisation.
	 * An empty sequence or zero iterations leave the model untouched.
	 *
	 * @throws InvalidObservationException if a symbol is out of range
	 * @throws IllegalArgumentException if {@code iterations} is negative
	 */
	@Override
	public void train(int[] observations, int iterations) {
		if(iterations<0)
			throw new IllegalArgumentException("Number of iterations must not be negative: "+iterations);
		if(observations.length==0) {
			myLogger.debug("Empty observation sequence, nothing to train.");
			return;
		}
		hmm.checkObservations(observations);
		this.obs = observations.clone();

		for(int k=0; k<iterations; k++) {
			this.train();
			myLogger.debug("Iteration "+iteration+", log-likelihood "+loglik());
		}
		if(iterations>0)
			myLogger.info("Trained "+iterations+" iterations on "+obs.length+
					" observations, log-likelihood "+loglik());
	}

	/** one iteration on the sequence given to the last {@link #train(int[], int)} call */
	@Override
	public void train() {
		if(obs==null)
			throw new IllegalStateException("No observation sequence to train on.");
		++iteration;
		forward();
		backward();
		posterior();
		check();
		em();
	}

	@Override
	public void forward() {
		this.forward = ForwardBackward.forward(hmm, obs);
	}

	@Override
	public void backward() {
		this.backward = ForwardBackward.backward(hmm, obs, forward);
	}

	@Override
	public void posterior() {
		this.posterior = PosteriorUnit.estimate(hmm, obs, forward, backward);
	}

	@Override
	public void check() {
		if(forward.isDegenerate()) {
			myLogger.debug("Iteration "+iteration+": observation sequence has zero probability.");
			return;
		}
		double d = posterior.maxDeviation();
		if(d>maxDeviation)
			myLogger.warn("Iteration "+iteration+": posterior state probabilities deviate from one by "+d);
	}

	@Override
	public void em() {
		updateInitial();
		updateTransition();
		updateEmission();
		hmm.normalize();
	}

	private void updateInitial() {
		System.arraycopy(posterior.gamma[0], 0, hmm.pi, 0, hmm.S);
	}

	/** the denominator leaves out the last time step */
	private void updateTransition() {
		final int N = obs.length, S = hmm.S;
		final double[][] gamma = posterior.gamma;
		final double[][][] xi = posterior.xi;
		double denom, numer;
		for(int i=0; i<S; i++) {
			denom = 0;
			for(int t=0; t<N-1; t++) denom += gamma[t][i];
			if(denom==0) {
				myLogger.debug("Transition row "+i+" kept, zero expected visits.");
				continue;
			}
			for(int j=0; j<S; j++) {
				numer = 0;
				for(int t=0; t<N-1; t++) numer += xi[t][i][j];
				hmm.trans[i][j] = numer/denom;
			}
		}
	}

	/** the denominator covers every time step */
	private void updateEmission() {
		final int N = obs.length, S = hmm.S, O = hmm.O;
		final double[][] gamma = posterior.gamma;
		double denom;
		double[] count = new double[O];
		for(int i=0; i<S; i++) {
			denom = 0;
			Arrays.fill(count, 0);
			for(int t=0; t<N; t++) {
				denom += gamma[t][i];
				count[obs[t]] += gamma[t][i];
			}
			if(denom==0) {
				myLogger.debug("Emission row "+i+" kept, zero expected visits.");
				continue;
			}
			for(int k=0; k<O; k++)
				hmm.emiss[i][k] = count[k]/denom;
		}
	}

	/**
	 * @return log-likelihood of the sequence under the parameters of the last
	 * E-step, negative infinity before the first iteration
	 */
	@Override
	public double loglik() {
		if(forward==null) return Double.NEGATIVE_INFINITY;
		return forward.probability();
	}

	public HiddenMarkovModel getModel() {
		return hmm;
	}

	public FBUnit getForward() {
		return forward;
	}

	public FBUnit getBackward() {
		return backward;
	}

	public PosteriorUnit getPosterior() {
		return posterior;
	}

	public int iteration() {
		return iteration;
	}
}
