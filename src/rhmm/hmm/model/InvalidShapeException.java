package rhmm.hmm.model;

/**
 * Thrown when the probability tables handed to a {@link HiddenMarkovModel}
 * do not match the declared number of states and symbols, or hold entries
 * that are not probabilities.
 */
public class InvalidShapeException extends IllegalArgumentException {

	private static final long serialVersionUID = 2216495030968153524L;

	public InvalidShapeException(String message) {
		super(message);
	}
}
