package rhmm.hmm.model;

/**
 * Thrown when an observation symbol falls outside {@code [0, O)}.
 */
public class InvalidObservationException extends IllegalArgumentException {

	private static final long serialVersionUID = -5079330264163826117L;

	private final int position;
	private final int symbol;

	public InvalidObservationException(int position, int symbol, int numSymbols) {
		super("Observation "+symbol+" at position "+position+
				" is outside the symbol range [0, "+numSymbols+").");
		this.position = position;
		this.symbol = symbol;
	}

	public int getPosition() {
		return position;
	}

	public int getSymbol() {
		return symbol;
	}
}
