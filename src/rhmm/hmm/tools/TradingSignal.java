package rhmm.hmm.tools;

/**
 * Trading action attached to a decoded regime.
 */
public enum TradingSignal {
	BUY(1), SELL(-1), HOLD(0);

	private final int position;

	private TradingSignal(int position) {
		this.position = position;
	}

	public int position() {
		return position;
	}

	/** state 0 buys, state 1 sells, anything else holds */
	public static TradingSignal fromState(int state) {
		switch(state) {
		case 0:
			return BUY;
		case 1:
			return SELL;
		default:
			return HOLD;
		}
	}

	public static TradingSignal[] signals(int[] path) {
		TradingSignal[] signals = new TradingSignal[path.length];
		for(int i=0; i<path.length; i++)
			signals[i] = fromState(path[i]);
		return signals;
	}
}
