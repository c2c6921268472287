package rhmm.hmm.tools;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class TradingSignalTest {

	@Test
	public void testStateMapping() {
		assertEquals(TradingSignal.BUY, TradingSignal.fromState(0));
		assertEquals(TradingSignal.SELL, TradingSignal.fromState(1));
		assertEquals(TradingSignal.HOLD, TradingSignal.fromState(2));
		assertEquals(TradingSignal.HOLD, TradingSignal.fromState(7));
	}

	@Test
	public void testPositions() {
		assertEquals(1, TradingSignal.BUY.position());
		assertEquals(-1, TradingSignal.SELL.position());
		assertEquals(0, TradingSignal.HOLD.position());
		assertArrayEquals(new TradingSignal[]{TradingSignal.SELL, TradingSignal.BUY, TradingSignal.HOLD},
				TradingSignal.signals(new int[]{1, 0, 2}));
	}
}
