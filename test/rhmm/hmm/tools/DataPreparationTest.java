package rhmm.hmm.tools;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import rhmm.hmm.data.PriceData;
import rhmm.hmm.data.QuantileDiscretizer;
import rhmm.util.Utils;

public class DataPreparationTest {

	@TempDir
	File tmp;

	@Test
	public void testWritesObservations() throws IOException {
		String in = new File(tmp, "p.csv").getPath();
		String prefix = new File(tmp, "p").getPath();
		new PriceData("p", new double[]{100, 101, 100, 102, 99, 99}).write(in);

		DataPreparation dp = new DataPreparation();
		dp.setParameters(new String[]{"-i", in, "-o", prefix, "-b", "2"});
		dp.run();

		// returns sorted: ln(99/102), ln(100/101), 0, ln(101/100), ln(102/100)
		assertArrayEquals(new int[]{1, 0, 1, 0, 0},
				QuantileDiscretizer.readObservations(prefix+".obs.txt"));
		try (BufferedReader br = Utils.getBufferedReader(prefix+".thresholds.txt")) {
			assertEquals("0\t0.0", br.readLine());
			assertNull(br.readLine());
		}
	}

	@Test
	public void testMissingArguments() {
		assertThrows(IllegalArgumentException.class,
				() -> new DataPreparation().setParameters(new String[0]));
		assertThrows(IllegalArgumentException.class,
				() -> new DataPreparation().setParameters(new String[]{"-i", "a.csv"}));
		assertThrows(IllegalArgumentException.class,
				() -> new DataPreparation().setParameters(new String[]{"-i", "a.csv", "-o", "a", "-b", "x"}));
		assertThrows(IllegalArgumentException.class,
				() -> new DataPreparation().setParameters(new String[]{"-i", "a.csv", "-o", "a", "-b", "0"}));
		assertThrows(IllegalArgumentException.class,
				() -> new DataPreparation().setParameters(new String[]{"-i", "a.csv", "-o", "a", "--nope"}));
	}
}
