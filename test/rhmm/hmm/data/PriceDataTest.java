package rhmm.hmm.data;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import rhmm.util.Utils;

public class PriceDataTest {

	@TempDir
	File tmp;

	private String write(String name, String content) throws IOException {
		File f = new File(tmp, name);
		try (BufferedWriter bw = Utils.getBufferedWriter(f)) {
			bw.write(content);
		}
		return f.getPath();
	}

	@Test
	public void testReadCsv() throws IOException {
		String file = write("SPY.csv",
				"Date,Open,High,Low,Close,Volume\n"
						+ "2020-01-02,1,1,1,100.5,10\n"
						+ "2020-01-03,1,1,1,101.0,12\n"
						+ "\n"
						+ "2020-01-06,1,1,1,99.25,9\n");
		PriceData prices = PriceData.read(file);
		assertEquals("SPY", prices.getId());
		assertEquals(3, prices.size());
		assertArrayEquals(new double[]{100.5, 101.0, 99.25}, prices.getClose(), 0);
		assertArrayEquals(new String[]{"2020-01-02", "2020-01-03", "2020-01-06"}, prices.getDate());
	}

	@Test
	public void testCloseColumnPreference() throws IOException {
		String file = write("q.tsv", "price\tadj_close\n10\t9.5\n11\t10.5\n");
		PriceData prices = PriceData.read(file);
		assertArrayEquals(new double[]{9.5, 10.5}, prices.getClose(), 0);
		assertNull(prices.getDate()[0]);
	}

	@Test
	public void testGzipRoundTrip() {
		String file = new File(tmp, "x.csv.gz").getPath();
		new PriceData("x", new String[]{"d1", "d2"}, new double[]{1.5, 2.5}).write(file);
		PriceData prices = PriceData.read(file);
		assertEquals("x", prices.getId());
		assertArrayEquals(new String[]{"d1", "d2"}, prices.getDate());
		assertArrayEquals(new double[]{1.5, 2.5}, prices.getClose(), 0);
	}

	@Test
	public void testMalformedFiles() throws IOException {
		String noClose = write("a.csv", "date,open\n2020-01-01,3\n");
		assertThrows(IllegalArgumentException.class, () -> PriceData.read(noClose));
		String badPrice = write("b.csv", "date,close\n2020-01-01,abc\n");
		assertThrows(IllegalArgumentException.class, () -> PriceData.read(badPrice));
		String shortLine = write("c.csv", "date,open,close\n2020-01-01,3\n");
		assertThrows(IllegalArgumentException.class, () -> PriceData.read(shortLine));
		assertThrows(RuntimeException.class,
				() -> PriceData.read(new File(tmp, "missing.csv").getPath()));
		assertThrows(IllegalArgumentException.class,
				() -> new PriceData("y", new String[1], new double[2]));
	}
}
