package rhmm.hmm.data;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import rhmm.util.Utils;

/**
 * Daily closing prices of one instrument, in chronological order.
 */
public class PriceData {

	private final static Logger myLogger = LogManager.getLogger(PriceData.class);

	private final static String[] close_header = new String[]{"close", "adj_close", "adjclose", "price"};

	private final String id;
	private final String[] date; // may hold nulls when the file has no date column
	private final double[] close;

	public PriceData(String id, String[] date, double[] close) {
		if(date.length!=close.length)
			throw new IllegalArgumentException("Got "+date.length+" dates for "+close.length+" prices.");
		this.id = id;
		this.date = date;
		this.close = close;
	}

	public PriceData(String id, double[] close) {
		this(id, new String[close.length], close);
	}

	/**
	 * Reads a delimited price file with a header line. Comma, tab and
	 * whitespace delimiters are recognised; {@code .gz} files are decompressed.
	 * The close column is located by name, the date column is optional.
	 */
	public static PriceData read(String file) {
		List<String> dates = new ArrayList<String>();
		List<Double> prices = new ArrayList<Double>();
		int dcol = -1, ccol = -1, n = 0;
		try (BufferedReader br = Utils.getBufferedReader(file)) {
			String line;
			String[] s;
			boolean header = true;
			while( (line=br.readLine())!=null ) {
				++n;
				line = line.trim();
				if(line.isEmpty() || line.startsWith("#")) continue;
				s = split(line);
				if(header) {
					for(int i=0; i<s.length; i++) {
						String h = unquote(s[i]).toLowerCase();
						if(h.equals("date") || h.equals("timestamp")) dcol = i;
					}
					for(String h : close_header) {
						for(int i=0; i<s.length; i++)
							if(unquote(s[i]).equalsIgnoreCase(h)) {
								ccol = i;
								break;
							}
						if(ccol>=0) break;
					}
					if(ccol<0)
						throw new IllegalArgumentException("No close price column in the header of "+file+".");
					header = false;
					continue;
				}
				if(s.length<=ccol || dcol>=0 && s.length<=dcol)
					throw new IllegalArgumentException("Line "+n+" of "+file+" has too few columns.");
				try {
					prices.add(Double.parseDouble(unquote(s[ccol])));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Line "+n+" of "+file+
							" has an invalid price \""+s[ccol]+"\".");
				}
				dates.add(dcol<0 ? null : unquote(s[dcol]));
			}
		} catch (IOException e) {
			myLogger.error("Error reading price file "+file);
			throw new RuntimeException(e);
		}
		myLogger.info("Read "+prices.size()+" prices from "+file);
		String id = new File(file).getName().
				replaceAll(".gz$", "").
				replaceAll("\\.[^.]*$", "");
		return new PriceData(id,
				dates.toArray(new String[dates.size()]),
				ArrayUtils.toPrimitive(prices.toArray(new Double[prices.size()])));
	}

	private static String[] split(String line) {
		if(line.contains(",")) return line.split("\\s*,\\s*", -1);
		if(line.contains("\t")) return line.split("\\t", -1);
		return line.split("\\s+");
	}

	private static String unquote(String s) {
		return StringUtils.strip(s.trim(), "\"");
	}

	/** writes a {@code date,close} file that {@link #read(String)} reads back */
	public void write(String file) {
		try (BufferedWriter bw = Utils.getBufferedWriter(file)) {
			bw.write("date,close\n");
			for(int i=0; i<close.length; i++) {
				bw.write((date[i]==null ? String.valueOf(i) : date[i])+","+close[i]+"\n");
			}
		} catch (IOException e) {
			myLogger.error("Error writing price file "+file);
			throw new RuntimeException(e);
		}
	}

	public String getId() {
		return id;
	}

	public String[] getDate() {
		return date;
	}

	public double[] getClose() {
		return close;
	}

	public int size() {
		return close.length;
	}
}
