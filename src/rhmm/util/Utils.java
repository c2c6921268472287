package rhmm.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class Utils {

	private static final Logger myLogger = LogManager.getLogger(Utils.class);

	public static String getSystemTime(){
		return new SimpleDateFormat("yyyy-MM-dd HH:mm:ss").
				format(Calendar.getInstance().getTime());
	}

	public static BufferedReader getBufferedReader(String inSourceName) {
		try {
			InputStream is = new FileInputStream(inSourceName);
			if (inSourceName.endsWith(".gz")) 
				is = new GZIPInputStream(is);
			return new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
		} catch (IOException e) {
			myLogger.error("getBufferedReader: Error getting reader for: " + inSourceName);
			throw new RuntimeException("Cannot open "+inSourceName, e);
		}
	}

	public static BufferedWriter getBufferedWriter(String filename) {
		return getBufferedWriter(new File(filename));
	}

	public static BufferedWriter getBufferedWriter(File file) {
		try {
			if (file.getName().endsWith(".gz")) {
				return new BufferedWriter(new OutputStreamWriter(new GZIPOutputStream(
						new FileOutputStream(file)), StandardCharsets.UTF_8));
			} else {
				return new BufferedWriter(new OutputStreamWriter(
						new FileOutputStream(file), StandardCharsets.UTF_8));
			}
		} catch (IOException e) {
			myLogger.error("getBufferedWriter: Error getting writer for: " + file.getPath());
			throw new RuntimeException("Cannot write "+file.getPath(), e);
		}
	}

	public static String paste(double[] array, String collapse) {
		StringBuilder s = new StringBuilder();
		for(int i=0; i<array.length; i++) {
			if(i>0) s.append(collapse);
			s.append(String.format("%.6f", array[i]));
		}
		return s.toString();
	}

	public static String paste(int[] array, String collapse) {
		return StringUtils.join(ArrayUtils.toObject(array), collapse);
	}

	public static String paste(double[][] mat, String collapse) {
		StringBuilder s = new StringBuilder();
		for(int i=0; i<mat.length; i++) {
			s.append("[");
			s.append(paste(mat[i], collapse));
			s.append("]");
			if(i<mat.length-1) s.append("\n");
		}
		return s.toString();
	}
}
