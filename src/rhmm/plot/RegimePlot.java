package rhmm.plot;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.geom.Ellipse2D;
import java.io.File;
import java.io.IOException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtilities;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.DatasetRenderingOrder;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Price line with the decoded regime of every day drawn as a coloured dot.
 */
public class RegimePlot {

	private final static Logger myLogger = LogManager.getLogger(RegimePlot.class);

	static {
		if(System.getProperty("java.awt.headless")==null)
			System.setProperty("java.awt.headless", "true");
	}

	private final static Color[] regime_color = new Color[]{Color.RED, Color.GREEN, Color.BLUE};

	private String title = "Regimes";
	private int width = 800, height = 600;

	public RegimePlot() {}

	public RegimePlot(String title, int width, int height) {
		this.title = title;
		this.width = width;
		this.height = height;
	}

	/**
	 * @param prices one price per day
	 * @param regimes decoded state per day, aligned with the end of
	 * {@code prices} when shorter
	 */
	public JFreeChart createChart(double[] prices, int[] regimes) {
		if(regimes.length>prices.length)
			throw new IllegalArgumentException("More regimes ("+regimes.length+
					") than prices ("+prices.length+").");

		XYSeries price = new XYSeries("price");
		for(int i=0; i<prices.length; i++) price.add(i, prices[i]);
		XYSeriesCollection line = new XYSeriesCollection(price);

		int nr = 0;
		for(int r : regimes) nr = Math.max(nr, r+1);
		XYSeries[] series = new XYSeries[nr];
		for(int k=0; k<nr; k++) series[k] = new XYSeries("regime "+k);
		int offset = prices.length-regimes.length;
		for(int i=0; i<regimes.length; i++)
			series[regimes[i]].add(i+offset, prices[i+offset]);
		XYSeriesCollection points = new XYSeriesCollection();
		for(XYSeries s : series) points.addSeries(s);

		JFreeChart chart = ChartFactory.createXYLineChart(title,
				"day",
				"price",
				line,
				PlotOrientation.VERTICAL,
				true,
				false,
				false);
		chart.setBackgroundPaint(Color.WHITE);

		XYPlot plot = chart.getXYPlot();
		plot.setBackgroundPaint(Color.WHITE);
		((NumberAxis) plot.getRangeAxis()).setAutoRangeIncludesZero(false);

		XYLineAndShapeRenderer lr = new XYLineAndShapeRenderer(true, false);
		lr.setSeriesPaint(0, Color.DARK_GRAY);
		lr.setSeriesStroke(0, new BasicStroke(1.0f));
		plot.setRenderer(0, lr);

		XYLineAndShapeRenderer pr = new XYLineAndShapeRenderer(false, true);
		for(int k=0; k<nr; k++) {
			pr.setSeriesPaint(k, k<regime_color.length ? regime_color[k] : Color.BLACK);
			pr.setSeriesShape(k, new Ellipse2D.Double(-1.5, -1.5, 3, 3));
		}
		plot.setDataset(1, points);
		plot.setRenderer(1, pr);
		plot.setDatasetRenderingOrder(DatasetRenderingOrder.FORWARD);
		return chart;
	}

	public void save(double[] prices, int[] regimes, String file) {
		JFreeChart chart = createChart(prices, regimes);
		try {
			ChartUtilities.saveChartAsPNG(new File(file), chart, width, height);
		} catch (IOException e) {
			myLogger.error("Error writing plot "+file);
			throw new RuntimeException(e);
		}
		myLogger.info("Regime plot written to "+file);
	}
}
