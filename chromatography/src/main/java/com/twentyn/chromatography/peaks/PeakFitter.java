/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.chromatography.peaks;

import com.twentyn.chromatography.concurrent.CancellationFlag;
import com.twentyn.chromatography.concurrent.ColumnWorkerPool;
import com.twentyn.chromatography.model.Peak;
import com.twentyn.chromatography.model.Signal;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits an exponential-Gaussian hybrid (Lan and Jorgenson, J. Chromatogr. A 915 (2001) 1) to the peak found by a
 * {@link PeakDetector}:
 * <pre>
 *   EGH(x) = h * exp(-(x - c)^2 / (2 w^2 + e (x - c)))    where 2 w^2 + e (x - c) > 0
 * </pre>
 * Width {@code w} and decay {@code e} follow directly from the boundary distances at height fraction {@code alpha}.
 * The formula does not determine the sign of the decay, so both signs are evaluated and the one with the lower fit
 * error is kept; on a tie the positive decay wins.
 */
public class PeakFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakFitter.class);

  // Coefficients of the area correction polynomial in atan(|e| / w).
  static final double[] AREA_COEFFICIENTS = {
      4.0, -6.293724, 9.232834, -11.34291, 9.123978, -4.173753, 0.827797
  };

  public static final double MIN_ALPHA = 1e-9;
  public static final double MAX_ALPHA = 1.0 - 1e-9;

  // Fit values outside [MIN_FIT_RATIO * h, MAX_FIT_RATIO * h] are model blow-ups and are zeroed.
  public static final double MAX_FIT_RATIO = 10.0;
  public static final double MIN_FIT_RATIO = 1e-9;

  private final PeakOptions options;
  private final PeakDetector detector;

  public PeakFitter() {
    this(new PeakOptions());
  }

  public PeakFitter(PeakOptions options) {
    this(options, new PeakDetector(options));
  }

  public PeakFitter(PeakOptions options, PeakDetector detector) {
    this.options = options;
    this.detector = detector;
  }

  public PeakOptions getOptions() {
    return options;
  }

  /**
   * Fits one peak per column on the calling thread.
   */
  public List<Peak> fit(Signal signal) {
    double[] time = signal.getTime();
    List<Peak> peaks = new ArrayList<>(signal.getColumnCount());
    for (int c = 0; c < signal.getColumnCount(); c++) {
      peaks.add(fit(time, signal.getIntensities().getColumn(c)));
    }
    return peaks;
  }

  /**
   * Fits one peak per column with one pool task per column.  A column whose fit fails gets an empty peak.
   */
  public List<Peak> fit(final Signal signal, ColumnWorkerPool pool, CancellationFlag cancellation) {
    final double[] time = signal.getTime();
    final int rows = signal.size();
    return pool.map(signal.getColumnCount(),
        column -> fit(time, signal.getIntensities().getColumn(column)),
        column -> Peak.empty(rows),
        cancellation);
  }

  public Peak fit(double[] x, double[] y) {
    return fit(x, y, options.getCenter(), options.getWidth());
  }

  /**
   * Fits the peak nearest {@code center} on one column.
   * @return The fitted peak; {@link Peak#empty(int)} if there is no peak or the fit is not numerically defined.
   */
  public Peak fit(double[] x, double[] y, Double center, Double width) {
    PeakBoundaries peak = detector.detect(x, y, center, width);
    if (peak.isEmpty()) {
      return Peak.empty(y.length);
    }

    final double c = peak.getCenter();
    final double h = peak.getHeight();
    final double a = c - peak.getLeft();
    final double b = peak.getRight() - c;
    final double alpha = Math.min(MAX_ALPHA, Math.max(MIN_ALPHA, peak.getAlpha()));
    final double logAlpha = FastMath.log(alpha);

    final double w = FastMath.sqrt(-a * b / (2.0 * logAlpha));
    final double e = -(b - a) / logAlpha;

    double[] positive = evaluate(x, c, h, w, e);
    double[] negative = evaluate(x, c, h, w, -e);
    double positiveError = fitError(x, y, positive, peak.getLeft(), peak.getRight(), h);
    double negativeError = fitError(x, y, negative, peak.getLeft(), peak.getRight(), h);

    boolean useNegative = Double.isNaN(positiveError) ? !Double.isNaN(negativeError) : negativeError < positiveError;
    double decay = useNegative ? -e : e;
    double[] fit = useNegative ? negative : positive;
    double error = useNegative ? negativeError : positiveError;

    double area = area(h, w, decay);
    if (Double.isNaN(area) || Double.isNaN(error)) {
      LOGGER.debug("Peak fit at %.4f is not defined (area %f, error %f)", c, area, error);
      return Peak.empty(y.length);
    }

    double[] residuals = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      residuals[i] = y[i] - fit[i];
    }
    return new Peak(c, peak.getLeft(), peak.getRight(), h, w, decay, area, fit, residuals, error);
  }

  /**
   * Evaluates the model; points outside its domain or outside the sane range relative to {@code h} are zero.
   */
  static double[] evaluate(double[] x, double c, double h, double w, double e) {
    double[] fit = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      double d = x[i] - c;
      double denominator = 2.0 * w * w + e * d;
      if (denominator > 0.0) {
        double v = h * FastMath.exp(-d * d / denominator);
        fit[i] = v <= MAX_FIT_RATIO * h && v >= MIN_FIT_RATIO * h ? v : 0.0;
      }
    }
    return fit;
  }

  /**
   * RMS of the residual between {@code left} and {@code right}, as a percentage of the peak's rise above the lowest
   * intensity there.
   * @return The error, or NaN if the window is empty or the peak does not rise above it.
   */
  static double fitError(double[] x, double[] y, double[] fit, double left, double right, double height) {
    double sumSquares = 0.0;
    int count = 0;
    double min = Double.POSITIVE_INFINITY;
    for (int i = 0; i < x.length; i++) {
      if (x[i] >= left && x[i] <= right) {
        double r = y[i] - fit[i];
        sumSquares += r * r;
        count++;
        min = Math.min(min, y[i]);
      }
    }
    if (count == 0 || !(height > min)) {
      return Double.NaN;
    }
    return FastMath.sqrt(sumSquares / count) / (height - min) * 100.0;
  }

  static double area(double h, double w, double e) {
    double t = FastMath.atan(FastMath.abs(e) / w);
    double e0 = 0.0;
    // Horner's scheme, highest power first.
    for (int i = AREA_COEFFICIENTS.length - 1; i >= 0; i--) {
      e0 = e0 * t + AREA_COEFFICIENTS[i];
    }
    return h * (w * FastMath.sqrt(FastMath.PI / 8.0) + FastMath.abs(e)) * e0;
  }
}
