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

import com.twentyn.chromatography.model.Signal;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the highest local maximum inside a search window and the positions on either side where the peak falls back
 * to a common fraction {@code alpha} of its height.
 *
 * The fraction is picked from the peak itself: the leftward and rightward traces from the apex (normalized by the
 * apex height) are walked in lockstep while accumulating their absolute difference.  On each side, the first point
 * where the accumulated asymmetry reaches the trace gives that side's crossing height; the larger of the two is used.
 * A symmetric peak therefore gets boundaries near half height, a tailing peak gets boundaries higher up where the two
 * flanks still agree.
 */
public class PeakDetector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakDetector.class);

  public static final double FALLBACK_ALPHA = 0.5;
  public static final double MAX_ASYMMETRY = 2.0;

  // Brent is solving on the time axis, which is in minutes.
  private static final double ABSOLUTE_ACCURACY = 1e-6;
  private static final int MAX_EVALUATIONS = 10000;

  private final PeakOptions options;

  public PeakDetector() {
    this(new PeakOptions());
  }

  public PeakDetector(PeakOptions options) {
    this.options = options;
  }

  public PeakOptions getOptions() {
    return options;
  }

  /**
   * Detects one peak per column of the signal using the configured hints.
   */
  public List<PeakBoundaries> detect(Signal signal) {
    double[] time = signal.getTime();
    List<PeakBoundaries> results = new ArrayList<>(signal.getColumnCount());
    for (int c = 0; c < signal.getColumnCount(); c++) {
      results.add(detect(time, signal.getIntensities().getColumn(c)));
    }
    return results;
  }

  public PeakBoundaries detect(double[] x, double[] y) {
    return detect(x, y, options.getCenter(), options.getWidth());
  }

  /**
   * Locates a peak near {@code centerHint}.
   * @param x The time axis, strictly increasing.
   * @param y The intensities, co-indexed with {@code x}.
   * @param centerHint Where to look, or null for the time of the column maximum.
   * @param widthHint How wide a window to search, or null for 5% of the time range.
   * @return The peak boundaries, or {@link PeakBoundaries#none()} if the window holds no local maximum.
   */
  public PeakBoundaries detect(double[] x, double[] y, Double centerHint, Double widthHint) {
    if (x.length != y.length) {
      throw new IllegalArgumentException(String.format(
          "Peak detection got %d time points but %d intensities", x.length, y.length));
    }
    final int n = x.length;
    if (n < 3) {
      return PeakBoundaries.none();
    }
    for (int i = 1; i < n; i++) {
      if (!(x[i] > x[i - 1])) {
        throw new IllegalArgumentException(String.format(
            "Peak detection time axis is not strictly increasing at index %d", i));
      }
    }

    Window window = window(x, y, centerHint, widthHint);
    int apex = highestLocalMaximum(x, y, window);
    if (apex < 0 || !(y[apex] > 0.0)) {
      LOGGER.debug("No local maximum between %.4f and %.4f", window.lower, window.upper);
      return PeakBoundaries.none();
    }

    PolynomialSplineFunction spline = new SplineInterpolator().interpolate(x, y);
    // Solvers keep evaluation counts, so each call gets its own.
    BrentSolver solver = new BrentSolver(ABSOLUTE_ACCURACY);

    double center = x[apex];
    double height = y[apex];
    UnivariateFunction slope = spline.derivative();
    if (slope.value(x[apex - 1]) > 0 && slope.value(x[apex + 1]) < 0) {
      double root = solver.solve(MAX_EVALUATIONS, slope, x[apex - 1], x[apex + 1]);
      double refined = spline.value(root);
      if (refined >= height) {
        center = root;
        height = refined;
      }
    }

    double alpha = boundaryLevel(y, apex, height);
    double level = alpha * height;
    double left = linearCrossing(x, y, apex, -1, level);
    double right = linearCrossing(x, y, apex, 1, level);

    if (needsCorrection(center, left, right)) {
      LOGGER.debug("Re-estimating boundaries %.4f/%.4f around %.4f on the spline", left, right, center);
      left = splineCrossing(solver, spline, x, center, -1, level);
      right = splineCrossing(solver, spline, x, center, 1, level);
    }

    double a = center - left;
    double b = right - center;
    // Negated comparisons also catch a crossing the spline could not place.
    if (!(a > 0.0) && !(b > 0.0)) {
      a = (x[n - 1] - x[0]) / (n - 1);
      b = a;
    } else if (!(a > 0.0)) {
      a = b;
    } else if (!(b > 0.0)) {
      b = a;
    }
    if (a > MAX_ASYMMETRY * b) {
      a = MAX_ASYMMETRY * b;
    } else if (b > MAX_ASYMMETRY * a) {
      b = MAX_ASYMMETRY * a;
    }

    return new PeakBoundaries(center, center - a, center + b, height, alpha);
  }

  private static class Window {
    final double lower;
    final double upper;

    Window(double center, double width) {
      this.lower = center - width / 2.0;
      this.upper = center + width / 2.0;
    }
  }

  // The hints are pulled inside the time range: the center onto the second or second-to-last point, the width so the
  // window does not extend past either end.
  private static Window window(double[] x, double[] y, Double centerHint, Double widthHint) {
    final int n = x.length;
    final double xmin = x[0];
    final double xmax = x[n - 1];

    double center;
    if (centerHint == null) {
      int argmax = 0;
      for (int i = 1; i < n; i++) {
        if (y[i] > y[argmax]) {
          argmax = i;
        }
      }
      center = x[argmax];
    } else {
      center = centerHint;
    }
    double width = widthHint == null || !(widthHint > 0.0) ?
        PeakOptions.DEFAULT_WIDTH_FRACTION * (xmax - xmin) : widthHint;

    if (center >= xmax) {
      center = x[n - 2];
    } else if (center <= xmin) {
      center = x[1];
    }
    if (center + width / 2.0 > xmax) {
      width = 2.0 * (xmax - center);
    }
    if (center - width / 2.0 < xmin) {
      width = 2.0 * (center - xmin);
    }
    return new Window(center, width);
  }

  // Local maxima are points strictly above the next and at least as high as the previous one.
  private static int highestLocalMaximum(double[] x, double[] y, Window window) {
    int apex = -1;
    for (int k = 1; k < y.length - 1; k++) {
      if (y[k] > y[k + 1] && y[k] >= y[k - 1] && x[k] > window.lower && x[k] < window.upper &&
          (apex < 0 || y[k] > y[apex])) {
        apex = k;
      }
    }
    return apex;
  }

  /**
   * Picks the fraction of the apex height at which both boundaries are placed.
   */
  static double boundaryLevel(double[] y, int apex, double height) {
    final int steps = Math.min(apex, y.length - 1 - apex);
    double cumulative = 0.0;
    double leftLevel = Double.NaN;
    double rightLevel = Double.NaN;
    for (int j = 0; j <= steps; j++) {
      double l = y[apex - j] / height;
      double r = y[apex + j] / height;
      cumulative += Math.abs(l - r);
      if (Double.isNaN(leftLevel) && cumulative >= l) {
        leftLevel = l;
      }
      if (Double.isNaN(rightLevel) && cumulative >= r) {
        rightLevel = r;
      }
      if (!Double.isNaN(leftLevel) && !Double.isNaN(rightLevel)) {
        break;
      }
    }

    double alpha;
    if (Double.isNaN(leftLevel)) {
      alpha = rightLevel;
    } else if (Double.isNaN(rightLevel)) {
      alpha = leftLevel;
    } else {
      alpha = Math.max(leftLevel, rightLevel);
    }
    if (Double.isNaN(alpha) || alpha >= 1.0 || alpha <= 0.0) {
      return FALLBACK_ALPHA;
    }
    return alpha;
  }

  // Walks away from the apex and linearly interpolates the first drop to the level; the end of the column if none.
  private static double linearCrossing(double[] x, double[] y, int apex, int direction, double level) {
    for (int j = apex + direction; j >= 0 && j < y.length; j += direction) {
      if (y[j] <= level) {
        int previous = j - direction;
        // A plateau sitting exactly on the level has no slope to interpolate along.
        if (y[previous] == y[j]) {
          return x[j];
        }
        double fraction = (y[previous] - level) / (y[previous] - y[j]);
        return x[previous] + fraction * (x[j] - x[previous]);
      }
    }
    return direction < 0 ? x[0] : x[x.length - 1];
  }

  private static double splineCrossing(BrentSolver solver, final PolynomialSplineFunction spline, double[] x,
                                       double center, int direction, final double level) {
    final int n = x.length;
    int j;
    if (direction > 0) {
      j = 0;
      while (j < n && x[j] <= center) {
        j++;
      }
    } else {
      j = n - 1;
      while (j >= 0 && x[j] >= center) {
        j--;
      }
    }

    UnivariateFunction shifted = t -> spline.value(t) - level;
    double previous = center;
    for (; j >= 0 && j < n; j += direction) {
      if (spline.value(x[j]) <= level) {
        double lo = Math.min(previous, x[j]);
        double hi = Math.max(previous, x[j]);
        if (lo < hi && shifted.value(previous) > 0.0) {
          return solver.solve(MAX_EVALUATIONS, shifted, lo, hi);
        }
        return x[j];
      }
      previous = x[j];
    }
    return direction < 0 ? x[0] : x[n - 1];
  }

  private static boolean needsCorrection(double center, double left, double right) {
    if (!Double.isFinite(left) || !Double.isFinite(right) || left >= center || right <= center) {
      return true;
    }
    double a = center - left;
    double b = right - center;
    return a > MAX_ASYMMETRY * b || b > MAX_ASYMMETRY * a;
  }
}
