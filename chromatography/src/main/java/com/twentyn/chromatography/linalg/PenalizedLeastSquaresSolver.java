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

package com.twentyn.chromatography.linalg;

import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Asymmetric least squares with a second-difference roughness penalty (P.H.C. Eilers, Anal. Chem. 75 (2003) 3631).
 *
 * Each iteration solves {@code z = (W + s·DᵗD)⁻¹·W·y} and then re-weights every point: {@code a} when the point lies
 * above the fitted curve, {@code 1 - a} otherwise.  A small asymmetry drags the curve down to the lower envelope of
 * the signal (a baseline); an asymmetry of 0.5 gives a plain Whittaker smoother.
 *
 * Parameters are clamped to safe ranges rather than rejected.
 */
public class PenalizedLeastSquaresSolver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PenalizedLeastSquaresSolver.class);

  public static final int MIN_POINTS = 4;

  public static final double MIN_ASYMMETRY = 1e-9;
  public static final double MAX_ASYMMETRY = 1.0 - 1e-9;
  public static final double MIN_SMOOTHNESS = 1e-9;
  public static final double MAX_SMOOTHNESS = 1e15;

  private final double smoothness;
  private final double asymmetry;
  private final int iterations;
  private final double convergence;

  public PenalizedLeastSquaresSolver(double smoothness, double asymmetry, int iterations, double convergence) {
    this.smoothness = clampSmoothness(smoothness);
    this.asymmetry = clampAsymmetry(asymmetry);
    this.iterations = Math.max(1, iterations);
    this.convergence = Double.isNaN(convergence) ? 0.0 : Math.max(0.0, convergence);
  }

  public static double clampSmoothness(double smoothness) {
    if (Double.isNaN(smoothness) || smoothness < MIN_SMOOTHNESS) {
      return MIN_SMOOTHNESS;
    }
    return Math.min(smoothness, MAX_SMOOTHNESS);
  }

  public static double clampAsymmetry(double asymmetry) {
    if (Double.isNaN(asymmetry) || asymmetry < MIN_ASYMMETRY) {
      return MIN_ASYMMETRY;
    }
    return Math.min(asymmetry, MAX_ASYMMETRY);
  }

  public double getSmoothness() {
    return smoothness;
  }

  public double getAsymmetry() {
    return asymmetry;
  }

  public int getIterations() {
    return iterations;
  }

  public double getConvergence() {
    return convergence;
  }

  /**
   * Runs the reweighting loop on one column.
   * @param y The column values; not modified.
   * @return The fitted curve plus convergence diagnostics.
   * @throws IllegalArgumentException if {@code y} has fewer than {@link #MIN_POINTS} values.
   */
  public SolverResult solve(double[] y) {
    final int n = y.length;
    if (n < MIN_POINTS) {
      throw new IllegalArgumentException(String.format(
          "Penalized least squares needs at least %d points, got %d", MIN_POINTS, n));
    }

    boolean allZero = true;
    for (double v : y) {
      if (v != 0.0) {
        allZero = false;
        break;
      }
    }
    if (allZero) {
      return new SolverResult(new double[n], 0, new ArrayList<Double>(), true, false);
    }

    double[][] penalty = secondDifferencePenalty(n, smoothness);
    double[] weights = new double[n];
    Arrays.fill(weights, 1.0);

    double[] estimate = null;
    List<Double> weightChanges = new ArrayList<>(iterations);
    boolean converged = false;
    boolean factorizationFailed = false;
    int performed = 0;

    for (int iter = 0; iter < iterations; iter++) {
      double[] main = new double[n];
      for (int i = 0; i < n; i++) {
        main[i] = weights[i] + penalty[0][i];
      }

      PentadiagonalCholesky cholesky;
      try {
        cholesky = factorize(main, penalty[1], penalty[2]);
      } catch (NonPositiveDefiniteMatrixException e) {
        LOGGER.debug("Factorization failed on iteration %d: %s", iter + 1, e.getMessage());
        factorizationFailed = true;
        break;
      }

      double[] rhs = new double[n];
      for (int i = 0; i < n; i++) {
        rhs[i] = weights[i] * y[i];
      }
      estimate = cholesky.solve(rhs);
      performed++;

      double change = 0.0;
      for (int i = 0; i < n; i++) {
        double w = y[i] > estimate[i] ? asymmetry : 1.0 - asymmetry;
        change += Math.abs(w - weights[i]);
        weights[i] = w;
      }
      change /= n;
      weightChanges.add(change);

      if (change <= convergence) {
        converged = true;
        break;
      }
    }

    return new SolverResult(estimate, performed, weightChanges, converged, factorizationFailed);
  }

  /**
   * Factorizes {@code W + s·DᵗD} from its main diagonal and the penalty's two sub-diagonals.
   * @throws NonPositiveDefiniteMatrixException if a pivot is not positive.
   */
  protected PentadiagonalCholesky factorize(double[] main, double[] first, double[] second) {
    return new PentadiagonalCholesky(main, first, second);
  }

  /**
   * Builds the three distinct diagonals of {@code s·DᵗD}, D being the (n-2)×n second-difference operator.
   * @return {main, first sub-diagonal, second sub-diagonal}; sub-diagonal entry i couples row i with i-1 (i-2).
   */
  static double[][] secondDifferencePenalty(int n, double s) {
    double[] main = new double[n];
    double[] first = new double[n];
    double[] second = new double[n];
    final double[] coefficients = {1.0, -2.0, 1.0};
    for (int k = 0; k + 2 < n; k++) {
      for (int p = 0; p < 3; p++) {
        main[k + p] += s * coefficients[p] * coefficients[p];
      }
      first[k + 1] += s * coefficients[1] * coefficients[0];
      first[k + 2] += s * coefficients[2] * coefficients[1];
      second[k + 2] += s * coefficients[2] * coefficients[0];
    }
    return new double[][] {main, first, second};
  }
}
