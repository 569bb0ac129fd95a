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

package com.twentyn.chromatography.preprocessing;

import com.twentyn.chromatography.linalg.PenalizedLeastSquaresSolver;
import com.twentyn.chromatography.linalg.SolverResult;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Asymmetric least squares baseline estimate, one column at a time.  The result is the baseline itself; callers
 * subtract it (or store it next to the raw data).
 */
public class Baseline extends ColumnTransform {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Baseline.class);

  private final BaselineOptions options;
  private final PenalizedLeastSquaresSolver solver;

  public Baseline() {
    this(new BaselineOptions());
  }

  public Baseline(BaselineOptions options) {
    this(options, options.toSolver());
  }

  Baseline(BaselineOptions options, PenalizedLeastSquaresSolver solver) {
    this.options = options;
    this.solver = solver;
  }

  public BaselineOptions getOptions() {
    return options;
  }

  /**
   * Estimates the baseline of one column.
   * @param y The column intensities; not modified.
   * @return A non-negative baseline with as many points as {@code y}.
   */
  @Override
  public double[] transformColumn(double[] y) {
    final int n = y.length;
    if (n < PenalizedLeastSquaresSolver.MIN_POINTS) {
      LOGGER.debug("Column of %d points is too short for a baseline, returning zeros", n);
      return new double[n];
    }

    // Spikes above one standard deviation are replaced by the mean so they do not drag the fit up.
    double mean = StatUtils.mean(y);
    double std = FastMath.sqrt(StatUtils.variance(y, mean));
    double[] clipped = y.clone();
    for (int i = 0; i < n; i++) {
      if (Math.abs(clipped[i]) > mean + std) {
        clipped[i] = mean;
      }
    }

    SolverResult result = solver.solve(clipped);
    if (result.isFactorizationFailed()) {
      LOGGER.warn("Baseline factorization failed after %d iterations", result.getIterations());
    }
    if (!result.hasEstimate()) {
      return new double[n];
    }

    double[] baseline = result.getEstimate();
    for (int i = 0; i < n; i++) {
      if (baseline[i] < 0.0 || Double.isNaN(baseline[i])) {
        baseline[i] = 0.0;
      }
    }
    return baseline;
  }

  @Override
  protected double[] degenerateColumn(double[] y) {
    return new double[y.length];
  }
}
