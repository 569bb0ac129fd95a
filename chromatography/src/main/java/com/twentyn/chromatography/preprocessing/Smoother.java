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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Penalized least squares smoothing.  Same solver as {@link Baseline}, tuned for a gentle, near-symmetric fit; no
 * spike clipping and no clamping, so smoothed values may dip below the raw minimum.
 */
public class Smoother extends ColumnTransform {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Smoother.class);

  private final SmoothingOptions options;
  private final PenalizedLeastSquaresSolver solver;

  public Smoother() {
    this(new SmoothingOptions());
  }

  public Smoother(SmoothingOptions options) {
    this(options, options.toSolver());
  }

  Smoother(SmoothingOptions options, PenalizedLeastSquaresSolver solver) {
    this.options = options;
    this.solver = solver;
  }

  public SmoothingOptions getOptions() {
    return options;
  }

  @Override
  public double[] transformColumn(double[] y) {
    if (y.length < PenalizedLeastSquaresSolver.MIN_POINTS) {
      LOGGER.debug("Column of %d points is too short to smooth, returning it unchanged", y.length);
      return y.clone();
    }

    SolverResult result = solver.solve(y);
    if (!result.hasEstimate()) {
      LOGGER.warn("Smoothing factorization failed before the first solve, returning the column unchanged");
      return y.clone();
    }
    return result.getEstimate();
  }

  @Override
  protected double[] degenerateColumn(double[] y) {
    return y.clone();
  }
}
