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

import java.util.Collections;
import java.util.List;

/**
 * Output of one {@link PenalizedLeastSquaresSolver#solve(double[])} call.
 */
public class SolverResult {
  private final double[] estimate;
  private final int iterations;
  private final List<Double> weightChanges;
  private final boolean converged;
  private final boolean factorizationFailed;

  SolverResult(double[] estimate, int iterations, List<Double> weightChanges,
               boolean converged, boolean factorizationFailed) {
    this.estimate = estimate;
    this.iterations = iterations;
    this.weightChanges = Collections.unmodifiableList(weightChanges);
    this.converged = converged;
    this.factorizationFailed = factorizationFailed;
  }

  /**
   * @return True if at least one solve completed.  False only when the very first factorization failed.
   */
  public boolean hasEstimate() {
    return estimate != null;
  }

  /**
   * @return The fitted curve from the last successful iteration, or null if there was none.
   */
  public double[] getEstimate() {
    return estimate == null ? null : estimate.clone();
  }

  public int getIterations() {
    return iterations;
  }

  /**
   * @return The mean absolute weight change after each completed iteration.
   */
  public List<Double> getWeightChanges() {
    return weightChanges;
  }

  public boolean isConverged() {
    return converged;
  }

  public boolean isFactorizationFailed() {
    return factorizationFailed;
  }
}
