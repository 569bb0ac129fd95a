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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.chromatography.linalg.PenalizedLeastSquaresSolver;

/**
 * Parameters shared by the baseline and smoothing passes.  Values are clamped in the constructor; missing values
 * (null) take the subclass defaults.
 */
public abstract class PenalizedLeastSquaresOptions {
  @JsonProperty("smoothness")
  private final double smoothness;

  @JsonProperty("asymmetry")
  private final double asymmetry;

  @JsonProperty("iterations")
  private final int iterations;

  @JsonProperty("convergence")
  private final double convergence;

  protected PenalizedLeastSquaresOptions(Double smoothness, Double asymmetry, Integer iterations, Double convergence,
                                         double defaultSmoothness, double defaultAsymmetry,
                                         int defaultIterations, double defaultConvergence) {
    this.smoothness = PenalizedLeastSquaresSolver.clampSmoothness(
        smoothness == null ? defaultSmoothness : smoothness);
    this.asymmetry = PenalizedLeastSquaresSolver.clampAsymmetry(
        asymmetry == null ? defaultAsymmetry : asymmetry);
    this.iterations = Math.max(1, iterations == null ? defaultIterations : iterations);
    double c = convergence == null ? defaultConvergence : convergence;
    this.convergence = Double.isNaN(c) || c < 0.0 ? 0.0 : c;
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

  public PenalizedLeastSquaresSolver toSolver() {
    return new PenalizedLeastSquaresSolver(smoothness, asymmetry, iterations, convergence);
  }

  @Override
  public String toString() {
    return String.format("%s{smoothness=%g, asymmetry=%g, iterations=%d, convergence=%g}",
        getClass().getSimpleName(), smoothness, asymmetry, iterations, convergence);
  }
}
