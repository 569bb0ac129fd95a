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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class AlignmentOptions {
  public static final int DEFAULT_ITERATIONS = 50;
  public static final double DEFAULT_CONVERGENCE = 1e-5;

  @JsonProperty("iterations")
  private final int iterations;

  @JsonProperty("convergence")
  private final double convergence;

  public AlignmentOptions() {
    this(null, null);
  }

  @JsonCreator
  public AlignmentOptions(@JsonProperty("iterations") Integer iterations,
                          @JsonProperty("convergence") Double convergence) {
    this.iterations = Math.max(1, iterations == null ? DEFAULT_ITERATIONS : iterations);
    double c = convergence == null ? DEFAULT_CONVERGENCE : convergence;
    this.convergence = Double.isNaN(c) || c < 0.0 ? 0.0 : c;
  }

  public int getIterations() {
    return iterations;
  }

  public double getConvergence() {
    return convergence;
  }
}
