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

public class CentroidOptions {
  public static final int DEFAULT_ITERATIONS = 10;
  public static final double DEFAULT_TOLERANCE = 1.0;
  public static final double DEFAULT_BLOCK_SIZE = 10e6;

  public static final double MIN_TOLERANCE = 1e-9;
  public static final double MAX_TOLERANCE = 100.0;
  public static final double MIN_BLOCK_SIZE = 1e3;

  // Maximum number of merge sweeps.
  @JsonProperty("iterations")
  private final int iterations;

  // Largest m/z gap across which two adjacent channels may merge.
  @JsonProperty("tolerance")
  private final double tolerance;

  // Approximate number of bytes of intensity data handled per block.
  @JsonProperty("block_size")
  private final double blockSize;

  public CentroidOptions() {
    this(null, null, null);
  }

  @JsonCreator
  public CentroidOptions(@JsonProperty("iterations") Integer iterations,
                         @JsonProperty("tolerance") Double tolerance,
                         @JsonProperty("block_size") Double blockSize) {
    this.iterations = Math.max(1, iterations == null ? DEFAULT_ITERATIONS : iterations);

    double tol = tolerance == null ? DEFAULT_TOLERANCE : tolerance;
    if (Double.isNaN(tol) || tol <= 0.0) {
      tol = MIN_TOLERANCE;
    } else if (tol >= MAX_TOLERANCE) {
      tol = MAX_TOLERANCE;
    }
    this.tolerance = tol;

    double block = blockSize == null ? DEFAULT_BLOCK_SIZE : blockSize;
    this.blockSize = Double.isNaN(block) || block <= MIN_BLOCK_SIZE ? MIN_BLOCK_SIZE : block;
  }

  public int getIterations() {
    return iterations;
  }

  public double getTolerance() {
    return tolerance;
  }

  public double getBlockSize() {
    return blockSize;
  }
}
