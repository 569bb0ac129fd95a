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

package com.twentyn.chromatography.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.util.Precision;

/**
 * An m/z axis paired with an intensity matrix whose columns are the mass channels (rows are scans).  The number of
 * intensity columns always equals the length of the m/z axis.  The m/z values need not be unique: fragmented bins of
 * the same mass appear as duplicate, adjacent entries until they are centroided.
 */
public class MassChannelMatrix {
  public static final int DEFAULT_MZ_PRECISION = 3;

  @JsonProperty("mz")
  private final double[] mz;

  @JsonProperty("intensities")
  private final IntensityMatrix intensities;

  @JsonCreator
  public MassChannelMatrix(@JsonProperty("mz") double[] mz,
                           @JsonProperty("intensities") IntensityMatrix intensities) {
    if (mz == null) {
      throw new IllegalArgumentException("Mass axis must not be null");
    }
    if (intensities == null) {
      throw new IllegalArgumentException("Mass channel intensities must not be null");
    }
    if (mz.length != intensities.getColumnCount()) {
      throw new IllegalArgumentException(String.format(
          "Mass axis has %d values but the intensity matrix has %d columns", mz.length, intensities.getColumnCount()));
    }
    this.mz = mz.clone();
    this.intensities = intensities;
  }

  public double[] getMz() {
    return mz.clone();
  }

  public IntensityMatrix getIntensities() {
    return intensities;
  }

  @JsonIgnore
  public int getChannelCount() {
    return mz.length;
  }

  @JsonIgnore
  public int getScanCount() {
    return intensities.getRowCount();
  }

  /**
   * Rounds every m/z value to a fixed number of decimals.  Centroiding assumes quantized masses, so importers call
   * this before handing the matrix over.
   * @param decimals The number of decimal places to keep; negative values are treated as 0.
   * @return A new matrix with rounded masses and the same intensities.
   */
  public MassChannelMatrix roundMasses(int decimals) {
    int places = Math.max(0, decimals);
    double[] rounded = new double[mz.length];
    for (int i = 0; i < mz.length; i++) {
      rounded[i] = Precision.round(mz[i], places);
    }
    return new MassChannelMatrix(rounded, intensities);
  }
}
