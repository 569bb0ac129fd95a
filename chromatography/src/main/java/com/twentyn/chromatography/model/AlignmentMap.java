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

/**
 * A monotonic correspondence between the points of a reference signal and a sample signal, as two equal-length,
 * 0-based index sequences.  {@code referenceIndices[k]} in the reference lines up with {@code sampleIndices[k]} in
 * the sample.
 */
public class AlignmentMap {
  @JsonProperty("reference_indices")
  private final int[] referenceIndices;

  @JsonProperty("sample_indices")
  private final int[] sampleIndices;

  @JsonCreator
  public AlignmentMap(@JsonProperty("reference_indices") int[] referenceIndices,
                      @JsonProperty("sample_indices") int[] sampleIndices) {
    if (referenceIndices == null || sampleIndices == null) {
      throw new IllegalArgumentException("Alignment index sequences must not be null");
    }
    if (referenceIndices.length != sampleIndices.length) {
      throw new IllegalArgumentException(String.format(
          "Alignment index sequences differ in length: %d reference vs %d sample",
          referenceIndices.length, sampleIndices.length));
    }
    this.referenceIndices = referenceIndices.clone();
    this.sampleIndices = sampleIndices.clone();
  }

  public int[] getReferenceIndices() {
    return referenceIndices.clone();
  }

  public int[] getSampleIndices() {
    return sampleIndices.clone();
  }

  @JsonIgnore
  public int size() {
    return referenceIndices.length;
  }

  /**
   * Resamples a sample trace onto the reference points covered by this map.  Reference points that no sample point
   * maps to keep a value of zero.
   * @param sample The sample intensities this map was computed for.
   * @param referenceLength The length of the reference signal.
   * @return The sample intensities indexed like the reference.
   */
  public double[] resample(double[] sample, int referenceLength) {
    double[] resampled = new double[referenceLength];
    for (int k = 0; k < referenceIndices.length; k++) {
      int r = referenceIndices[k];
      int s = sampleIndices[k];
      if (r >= 0 && r < referenceLength && s >= 0 && s < sample.length) {
        resampled[r] = sample[s];
      }
    }
    return resampled;
  }
}
