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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;

/**
 * One imported chromatography run: a time axis (minutes), the total intensity trace and, for MS data, the mass
 * channel matrix.  Processing results (baselines, peak tables) travel with the sample but never overwrite the raw
 * intensities.  Instances are immutable; the {@code with...} methods return updated copies.
 */
public class ChromatogramSample {
  @JsonProperty("name")
  private final String name;

  @JsonProperty("time")
  private final double[] time;

  @JsonProperty("total_intensity")
  private final double[] totalIntensity;

  @JsonProperty("mass_channels")
  private final MassChannelMatrix massChannels;

  @JsonProperty("total_intensity_baseline")
  private final double[] totalIntensityBaseline;

  @JsonProperty("mass_channel_baseline")
  private final IntensityMatrix massChannelBaseline;

  @JsonProperty("total_intensity_peaks")
  private final PeakTable totalIntensityPeaks;

  @JsonProperty("mass_channel_peaks")
  private final PeakTable massChannelPeaks;

  public ChromatogramSample(String name, double[] time, double[] totalIntensity, MassChannelMatrix massChannels) {
    this(name, time, totalIntensity, massChannels, null, null, new PeakTable(), new PeakTable());
  }

  @JsonCreator
  public ChromatogramSample(@JsonProperty("name") String name,
                            @JsonProperty("time") double[] time,
                            @JsonProperty("total_intensity") double[] totalIntensity,
                            @JsonProperty("mass_channels") MassChannelMatrix massChannels,
                            @JsonProperty("total_intensity_baseline") double[] totalIntensityBaseline,
                            @JsonProperty("mass_channel_baseline") IntensityMatrix massChannelBaseline,
                            @JsonProperty("total_intensity_peaks") PeakTable totalIntensityPeaks,
                            @JsonProperty("mass_channel_peaks") PeakTable massChannelPeaks) {
    if (time == null || totalIntensity == null) {
      throw new IllegalArgumentException(String.format(
          "Sample '%s' needs both a time axis and a total intensity trace", name));
    }
    // Validates the time axis as a side effect.
    Signal.of(time, totalIntensity);
    if (massChannels != null && massChannels.getScanCount() != time.length) {
      throw new IllegalArgumentException(String.format(
          "Sample '%s' has %d time points but %d mass channel scans", name, time.length, massChannels.getScanCount()));
    }
    if (totalIntensityBaseline != null && totalIntensityBaseline.length != time.length) {
      throw new IllegalArgumentException(String.format(
          "Sample '%s' total intensity baseline has %d points, expected %d",
          name, totalIntensityBaseline.length, time.length));
    }
    if (massChannelBaseline != null &&
        (massChannels == null || !massChannelBaseline.sameShape(massChannels.getIntensities()))) {
      throw new IllegalArgumentException(String.format(
          "Sample '%s' mass channel baseline does not match the mass channel matrix", name));
    }
    this.name = name;
    this.time = time.clone();
    this.totalIntensity = totalIntensity.clone();
    this.massChannels = massChannels;
    this.totalIntensityBaseline = totalIntensityBaseline == null ? null : totalIntensityBaseline.clone();
    this.massChannelBaseline = massChannelBaseline;
    this.totalIntensityPeaks = totalIntensityPeaks == null ? new PeakTable() : totalIntensityPeaks;
    this.massChannelPeaks = massChannelPeaks == null ? new PeakTable() : massChannelPeaks;
  }

  public String getName() {
    return name;
  }

  public double[] getTime() {
    return time.clone();
  }

  public double[] getTotalIntensity() {
    return totalIntensity.clone();
  }

  public MassChannelMatrix getMassChannels() {
    return massChannels;
  }

  public boolean hasMassChannels() {
    return massChannels != null;
  }

  public double[] getTotalIntensityBaseline() {
    return totalIntensityBaseline == null ? null : totalIntensityBaseline.clone();
  }

  public IntensityMatrix getMassChannelBaseline() {
    return massChannelBaseline;
  }

  public PeakTable getTotalIntensityPeaks() {
    return totalIntensityPeaks;
  }

  public PeakTable getMassChannelPeaks() {
    return massChannelPeaks;
  }

  /**
   * @return The total intensity trace as a single-column signal.
   */
  public Signal totalIntensitySignal() {
    return new Signal(time, IntensityMatrix.fromColumns(totalIntensity), Collections.singletonList("TIC"));
  }

  public ChromatogramSample withMassChannels(MassChannelMatrix replacement) {
    // A new mass axis invalidates a stored mass channel baseline and peak table.
    return new ChromatogramSample(name, time, totalIntensity, replacement,
        totalIntensityBaseline, null, totalIntensityPeaks, new PeakTable());
  }

  public ChromatogramSample withTotalIntensityBaseline(double[] baseline) {
    return new ChromatogramSample(name, time, totalIntensity, massChannels,
        baseline, massChannelBaseline, totalIntensityPeaks, massChannelPeaks);
  }

  public ChromatogramSample withMassChannelBaseline(IntensityMatrix baseline) {
    return new ChromatogramSample(name, time, totalIntensity, massChannels,
        totalIntensityBaseline, baseline, totalIntensityPeaks, massChannelPeaks);
  }

  public ChromatogramSample withTotalIntensityPeaks(PeakTable peaks) {
    return new ChromatogramSample(name, time, totalIntensity, massChannels,
        totalIntensityBaseline, massChannelBaseline, peaks, massChannelPeaks);
  }

  public ChromatogramSample withMassChannelPeaks(PeakTable peaks) {
    return new ChromatogramSample(name, time, totalIntensity, massChannels,
        totalIntensityBaseline, massChannelBaseline, totalIntensityPeaks, peaks);
  }

  public ChromatogramSample withTotalIntensity(double[] replacement) {
    return new ChromatogramSample(name, time, replacement, massChannels,
        null, massChannelBaseline, new PeakTable(), massChannelPeaks);
  }
}
