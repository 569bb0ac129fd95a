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

package com.twentyn.chromatography.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.chromatography.model.MassChannelMatrix;
import com.twentyn.chromatography.peaks.PeakOptions;
import com.twentyn.chromatography.preprocessing.AlignmentOptions;
import com.twentyn.chromatography.preprocessing.BaselineOptions;
import com.twentyn.chromatography.preprocessing.CentroidOptions;
import com.twentyn.chromatography.preprocessing.SmoothingOptions;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Every tunable of the processing pipeline in one place, loadable from JSON.  Sections that are absent get their
 * defaults; unknown keys are rejected so that typos do not silently fall back to defaults.
 *
 * <pre>
 * {
 *   "baseline":  {"smoothness": 1e6, "asymmetry": 1e-4, "iterations": 10, "convergence": 1e-4},
 *   "smoothing": {"smoothness": 0.5, "asymmetry": 0.5},
 *   "centroid":  {"iterations": 10, "tolerance": 1, "block_size": 10e6},
 *   "alignment": {"iterations": 50, "convergence": 1e-5},
 *   "peaks":     {"center": 12.4, "width": 0.5},
 *   "workers": 4,
 *   "mz_precision": 3
 * }
 * </pre>
 */
public class ProcessingConfig {
  public static final int MAX_MZ_PRECISION = 10;

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

  @JsonProperty("baseline")
  private final BaselineOptions baseline;

  @JsonProperty("smoothing")
  private final SmoothingOptions smoothing;

  @JsonProperty("centroid")
  private final CentroidOptions centroid;

  @JsonProperty("alignment")
  private final AlignmentOptions alignment;

  @JsonProperty("peaks")
  private final PeakOptions peaks;

  @JsonProperty("workers")
  private final int workers;

  @JsonProperty("mz_precision")
  private final int mzPrecision;

  public ProcessingConfig() {
    this(null, null, null, null, null, null, null);
  }

  @JsonCreator
  public ProcessingConfig(@JsonProperty("baseline") BaselineOptions baseline,
                          @JsonProperty("smoothing") SmoothingOptions smoothing,
                          @JsonProperty("centroid") CentroidOptions centroid,
                          @JsonProperty("alignment") AlignmentOptions alignment,
                          @JsonProperty("peaks") PeakOptions peaks,
                          @JsonProperty("workers") Integer workers,
                          @JsonProperty("mz_precision") Integer mzPrecision) {
    this.baseline = baseline == null ? new BaselineOptions() : baseline;
    this.smoothing = smoothing == null ? new SmoothingOptions() : smoothing;
    this.centroid = centroid == null ? new CentroidOptions() : centroid;
    this.alignment = alignment == null ? new AlignmentOptions() : alignment;
    this.peaks = peaks == null ? new PeakOptions() : peaks;
    this.workers = workers == null || workers <= 0 ? Runtime.getRuntime().availableProcessors() : workers;
    int precision = mzPrecision == null ? MassChannelMatrix.DEFAULT_MZ_PRECISION : mzPrecision;
    this.mzPrecision = Math.min(MAX_MZ_PRECISION, Math.max(0, precision));
  }

  public static ProcessingConfig load(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, ProcessingConfig.class);
  }

  public static ProcessingConfig load(InputStream in) throws IOException {
    return OBJECT_MAPPER.readValue(in, ProcessingConfig.class);
  }

  public ProcessingConfig withPeaks(PeakOptions replacement) {
    return new ProcessingConfig(baseline, smoothing, centroid, alignment, replacement, workers, mzPrecision);
  }

  public BaselineOptions getBaseline() {
    return baseline;
  }

  public SmoothingOptions getSmoothing() {
    return smoothing;
  }

  public CentroidOptions getCentroid() {
    return centroid;
  }

  public AlignmentOptions getAlignment() {
    return alignment;
  }

  public PeakOptions getPeaks() {
    return peaks;
  }

  public int getWorkers() {
    return workers;
  }

  public int getMzPrecision() {
    return mzPrecision;
  }
}
