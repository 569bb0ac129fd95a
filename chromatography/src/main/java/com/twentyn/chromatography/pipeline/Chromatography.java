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

import com.twentyn.chromatography.concurrent.CancellationFlag;
import com.twentyn.chromatography.concurrent.ColumnWorkerPool;
import com.twentyn.chromatography.model.AlignmentMap;
import com.twentyn.chromatography.model.ChromatogramSample;
import com.twentyn.chromatography.model.IntensityMatrix;
import com.twentyn.chromatography.model.MassChannelMatrix;
import com.twentyn.chromatography.model.Peak;
import com.twentyn.chromatography.model.PeakTable;
import com.twentyn.chromatography.model.Selection;
import com.twentyn.chromatography.model.Signal;
import com.twentyn.chromatography.peaks.PeakFitter;
import com.twentyn.chromatography.peaks.PeakOptions;
import com.twentyn.chromatography.preprocessing.Aligner;
import com.twentyn.chromatography.preprocessing.Baseline;
import com.twentyn.chromatography.preprocessing.Centroid;
import com.twentyn.chromatography.preprocessing.Smoother;
import org.apache.commons.math3.util.Precision;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Sample level processing: baseline estimation, smoothing, centroiding, peak integration and alignment of whole
 * {@link ChromatogramSample}s, with a {@link Selection} choosing the trace(s) to work on.
 *
 * Baselines are stored next to the raw intensities and subtracted at integration time.  Smoothing and centroiding
 * replace intensities, which discards results computed from the old values.  Column work runs on a shared
 * {@link ColumnWorkerPool}; close the facade to release it.
 */
public class Chromatography implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Chromatography.class);

  private final ProcessingConfig config;
  private final ColumnWorkerPool pool;
  private final boolean ownsPool;

  private final Baseline baseline;
  private final Smoother smoother;
  private final Centroid centroid;
  private final Aligner aligner;

  public Chromatography() {
    this(new ProcessingConfig());
  }

  public Chromatography(ProcessingConfig config) {
    this(config, new ColumnWorkerPool(config.getWorkers()), true);
  }

  public Chromatography(ProcessingConfig config, ColumnWorkerPool pool) {
    this(config, pool, false);
  }

  private Chromatography(ProcessingConfig config, ColumnWorkerPool pool, boolean ownsPool) {
    this.config = config;
    this.pool = pool;
    this.ownsPool = ownsPool;
    this.baseline = new Baseline(config.getBaseline());
    this.smoother = new Smoother(config.getSmoothing());
    this.centroid = new Centroid(config.getCentroid());
    this.aligner = new Aligner(config.getAlignment());
  }

  public ProcessingConfig getConfig() {
    return config;
  }

  public ChromatogramSample baseline(ChromatogramSample sample, Selection selection) {
    return baseline(sample, selection, CancellationFlag.none());
  }

  /**
   * Estimates and stores the baseline of the selected trace(s).  Mass channels outside the selection keep whatever
   * baseline they had (zero if none was computed).
   */
  public ChromatogramSample baseline(ChromatogramSample sample, Selection selection, CancellationFlag cancellation) {
    if (selection.getKind() == Selection.Kind.TOTAL_INTENSITY) {
      double[] estimate = baseline.transform(IntensityMatrix.fromColumns(sample.getTotalIntensity())).getColumn(0);
      return sample.withTotalIntensityBaseline(estimate);
    }

    MassChannelMatrix channels = requireMassChannels(sample);
    int[] columns = resolve(selection, channels);
    LOGGER.info("Computing baselines for %d of %d mass channels of '%s'",
        columns.length, channels.getChannelCount(), sample.getName());
    IntensityMatrix estimate = baseline.transform(
        channels.getIntensities().selectColumns(columns), pool, cancellation);

    IntensityMatrix existing = sample.getMassChannelBaseline() == null ?
        IntensityMatrix.zeros(channels.getScanCount(), channels.getChannelCount()) : sample.getMassChannelBaseline();
    return sample.withMassChannelBaseline(replaceColumns(existing, columns, estimate));
  }

  public ChromatogramSample smooth(ChromatogramSample sample, Selection selection) {
    return smooth(sample, selection, CancellationFlag.none());
  }

  /**
   * Replaces the selected trace(s) by their smoothed version.
   */
  public ChromatogramSample smooth(ChromatogramSample sample, Selection selection, CancellationFlag cancellation) {
    if (selection.getKind() == Selection.Kind.TOTAL_INTENSITY) {
      double[] smoothed = smoother.transform(IntensityMatrix.fromColumns(sample.getTotalIntensity())).getColumn(0);
      return sample.withTotalIntensity(smoothed);
    }

    MassChannelMatrix channels = requireMassChannels(sample);
    int[] columns = resolve(selection, channels);
    LOGGER.info("Smoothing %d of %d mass channels of '%s'",
        columns.length, channels.getChannelCount(), sample.getName());
    IntensityMatrix smoothed = smoother.transform(channels.getIntensities().selectColumns(columns), pool, cancellation);
    return sample.withMassChannels(new MassChannelMatrix(
        channels.getMz(), replaceColumns(channels.getIntensities(), columns, smoothed)));
  }

  public ChromatogramSample centroid(ChromatogramSample sample) {
    return centroid(sample, CancellationFlag.none());
  }

  /**
   * Rounds the masses to the configured precision and merges fragmented mass channels.
   */
  public ChromatogramSample centroid(ChromatogramSample sample, CancellationFlag cancellation) {
    MassChannelMatrix channels = requireMassChannels(sample);
    MassChannelMatrix centroided = centroid.centroid(channels.roundMasses(config.getMzPrecision()), pool, cancellation);
    LOGGER.info("Centroided '%s' from %d to %d mass channels",
        sample.getName(), channels.getChannelCount(), centroided.getChannelCount());
    return sample.withMassChannels(centroided);
  }

  public ChromatogramSample integrate(ChromatogramSample sample, Selection selection, PeakTable.MergeMode mode) {
    return integrate(sample, selection, config.getPeaks(), mode, CancellationFlag.none());
  }

  /**
   * Fits one peak per selected trace and records it in the sample's peak table.  A stored baseline is subtracted
   * before fitting.
   * @param hints Where to look for the peak.
   * @param mode How the new peaks combine with the ones already recorded.
   */
  public ChromatogramSample integrate(ChromatogramSample sample, Selection selection, PeakOptions hints,
                                      PeakTable.MergeMode mode, CancellationFlag cancellation) {
    PeakFitter fitter = new PeakFitter(hints);
    double[] time = sample.getTime();

    if (selection.getKind() == Selection.Kind.TOTAL_INTENSITY) {
      double[] y = sample.getTotalIntensity();
      double[] stored = sample.getTotalIntensityBaseline();
      if (stored != null) {
        for (int i = 0; i < y.length; i++) {
          y[i] -= stored[i];
        }
      }
      List<Peak> peaks = fitter.fit(Signal.of(time, y));
      LOGGER.debug("Total intensity peak of '%s': %s", sample.getName(), peaks.get(0));
      return sample.withTotalIntensityPeaks(sample.getTotalIntensityPeaks().merge(new int[] {0}, peaks, mode));
    }

    MassChannelMatrix channels = requireMassChannels(sample);
    int[] columns = resolve(selection, channels);
    IntensityMatrix y = channels.getIntensities().selectColumns(columns);
    if (sample.getMassChannelBaseline() != null) {
      y = y.subtract(sample.getMassChannelBaseline().selectColumns(columns));
    }
    List<Peak> peaks = fitter.fit(new Signal(time, y), pool, cancellation);

    int found = 0;
    for (Peak peak : peaks) {
      if (!peak.isEmpty()) {
        found++;
      }
    }
    LOGGER.info("Integrated %d of %d selected mass channels of '%s'", found, columns.length, sample.getName());
    return sample.withMassChannelPeaks(sample.getMassChannelPeaks().merge(columns, peaks, mode));
  }

  public List<AlignmentMap> align(List<ChromatogramSample> samples, int reference) {
    return align(samples, reference, CancellationFlag.none());
  }

  /**
   * Aligns the total intensity trace of every sample to that of {@code samples.get(reference)}.
   * @return One map per sample, in order; the reference maps onto itself.
   */
  public List<AlignmentMap> align(List<ChromatogramSample> samples, int reference, CancellationFlag cancellation) {
    if (reference < 0 || reference >= samples.size()) {
      throw new IllegalArgumentException(String.format(
          "Reference sample %d is out of range [0, %d)", reference, samples.size()));
    }
    List<double[]> traces = new ArrayList<>(samples.size());
    for (ChromatogramSample sample : samples) {
      traces.add(sample.getTotalIntensity());
    }
    return aligner.align(traces.get(reference), traces, pool, cancellation);
  }

  /**
   * Names mass channels by their m/z rounded to the configured precision, so they can be selected by name.
   */
  public List<String> channelNames(MassChannelMatrix channels) {
    double[] mz = channels.getMz();
    List<String> names = new ArrayList<>(mz.length);
    for (double m : mz) {
      names.add(String.valueOf(Precision.round(m, config.getMzPrecision())));
    }
    return names;
  }

  @Override
  public void close() {
    if (ownsPool) {
      pool.close();
    }
  }

  private int[] resolve(Selection selection, MassChannelMatrix channels) {
    return selection.resolve(channels.getChannelCount(), channelNames(channels));
  }

  private static MassChannelMatrix requireMassChannels(ChromatogramSample sample) {
    if (!sample.hasMassChannels()) {
      throw new IllegalArgumentException(String.format(
          "Sample '%s' has no mass channels to select from", sample.getName()));
    }
    return sample.getMassChannels();
  }

  private static IntensityMatrix replaceColumns(IntensityMatrix target, int[] columns, IntensityMatrix replacement) {
    double[][] updated = target.toColumnArrays();
    for (int i = 0; i < columns.length; i++) {
      updated[columns[i]] = replacement.getColumn(i);
    }
    return IntensityMatrix.withRowCount(target.getRowCount(), updated);
  }
}
