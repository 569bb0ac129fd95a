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

import com.twentyn.chromatography.concurrent.CancellationFlag;
import com.twentyn.chromatography.concurrent.ColumnWorkerPool;
import com.twentyn.chromatography.model.IntensityMatrix;
import com.twentyn.chromatography.model.MassChannelMatrix;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses fragmented m/z bins.  Importers often spread one mass over several adjacent channels that are each only
 * populated in some scans; the sparser channel is folded into its denser neighbour and channels left empty are
 * dropped.
 *
 * Large matrices are processed in blocks of adjacent channels.  Only adjacent channels within the tolerance ever
 * interact, block boundaries are only placed across larger gaps, and every block runs the same number of sweeps, so
 * the blocked result equals the one computed on the whole matrix.
 */
public class Centroid {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Centroid.class);

  private static final int BYTES_PER_VALUE = Double.BYTES;
  private static final int FALLBACK_BLOCK_WIDTH = 3;

  private final CentroidOptions options;

  public Centroid() {
    this(new CentroidOptions());
  }

  public Centroid(CentroidOptions options) {
    this.options = options;
  }

  public CentroidOptions getOptions() {
    return options;
  }

  /**
   * Centroids on the calling thread.
   */
  public MassChannelMatrix centroid(MassChannelMatrix input) {
    if (isTooSmall(input)) {
      return copyOf(input);
    }
    List<Pair<double[], double[][]>> state = split(input);

    int removed = 1;
    int sweeps = 0;
    while (removed != 0 && sweeps < options.getIterations()) {
      int before = channelCount(state);
      int first = firstOccupied(state);
      int last = lastOccupied(state);
      for (int b = 0; b < state.size(); b++) {
        state.set(b, sweep(state.get(b), b != first, b != last));
      }
      removed = before - channelCount(state);
      sweeps++;
    }
    return concatenate(state, input.getScanCount());
  }

  /**
   * Centroids with one pool task per block and sweep.  The result is identical to
   * {@link #centroid(MassChannelMatrix)}.
   */
  public MassChannelMatrix centroid(MassChannelMatrix input, ColumnWorkerPool pool, CancellationFlag cancellation) {
    if (isTooSmall(input)) {
      return copyOf(input);
    }
    final List<Pair<double[], double[][]>> state = split(input);

    int removed = 1;
    int sweeps = 0;
    while (removed != 0 && sweeps < options.getIterations()) {
      int before = channelCount(state);
      final int first = firstOccupied(state);
      final int last = lastOccupied(state);
      // A block that failed keeps its channels as they were before this sweep.
      List<Pair<double[], double[][]>> swept = pool.map(state.size(),
          block -> sweep(state.get(block), block != first, block != last), state::get, cancellation);
      for (int b = 0; b < state.size(); b++) {
        state.set(b, swept.get(b));
      }
      removed = before - channelCount(state);
      sweeps++;
    }
    return concatenate(state, input.getScanCount());
  }

  private boolean isTooSmall(MassChannelMatrix input) {
    return input.getChannelCount() < 3 || input.getScanCount() <= 1;
  }

  private MassChannelMatrix copyOf(MassChannelMatrix input) {
    return new MassChannelMatrix(input.getMz(), IntensityMatrix.withRowCount(
        input.getScanCount(), input.getIntensities().toColumnArrays()));
  }

  private List<Pair<double[], double[][]>> split(MassChannelMatrix input) {
    double[] mz = input.getMz();
    double[][] columns = input.getIntensities().toColumnArrays();
    List<int[]> blocks = blocks(mz, input.getScanCount());

    List<Pair<double[], double[][]>> state = new ArrayList<>(blocks.size());
    for (int[] block : blocks) {
      double[][] y = new double[block[1] - block[0]][];
      System.arraycopy(columns, block[0], y, 0, y.length);
      state.add(Pair.of(ArrayUtils.subarray(mz, block[0], block[1]), y));
    }
    return state;
  }

  /**
   * Splits the channel range into [from, to) blocks of roughly {@code blockSize} bytes each.  A boundary is only
   * placed where the gap to the next mass exceeds the tolerance, so no two channels that could merge are ever in
   * different blocks.  Identical masses are never separated.
   */
  List<int[]> blocks(double[] mz, int rows) {
    final int n = mz.length;
    final double tolerance = options.getTolerance();
    int width = (int) Math.floor(options.getBlockSize() / ((double) rows * BYTES_PER_VALUE));
    if (width <= 0) {
      width = FALLBACK_BLOCK_WIDTH;
    }

    List<int[]> blocks = new ArrayList<>();
    int from = 0;
    while (from < n) {
      int to = (int) Math.min((long) from + width, n);
      while (to < n && mz[to] - mz[to - 1] <= tolerance) {
        to++;
      }
      blocks.add(new int[] {from, to});
      from = to;
    }
    LOGGER.debug("Centroiding %d channels x %d scans in %d blocks of up to %d channels", n, rows, blocks.size(), width);
    return blocks;
  }

  /**
   * Runs one merge sweep over a block and drops the channels it emptied.  The block's arrays are only read.
   *
   * @param receiveFirst whether the block's first channel is interior to the whole mass axis.
   * @param receiveLast whether the block's last channel is interior to the whole mass axis.
   */
  Pair<double[], double[][]> sweep(Pair<double[], double[][]> block, boolean receiveFirst, boolean receiveLast) {
    double[] x = block.getLeft();
    double[][] y = new double[x.length][];
    for (int c = 0; c < y.length; c++) {
      y[c] = block.getRight()[c].clone();
    }

    final double tolerance = options.getTolerance();
    final int n = y.length;
    final int start = receiveFirst ? 0 : 1;
    final int end = receiveLast ? n : n - 1;
    for (int i = start; i < end; i++) {
      boolean[] zeroHere = zeroMask(y[i]);
      int zerosHere = count(zeroHere);

      if (i + 1 < n && x[i + 1] - x[i] <= tolerance) {
        boolean[] zeroRight = zeroMask(y[i + 1]);
        if (zerosHere < count(zeroRight)) {
          moveInto(y[i], y[i + 1], zeroHere, zeroRight);
        }
      }
      // Masks for this channel are the ones taken before the right-hand merge.
      if (i > 0 && x[i] - x[i - 1] <= tolerance) {
        boolean[] zeroLeft = zeroMask(y[i - 1]);
        if (zerosHere < count(zeroLeft)) {
          moveInto(y[i], y[i - 1], zeroHere, zeroLeft);
        }
      }
    }

    List<Integer> keep = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      if (!isAllZero(y[i])) {
        keep.add(i);
      }
    }
    double[] keptX = new double[keep.size()];
    double[][] keptY = new double[keep.size()][];
    for (int k = 0; k < keep.size(); k++) {
      keptX[k] = x[keep.get(k)];
      keptY[k] = y[keep.get(k)];
    }
    return Pair.of(keptX, keptY);
  }

  private static int channelCount(List<Pair<double[], double[][]>> state) {
    int total = 0;
    for (Pair<double[], double[][]> block : state) {
      total += block.getLeft().length;
    }
    return total;
  }

  private static int firstOccupied(List<Pair<double[], double[][]>> state) {
    for (int b = 0; b < state.size(); b++) {
      if (state.get(b).getLeft().length > 0) {
        return b;
      }
    }
    return -1;
  }

  private static int lastOccupied(List<Pair<double[], double[][]>> state) {
    for (int b = state.size() - 1; b >= 0; b--) {
      if (state.get(b).getLeft().length > 0) {
        return b;
      }
    }
    return -1;
  }

  // Rows where exactly one of the two channels is empty move from the neighbour into the target.
  private static void moveInto(double[] target, double[] neighbour, boolean[] zeroTarget, boolean[] zeroNeighbour) {
    for (int r = 0; r < target.length; r++) {
      if (zeroTarget[r] != zeroNeighbour[r]) {
        target[r] += neighbour[r];
        neighbour[r] = 0.0;
      }
    }
  }

  private static boolean[] zeroMask(double[] column) {
    boolean[] mask = new boolean[column.length];
    for (int r = 0; r < column.length; r++) {
      mask[r] = column[r] == 0.0;
    }
    return mask;
  }

  private static int count(boolean[] mask) {
    int c = 0;
    for (boolean b : mask) {
      if (b) {
        c++;
      }
    }
    return c;
  }

  private static boolean isAllZero(double[] column) {
    for (double v : column) {
      if (v != 0.0) {
        return false;
      }
    }
    return true;
  }

  private static MassChannelMatrix concatenate(List<Pair<double[], double[][]>> blocks, int rows) {
    double[] mz = new double[0];
    List<double[]> columns = new ArrayList<>();
    for (Pair<double[], double[][]> block : blocks) {
      mz = ArrayUtils.addAll(mz, block.getLeft());
      for (double[] column : block.getRight()) {
        columns.add(column);
      }
    }
    return new MassChannelMatrix(mz,
        IntensityMatrix.withRowCount(rows, columns.toArray(new double[columns.size()][])));
  }
}
