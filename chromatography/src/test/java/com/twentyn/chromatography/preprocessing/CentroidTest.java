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
import org.junit.Test;

import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class CentroidTest {

  // Pairs of channels 0.2 apart splitting one mass: every scan lands in the dense (70%) or the sparse member.
  private static MassChannelMatrix fragmented(int pairs, int scans, long seed) {
    Random random = new Random(seed);
    double[] mz = new double[2 * pairs];
    double[][] columns = new double[2 * pairs][scans];
    for (int p = 0; p < pairs; p++) {
      mz[2 * p] = 100.0 + p * 5.0;
      mz[2 * p + 1] = 100.2 + p * 5.0;
      for (int r = 0; r < scans; r++) {
        int member = random.nextDouble() < 0.7 ? 2 * p : 2 * p + 1;
        columns[member][r] = 1.0 + random.nextInt(100);
      }
    }
    return new MassChannelMatrix(mz, IntensityMatrix.withRowCount(scans, columns));
  }

  private static double total(MassChannelMatrix m) {
    double sum = 0.0;
    for (double v : m.getIntensities().rowSums()) {
      sum += v;
    }
    return sum;
  }

  @Test
  public void testSparseNeighbourIsFoldedIntoDenseChannel() throws Exception {
    MassChannelMatrix input = new MassChannelMatrix(
        new double[] {50.0, 100.0, 100.5, 300.0},
        IntensityMatrix.fromColumns(
            new double[] {1, 1, 1, 1},
            new double[] {5, 0, 5, 0},
            new double[] {0, 3, 0, 0},
            new double[] {2, 2, 2, 2}));

    MassChannelMatrix output = new Centroid().centroid(input);

    assertArrayEquals("Fragment at 100.5 is dropped", new double[] {50.0, 100.0, 300.0}, output.getMz(), 0.0);
    assertArrayEquals("Channel at 50 is untouched", new double[] {1, 1, 1, 1},
        output.getIntensities().getColumn(0), 0.0);
    assertArrayEquals("Channel at 100 picked up the fragment", new double[] {5, 3, 5, 0},
        output.getIntensities().getColumn(1), 0.0);
    assertArrayEquals("Channel at 300 is untouched", new double[] {2, 2, 2, 2},
        output.getIntensities().getColumn(2), 0.0);
  }

  @Test
  public void testChannelsBeyondToleranceDoNotMerge() throws Exception {
    MassChannelMatrix input = new MassChannelMatrix(
        new double[] {50.0, 100.0, 100.5, 300.0},
        IntensityMatrix.fromColumns(
            new double[] {1, 1, 1, 1},
            new double[] {5, 0, 5, 0},
            new double[] {0, 3, 0, 0},
            new double[] {2, 2, 2, 2}));

    MassChannelMatrix output = new Centroid(new CentroidOptions(null, 0.1, null)).centroid(input);
    assertEquals("Nothing merges with a tight tolerance", 4, output.getChannelCount());
    assertEquals("Intensities are unchanged", input.getIntensities(), output.getIntensities());
  }

  @Test
  public void testChannelCountAndIntensityInvariants() throws Exception {
    MassChannelMatrix input = fragmented(30, 40, 11L);
    MassChannelMatrix output = new Centroid(new CentroidOptions(null, 0.5, null)).centroid(input);

    assertTrue("Centroiding never adds channels", output.getChannelCount() <= input.getChannelCount());
    assertTrue("Some fragments were merged", output.getChannelCount() < input.getChannelCount());
    assertEquals("m/z axis and columns stay in step", output.getMz().length, output.getIntensities().getColumnCount());
    assertEquals("Scan count is unchanged", input.getScanCount(), output.getScanCount());
    assertEquals("Total intensity is conserved", total(input), total(output), 1e-6);
    for (int c = 0; c < output.getChannelCount(); c++) {
      double sum = 0.0;
      for (double v : output.getIntensities().getColumn(c)) {
        sum += v;
      }
      assertNotEquals("Empty channels are dropped", 0.0, sum, 0.0);
    }
  }

  @Test
  public void testCentroidingTwiceChangesNothing() throws Exception {
    Centroid centroid = new Centroid(new CentroidOptions(null, 0.5, null));
    MassChannelMatrix once = centroid.centroid(fragmented(30, 40, 17L));
    MassChannelMatrix twice = centroid.centroid(once);
    assertArrayEquals("Same masses", once.getMz(), twice.getMz(), 0.0);
    assertEquals("Same intensities", once.getIntensities(), twice.getIntensities());
  }

  @Test
  public void testBlocksNeverSplitIdenticalMasses() throws Exception {
    double[] mz = {1.0, 2.0, 2.0, 2.0, 3.0, 4.0, 4.0, 5.0};
    // 1e3 bytes over 50 scans of 8 byte values gives blocks of two channels; unit gaps exceed the tolerance.
    Centroid centroid = new Centroid(new CentroidOptions(null, 0.5, 1e3));
    List<int[]> blocks = centroid.blocks(mz, 50);

    assertEquals("Block count", 3, blocks.size());
    assertArrayEquals("First block absorbs the run of 2.0", new int[] {0, 4}, blocks.get(0));
    assertArrayEquals("Second block absorbs the run of 4.0", new int[] {4, 7}, blocks.get(1));
    assertArrayEquals("Last block", new int[] {7, 8}, blocks.get(2));
    for (int[] block : blocks) {
      if (block[1] < mz.length) {
        assertNotEquals("Boundary between distinct masses", mz[block[1] - 1], mz[block[1]], 0.0);
      }
    }
  }

  @Test
  public void testBlocksNeverSeparateMassesWithinTolerance() throws Exception {
    double[] mz = {1.0, 1.4, 1.8, 3.0, 3.2, 5.0};
    Centroid centroid = new Centroid(new CentroidOptions(null, 0.5, 1e3));
    List<int[]> blocks = centroid.blocks(mz, 50);

    assertEquals("Block count", 3, blocks.size());
    assertArrayEquals("Chain of close masses stays together", new int[] {0, 3}, blocks.get(0));
    assertArrayEquals("Pair stays together", new int[] {3, 5}, blocks.get(1));
    assertArrayEquals("Last block", new int[] {5, 6}, blocks.get(2));
  }

  @Test
  public void testBlockedResultEqualsWholeMatrix() throws Exception {
    MassChannelMatrix input = fragmented(40, 30, 29L);
    MassChannelMatrix whole = new Centroid(new CentroidOptions(null, 0.5, 1e9)).centroid(input);
    // 1e3 bytes over 30 scans is four channels per block.
    MassChannelMatrix blocked = new Centroid(new CentroidOptions(null, 0.5, 1e3)).centroid(input);

    assertArrayEquals("Same masses", whole.getMz(), blocked.getMz(), 0.0);
    assertEquals("Same intensities", whole.getIntensities(), blocked.getIntensities());
  }

  @Test
  public void testPoolMatchesSequential() throws Exception {
    MassChannelMatrix input = fragmented(40, 50, 23L);
    Centroid centroid = new Centroid(new CentroidOptions(null, 0.5, 2e3));

    MassChannelMatrix sequential = centroid.centroid(input);
    MassChannelMatrix parallel;
    try (ColumnWorkerPool pool = new ColumnWorkerPool(4)) {
      parallel = centroid.centroid(input, pool, CancellationFlag.none());
    }
    assertArrayEquals("Same masses", sequential.getMz(), parallel.getMz(), 0.0);
    assertEquals("Same intensities", sequential.getIntensities(), parallel.getIntensities());
  }

  @Test
  public void testTooFewChannelsAreCopied() throws Exception {
    MassChannelMatrix input = new MassChannelMatrix(new double[] {100.0, 100.1},
        IntensityMatrix.fromColumns(new double[] {1, 0, 1}, new double[] {0, 2, 0}));
    MassChannelMatrix output = new Centroid().centroid(input);
    assertArrayEquals("Masses kept", input.getMz(), output.getMz(), 0.0);
    assertEquals("Intensities kept", input.getIntensities(), output.getIntensities());
  }

  @Test
  public void testOptionsAreClamped() throws Exception {
    CentroidOptions options = new CentroidOptions(0, -1.0, 10.0);
    assertEquals("Iterations at least one", 1, options.getIterations());
    assertEquals("Tolerance floor", CentroidOptions.MIN_TOLERANCE, options.getTolerance(), 0.0);
    assertEquals("Block size floor", CentroidOptions.MIN_BLOCK_SIZE, options.getBlockSize(), 0.0);
    assertEquals("Tolerance ceiling", CentroidOptions.MAX_TOLERANCE,
        new CentroidOptions(null, 1e6, null).getTolerance(), 0.0);
  }
}
