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
import com.twentyn.chromatography.model.AlignmentMap;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AlignerTest {

  private static double[] gaussian(int n, double center, double sigma) {
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      y[i] = 100.0 * Math.exp(-Math.pow(i - center, 2) / (2.0 * sigma * sigma));
    }
    return y;
  }

  @Test
  public void testSignalAlignsOntoItself() throws Exception {
    double[] reference = gaussian(200, 50.0, 10.0);
    AlignmentMap map = new Aligner().align(reference, reference);

    assertEquals("Every interior point is matched", 198, map.size());
    assertArrayEquals("Identity map", map.getReferenceIndices(), map.getSampleIndices());
    assertEquals("Starts at the second point", 1, map.getSampleIndices()[0]);
  }

  @Test
  public void testShiftedPeakIsPulledOntoReference() throws Exception {
    double[] reference = gaussian(200, 50.0, 10.0);
    double[] sample = gaussian(200, 55.0, 10.0);
    AlignmentMap map = new Aligner().align(reference, sample);

    int[] sampleIndices = map.getSampleIndices();
    int[] referenceIndices = map.getReferenceIndices();
    int k = Arrays.binarySearch(sampleIndices, 55);
    assertTrue("Sample apex is part of the map", k >= 0);
    assertTrue(String.format("Sample apex maps onto the reference apex (got %d)", referenceIndices[k]),
        referenceIndices[k] >= 49 && referenceIndices[k] <= 51);

    for (int j = 1; j < referenceIndices.length; j++) {
      assertTrue("Map is monotonic", referenceIndices[j] >= referenceIndices[j - 1]);
    }
  }

  @Test
  public void testResampledSampleMatchesReference() throws Exception {
    double[] reference = gaussian(200, 50.0, 10.0);
    double[] sample = gaussian(200, 55.0, 10.0);
    AlignmentMap map = new Aligner().align(reference, sample);
    double[] resampled = map.resample(sample, reference.length);

    assertEquals("Resampled trace has the reference length", reference.length, resampled.length);
    assertEquals("Apex lines up after resampling", 100.0, resampled[50], 5.0);
  }

  @Test
  public void testPoolMatchesSequential() throws Exception {
    double[] reference = gaussian(150, 70.0, 8.0);
    List<double[]> samples = Arrays.asList(gaussian(150, 72.0, 8.0), reference, gaussian(150, 66.0, 8.0));
    Aligner aligner = new Aligner();

    List<AlignmentMap> sequential = aligner.align(reference, samples);
    List<AlignmentMap> parallel;
    try (ColumnWorkerPool pool = new ColumnWorkerPool(2)) {
      parallel = aligner.align(reference, samples, pool, CancellationFlag.none());
    }
    assertEquals("One map per sample", 3, parallel.size());
    for (int i = 0; i < samples.size(); i++) {
      assertArrayEquals("Same reference indices for sample " + i,
          sequential.get(i).getReferenceIndices(), parallel.get(i).getReferenceIndices());
      assertArrayEquals("Same sample indices for sample " + i,
          sequential.get(i).getSampleIndices(), parallel.get(i).getSampleIndices());
    }
  }

  @Test
  public void testOptionsAreClamped() throws Exception {
    AlignmentOptions options = new AlignmentOptions(0, -1.0);
    assertEquals("Iterations at least one", 1, options.getIterations());
    assertEquals("Convergence not negative", 0.0, options.getConvergence(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullSignalIsRejected() throws Exception {
    new Aligner().align(new double[10], (double[]) null);
  }
}
