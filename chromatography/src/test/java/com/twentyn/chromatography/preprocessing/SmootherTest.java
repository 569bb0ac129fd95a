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

import com.twentyn.chromatography.linalg.PenalizedLeastSquaresSolver;
import com.twentyn.chromatography.linalg.PentadiagonalCholesky;
import com.twentyn.chromatography.model.IntensityMatrix;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SmootherTest {

  // A solver whose factorization starts failing on the given call, counted from one.
  private static PenalizedLeastSquaresSolver failingFrom(final int call, PenalizedLeastSquaresOptions options) {
    return new PenalizedLeastSquaresSolver(
        options.getSmoothness(), options.getAsymmetry(), options.getIterations(), 0.0) {
      private int calls = 0;

      @Override
      protected PentadiagonalCholesky factorize(double[] main, double[] first, double[] second) {
        calls++;
        if (calls >= call) {
          throw new NonPositiveDefiniteMatrixException(-1.0, 0, 0.0);
        }
        return super.factorize(main, first, second);
      }
    };
  }

  @Test
  public void testDefaultsAndClamping() throws Exception {
    SmoothingOptions defaults = new SmoothingOptions();
    assertEquals("Default smoothness", 0.5, defaults.getSmoothness(), 0.0);
    assertEquals("Default asymmetry", 0.5, defaults.getAsymmetry(), 0.0);
    assertEquals("Default iterations", 5, defaults.getIterations());

    SmoothingOptions clamped = new SmoothingOptions(-1.0, 1.5, -3, null);
    assertEquals("Negative smoothness is clamped", 1e-9, clamped.getSmoothness(), 0.0);
    assertEquals("Asymmetry above one is clamped", 1.0 - 1e-9, clamped.getAsymmetry(), 0.0);
    assertEquals("Iterations are at least one", 1, clamped.getIterations());
  }

  @Test
  public void testSmoothingReducesNoise() throws Exception {
    Random random = new Random(42L);
    double[] clean = new double[400];
    double[] noisy = new double[400];
    for (int i = 0; i < clean.length; i++) {
      clean[i] = 50.0 * Math.exp(-Math.pow(i - 200, 2) / 800.0);
      noisy[i] = clean[i] + random.nextGaussian() * 2.0;
    }

    double[] smoothed = new Smoother(new SmoothingOptions(50.0, 0.5, 5, 1e-4)).transformColumn(noisy);

    double noisyError = 0.0;
    double smoothedError = 0.0;
    for (int i = 0; i < clean.length; i++) {
      noisyError += Math.pow(noisy[i] - clean[i], 2);
      smoothedError += Math.pow(smoothed[i] - clean[i], 2);
    }
    assertTrue(String.format("Smoothing brings the signal closer to the truth (%f < %f)", smoothedError, noisyError),
        smoothedError < noisyError / 2.0);
  }

  @Test
  public void testShapeIsPreservedAndZerosStayZero() throws Exception {
    double[] ramp = new double[30];
    for (int i = 0; i < ramp.length; i++) {
      ramp[i] = i % 7;
    }
    IntensityMatrix y = IntensityMatrix.fromColumns(ramp, new double[30]);
    IntensityMatrix smoothed = new Smoother().transform(y);
    assertEquals("Same number of rows", 30, smoothed.getRowCount());
    assertEquals("Same number of columns", 2, smoothed.getColumnCount());
    assertArrayEquals("All-zero column stays zero", new double[30], smoothed.getColumn(1), 0.0);
  }

  @Test
  public void testShortColumnsAreReturnedUnchanged() throws Exception {
    double[] y = {3.0, 1.0, 2.0};
    assertArrayEquals("Too short to smooth", y, new Smoother().transformColumn(y), 0.0);
  }

  @Test
  public void testFailedFactorizationKeepsTheLastEstimate() throws Exception {
    double[] y = new double[60];
    for (int i = 0; i < y.length; i++) {
      y[i] = (i * 37) % 11;
    }
    SmoothingOptions options = new SmoothingOptions();
    double[] smoothed = new Smoother(options, failingFrom(2, options)).transformColumn(y);
    double[] firstIteration = new Smoother(new SmoothingOptions(null, null, 1, null)).transformColumn(y);

    assertEquals("Same length as the input", y.length, smoothed.length);
    assertArrayEquals("Estimate of the iteration before the failure", firstIteration, smoothed, 0.0);
  }

  @Test
  public void testFactorizationFailingAtOnceReturnsTheColumn() throws Exception {
    double[] y = {4.0, 1.0, 3.0, 1.0, 5.0, 9.0};
    SmoothingOptions options = new SmoothingOptions();
    assertArrayEquals("Column comes back unchanged", y,
        new Smoother(options, failingFrom(1, options)).transformColumn(y), 0.0);
  }
}
