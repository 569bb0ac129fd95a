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

package com.twentyn.chromatography.peaks;

import com.twentyn.chromatography.concurrent.CancellationFlag;
import com.twentyn.chromatography.concurrent.ColumnWorkerPool;
import com.twentyn.chromatography.model.Peak;
import com.twentyn.chromatography.model.Signal;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PeakFitterTest {
  private static final double[] X = grid(1000, 20.0);

  private static double[] grid(int n, double max) {
    double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = max * i / (n - 1);
    }
    return x;
  }

  private static double[] gaussian(double[] x, double height, double center, double sigma) {
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      y[i] = height * Math.exp(-Math.pow(x[i] - center, 2) / (2.0 * sigma * sigma));
    }
    return y;
  }

  private static double trapezoid(double[] x, double[] y) {
    double area = 0.0;
    for (int i = 1; i < x.length; i++) {
      area += 0.5 * (y[i] + y[i - 1]) * (x[i] - x[i - 1]);
    }
    return area;
  }

  @Test
  public void testGaussianIsRecovered() throws Exception {
    double[] y = gaussian(X, 100.0, 10.0, 1.0);
    Peak peak = new PeakFitter().fit(X, y);

    assertFalse("Peak is found", peak.isEmpty());
    assertEquals("Center", 10.0, peak.getCenter(), 0.05);
    assertEquals("Height", 100.0, peak.getHeight(), 0.5);
    assertEquals("Width is sigma", 1.0, peak.getWidth(), 0.05);
    assertEquals("Area is h * sigma * sqrt(2 pi)", 100.0 * Math.sqrt(2.0 * Math.PI), peak.getArea(),
        0.05 * 100.0 * Math.sqrt(2.0 * Math.PI));
    assertTrue(String.format("Fit error %f is below 1%%", peak.getError()), peak.getError() < 1.0);
    assertEquals("Fit has one value per point", X.length, peak.getFit().length);
    assertEquals("Residual at the apex is small", 0.0, peak.getResiduals()[500], 1.0);
  }

  @Test
  public void testTailingPeakGetsPositiveDecay() throws Exception {
    double[] y = PeakFitter.evaluate(X, 10.0, 50.0, 0.5, 0.3);
    Peak peak = new PeakFitter().fit(X, y);

    assertFalse("Peak is found", peak.isEmpty());
    assertTrue(String.format("Decay %f is positive for a tail on the right", peak.getDecay()), peak.getDecay() > 0.0);
    double expected = trapezoid(X, y);
    assertEquals("Area matches the numerical integral", expected, peak.getArea(), 0.05 * expected);
  }

  @Test
  public void testFrontingPeakGetsNegativeDecay() throws Exception {
    double[] y = PeakFitter.evaluate(X, 10.0, 50.0, 0.5, -0.3);
    Peak peak = new PeakFitter().fit(X, y);
    assertTrue(String.format("Decay %f is negative for a front on the left", peak.getDecay()), peak.getDecay() < 0.0);
  }

  @Test
  public void testZeroSignalGivesEmptyPeak() throws Exception {
    Peak peak = new PeakFitter().fit(X, new double[X.length]);
    assertTrue("No peak", peak.isEmpty());
    assertEquals("Area", 0.0, peak.getArea(), 0.0);
    assertEquals("Error", 0.0, peak.getError(), 0.0);
    assertEquals("Fit keeps the column length", X.length, peak.getFit().length);
  }

  @Test
  public void testHintsAreHandedToTheDetector() throws Exception {
    double[] y = gaussian(X, 10.0, 5.0, 0.5);
    PeakDetector detector = mock(PeakDetector.class);
    when(detector.detect(X, y, 8.0, 2.0)).thenReturn(PeakBoundaries.none());

    Peak peak = new PeakFitter(new PeakOptions(8.0, 2.0), detector).fit(X, y);

    verify(detector).detect(X, y, 8.0, 2.0);
    assertTrue("Nothing detected means nothing fitted", peak.isEmpty());
  }

  @Test
  public void testFitFollowsTheDetectedBoundaries() throws Exception {
    double[] y = gaussian(X, 100.0, 10.0, 1.0);
    double halfWidth = Math.sqrt(2.0 * Math.log(2.0));
    PeakDetector detector = mock(PeakDetector.class);
    when(detector.detect(X, y, null, null)).thenReturn(
        new PeakBoundaries(10.0, 10.0 - halfWidth, 10.0 + halfWidth, 100.0, 0.5));

    Peak peak = new PeakFitter(new PeakOptions(), detector).fit(X, y);

    assertEquals("Width", 1.0, peak.getWidth(), 1e-9);
    assertEquals("Decay of a symmetric peak", 0.0, peak.getDecay(), 1e-9);
    assertEquals("Area", 100.0 * Math.sqrt(2.0 * Math.PI), peak.getArea(), 1e-4);
    assertEquals("Boundaries are kept", 10.0 - halfWidth, peak.getLeft(), 1e-12);
  }

  @Test
  public void testModelBlowUpsAreZeroed() throws Exception {
    double[] fit = PeakFitter.evaluate(new double[] {0.0, 5.0, 10.0}, 5.0, 1.0, 0.1, 0.01);
    assertEquals("Outside the model domain", 0.0, fit[0], 0.0);
    assertEquals("Apex", 1.0, fit[1], 0.0);
    assertEquals("Below the floor relative to the height", 0.0, fit[2], 0.0);
  }

  @Test
  public void testFitErrorIsUndefinedWithoutRise() throws Exception {
    double[] x = {0.0, 1.0, 2.0};
    assertTrue("Peak no higher than the window",
        Double.isNaN(PeakFitter.fitError(x, new double[] {1, 1, 1}, new double[3], 0.0, 2.0, 1.0)));
    assertTrue("Empty window",
        Double.isNaN(PeakFitter.fitError(x, new double[] {1, 2, 1}, new double[3], 5.0, 6.0, 2.0)));
  }

  @Test
  public void testFitErrorOnFlatWindowUsesPeakHeight() throws Exception {
    double[] x = {0.0, 1.0, 2.0};
    double[] fit = {0.0, 9.0, 0.0};
    // Only the two plateau points at 10 are inside; residuals are 1 and 10 against a rise of 2.
    double error = PeakFitter.fitError(x, new double[] {0, 10, 10}, fit, 1.0, 2.0, 12.0);
    assertEquals(Math.sqrt((1.0 + 100.0) / 2.0) / 2.0 * 100.0, error, 1e-9);
  }

  @Test
  public void testPoolMatchesSequential() throws Exception {
    Signal signal = Signal.of(X, gaussian(X, 100.0, 10.0, 1.0), gaussian(X, 30.0, 4.0, 0.4), new double[X.length]);
    PeakFitter fitter = new PeakFitter();
    List<Peak> sequential = fitter.fit(signal);
    List<Peak> parallel;
    try (ColumnWorkerPool pool = new ColumnWorkerPool(3)) {
      parallel = fitter.fit(signal, pool, CancellationFlag.none());
    }
    assertEquals(3, parallel.size());
    for (int c = 0; c < 3; c++) {
      assertEquals("Area of column " + c, sequential.get(c).getArea(), parallel.get(c).getArea(), 0.0);
      assertEquals("Center of column " + c, sequential.get(c).getCenter(), parallel.get(c).getCenter(), 0.0);
    }
    assertTrue("Flat column", parallel.get(2).isEmpty());
  }
}
