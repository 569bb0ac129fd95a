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

import com.twentyn.chromatography.model.IntensityMatrix;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class DerivativeTest {

  private static double[] unitTime(int n) {
    double[] t = new double[n];
    for (int i = 0; i < n; i++) {
      t[i] = i;
    }
    return t;
  }

  @Test
  public void testFirstDerivativeOfLine() throws Exception {
    double[] t = {0.0, 0.5, 1.0, 1.5, 2.0};
    double[] y = {1.0, 2.5, 4.0, 5.5, 7.0};
    assertArrayEquals("Slope 3 with a zero in the last row", new double[] {3, 3, 3, 3, 0},
        new Derivative(t).transformColumn(y), 1e-12);
  }

  @Test
  public void testSecondDerivativeOfParabola() throws Exception {
    double[] y = new double[10];
    for (int i = 0; i < y.length; i++) {
      y[i] = i * i;
    }
    assertArrayEquals("Constant second derivative, zero at both ends", new double[] {0, 2, 2, 2, 2, 2, 2, 2, 2, 0},
        new Derivative(unitTime(10), 2).transformColumn(y), 1e-12);
  }

  @Test
  public void testOrderIsClamped() throws Exception {
    assertEquals("Order at least one", 1, new Derivative(unitTime(3), 0).getOrder());
    assertEquals("Order ceiling", Derivative.MAX_ORDER, new Derivative(unitTime(3), 5000).getOrder());
  }

  @Test
  public void testShortColumnsGiveZeros() throws Exception {
    assertArrayEquals("Single point", new double[1], new Derivative(new double[] {1.0}).transformColumn(new double[] {7.0}), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRowCountMustMatchTimeAxis() throws Exception {
    new Derivative(unitTime(4)).transform(IntensityMatrix.fromColumns(new double[] {1, 2, 3}));
  }
}
