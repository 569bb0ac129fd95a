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
import com.twentyn.chromatography.model.Signal;

/**
 * N-th order finite difference derivative of intensity columns with respect to time.
 *
 * Each pass takes forward differences and pads the result back to the column length.  Every second pass shifts the
 * differences down by one row so repeated differencing stays centered on the original samples.  The first and last
 * rows of the result are therefore zero for orders above one, and the last row is zero for every order.
 */
public class Derivative extends ColumnTransform {
  public static final int DEFAULT_ORDER = 1;
  public static final int MAX_ORDER = 1000;

  private final double[] time;
  private final int order;

  public Derivative(double[] time) {
    this(time, DEFAULT_ORDER);
  }

  public Derivative(double[] time, int order) {
    if (time == null) {
      throw new IllegalArgumentException("Derivative needs a time axis");
    }
    this.time = time.clone();
    this.order = Math.min(MAX_ORDER, Math.max(1, order));
  }

  public static Derivative of(Signal signal, int order) {
    return new Derivative(signal.getTime(), order);
  }

  public int getOrder() {
    return order;
  }

  @Override
  public IntensityMatrix transform(IntensityMatrix y) {
    checkRows(y);
    return super.transform(y);
  }

  @Override
  public IntensityMatrix transform(IntensityMatrix y, ColumnWorkerPool pool, CancellationFlag cancellation) {
    checkRows(y);
    return super.transform(y, pool, cancellation);
  }

  @Override
  public double[] transformColumn(double[] y) {
    final int n = y.length;
    if (n != time.length) {
      throw new IllegalArgumentException(String.format(
          "Column has %d points but the time axis has %d", n, time.length));
    }
    if (n < 2) {
      return new double[n];
    }

    double[] d = y.clone();
    for (int pass = 1; pass <= order; pass++) {
      double[] diff = new double[n - 1];
      for (int j = 0; j < n - 1; j++) {
        diff[j] = (d[j + 1] - d[j]) / (time[j + 1] - time[j]);
      }
      double[] next = new double[n];
      if (pass % 2 == 0) {
        for (int j = 1; j < n - 1; j++) {
          next[j] = diff[j - 1];
        }
      } else {
        System.arraycopy(diff, 0, next, 0, n - 1);
      }
      d = next;
    }

    for (int j = 0; j < n; j++) {
      if (Double.isNaN(d[j]) || Double.isInfinite(d[j])) {
        d[j] = 0.0;
      }
    }
    return d;
  }

  @Override
  protected double[] degenerateColumn(double[] y) {
    return new double[y.length];
  }

  private void checkRows(IntensityMatrix y) {
    if (y.getRowCount() != time.length) {
      throw new IllegalArgumentException(String.format(
          "Intensity matrix has %d rows but the time axis has %d points", y.getRowCount(), time.length));
    }
  }
}
