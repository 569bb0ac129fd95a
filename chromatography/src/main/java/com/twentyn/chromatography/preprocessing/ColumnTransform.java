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

/**
 * A transform applied to every column of an intensity matrix independently.  The output always has the shape of the
 * input and is freshly allocated.
 */
public abstract class ColumnTransform {

  /**
   * Transforms a single column.  Implementations must not modify {@code y} and must return an array of the same
   * length.
   */
  public abstract double[] transformColumn(double[] y);

  /**
   * What a column turns into when its transform blows up; it must have {@code rows} entries.
   */
  protected abstract double[] degenerateColumn(double[] y);

  /**
   * Applies the transform column by column on the calling thread.
   */
  public IntensityMatrix transform(IntensityMatrix y) {
    double[][] out = new double[y.getColumnCount()][];
    for (int c = 0; c < out.length; c++) {
      out[c] = safeTransform(y.getColumn(c));
    }
    return IntensityMatrix.withRowCount(y.getRowCount(), out);
  }

  /**
   * Applies the transform with one pool task per column.
   */
  public IntensityMatrix transform(final IntensityMatrix y, ColumnWorkerPool pool, CancellationFlag cancellation) {
    double[][] out = pool.mapColumns(y.getColumnCount(), column -> safeTransform(y.getColumn(column)),
        y.getRowCount(), cancellation);
    return IntensityMatrix.withRowCount(y.getRowCount(), out);
  }

  private double[] safeTransform(double[] column) {
    try {
      return transformColumn(column);
    } catch (IllegalArgumentException e) {
      return degenerateColumn(column);
    }
  }
}
