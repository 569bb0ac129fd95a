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

/**
 * Min/max scaling of intensities into [0, 1].  A range with no spread (max == min) maps to zero.
 */
public class Normalizer {
  public enum Scope {
    MATRIX,
    ROW,
    COLUMN,
  }

  private final Scope scope;

  public Normalizer() {
    this(Scope.COLUMN);
  }

  public Normalizer(Scope scope) {
    this.scope = scope == null ? Scope.COLUMN : scope;
  }

  public Scope getScope() {
    return scope;
  }

  public IntensityMatrix normalize(IntensityMatrix y) {
    final int rows = y.getRowCount();
    final int cols = y.getColumnCount();
    double[][] columns = y.toColumnArrays();

    switch (scope) {
      case MATRIX: {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] column : columns) {
          for (double v : column) {
            min = Math.min(min, v);
            max = Math.max(max, v);
          }
        }
        for (double[] column : columns) {
          scale(column, min, max);
        }
        break;
      }
      case COLUMN:
        for (double[] column : columns) {
          double min = Double.POSITIVE_INFINITY;
          double max = Double.NEGATIVE_INFINITY;
          for (double v : column) {
            min = Math.min(min, v);
            max = Math.max(max, v);
          }
          scale(column, min, max);
        }
        break;
      case ROW:
        for (int r = 0; r < rows; r++) {
          double min = Double.POSITIVE_INFINITY;
          double max = Double.NEGATIVE_INFINITY;
          for (int c = 0; c < cols; c++) {
            min = Math.min(min, columns[c][r]);
            max = Math.max(max, columns[c][r]);
          }
          double range = max - min;
          for (int c = 0; c < cols; c++) {
            columns[c][r] = range > 0.0 ? (columns[c][r] - min) / range : 0.0;
          }
        }
        break;
      default:
        throw new IllegalArgumentException("Unhandled normalization scope " + scope);
    }
    return IntensityMatrix.withRowCount(rows, columns);
  }

  private static void scale(double[] column, double min, double max) {
    double range = max - min;
    for (int r = 0; r < column.length; r++) {
      column[r] = range > 0.0 ? (column[r] - min) / range : 0.0;
    }
  }
}
