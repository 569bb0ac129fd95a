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

package com.twentyn.chromatography.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * A dense block of intensities: rows are time points, columns are channels (mass channels, detector traces or
 * samples).  Values are stored column by column since every algorithm in this package walks one column at a time.
 *
 * Instances never share storage with the arrays they were built from or handed out; every accessor returns a copy.
 */
public class IntensityMatrix {
  @JsonProperty("columns")
  private final double[][] columns;

  @JsonProperty("rows")
  private final int rows;

  private IntensityMatrix(int rows, double[][] columns) {
    this.rows = rows;
    this.columns = columns;
  }

  // Serialized matrices get the same shape checks as ones built in code.
  @JsonCreator
  private static IntensityMatrix fromJson(@JsonProperty("rows") int rows,
                                          @JsonProperty("columns") double[][] columns) {
    if (rows < 0) {
      throw new IllegalArgumentException(String.format("Intensity matrix row count %d is negative", rows));
    }
    return withRowCount(rows, columns);
  }

  /**
   * Builds a matrix from column vectors, each of which must have the same length.
   * @param columns The intensity columns.
   * @return A new matrix holding copies of the columns.
   */
  public static IntensityMatrix fromColumns(double[]... columns) {
    if (columns == null) {
      throw new IllegalArgumentException("Intensity columns must not be null");
    }
    return withRowCount(columns.length == 0 ? 0 : columns[0].length, columns);
  }

  /**
   * Same as {@link #fromColumns(double[]...)} but keeps the row count when there are no columns left, e.g. after
   * every mass channel of a scan range was dropped.
   */
  public static IntensityMatrix withRowCount(int rows, double[][] columns) {
    if (columns == null) {
      throw new IllegalArgumentException("Intensity columns must not be null");
    }
    double[][] copy = new double[columns.length][];
    for (int i = 0; i < columns.length; i++) {
      if (columns[i] == null || columns[i].length != rows) {
        throw new IllegalArgumentException(String.format(
            "Intensity column %d has %d values, expected %d", i, columns[i] == null ? 0 : columns[i].length, rows));
      }
      copy[i] = columns[i].clone();
    }
    return new IntensityMatrix(rows, copy);
  }

  /**
   * Builds a matrix from row vectors (the layout vendor files are read in: one row per scan).
   * @param rowValues The intensity rows, all of the same length.
   * @return A new matrix.
   */
  public static IntensityMatrix fromRows(double[][] rowValues) {
    if (rowValues == null) {
      throw new IllegalArgumentException("Intensity rows must not be null");
    }
    int nRows = rowValues.length;
    int nCols = nRows == 0 ? 0 : rowValues[0].length;
    double[][] cols = new double[nCols][nRows];
    for (int r = 0; r < nRows; r++) {
      if (rowValues[r] == null || rowValues[r].length != nCols) {
        throw new IllegalArgumentException(String.format(
            "Intensity row %d has %d values, expected %d", r, rowValues[r] == null ? 0 : rowValues[r].length, nCols));
      }
      for (int c = 0; c < nCols; c++) {
        cols[c][r] = rowValues[r][c];
      }
    }
    return new IntensityMatrix(nRows, cols);
  }

  public static IntensityMatrix zeros(int rows, int columns) {
    return new IntensityMatrix(rows, new double[columns][rows]);
  }

  @JsonIgnore
  public int getRowCount() {
    return rows;
  }

  @JsonIgnore
  public int getColumnCount() {
    return columns.length;
  }

  public double get(int row, int column) {
    return columns[column][row];
  }

  public double[] getColumn(int column) {
    checkColumn(column);
    return columns[column].clone();
  }

  public double[] getRow(int row) {
    if (row < 0 || row >= rows) {
      throw new IndexOutOfBoundsException(String.format("Row %d out of range [0, %d)", row, rows));
    }
    double[] values = new double[columns.length];
    for (int c = 0; c < columns.length; c++) {
      values[c] = columns[c][row];
    }
    return values;
  }

  /**
   * @return A copy of all columns, indexed [column][row].
   */
  public double[][] toColumnArrays() {
    double[][] copy = new double[columns.length][];
    for (int c = 0; c < columns.length; c++) {
      copy[c] = columns[c].clone();
    }
    return copy;
  }

  public IntensityMatrix selectColumns(int[] indices) {
    double[][] selected = new double[indices.length][];
    for (int i = 0; i < indices.length; i++) {
      checkColumn(indices[i]);
      selected[i] = columns[indices[i]].clone();
    }
    return new IntensityMatrix(rows, selected);
  }

  public IntensityMatrix selectRows(boolean[] keep) {
    if (keep.length != rows) {
      throw new IllegalArgumentException(String.format(
          "Row filter has %d entries, matrix has %d rows", keep.length, rows));
    }
    int kept = 0;
    for (boolean k : keep) {
      if (k) {
        kept++;
      }
    }
    double[][] filtered = new double[columns.length][kept];
    for (int c = 0; c < columns.length; c++) {
      int j = 0;
      for (int r = 0; r < rows; r++) {
        if (keep[r]) {
          filtered[c][j++] = columns[c][r];
        }
      }
    }
    return new IntensityMatrix(kept, filtered);
  }

  /**
   * Element-wise difference {@code this - other}.  Used to remove a baseline from a signal.
   */
  public IntensityMatrix subtract(IntensityMatrix other) {
    if (other.rows != rows || other.columns.length != columns.length) {
      throw new IllegalArgumentException(String.format(
          "Cannot subtract a %dx%d matrix from a %dx%d matrix",
          other.rows, other.columns.length, rows, columns.length));
    }
    double[][] diff = new double[columns.length][rows];
    for (int c = 0; c < columns.length; c++) {
      for (int r = 0; r < rows; r++) {
        diff[c][r] = columns[c][r] - other.columns[c][r];
      }
    }
    return new IntensityMatrix(rows, diff);
  }

  /**
   * @return A single column holding the sum of every row (the total intensity trace).
   */
  public double[] rowSums() {
    double[] sums = new double[rows];
    for (double[] column : columns) {
      for (int r = 0; r < rows; r++) {
        sums[r] += column[r];
      }
    }
    return sums;
  }

  public boolean sameShape(IntensityMatrix other) {
    return other != null && other.rows == rows && other.columns.length == columns.length;
  }

  private void checkColumn(int column) {
    if (column < 0 || column >= columns.length) {
      throw new IndexOutOfBoundsException(String.format(
          "Column %d out of range [0, %d)", column, columns.length));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IntensityMatrix)) {
      return false;
    }
    IntensityMatrix that = (IntensityMatrix) o;
    return rows == that.rows && Arrays.deepEquals(columns, that.columns);
  }

  @Override
  public int hashCode() {
    return 31 * rows + Arrays.deepHashCode(columns);
  }
}
