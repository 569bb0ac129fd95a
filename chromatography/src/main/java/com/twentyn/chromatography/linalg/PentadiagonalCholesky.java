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

package com.twentyn.chromatography.linalg;

import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;

/**
 * Cholesky factorization {@code A = L·Lᵗ} of a symmetric matrix with two non-zero off-diagonals on each side, as
 * produced by {@code W + s·DᵗD} for a second-difference operator D.  Factorization and solves are O(n) in time and
 * memory, against O(n³) for the dense decomposition in commons-math.
 */
public class PentadiagonalCholesky {
  // Pivots at or below this magnitude are treated as a loss of positive definiteness.
  private static final double PIVOT_THRESHOLD = 0.0;

  private final int size;
  // L[i][i], L[i][i-1] and L[i][i-2].
  private final double[] diagonal;
  private final double[] firstSub;
  private final double[] secondSub;

  /**
   * Factorizes the banded matrix given by its three distinct diagonals.
   * @param main {@code A[i][i]}, length n.
   * @param first {@code A[i][i-1]} at index i (index 0 unused), length n.
   * @param second {@code A[i][i-2]} at index i (indices 0 and 1 unused), length n.
   * @throws NonPositiveDefiniteMatrixException if a pivot is not strictly positive.
   */
  public PentadiagonalCholesky(double[] main, double[] first, double[] second) {
    if (main.length != first.length || main.length != second.length) {
      throw new IllegalArgumentException(String.format(
          "Diagonal lengths disagree: %d, %d, %d", main.length, first.length, second.length));
    }
    this.size = main.length;
    this.diagonal = new double[size];
    this.firstSub = new double[size];
    this.secondSub = new double[size];

    for (int i = 0; i < size; i++) {
      double l2 = 0.0;
      double l1 = 0.0;
      if (i >= 2) {
        l2 = second[i] / diagonal[i - 2];
      }
      if (i >= 1) {
        double acc = first[i];
        if (i >= 2) {
          acc -= l2 * firstSub[i - 1];
        }
        l1 = acc / diagonal[i - 1];
      }
      double pivot = main[i] - l1 * l1 - l2 * l2;
      if (!(pivot > PIVOT_THRESHOLD)) {
        throw new NonPositiveDefiniteMatrixException(pivot, i, PIVOT_THRESHOLD);
      }
      diagonal[i] = Math.sqrt(pivot);
      firstSub[i] = l1;
      secondSub[i] = l2;
    }
  }

  public int getSize() {
    return size;
  }

  /**
   * Solves {@code A·x = b} with the stored factor.
   */
  public double[] solve(double[] b) {
    if (b.length != size) {
      throw new IllegalArgumentException(String.format(
          "Right hand side has %d entries, system has %d", b.length, size));
    }

    // L·u = b
    double[] u = new double[size];
    for (int i = 0; i < size; i++) {
      double acc = b[i];
      if (i >= 1) {
        acc -= firstSub[i] * u[i - 1];
      }
      if (i >= 2) {
        acc -= secondSub[i] * u[i - 2];
      }
      u[i] = acc / diagonal[i];
    }

    // Lᵗ·x = u
    double[] x = new double[size];
    for (int i = size - 1; i >= 0; i--) {
      double acc = u[i];
      if (i + 1 < size) {
        acc -= firstSub[i + 1] * x[i + 1];
      }
      if (i + 2 < size) {
        acc -= secondSub[i + 2] * x[i + 2];
      }
      x[i] = acc / diagonal[i];
    }
    return x;
  }
}
