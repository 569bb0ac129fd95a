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
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Parametric time warping (P.H.C. Eilers, Anal. Chem. 76 (2004) 404).
 *
 * A quadratic warp {@code w(i) = c0 + c1·i + c2·(i/m)²} maps sample positions onto (fractional) reference positions.
 * Starting from the identity, each iteration interpolates the reference at the warped positions and solves a
 * three-parameter linear least squares update from the residual against the sample.  Positions are 1-based inside
 * the model and {@code m} is the longer of the two signal lengths; the returned maps use 0-based indices.
 */
public class Aligner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Aligner.class);

  private static final double RMS_EPSILON = 1e-10;

  private final AlignmentOptions options;

  public Aligner() {
    this(new AlignmentOptions());
  }

  public Aligner(AlignmentOptions options) {
    this.options = options;
  }

  public AlignmentOptions getOptions() {
    return options;
  }

  /**
   * Aligns every sample to the reference on the calling thread.
   */
  public List<AlignmentMap> align(double[] reference, List<double[]> samples) {
    List<AlignmentMap> maps = new ArrayList<>(samples.size());
    for (double[] sample : samples) {
      maps.add(align(reference, sample));
    }
    return maps;
  }

  /**
   * Aligns every sample to the reference with one pool task per sample.
   */
  public List<AlignmentMap> align(final double[] reference, final List<double[]> samples,
                                  ColumnWorkerPool pool, CancellationFlag cancellation) {
    return pool.map(samples.size(), column -> align(reference, samples.get(column)),
        column -> new AlignmentMap(new int[0], new int[0]), cancellation);
  }

  /**
   * Aligns a single sample to the reference.
   * @return The index correspondence; empty when no sample point maps into the reference.
   */
  public AlignmentMap align(double[] reference, double[] sample) {
    if (reference == null || sample == null) {
      throw new IllegalArgumentException("Reference and sample signals must not be null");
    }
    final int refLength = reference.length;
    final int sampleLength = sample.length;
    final int m = Math.max(refLength, sampleLength);

    double[] c = {0.0, 1.0, 0.0};
    double previousRms = 0.0;
    Correspondence current = null;

    for (int iter = 0; iter < options.getIterations(); iter++) {
      current = correspondence(reference, c, m, sampleLength);
      final int k = current.positions.length;
      if (k < c.length) {
        LOGGER.debug("Warp maps only %d sample points into the reference after %d iterations", k, iter);
        break;
      }

      double[] residuals = new double[k];
      double sumSquares = 0.0;
      for (int j = 0; j < k; j++) {
        int refIndex = current.referenceFloor[j] - 1;
        double warped = reference[refIndex] + current.fraction[j] * current.slope[j];
        residuals[j] = sample[current.positions[j] - 1] - warped;
        sumSquares += residuals[j] * residuals[j];
      }
      double rms = Math.sqrt(sumSquares / m);

      if (Math.abs((rms - previousRms) / (rms + RMS_EPSILON)) < options.getConvergence()) {
        break;
      }
      previousRms = rms;

      double[][] design = new double[k][3];
      for (int j = 0; j < k; j++) {
        double p = current.positions[j];
        design[j][0] = current.slope[j];
        design[j][1] = current.slope[j] * p;
        design[j][2] = current.slope[j] * (p / m) * (p / m);
      }

      try {
        RealMatrix a = new Array2DRowRealMatrix(design, false);
        RealVector update = new QRDecomposition(a).getSolver().solve(new ArrayRealVector(residuals, false));
        for (int j = 0; j < 3; j++) {
          c[j] += update.getEntry(j);
        }
      } catch (SingularMatrixException e) {
        LOGGER.debug("Warp update is singular on iteration %d, keeping the current warp", iter + 1);
        break;
      }
      if (Double.isNaN(c[0]) || Double.isNaN(c[1]) || Double.isNaN(c[2])) {
        LOGGER.warn("Warp coefficients diverged on iteration %d", iter + 1);
        break;
      }
    }

    if (current == null) {
      return new AlignmentMap(new int[0], new int[0]);
    }
    int[] referenceIndices = new int[current.positions.length];
    int[] sampleIndices = new int[current.positions.length];
    for (int j = 0; j < current.positions.length; j++) {
      referenceIndices[j] = current.referenceFloor[j] - 1;
      sampleIndices[j] = current.positions[j] - 1;
    }
    return new AlignmentMap(referenceIndices, sampleIndices);
  }

  // Sample positions that land strictly inside the reference, with the interpolation data for each.
  private static Correspondence correspondence(double[] reference, double[] c, int m, int sampleLength) {
    final int refLength = reference.length;
    List<Integer> positions = new ArrayList<>();
    List<Double> warps = new ArrayList<>();
    for (int p = 1; p <= Math.min(m, sampleLength); p++) {
      double q = (double) p / m;
      double w = c[0] + c[1] * p + c[2] * q * q;
      if (w > 1 && w < refLength) {
        positions.add(p);
        warps.add(w);
      }
    }
    return new Correspondence(reference, positions, warps);
  }

  private static class Correspondence {
    final int[] positions;
    final int[] referenceFloor;
    final double[] fraction;
    final double[] slope;

    Correspondence(double[] reference, List<Integer> positions, List<Double> warps) {
      int k = positions.size();
      this.positions = new int[k];
      this.referenceFloor = new int[k];
      this.fraction = new double[k];
      this.slope = new double[k];
      for (int j = 0; j < k; j++) {
        double w = warps.get(j);
        this.positions[j] = positions.get(j);
        this.referenceFloor[j] = (int) Math.floor(w);
        this.fraction[j] = w - referenceFloor[j];
        // Reference values at 1-based positions floor(w) and floor(w) + 1.
        this.slope[j] = reference[referenceFloor[j]] - reference[referenceFloor[j] - 1];
      }
    }
  }
}
