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

/**
 * Where a peak sits on a column: its apex and the positions on either side where the signal falls to {@code alpha}
 * times the apex height.  A center of zero with zero height means no peak was found.
 */
public class PeakBoundaries {
  private static final PeakBoundaries NONE = new PeakBoundaries(0.0, 0.0, 0.0, 0.0, 0.0);

  private final double center;
  private final double left;
  private final double right;
  private final double height;
  private final double alpha;

  public PeakBoundaries(double center, double left, double right, double height, double alpha) {
    this.center = center;
    this.left = left;
    this.right = right;
    this.height = height;
    this.alpha = alpha;
  }

  public static PeakBoundaries none() {
    return NONE;
  }

  public boolean isEmpty() {
    return center == 0.0 && height == 0.0;
  }

  public double getCenter() {
    return center;
  }

  public double getLeft() {
    return left;
  }

  public double getRight() {
    return right;
  }

  public double getHeight() {
    return height;
  }

  public double getAlpha() {
    return alpha;
  }

  @Override
  public String toString() {
    return String.format("PeakBoundaries{center=%.4f, left=%.4f, right=%.4f, height=%.4g, alpha=%.4f}",
        center, left, right, height, alpha);
  }
}
