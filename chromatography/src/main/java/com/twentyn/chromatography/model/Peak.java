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

import java.io.Serializable;

/**
 * A chromatographic peak fitted on one intensity column.  A peak with zero area stands for "no peak found"; in that
 * case every scalar is zero and the fit and residual arrays are zero-filled, never null.
 */
public class Peak implements Serializable {
  private static final long serialVersionUID = 4092361552378211905L;

  @JsonProperty("center")
  private final double center;

  @JsonProperty("left")
  private final double left;

  @JsonProperty("right")
  private final double right;

  @JsonProperty("height")
  private final double height;

  @JsonProperty("width")
  private final double width;

  @JsonProperty("decay")
  private final double decay;

  @JsonProperty("area")
  private final double area;

  @JsonProperty("fit")
  private final double[] fit;

  @JsonProperty("residuals")
  private final double[] residuals;

  @JsonProperty("error")
  private final double error;

  @JsonCreator
  public Peak(@JsonProperty("center") double center,
              @JsonProperty("left") double left,
              @JsonProperty("right") double right,
              @JsonProperty("height") double height,
              @JsonProperty("width") double width,
              @JsonProperty("decay") double decay,
              @JsonProperty("area") double area,
              @JsonProperty("fit") double[] fit,
              @JsonProperty("residuals") double[] residuals,
              @JsonProperty("error") double error) {
    this.center = center;
    this.left = left;
    this.right = right;
    this.height = height;
    this.width = width;
    this.decay = decay;
    this.area = area;
    this.fit = fit == null ? new double[0] : fit.clone();
    this.residuals = residuals == null ? new double[0] : residuals.clone();
    this.error = error;
  }

  /**
   * The "no peak" record for a column of {@code length} points.
   */
  public static Peak empty(int length) {
    return new Peak(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, new double[length], new double[length], 0.0);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return area == 0.0;
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

  public double getWidth() {
    return width;
  }

  public double getDecay() {
    return decay;
  }

  public double getArea() {
    return area;
  }

  public double[] getFit() {
    return fit.clone();
  }

  public double[] getResiduals() {
    return residuals.clone();
  }

  public double getError() {
    return error;
  }

  @Override
  public String toString() {
    return String.format("Peak{center=%.4f, height=%.4g, width=%.4f, decay=%.4f, area=%.4g, error=%.3f%%}",
        center, height, width, decay, area, error);
  }
}
