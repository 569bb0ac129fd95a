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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hints for where to look for a peak.  Both are optional: without a center the column maximum is used, and without a
 * (positive) width the search window spans 5% of the time range.
 */
public class PeakOptions {
  public static final double DEFAULT_WIDTH_FRACTION = 0.05;

  @JsonProperty("center")
  private final Double center;

  @JsonProperty("width")
  private final Double width;

  public PeakOptions() {
    this(null, null);
  }

  @JsonCreator
  public PeakOptions(@JsonProperty("center") Double center,
                     @JsonProperty("width") Double width) {
    this.center = center == null || Double.isNaN(center) ? null : center;
    this.width = width == null || Double.isNaN(width) || width <= 0.0 ? null : width;
  }

  public Double getCenter() {
    return center;
  }

  public Double getWidth() {
    return width;
  }

  @Override
  public String toString() {
    return String.format("PeakOptions{center=%s, width=%s}", center, width);
  }
}
