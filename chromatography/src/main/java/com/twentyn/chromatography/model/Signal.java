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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One time axis paired with one or more intensity columns.  Time and intensities are co-indexed: the matrix always
 * has exactly as many rows as there are time points, and the time axis is strictly increasing.
 */
public class Signal {
  @JsonProperty("time")
  private final double[] time;

  @JsonProperty("intensities")
  private final IntensityMatrix intensities;

  @JsonProperty("column_names")
  private final List<String> columnNames;

  public Signal(double[] time, IntensityMatrix intensities) {
    this(time, intensities, null);
  }

  @JsonCreator
  public Signal(@JsonProperty("time") double[] time,
                @JsonProperty("intensities") IntensityMatrix intensities,
                @JsonProperty("column_names") List<String> columnNames) {
    if (time == null) {
      throw new IllegalArgumentException("Signal time axis must not be null");
    }
    if (intensities == null) {
      throw new IllegalArgumentException("Signal intensities must not be null");
    }
    if (time.length != intensities.getRowCount()) {
      throw new IllegalArgumentException(String.format(
          "Signal time axis has %d points but intensities have %d rows", time.length, intensities.getRowCount()));
    }
    for (int i = 1; i < time.length; i++) {
      if (!(time[i] > time[i - 1])) {
        throw new IllegalArgumentException(String.format(
            "Signal time axis is not strictly increasing at index %d (%f after %f)", i, time[i], time[i - 1]));
      }
    }
    if (columnNames != null && columnNames.size() != intensities.getColumnCount()) {
      throw new IllegalArgumentException(String.format(
          "Signal has %d column names for %d intensity columns", columnNames.size(), intensities.getColumnCount()));
    }
    this.time = time.clone();
    this.intensities = intensities;
    this.columnNames = columnNames == null ? null : Collections.unmodifiableList(new ArrayList<>(columnNames));
  }

  public static Signal of(double[] time, double[]... columns) {
    return new Signal(time, IntensityMatrix.fromColumns(columns));
  }

  public double[] getTime() {
    return time.clone();
  }

  public IntensityMatrix getIntensities() {
    return intensities;
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public int size() {
    return time.length;
  }

  @JsonIgnore
  public int getColumnCount() {
    return intensities.getColumnCount();
  }

  /**
   * @return The index of the named column, or -1 if columns are unnamed or no column has that name.
   */
  public int indexOfColumn(String name) {
    return columnNames == null ? -1 : columnNames.indexOf(name);
  }

  public Signal withIntensities(IntensityMatrix replacement) {
    return new Signal(time, replacement, columnNames);
  }
}
