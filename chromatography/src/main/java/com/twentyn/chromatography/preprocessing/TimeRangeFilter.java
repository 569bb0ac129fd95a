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

import com.twentyn.chromatography.model.Signal;

/**
 * Keeps the rows of a signal whose time lies in the inclusive range [min, max].  Either bound may be left open by
 * passing null.
 */
public class TimeRangeFilter {
  private final Double min;
  private final Double max;

  public TimeRangeFilter(Double min, Double max) {
    this.min = min;
    this.max = max;
  }

  public Double getMin() {
    return min;
  }

  public Double getMax() {
    return max;
  }

  public Signal filter(Signal signal) {
    if (min == null && max == null) {
      return signal;
    }
    double[] time = signal.getTime();
    boolean[] keep = new boolean[time.length];
    int kept = 0;
    for (int i = 0; i < time.length; i++) {
      keep[i] = (min == null || time[i] >= min) && (max == null || time[i] <= max);
      if (keep[i]) {
        kept++;
      }
    }

    double[] filteredTime = new double[kept];
    int j = 0;
    for (int i = 0; i < time.length; i++) {
      if (keep[i]) {
        filteredTime[j++] = time[i];
      }
    }
    return new Signal(filteredTime, signal.getIntensities().selectRows(keep), signal.getColumnNames());
  }
}
