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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The peaks integrated so far for a set of columns.  Each column keeps an ordered list of peaks (several peaks can be
 * integrated on one trace by integrating with different center hints).  Tables are immutable; merging returns a new
 * table.
 */
public class PeakTable {
  /**
   * How newly fitted peaks are combined with the peaks already recorded for a column.
   */
  public enum MergeMode {
    /** Drop every recorded peak of the column and keep only the new one. */
    RESET,
    /** Overwrite the most recently recorded peak of the column (or add one if there is none). */
    REPLACE,
    /** Add the new peak after the recorded ones. */
    APPEND,
  }

  @JsonProperty("peaks")
  private final Map<Integer, List<Peak>> peaksByColumn;

  public PeakTable() {
    this(Collections.<Integer, List<Peak>>emptyMap());
  }

  @JsonCreator
  public PeakTable(@JsonProperty("peaks") Map<Integer, List<Peak>> peaksByColumn) {
    TreeMap<Integer, List<Peak>> copy = new TreeMap<>();
    if (peaksByColumn != null) {
      for (Map.Entry<Integer, List<Peak>> entry : peaksByColumn.entrySet()) {
        copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
      }
    }
    this.peaksByColumn = Collections.unmodifiableMap(copy);
  }

  public List<Peak> getPeaks(int column) {
    List<Peak> peaks = peaksByColumn.get(column);
    return peaks == null ? Collections.<Peak>emptyList() : peaks;
  }

  public Map<Integer, List<Peak>> getPeaks() {
    return peaksByColumn;
  }

  /**
   * Records one fitted peak per column.  Empty peaks ("no peak found") are not recorded, but with
   * {@link MergeMode#RESET} the column is still cleared.
   * @param columns The column each peak belongs to.
   * @param peaks The peaks, co-indexed with {@code columns}.
   * @param mode How to combine with the existing entries.
   * @return The updated table.
   */
  public PeakTable merge(int[] columns, List<Peak> peaks, MergeMode mode) {
    if (columns.length != peaks.size()) {
      throw new IllegalArgumentException(String.format(
          "Got %d peaks for %d columns", peaks.size(), columns.length));
    }
    Map<Integer, List<Peak>> updated = new TreeMap<>(peaksByColumn);
    for (int i = 0; i < columns.length; i++) {
      List<Peak> existing = updated.containsKey(columns[i]) ?
          new ArrayList<>(updated.get(columns[i])) : new ArrayList<Peak>();
      Peak peak = peaks.get(i);

      switch (mode) {
        case RESET:
          existing.clear();
          if (!peak.isEmpty()) {
            existing.add(peak);
          }
          break;
        case REPLACE:
          if (peak.isEmpty()) {
            break;
          }
          if (existing.isEmpty()) {
            existing.add(peak);
          } else {
            existing.set(existing.size() - 1, peak);
          }
          break;
        case APPEND:
          if (!peak.isEmpty()) {
            existing.add(peak);
          }
          break;
        default:
          throw new IllegalArgumentException("Unhandled merge mode " + mode);
      }

      if (existing.isEmpty()) {
        updated.remove(columns[i]);
      } else {
        updated.put(columns[i], existing);
      }
    }
    return new PeakTable(updated);
  }
}
