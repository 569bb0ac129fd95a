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

import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

/**
 * Which intensity columns of a sample an operation applies to.  One of:
 * <ul>
 *   <li>{@link #all()}: every mass channel</li>
 *   <li>{@link #indices(int...)}: an explicit set of mass channel indices</li>
 *   <li>{@link #byName(String)}: the channel carrying a given column name</li>
 *   <li>{@link #totalIntensity()}: the total intensity trace instead of the mass channels</li>
 * </ul>
 */
public abstract class Selection {
  public enum Kind {
    ALL,
    INDICES,
    BY_NAME,
    TOTAL_INTENSITY,
  }

  private static final Selection ALL = new All();
  private static final Selection TOTAL_INTENSITY = new TotalIntensity();

  private Selection() {
  }

  public static Selection all() {
    return ALL;
  }

  public static Selection totalIntensity() {
    return TOTAL_INTENSITY;
  }

  public static Selection indices(int... indices) {
    return new Indices(indices);
  }

  public static Selection byName(String name) {
    return new ByName(name);
  }

  public abstract Kind getKind();

  /**
   * Turns this selection into concrete, ascending, de-duplicated column indices.
   * @param columnCount The number of columns available.
   * @param columnNames The column names, or null when the columns are unnamed.
   * @return The selected column indices.
   * @throws IllegalArgumentException if the selection does not match any column.
   */
  public abstract int[] resolve(int columnCount, List<String> columnNames);

  private static final class All extends Selection {
    @Override
    public Kind getKind() {
      return Kind.ALL;
    }

    @Override
    public int[] resolve(int columnCount, List<String> columnNames) {
      int[] all = new int[columnCount];
      for (int i = 0; i < columnCount; i++) {
        all[i] = i;
      }
      return all;
    }

    @Override
    public String toString() {
      return "all";
    }
  }

  private static final class TotalIntensity extends Selection {
    @Override
    public Kind getKind() {
      return Kind.TOTAL_INTENSITY;
    }

    @Override
    public int[] resolve(int columnCount, List<String> columnNames) {
      throw new IllegalArgumentException("The total intensity selection does not refer to mass channel columns");
    }

    @Override
    public String toString() {
      return "tic";
    }
  }

  private static final class Indices extends Selection {
    private final int[] indices;

    private Indices(int[] indices) {
      if (indices == null || indices.length == 0) {
        throw new IllegalArgumentException("An index selection needs at least one index");
      }
      TreeSet<Integer> unique = new TreeSet<>();
      for (int i : indices) {
        unique.add(i);
      }
      this.indices = unique.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public Kind getKind() {
      return Kind.INDICES;
    }

    @Override
    public int[] resolve(int columnCount, List<String> columnNames) {
      for (int i : indices) {
        if (i < 0 || i >= columnCount) {
          throw new IllegalArgumentException(String.format(
              "Selected column %d is out of range [0, %d)", i, columnCount));
        }
      }
      return indices.clone();
    }

    @Override
    public String toString() {
      return Arrays.toString(indices);
    }
  }

  private static final class ByName extends Selection {
    private final String name;

    private ByName(String name) {
      if (name == null) {
        throw new IllegalArgumentException("A name selection needs a column name");
      }
      this.name = name;
    }

    @Override
    public Kind getKind() {
      return Kind.BY_NAME;
    }

    @Override
    public int[] resolve(int columnCount, List<String> columnNames) {
      int index = columnNames == null ? -1 : columnNames.indexOf(name);
      if (index < 0 || index >= columnCount) {
        throw new IllegalArgumentException(String.format("No column named '%s'", name));
      }
      return new int[] {index};
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
