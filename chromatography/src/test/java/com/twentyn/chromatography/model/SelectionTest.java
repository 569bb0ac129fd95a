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

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class SelectionTest {
  private static final List<String> NAMES = Arrays.asList("100.0", "101.5", "250.25");

  @Test
  public void testAllSelectsEveryColumn() throws Exception {
    assertArrayEquals(new int[] {0, 1, 2}, Selection.all().resolve(3, NAMES));
    assertEquals(Selection.Kind.ALL, Selection.all().getKind());
  }

  @Test
  public void testIndicesAreSortedAndUnique() throws Exception {
    assertArrayEquals(new int[] {0, 2}, Selection.indices(2, 0, 2).resolve(3, NAMES));
  }

  @Test
  public void testByName() throws Exception {
    assertArrayEquals(new int[] {1}, Selection.byName("101.5").resolve(3, NAMES));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownNameIsRejected() throws Exception {
    Selection.byName("999.0").resolve(3, NAMES);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testIndexOutOfRangeIsRejected() throws Exception {
    Selection.indices(3).resolve(3, NAMES);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyIndexSelectionIsRejected() throws Exception {
    Selection.indices();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTotalIntensityHasNoColumns() throws Exception {
    Selection.totalIntensity().resolve(3, NAMES);
  }
}
