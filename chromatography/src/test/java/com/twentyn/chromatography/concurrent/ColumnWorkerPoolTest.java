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

package com.twentyn.chromatography.concurrent;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.IntFunction;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ColumnWorkerPoolTest {
  private ColumnWorkerPool pool;

  @Before
  public void setUp() throws Exception {
    pool = new ColumnWorkerPool(4);
  }

  @After
  public void tearDown() throws Exception {
    pool.close();
  }

  @Test
  public void testResultsComeBackInColumnOrder() throws Exception {
    List<Integer> squares = pool.map(100, column -> column * column, column -> -1, CancellationFlag.none());
    assertEquals(100, squares.size());
    for (int i = 0; i < 100; i++) {
      assertEquals("Result for column " + i, Integer.valueOf(i * i), squares.get(i));
    }
  }

  @Test
  public void testFailedColumnGetsFallback() throws Exception {
    @SuppressWarnings("unchecked")
    ColumnWorkerPool.ColumnTask<String> task = mock(ColumnWorkerPool.ColumnTask.class);
    when(task.process(anyInt())).thenReturn("ok");
    when(task.process(2)).thenThrow(new IllegalStateException("bad column"));

    List<String> results = pool.map(4, task, column -> "fallback " + column, CancellationFlag.none());

    assertEquals(Arrays.asList("ok", "ok", "fallback 2", "ok"), results);
    verify(task).process(2);
  }

  @Test
  public void testMapColumnsFallsBackToZeros() throws Exception {
    double[][] columns = pool.mapColumns(3, column -> {
      if (column == 1) {
        throw new IllegalArgumentException("too short");
      }
      return new double[] {column, column};
    }, 2, CancellationFlag.none());

    assertArrayEquals(new double[] {0, 0}, columns[0], 0.0);
    assertArrayEquals("Failed column is zero filled", new double[] {0, 0}, columns[1], 0.0);
    assertArrayEquals(new double[] {2, 2}, columns[2], 0.0);
  }

  @Test(expected = CancellationException.class)
  public void testCancelledBatchThrows() throws Exception {
    CancellationFlag flag = CancellationFlag.none();
    flag.cancel();
    pool.map(5, column -> column, column -> -1, flag);
  }

  @Test
  public void testCancelledBatchRunsNoTasks() throws Exception {
    @SuppressWarnings("unchecked")
    ColumnWorkerPool.ColumnTask<Integer> task = mock(ColumnWorkerPool.ColumnTask.class);
    @SuppressWarnings("unchecked")
    IntFunction<Integer> fallback = mock(IntFunction.class);
    CancellationFlag flag = CancellationFlag.none();
    flag.cancel();
    try {
      pool.map(3, task, fallback, flag);
    } catch (CancellationException e) {
      // expected
    }
    verify(task, never()).process(anyInt());
    verify(fallback, never()).apply(anyInt());
  }

  @Test
  public void testCancelledBatchKeepsFinishedColumns() throws Exception {
    final CancellationFlag flag = CancellationFlag.none();
    // One worker runs the columns in submission order, so the flag flips between columns 1 and 2.
    try (ColumnWorkerPool single = new ColumnWorkerPool(1)) {
      single.map(5, column -> {
        if (column == 1) {
          flag.cancel();
        }
        return column * 10;
      }, column -> -1, flag);
      fail("Batch was cancelled");
    } catch (BatchCancelledException e) {
      assertEquals(Arrays.asList(0, 10, null, null, null), e.getPartialResults());
      assertArrayEquals("Columns that never started", new int[] {2, 3, 4}, e.getUnprocessed());
      assertTrue("Column 1 finished", e.isProcessed(1));
      assertFalse("Column 2 did not start", e.isProcessed(2));
    }
  }

  @Test
  public void testBatchCancelledBeforeStartHasNoResults() throws Exception {
    CancellationFlag flag = CancellationFlag.none();
    flag.cancel();
    try {
      pool.map(3, column -> column, column -> -1, flag);
      fail("Batch was cancelled");
    } catch (BatchCancelledException e) {
      for (Object result : e.getPartialResults()) {
        assertNull("Nothing was processed", result);
      }
      assertArrayEquals(new int[] {0, 1, 2}, e.getUnprocessed());
    }
  }

  @Test
  public void testWorkerCountIsAtLeastOne() throws Exception {
    try (ColumnWorkerPool single = new ColumnWorkerPool(0)) {
      assertEquals(1, single.getWorkers());
    }
  }
}
