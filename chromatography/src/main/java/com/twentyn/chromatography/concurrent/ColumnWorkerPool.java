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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * A bounded pool that runs one task per independent column (or column block) and scatters the results into a
 * pre-allocated array slot per column.
 *
 * A column whose task throws is logged and filled with the caller's fallback value so that the other columns of the
 * batch are kept.  Cancellation is checked before each column starts.
 */
public class ColumnWorkerPool implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ColumnWorkerPool.class);
  private static final AtomicInteger POOL_COUNTER = new AtomicInteger(0);

  /**
   * The work for a single column.
   * @param <T> The per-column result type.
   */
  public interface ColumnTask<T> {
    T process(int column);
  }

  private final int workers;
  private final ExecutorService executor;

  public ColumnWorkerPool() {
    this(Runtime.getRuntime().availableProcessors());
  }

  public ColumnWorkerPool(int workers) {
    this.workers = Math.max(1, workers);
    final int poolId = POOL_COUNTER.incrementAndGet();
    final AtomicInteger threadCounter = new AtomicInteger(0);
    ThreadFactory factory = r -> {
      Thread t = new Thread(r, String.format("column-worker-%d-%d", poolId, threadCounter.incrementAndGet()));
      t.setDaemon(true);
      return t;
    };
    this.executor = Executors.newFixedThreadPool(this.workers, factory);
  }

  public int getWorkers() {
    return workers;
  }

  /**
   * Runs {@code task} for columns {@code 0 .. count-1}.
   * @param count The number of columns.
   * @param task The per-column work; must only read shared inputs.
   * @param fallback Produces the result for a column whose task failed.
   * @param cancellation Checked before every column.
   * @return The per-column results, in column order.
   * @throws BatchCancelledException if the batch was cancelled before every column ran; it carries the results of
   *     the columns that did.
   * @throws CancellationException if the calling thread was interrupted while waiting.
   */
  public <T> List<T> map(int count, final ColumnTask<T> task, final IntFunction<T> fallback,
                         final CancellationFlag cancellation) {
    final Object[] results = new Object[count];
    final boolean[] done = new boolean[count];

    List<Future<?>> futures = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      final int column = i;
      futures.add(executor.submit(() -> {
        if (cancellation.isCancelled()) {
          return;
        }
        T result;
        try {
          result = task.process(column);
        } catch (RuntimeException e) {
          LOGGER.warn("Processing of column %d failed, substituting a degenerate result: %s",
              column, e.getMessage());
          result = fallback.apply(column);
        }
        results[column] = result;
        done[column] = true;
      }));
    }

    try {
      for (Future<?> future : futures) {
        future.get();
      }
    } catch (InterruptedException e) {
      cancellation.cancel();
      for (Future<?> future : futures) {
        future.cancel(false);
      }
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for column workers");
    } catch (ExecutionException e) {
      // Only Errors get here; exceptions are absorbed per column above.
      throw new IllegalStateException("Column worker died", e.getCause());
    }

    int skipped = 0;
    for (boolean d : done) {
      if (!d) {
        skipped++;
      }
    }
    if (skipped > 0) {
      LOGGER.info("Batch cancelled with %d of %d columns unprocessed", skipped, count);
      throw new BatchCancelledException(String.format(
          "Cancelled with %d of %d columns unprocessed", skipped, count), results, done);
    }

    List<T> ordered = new ArrayList<>(count);
    for (Object r : results) {
      @SuppressWarnings("unchecked")
      T typed = (T) r;
      ordered.add(typed);
    }
    return ordered;
  }

  /**
   * Convenience for tasks producing one {@code double[]} column each; results are written into their own slot.
   */
  public double[][] mapColumns(int count, ColumnTask<double[]> task, final int rows, CancellationFlag cancellation) {
    List<double[]> columns = map(count, task, column -> new double[rows], cancellation);
    return columns.toArray(new double[columns.size()][]);
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
        LOGGER.warn("Column workers did not stop within a minute, forcing shutdown");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
