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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Thrown when a batch is cancelled before every column ran.  Carries what the batch had already produced: one slot per
 * column, {@code null} for the columns that never started.
 */
public class BatchCancelledException extends CancellationException {
  private static final long serialVersionUID = 1L;

  private final transient List<Object> partialResults;
  private final boolean[] processed;
  private final int[] unprocessed;

  public BatchCancelledException(String message, Object[] results, boolean[] done) {
    super(message);
    List<Object> partial = new ArrayList<>(results.length);
    List<Integer> skipped = new ArrayList<>();
    for (int i = 0; i < results.length; i++) {
      partial.add(done[i] ? results[i] : null);
      if (!done[i]) {
        skipped.add(i);
      }
    }
    this.partialResults = Collections.unmodifiableList(partial);
    this.processed = done.clone();
    this.unprocessed = skipped.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * @return The per-column results in column order; {@code null} where the column was not processed.
   */
  public List<Object> getPartialResults() {
    return partialResults;
  }

  public int[] getUnprocessed() {
    return unprocessed.clone();
  }

  public boolean isProcessed(int column) {
    return processed[column];
  }
}
