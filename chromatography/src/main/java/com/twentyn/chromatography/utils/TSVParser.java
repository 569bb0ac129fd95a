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

package com.twentyn.chromatography.utils;

import com.twentyn.chromatography.model.IntensityMatrix;
import com.twentyn.chromatography.model.Signal;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a tab separated signal table.  The first row is a header; the first column holds the time axis and every
 * other column one intensity trace, named after its header.
 */
public class TSVParser {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withHeader();

  private List<String> header = null;
  private Signal signal = null;

  public Signal parse(File file) throws IOException {
    try (InputStream in = new FileInputStream(file)) {
      return parse(in);
    }
  }

  /**
   * @throws IllegalArgumentException if a cell is not a number, a row is short, or the time axis is not increasing.
   */
  public Signal parse(InputStream inStream) throws IOException {
    List<double[]> rows = new ArrayList<>();
    List<String> header;
    try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), TSV_FORMAT)) {
      header = new ArrayList<>(parser.getHeaderNames());
      if (header.size() < 2) {
        throw new IllegalArgumentException(String.format(
            "Signal table needs a time column and at least one intensity column, found %d columns", header.size()));
      }
      for (CSVRecord r : parser) {
        if (r.size() != header.size()) {
          throw new IllegalArgumentException(String.format(
              "Signal table row %d has %d fields, expected %d", r.getRecordNumber(), r.size(), header.size()));
        }
        double[] row = new double[header.size()];
        for (int c = 0; c < row.length; c++) {
          try {
            row[c] = Double.parseDouble(r.get(c).trim());
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(
                "Signal table row %d column '%s' is not a number: '%s'", r.getRecordNumber(), header.get(c), r.get(c)),
                e);
          }
        }
        rows.add(row);
      }
    }

    final int n = rows.size();
    final int columns = header.size() - 1;
    double[] time = new double[n];
    double[][] intensities = new double[columns][n];
    for (int i = 0; i < n; i++) {
      double[] row = rows.get(i);
      time[i] = row[0];
      for (int c = 0; c < columns; c++) {
        intensities[c][i] = row[c + 1];
      }
    }

    this.header = header;
    this.signal = new Signal(time, IntensityMatrix.withRowCount(n, intensities), header.subList(1, header.size()));
    return this.signal;
  }

  public Signal getSignal() {
    return this.signal;
  }

  public List<String> getHeader() {
    return this.header;
  }
}
