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

package com.twentyn.chromatography.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.chromatography.concurrent.CancellationFlag;
import com.twentyn.chromatography.concurrent.ColumnWorkerPool;
import com.twentyn.chromatography.model.IntensityMatrix;
import com.twentyn.chromatography.model.Peak;
import com.twentyn.chromatography.model.Signal;
import com.twentyn.chromatography.peaks.PeakFitter;
import com.twentyn.chromatography.peaks.PeakOptions;
import com.twentyn.chromatography.preprocessing.Baseline;
import com.twentyn.chromatography.preprocessing.Smoother;
import com.twentyn.chromatography.utils.CLIUtil;
import com.twentyn.chromatography.utils.TSVParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Integrates one peak per trace of a tab separated signal table and writes the peaks as JSON, keyed by column name.
 * Traces are optionally baseline corrected (baseline subtracted) and then smoothed before fitting.
 */
public class ChromatographyCLI {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ChromatographyCLI.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_OUTPUT = "o";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_BASELINE = "b";
  public static final String OPTION_SMOOTH = "s";
  public static final String OPTION_CENTER = "t";
  public static final String OPTION_WIDTH = "w";

  public static final String HELP_MESSAGE = StringUtils.join(new String[] {
      "Fits an exponential-Gaussian hybrid peak to every intensity column of a tab separated table.",
      "The first column of the table is the time axis (minutes); the header names the columns.",
      "Peaks are written to the output file as JSON, keyed by column name."
  }, " ");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("input file")
        .desc("A tab separated signal table: a time column followed by one column per trace")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output file")
        .desc("Where to write the fitted peaks as JSON")
        .hasArg().required()
        .longOpt("output")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("config file")
        .desc("A JSON processing configuration; defaults are used for anything it leaves out")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_BASELINE)
        .desc("Subtract an asymmetric least squares baseline before fitting")
        .longOpt("baseline")
    );
    add(Option.builder(OPTION_SMOOTH)
        .desc("Smooth every trace before fitting")
        .longOpt("smooth")
    );
    add(Option.builder(OPTION_CENTER)
        .argName("time")
        .desc("Look for the peak near this time (default: the time of each trace's maximum)")
        .hasArg()
        .longOpt("center")
    );
    add(Option.builder(OPTION_WIDTH)
        .argName("time span")
        .desc("Width of the window searched for the peak (default: 5% of the time range)")
        .hasArg()
        .longOpt("width")
    );
  }};

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(ChromatographyCLI.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    File inputFile = new File(cl.getOptionValue(OPTION_INPUT));
    if (!inputFile.exists()) {
      cliUtil.failWithMessage("Input file at %s does not exist", inputFile.getAbsolutePath());
    }
    if (cl.hasOption(OPTION_CONFIG) && !new File(cl.getOptionValue(OPTION_CONFIG)).exists()) {
      cliUtil.failWithMessage("Config file at %s does not exist", cl.getOptionValue(OPTION_CONFIG));
    }

    ProcessingConfig config;
    try {
      config = configFor(cl);
    } catch (NumberFormatException e) {
      cliUtil.failWithMessage("Center and width must be numbers: %s", e.getMessage());
      return;
    }

    Map<String, Peak> peaks = run(cl, config);
    File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT));
    OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(outputFile, peaks);
    LOGGER.info("Wrote %d peaks to %s", peaks.size(), outputFile.getAbsolutePath());
  }

  /**
   * Loads the configuration named on the command line (or the defaults) and applies the center/width overrides.
   * @throws NumberFormatException if a center or width is given that is not a number.
   */
  public static ProcessingConfig configFor(CommandLine cl) throws IOException {
    ProcessingConfig config = cl.hasOption(OPTION_CONFIG) ?
        ProcessingConfig.load(new File(cl.getOptionValue(OPTION_CONFIG))) : new ProcessingConfig();

    if (cl.hasOption(OPTION_CENTER) || cl.hasOption(OPTION_WIDTH)) {
      Double center = cl.hasOption(OPTION_CENTER) ?
          Double.valueOf(cl.getOptionValue(OPTION_CENTER)) : config.getPeaks().getCenter();
      Double width = cl.hasOption(OPTION_WIDTH) ?
          Double.valueOf(cl.getOptionValue(OPTION_WIDTH)) : config.getPeaks().getWidth();
      config = config.withPeaks(new PeakOptions(center, width));
    }
    return config;
  }

  public static Map<String, Peak> run(CommandLine cl, ProcessingConfig config) throws IOException {
    Signal signal = new TSVParser().parse(new File(cl.getOptionValue(OPTION_INPUT)));
    LOGGER.info("Read %d traces of %d points from %s",
        signal.getColumnCount(), signal.size(), cl.getOptionValue(OPTION_INPUT));

    try (ColumnWorkerPool pool = new ColumnWorkerPool(config.getWorkers())) {
      return process(signal, config, cl.hasOption(OPTION_BASELINE), cl.hasOption(OPTION_SMOOTH), pool);
    }
  }

  /**
   * Runs baseline subtraction, smoothing and peak fitting over every trace of {@code signal}.
   * @return The fitted peak of every trace, keyed by column name, in column order.
   */
  public static Map<String, Peak> process(Signal signal, ProcessingConfig config, boolean subtractBaseline,
                                          boolean smooth, ColumnWorkerPool pool) {
    CancellationFlag cancellation = CancellationFlag.none();
    IntensityMatrix y = signal.getIntensities();
    if (subtractBaseline) {
      y = y.subtract(new Baseline(config.getBaseline()).transform(y, pool, cancellation));
    }
    if (smooth) {
      y = new Smoother(config.getSmoothing()).transform(y, pool, cancellation);
    }

    List<Peak> fitted = new PeakFitter(config.getPeaks()).fit(signal.withIntensities(y), pool, cancellation);

    Map<String, Peak> peaks = new LinkedHashMap<>();
    for (int c = 0; c < fitted.size(); c++) {
      String name = signal.getColumnNames() == null ? String.valueOf(c) : signal.getColumnNames().get(c);
      peaks.put(name, fitted.get(c));
    }
    return peaks;
  }
}
