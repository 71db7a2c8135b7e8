/*************************************************************************
*                                                                        *
*  This file is part of the rgs-bkgsmoothing project.                    *
*  rgs-bkgsmoothing smooths RGS background spectra per CCD segment.      *
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

package com.rgs.bkgsmoothing.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rgs.bkgsmoothing.BackgroundSmoothingResult;
import com.rgs.bkgsmoothing.boundary.BoundaryAlignment;
import com.rgs.bkgsmoothing.diagnostics.DiagnosticTable;
import com.rgs.bkgsmoothing.model.SegmentResult;
import com.rgs.bkgsmoothing.rates.NetSpectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the products of a smoothing run to disk: the per-channel diagnostic table and the net spectrum as TSV,
 * and the boundary alignment with its per-segment results as JSON.
 */
public class SmoothingReportWriter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SmoothingReportWriter.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public enum DIAGNOSTIC_FIELD {
    SEGMENT,
    PLOT_COLOR,
    CHANNEL,
    WAVELENGTH,
    BACKGROUND_COUNTS,
    SMOOTHED_COUNTS,
  }

  public enum NET_SPECTRUM_FIELD {
    ENERGY_LOW,
    ENERGY_HIGH,
    SOURCE_RATE,
    SOURCE_RATE_ERROR,
    BACKGROUND_RATE,
    BACKGROUND_COUNTS,
  }

  public static class SegmentReport {
    @JsonProperty("alignment")
    private BoundaryAlignment alignment;

    @JsonProperty("segments")
    private List<SegmentResult> segments;

    public SegmentReport(BoundaryAlignment alignment, List<SegmentResult> segments) {
      this.alignment = alignment;
      this.segments = segments;
    }

    public BoundaryAlignment getAlignment() {
      return alignment;
    }

    public List<SegmentResult> getSegments() {
      return segments;
    }
  }

  public void writeDiagnosticTable(DiagnosticTable table, File outputFile) throws IOException {
    try (TSVWriter<DIAGNOSTIC_FIELD, String> writer =
             new TSVWriter<>(Arrays.asList(DIAGNOSTIC_FIELD.values()))) {
      writer.open(outputFile);
      for (DiagnosticTable.Row row : table.getRows()) {
        Map<DIAGNOSTIC_FIELD, String> values = new HashMap<>();
        values.put(DIAGNOSTIC_FIELD.SEGMENT, Integer.toString(row.getSegmentIndex()));
        values.put(DIAGNOSTIC_FIELD.PLOT_COLOR, row.getPlotColor());
        values.put(DIAGNOSTIC_FIELD.CHANNEL, Integer.toString(row.getChannel()));
        values.put(DIAGNOSTIC_FIELD.WAVELENGTH, Double.toString(row.getWavelength()));
        values.put(DIAGNOSTIC_FIELD.BACKGROUND_COUNTS, Double.toString(row.getBackgroundCounts()));
        values.put(DIAGNOSTIC_FIELD.SMOOTHED_COUNTS, Double.toString(row.getSmoothedCounts()));
        writer.append(values);
      }
      writer.flush();
    }
    LOGGER.info("Wrote %d diagnostic rows to %s", table.size(), outputFile.getAbsolutePath());
  }

  public void writeSegmentReport(BackgroundSmoothingResult result, File outputFile) throws IOException {
    SegmentReport report = new SegmentReport(result.getAlignment(), result.getSegmentResults());
    OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(outputFile, report);
    LOGGER.info("Wrote report for %d segments to %s", result.getSegmentResults().size(),
        outputFile.getAbsolutePath());
  }

  public void writeNetSpectrum(NetSpectrum spectrum, File outputFile) throws IOException {
    double[] eLow = spectrum.getEnergyLow(), eHigh = spectrum.getEnergyHigh();
    double[] rate = spectrum.getSourceRate(), error = spectrum.getSourceRateError();
    double[] bkgRate = spectrum.getBackgroundRate(), bkgCounts = spectrum.getBackgroundCounts();

    try (TSVWriter<NET_SPECTRUM_FIELD, String> writer =
             new TSVWriter<>(Arrays.asList(NET_SPECTRUM_FIELD.values()))) {
      writer.open(outputFile);
      for (int i = 0; i < spectrum.size(); i++) {
        Map<NET_SPECTRUM_FIELD, String> values = new HashMap<>();
        values.put(NET_SPECTRUM_FIELD.ENERGY_LOW, Double.toString(eLow[i]));
        values.put(NET_SPECTRUM_FIELD.ENERGY_HIGH, Double.toString(eHigh[i]));
        values.put(NET_SPECTRUM_FIELD.SOURCE_RATE, Double.toString(rate[i]));
        values.put(NET_SPECTRUM_FIELD.SOURCE_RATE_ERROR, Double.toString(error[i]));
        values.put(NET_SPECTRUM_FIELD.BACKGROUND_RATE, Double.toString(bkgRate[i]));
        values.put(NET_SPECTRUM_FIELD.BACKGROUND_COUNTS, Double.toString(bkgCounts[i]));
        writer.append(values);
      }
      writer.flush();
    }
    LOGGER.info("Wrote %d net spectrum rows to %s", spectrum.size(), outputFile.getAbsolutePath());
  }
}
