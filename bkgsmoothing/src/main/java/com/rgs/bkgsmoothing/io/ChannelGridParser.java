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

import com.rgs.bkgsmoothing.model.ChannelGrid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Reads a prepared channel grid from a TSV file with one row per good channel, in increasing wavelength order.
 */
public class ChannelGridParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ChannelGridParser.class);

  public enum GRID_FIELD {
    CHANNEL("channel"),
    WAVELENGTH_LOW("wavelength_low"),
    WAVELENGTH_HIGH("wavelength_high"),
    EXPOSURE("exposure"),
    SOURCE_COUNTS("source_counts"),
    BACKGROUND_COUNTS("background_counts"),
    ;

    private final String columnName;

    GRID_FIELD(String columnName) {
      this.columnName = columnName;
    }

    public String getColumnName() {
      return columnName;
    }

    @Override
    public String toString() {
      return columnName;
    }
  }

  public ChannelGrid parse(File file) throws IOException {
    TSVParser parser = new TSVParser();
    parser.parse(file);
    LOGGER.info("Read %d channel rows from %s", parser.getResults().size(), file.getAbsolutePath());
    return toGrid(parser);
  }

  public ChannelGrid parse(InputStream is) throws IOException {
    TSVParser parser = new TSVParser();
    parser.parse(is);
    return toGrid(parser);
  }

  private ChannelGrid toGrid(TSVParser parser) throws IOException {
    for (GRID_FIELD field : GRID_FIELD.values()) {
      if (!parser.getHeaderMap().containsKey(field.getColumnName())) {
        throw new IOException(String.format("Channel grid is missing the '%s' column", field.getColumnName()));
      }
    }

    List<Map<String, String>> rows = parser.getResults();
    int n = rows.size();
    int[] channels = new int[n];
    double[] low = new double[n], high = new double[n], exposure = new double[n], src = new double[n],
        bkg = new double[n];
    for (int i = 0; i < n; i++) {
      Map<String, String> row = rows.get(i);
      try {
        channels[i] = Integer.parseInt(row.get(GRID_FIELD.CHANNEL.getColumnName()).trim());
        low[i] = parseDouble(row, GRID_FIELD.WAVELENGTH_LOW);
        high[i] = parseDouble(row, GRID_FIELD.WAVELENGTH_HIGH);
        exposure[i] = parseDouble(row, GRID_FIELD.EXPOSURE);
        src[i] = parseDouble(row, GRID_FIELD.SOURCE_COUNTS);
        bkg[i] = parseDouble(row, GRID_FIELD.BACKGROUND_COUNTS);
      } catch (NumberFormatException e) {
        throw new IOException(String.format("Unable to parse channel grid row %d: %s", i + 1, e.getMessage()), e);
      }
    }

    for (int i = 1; i < n; i++) {
      if (low[i] < low[i - 1]) {
        LOGGER.warn("Channel grid rows are not in increasing wavelength order at row %d", i + 1);
        break;
      }
    }
    return new ChannelGrid(low, high, exposure, src, bkg, channels);
  }

  private static double parseDouble(Map<String, String> row, GRID_FIELD field) {
    return Double.parseDouble(row.get(field.getColumnName()).trim());
  }
}
