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

package com.rgs.bkgsmoothing.diagnostics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Per-channel before/after values for visual inspection of the smoothing, one row per smoothed channel.
 */
public class DiagnosticTable {
  public static final List<String> PLOT_COLORS = Collections.unmodifiableList(Arrays.asList(
      "red", "blue", "green", "orange", "purple", "cyan", "magenta", "yellow"));

  public static class Row {
    private final int segmentIndex;
    private final int channel;
    private final double wavelength;
    private final double backgroundCounts;
    private final double smoothedCounts;

    public Row(int segmentIndex, int channel, double wavelength, double backgroundCounts, double smoothedCounts) {
      this.segmentIndex = segmentIndex;
      this.channel = channel;
      this.wavelength = wavelength;
      this.backgroundCounts = backgroundCounts;
      this.smoothedCounts = smoothedCounts;
    }

    public int getSegmentIndex() {
      return segmentIndex;
    }

    public String getPlotColor() {
      return plotColor(segmentIndex);
    }

    public int getChannel() {
      return channel;
    }

    public double getWavelength() {
      return wavelength;
    }

    public double getBackgroundCounts() {
      return backgroundCounts;
    }

    public double getSmoothedCounts() {
      return smoothedCounts;
    }
  }

  private final List<Row> rows = new ArrayList<>();

  /**
   * Colors cycle with the segment index.
   */
  public static String plotColor(int segmentIndex) {
    return PLOT_COLORS.get(segmentIndex % PLOT_COLORS.size());
  }

  public void add(Row row) {
    rows.add(row);
  }

  public List<Row> getRows() {
    return Collections.unmodifiableList(rows);
  }

  public int size() {
    return rows.size();
  }
}
