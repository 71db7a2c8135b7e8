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

package com.rgs.bkgsmoothing.rates;

import com.rgs.bkgsmoothing.model.ChannelGrid;
import com.rgs.bkgsmoothing.model.SmoothedBackground;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Recomputes source and background rates once the smoothed background is known.
 */
public class RateRecalculator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RateRecalculator.class);

  public static final String BACKGROUND_RATE = "background_rate";
  public static final String SOURCE_RATE = "source_rate";
  public static final String SOURCE_COUNTS = "source_counts";

  private final ChannelGrid grid;
  private final SmoothedBackground smoothed;

  private final double[] sourceRate;
  private final double[] sourceRateError;
  private final double[] backgroundRate;
  private final double[] residual;

  public RateRecalculator(ChannelGrid grid, SmoothedBackground smoothed) {
    if (grid.size() != smoothed.size()) {
      throw new IllegalArgumentException(String.format(
          "Smoothed background has %d channels but the grid has %d", smoothed.size(), grid.size()));
    }
    this.grid = grid;
    this.smoothed = smoothed;

    int n = grid.size();
    sourceRate = new double[n];
    sourceRateError = new double[n];
    backgroundRate = new double[n];
    residual = new double[n];
    for (int i = 0; i < n; i++) {
      double exposure = grid.getExposure(i);
      double src = grid.getSourceCounts(i);
      double bkg = smoothed.get(i);
      residual[i] = grid.getBackgroundCounts(i) - bkg;
      if (exposure > 0.0) {
        sourceRate[i] = (src - bkg) / exposure;
        sourceRateError[i] = Math.sqrt(Math.max(src, 0.0)) / exposure;
        backgroundRate[i] = bkg / exposure;
      }
    }
  }

  public double getSourceRate(int i) {
    return sourceRate[i];
  }

  public double getSourceRateError(int i) {
    return sourceRateError[i];
  }

  public double getBackgroundRate(int i) {
    return backgroundRate[i];
  }

  /**
   * @return Raw minus smoothed background counts for a grid channel.
   */
  public double getResidual(int i) {
    return residual[i];
  }

  /**
   * The rates in increasing energy order.  The grid runs in wavelength order, so every column is reversed.
   */
  public NetSpectrum toNetSpectrum() {
    int n = grid.size();
    double[] eLow = new double[n], eHigh = new double[n], rate = new double[n], error = new double[n];
    double[] bkgRate = new double[n], bkgCounts = new double[n];
    for (int i = 0; i < n; i++) {
      int src = n - 1 - i;
      eLow[i] = grid.getEnergyLow(src);
      eHigh[i] = grid.getEnergyHigh(src);
      rate[i] = sourceRate[src];
      error[i] = sourceRateError[src];
      bkgRate[i] = backgroundRate[src];
      bkgCounts[i] = smoothed.get(src);
    }
    return new NetSpectrum(eLow, eHigh, rate, error, bkgRate, bkgCounts);
  }

  /**
   * Places a column back onto the full instrument channel grid; channels that weren't good stay at zero.
   * @param column One of BACKGROUND_RATE, SOURCE_RATE or SOURCE_COUNTS.
   * @param fullChannelCount The size of the instrument grid.
   */
  public double[] toFullGrid(String column, int fullChannelCount) {
    double[] full = new double[fullChannelCount];
    int dropped = 0;
    for (int i = 0; i < grid.size(); i++) {
      int channel = grid.getGoodChannel(i);
      if (channel < 0 || channel >= fullChannelCount) {
        dropped++;
        continue;
      }
      switch (column) {
        case BACKGROUND_RATE:
          full[channel] = backgroundRate[i];
          break;
        case SOURCE_RATE:
          full[channel] = sourceRate[i];
          break;
        case SOURCE_COUNTS:
          full[channel] = sourceRate[i] * grid.getExposure(i);
          break;
        default:
          throw new IllegalArgumentException("Unknown rate column " + column);
      }
    }
    if (dropped > 0) {
      LOGGER.warn("%d good channels fall outside the %d-channel instrument grid", dropped, fullChannelCount);
    }
    return full;
  }
}
