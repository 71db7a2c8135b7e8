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

import java.util.Arrays;

/**
 * Background-subtracted source rates on the good-channel grid, in increasing energy order.
 */
public class NetSpectrum {
  private final double[] energyLow;
  private final double[] energyHigh;
  private final double[] sourceRate;
  private final double[] sourceRateError;
  private final double[] backgroundRate;
  private final double[] backgroundCounts;

  public NetSpectrum(double[] energyLow, double[] energyHigh, double[] sourceRate, double[] sourceRateError,
                     double[] backgroundRate, double[] backgroundCounts) {
    this.energyLow = energyLow;
    this.energyHigh = energyHigh;
    this.sourceRate = sourceRate;
    this.sourceRateError = sourceRateError;
    this.backgroundRate = backgroundRate;
    this.backgroundCounts = backgroundCounts;
  }

  public int size() {
    return sourceRate.length;
  }

  public double[] getEnergyLow() {
    return Arrays.copyOf(energyLow, energyLow.length);
  }

  public double[] getEnergyHigh() {
    return Arrays.copyOf(energyHigh, energyHigh.length);
  }

  public double[] getSourceRate() {
    return Arrays.copyOf(sourceRate, sourceRate.length);
  }

  public double[] getSourceRateError() {
    return Arrays.copyOf(sourceRateError, sourceRateError.length);
  }

  public double[] getBackgroundRate() {
    return Arrays.copyOf(backgroundRate, backgroundRate.length);
  }

  public double[] getBackgroundCounts() {
    return Arrays.copyOf(backgroundCounts, backgroundCounts.length);
  }
}
