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

package com.rgs.bkgsmoothing.model;

/**
 * The exposure-corrected channels of one observation, restricted to the good-exposure subset.  Entry i of every
 * array describes the same channel; {@link #getGoodChannel(int)} maps it back to its index in the full instrument
 * grid.
 */
public class ChannelGrid {
  // keV * Angstrom, converts between photon energy and wavelength.
  public static final double HC_KEV_ANGSTROM = 12.398424;

  private final double[] wavelengthLow;
  private final double[] wavelengthHigh;
  private final double[] exposure;
  private final double[] sourceCounts;
  private final double[] backgroundCounts;
  private final int[] goodChannels;

  public ChannelGrid(double[] wavelengthLow, double[] wavelengthHigh, double[] exposure,
                     double[] sourceCounts, double[] backgroundCounts, int[] goodChannels) {
    int n = wavelengthLow.length;
    if (wavelengthHigh.length != n || exposure.length != n || sourceCounts.length != n ||
        backgroundCounts.length != n || goodChannels.length != n) {
      throw new IllegalArgumentException(String.format(
          "Channel grid arrays must all have the same length: low=%d high=%d exp=%d src=%d bkg=%d good=%d",
          n, wavelengthHigh.length, exposure.length, sourceCounts.length, backgroundCounts.length,
          goodChannels.length));
    }
    for (int i = 0; i < n; i++) {
      if (!(wavelengthLow[i] > 0.0) || !(wavelengthHigh[i] >= wavelengthLow[i])) {
        throw new IllegalArgumentException(String.format(
            "Channel %d has an invalid wavelength interval [%f, %f)", i, wavelengthLow[i], wavelengthHigh[i]));
      }
    }

    this.wavelengthLow = wavelengthLow;
    this.wavelengthHigh = wavelengthHigh;
    this.exposure = exposure;
    this.sourceCounts = sourceCounts;
    this.backgroundCounts = backgroundCounts;
    this.goodChannels = goodChannels;
  }

  /**
   * Builds a grid from energy bin bounds (keV), as found in a response matrix EBOUNDS table.  The wavelength
   * interval of a channel is [hc / eHigh, hc / eLow).
   */
  public static ChannelGrid fromEnergyBounds(double[] energyLow, double[] energyHigh, double[] exposure,
                                             double[] sourceCounts, double[] backgroundCounts, int[] goodChannels) {
    if (energyLow.length != energyHigh.length) {
      throw new IllegalArgumentException("Energy bound arrays must have the same length");
    }
    double[] low = new double[energyLow.length];
    double[] high = new double[energyLow.length];
    for (int i = 0; i < energyLow.length; i++) {
      if (!(energyLow[i] > 0.0) || !(energyHigh[i] > 0.0)) {
        throw new IllegalArgumentException(String.format(
            "Channel %d has a non-positive energy bound [%f, %f]", i, energyLow[i], energyHigh[i]));
      }
      low[i] = HC_KEV_ANGSTROM / energyHigh[i];
      high[i] = HC_KEV_ANGSTROM / energyLow[i];
    }
    return new ChannelGrid(low, high, exposure, sourceCounts, backgroundCounts, goodChannels);
  }

  public int size() {
    return wavelengthLow.length;
  }

  /**
   * The representative wavelength of a channel: hc over the mean energy of the bin, which is the harmonic mean of
   * the wavelength bounds.
   */
  public double getWavelength(int i) {
    double low = wavelengthLow[i], high = wavelengthHigh[i];
    return 2.0 * low * high / (low + high);
  }

  public double getWavelengthLow(int i) {
    return wavelengthLow[i];
  }

  public double getWavelengthHigh(int i) {
    return wavelengthHigh[i];
  }

  public double getEnergyLow(int i) {
    return HC_KEV_ANGSTROM / wavelengthHigh[i];
  }

  public double getEnergyHigh(int i) {
    return HC_KEV_ANGSTROM / wavelengthLow[i];
  }

  public double getExposure(int i) {
    return exposure[i];
  }

  public double getSourceCounts(int i) {
    return sourceCounts[i];
  }

  public double getBackgroundCounts(int i) {
    return backgroundCounts[i];
  }

  public int getGoodChannel(int i) {
    return goodChannels[i];
  }
}
