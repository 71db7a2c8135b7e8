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

package com.rgs.bkgsmoothing.exposure;

/**
 * Full-grid inputs as read from the source/background spectra, the response EBOUNDS and the exposure map.  All
 * arrays are indexed by instrument channel.
 */
public class RawSpectra {
  private final double[] energyLow;
  private final double[] energyHigh;
  private final double[] exposure;
  private final double[] sourceCounts;
  private final double[] sourceBackscal;
  private final double[] backgroundCounts;
  private final double[] backgroundBackscal;

  public RawSpectra(double[] energyLow, double[] energyHigh, double[] exposure, double[] sourceCounts,
                    double[] sourceBackscal, double[] backgroundCounts, double[] backgroundBackscal) {
    int n = exposure.length;
    if (energyLow.length != n || energyHigh.length != n || sourceCounts.length != n ||
        sourceBackscal.length != n || backgroundCounts.length != n || backgroundBackscal.length != n) {
      throw new IllegalArgumentException("All raw spectrum arrays must cover the same channels");
    }
    this.energyLow = energyLow;
    this.energyHigh = energyHigh;
    this.exposure = exposure;
    this.sourceCounts = sourceCounts;
    this.sourceBackscal = sourceBackscal;
    this.backgroundCounts = backgroundCounts;
    this.backgroundBackscal = backgroundBackscal;
  }

  public int size() {
    return exposure.length;
  }

  public double[] getEnergyLow() {
    return energyLow;
  }

  public double[] getEnergyHigh() {
    return energyHigh;
  }

  /**
   * @return The per-channel maximum of the exposure map.
   */
  public double[] getExposure() {
    return exposure;
  }

  public double[] getSourceCounts() {
    return sourceCounts;
  }

  public double[] getSourceBackscal() {
    return sourceBackscal;
  }

  public double[] getBackgroundCounts() {
    return backgroundCounts;
  }

  public double[] getBackgroundBackscal() {
    return backgroundBackscal;
  }
}
