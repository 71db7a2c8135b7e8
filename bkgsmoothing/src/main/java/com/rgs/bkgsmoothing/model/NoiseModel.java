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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The power-law-plus-floor noise model power(x) = C + N * x^a fit to one segment's power spectrum.
 */
public class NoiseModel {
  public enum FitStatus {
    CONVERGED,
    FALLBACK,
  }

  public static final double FALLBACK_AMPLITUDE = 0.0;
  public static final double FALLBACK_EXPONENT = -1.0;

  @JsonProperty("floor")
  private double floor;

  @JsonProperty("amplitude")
  private double amplitude;

  @JsonProperty("exponent")
  private double exponent;

  @JsonProperty("status")
  private FitStatus status;

  protected NoiseModel() {

  }

  public NoiseModel(double floor, double amplitude, double exponent, FitStatus status) {
    this.floor = floor;
    this.amplitude = amplitude;
    this.exponent = exponent;
    this.status = status;
  }

  /**
   * A flat model: only the floor is kept, so the attenuation filter suppresses every frequency.
   */
  public static NoiseModel fallback(double floor) {
    return new NoiseModel(floor, FALLBACK_AMPLITUDE, FALLBACK_EXPONENT, FitStatus.FALLBACK);
  }

  public double getFloor() {
    return floor;
  }

  public double getAmplitude() {
    return amplitude;
  }

  public double getExponent() {
    return exponent;
  }

  public FitStatus getStatus() {
    return status;
  }

  /**
   * The power-law term N * x^a at a 1-based frequency abscissa.
   */
  public double excessPower(double x) {
    if (amplitude == 0.0) {
      return 0.0;
    }
    return amplitude * Math.pow(x, exponent);
  }

  public double totalPower(double x) {
    return floor + excessPower(x);
  }

  @Override
  public String toString() {
    return String.format("C=%.6g N=%.6g a=%.4f (%s)", floor, amplitude, exponent, status);
  }
}
