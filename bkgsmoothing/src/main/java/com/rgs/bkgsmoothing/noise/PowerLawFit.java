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

package com.rgs.bkgsmoothing.noise;

/**
 * Result of a power-law fit.  A fit that did not converge carries no usable parameters, only the reason.
 */
public class PowerLawFit {
  private final double amplitude;
  private final double exponent;
  private final boolean converged;
  private final int iterations;
  private final String failureReason;

  private PowerLawFit(double amplitude, double exponent, boolean converged, int iterations, String failureReason) {
    this.amplitude = amplitude;
    this.exponent = exponent;
    this.converged = converged;
    this.iterations = iterations;
    this.failureReason = failureReason;
  }

  public static PowerLawFit converged(double amplitude, double exponent, int iterations) {
    return new PowerLawFit(amplitude, exponent, true, iterations, null);
  }

  public static PowerLawFit failed(String reason) {
    return new PowerLawFit(Double.NaN, Double.NaN, false, 0, reason);
  }

  public double getAmplitude() {
    return amplitude;
  }

  public double getExponent() {
    return exponent;
  }

  public boolean isConverged() {
    return converged;
  }

  public int getIterations() {
    return iterations;
  }

  public String getFailureReason() {
    return failureReason;
  }
}
