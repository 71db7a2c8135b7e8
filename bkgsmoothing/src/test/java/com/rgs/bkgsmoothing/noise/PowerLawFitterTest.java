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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PowerLawFitterTest {
  private final PowerLawFitter fitter = new PowerLawFitter(1000);

  @Test
  public void testRecoversExactPowerLaw() {
    double floor = 10.0, amplitude = 5000.0, exponent = -1.5;
    int n = 482;
    double[] x = new double[n], y = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = 31 + i;
      y[i] = floor + amplitude * Math.pow(x[i], exponent);
    }

    PowerLawFit fit = fitter.fit(x, y, floor);
    assertTrue("Fit converges on noiseless data", fit.isConverged());
    assertEquals("Amplitude is recovered", amplitude, fit.getAmplitude(), amplitude * 0.01);
    assertEquals("Exponent is recovered", exponent, fit.getExponent(), 0.01);
  }

  @Test
  public void testFlatDataHasNoExcess() {
    int n = 100;
    double[] x = new double[n], y = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = 31 + i;
      y[i] = 42.0;
    }

    PowerLawFit fit = fitter.fit(x, y, 42.0);
    assertTrue("Already at the optimum", fit.isConverged());
    assertEquals("No power law term", 0.0, fit.getAmplitude(), 1e-9);
  }

  @Test
  public void testParametersStayInBounds() {
    // Steeper than the exponent bound allows.
    int n = 200;
    double[] x = new double[n], y = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = 31 + i;
      y[i] = 1e12 * Math.pow(x[i], -6.0);
    }

    PowerLawFit fit = fitter.fit(x, y, 0.0);
    if (fit.isConverged()) {
      assertTrue("Exponent respects its lower bound", fit.getExponent() >= PowerLawFitter.EXPONENT_MIN);
      assertTrue("Exponent respects its upper bound", fit.getExponent() <= PowerLawFitter.EXPONENT_MAX);
      assertTrue("Amplitude respects its lower bound", fit.getAmplitude() >= PowerLawFitter.AMPLITUDE_MIN);
      assertTrue("Amplitude respects its upper bound", fit.getAmplitude() <= PowerLawFitter.AMPLITUDE_MAX);
    }
  }

  @Test
  public void testTooFewPointsFails() {
    PowerLawFit fit = fitter.fit(new double[]{31.0}, new double[]{5.0}, 1.0);
    assertFalse("One point can't constrain two parameters", fit.isConverged());
    assertTrue("Failed fits carry NaN parameters", Double.isNaN(fit.getAmplitude()));
  }

  @Test
  public void testLengthMismatchFails() {
    PowerLawFit fit = fitter.fit(new double[]{31.0, 32.0, 33.0}, new double[]{5.0, 4.0}, 1.0);
    assertFalse("Mismatched inputs are reported, not thrown", fit.isConverged());
  }
}
