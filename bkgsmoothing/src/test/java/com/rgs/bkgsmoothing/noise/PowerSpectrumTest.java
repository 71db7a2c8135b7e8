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

import com.rgs.bkgsmoothing.TestGrids;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class PowerSpectrumTest {

  @Test
  public void testFftSizeIsSmallestPowerOfTwoCoveringTwiceTheTrace() {
    assertEquals(2, PowerSpectrum.fftSizeFor(1));
    assertEquals(4, PowerSpectrum.fftSizeFor(2));
    assertEquals(8, PowerSpectrum.fftSizeFor(3));
    assertEquals(256, PowerSpectrum.fftSizeFor(100));
    assertEquals(256, PowerSpectrum.fftSizeFor(128));
    assertEquals(1024, PowerSpectrum.fftSizeFor(512));
    assertEquals(2048, PowerSpectrum.fftSizeFor(513));
  }

  @Test
  public void testConstantTraceHasNoPower() {
    PowerSpectrum spectrum = PowerSpectrum.of(TestGrids.constant(50, 7.5));
    assertEquals("Mean is the constant", 7.5, spectrum.getMean(), 1e-12);
    assertEquals("Padded to 128", 128, spectrum.getFftSize());
    assertEquals("One-sided length", 65, spectrum.getSpectrumLength());
    for (int bin = 0; bin < spectrum.getSpectrumLength(); bin++) {
      assertEquals("A flat trace has zero power everywhere", 0.0, spectrum.getPower(bin), 1e-18);
    }
  }

  @Test
  public void testPaddingIsMeanSubtracted() {
    double[] trace = TestGrids.gaussianNoise(30, 20.0, 3.0, TestGrids.SEED);
    PowerSpectrum spectrum = PowerSpectrum.of(trace);
    double[] padded = spectrum.getPaddedTrace();

    assertEquals("Padded to 64", 64, padded.length);
    double sum = 0.0;
    for (int i = 0; i < padded.length; i++) {
      if (i < trace.length) {
        assertEquals("Trace values are mean-subtracted", trace[i] - spectrum.getMean(), padded[i], 1e-12);
      } else {
        assertEquals("Padding contributes nothing", 0.0, padded[i], 1e-12);
      }
      sum += padded[i];
    }
    assertEquals("DC bin is empty", 0.0, spectrum.getPower(0), 1e-9);
    assertEquals("Padded trace sums to zero", 0.0, sum, 1e-9);
  }

  @Test
  public void testParsevalHolds() {
    double[] trace = TestGrids.gaussianNoise(100, 0.0, 1.0, TestGrids.SEED);
    PowerSpectrum spectrum = PowerSpectrum.of(trace);
    double[] padded = spectrum.getPaddedTrace();

    double timeEnergy = 0.0;
    for (double v : padded) {
      timeEnergy += v * v;
    }
    int n = spectrum.getFftSize();
    double freqEnergy = spectrum.getPower(0) + spectrum.getPower(n / 2);
    for (int bin = 1; bin < n / 2; bin++) {
      freqEnergy += 2.0 * spectrum.getPower(bin);
    }
    assertEquals("Unnormalized forward transform", timeEnergy, freqEnergy / n, 1e-8);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyTraceIsRejected() {
    PowerSpectrum.of(new double[0]);
  }
}
