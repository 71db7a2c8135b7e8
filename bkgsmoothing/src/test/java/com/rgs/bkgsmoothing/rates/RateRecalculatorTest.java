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

import com.rgs.bkgsmoothing.SmoothingConfig;
import com.rgs.bkgsmoothing.model.ChannelGrid;
import com.rgs.bkgsmoothing.model.SmoothedBackground;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RateRecalculatorTest {
  private static final double TOLERANCE = 1e-12;

  private ChannelGrid grid;
  private SmoothedBackground smoothed;

  @Before
  public void setUp() {
    grid = new ChannelGrid(
        new double[]{10.0, 10.1, 10.2},
        new double[]{10.1, 10.2, 10.3},
        new double[]{100.0, 0.0, 50.0},
        new double[]{20.0, 5.0, 10.0},
        new double[]{4.0, 4.0, 4.0},
        new int[]{10, 11, 4000});
    smoothed = new SmoothedBackground(3);
    smoothed.set(0, 5.0);
    smoothed.set(1, 2.0);
    smoothed.set(2, 3.0);
  }

  @Test
  public void testRatesPerChannel() {
    RateRecalculator rates = new RateRecalculator(grid, smoothed);

    assertEquals("Net rate", 0.15, rates.getSourceRate(0), TOLERANCE);
    assertEquals("Rate error", Math.sqrt(20.0) / 100.0, rates.getSourceRateError(0), TOLERANCE);
    assertEquals("Background rate", 0.05, rates.getBackgroundRate(0), TOLERANCE);
    assertEquals("Residual", -1.0, rates.getResidual(0), TOLERANCE);

    assertEquals("Zero exposure gives zero rate", 0.0, rates.getSourceRate(1), 0.0);
    assertEquals("Zero exposure gives zero error", 0.0, rates.getSourceRateError(1), 0.0);
    assertEquals("Zero exposure gives zero background rate", 0.0, rates.getBackgroundRate(1), 0.0);
    assertEquals("Residual doesn't need exposure", 2.0, rates.getResidual(1), TOLERANCE);

    assertEquals("Net rate", 0.14, rates.getSourceRate(2), TOLERANCE);
  }

  @Test
  public void testNetSpectrumIsEnergyOrdered() {
    NetSpectrum spectrum = new RateRecalculator(grid, smoothed).toNetSpectrum();

    assertEquals(3, spectrum.size());
    assertArrayEquals("Rates are reversed", new double[]{0.14, 0.0, 0.15}, spectrum.getSourceRate(), TOLERANCE);
    assertArrayEquals("Counts are reversed with them", new double[]{3.0, 2.0, 5.0},
        spectrum.getBackgroundCounts(), 0.0);
    assertEquals("Highest wavelength is lowest energy", ChannelGrid.HC_KEV_ANGSTROM / 10.3,
        spectrum.getEnergyLow()[0], TOLERANCE);
    double[] eLow = spectrum.getEnergyLow();
    for (int i = 1; i < eLow.length; i++) {
      assertTrue("Energies increase", eLow[i] > eLow[i - 1]);
    }
  }

  @Test
  public void testFullGridPlacesGoodChannels() throws Exception {
    int fullChannels = SmoothingConfig.loadDefaults().getFullChannelCount();
    RateRecalculator rates = new RateRecalculator(grid, smoothed);

    double[] background = rates.toFullGrid(RateRecalculator.BACKGROUND_RATE, fullChannels);
    double[] netCounts = rates.toFullGrid(RateRecalculator.SOURCE_COUNTS, fullChannels);

    assertEquals("Full instrument grid", 3600, background.length);
    assertEquals("Channel 10 background rate", 0.05, background[10], TOLERANCE);
    assertEquals("Channel 10 net counts", 15.0, netCounts[10], TOLERANCE);
    assertEquals("Channels that weren't good are zero", 0.0, background[12], 0.0);
    double sum = 0.0;
    for (double v : background) {
      sum += v;
    }
    assertEquals("Channel 4000 is off the grid and dropped", 0.05, sum, TOLERANCE);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownColumn() {
    new RateRecalculator(grid, smoothed).toFullGrid("exposure", 3600);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSizeMismatch() {
    new RateRecalculator(grid, new SmoothedBackground(2));
  }
}
