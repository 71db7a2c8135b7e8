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

import com.rgs.bkgsmoothing.SmoothingConfig;
import com.rgs.bkgsmoothing.boundary.InstrumentCalibrationCorpus;
import com.rgs.bkgsmoothing.model.ChannelGrid;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ExposureMapAnalyzerTest {
  private static final int CHANNELS = 60;

  private InstrumentCalibrationCorpus corpus;
  private ExposureMapAnalyzer analyzer;
  private double[] exposure;

  @Before
  public void setUp() throws Exception {
    corpus = new InstrumentCalibrationCorpus();
    corpus.loadCorpus();
    analyzer = new ExposureMapAnalyzer(SmoothingConfig.loadDefaults());

    // Unexposed edges, three chip gaps (one two channels wide), one partially and one poorly exposed channel.
    exposure = new double[CHANNELS];
    Arrays.fill(exposure, 5, 55, 1000.0);
    exposure[15] = 0.0;
    exposure[16] = 0.0;
    exposure[30] = 0.0;
    exposure[45] = 0.0;
    exposure[20] = 900.0;
    exposure[21] = 500.0;
  }

  @Test
  public void testChannelTableFollowsGaps() throws Exception {
    ExposureProfile profile = analyzer.analyze(exposure, corpus.getCalibration(2, 1));

    assertEquals("Max exposure", 1000.0, profile.getMaxExposure(), 0.0);
    assertEquals("First exposed channel", 5, profile.getFirstChannel());
    assertEquals("Last exposed channel", 54, profile.getLastChannel());
    assertEquals("Rows run from edge to gap, gap to gap and gap to edge", Arrays.asList(
        new ChannelRange(5, 15), new ChannelRange(16, 30), new ChannelRange(30, 45), new ChannelRange(45, 54)),
        profile.getSegmentChannels());
  }

  @Test
  public void testChannelOverrideIsInserted() throws Exception {
    ExposureProfile profile = analyzer.analyze(exposure, corpus.getCalibration(1, 1));
    assertEquals("RGS1 gets its fixed row before the second jump", Arrays.asList(
        new ChannelRange(5, 15), new ChannelRange(16, 30), new ChannelRange(650, 965),
        new ChannelRange(30, 45), new ChannelRange(45, 54)),
        profile.getSegmentChannels());
  }

  @Test
  public void testGoodAndLowExposureChannels() throws Exception {
    ExposureProfile profile = analyzer.analyze(exposure, corpus.getCalibration(2, 1));
    assertEquals("Exposed channels minus gaps and the poorly exposed one", 45, profile.getGoodChannels().length);
    assertEquals("Partially exposed channel is still good", 13,
        Arrays.binarySearch(profile.getGoodChannels(), 20));
    assertArrayEquals("Only channel 20 is partially exposed", new int[]{20}, profile.getLowExposureChannels());
  }

  @Test
  public void testPrepareRescalesBackground() throws Exception {
    double[] eLow = new double[CHANNELS], eHigh = new double[CHANNELS];
    for (int i = 0; i < CHANNELS; i++) {
      eLow[i] = 0.3 + 0.01 * i;
      eHigh[i] = eLow[i] + 0.01;
    }
    double[] src = new double[CHANNELS], bkg = new double[CHANNELS];
    double[] srcBackscal = new double[CHANNELS], bkgBackscal = new double[CHANNELS];
    Arrays.fill(src, 30.0);
    Arrays.fill(bkg, 10.0);
    Arrays.fill(srcBackscal, 2.0);
    Arrays.fill(bkgBackscal, 4.0);
    bkgBackscal[7] = 0.0;

    RawSpectra raw = new RawSpectra(eLow, eHigh, exposure, src, srcBackscal, bkg, bkgBackscal);
    Pair<ExposureProfile, ChannelGrid> prepared = analyzer.prepare(raw, corpus.getCalibration(2, 1));
    ChannelGrid grid = prepared.getRight();

    assertEquals("Grid holds the good channels", 45, grid.size());
    assertEquals("First grid entry is channel 5", 5, grid.getGoodChannel(0));
    assertEquals("Background scaled to the source area", 5.0, grid.getBackgroundCounts(0), 1e-12);
    assertEquals("Zero background area gives no background", 0.0, grid.getBackgroundCounts(2), 0.0);

    assertEquals("Channel 20 sits at grid position 13", 20, grid.getGoodChannel(13));
    assertEquals("Partial exposure is scaled up", 1000.0 * 5.0 / 900.0, grid.getBackgroundCounts(13), 1e-9);
    assertEquals("Partial exposure takes its best neighbour's value", 1000.0, grid.getExposure(13), 0.0);

    assertEquals("Wavelength comes from the energy bounds", ChannelGrid.HC_KEV_ANGSTROM / eHigh[5],
        grid.getWavelengthLow(0), 1e-12);
    assertEquals("Raw exposure is left alone", 900.0, raw.getExposure()[20], 0.0);
  }

  @Test
  public void testColumnMaxima() {
    double[][] map = new double[][]{
        {1.0, 5.0, 0.0},
        {3.0, 2.0, 0.0},
        {2.0, 4.0, 7.0},
    };
    assertArrayEquals(new double[]{3.0, 5.0, 7.0}, ExposureMapAnalyzer.columnMaxima(map), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoGapsIsRejected() throws Exception {
    double[] flat = new double[CHANNELS];
    Arrays.fill(flat, 1000.0);
    analyzer.analyze(flat, corpus.getCalibration(2, 1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnexposedMapIsRejected() throws Exception {
    analyzer.analyze(new double[CHANNELS], corpus.getCalibration(2, 1));
  }
}
