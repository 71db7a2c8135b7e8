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

import com.rgs.bkgsmoothing.SmoothingConfig;
import com.rgs.bkgsmoothing.TestGrids;
import com.rgs.bkgsmoothing.model.ChannelGrid;
import com.rgs.bkgsmoothing.model.NoiseModel;
import com.rgs.bkgsmoothing.model.SegmentBoundary;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class NoiseModelFitterTest {
  private SmoothingConfig config;

  @Before
  public void setUp() throws Exception {
    config = SmoothingConfig.loadDefaults();
  }

  @Test
  public void testMembersFollowSegmentAndWindow() {
    ChannelGrid grid = TestGrids.uniformGrid(17.2, 20.6, TestGrids.constant(340, 10.0));
    SegmentBoundary boundary = new SegmentBoundary(4, 17.09, 20.77);

    NoiseModelFitter unwindowed = new NoiseModelFitter(config);
    assertEquals("Whole grid lies in the segment", 340, unwindowed.selectMembers(boundary, grid).length);

    config.setWavelengthWindow(18.0, 19.0);
    NoiseModelFitter windowed = new NoiseModelFitter(config);
    int[] members = windowed.selectMembers(boundary, grid);
    assertTrue("The window trims the segment", members.length > 0 && members.length < 340);
    for (int i = 1; i < members.length; i++) {
      assertEquals("Members are contiguous grid positions", members[i - 1] + 1, members[i]);
    }
    for (int member : members) {
      double w = grid.getWavelength(member);
      assertTrue(String.format("Wavelength %f is inside the window", w), w >= 18.0 && w <= 19.0);
    }
  }

  @Test
  public void testSegmentWithoutChannelsIsEmpty() {
    ChannelGrid grid = TestGrids.uniformGrid(17.2, 20.6, TestGrids.constant(340, 10.0));
    SegmentNoiseAnalysis analysis =
        new NoiseModelFitter(config).analyze(new SegmentBoundary(0, 0.0, 7.69), grid);
    assertTrue("No channel falls below 7.69 A", analysis.isEmpty());
    assertNull("Empty segments have no spectrum", analysis.getSpectrum());
    assertNull("Empty segments have no model", analysis.getNoiseModel());
  }

  @Test
  public void testFittedModelRespectsBounds() {
    for (long seed = 1; seed <= 5; seed++) {
      double[] background = TestGrids.gaussianNoise(512, 100.0, 10.0, seed);
      ChannelGrid grid = TestGrids.uniformGrid(17.2, 20.6, background);
      SegmentNoiseAnalysis analysis =
          new NoiseModelFitter(config).analyze(new SegmentBoundary(4, 17.09, 20.77), grid);

      NoiseModel model = analysis.getNoiseModel();
      assertEquals("Every channel is a member", 512, analysis.getMemberCount());
      assertEquals("FFT covers twice the trace", 1024, analysis.getSpectrum().getFftSize());
      assertTrue("Exponent is at least -3", model.getExponent() >= -3.0);
      assertTrue("Exponent is at most -0.1", model.getExponent() <= -0.1);
      assertTrue(String.format("Amplitude %g is 0 or at least 1e-4", model.getAmplitude()),
          model.getAmplitude() == 0.0 || model.getAmplitude() >= 1e-4);
      // White noise of variance 100 spreads 512 * 100 of power into each bin on average.
      assertEquals("Floor is the high band noise power", 51200.0, model.getFloor(), 51200.0 * 0.25);
    }
  }

  @Test
  public void testFlatTraceFitsFlatModel() {
    ChannelGrid grid = TestGrids.uniformGrid(17.2, 20.6, TestGrids.constant(200, 30.0));
    SegmentNoiseAnalysis analysis =
        new NoiseModelFitter(config).analyze(new SegmentBoundary(4, 17.09, 20.77), grid);
    NoiseModel model = analysis.getNoiseModel();
    assertEquals("No noise floor", 0.0, model.getFloor(), 1e-9);
    assertEquals("No power law term", 0.0, model.getAmplitude(), 0.0);
  }

  @Test
  public void testShortSegmentFallsBack() {
    // Four channels give an 8-point transform: the high band starting at bin 30 is empty.
    ChannelGrid grid = TestGrids.uniformGrid(17.2, 17.6, new double[]{10.0, 12.0, 9.0, 11.0});
    SegmentNoiseAnalysis analysis =
        new NoiseModelFitter(config).analyze(new SegmentBoundary(4, 17.09, 20.77), grid);
    NoiseModel model = analysis.getNoiseModel();
    assertEquals("Too few bins to fit", NoiseModel.FitStatus.FALLBACK, model.getStatus());
    assertEquals("Fallback has no power law term", 0.0, model.getAmplitude(), 0.0);
    assertEquals("Fallback exponent", NoiseModel.FALLBACK_EXPONENT, model.getExponent(), 0.0);
  }
}
