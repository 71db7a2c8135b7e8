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

package com.rgs.bkgsmoothing.io;

import com.rgs.bkgsmoothing.boundary.SegmentBoundaryResolver;
import com.rgs.bkgsmoothing.model.ChannelGrid;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;

public class ChannelGridParserTest {

  @Test
  public void testParsesFixture() throws Exception {
    ChannelGrid grid;
    try (InputStream is = getClass().getResourceAsStream("/channel_grid.tsv")) {
      grid = new ChannelGridParser().parse(is);
    }

    assertEquals("Five rows", 5, grid.size());
    assertEquals("Channel index", 812, grid.getGoodChannel(0));
    assertEquals("Lower bound", 17.22, grid.getWavelengthLow(2), 1e-12);
    assertEquals("Exposure", 998.5, grid.getExposure(2), 1e-12);
    assertEquals("Source counts", 61.0, grid.getSourceCounts(1), 1e-12);
    assertEquals("Background counts", 10.75, grid.getBackgroundCounts(4), 1e-12);
    assertEquals("Missing channel 815 splits the rows into two runs", 2,
        SegmentBoundaryResolver.findGoodExposureRuns(grid).size());
  }

  @Test(expected = IOException.class)
  public void testMissingColumnIsRejected() throws Exception {
    String tsv = "channel\twavelength_low\twavelength_high\texposure\tsource_counts\n1\t10.0\t10.1\t100\t5\n";
    new ChannelGridParser().parse(new ByteArrayInputStream(tsv.getBytes(StandardCharsets.UTF_8)));
  }

  @Test(expected = IOException.class)
  public void testMalformedNumberIsRejected() throws Exception {
    String tsv = "channel\twavelength_low\twavelength_high\texposure\tsource_counts\tbackground_counts\n" +
        "1\t10.0\tten\t100\t5\t2\n";
    new ChannelGridParser().parse(new ByteArrayInputStream(tsv.getBytes(StandardCharsets.UTF_8)));
  }
}
