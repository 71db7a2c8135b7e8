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

package com.rgs.bkgsmoothing.boundary;

import com.rgs.bkgsmoothing.model.ChannelGrid;
import com.rgs.bkgsmoothing.model.SegmentBoundary;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the wavelength limits of the nine CCD segments by sliding the instrument's gap template until its interior
 * boundaries sit in the gaps of the observed exposure.
 */
public class SegmentBoundaryResolver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SegmentBoundaryResolver.class);

  public static final int SEGMENT_COUNT = InstrumentCalibration.TEMPLATE_LENGTH - 1;

  // The template is shifted by +/- DELTA_STEP * k for k in [0, MAX_DELTA_STEPS).
  private static final double DELTA_STEP = 0.01;
  private static final int MAX_DELTA_STEPS = 99;
  private static final int[] DELTA_SIGNS = new int[]{-1, 1};

  private final InstrumentCalibrationCorpus corpus;

  public SegmentBoundaryResolver(InstrumentCalibrationCorpus corpus) {
    this.corpus = corpus;
  }

  public BoundaryAlignment resolve(int instrumentId, int order, ChannelGrid grid) throws InvalidInstrumentException {
    InstrumentCalibration calibration = corpus.getCalibration(instrumentId, order);
    List<Pair<Double, Double>> runs = findGoodExposureRuns(grid);
    LOGGER.debug("Found %d good-exposure runs for %s order %d", runs.size(), calibration.getName(), order);

    int bestNogap = Integer.MAX_VALUE;
    double bestDelta = 0.0;
    search:
    for (int k = 0; k < MAX_DELTA_STEPS; k++) {
      for (int sign : DELTA_SIGNS) {
        if (k == 0 && sign > 0) {
          // +0 and -0 are the same shift.
          continue;
        }
        double delta = k == 0 ? 0.0 : sign * k * DELTA_STEP;
        int nogap = countNogap(calibration.shiftedTemplate(delta, order), runs);
        if (nogap < bestNogap) {
          bestNogap = nogap;
          bestDelta = delta;
        }
        if (nogap == 0) {
          break search;
        }
      }
    }

    if (bestNogap > 0) {
      LOGGER.warn("No exact gap alignment for %s order %d; using delta %.2f with %d boundaries on data",
          calibration.getName(), order, bestDelta, bestNogap);
    } else {
      LOGGER.info("Aligned %s order %d gap template with delta %.2f", calibration.getName(), order, bestDelta);
    }

    double[] shifted = calibration.shiftedTemplate(bestDelta, order);
    List<SegmentBoundary> boundaries = new ArrayList<>(SEGMENT_COUNT);
    for (int j = 0; j < SEGMENT_COUNT; j++) {
      boundaries.add(new SegmentBoundary(j, shifted[j], shifted[j + 1]));
    }
    return new BoundaryAlignment(bestDelta, bestNogap, boundaries);
  }

  /**
   * Counts the interior template boundaries (template positions 1..8) that fall inside observed data.  Each
   * boundary is counted at most once.
   */
  static int countNogap(double[] shiftedTemplate, List<Pair<Double, Double>> runs) {
    int nogap = 0;
    for (int j = 1; j < shiftedTemplate.length - 1; j++) {
      double boundary = shiftedTemplate[j];
      for (Pair<Double, Double> run : runs) {
        if (boundary >= run.getLeft() && boundary <= run.getRight()) {
          nogap++;
          break;
        }
      }
    }
    return nogap;
  }

  /**
   * Groups grid entries with consecutive good-channel indices into runs of uninterrupted exposure.  A break in the
   * index sequence is a zero- or low-exposure stretch, i.e. a gap.
   * @return The [min, max] wavelength span of each run.
   */
  public static List<Pair<Double, Double>> findGoodExposureRuns(ChannelGrid grid) {
    List<Pair<Double, Double>> runs = new ArrayList<>();
    if (grid.size() == 0) {
      return runs;
    }

    double low = grid.getWavelengthLow(0), high = grid.getWavelengthHigh(0);
    for (int i = 1; i < grid.size(); i++) {
      if (Math.abs(grid.getGoodChannel(i) - grid.getGoodChannel(i - 1)) != 1) {
        runs.add(Pair.of(low, high));
        low = grid.getWavelengthLow(i);
        high = grid.getWavelengthHigh(i);
      } else {
        low = Math.min(low, grid.getWavelengthLow(i));
        high = Math.max(high, grid.getWavelengthHigh(i));
      }
    }
    runs.add(Pair.of(low, high));
    return runs;
  }
}
