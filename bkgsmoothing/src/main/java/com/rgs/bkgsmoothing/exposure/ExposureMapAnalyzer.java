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
import com.rgs.bkgsmoothing.boundary.InstrumentCalibration;
import com.rgs.bkgsmoothing.boundary.SegmentBoundaryResolver;
import com.rgs.bkgsmoothing.model.ChannelGrid;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns the per-channel exposure of an observation into the inputs of the smoothing: the good-exposure channel
 * grid and the channel range of every CCD.
 */
public class ExposureMapAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ExposureMapAnalyzer.class);

  private final double edgeExposureFraction;
  private final double lowExposureFraction;
  private final double fullExposureFraction;

  public ExposureMapAnalyzer(SmoothingConfig config) {
    this.edgeExposureFraction = config.getEdgeExposureFraction();
    this.lowExposureFraction = config.getLowExposureFraction();
    this.fullExposureFraction = config.getFullExposureFraction();
  }

  /**
   * Collapses a 2-D exposure map (rows are cross-dispersion pixels, columns are channels) to its per-channel
   * maximum.
   */
  public static double[] columnMaxima(double[][] exposureMap) {
    if (exposureMap.length == 0) {
      return new double[0];
    }
    double[] maxima = Arrays.copyOf(exposureMap[0], exposureMap[0].length);
    for (int row = 1; row < exposureMap.length; row++) {
      if (exposureMap[row].length != maxima.length) {
        throw new IllegalArgumentException(String.format(
            "Exposure map row %d has %d columns, expected %d", row, exposureMap[row].length, maxima.length));
      }
      for (int col = 0; col < maxima.length; col++) {
        maxima[col] = Math.max(maxima[col], exposureMap[row][col]);
      }
    }
    return maxima;
  }

  public ExposureProfile analyze(double[] exposure, InstrumentCalibration calibration) {
    double maxExposure = 0.0;
    for (double e : exposure) {
      maxExposure = Math.max(maxExposure, e);
    }
    if (!(maxExposure > 0.0)) {
      throw new IllegalArgumentException("Exposure map has no exposed channels");
    }

    // Skip channels at either end that have little or no exposure.
    double edgeThreshold = maxExposure * edgeExposureFraction;
    int firstChannel = 0, lastChannel = 0;
    for (int i = 0; i < exposure.length; i++) {
      if (exposure[i] != 0.0 && exposure[i] > edgeThreshold) {
        firstChannel = i;
        break;
      }
    }
    for (int i = exposure.length - 1; i >= 0; i--) {
      if (exposure[i] != 0.0 && exposure[i] > edgeThreshold) {
        lastChannel = i;
        break;
      }
    }
    LOGGER.debug("First channel with exposure %d, last channel with exposure %d", firstChannel, lastChannel);

    // Zero-exposure channels between the edges are chip gaps and bad columns.
    List<Integer> badChannels = new ArrayList<>();
    for (int i = firstChannel; i < lastChannel; i++) {
      if (exposure[i] == 0.0) {
        badChannels.add(i);
      }
    }
    if (badChannels.isEmpty()) {
      throw new IllegalArgumentException(String.format(
          "No zero-exposure channels between channels %d and %d; cannot locate the CCD gaps",
          firstChannel, lastChannel));
    }

    List<ChannelRange> segmentChannels = buildSegmentChannels(badChannels, firstChannel, lastChannel, calibration);
    if (segmentChannels.size() != SegmentBoundaryResolver.SEGMENT_COUNT) {
      LOGGER.warn("Exposure map yields %d CCD channel ranges for %s, expected %d", segmentChannels.size(),
          calibration.getName(), SegmentBoundaryResolver.SEGMENT_COUNT);
    }

    List<Integer> good = new ArrayList<>();
    List<Integer> low = new ArrayList<>();
    double lowThreshold = maxExposure * lowExposureFraction;
    double fullThreshold = maxExposure * fullExposureFraction;
    for (int i = 0; i < exposure.length; i++) {
      if (exposure[i] > lowThreshold) {
        good.add(i);
      }
      if (exposure[i] >= lowThreshold && exposure[i] <= fullThreshold) {
        low.add(i);
      }
    }
    LOGGER.info("%s exposure: max %.2f s, %d good channels, %d low-exposure channels", calibration.getName(),
        maxExposure, good.size(), low.size());

    return new ExposureProfile(maxExposure, firstChannel, lastChannel, segmentChannels, toArray(good), toArray(low));
  }

  /**
   * Builds the channel grid to smooth: background rescaled to the source extraction area, low-exposure channels
   * rescaled to full exposure, restricted to the good channels.
   */
  public Pair<ExposureProfile, ChannelGrid> prepare(RawSpectra raw, InstrumentCalibration calibration) {
    double[] exposure = Arrays.copyOf(raw.getExposure(), raw.size());
    ExposureProfile profile = analyze(exposure, calibration);

    double[] background = new double[raw.size()];
    double[] srcScale = raw.getSourceBackscal(), bkgScale = raw.getBackgroundBackscal();
    for (int i = 0; i < background.length; i++) {
      background[i] = bkgScale[i] != 0.0 ? raw.getBackgroundCounts()[i] * srcScale[i] / bkgScale[i] : 0.0;
    }

    double maxExposure = profile.getMaxExposure();
    int[] lowChannels = profile.getLowExposureChannels();
    for (int i : lowChannels) {
      background[i] = maxExposure * background[i] / exposure[i];
      exposure[i] = maxExposure;
    }
    // Treat partially exposed channels like their best-exposed neighbour.
    for (int i : lowChannels) {
      double left = i > 0 ? exposure[i - 1] : 0.0;
      double right = i < exposure.length - 1 ? exposure[i + 1] : 0.0;
      exposure[i] = Math.max(left, right);
    }

    int[] good = profile.getGoodChannels();
    double[] eLow = new double[good.length], eHigh = new double[good.length], exp = new double[good.length];
    double[] src = new double[good.length], bkg = new double[good.length];
    for (int k = 0; k < good.length; k++) {
      int i = good[k];
      eLow[k] = raw.getEnergyLow()[i];
      eHigh[k] = raw.getEnergyHigh()[i];
      exp[k] = exposure[i];
      src[k] = raw.getSourceCounts()[i];
      bkg[k] = background[i];
    }
    return Pair.of(profile, ChannelGrid.fromEnergyBounds(eLow, eHigh, exp, src, bkg, good));
  }

  private List<ChannelRange> buildSegmentChannels(List<Integer> badChannels, int firstChannel, int lastChannel,
                                                  InstrumentCalibration calibration) {
    List<ChannelRange> ranges = new ArrayList<>();
    ranges.add(new ChannelRange(firstChannel, badChannels.get(0)));

    int jumpIndex = 0;
    for (int j = 0; j < badChannels.size() - 1; j++) {
      if (badChannels.get(j + 1) - badChannels.get(j) == 1) {
        continue;
      }
      for (InstrumentCalibration.ChannelOverride override : calibration.getChannelOverrides()) {
        if (override.getJumpIndex() == jumpIndex) {
          ranges.add(new ChannelRange(override.getFirstChannel(), override.getLastChannel()));
        }
      }
      ranges.add(new ChannelRange(badChannels.get(j), badChannels.get(j + 1)));
      jumpIndex++;
    }

    int interiorSlots = SegmentBoundaryResolver.SEGMENT_COUNT - 1;
    if (ranges.size() > interiorSlots) {
      LOGGER.warn("Dropping %d surplus CCD channel ranges: %s", ranges.size() - interiorSlots,
          ranges.subList(interiorSlots, ranges.size()));
      ranges = new ArrayList<>(ranges.subList(0, interiorSlots));
    }
    ranges.add(new ChannelRange(badChannels.get(badChannels.size() - 1), lastChannel));
    return ranges;
  }

  private static int[] toArray(List<Integer> values) {
    int[] result = new int[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i);
    }
    return result;
  }
}
