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
import com.rgs.bkgsmoothing.model.ChannelGrid;
import com.rgs.bkgsmoothing.model.NoiseModel;
import com.rgs.bkgsmoothing.model.SegmentBoundary;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes each segment's background power spectrum and fits the power-law-plus-floor noise model to its
 * high-frequency band, where the power is assumed to be pure measurement noise.
 */
public class NoiseModelFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(NoiseModelFitter.class);

  // Exponents outside this range mean the optimizer ran away, not that the data is that steep.
  private static final double DIVERGENT_EXPONENT_MIN = -5.0;
  private static final double DIVERGENT_EXPONENT_MAX = -0.1;
  // Amplitudes below this are indistinguishable from a flat spectrum.
  private static final double AMPLITUDE_SNAP_THRESHOLD = 1e-4;

  private final Pair<Double, Double> wavelengthWindow;
  private final int lowBandStart;
  private final int bandSplit;
  private final int bandEnd;
  private final PowerLawFitter powerLawFitter;

  public NoiseModelFitter(SmoothingConfig config) {
    this.wavelengthWindow = config.getWavelengthWindow();
    this.lowBandStart = config.getLowBandStart();
    this.bandSplit = config.getBandSplit();
    this.bandEnd = config.getBandEnd();
    this.powerLawFitter = new PowerLawFitter(config.getFitMaxEvaluations());
  }

  public SegmentNoiseAnalysis analyze(SegmentBoundary boundary, ChannelGrid grid) {
    int[] members = selectMembers(boundary, grid);
    if (members.length == 0) {
      LOGGER.info("%s has no channels with usable exposure, skipping", boundary);
      return SegmentNoiseAnalysis.empty(boundary);
    }

    double[] trace = new double[members.length];
    for (int i = 0; i < members.length; i++) {
      trace[i] = grid.getBackgroundCounts(members[i]);
    }

    PowerSpectrum spectrum = PowerSpectrum.of(trace);
    LOGGER.debug("%s: %d channels (%d..%d), fft size %d, mean %.4f", boundary, members.length,
        members[0], members[members.length - 1], spectrum.getFftSize(), spectrum.getMean());

    NoiseModel model = fitNoiseModel(spectrum, boundary);
    LOGGER.info("%s power law fit: %s", boundary, model);
    return SegmentNoiseAnalysis.fitted(boundary, members, spectrum, model);
  }

  /**
   * Picks the grid positions whose wavelength is inside the segment and inside the configured window.
   */
  public int[] selectMembers(SegmentBoundary boundary, ChannelGrid grid) {
    List<Integer> members = new ArrayList<>();
    for (int i = 0; i < grid.size(); i++) {
      double w = grid.getWavelength(i);
      if (boundary.contains(w) && w >= wavelengthWindow.getLeft() && w <= wavelengthWindow.getRight()) {
        members.add(i);
      }
    }

    int[] result = new int[members.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = members.get(i);
    }
    return result;
  }

  public NoiseModel fitNoiseModel(PowerSpectrum spectrum, SegmentBoundary boundary) {
    int highEnd = Math.min(bandEnd, spectrum.getSpectrumLength());
    int highCount = Math.max(highEnd - bandSplit, 0);

    double[] x = new double[highCount];
    double[] y = new double[highCount];
    double floor = 0.0;
    for (int i = 0; i < highCount; i++) {
      int bin = bandSplit + i;
      // Bins are fit against a 1-based abscissa so that bin 0 has a finite power-law term.
      x[i] = bin + 1;
      y[i] = spectrum.getPower(bin);
      floor += y[i];
    }
    if (highCount > 0) {
      floor /= highCount;
    }

    if (LOGGER.isDebugEnabled()) {
      int lowEnd = Math.min(bandSplit, spectrum.getSpectrumLength());
      double lowSum = 0.0;
      for (int bin = lowBandStart; bin < lowEnd; bin++) {
        lowSum += spectrum.getPower(bin);
      }
      int lowCount = Math.max(lowEnd - lowBandStart, 0);
      LOGGER.debug("%s: low band mean power %.6g over %d bins, high band floor %.6g over %d bins", boundary,
          lowCount > 0 ? lowSum / lowCount : 0.0, lowCount, floor, highCount);
    }

    PowerLawFit fit = powerLawFitter.fit(x, y, floor);
    NoiseModel model;
    if (!fit.isConverged()) {
      LOGGER.warn("%s: power law fit failed (%s), using flat model", boundary, fit.getFailureReason());
      model = NoiseModel.fallback(floor);
    } else if (Double.isInfinite(fit.getAmplitude()) || fit.getExponent() < DIVERGENT_EXPONENT_MIN ||
        fit.getExponent() > DIVERGENT_EXPONENT_MAX) {
      LOGGER.warn("%s: power law fit diverged (N=%g, a=%g), using flat model", boundary,
          fit.getAmplitude(), fit.getExponent());
      model = NoiseModel.fallback(floor);
    } else {
      LOGGER.debug("%s: power law fit converged after %d iterations", boundary, fit.getIterations());
      model = new NoiseModel(floor, fit.getAmplitude(), fit.getExponent(), NoiseModel.FitStatus.CONVERGED);
    }

    if (Math.abs(model.getAmplitude()) < AMPLITUDE_SNAP_THRESHOLD && model.getAmplitude() != 0.0) {
      model = new NoiseModel(model.getFloor(), 0.0, model.getExponent(), model.getStatus());
    }
    return model;
  }
}
