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

package com.rgs.bkgsmoothing.reconstruction;

import com.rgs.bkgsmoothing.model.NoiseModel;
import com.rgs.bkgsmoothing.model.SmoothedBackground;
import com.rgs.bkgsmoothing.noise.PowerSpectrum;
import com.rgs.bkgsmoothing.noise.SegmentNoiseAnalysis;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Applies a segment's attenuation filter in the frequency domain and writes the inverse-transformed trace back
 * into the smoothed background at the segment's own channels.
 */
public class SpectralReconstructor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectralReconstructor.class);
  private static final FastFourierTransformer TRANSFORMER = new FastFourierTransformer(DftNormalization.STANDARD);

  /**
   * Reconstructs one segment into the target.  Empty segments write nothing.
   * @return The number of channels written.
   */
  public int reconstruct(SegmentNoiseAnalysis analysis, SmoothedBackground target) {
    if (analysis.isEmpty()) {
      return 0;
    }

    double[] smoothed = reconstructTrace(analysis.getSpectrum(), analysis.getNoiseModel());
    int[] members = analysis.getMembers();
    for (int k = 0; k < members.length; k++) {
      target.set(members[k], smoothed[k]);
    }
    LOGGER.debug("%s: wrote %d smoothed channels (%d..%d)", analysis.getBoundary(), members.length,
        analysis.getFirstMember(), analysis.getLastMember());
    return members.length;
  }

  /**
   * Filters and inverts the spectrum.
   * @return The full padded trace (fftSize values) with the mean restored; the first traceLength entries line up
   *         with the segment's channels.
   */
  public double[] reconstructTrace(PowerSpectrum spectrum, NoiseModel model) {
    int spectrumLength = spectrum.getSpectrumLength();
    int fftSize = spectrum.getFftSize();

    AttenuationFilter filter = AttenuationFilter.fromModel(model, spectrumLength);
    if (filter.getDegenerateBins() > 0) {
      LOGGER.debug("Noise model %s has zero total power in %d of %d bins", model,
          filter.getDegenerateBins(), spectrumLength);
    }

    // Rebuild the Hermitian full spectrum from the filtered one-sided half.
    Complex[] full = new Complex[fftSize];
    for (int i = 0; i < spectrumLength; i++) {
      Complex c = spectrum.getCoefficient(i);
      double phi = filter.getPhi(i);
      full[i] = new Complex(c.getReal() * phi, c.getImaginary() * phi);
    }
    // The DC and Nyquist bins of a real signal are real.
    full[0] = new Complex(full[0].getReal(), 0.0);
    int nyquist = fftSize / 2;
    full[nyquist] = new Complex(full[nyquist].getReal(), 0.0);
    for (int i = 1; i < nyquist; i++) {
      full[fftSize - i] = full[i].conjugate();
    }

    Complex[] inverse = TRANSFORMER.transform(full, TransformType.INVERSE);
    double scale = outputScale(spectrum);
    double mean = spectrum.getMean();
    double[] trace = new double[fftSize];
    for (int i = 0; i < fftSize; i++) {
      trace[i] = inverse[i].getReal() * scale + mean;
    }
    return trace;
  }

  /**
   * The factor the inverse transform is multiplied by before the mean is restored.
   */
  public static double outputScale(PowerSpectrum spectrum) {
    return spectrum.getSpectrumLength() * (2.0 / spectrum.getFftSize());
  }
}
