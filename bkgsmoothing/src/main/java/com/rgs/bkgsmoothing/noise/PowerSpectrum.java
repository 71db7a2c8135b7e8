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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

import java.util.Arrays;

/**
 * The one-sided Fourier spectrum of a segment's background trace.  The trace is padded with its own mean up to
 * the FFT size and then mean-subtracted, so the padding contributes no edge step.
 */
public class PowerSpectrum {
  private static final FastFourierTransformer TRANSFORMER = new FastFourierTransformer(DftNormalization.STANDARD);

  private final int traceLength;
  private final int fftSize;
  private final double mean;
  private final double[] paddedTrace;
  private final Complex[] coefficients;
  private final double[] power;

  private PowerSpectrum(int traceLength, int fftSize, double mean, double[] paddedTrace, Complex[] coefficients) {
    this.traceLength = traceLength;
    this.fftSize = fftSize;
    this.mean = mean;
    this.paddedTrace = paddedTrace;
    this.coefficients = coefficients;
    this.power = new double[coefficients.length];
    for (int i = 0; i < coefficients.length; i++) {
      double re = coefficients[i].getReal(), im = coefficients[i].getImaginary();
      power[i] = re * re + im * im;
    }
  }

  public static PowerSpectrum of(double[] trace) {
    if (trace.length == 0) {
      throw new IllegalArgumentException("Cannot compute the spectrum of an empty trace");
    }

    int fftSize = fftSizeFor(trace.length);
    double sum = 0.0;
    for (double v : trace) {
      sum += v;
    }
    double mean = sum / trace.length;

    double[] padded = new double[fftSize];
    System.arraycopy(trace, 0, padded, 0, trace.length);
    Arrays.fill(padded, trace.length, fftSize, mean);
    for (int i = 0; i < fftSize; i++) {
      padded[i] -= mean;
    }

    Complex[] full = TRANSFORMER.transform(padded, TransformType.FORWARD);
    Complex[] oneSided = Arrays.copyOf(full, fftSize / 2 + 1);
    return new PowerSpectrum(trace.length, fftSize, mean, padded, oneSided);
  }

  /**
   * @return The smallest power of two that is at least twice the trace length.
   */
  public static int fftSizeFor(int traceLength) {
    int size = 2;
    while (size < 2 * traceLength) {
      size <<= 1;
    }
    return size;
  }

  public int getTraceLength() {
    return traceLength;
  }

  public int getFftSize() {
    return fftSize;
  }

  /**
   * @return The number of one-sided bins, fftSize / 2 + 1.
   */
  public int getSpectrumLength() {
    return coefficients.length;
  }

  public double getMean() {
    return mean;
  }

  public double[] getPaddedTrace() {
    return Arrays.copyOf(paddedTrace, paddedTrace.length);
  }

  public Complex getCoefficient(int bin) {
    return coefficients[bin];
  }

  public double getPower(int bin) {
    return power[bin];
  }
}
