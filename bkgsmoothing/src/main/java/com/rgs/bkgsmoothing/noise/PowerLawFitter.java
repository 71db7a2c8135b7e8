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

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fits y = C + N * x^a for (N, a) with the floor C held fixed, using bounded Levenberg-Marquardt.
 */
public class PowerLawFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PowerLawFitter.class);

  public static final double AMPLITUDE_MIN = 0.0;
  public static final double AMPLITUDE_MAX = 1e10;
  public static final double EXPONENT_MIN = -3.0;
  public static final double EXPONENT_MAX = -0.1;

  private static final double INITIAL_EXPONENT = -1.0;
  private static final int PARAMETER_COUNT = 2;
  private static final int AMPLITUDE = 0;
  private static final int EXPONENT = 1;

  private final int maxEvaluations;

  public PowerLawFitter(int maxEvaluations) {
    this.maxEvaluations = maxEvaluations;
  }

  /**
   * Runs the fit.  Never throws on bad data: optimizer failures, too few points and the like come back as a
   * non-converged result so the caller can pick a fallback explicitly.
   * @param x The abscissae, all positive.
   * @param y The observed values at each abscissa.
   * @param floor The fixed constant term C.
   * @return The fitted (N, a), clamped to their bounds, or a failed fit.
   */
  public PowerLawFit fit(final double[] x, double[] y, final double floor) {
    if (x.length != y.length) {
      return PowerLawFit.failed(String.format("abscissa/ordinate length mismatch: %d vs %d", x.length, y.length));
    }
    if (x.length < PARAMETER_COUNT) {
      return PowerLawFit.failed(String.format("%d points cannot constrain %d parameters", x.length, PARAMETER_COUNT));
    }

    MultivariateJacobianFunction model = new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(RealVector point) {
        double amplitude = point.getEntry(AMPLITUDE), exponent = point.getEntry(EXPONENT);
        RealVector values = new ArrayRealVector(x.length);
        RealMatrix jacobian = new Array2DRowRealMatrix(x.length, PARAMETER_COUNT);
        for (int i = 0; i < x.length; i++) {
          double xa = Math.pow(x[i], exponent);
          values.setEntry(i, floor + amplitude * xa);
          jacobian.setEntry(i, AMPLITUDE, xa);
          jacobian.setEntry(i, EXPONENT, amplitude * xa * Math.log(x[i]));
        }
        return new Pair<>(values, jacobian);
      }
    };

    LeastSquaresProblem problem = new LeastSquaresBuilder().
        start(initialGuess(x, y, floor)).
        target(y).
        model(model).
        parameterValidator(new BoundsValidator()).
        lazyEvaluation(false).
        maxEvaluations(maxEvaluations).
        maxIterations(maxEvaluations).
        build();

    LeastSquaresOptimizer.Optimum optimum;
    try {
      optimum = new LevenbergMarquardtOptimizer().optimize(problem);
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      LOGGER.debug("Power law fit over %d points failed: %s", x.length, e.getMessage());
      return PowerLawFit.failed(e.getMessage());
    }

    RealVector point = clamp(optimum.getPoint());
    double amplitude = point.getEntry(AMPLITUDE), exponent = point.getEntry(EXPONENT);
    if (Double.isNaN(amplitude) || Double.isNaN(exponent)) {
      return PowerLawFit.failed("fit produced non-finite parameters");
    }
    return PowerLawFit.converged(amplitude, exponent, optimum.getIterations());
  }

  /**
   * Starts from a -1 slope through the first point's excess over the floor.
   */
  private static double[] initialGuess(double[] x, double[] y, double floor) {
    double excess = Math.max(y[0] - floor, 0.0);
    double amplitude = excess * Math.pow(x[0], -INITIAL_EXPONENT);
    return new double[]{
        Math.min(Math.max(amplitude, AMPLITUDE_MIN), AMPLITUDE_MAX),
        INITIAL_EXPONENT
    };
  }

  private static RealVector clamp(RealVector params) {
    RealVector clamped = params.copy();
    clamped.setEntry(AMPLITUDE, Math.min(Math.max(params.getEntry(AMPLITUDE), AMPLITUDE_MIN), AMPLITUDE_MAX));
    clamped.setEntry(EXPONENT, Math.min(Math.max(params.getEntry(EXPONENT), EXPONENT_MIN), EXPONENT_MAX));
    return clamped;
  }

  private static class BoundsValidator implements ParameterValidator {
    /**
     * Projects every trial point back into the feasible box before the model is evaluated.
     */
    @Override
    public RealVector validate(RealVector params) {
      return clamp(params);
    }
  }
}
