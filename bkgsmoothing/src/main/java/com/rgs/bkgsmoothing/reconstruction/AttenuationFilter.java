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

/**
 * The per-bin fraction of modelled power that belongs to structure rather than to the flat noise floor:
 * phi = N x^a / (C + N x^a), with x the 1-based bin number.  Close to 1 where the power law dominates and falling
 * toward 0 where the floor does.
 */
public class AttenuationFilter {
  private final double[] phi;
  private final int degenerateBins;

  private AttenuationFilter(double[] phi, int degenerateBins) {
    this.phi = phi;
    this.degenerateBins = degenerateBins;
  }

  public static AttenuationFilter fromModel(NoiseModel model, int spectrumLength) {
    double[] phi = new double[spectrumLength];
    int degenerate = 0;
    for (int i = 0; i < spectrumLength; i++) {
      double x = i + 1;
      double excess = model.excessPower(x);
      double total = model.totalPower(x);
      if (total == 0.0) {
        phi[i] = 0.0;
        degenerate++;
      } else {
        phi[i] = excess / total;
      }
    }
    return new AttenuationFilter(phi, degenerate);
  }

  public double getPhi(int bin) {
    return phi[bin];
  }

  /**
   * @return How many bins had zero modelled power and were zeroed outright.
   */
  public int getDegenerateBins() {
    return degenerateBins;
  }
}
