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

package com.rgs.bkgsmoothing.model;

import java.util.Arrays;

/**
 * The merged smoothed background, indexed like the channel grid.  Starts at zero; each segment's reconstruction
 * writes its own disjoint set of channels, so concurrent writers never touch the same slot.
 */
public class SmoothedBackground {
  private final double[] values;

  public SmoothedBackground(int size) {
    this.values = new double[size];
  }

  public int size() {
    return values.length;
  }

  public void set(int channel, double value) {
    values[channel] = value;
  }

  public double get(int channel) {
    return values[channel];
  }

  public double[] toArray() {
    return Arrays.copyOf(values, values.length);
  }
}
