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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The wavelength range [w1, w2) covered by one of the nine CCD segments.
 */
public class SegmentBoundary {
  @JsonProperty("segment")
  private int segmentIndex;

  @JsonProperty("w1")
  private double w1;

  @JsonProperty("w2")
  private double w2;

  protected SegmentBoundary() {

  }

  public SegmentBoundary(int segmentIndex, double w1, double w2) {
    if (w2 < w1) {
      throw new IllegalArgumentException(String.format(
          "Segment %d boundary is reversed: w1=%f w2=%f", segmentIndex, w1, w2));
    }
    this.segmentIndex = segmentIndex;
    this.w1 = w1;
    this.w2 = w2;
  }

  public int getSegmentIndex() {
    return segmentIndex;
  }

  public double getW1() {
    return w1;
  }

  public double getW2() {
    return w2;
  }

  public boolean contains(double wavelength) {
    return wavelength >= w1 && wavelength < w2;
  }

  @Override
  public String toString() {
    return String.format("CCD %d [%.4f, %.4f)", segmentIndex + 1, w1, w2);
  }
}
