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

import com.rgs.bkgsmoothing.model.NoiseModel;
import com.rgs.bkgsmoothing.model.SegmentBoundary;

import java.util.Arrays;

/**
 * Everything the reconstruction needs about one segment: which grid channels belong to it, their spectrum and the
 * noise model fit to it.  Empty segments have neither spectrum nor model.
 */
public class SegmentNoiseAnalysis {
  private final SegmentBoundary boundary;
  private final int[] members;
  private final PowerSpectrum spectrum;
  private final NoiseModel noiseModel;

  private SegmentNoiseAnalysis(SegmentBoundary boundary, int[] members, PowerSpectrum spectrum,
                               NoiseModel noiseModel) {
    this.boundary = boundary;
    this.members = members;
    this.spectrum = spectrum;
    this.noiseModel = noiseModel;
  }

  public static SegmentNoiseAnalysis empty(SegmentBoundary boundary) {
    return new SegmentNoiseAnalysis(boundary, new int[0], null, null);
  }

  public static SegmentNoiseAnalysis fitted(SegmentBoundary boundary, int[] members, PowerSpectrum spectrum,
                                            NoiseModel noiseModel) {
    if (members.length != spectrum.getTraceLength()) {
      throw new IllegalArgumentException(String.format(
          "Segment has %d members but its spectrum was computed over %d values",
          members.length, spectrum.getTraceLength()));
    }
    return new SegmentNoiseAnalysis(boundary, members, spectrum, noiseModel);
  }

  public SegmentBoundary getBoundary() {
    return boundary;
  }

  public boolean isEmpty() {
    return members.length == 0;
  }

  /**
   * @return Grid positions of the segment's channels, in grid order.
   */
  public int[] getMembers() {
    return Arrays.copyOf(members, members.length);
  }

  public int getMemberCount() {
    return members.length;
  }

  public int getFirstMember() {
    return members[0];
  }

  public int getLastMember() {
    return members[members.length - 1];
  }

  public PowerSpectrum getSpectrum() {
    return spectrum;
  }

  public NoiseModel getNoiseModel() {
    return noiseModel;
  }
}
