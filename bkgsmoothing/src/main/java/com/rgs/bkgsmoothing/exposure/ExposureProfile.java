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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * What the exposure map says about the channel layout of an observation.
 */
public class ExposureProfile {
  private final double maxExposure;
  private final int firstChannel;
  private final int lastChannel;
  private final List<ChannelRange> segmentChannels;
  private final int[] goodChannels;
  private final int[] lowExposureChannels;

  public ExposureProfile(double maxExposure, int firstChannel, int lastChannel, List<ChannelRange> segmentChannels,
                         int[] goodChannels, int[] lowExposureChannels) {
    this.maxExposure = maxExposure;
    this.firstChannel = firstChannel;
    this.lastChannel = lastChannel;
    this.segmentChannels = Collections.unmodifiableList(segmentChannels);
    this.goodChannels = goodChannels;
    this.lowExposureChannels = lowExposureChannels;
  }

  public double getMaxExposure() {
    return maxExposure;
  }

  public int getFirstChannel() {
    return firstChannel;
  }

  public int getLastChannel() {
    return lastChannel;
  }

  /**
   * @return The instrument channel range of each CCD, in channel order.
   */
  public List<ChannelRange> getSegmentChannels() {
    return segmentChannels;
  }

  public int[] getGoodChannels() {
    return Arrays.copyOf(goodChannels, goodChannels.length);
  }

  public int[] getLowExposureChannels() {
    return Arrays.copyOf(lowExposureChannels, lowExposureChannels.length);
  }
}
