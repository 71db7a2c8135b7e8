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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The processing record of one segment: its boundary, where it got to in the pipeline, and the fitted model if
 * one was produced.
 */
public class SegmentResult {
  public static final int NO_CHANNEL = -1;

  @JsonProperty("boundary")
  private SegmentBoundary boundary;

  @JsonProperty("state")
  private SegmentState state = SegmentState.UNPROCESSED;

  @JsonProperty("first_channel")
  private int firstChannel = NO_CHANNEL;

  @JsonProperty("last_channel")
  private int lastChannel = NO_CHANNEL;

  @JsonProperty("member_count")
  private int memberCount = 0;

  @JsonProperty("fft_size")
  private int fftSize = 0;

  @JsonProperty("noise_model")
  private NoiseModel noiseModel;

  public SegmentResult(SegmentBoundary boundary) {
    this.boundary = boundary;
    advanceTo(SegmentState.BOUNDARY_RESOLVED);
  }

  public void advanceTo(SegmentState next) {
    if (!state.canAdvanceTo(next)) {
      throw new IllegalStateException(String.format(
          "Segment %d cannot move from %s to %s", boundary.getSegmentIndex(), state, next));
    }
    state = next;
  }

  public void recordMembers(int firstChannel, int lastChannel, int memberCount) {
    this.firstChannel = firstChannel;
    this.lastChannel = lastChannel;
    this.memberCount = memberCount;
  }

  public void recordModel(NoiseModel noiseModel, int fftSize) {
    this.noiseModel = noiseModel;
    this.fftSize = fftSize;
  }

  @JsonIgnore
  public int getSegmentIndex() {
    return boundary.getSegmentIndex();
  }

  public SegmentBoundary getBoundary() {
    return boundary;
  }

  public SegmentState getState() {
    return state;
  }

  public int getFirstChannel() {
    return firstChannel;
  }

  public int getLastChannel() {
    return lastChannel;
  }

  public int getMemberCount() {
    return memberCount;
  }

  public int getFftSize() {
    return fftSize;
  }

  /**
   * @return The fitted model, or null when the segment was skipped as empty.
   */
  public NoiseModel getNoiseModel() {
    return noiseModel;
  }

  @JsonIgnore
  public boolean isSkipped() {
    return state == SegmentState.SKIPPED_EMPTY;
  }
}
