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

package com.rgs.bkgsmoothing.boundary;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-instrument calibration data: the first-order wavelengths of the CCD gaps and any channel-table corrections
 * that can't be derived from the exposure map.
 */
public class InstrumentCalibration {
  public static final int TEMPLATE_LENGTH = 10;

  @JsonProperty(value = "instrument_id", required = true)
  private Integer instrumentId;

  @JsonProperty("name")
  private String name;

  // Angstroms at order 1.  Entry 0 and the last entry bracket the full band; 1..8 are the interior CCD gaps.
  @JsonProperty(value = "gap_template", required = true)
  private List<Double> gapTemplate;

  @JsonProperty("channel_overrides")
  private List<ChannelOverride> channelOverrides = new ArrayList<>();

  public static class ChannelOverride {
    // The gap jump (0-based, in detection order) before which this fixed channel pair is inserted.
    @JsonProperty(value = "jump_index", required = true)
    private Integer jumpIndex;

    @JsonProperty(value = "first_channel", required = true)
    private Integer firstChannel;

    @JsonProperty(value = "last_channel", required = true)
    private Integer lastChannel;

    public ChannelOverride() {

    }

    public ChannelOverride(Integer jumpIndex, Integer firstChannel, Integer lastChannel) {
      this.jumpIndex = jumpIndex;
      this.firstChannel = firstChannel;
      this.lastChannel = lastChannel;
    }

    public Integer getJumpIndex() {
      return jumpIndex;
    }

    public Integer getFirstChannel() {
      return firstChannel;
    }

    public Integer getLastChannel() {
      return lastChannel;
    }
  }

  public InstrumentCalibration() {

  }

  public InstrumentCalibration(Integer instrumentId, String name, List<Double> gapTemplate,
                               List<ChannelOverride> channelOverrides) {
    this.instrumentId = instrumentId;
    this.name = name;
    this.gapTemplate = gapTemplate;
    this.channelOverrides = channelOverrides;
  }

  public Integer getInstrumentId() {
    return instrumentId;
  }

  public String getName() {
    return name;
  }

  public List<Double> getGapTemplate() {
    return Collections.unmodifiableList(gapTemplate);
  }

  public List<ChannelOverride> getChannelOverrides() {
    return channelOverrides == null ?
        Collections.<ChannelOverride>emptyList() : Collections.unmodifiableList(channelOverrides);
  }

  /**
   * Shifts the template by delta (first-order Angstroms) and scales it to the given diffraction order.
   */
  public double[] shiftedTemplate(double delta, int order) {
    double[] shifted = new double[gapTemplate.size()];
    double scale = Math.abs(order);
    for (int j = 0; j < shifted.length; j++) {
      shifted[j] = (gapTemplate.get(j) + delta) / scale;
    }
    return shifted;
  }
}
