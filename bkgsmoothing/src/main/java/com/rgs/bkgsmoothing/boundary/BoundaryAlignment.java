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
import com.rgs.bkgsmoothing.model.SegmentBoundary;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of matching an instrument's gap template to an observation: the chosen template shift and the nine
 * segment boundaries it implies.
 */
public class BoundaryAlignment {
  @JsonProperty("delta")
  private double delta;

  // Interior template boundaries that land on observed data instead of in a chip gap.
  @JsonProperty("nogap_count")
  private int nogapCount;

  @JsonProperty("boundaries")
  private List<SegmentBoundary> boundaries;

  public BoundaryAlignment(double delta, int nogapCount, List<SegmentBoundary> boundaries) {
    this.delta = delta;
    this.nogapCount = nogapCount;
    this.boundaries = Collections.unmodifiableList(boundaries);
  }

  public double getDelta() {
    return delta;
  }

  public int getNogapCount() {
    return nogapCount;
  }

  @JsonProperty("exact")
  public boolean isExact() {
    return nogapCount == 0;
  }

  public List<SegmentBoundary> getBoundaries() {
    return boundaries;
  }
}
