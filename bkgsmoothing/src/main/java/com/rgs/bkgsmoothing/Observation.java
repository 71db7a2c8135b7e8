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

package com.rgs.bkgsmoothing;

import com.rgs.bkgsmoothing.model.ChannelGrid;

/**
 * One spectrum to smooth: which RGS unit and order it came from and its good-exposure channel grid.
 */
public class Observation {
  private final int instrumentId;
  private final int order;
  private final ChannelGrid grid;

  public Observation(int instrumentId, int order, ChannelGrid grid) {
    this.instrumentId = instrumentId;
    this.order = order;
    this.grid = grid;
  }

  public int getInstrumentId() {
    return instrumentId;
  }

  public int getOrder() {
    return order;
  }

  public ChannelGrid getGrid() {
    return grid;
  }
}
