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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum SegmentState {
  UNPROCESSED,
  BOUNDARY_RESOLVED,
  MODEL_FIT_CONVERGED,
  MODEL_FIT_FALLBACK,
  SKIPPED_EMPTY,
  RECONSTRUCTED,
  ;

  // Filled in by the static block: an EnumSet can't be built while the constants are still being constructed.
  private static final Map<SegmentState, Set<SegmentState>> SUCCESSORS = new EnumMap<>(SegmentState.class);

  static {
    SUCCESSORS.put(UNPROCESSED, EnumSet.of(BOUNDARY_RESOLVED));
    SUCCESSORS.put(BOUNDARY_RESOLVED, EnumSet.of(MODEL_FIT_CONVERGED, MODEL_FIT_FALLBACK, SKIPPED_EMPTY));
    SUCCESSORS.put(MODEL_FIT_CONVERGED, EnumSet.of(RECONSTRUCTED));
    SUCCESSORS.put(MODEL_FIT_FALLBACK, EnumSet.of(RECONSTRUCTED));
    SUCCESSORS.put(SKIPPED_EMPTY, EnumSet.noneOf(SegmentState.class));
    SUCCESSORS.put(RECONSTRUCTED, EnumSet.noneOf(SegmentState.class));
  }

  public boolean isTerminal() {
    return SUCCESSORS.get(this).isEmpty();
  }

  public boolean canAdvanceTo(SegmentState next) {
    return SUCCESSORS.get(this).contains(next);
  }
}
