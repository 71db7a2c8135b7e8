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

import com.rgs.bkgsmoothing.boundary.BoundaryAlignment;
import com.rgs.bkgsmoothing.diagnostics.DiagnosticTable;
import com.rgs.bkgsmoothing.model.SegmentResult;
import com.rgs.bkgsmoothing.model.SmoothedBackground;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class BackgroundSmoothingResult {
  private final SmoothedBackground smoothedBackground;
  private final BoundaryAlignment alignment;
  private final List<SegmentResult> segmentResults;
  private final DiagnosticTable diagnosticTable;

  public BackgroundSmoothingResult(SmoothedBackground smoothedBackground, BoundaryAlignment alignment,
                                   List<SegmentResult> segmentResults, DiagnosticTable diagnosticTable) {
    this.smoothedBackground = smoothedBackground;
    this.alignment = alignment;
    this.segmentResults = Collections.unmodifiableList(segmentResults);
    this.diagnosticTable = diagnosticTable;
  }

  public SmoothedBackground getSmoothedBackground() {
    return smoothedBackground;
  }

  public BoundaryAlignment getAlignment() {
    return alignment;
  }

  /**
   * @return One result per segment, in segment order.
   */
  public List<SegmentResult> getSegmentResults() {
    return segmentResults;
  }

  public Optional<DiagnosticTable> getDiagnosticTable() {
    return Optional.ofNullable(diagnosticTable);
  }
}
