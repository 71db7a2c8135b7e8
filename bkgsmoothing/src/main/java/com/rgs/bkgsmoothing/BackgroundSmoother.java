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
import com.rgs.bkgsmoothing.boundary.InstrumentCalibrationCorpus;
import com.rgs.bkgsmoothing.boundary.InvalidInstrumentException;
import com.rgs.bkgsmoothing.boundary.SegmentBoundaryResolver;
import com.rgs.bkgsmoothing.diagnostics.DiagnosticTable;
import com.rgs.bkgsmoothing.model.ChannelGrid;
import com.rgs.bkgsmoothing.model.NoiseModel;
import com.rgs.bkgsmoothing.model.SegmentBoundary;
import com.rgs.bkgsmoothing.model.SegmentResult;
import com.rgs.bkgsmoothing.model.SegmentState;
import com.rgs.bkgsmoothing.model.SmoothedBackground;
import com.rgs.bkgsmoothing.noise.NoiseModelFitter;
import com.rgs.bkgsmoothing.noise.SegmentNoiseAnalysis;
import com.rgs.bkgsmoothing.reconstruction.SpectralReconstructor;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Smooths the background of one observation: resolves the CCD segment boundaries, then fits and filters every
 * segment independently and merges the results into a single smoothed background.
 */
public class BackgroundSmoother {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BackgroundSmoother.class);

  private final SmoothingConfig config;
  private final SegmentBoundaryResolver resolver;
  private final NoiseModelFitter fitter;
  private final SpectralReconstructor reconstructor;

  public BackgroundSmoother(SmoothingConfig config, InstrumentCalibrationCorpus corpus) {
    this.config = config;
    this.resolver = new SegmentBoundaryResolver(corpus);
    this.fitter = new NoiseModelFitter(config);
    this.reconstructor = new SpectralReconstructor();
  }

  /**
   * Runs the full smoothing.  Fit failures and empty segments are handled per segment and never abort the run.
   * @param observation The observation to smooth.
   * @return The smoothed background plus per-segment results.
   * @throws InvalidInstrumentException If the instrument has no gap template or the order is 0; nothing is
   *         processed in that case.
   */
  public BackgroundSmoothingResult smooth(Observation observation) throws InvalidInstrumentException {
    ChannelGrid grid = observation.getGrid();
    BoundaryAlignment alignment = resolver.resolve(observation.getInstrumentId(), observation.getOrder(), grid);

    LOGGER.info("Smoothing %d channels across %d segments", grid.size(), alignment.getBoundaries().size());
    SmoothedBackground background = new SmoothedBackground(grid.size());

    List<Pair<SegmentResult, SegmentNoiseAnalysis>> processed;
    if (config.getWorkerThreads() <= 1) {
      processed = new ArrayList<>(alignment.getBoundaries().size());
      for (SegmentBoundary boundary : alignment.getBoundaries()) {
        processed.add(processSegment(boundary, grid, background));
      }
    } else {
      processed = processConcurrently(alignment.getBoundaries(), grid, background);
    }

    List<SegmentResult> results = new ArrayList<>(processed.size());
    for (Pair<SegmentResult, SegmentNoiseAnalysis> p : processed) {
      results.add(p.getLeft());
    }

    DiagnosticTable diagnostics = null;
    if (config.getWriteDiagnostics()) {
      diagnostics = buildDiagnosticTable(processed, grid, background);
    }

    int skipped = 0;
    for (SegmentResult result : results) {
      if (result.isSkipped()) {
        skipped++;
      }
    }
    LOGGER.info("Done smoothing: %d segments reconstructed, %d skipped as empty", results.size() - skipped, skipped);
    return new BackgroundSmoothingResult(background, alignment, results, diagnostics);
  }

  private List<Pair<SegmentResult, SegmentNoiseAnalysis>> processConcurrently(
      List<SegmentBoundary> boundaries, final ChannelGrid grid, final SmoothedBackground background) {
    ExecutorService executor = Executors.newFixedThreadPool(config.getWorkerThreads());
    try {
      List<Future<Pair<SegmentResult, SegmentNoiseAnalysis>>> futures = new ArrayList<>(boundaries.size());
      for (final SegmentBoundary boundary : boundaries) {
        // Each segment writes a disjoint set of channels, so the shared buffer needs no locking.
        futures.add(executor.submit(() -> processSegment(boundary, grid, background)));
      }

      List<Pair<SegmentResult, SegmentNoiseAnalysis>> processed = new ArrayList<>(futures.size());
      for (Future<Pair<SegmentResult, SegmentNoiseAnalysis>> future : futures) {
        processed.add(future.get());
      }
      return processed;
    } catch (ExecutionException e) {
      throw new IllegalStateException("Segment processing failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for segment processing", e);
    } finally {
      executor.shutdownNow();
    }
  }

  private Pair<SegmentResult, SegmentNoiseAnalysis> processSegment(
      SegmentBoundary boundary, ChannelGrid grid, SmoothedBackground background) {
    SegmentResult result = new SegmentResult(boundary);
    SegmentNoiseAnalysis analysis = fitter.analyze(boundary, grid);
    if (analysis.isEmpty()) {
      result.advanceTo(SegmentState.SKIPPED_EMPTY);
      return Pair.of(result, analysis);
    }

    NoiseModel model = analysis.getNoiseModel();
    result.recordMembers(analysis.getFirstMember(), analysis.getLastMember(), analysis.getMemberCount());
    result.recordModel(model, analysis.getSpectrum().getFftSize());
    result.advanceTo(model.getStatus() == NoiseModel.FitStatus.CONVERGED ?
        SegmentState.MODEL_FIT_CONVERGED : SegmentState.MODEL_FIT_FALLBACK);

    reconstructor.reconstruct(analysis, background);
    result.advanceTo(SegmentState.RECONSTRUCTED);
    return Pair.of(result, analysis);
  }

  private DiagnosticTable buildDiagnosticTable(List<Pair<SegmentResult, SegmentNoiseAnalysis>> processed,
                                               ChannelGrid grid, SmoothedBackground background) {
    DiagnosticTable table = new DiagnosticTable();
    for (Pair<SegmentResult, SegmentNoiseAnalysis> p : processed) {
      SegmentNoiseAnalysis analysis = p.getRight();
      for (int member : analysis.getMembers()) {
        table.add(new DiagnosticTable.Row(p.getLeft().getSegmentIndex(), grid.getGoodChannel(member),
            grid.getWavelength(member), grid.getBackgroundCounts(member), background.get(member)));
      }
    }
    return table;
  }
}
