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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.tuple.Pair;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SmoothingConfig {
  private static final String DEFAULT_CONFIG_PATH = "smoothing_config.json";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  // Channels whose wavelength (Angstrom) falls outside this window are left out of every segment.
  @JsonProperty("wavelength_window_low")
  private Double wavelengthWindowLow = 0.0;

  @JsonProperty("wavelength_window_high")
  private Double wavelengthWindowHigh = 1000.0;

  // Collect a per-channel diagnostic table alongside the smoothed background.
  @JsonProperty("write_diagnostics")
  private Boolean writeDiagnostics = false;

  // Power spectrum bins [low_band_start, band_split) hold structure, [band_split, band_end) are treated as noise.
  @JsonProperty("low_band_start")
  private Integer lowBandStart = 1;

  @JsonProperty("band_split")
  private Integer bandSplit = 30;

  @JsonProperty("band_end")
  private Integer bandEnd = 512;

  @JsonProperty("fit_max_evaluations")
  private Integer fitMaxEvaluations = 1000;

  // Segments are independent; more than one thread processes them concurrently.
  @JsonProperty("worker_threads")
  private Integer workerThreads = 1;

  // Size of the instrument's full channel grid, used when mapping rates back onto it.
  @JsonProperty("full_channel_count")
  private Integer fullChannelCount = 3600;

  // Exposure thresholds, as fractions of the maximum exposure, used when preparing a grid from an exposure map.
  @JsonProperty("low_exposure_fraction")
  private Double lowExposureFraction = 0.85;

  @JsonProperty("full_exposure_fraction")
  private Double fullExposureFraction = 0.99;

  @JsonProperty("edge_exposure_fraction")
  private Double edgeExposureFraction = 0.5;

  public SmoothingConfig() {

  }

  public static SmoothingConfig loadDefaults() throws IOException {
    try (InputStream is = SmoothingConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (is == null) {
        throw new IOException("Unable to find default configuration resource " + DEFAULT_CONFIG_PATH);
      }
      SmoothingConfig config = OBJECT_MAPPER.readValue(is, SmoothingConfig.class);
      config.validate();
      return config;
    }
  }

  public static SmoothingConfig load(File configFile) throws IOException {
    SmoothingConfig config = OBJECT_MAPPER.readValue(configFile, SmoothingConfig.class);
    config.validate();
    return config;
  }

  public void validate() {
    requireSet(wavelengthWindowLow, "wavelength_window_low");
    requireSet(wavelengthWindowHigh, "wavelength_window_high");
    requireSet(writeDiagnostics, "write_diagnostics");
    requireSet(lowBandStart, "low_band_start");
    requireSet(bandSplit, "band_split");
    requireSet(bandEnd, "band_end");
    requireSet(fitMaxEvaluations, "fit_max_evaluations");
    requireSet(workerThreads, "worker_threads");
    requireSet(fullChannelCount, "full_channel_count");
    requireSet(lowExposureFraction, "low_exposure_fraction");
    requireSet(fullExposureFraction, "full_exposure_fraction");
    requireSet(edgeExposureFraction, "edge_exposure_fraction");

    if (wavelengthWindowHigh < wavelengthWindowLow) {
      throw new IllegalArgumentException(String.format("Wavelength window is reversed: [%f, %f]",
          wavelengthWindowLow, wavelengthWindowHigh));
    }
    if (lowBandStart < 1 || bandSplit <= lowBandStart || bandEnd <= bandSplit) {
      throw new IllegalArgumentException(String.format(
          "Frequency bands must satisfy 1 <= low_band_start < band_split < band_end, got %d, %d, %d",
          lowBandStart, bandSplit, bandEnd));
    }
    if (fitMaxEvaluations < 1) {
      throw new IllegalArgumentException("fit_max_evaluations must be positive");
    }
    if (workerThreads < 1) {
      throw new IllegalArgumentException("worker_threads must be at least 1");
    }
    if (fullChannelCount < 1) {
      throw new IllegalArgumentException("full_channel_count must be positive");
    }
    if (!(edgeExposureFraction > 0.0 && lowExposureFraction <= fullExposureFraction && fullExposureFraction <= 1.0)) {
      throw new IllegalArgumentException(String.format(
          "Exposure fractions must satisfy 0 < edge and low <= full <= 1, got edge=%f low=%f full=%f",
          edgeExposureFraction, lowExposureFraction, fullExposureFraction));
    }
  }

  private static void requireSet(Object value, String field) {
    if (value == null) {
      throw new IllegalArgumentException(String.format("%s may not be null", field));
    }
  }

  public Pair<Double, Double> getWavelengthWindow() {
    return Pair.of(wavelengthWindowLow, wavelengthWindowHigh);
  }

  public void setWavelengthWindow(double low, double high) {
    this.wavelengthWindowLow = low;
    this.wavelengthWindowHigh = high;
  }

  public Boolean getWriteDiagnostics() {
    return writeDiagnostics;
  }

  public void setWriteDiagnostics(Boolean writeDiagnostics) {
    this.writeDiagnostics = writeDiagnostics;
  }

  public Integer getLowBandStart() {
    return lowBandStart;
  }

  public void setLowBandStart(Integer lowBandStart) {
    this.lowBandStart = lowBandStart;
  }

  public Integer getBandSplit() {
    return bandSplit;
  }

  public void setBandSplit(Integer bandSplit) {
    this.bandSplit = bandSplit;
  }

  public Integer getBandEnd() {
    return bandEnd;
  }

  public void setBandEnd(Integer bandEnd) {
    this.bandEnd = bandEnd;
  }

  public Integer getFitMaxEvaluations() {
    return fitMaxEvaluations;
  }

  public void setFitMaxEvaluations(Integer fitMaxEvaluations) {
    this.fitMaxEvaluations = fitMaxEvaluations;
  }

  public Integer getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(Integer workerThreads) {
    this.workerThreads = workerThreads;
  }

  public Integer getFullChannelCount() {
    return fullChannelCount;
  }

  public void setFullChannelCount(Integer fullChannelCount) {
    this.fullChannelCount = fullChannelCount;
  }

  public Double getLowExposureFraction() {
    return lowExposureFraction;
  }

  public void setLowExposureFraction(Double lowExposureFraction) {
    this.lowExposureFraction = lowExposureFraction;
  }

  public Double getFullExposureFraction() {
    return fullExposureFraction;
  }

  public void setFullExposureFraction(Double fullExposureFraction) {
    this.fullExposureFraction = fullExposureFraction;
  }

  public Double getEdgeExposureFraction() {
    return edgeExposureFraction;
  }

  public void setEdgeExposureFraction(Double edgeExposureFraction) {
    this.edgeExposureFraction = edgeExposureFraction;
  }
}
