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
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class InstrumentCalibrationCorpus {
  private static final String CALIBRATION_FILE_PATH = "instrument_calibration.json";
  private final Class INSTANCE_CLASS_LOADER = getClass();
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private Map<Integer, InstrumentCalibration> idToCalibration = new HashMap<>();

  @JsonProperty("instruments")
  private List<InstrumentCalibration> instruments;

  public InstrumentCalibrationCorpus() {}

  public List<InstrumentCalibration> getInstruments() {
    return instruments;
  }

  public void setInstruments(List<InstrumentCalibration> instruments) {
    this.instruments = instruments;
  }

  public void loadCorpus() throws IOException {
    try (InputStream calibrationStream = INSTANCE_CLASS_LOADER.getResourceAsStream(CALIBRATION_FILE_PATH)) {
      if (calibrationStream == null) {
        throw new IOException("Unable to find calibration resource " + CALIBRATION_FILE_PATH);
      }
      InstrumentCalibrationCorpus corpus =
          OBJECT_MAPPER.readValue(calibrationStream, InstrumentCalibrationCorpus.class);
      this.instruments = corpus.getInstruments();
    }
    index();
  }

  public void index() {
    idToCalibration.clear();
    for (InstrumentCalibration calibration : instruments) {
      if (calibration.getGapTemplate().size() != InstrumentCalibration.TEMPLATE_LENGTH) {
        throw new IllegalArgumentException(String.format(
            "Gap template for instrument %d has %d entries, expected %d", calibration.getInstrumentId(),
            calibration.getGapTemplate().size(), InstrumentCalibration.TEMPLATE_LENGTH));
      }
      idToCalibration.put(calibration.getInstrumentId(), calibration);
    }
  }

  /**
   * Looks up the calibration for an instrument, validating the diffraction order along the way.
   * @param instrumentId The instrument number, 1 or 2 for RGS1/RGS2.
   * @param order The diffraction order; its magnitude scales the template, so it may not be 0.
   * @return The instrument's calibration.
   * @throws InvalidInstrumentException If the instrument is unknown or the order is 0.
   */
  public InstrumentCalibration getCalibration(int instrumentId, int order) throws InvalidInstrumentException {
    InstrumentCalibration calibration = idToCalibration.get(instrumentId);
    if (calibration == null) {
      throw new InvalidInstrumentException(String.format(
          "No gap template for instrument %d; known instruments are %s", instrumentId, idToCalibration.keySet()));
    }
    if (order == 0) {
      throw new InvalidInstrumentException(String.format(
          "Diffraction order 0 is not valid for %s", calibration.getName()));
    }
    return calibration;
  }
}
