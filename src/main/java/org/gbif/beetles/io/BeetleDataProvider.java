package org.gbif.beetles.io;

import org.gbif.beetles.model.ExpertRecord;
import org.gbif.beetles.model.FieldSample;
import org.gbif.beetles.model.PinRecord;
import org.gbif.beetles.model.SortRecord;

import java.io.IOException;
import java.util.List;

/**
 * Source of the four raw beetle tables. Rows must be returned in their original order, which decides ties when
 * collect dates are resolved and when duplicate pin or expert records are encountered.
 */
public interface BeetleDataProvider {

  List<FieldSample> fieldSamples() throws IOException;

  List<SortRecord> sortRecords() throws IOException;

  List<PinRecord> pinRecords() throws IOException;

  List<ExpertRecord> expertRecords() throws IOException;
}
