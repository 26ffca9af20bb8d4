package org.gbif.beetles.io;

import org.gbif.beetles.model.CountRow;

import java.io.IOException;
import java.util.List;

/**
 * Destination of the count table.
 */
public interface CountTableSink {

  void write(List<CountRow> counts) throws IOException;
}
