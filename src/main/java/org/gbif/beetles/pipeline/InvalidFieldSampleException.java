package org.gbif.beetles.pipeline;

/**
 * Thrown when a collected field sample lacks a required key or carries a date that cannot be interpreted. The run
 * cannot proceed past such a row.
 */
public class InvalidFieldSampleException extends RuntimeException {

  private final String sampleID;
  private final int row;

  public InvalidFieldSampleException(String sampleID, int row, String message) {
    super("Field sample " + sampleID + " (row " + row + "): " + message);
    this.sampleID = sampleID;
    this.row = row;
  }

  public InvalidFieldSampleException(String sampleID, int row, String message, Throwable cause) {
    super("Field sample " + sampleID + " (row " + row + "): " + message, cause);
    this.sampleID = sampleID;
    this.row = row;
  }

  public String getSampleID() {
    return sampleID;
  }

  /**
   * @return 1-based position of the offending sample in the field data table
   */
  public int getRow() {
    return row;
  }
}
