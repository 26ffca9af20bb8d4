package org.gbif.beetles.utils;

import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.TimeZone;

/**
 * Constants used across classes.
 */
public class Constants {

  public static final DateFormat ISO_DF = new SimpleDateFormat("yyyy-MM-dd");
  public static final long MILLIS_PER_DAY = 24 * 60 * 60 * 1000L;
  public static final String BOUT_SEPARATOR = "_";

  static {
    // calendar days, independent of the JVM default time zone and its DST transitions
    ISO_DF.setTimeZone(TimeZone.getTimeZone("UTC"));
    ISO_DF.setLenient(false);
  }

  private Constants() {
  }
}
