package org.gbif.beetles.utils;

import java.text.ParseException;
import java.util.Date;
import javax.annotation.Nullable;
import javax.validation.constraints.NotNull;

import com.google.common.base.Strings;
import org.apache.commons.lang3.StringUtils;

/**
 * Set of utilities used to interpret raw term values found in the beetle tables.
 */
public class TermUtils {

  private TermUtils() {
  }

  /**
   * Interpret the sampleCollected flag. Published tables use "Y"/"N"; boolean literals are accepted as well.
   *
   * @param value raw flag
   *
   * @return true if the sample was collected
   */
  public static boolean isCollected(@Nullable String value) {
    String v = StringUtils.trimToEmpty(value);
    return v.equalsIgnoreCase("Y") || v.equalsIgnoreCase("yes") || v.equalsIgnoreCase("true");
  }

  /**
   * Parse the date part of an ISO date or date-time (e.g. 2018-06-01 or 2018-06-01T14:30Z).
   *
   * @param value raw date
   *
   * @return date at midnight UTC
   *
   * @throws ParseException if the value does not start with a valid yyyy-MM-dd date
   */
  @NotNull
  public static Date parseDate(@Nullable String value) throws ParseException {
    String v = Strings.nullToEmpty(value).trim();
    if (v.length() < 10) {
      throw new ParseException("Unparseable date: \"" + v + "\"", 0);
    }
    synchronized (Constants.ISO_DF) {
      return Constants.ISO_DF.parse(v.substring(0, 10));
    }
  }

  /**
   * @return the date formatted as yyyy-MM-dd
   */
  @NotNull
  public static String formatDate(Date date) {
    synchronized (Constants.ISO_DF) {
      return Constants.ISO_DF.format(date);
    }
  }

  /**
   * @return number of whole calendar days from start to end, negative if end precedes start
   */
  public static int daysBetween(Date start, Date end) {
    return (int) ((end.getTime() - start.getTime()) / Constants.MILLIS_PER_DAY);
  }

  /**
   * Remove every character matched by the separator pattern, e.g. "ABBY.2018.24" becomes "ABBY201824".
   *
   * @param eventID    raw eventID
   * @param separators regular expression matching separator characters
   *
   * @return normalized eventID, empty if eventID was null
   */
  @NotNull
  public static String stripSeparators(@Nullable String eventID, String separators) {
    return Strings.nullToEmpty(eventID).replaceAll(separators, "");
  }
}
