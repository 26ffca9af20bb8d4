package org.gbif.beetles.pipeline;

import org.gbif.beetles.model.FieldSample;
import org.gbif.beetles.model.TrappingRecord;
import org.gbif.beetles.utils.Constants;
import org.gbif.beetles.utils.Groupings;
import org.gbif.beetles.utils.TermUtils;

import java.text.ParseException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw field samples into trapping records:
 * i) keeps collected samples only
 * ii) computes trapping days from set and collect dates, counting days since the earliest collection for traps that
 * were emptied several times after being set once
 * iii) resolves the collect date of every sampling event to the date most of its samples were collected on, and
 * derives the bout identifier from it
 */
public class SampleNormalizer {

  private static final Logger LOG = LoggerFactory.getLogger(SampleNormalizer.class);

  private final String eventIdSeparators;

  /**
   * @param eventIdSeparators regular expression matching characters stripped from eventIDs before grouping
   */
  public SampleNormalizer(String eventIdSeparators) {
    this.eventIdSeparators = Preconditions.checkNotNull(eventIdSeparators, "eventIdSeparators");
  }

  /**
   * @param samples raw field samples in input order
   *
   * @return trapping records of all collected samples, in input order
   *
   * @throws InvalidFieldSampleException if a collected sample misses a key or has an unparseable date
   */
  public List<TrappingRecord> normalize(List<FieldSample> samples) {
    List<Collected> collected = collect(samples);
    int adjusted = adjustMultiBoutTraps(collected);
    Map<String, String> resolvedDates = resolveCollectDates(collected);

    List<TrappingRecord> records = Lists.newArrayListWithCapacity(collected.size());
    Set<String> bouts = Sets.newLinkedHashSet();
    int moved = 0;
    for (Collected c : collected) {
      String collectDate = c.eventKey == null ? c.collectDate : resolvedDates.get(c.eventKey);
      if (!collectDate.equals(c.collectDate)) {
        moved++;
        LOG.debug("Sample {} collected on {} assigned to event date {}", c.sample.getSampleID(), c.collectDate,
          collectDate);
      }
      String boutID = boutID(c.sample.getSiteID(), collectDate);
      bouts.add(boutID);
      records.add(new TrappingRecord(c.sample.getSampleID(), c.sample.getDomainID(), c.sample.getSiteID(),
        c.sample.getPlotID(), c.sample.getTrapID(), collectDate, c.trappingDays, boutID));
    }

    LOG.info("Normalized " + samples.size() + " field samples: " + records.size() + " collected, " + adjusted
             + " multi-bout trapping days adjusted, " + moved + " collect dates resolved to their event date, "
             + bouts.size() + " unique bouts.");
    return records;
  }

  /**
   * @return bout identifier, e.g. "UNDE_2018-06-04"
   */
  public static String boutID(String siteID, String collectDate) {
    return siteID + Constants.BOUT_SEPARATOR + collectDate;
  }

  /**
   * Keep collected samples, validate their keys and dates, and compute their trapping days.
   */
  private List<Collected> collect(List<FieldSample> samples) {
    List<Collected> collected = Lists.newArrayList();
    int row = 0;
    for (FieldSample sample : samples) {
      row++;
      if (!sample.isCollected()) {
        continue;
      }
      String sampleID = sample.getSampleID();
      if (Strings.isNullOrEmpty(sampleID)) {
        throw new InvalidFieldSampleException("<missing>", row, "missing sampleID");
      }
      if (Strings.isNullOrEmpty(sample.getSiteID())) {
        throw new InvalidFieldSampleException(sampleID, row, "missing siteID");
      }
      Date setDate = parse(sample.getSetDate(), "setDate", sampleID, row);
      Date collectDate = parse(sample.getCollectDate(), "collectDate", sampleID, row);
      int days = TermUtils.daysBetween(setDate, collectDate);
      if (days < 0) {
        throw new InvalidFieldSampleException(sampleID, row,
          "collectDate " + sample.getCollectDate() + " precedes setDate " + sample.getSetDate());
      }

      String eventKey = TermUtils.stripSeparators(sample.getEventID(), eventIdSeparators);
      collected.add(new Collected(sample, TermUtils.formatDate(setDate), TermUtils.formatDate(collectDate), days,
        eventKey.isEmpty() ? null : eventKey));
    }
    return collected;
  }

  private static Date parse(String value, String term, String sampleID, int row) {
    try {
      return TermUtils.parseDate(value);
    } catch (ParseException e) {
      throw new InvalidFieldSampleException(sampleID, row, "unparseable " + term + " \"" + value + "\"", e);
    }
  }

  /**
   * A trap set once and collected on several dates reports, for every collection except the earliest, the days since
   * the earliest collection. The earliest collection keeps the full set-to-collect interval.
   *
   * @return number of rows whose trapping days changed
   */
  private static int adjustMultiBoutTraps(List<Collected> collected) {
    ListMultimap<List<String>, Collected> traps = MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (Collected c : collected) {
      traps.put(c.trapKey(), c);
    }

    int adjusted = 0;
    for (Map.Entry<List<String>, Collection<Collected>> trap : traps.asMap().entrySet()) {
      Collection<Collected> collections = trap.getValue();
      Set<String> dates = Sets.newHashSet();
      int min = Integer.MAX_VALUE;
      for (Collected c : collections) {
        dates.add(c.collectDate);
        min = Math.min(min, c.trappingDays);
      }
      if (dates.size() < 2) {
        continue;
      }
      LOG.debug("Trap {} collected on {} dates", trap.getKey(), dates.size());
      for (Collected c : collections) {
        int diff = c.trappingDays - min;
        if (diff != 0) {
          c.trappingDays = diff;
          adjusted++;
        }
      }
    }
    return adjusted;
  }

  /**
   * @return the modal collect date of every normalized eventID
   */
  private static Map<String, String> resolveCollectDates(List<Collected> collected) {
    ListMultimap<String, String> datesByEvent = MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (Collected c : collected) {
      if (c.eventKey != null) {
        datesByEvent.put(c.eventKey, c.collectDate);
      }
    }
    return Groupings.modes(datesByEvent.asMap());
  }

  /**
   * Working state of one collected sample while it is being normalized.
   */
  private static final class Collected {

    private final FieldSample sample;
    private final String setDate;
    private final String collectDate;
    private final String eventKey;
    private int trappingDays;

    private Collected(FieldSample sample, String setDate, String collectDate, int trappingDays, String eventKey) {
      this.sample = sample;
      this.setDate = setDate;
      this.collectDate = collectDate;
      this.trappingDays = trappingDays;
      this.eventKey = eventKey;
    }

    /**
     * Identity of the physical trap deployment: everything but the per-collection fields.
     */
    private List<String> trapKey() {
      return Arrays.asList(sample.getDomainID(), sample.getSiteID(), sample.getPlotID(), sample.getTrapID(), setDate);
    }
  }
}
