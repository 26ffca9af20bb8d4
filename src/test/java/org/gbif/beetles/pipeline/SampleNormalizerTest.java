package org.gbif.beetles.pipeline;

import org.gbif.beetles.model.FieldSample;
import org.gbif.beetles.model.TrappingRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.gbif.beetles.BeetleFixtures.sample;
import static org.gbif.beetles.BeetleFixtures.uncollected;

class SampleNormalizerTest {

  private final SampleNormalizer normalizer = new SampleNormalizer("[^A-Za-z0-9]");

  @Test
  void keepsCollectedSamplesOnly() {
    List<TrappingRecord> records = normalizer.normalize(Arrays.asList(
      sample("S1", "N", "2018-06-01", "2018-06-04", "UNDE.2018.1"),
      uncollected("S2", "E", "2018-06-01", "UNDE.2018.1")));

    assertThat(records).extracting(TrappingRecord::getSampleID).containsExactly("S1");
  }

  @Test
  void computesTrappingDaysAndBout() {
    List<TrappingRecord> records =
      normalizer.normalize(Arrays.asList(sample("S1", "N", "2018-06-01", "2018-06-04", "E.1")));

    TrappingRecord record = records.get(0);
    assertThat(record.getTrappingDays()).isEqualTo(3);
    assertThat(record.getCollectDate()).isEqualTo("2018-06-04");
    assertThat(record.getBoutID()).isEqualTo("UNDE_2018-06-04");
    assertThat(record.getSiteID()).isEqualTo("UNDE");
    assertThat(record.getTrapID()).isEqualTo("N");
  }

  @Test
  void usesDatePartOfDateTimes() {
    List<TrappingRecord> records =
      normalizer.normalize(Arrays.asList(sample("S1", "N", "2018-06-01T18:00Z", "2018-06-04T09:30Z", "E.1")));

    assertThat(records.get(0).getTrappingDays()).isEqualTo(3);
    assertThat(records.get(0).getCollectDate()).isEqualTo("2018-06-04");
  }

  @Test
  void countsDaysSinceEarliestCollectionForMultiBoutTraps() {
    List<TrappingRecord> records = normalizer.normalize(Arrays.asList(
      sample("S1", "N", "2018-06-01", "2018-06-04", "E.1"),
      sample("S2", "N", "2018-06-01", "2018-06-08", "E.2"),
      sample("S3", "N", "2018-06-01", "2018-06-15", "E.3"),
      // a different trap of the same plot is not affected
      sample("S4", "W", "2018-06-01", "2018-06-15", "E.3")));

    assertThat(records).extracting(TrappingRecord::getTrappingDays).containsExactly(3, 4, 11, 14);
  }

  @Test
  void multiBoutAnchorKeepsItsDaysWhateverTheInputOrder() {
    List<TrappingRecord> records = normalizer.normalize(Arrays.asList(
      sample("S2", "N", "2018-06-01", "2018-06-15", "E.2"),
      sample("S1", "N", "2018-06-01", "2018-06-05", "E.1")));

    assertThat(records).extracting(TrappingRecord::getTrappingDays).containsExactly(10, 4);
  }

  @Test
  void trapCollectedOnceOnTheSameDateIsNotMultiBout() {
    List<TrappingRecord> records = normalizer.normalize(Arrays.asList(
      sample("S1", "N", "2018-06-01", "2018-06-04", "E.1"),
      sample("S2", "N", "2018-06-01", "2018-06-04", "E.1")));

    assertThat(records).extracting(TrappingRecord::getTrappingDays).containsExactly(3, 3);
  }

  @Test
  void resolvesCollectDateToModeOfEventIgnoringSeparators() {
    List<TrappingRecord> records = normalizer.normalize(Arrays.asList(
      sample("S1", "N", "2018-06-01", "2018-06-04", "UNDE.2018.1"),
      sample("S2", "E", "2018-06-01", "2018-06-05", "UNDE2018.1"),
      sample("S3", "W", "2018-06-01", "2018-06-05", "UNDE_2018_1"),
      sample("S4", "S", "2018-06-10", "2018-06-13", "UNDE.2018.2")));

    assertThat(records).extracting(TrappingRecord::getCollectDate)
      .containsExactly("2018-06-05", "2018-06-05", "2018-06-05", "2018-06-13");
    assertThat(records).extracting(TrappingRecord::getBoutID)
      .containsExactly("UNDE_2018-06-05", "UNDE_2018-06-05", "UNDE_2018-06-05", "UNDE_2018-06-13");
    // trapping days still reflect the physical collection date
    assertThat(records).extracting(TrappingRecord::getTrappingDays).containsExactly(3, 4, 4, 3);
  }

  @Test
  void breaksModeTiesByFirstSeenDate() {
    List<TrappingRecord> records = normalizer.normalize(Arrays.asList(
      sample("S1", "N", "2018-06-01", "2018-06-05", "E.1"),
      sample("S2", "E", "2018-06-01", "2018-06-04", "E.1")));

    assertThat(records).extracting(TrappingRecord::getCollectDate).containsExactly("2018-06-05", "2018-06-05");
  }

  @Test
  void resolvingResolvedDatesAgainChangesNothing() {
    List<FieldSample> samples = Arrays.asList(
      sample("S1", "N", "2018-06-01", "2018-06-04", "E.1"),
      sample("S2", "E", "2018-06-01", "2018-06-05", "E.1"),
      sample("S3", "W", "2018-06-01", "2018-06-05", "E.1"));
    List<TrappingRecord> first = normalizer.normalize(samples);

    List<FieldSample> resolved = new ArrayList<>();
    for (int i = 0; i < samples.size(); i++) {
      FieldSample s = samples.get(i);
      resolved.add(sample(s.getSampleID(), s.getTrapID(), s.getSetDate(), first.get(i).getCollectDate(),
        s.getEventID()));
    }
    List<TrappingRecord> second = normalizer.normalize(resolved);

    assertThat(second).extracting(TrappingRecord::getCollectDate)
      .containsExactlyElementsOf(extractDates(first));
  }

  @Test
  void samplesWithoutEventKeepTheirOwnDate() {
    List<TrappingRecord> records = normalizer.normalize(Arrays.asList(
      sample("S1", "N", "2018-06-01", "2018-06-04", null),
      sample("S2", "E", "2018-06-01", "2018-06-05", null),
      sample("S3", "W", "2018-06-01", "2018-06-05", "..")));

    assertThat(records).extracting(TrappingRecord::getCollectDate)
      .containsExactly("2018-06-04", "2018-06-05", "2018-06-05");
  }

  @Test
  void failsOnUnparseableDateNamingTheSample() {
    List<FieldSample> samples = Arrays.asList(
      sample("S1", "N", "2018-06-01", "2018-06-04", "E.1"),
      sample("S2", "E", "2018-06-01", "04/06/2018", "E.1"));

    assertThatThrownBy(() -> normalizer.normalize(samples))
      .isInstanceOf(InvalidFieldSampleException.class)
      .hasMessageContaining("S2")
      .hasMessageContaining("row 2")
      .hasMessageContaining("collectDate");
  }

  @Test
  void failsOnMissingSetDate() {
    List<FieldSample> samples = Arrays.asList(sample("S1", "N", null, "2018-06-04", "E.1"));

    assertThatThrownBy(() -> normalizer.normalize(samples))
      .isInstanceOfSatisfying(InvalidFieldSampleException.class, e -> {
        assertThat(e.getSampleID()).isEqualTo("S1");
        assertThat(e.getRow()).isEqualTo(1);
      });
  }

  @Test
  void failsOnMissingSampleID() {
    List<FieldSample> samples = Arrays.asList(sample(null, "N", "2018-06-01", "2018-06-04", "E.1"));

    assertThatThrownBy(() -> normalizer.normalize(samples))
      .isInstanceOf(InvalidFieldSampleException.class)
      .hasMessageContaining("missing sampleID");
  }

  @Test
  void failsOnCollectionBeforeSetting() {
    List<FieldSample> samples = Arrays.asList(sample("S1", "N", "2018-06-04", "2018-06-01", "E.1"));

    assertThatThrownBy(() -> normalizer.normalize(samples))
      .isInstanceOf(InvalidFieldSampleException.class)
      .hasMessageContaining("precedes");
  }

  @Test
  void ignoresBadDatesOfUncollectedSamples() {
    List<TrappingRecord> records = normalizer.normalize(Arrays.asList(
      uncollected("S1", "N", "not a date", "E.1"),
      sample("S2", "E", "2018-06-01", "2018-06-04", "E.1")));

    assertThat(records).hasSize(1);
  }

  private static List<String> extractDates(List<TrappingRecord> records) {
    List<String> dates = new ArrayList<>();
    for (TrappingRecord record : records) {
      dates.add(record.getCollectDate());
    }
    return dates;
  }
}
