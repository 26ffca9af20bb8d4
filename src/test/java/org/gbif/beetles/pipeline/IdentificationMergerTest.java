package org.gbif.beetles.pipeline;

import org.gbif.beetles.model.ExpertRecord;
import org.gbif.beetles.model.IdentificationSource;
import org.gbif.beetles.model.ReconciledIndividual;
import org.gbif.beetles.model.SortRecord;
import org.gbif.beetles.model.Taxon;
import org.gbif.beetles.model.TrappingRecord;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.gbif.beetles.BeetleFixtures.expert;
import static org.gbif.beetles.BeetleFixtures.pin;
import static org.gbif.beetles.BeetleFixtures.sort;
import static org.gbif.beetles.BeetleFixtures.taxon;
import static org.gbif.beetles.BeetleFixtures.trapping;

class IdentificationMergerTest {

  private final IdentificationMerger merger = new IdentificationMerger(ImmutableSet.of("carabid", "other carabid"));
  private final List<TrappingRecord> trapping = Arrays.asList(trapping("S1"), trapping("S2"));

  @Test
  void sortBaselineKeepsCarabidSubsamplesOfCollectedSamples() {
    List<ReconciledIndividual> rows = merger.sortBaseline(trapping, Arrays.asList(
      sort("S1", "SS1", 3, "CARSP1"),
      new SortRecord("S1", "SS2", "Other Carabid", taxon("CARSP2"), 2),
      new SortRecord("S1", "SS3", "invert bycatch", taxon("SPIDER"), 7),
      sort("S9", "SS4", 1, "CARSP1")));

    assertThat(rows)
      .extracting(ReconciledIndividual::getSubsampleID, ReconciledIndividual::getIndividualCount,
        ReconciledIndividual::getIdentificationSource)
      .containsExactly(tuple("SS1", 3, IdentificationSource.SORT), tuple("SS2", 2, IdentificationSource.SORT));
    assertThat(rows.get(0).getTrapping()).isEqualTo(trapping.get(0));
    assertThat(rows.get(0).getIndividualID()).isNull();
  }

  @Test
  void sortBaselineIgnoresDuplicateSubsamples() {
    List<ReconciledIndividual> rows = merger.sortBaseline(trapping, Arrays.asList(
      sort("S1", "SS1", 3, "CARSP1"),
      sort("S1", "SS1", 5, "CARSP2")));

    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getIndividualCount()).isEqualTo(3);
  }

  @Test
  void unpinnedSubsampleKeepsSortIdentification() {
    List<ReconciledIndividual> rows = merger.merge(trapping, Arrays.asList(sort("S1", "SS1", 4, "CARSP1")),
      Collections.singletonList(pin("SS9", "I9", "CARSP2")), Collections.emptyList());

    assertThat(rows).extracting(r -> r.getTaxon().getTaxonID(), ReconciledIndividual::getIndividualCount,
      ReconciledIndividual::getIdentificationSource)
      .containsExactly(tuple("CARSP1", 4, IdentificationSource.SORT));
  }

  @Test
  void partiallyPinnedSubsampleKeepsResidualAtSortLevel() {
    List<ReconciledIndividual> rows = merger.pinOverride(
      merger.sortBaseline(trapping, Arrays.asList(sort("S1", "SS1", 5, "CARSP1"))),
      Arrays.asList(pin("SS1", "I1", "CARSP1"), pin("SS1", "I2", "CARSP2")));

    assertThat(rows).extracting(ReconciledIndividual::getIndividualID, r -> r.getTaxon().getTaxonID(),
      ReconciledIndividual::getIndividualCount, ReconciledIndividual::getIdentificationSource)
      .containsExactly(
        tuple("I1", "CARSP1", 1, IdentificationSource.PIN),
        tuple("I2", "CARSP2", 1, IdentificationSource.PIN),
        tuple(null, "CARSP1", 3, IdentificationSource.SORT));
    assertThat(sum(rows)).isEqualTo(5);
  }

  @Test
  void fullyPinnedSubsampleHasNoResidual() {
    List<ReconciledIndividual> rows = merger.pinOverride(
      merger.sortBaseline(trapping, Arrays.asList(sort("S1", "SS1", 2, "CARSP1"))),
      Arrays.asList(pin("SS1", "I1", "CARSP1"), pin("SS1", "I2", "CARSP2")));

    assertThat(rows).extracting(ReconciledIndividual::getIdentificationSource)
      .containsExactly(IdentificationSource.PIN, IdentificationSource.PIN);
  }

  @Test
  void duplicatePinRecordsCountOnce() {
    List<ReconciledIndividual> rows = merger.pinOverride(
      merger.sortBaseline(trapping, Arrays.asList(sort("S1", "SS1", 3, "CARSP1"))),
      Arrays.asList(pin("SS1", "I1", "CARSP2"), pin("SS1", "I1", "CARSP3")));

    assertThat(rows).extracting(ReconciledIndividual::getIndividualID, r -> r.getTaxon().getTaxonID(),
      ReconciledIndividual::getIndividualCount)
      .containsExactly(tuple("I1", "CARSP2", 1), tuple(null, "CARSP1", 2));
  }

  @Test
  void overPinnedSubsampleKeepsAllPinnedIndividuals() {
    List<ReconciledIndividual> rows = merger.pinOverride(
      merger.sortBaseline(trapping, Arrays.asList(sort("S1", "SS1", 1, "CARSP1"))),
      Arrays.asList(pin("SS1", "I1", "CARSP1"), pin("SS1", "I2", "CARSP1")));

    assertThat(rows).hasSize(2);
    assertThat(sum(rows)).isEqualTo(2);
  }

  @Test
  void expertOverridesPinnedIndividual() {
    List<ReconciledIndividual> rows = merger.merge(trapping, Arrays.asList(sort("S1", "SS1", 2, "CARSP1")),
      Arrays.asList(pin("SS1", "I1", "CARSP2")), Arrays.asList(expert("I1", "COLSP1")));

    assertThat(rows).extracting(ReconciledIndividual::getIndividualID, r -> r.getTaxon().getTaxonID(),
      ReconciledIndividual::getIdentificationSource)
      .containsExactly(
        tuple("I1", "COLSP1", IdentificationSource.EXPERT),
        tuple(null, "CARSP1", IdentificationSource.SORT));
  }

  @Test
  void expertDisagreementLeavesPinIdentification() {
    List<ReconciledIndividual> rows = merger.merge(trapping, Arrays.asList(sort("S1", "SS1", 2, "CARSP1")),
      Arrays.asList(pin("SS1", "I1", "CARSP2"), pin("SS1", "I2", "CARSP2")),
      Arrays.asList(expert("I1", "COLSP1"), expert("I1", "COLSP2"), expert("I2", "COLSP3")));

    assertThat(rows).extracting(ReconciledIndividual::getIndividualID, r -> r.getTaxon().getTaxonID(),
      ReconciledIndividual::getIdentificationSource)
      .containsExactly(
        tuple("I1", "CARSP2", IdentificationSource.PIN),
        tuple("I2", "COLSP3", IdentificationSource.EXPERT));
  }

  @Test
  void consistentRepeatedExpertRecordsApplyOnce() {
    Taxon qualified = new Taxon("COLSP1", "COLSP1 name", "species", "cf. species");
    List<ReconciledIndividual> rows = merger.merge(trapping, Arrays.asList(sort("S1", "SS1", 1, "CARSP1")),
      Arrays.asList(pin("SS1", "I1", "CARSP2")),
      Arrays.asList(new ExpertRecord("I1", qualified), expert("I1", "COLSP1")));

    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getTaxon()).isEqualTo(qualified);
  }

  @Test
  void expertRecordsNeverTouchSortLevelRows() {
    List<ReconciledIndividual> rows = merger.merge(trapping, Arrays.asList(sort("S1", "SS1", 3, "CARSP1")),
      Collections.emptyList(), Arrays.asList(expert("I1", "COLSP1")));

    assertThat(rows).extracting(ReconciledIndividual::getIdentificationSource)
      .containsExactly(IdentificationSource.SORT);
  }

  @Test
  void expertReidentificationDoesNotPropagateToSiblings() {
    List<ReconciledIndividual> rows = merger.merge(trapping, Arrays.asList(sort("S1", "SS1", 4, "CARSP1")),
      Arrays.asList(pin("SS1", "I1", "CARSP1"), pin("SS1", "I2", "CARSP1")),
      Arrays.asList(expert("I1", "COLSP1")));

    assertThat(rows).extracting(r -> r.getTaxon().getTaxonID(), ReconciledIndividual::getIndividualCount)
      .containsExactly(tuple("COLSP1", 1), tuple("CARSP1", 1), tuple("CARSP1", 2));
  }

  @Test
  void findsIndividualsExpertsDisagreeAbout() {
    Set<String> excluded = IdentificationMerger.inconsistentExpertIdentifications(Arrays.asList(
      expert("I1", "A"), expert("I2", "B"), expert("I1", "A"), expert("I3", "C"), expert("I3", "D"),
      expert("I3", "C")));

    assertThat(excluded).containsExactly("I3");
  }

  @Test
  void countsAreConservedPerSubsample() {
    List<ReconciledIndividual> rows = merger.merge(trapping,
      Arrays.asList(sort("S1", "SS1", 6, "CARSP1"), sort("S2", "SS2", 2, "CARSP2")),
      Arrays.asList(pin("SS1", "I1", "CARSP1"), pin("SS1", "I2", "CARSP3"), pin("SS2", "I3", "CARSP2")),
      Arrays.asList(expert("I2", "COLSP1"), expert("I3", "COLSP2")));

    int ss1 = 0;
    int ss2 = 0;
    for (ReconciledIndividual row : rows) {
      if (row.getSubsampleID().equals("SS1")) {
        ss1 += row.getIndividualCount();
      } else {
        ss2 += row.getIndividualCount();
      }
    }
    assertThat(ss1).isEqualTo(6);
    assertThat(ss2).isEqualTo(2);
  }

  private static int sum(List<ReconciledIndividual> rows) {
    int sum = 0;
    for (ReconciledIndividual row : rows) {
      sum += row.getIndividualCount();
    }
    return sum;
  }
}
