package org.gbif.beetles.utils;

import java.text.ParseException;
import java.util.Date;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TermUtilsTest {

  @Test
  void interpretsCollectedFlag() {
    assertThat(TermUtils.isCollected("Y")).isTrue();
    assertThat(TermUtils.isCollected(" true ")).isTrue();
    assertThat(TermUtils.isCollected("N")).isFalse();
    assertThat(TermUtils.isCollected(null)).isFalse();
  }

  @Test
  void parsesDatesAndDateTimes() throws ParseException {
    Date date = TermUtils.parseDate("2018-06-01");

    assertThat(TermUtils.formatDate(date)).isEqualTo("2018-06-01");
    assertThat(TermUtils.parseDate("2018-06-01T23:59Z")).isEqualTo(date);
  }

  @Test
  void rejectsOtherDateFormats() {
    assertThatThrownBy(() -> TermUtils.parseDate("01/06/2018")).isInstanceOf(ParseException.class);
    assertThatThrownBy(() -> TermUtils.parseDate("2018-13-01")).isInstanceOf(ParseException.class);
    assertThatThrownBy(() -> TermUtils.parseDate("")).isInstanceOf(ParseException.class);
    assertThatThrownBy(() -> TermUtils.parseDate(null)).isInstanceOf(ParseException.class);
  }

  @Test
  void countsWholeDaysAcrossMonthsAndDst() throws ParseException {
    assertThat(TermUtils.daysBetween(TermUtils.parseDate("2018-03-20"), TermUtils.parseDate("2018-04-03")))
      .isEqualTo(14);
    assertThat(TermUtils.daysBetween(TermUtils.parseDate("2018-06-04"), TermUtils.parseDate("2018-06-01")))
      .isEqualTo(-3);
  }

  @Test
  void stripsEventIdSeparators() {
    assertThat(TermUtils.stripSeparators("UNDE.2018.24", "[^A-Za-z0-9]")).isEqualTo("UNDE201824");
    assertThat(TermUtils.stripSeparators("UNDE_2018-24", "[^A-Za-z0-9]")).isEqualTo("UNDE201824");
    assertThat(TermUtils.stripSeparators("E.1", "[.]")).isEqualTo("E1");
    assertThat(TermUtils.stripSeparators(null, "[.]")).isEmpty();
  }
}
