package org.gbif.beetles.utils;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;

/**
 * Deterministic reductions over groups of values kept in input order.
 */
public class Groupings {

  private Groupings() {
  }

  /**
   * Statistical mode of the values. When several values are equally frequent the one appearing first wins.
   *
   * @param values non empty values in input order
   *
   * @return most frequent value
   */
  public static <T> T mode(Iterable<T> values) {
    // LinkedHashMultiset iterates its distinct elements in first-seen order
    Multiset<T> counts = LinkedHashMultiset.create(values);
    Preconditions.checkArgument(!counts.isEmpty(), "Mode of an empty group is undefined");
    T mode = null;
    int best = 0;
    for (Multiset.Entry<T> entry : counts.entrySet()) {
      if (entry.getCount() > best) {
        best = entry.getCount();
        mode = entry.getElement();
      }
    }
    return mode;
  }

  /**
   * Resolve the mode of every group.
   *
   * @param groups values per key, each group in input order
   *
   * @return mode per key
   */
  public static <K, T> Map<K, T> modes(Map<K, ? extends Iterable<T>> groups) {
    Map<K, T> modes = Maps.newLinkedHashMap();
    for (Map.Entry<K, ? extends Iterable<T>> group : groups.entrySet()) {
      modes.put(group.getKey(), mode(group.getValue()));
    }
    return modes;
  }
}
