package io.b2mash.b2b.recordcore.filter;

import io.b2mash.b2b.recordcore.status.RecordStatus;
import java.time.LocalDate;
import java.util.List;

/** Backend-neutral predicate. Each renderer translates every variant. */
public sealed interface FilterPredicate
    permits FilterPredicate.Equals,
        FilterPredicate.Like,
        FilterPredicate.ExactString,
        FilterPredicate.MemberOf,
        FilterPredicate.StatusIs,
        FilterPredicate.DateRange,
        FilterPredicate.AnyOf {

  /** Exact equality. */
  record Equals(FieldRef field, Object value) implements FilterPredicate {}

  /**
   * Case-insensitive substring match where each whitespace-separated token must appear in order.
   */
  record Like(FieldRef field, List<String> tokens) implements FilterPredicate {
    public Like {
      tokens = List.copyOf(tokens);
    }
  }

  /** Case-insensitive match of the whole value. */
  record ExactString(FieldRef field, String value) implements FilterPredicate {}

  record MemberOf(FieldRef field, List<Long> values) implements FilterPredicate {
    public MemberOf {
      values = List.copyOf(values);
    }
  }

  /**
   * Status restriction. A null {@code requested} means "anything but deleted"; a requested {@link
   * RecordStatus#DELETED} is the only way to see deleted records.
   */
  record StatusIs(FieldRef field, RecordStatus requested) implements FilterPredicate {}

  /** Inclusive date range on the date part of a timestamp; {@code from == to} is a single day. */
  record DateRange(FieldRef field, LocalDate from, LocalDate to) implements FilterPredicate {}

  /** OR group; an empty group is dropped by the builder. */
  record AnyOf(List<FilterPredicate> predicates) implements FilterPredicate {
    public AnyOf {
      predicates = List.copyOf(predicates);
    }
  }
}
