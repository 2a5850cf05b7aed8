package io.b2mash.b2b.recordcore.filter;

import io.b2mash.b2b.recordcore.status.RecordStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.bson.Document;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link FilterSpec} into a MongoDB query document with the same matching semantics as
 * {@link RelationalFilterRenderer}. Change-log timestamps are ISO strings, so day ranges become
 * string bounds.
 */
@Component
public class DocumentFilterRenderer {

  private static final String REGEX_META = "\\.^$|?*+()[]{}";

  public Document render(FilterSpec spec) {
    var parts = new ArrayList<Document>();
    for (FilterPredicate predicate : spec.predicates()) {
      parts.add(render(predicate));
    }
    if (parts.isEmpty()) {
      return new Document();
    }
    if (parts.size() == 1) {
      return parts.get(0);
    }
    return new Document("$and", parts);
  }

  private Document render(FilterPredicate predicate) {
    if (predicate instanceof FilterPredicate.Equals equals) {
      Object value = equals.field().isJson() ? equals.value().toString() : equals.value();
      return new Document(equals.field().dottedPath(), value);
    }
    if (predicate instanceof FilterPredicate.Like like) {
      String regex =
          like.tokens().stream()
              .map(DocumentFilterRenderer::escapeRegex)
              .collect(Collectors.joining(".*"));
      return new Document(like.field().dottedPath(), caseInsensitive(regex));
    }
    if (predicate instanceof FilterPredicate.ExactString exact) {
      return new Document(
          exact.field().dottedPath(), caseInsensitive("^" + escapeRegex(exact.value()) + "$"));
    }
    if (predicate instanceof FilterPredicate.MemberOf memberOf) {
      return new Document(memberOf.field().dottedPath(), new Document("$in", memberOf.values()));
    }
    if (predicate instanceof FilterPredicate.StatusIs status) {
      var condition = new Document();
      if (status.requested() == RecordStatus.DELETED) {
        condition.append("$eq", RecordStatus.DELETED.code());
      } else {
        condition.append("$ne", RecordStatus.DELETED.code());
        if (status.requested() != null) {
          condition.append("$eq", status.requested().code());
        }
      }
      return new Document(status.field().dottedPath(), condition);
    }
    if (predicate instanceof FilterPredicate.DateRange range) {
      return new Document(
          range.field().dottedPath(),
          new Document("$gte", range.from().toString())
              .append("$lt", range.to().plusDays(1).toString()));
    }
    if (predicate instanceof FilterPredicate.AnyOf anyOf) {
      List<Document> parts = new ArrayList<>();
      for (FilterPredicate nested : anyOf.predicates()) {
        parts.add(render(nested));
      }
      return new Document("$or", parts);
    }
    throw new IllegalArgumentException("Unsupported predicate: " + predicate);
  }

  private static Document caseInsensitive(String regex) {
    return new Document("$regex", regex).append("$options", "i");
  }

  static String escapeRegex(String value) {
    var escaped = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      if (REGEX_META.indexOf(c) >= 0) {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
