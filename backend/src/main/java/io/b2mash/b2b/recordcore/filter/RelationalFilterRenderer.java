package io.b2mash.b2b.recordcore.filter;

import io.b2mash.b2b.recordcore.status.RecordStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link FilterSpec} into a PostgreSQL predicate over table alias {@code e}. Values are
 * always bound as named parameters ({@code f0}, {@code f1}, ...); only identifiers that passed
 * {@link FieldRef} validation are inlined.
 */
@Component
public class RelationalFilterRenderer {

  static final String ALIAS = "e";

  public SqlFragment render(FilterSpec spec) {
    var context = new Context();
    var clauses = new ArrayList<String>();
    for (FilterPredicate predicate : spec.predicates()) {
      clauses.add(render(predicate, context));
    }
    return new SqlFragment(String.join(" AND ", clauses), context.params);
  }

  private String render(FilterPredicate predicate, Context context) {
    if (predicate instanceof FilterPredicate.Equals equals) {
      Object value = equals.field().isJson() ? equals.value().toString() : equals.value();
      return expression(equals.field()) + " = :" + context.bind(value);
    }
    if (predicate instanceof FilterPredicate.Like like) {
      String pattern =
          like.tokens().stream()
              .map(RelationalFilterRenderer::escapeLike)
              .collect(Collectors.joining("%", "%", "%"));
      return expression(like.field()) + " ILIKE :" + context.bind(pattern);
    }
    if (predicate instanceof FilterPredicate.ExactString exact) {
      return expression(exact.field()) + " ILIKE :" + context.bind(escapeLike(exact.value()));
    }
    if (predicate instanceof FilterPredicate.MemberOf memberOf) {
      return expression(memberOf.field()) + " IN (:" + context.bind(memberOf.values()) + ")";
    }
    if (predicate instanceof FilterPredicate.StatusIs status) {
      String column = expression(status.field());
      if (status.requested() == null) {
        return column + " <> :" + context.bind(RecordStatus.DELETED.code());
      }
      return column + " = :" + context.bind(status.requested().code());
    }
    if (predicate instanceof FilterPredicate.DateRange range) {
      String day = "CAST(" + expression(range.field()) + " AS date)";
      if (range.from().equals(range.to())) {
        return day + " = :" + context.bind(range.from());
      }
      return "("
          + day
          + " >= :"
          + context.bind(range.from())
          + " AND "
          + day
          + " <= :"
          + context.bind(range.to())
          + ")";
    }
    if (predicate instanceof FilterPredicate.AnyOf anyOf) {
      List<String> parts = new ArrayList<>();
      for (FilterPredicate nested : anyOf.predicates()) {
        parts.add(render(nested, context));
      }
      return "(" + String.join(" OR ", parts) + ")";
    }
    throw new IllegalArgumentException("Unsupported predicate: " + predicate);
  }

  static String expression(FieldRef field) {
    if (!field.isJson()) {
      return ALIAS + "." + field.column();
    }
    String path = String.join(",", field.jsonPath());
    return "(" + ALIAS + "." + field.column() + " #>> '{" + path + "}')";
  }

  /** Escapes LIKE wildcards with PostgreSQL's default escape character. */
  static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private static final class Context {
    private final Map<String, Object> params = new LinkedHashMap<>();

    String bind(Object value) {
      String name = "f" + params.size();
      params.put(name, value);
      return name;
    }
  }
}
