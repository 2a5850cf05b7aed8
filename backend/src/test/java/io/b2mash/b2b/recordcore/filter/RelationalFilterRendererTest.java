package io.b2mash.b2b.recordcore.filter;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class RelationalFilterRendererTest {

  private final RelationalFilterRenderer renderer = new RelationalFilterRenderer();

  @Test
  void emptySpecRendersNoClause() {
    SqlFragment fragment = renderer.render(FilterSpec.MATCH_ALL);

    assertThat(fragment.isEmpty()).isTrue();
    assertThat(fragment.params()).isEmpty();
  }

  @Test
  void likeTokensBecomeOneOrderedPattern() {
    SqlFragment fragment =
        renderer.render(new RecordFilterBuilder().likeFilter("name", "john doe").build());

    assertThat(fragment.whereClause()).isEqualTo("e.name ILIKE :f0");
    assertThat(fragment.params()).containsEntry("f0", "%john%doe%");
  }

  @Test
  void likeWildcardsInInputAreEscaped() {
    SqlFragment fragment =
        renderer.render(new RecordFilterBuilder().likeFilter("name", "50%_off").build());

    assertThat(fragment.params()).containsEntry("f0", "%50\\%\\_off%");
  }

  @Test
  void missingStatusExcludesDeleted() {
    SqlFragment fragment =
        renderer.render(new RecordFilterBuilder().statusFilter("status", null).build());

    assertThat(fragment.whereClause()).isEqualTo("e.status <> :f0");
    assertThat(fragment.params()).containsEntry("f0", 4);
  }

  @Test
  void requestedStatusIsMatchedExactly() {
    SqlFragment fragment =
        renderer.render(new RecordFilterBuilder().statusFilter("status", 1).build());

    assertThat(fragment.whereClause()).isEqualTo("e.status = :f0");
    assertThat(fragment.params()).containsEntry("f0", 1);
  }

  @Test
  void changeLogDatesReadTheJsonPath() {
    SqlFragment fragment =
        renderer.render(
            new RecordFilterBuilder()
                .changeLogDateFilter("createdAt", "2024-01-01,2024-01-31")
                .build());

    assertThat(fragment.whereClause())
        .isEqualTo(
            "(CAST((e.detail #>> '{changeLog,createdAt}') AS date) >= :f0"
                + " AND CAST((e.detail #>> '{changeLog,createdAt}') AS date) <= :f1)");
    assertThat(fragment.params())
        .containsEntry("f0", LocalDate.of(2024, 1, 1))
        .containsEntry("f1", LocalDate.of(2024, 1, 31));
  }

  @Test
  void singleDayUsesEquality() {
    SqlFragment fragment =
        renderer.render(
            new RecordFilterBuilder().dateRangeFilter("created_on", "2024-02-29").build());

    assertThat(fragment.whereClause()).isEqualTo("CAST(e.created_on AS date) = :f0");
  }

  @Test
  void predicatesAreJoinedWithAndAndGroupsWithOr() {
    FilterSpec spec =
        new RecordFilterBuilder()
            .integerFilter("id", "7")
            .or(g -> g.likeFilter("name", "a").exactStringFilter("code", "B"))
            .multiValueFilter("owner_id", "1,2")
            .build();

    SqlFragment fragment = renderer.render(spec);

    assertThat(fragment.whereClause())
        .isEqualTo("e.id = :f0 AND (e.name ILIKE :f1 OR e.code ILIKE :f2) AND e.owner_id IN (:f3)");
    assertThat(fragment.params())
        .containsEntry("f0", 7L)
        .containsEntry("f1", "%a%")
        .containsEntry("f2", "B")
        .containsEntry("f3", List.of(1L, 2L));
  }

  @Test
  void jsonEqualityComparesText() {
    SqlFragment fragment =
        renderer.render(
            new RecordFilterBuilder()
                .jsonEqualsFilter("detail", List.of("color"), "red")
                .build());

    assertThat(fragment.whereClause()).isEqualTo("(e.detail #>> '{color}') = :f0");
  }
}
