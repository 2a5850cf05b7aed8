package io.b2mash.b2b.recordcore.query;

import io.b2mash.b2b.recordcore.config.RecordCoreProperties;
import io.b2mash.b2b.recordcore.exception.FieldViolation;
import io.b2mash.b2b.recordcore.exception.ResourceNotFoundException;
import io.b2mash.b2b.recordcore.exception.ValidationFailedException;
import io.b2mash.b2b.recordcore.filter.DocumentFilterRenderer;
import io.b2mash.b2b.recordcore.filter.FilterSpec;
import io.b2mash.b2b.recordcore.filter.RecordFilterBuilder;
import io.b2mash.b2b.recordcore.paging.PageSpec;
import io.b2mash.b2b.recordcore.paging.PagedResult;
import io.b2mash.b2b.recordcore.paging.Paginator;
import io.b2mash.b2b.recordcore.paging.SortSpec;
import io.b2mash.b2b.recordcore.paging.Sorter;
import io.b2mash.b2b.recordcore.record.FieldValues;
import io.b2mash.b2b.recordcore.record.ManagedRecord;
import io.b2mash.b2b.recordcore.record.RecordFields;
import io.b2mash.b2b.recordcore.record.RecordType;
import io.b2mash.b2b.recordcore.store.MirrorStore;
import io.b2mash.b2b.recordcore.store.RecordStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read paths: relational search, mirror search and single-record view. Both searches build the
 * same {@link FilterSpec}, so a parameter set matches the same records in either store.
 */
@Service
public class RecordQueryService {

  private static final Logger log = LoggerFactory.getLogger(RecordQueryService.class);

  private static final List<String> LOG_DATES = List.of("createdAt", "updatedAt", "deletedAt");
  private static final List<String> LOG_USERS = List.of("createdBy", "updatedBy", "deletedBy");

  private final RecordStore recordStore;
  private final MirrorStore mirrorStore;
  private final SearchParameterParser parameterParser;
  private final DocumentFilterRenderer documentRenderer;
  private final int defaultPageSize;

  public RecordQueryService(
      RecordStore recordStore,
      MirrorStore mirrorStore,
      SearchParameterParser parameterParser,
      DocumentFilterRenderer documentRenderer,
      RecordCoreProperties properties) {
    this.recordStore = recordStore;
    this.mirrorStore = mirrorStore;
    this.parameterParser = parameterParser;
    this.documentRenderer = documentRenderer;
    this.defaultPageSize = properties.pagination().pageSize();
  }

  public <E extends ManagedRecord> PagedResult<Map<String, Object>> search(
      RecordType<E> type, Map<String, Object> params) {
    SearchCriteria criteria = parameterParser.parse(type, params);
    SortSpec sort = resolveSort(type, criteria);
    FilterSpec filter = buildFilter(type, criteria);

    long total = recordStore.count(type, filter);
    PageSpec page =
        Paginator.resolvePage(criteria.page(), criteria.pageSize(), total, defaultPageSize);
    List<E> rows = recordStore.find(type, filter, sort, page);
    log.debug(
        "Searched {}: total={}, page={}, returned={}",
        type.resourceName(),
        total,
        page.page(),
        rows.size());
    return new PagedResult<>(rows.stream().map(type::toView).toList(), page);
  }

  public PagedResult<Map<String, Object>> searchMirror(
      RecordType<?> type, Map<String, Object> params) {
    if (!mirrorStore.isEnabled()) {
      throw ResourceNotFoundException.withKey("mirrorDisabled");
    }
    SearchCriteria criteria = parameterParser.parse(type, params);
    SortSpec sort = resolveSort(type, criteria);
    Document filter = documentRenderer.render(buildFilter(type, criteria));

    long total = mirrorStore.count(type.tableName(), filter);
    PageSpec page =
        Paginator.resolvePage(criteria.page(), criteria.pageSize(), total, defaultPageSize);
    var rows = mirrorStore.find(type.tableName(), filter, sort, page);
    return new PagedResult<>(new ArrayList<>(rows), page);
  }

  public <E extends ManagedRecord> Map<String, Object> view(
      RecordType<E> type, Map<String, Object> params) {
    Map<String, Object> input = params != null ? params : Map.of();
    var violations = new ArrayList<FieldViolation>();
    for (String key : input.keySet()) {
      if (!RecordFields.ID.equals(key)) {
        violations.add(FieldViolation.of(key, "invalidField"));
      }
    }
    Long id = FieldValues.asLong(input.get(RecordFields.ID)).filter(v -> v > 0).orElse(null);
    if (FieldValues.isBlank(input.get(RecordFields.ID))) {
      violations.add(FieldViolation.of(RecordFields.ID, "required"));
    } else if (id == null) {
      violations.add(FieldViolation.of(RecordFields.ID, "integerNoZero"));
    }
    if (!violations.isEmpty()) {
      throw new ValidationFailedException(violations);
    }
    return recordStore
        .findById(type, id)
        .map(type::toView)
        .orElseThrow(() -> new ResourceNotFoundException(type.resourceName(), id));
  }

  FilterSpec buildFilter(RecordType<?> type, SearchCriteria criteria) {
    var builder = new RecordFilterBuilder();
    builder.integerFilter(RecordFields.ID, criteria.filters().get(RecordFields.ID));
    builder.statusFilter(RecordFields.STATUS, criteria.filters().get(RecordFields.STATUS));
    type.applyFilters(criteria.filters(), builder);
    for (String logDate : LOG_DATES) {
      builder.changeLogDateFilter(logDate, criteria.text(logDate));
    }
    for (String logUser : LOG_USERS) {
      builder.changeLogUserFilter(logUser, criteria.text(logUser));
    }
    return builder.build();
  }

  private static SortSpec resolveSort(RecordType<?> type, SearchCriteria criteria) {
    return Sorter.resolveSort(criteria.sortBy(), criteria.sortDir(), type.sortColumns().keySet());
  }
}
