package io.b2mash.b2b.recordcore.item;

import io.b2mash.b2b.recordcore.filter.RecordFilterBuilder;
import io.b2mash.b2b.recordcore.record.FieldSpec;
import io.b2mash.b2b.recordcore.record.RecordFields;
import io.b2mash.b2b.recordcore.record.RecordType;
import io.b2mash.b2b.recordcore.record.Scenario;
import io.b2mash.b2b.recordcore.record.ScenarioFields;
import io.b2mash.b2b.recordcore.record.TextSanitizer;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

/** The {@code items} table: a name plus the common record columns. */
@Component
public class ItemRecordType implements RecordType<Item> {

  static final String NAME = "name";
  static final int NAME_MAX_LENGTH = 255;

  private static final Map<Scenario, ScenarioFields> FIELDS = new EnumMap<>(Scenario.class);

  static {
    FIELDS.put(
        Scenario.CREATE,
        new ScenarioFields(Set.of(NAME, RecordFields.STATUS, RecordFields.DETAIL), Set.of(NAME)));
    FIELDS.put(
        Scenario.UPDATE,
        new ScenarioFields(
            Set.of(
                RecordFields.ID,
                RecordFields.LOCK_VERSION,
                NAME,
                RecordFields.STATUS,
                RecordFields.DETAIL),
            Set.of(RecordFields.ID, RecordFields.LOCK_VERSION)));
    FIELDS.put(
        Scenario.DELETE,
        new ScenarioFields(
            Set.of(RecordFields.ID, RecordFields.LOCK_VERSION),
            Set.of(RecordFields.ID, RecordFields.LOCK_VERSION)));
  }

  private static final Map<String, String> SORT_COLUMNS =
      Map.of(RecordFields.ID, "id", NAME, "name", RecordFields.STATUS, "status");

  @Override
  public String resourceName() {
    return "item";
  }

  @Override
  public String tableName() {
    return "items";
  }

  @Override
  public Class<Item> entityClass() {
    return Item.class;
  }

  @Override
  public Item newInstance() {
    return new Item();
  }

  @Override
  public ScenarioFields fieldsFor(Scenario scenario) {
    return FIELDS.get(scenario);
  }

  @Override
  public List<FieldSpec> fieldSpecs() {
    return List.of(FieldSpec.string(NAME, NAME_MAX_LENGTH));
  }

  @Override
  public Set<String> applyFields(Item item, Map<String, Object> values) {
    if (!values.containsKey(NAME)) {
      return Set.of();
    }
    Object raw = values.get(NAME);
    String name = TextSanitizer.plainText(raw != null ? raw.toString() : null);
    if (Objects.equals(name, item.getName())) {
      return Set.of();
    }
    item.setName(name);
    return Set.of(NAME);
  }

  @Override
  public Set<String> searchParameters() {
    return Set.of(NAME);
  }

  @Override
  public void applyFilters(Map<String, Object> parameters, RecordFilterBuilder builder) {
    Object name = parameters.get(NAME);
    builder.likeFilter(NAME, name != null ? name.toString() : null);
  }

  @Override
  public Map<String, String> sortColumns() {
    return SORT_COLUMNS;
  }

  @Override
  public void writeFields(Item item, Map<String, Object> view) {
    view.put(NAME, item.getName());
  }
}
