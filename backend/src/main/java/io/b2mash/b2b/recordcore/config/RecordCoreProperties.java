package io.b2mash.b2b.recordcore.config;

import io.b2mash.b2b.recordcore.status.RecordStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Process-wide settings for the record core, bound once from {@code recordcore.*} and read-only
 * afterwards.
 *
 * @param service service metadata returned by the index endpoint
 * @param pagination default paging behaviour for search endpoints
 * @param status status transition table and status groups
 * @param dependencies per-table guard configuration for referenced records
 * @param mirror MongoDB mirror settings
 * @param security JWT verification settings
 */
@ConfigurationProperties(prefix = "recordcore")
@Validated
public record RecordCoreProperties(
    Service service,
    @Valid Pagination pagination,
    Status status,
    Map<String, @Valid Dependencies> dependencies,
    Mirror mirror,
    Security security) {

  static final String IDENTIFIER = "[a-z_][a-z0-9_]*";

  public RecordCoreProperties {
    service = service != null ? service : new Service(null, null);
    pagination = pagination != null ? pagination : new Pagination(null);
    status = status != null ? status : new Status(null, null, null, null);
    dependencies = dependencies != null ? Map.copyOf(dependencies) : Map.of();
    mirror = mirror != null ? mirror : new Mirror(false);
    security = security != null ? security : new Security(null);
  }

  /** Returns the dependency guard for a table, or an empty guard if none is configured. */
  public Dependencies dependenciesFor(String tableName) {
    return dependencies.getOrDefault(tableName, Dependencies.NONE);
  }

  public record Service(String title, String version) {
    public Service {
      title = title != null ? title : "Record Core Service";
      version = version != null ? version : "V1";
    }
  }

  public record Pagination(@Positive Integer pageSize) {
    public Pagination {
      pageSize = pageSize != null ? pageSize : 10;
    }
  }

  /**
   * @param transitions allowed successors per current status
   * @param restricted statuses only a privileged actor may request
   * @param disallowedUpdate terminal statuses; also trip the dependency guard on "status"
   * @param revivalTargets statuses a privileged actor may revive a deleted record into; empty
   *     means any non-deleted status
   */
  public record Status(
      Map<RecordStatus, Set<RecordStatus>> transitions,
      Set<RecordStatus> restricted,
      Set<RecordStatus> disallowedUpdate,
      Set<RecordStatus> revivalTargets) {

    public Status {
      transitions = transitions != null ? Map.copyOf(transitions) : defaultTransitions();
      restricted =
          restricted != null
              ? Set.copyOf(restricted)
              : Set.of(RecordStatus.DELETED, RecordStatus.COMPLETED);
      disallowedUpdate =
          disallowedUpdate != null
              ? Set.copyOf(disallowedUpdate)
              : Set.of(RecordStatus.COMPLETED, RecordStatus.DELETED, RecordStatus.REJECTED);
      revivalTargets = revivalTargets != null ? Set.copyOf(revivalTargets) : Set.of();
    }

    private static Map<RecordStatus, Set<RecordStatus>> defaultTransitions() {
      return Map.of(
          RecordStatus.DRAFT,
          Set.of(
              RecordStatus.INACTIVE,
              RecordStatus.ACTIVE,
              RecordStatus.DELETED,
              RecordStatus.MAINTENANCE),
          RecordStatus.ACTIVE,
          Set.of(RecordStatus.COMPLETED, RecordStatus.APPROVED, RecordStatus.REJECTED),
          RecordStatus.INACTIVE,
          Set.of(RecordStatus.ACTIVE, RecordStatus.DRAFT, RecordStatus.DELETED),
          RecordStatus.MAINTENANCE,
          Set.of(
              RecordStatus.INACTIVE,
              RecordStatus.ACTIVE,
              RecordStatus.DRAFT,
              RecordStatus.DELETED),
          RecordStatus.APPROVED,
          Set.of(RecordStatus.COMPLETED, RecordStatus.APPROVED, RecordStatus.REJECTED));
    }
  }

  /**
   * @param guardedFields fields whose change is blocked while the record is referenced
   * @param references tables/columns that may reference a record of this table
   */
  public record Dependencies(
      List<@NotBlank String> guardedFields, List<@Valid Reference> references) {

    public static final Dependencies NONE = new Dependencies(List.of(), List.of());

    public Dependencies {
      guardedFields = guardedFields != null ? List.copyOf(guardedFields) : List.of();
      references = references != null ? List.copyOf(references) : List.of();
    }
  }

  /**
   * @param table referencing table
   * @param column referencing column
   * @param jsonArray true if the column is a jsonb array of ids rather than a plain id column
   */
  public record Reference(
      @NotBlank @Pattern(regexp = IDENTIFIER) String table,
      @NotBlank @Pattern(regexp = IDENTIFIER) String column,
      boolean jsonArray) {}

  public record Mirror(boolean enabled) {}

  public record Security(String jwtSecret) {}
}
