package io.b2mash.b2b.recordcore.record;

import io.b2mash.b2b.recordcore.changelog.ChangeLog;
import io.b2mash.b2b.recordcore.status.RecordStatus;
import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import java.util.LinkedHashMap;
import java.util.Map;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Columns shared by every lifecycle-managed table. {@code lockVersion} is bumped by the store's
 * compare-and-swap update, not by JPA {@code @Version}.
 */
@MappedSuperclass
public abstract class ManagedRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "status", nullable = false)
  private RecordStatus status;

  @Column(name = "lock_version", nullable = false)
  private Integer lockVersion;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "detail", columnDefinition = "jsonb")
  private Map<String, Object> detail = new LinkedHashMap<>();

  @Column(name = "sync_flag")
  private Integer syncFlag;

  protected ManagedRecord() {
    this.status = RecordStatus.DRAFT;
  }

  public Long getId() {
    return id;
  }

  public RecordStatus getStatus() {
    return status;
  }

  public void setStatus(RecordStatus status) {
    this.status = status;
  }

  public Integer getLockVersion() {
    return lockVersion;
  }

  public void setLockVersion(Integer lockVersion) {
    this.lockVersion = lockVersion;
  }

  public Map<String, Object> getDetail() {
    return detail;
  }

  public void setDetail(Map<String, Object> detail) {
    this.detail = detail != null ? new LinkedHashMap<>(detail) : new LinkedHashMap<>();
  }

  public Integer getSyncFlag() {
    return syncFlag;
  }

  public void setSyncFlag(Integer syncFlag) {
    this.syncFlag = syncFlag;
  }

  public ChangeLog getChangeLog() {
    return ChangeLog.fromDetail(detail);
  }

  public void setChangeLog(ChangeLog changeLog) {
    var updated = new LinkedHashMap<>(detail != null ? detail : Map.of());
    updated.put(ChangeLog.DETAIL_KEY, changeLog.toMap());
    this.detail = updated;
  }
}
