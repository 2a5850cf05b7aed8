package io.b2mash.b2b.recordcore.store;

import io.b2mash.b2b.recordcore.exception.ResourceNotFoundException;
import io.b2mash.b2b.recordcore.paging.PageSpec;
import io.b2mash.b2b.recordcore.paging.SortSpec;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when {@code recordcore.mirror.enabled} is off: writes are skipped, searches rejected. */
@Component
@ConditionalOnProperty(
    prefix = "recordcore.mirror",
    name = "enabled",
    havingValue = "false",
    matchIfMissing = true)
public class DisabledMirrorStore implements MirrorStore {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public void upsert(String collection, String uniqueKey, Map<String, Object> document) {}

  @Override
  public long count(String collection, Document filter) {
    throw ResourceNotFoundException.withKey("mirrorDisabled");
  }

  @Override
  public List<Map<String, Object>> find(
      String collection, Document filter, SortSpec sort, PageSpec page) {
    throw ResourceNotFoundException.withKey("mirrorDisabled");
  }
}
