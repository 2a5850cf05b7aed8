package io.b2mash.b2b.recordcore.store;

import io.b2mash.b2b.recordcore.paging.PageSpec;
import io.b2mash.b2b.recordcore.paging.SortSpec;
import java.util.List;
import java.util.Map;
import org.bson.Document;

/**
 * Secondary, eventually consistent copy of the records, used for document-style search. Writes are
 * best effort; callers flag a record for re-sync when {@link #upsert} fails.
 */
public interface MirrorStore {

  boolean isEnabled();

  /** Inserts or replaces the document whose {@code uniqueKey} matches. */
  void upsert(String collection, String uniqueKey, Map<String, Object> document);

  long count(String collection, Document filter);

  List<Map<String, Object>> find(
      String collection, Document filter, SortSpec sort, PageSpec page);
}
