package io.b2mash.b2b.recordcore.store;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import io.b2mash.b2b.recordcore.paging.PageSpec;
import io.b2mash.b2b.recordcore.paging.SortDirection;
import io.b2mash.b2b.recordcore.paging.SortSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * MongoDB mirror, one collection per record table. Works on raw collections so field names are
 * stored exactly as the API exposes them (no {@code id} to {@code _id} mapping).
 */
@Component
@ConditionalOnProperty(prefix = "recordcore.mirror", name = "enabled", havingValue = "true")
public class MongoMirrorStore implements MirrorStore {

  private static final Logger log = LoggerFactory.getLogger(MongoMirrorStore.class);

  private static final String MONGO_ID = "_id";

  private final MongoTemplate mongoTemplate;

  public MongoMirrorStore(MongoTemplate mongoTemplate) {
    this.mongoTemplate = mongoTemplate;
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  public void upsert(String collection, String uniqueKey, Map<String, Object> document) {
    Object key = document.get(uniqueKey);
    if (key == null) {
      throw new IllegalArgumentException("Mirror document has no value for " + uniqueKey);
    }
    mongoTemplate
        .getCollection(collection)
        .replaceOne(
            Filters.eq(uniqueKey, key), new Document(document), new ReplaceOptions().upsert(true));
    log.debug("Mirrored {} {}={}", collection, uniqueKey, key);
  }

  @Override
  public long count(String collection, Document filter) {
    return mongoTemplate.getCollection(collection).countDocuments(filter);
  }

  @Override
  public List<Map<String, Object>> find(
      String collection, Document filter, SortSpec sort, PageSpec page) {
    if (page.pageSize() == 0) {
      return List.of();
    }
    int direction = sort.direction() == SortDirection.ASC ? 1 : -1;
    var results = new ArrayList<Map<String, Object>>();
    mongoTemplate
        .getCollection(collection)
        .find(filter)
        .sort(new Document(sort.field(), direction))
        .skip((int) page.offset())
        .limit(page.pageSize())
        .forEach(document -> results.add(withoutMongoId(document)));
    return results;
  }

  private static Map<String, Object> withoutMongoId(Document document) {
    var result = new LinkedHashMap<String, Object>(document);
    result.remove(MONGO_ID);
    return result;
  }
}
