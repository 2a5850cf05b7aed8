package io.b2mash.b2b.recordcore.item;

import io.b2mash.b2b.recordcore.api.ApiResponse;
import io.b2mash.b2b.recordcore.api.ResponseEnvelopeFactory;
import io.b2mash.b2b.recordcore.lifecycle.RecordLifecycleService;
import io.b2mash.b2b.recordcore.lifecycle.RecordWriteResult;
import io.b2mash.b2b.recordcore.query.RecordQueryService;
import io.b2mash.b2b.recordcore.security.ActorResolver;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Item endpoints. All of them take their parameters as a JSON object body. */
@RestController
@RequestMapping("/api/v1/items")
public class ItemController {

  private final ItemRecordType itemType;
  private final RecordLifecycleService lifecycleService;
  private final RecordQueryService queryService;
  private final ActorResolver actorResolver;
  private final ResponseEnvelopeFactory envelopes;

  public ItemController(
      ItemRecordType itemType,
      RecordLifecycleService lifecycleService,
      RecordQueryService queryService,
      ActorResolver actorResolver,
      ResponseEnvelopeFactory envelopes) {
    this.itemType = itemType;
    this.lifecycleService = lifecycleService;
    this.queryService = queryService;
    this.actorResolver = actorResolver;
    this.envelopes = envelopes;
  }

  @PostMapping("/data")
  public ResponseEntity<ApiResponse> data(
      @RequestBody(required = false) Map<String, Object> params) {
    return envelopes.page(queryService.search(itemType, params));
  }

  @PostMapping("/list")
  public ResponseEntity<ApiResponse> list(
      @RequestBody(required = false) Map<String, Object> params) {
    return envelopes.page(queryService.searchMirror(itemType, params));
  }

  @PostMapping("/view")
  public ResponseEntity<ApiResponse> view(
      @RequestBody(required = false) Map<String, Object> params) {
    return envelopes.ok("success", queryService.view(itemType, params));
  }

  @PostMapping("/create")
  public ResponseEntity<ApiResponse> create(
      @RequestBody(required = false) Map<String, Object> params) {
    return written(lifecycleService.create(itemType, params, actorResolver.current()));
  }

  @PutMapping("/update")
  public ResponseEntity<ApiResponse> update(
      @RequestBody(required = false) Map<String, Object> params) {
    return written(lifecycleService.update(itemType, params, actorResolver.current()));
  }

  @DeleteMapping("/delete")
  public ResponseEntity<ApiResponse> delete(
      @RequestBody(required = false) Map<String, Object> params) {
    return written(lifecycleService.delete(itemType, params, actorResolver.current()));
  }

  private ResponseEntity<ApiResponse> written(RecordWriteResult result) {
    return envelopes.ok(result.scenario().successKey(), result.record());
  }
}
