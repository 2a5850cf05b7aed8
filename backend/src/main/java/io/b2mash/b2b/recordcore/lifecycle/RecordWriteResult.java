package io.b2mash.b2b.recordcore.lifecycle;

import io.b2mash.b2b.recordcore.record.Scenario;
import java.util.Map;

/** Outcome of a successful write: the scenario (for the success message) and the stored view. */
public record RecordWriteResult(Scenario scenario, Map<String, Object> record) {}
