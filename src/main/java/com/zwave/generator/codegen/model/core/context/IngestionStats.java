package com.zwave.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Counters collected while building a catalog.
 */
@Value
@Builder(toBuilder = true)
public class IngestionStats {

    int nodesRead;
    int nodesSkipped;
    int entriesSuperseded;
    int nodesDiscardedAsStale;
    int nodesDiscardedForNameCollision;
}
