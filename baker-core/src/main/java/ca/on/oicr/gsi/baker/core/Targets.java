package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.CacheTarget;
import ca.on.oicr.gsi.baker.MetadataTarget;
import ca.on.oicr.gsi.baker.OutputTarget;

/**
 * The storage locations resolved for one recipe, all on the same filesystem
 *
 * @param output where the recipe writes its result
 * @param inputCache where downloaded inputs are kept
 * @param metadataCache where bookkeeping about the inputs is kept
 */
public record Targets(OutputTarget output, CacheTarget inputCache, MetadataTarget metadataCache) {}
