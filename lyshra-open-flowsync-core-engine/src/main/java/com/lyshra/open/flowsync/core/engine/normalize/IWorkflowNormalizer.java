package com.lyshra.open.flowsync.core.engine.normalize;

import java.util.Map;

/**
 * Strips environment-specific and volatile fields from a workflow definition so that
 * semantically identical workflows normalize identically, whichever environment or
 * point in time produced them.
 */
public interface IWorkflowNormalizer {

    /**
     * Returns a normalized deep copy. The input is never modified.
     *
     * @param definition raw workflow definition
     * @return normalized definition with nodes ordered by name
     */
    Map<String, Object> normalize(Map<String, Object> definition);
}
