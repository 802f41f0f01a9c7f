package com.lyshra.open.flowsync.core.engine.hash;

/**
 * Digest function applied to canonical workflow JSON.
 */
@FunctionalInterface
public interface IContentDigester {

    /**
     * @param canonicalPayload canonical JSON of a normalized definition
     * @return lowercase hexadecimal digest
     */
    String digest(String canonicalPayload);
}
