package com.lyshra.open.flowsync.core.engine.hash;

import com.lyshra.open.flowsync.core.engine.normalize.CanonicalJson;
import com.lyshra.open.flowsync.core.engine.normalize.IWorkflowNormalizer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes collision-aware content fingerprints.
 *
 * <ol>
 *   <li>Normalize the definition and serialize it canonically.</li>
 *   <li>Digest the canonical bytes.</li>
 *   <li>Consult the collision registry: an unknown hash is registered; a known hash with
 *       the same payload is returned as is; a known hash with a different payload is a
 *       collision. With a canonical id, the payload is salted with
 *       {@value #CANONICAL_ID_SALT_KEY} and re-digested. Without one the colliding hash is
 *       returned and the result flags the collision as unresolved.</li>
 * </ol>
 */
@Slf4j
public class WorkflowContentHasher {

    static final String CANONICAL_ID_SALT_KEY = "__canonical_id__";

    private final IWorkflowNormalizer normalizer;
    private final IContentDigester digester;
    private final IHashCollisionRegistry registry;

    public WorkflowContentHasher(IWorkflowNormalizer normalizer,
                                 IContentDigester digester,
                                 IHashCollisionRegistry registry) {
        this.normalizer = normalizer;
        this.digester = digester;
        this.registry = registry;
    }

    public Mono<FingerprintResult> computeFingerprint(Map<String, Object> definition, String canonicalId) {
        return Mono.fromCallable(() -> normalizer.normalize(definition))
                .flatMap(normalized -> {
                    String payload = CanonicalJson.write(normalized);
                    String hash = digester.digest(payload);
                    return registry.registerIfAbsent(hash, payload)
                            .flatMap(existing -> {
                                if (existing.isEmpty() || existing.get().equals(payload)) {
                                    return Mono.just(FingerprintResult.clean(hash));
                                }
                                return resolveCollision(normalized, hash, canonicalId);
                            });
                });
    }

    private Mono<FingerprintResult> resolveCollision(Map<String, Object> normalized, String hash, String canonicalId) {
        if (canonicalId == null || canonicalId.isBlank()) {
            log.error("Hash collision on {} with no canonical id to derive a fallback; returning colliding hash", hash);
            return Mono.just(FingerprintResult.builder()
                    .contentHash(hash)
                    .originalHash(hash)
                    .collisionDetected(true)
                    .resolved(false)
                    .build());
        }
        Map<String, Object> salted = new LinkedHashMap<>(normalized);
        salted.put(CANONICAL_ID_SALT_KEY, canonicalId);
        String saltedPayload = CanonicalJson.write(salted);
        String fallbackHash = digester.digest(saltedPayload);
        log.warn("Hash collision on {} for canonical workflow {}; using fallback hash {}", hash, canonicalId, fallbackHash);
        return registry.registerIfAbsent(fallbackHash, saltedPayload)
                .map(ignored -> FingerprintResult.builder()
                        .contentHash(fallbackHash)
                        .originalHash(hash)
                        .collisionDetected(true)
                        .resolved(true)
                        .build());
    }
}
