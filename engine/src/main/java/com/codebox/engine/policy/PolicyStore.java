package com.codebox.engine.policy;

import com.codebox.engine.config.CodeboxProperties;
import com.codebox.engine.model.SecurityPolicyDocument;
import com.codebox.engine.repository.SecurityPolicyDocumentRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single active {@link SecurityPolicy}.
 *
 * Reads are a plain volatile load and never block, which matters because
 * every submission reads the policy once. A reload validates the candidate,
 * then swaps the reference in one step. Executions already in flight keep
 * the snapshot they took at the start of their call.
 *
 * Startup order: the policy persisted by the last successful reload, if it is
 * present and still valid; otherwise the {@code codebox.policy.*} defaults.
 */
@Component
public class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final AtomicReference<SecurityPolicy> active;
    private final SecurityPolicyDocumentRepository documents;
    private final ObjectMapper json;

    public PolicyStore(CodeboxProperties properties,
                       SecurityPolicyDocumentRepository documents,
                       ObjectMapper objectMapper) {
        this.documents = documents;
        this.json      = objectMapper;

        SecurityPolicy configured = properties.getPolicy().toSecurityPolicy();
        List<String> errors = configured.violations();
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid codebox.policy configuration: " + errors);
        }
        this.active = new AtomicReference<>(configured);
    }

    /** Replace the configured defaults with the persisted policy, when there is one. */
    @PostConstruct
    void restorePersisted() {
        try {
            documents.findById(SecurityPolicyDocument.SINGLETON_ID).ifPresent(doc -> {
                try {
                    SecurityPolicy persisted = json.readValue(doc.getPolicyJson(), SecurityPolicy.class);
                    List<String> errors = persisted.violations();
                    if (errors.isEmpty()) {
                        active.set(persisted);
                        log.info("Restored security policy saved at {}", doc.getUpdatedAt());
                    } else {
                        log.warn("Ignoring persisted security policy, it violates invariants: {}", errors);
                    }
                } catch (JsonProcessingException e) {
                    log.warn("Ignoring unreadable persisted security policy: {}", e.getOriginalMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Could not load persisted security policy, using configured defaults: {}", e.getMessage());
        }
    }

    /** The active policy. Take it once per call and use that snapshot throughout. */
    public SecurityPolicy current() {
        return active.get();
    }

    /**
     * Validate and atomically activate a new policy.
     *
     * Persisting the accepted policy is best-effort: a storage failure is
     * logged and the in-memory swap still stands.
     */
    public PolicyReloadResult reload(SecurityPolicy candidate) {
        if (candidate == null) {
            return PolicyReloadResult.rejected(current(), List.of("policy body is required"));
        }
        List<String> errors = candidate.violations();
        if (!errors.isEmpty()) {
            log.warn("Rejected security policy reload: {}", errors);
            return PolicyReloadResult.rejected(current(), errors);
        }

        active.set(candidate);
        log.info("Security policy reloaded (wallClock={}s, memory={} bytes, output={} bytes, languages={})",
                candidate.maxWallClockSeconds(), candidate.maxMemoryBytes(),
                candidate.maxOutputBytes(), candidate.languagesEnabled());
        persist(candidate);
        return PolicyReloadResult.applied(candidate);
    }

    private void persist(SecurityPolicy policy) {
        try {
            String body = json.writeValueAsString(policy);
            SecurityPolicyDocument doc = documents.findById(SecurityPolicyDocument.SINGLETON_ID)
                    .orElseGet(() -> new SecurityPolicyDocument(body));
            doc.replace(body);
            documents.save(doc);
        } catch (Exception e) {
            log.error("Security policy applied in memory but could not be persisted", e);
        }
    }
}
