package com.codebox.engine.api;

import com.codebox.engine.api.dto.LanguageResponse;
import com.codebox.engine.config.CodeboxProperties;
import com.codebox.engine.model.Language;
import com.codebox.engine.policy.PolicyReloadResult;
import com.codebox.engine.policy.PolicyStore;
import com.codebox.engine.policy.SecurityPolicy;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

/**
 * GET /admin/policy  - the active security policy
 * PUT /admin/policy  - replace it atomically; 422 with the violated invariants
 *                      when the candidate is invalid (the old policy stays active)
 * GET /languages     - languages the active policy currently accepts
 *
 * Access control for /admin is left to the deployment (reverse proxy or
 * network policy); the engine does not authenticate callers.
 */
@RestController
public class PolicyController {

    private final PolicyStore       policyStore;
    private final CodeboxProperties properties;

    public PolicyController(PolicyStore policyStore, CodeboxProperties properties) {
        this.policyStore = policyStore;
        this.properties  = properties;
    }

    @GetMapping("/admin/policy")
    public SecurityPolicy current() {
        return policyStore.current();
    }

    @PutMapping("/admin/policy")
    public ResponseEntity<PolicyReloadResult> reload(@RequestBody SecurityPolicy candidate) {
        PolicyReloadResult result = policyStore.reload(candidate);
        return result.applied()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }

    @GetMapping("/languages")
    public List<LanguageResponse> languages() {
        SecurityPolicy policy = policyStore.current();
        return Arrays.stream(Language.values())
                .filter(policy::languageEnabled)
                .map(l -> new LanguageResponse(l, l.alias(),
                        properties.getSandbox().interpreterFor(l).getFileName()))
                .toList();
    }
}
