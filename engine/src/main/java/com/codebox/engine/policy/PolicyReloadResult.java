package com.codebox.engine.policy;

import java.util.List;

/**
 * Outcome of {@link PolicyStore#reload}.
 *
 * @param applied true when the new policy is now active
 * @param policy  the policy active after the call
 * @param errors  invariant violations that caused a rejection (empty when applied)
 */
public record PolicyReloadResult(boolean applied, SecurityPolicy policy, List<String> errors) {

    public static PolicyReloadResult applied(SecurityPolicy policy) {
        return new PolicyReloadResult(true, policy, List.of());
    }

    public static PolicyReloadResult rejected(SecurityPolicy current, List<String> errors) {
        return new PolicyReloadResult(false, current, List.copyOf(errors));
    }
}
