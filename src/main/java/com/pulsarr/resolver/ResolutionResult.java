package com.pulsarr.resolver;

import com.pulsarr.decision.RouterDecision;

import java.util.List;

/**
 * Outcome of a resolution.
 *
 * @param decisions One {@code route} decision per target instance, primary target first
 * @param fallback  True when no rule matched and the default instance was used
 */
public record ResolutionResult(List<RouterDecision> decisions, boolean fallback) {

    public ResolutionResult {
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
    }

    public static ResolutionResult matched(List<RouterDecision> decisions) {
        return new ResolutionResult(decisions, false);
    }

    public static ResolutionResult fallback(List<RouterDecision> decisions) {
        return new ResolutionResult(decisions, true);
    }

    public static ResolutionResult empty() {
        return new ResolutionResult(List.of(), true);
    }

    public boolean isEmpty() {
        return decisions.isEmpty();
    }
}
