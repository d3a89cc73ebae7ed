package com.zatca.fatoora.chain;

import java.util.Collections;
import java.util.List;

/**
 * Problems found by {@link ChainVerifier}, in ICV order.
 */
public final class ChainVerificationResult {

    private final List<String> problems;

    ChainVerificationResult(List<String> problems) {
        this.problems = Collections.unmodifiableList(problems);
    }

    public boolean isValid() {
        return problems.isEmpty();
    }

    public List<String> getProblems() {
        return problems;
    }

    @Override
    public String toString() {
        return isValid() ? "ChainVerificationResult{valid}" : "ChainVerificationResult{problems=" + problems + '}';
    }
}
