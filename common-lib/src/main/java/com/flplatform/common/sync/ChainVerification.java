package com.flplatform.common.sync;

import java.util.List;

/**
 * Result of re-checking the retained model history.
 *
 * @param checkedModels models inspected, history plus current
 * @param failures      one message per broken hash or link, empty when valid
 */
public record ChainVerification(int checkedModels, List<String> failures) {

    public ChainVerification {
        failures = List.copyOf(failures);
    }

    public boolean valid() {
        return failures.isEmpty();
    }
}
