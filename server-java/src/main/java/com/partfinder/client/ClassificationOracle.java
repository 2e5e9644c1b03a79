package com.partfinder.client;

import java.io.IOException;

/**
 * A text-in, text-out model used to classify parts and judge stores. Answers are
 * free text that should contain JSON; see {@link OracleJsonExtractor}.
 */
public interface ClassificationOracle {

    /**
     * Whether the oracle is configured at all. Callers skip straight to their
     * fallback when it is not.
     */
    boolean isAvailable();

    String complete(String prompt, int maxOutputTokens, CancellationToken token) throws IOException;
}
