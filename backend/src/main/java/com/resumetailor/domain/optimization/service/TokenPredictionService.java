package com.resumetailor.domain.optimization.service;

import java.util.List;

/**
 * Masked-token prediction port. May be absent, slow, or return nothing;
 * callers must treat any failure as "no prediction".
 */
public interface TokenPredictionService {

    /**
     * Placeholder token expected inside the context passed to {@link #predict(String)}.
     */
    String MASK = "[MASK]";

    /**
     * Predict replacements for the {@link #MASK} placeholder.
     *
     * @param maskedContext text containing exactly one {@link #MASK}
     * @return candidate words, most likely first; empty when no prediction is available
     */
    List<String> predict(String maskedContext);
}
