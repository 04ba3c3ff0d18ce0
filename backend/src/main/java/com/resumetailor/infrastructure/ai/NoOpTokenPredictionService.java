package com.resumetailor.infrastructure.ai;

import com.resumetailor.domain.optimization.service.TokenPredictionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Used when no prediction backend is configured: every sentence keeps its template wording,
 * which makes optimization output deterministic.
 */
@Service
@Profile("!prediction")
@Slf4j
public class NoOpTokenPredictionService implements TokenPredictionService {

    @Override
    public List<String> predict(String maskedContext) {
        log.trace("[DEV] token prediction disabled, context length {}", maskedContext.length());
        return List.of();
    }
}
