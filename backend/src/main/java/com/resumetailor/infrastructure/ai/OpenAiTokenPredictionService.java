package com.resumetailor.infrastructure.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.resumetailor.domain.optimization.service.TokenPredictionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Masked-token prediction backed by a chat model prompted to behave like a fill-mask model.
 *
 * Results are memoized per masked context (LRU). Failures surface as
 * {@link TokenPredictionException}; callers fall back to their own wording.
 */
@Slf4j
@Service
@Profile("prediction")
@RequiredArgsConstructor
public class OpenAiTokenPredictionService implements TokenPredictionService {

    static final int CACHE_SIZE = 500;
    private static final int MAX_CANDIDATES = 5;
    private static final double TEMPERATURE = 0.0;
    private static final int MAX_TOKENS = 60;

    private static final String SYSTEM_PROMPT = """
            You are a masked language model.
            The user sends one piece of resume text containing exactly one [MASK] token.
            Predict the single English word that best replaces [MASK].

            ## Rules
            1. Return up to 5 candidates, most likely first
            2. Each candidate is one word: letters only, no punctuation, no phrases
            3. Never repeat words that already follow [MASK]

            ## Output (JSON)
            {"candidates": ["word1", "word2"]}
            """;

    private final OpenAIClient openAIClient;
    private final ObjectMapper objectMapper;
    private final PredictionMetricsTracker metricsTracker;

    @Value("${openai.prediction-model:gpt-4o-mini}")
    private String model;

    private final Map<String, List<String>> cache = Collections.synchronizedMap(
            new LinkedHashMap<>(64, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, List<String>> eldest) {
                    return size() > CACHE_SIZE;
                }
            });

    @Override
    public List<String> predict(String maskedContext) {
        if (maskedContext == null || !maskedContext.contains(MASK)) {
            throw new TokenPredictionException("Context must contain " + MASK);
        }

        List<String> cached = cache.get(maskedContext);
        if (cached != null) {
            metricsTracker.recordCacheHit();
            return cached;
        }

        List<String> candidates = callModel(maskedContext);
        cache.put(maskedContext, candidates);
        return candidates;
    }

    private List<String> callModel(String maskedContext) {
        ChatCompletion completion;
        try {
            completion = openAIClient.chat().completions().create(ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(TEMPERATURE)
                    .maxCompletionTokens(MAX_TOKENS)
                    .addSystemMessage(SYSTEM_PROMPT)
                    .addUserMessage(maskedContext)
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build());
        } catch (Exception e) {
            metricsTracker.recordFailure();
            throw new TokenPredictionException("Prediction call failed: " + e.getMessage(), e);
        }

        String content = completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .orElse(null);
        if (content == null) {
            metricsTracker.recordFailure();
            throw new TokenPredictionException("Prediction response has no content");
        }

        List<String> candidates = parseCandidates(content);
        long promptTokens = completion.usage().map(u -> u.promptTokens()).orElse(0L);
        metricsTracker.recordCall(promptTokens, candidates.size());
        return candidates;
    }

    List<String> parseCandidates(String content) {
        try {
            JsonNode root = objectMapper.readTree(content);
            JsonNode node = root.path("candidates");
            List<String> candidates = new ArrayList<>();
            if (node.isArray()) {
                for (JsonNode item : node) {
                    String word = item.asText("").strip();
                    if (!word.isEmpty() && candidates.size() < MAX_CANDIDATES) {
                        candidates.add(word);
                    }
                }
            }
            return List.copyOf(candidates);
        } catch (Exception e) {
            log.warn("[TokenPrediction] Parse failed: {}", e.getMessage());
            return List.of();
        }
    }

    int cacheSize() {
        return cache.size();
    }
}
