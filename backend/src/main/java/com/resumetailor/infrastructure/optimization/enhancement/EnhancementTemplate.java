package com.resumetailor.infrastructure.optimization.enhancement;

import com.resumetailor.domain.optimization.service.TokenPredictionService;

/**
 * A sentence appended to a paragraph to introduce a keyword.
 *
 * @param id       stable identifier, used in logs
 * @param leadWord first word of the sentence; the only word the prediction service may replace
 * @param body     rest of the sentence with a {@code {kw}} placeholder
 */
public record EnhancementTemplate(String id, String leadWord, String body) {

    private static final String PLACEHOLDER = "{kw}";

    public String render(String keyword) {
        return render(leadWord, keyword);
    }

    public String render(String lead, String keyword) {
        return lead + " " + body.replace(PLACEHOLDER, keyword);
    }

    /**
     * Rendered sentence with the lead word replaced by the mask token.
     */
    public String masked(String keyword) {
        return render(TokenPredictionService.MASK, keyword);
    }
}
