package com.jreinhal.hragent.confidence;

import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.settings.AgentSettings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deterministic score from retrieval quality and answer length; makes no external call.
 *
 * <pre>
 * similarity_score = top-3 similarities weighted 0.6/0.3/0.1 (0.7/0.3 for two, the value for one)
 * source_boost     = passages above the high-quality similarity: >=3 1.0, 2 0.6, 1 0.3, 0 0.0
 * length_boost     = answer length: >=full 1.0, >=partial 0.5, else 0.0
 * score            = min(1, similarity_score*w_sim + source_boost*w_src + length_boost*w_len)
 * </pre>
 *
 * No passages always scores 0.
 */
@Component
public class FormulaConfidenceStrategy implements ConfidenceStrategy {

    private static final Logger log = LoggerFactory.getLogger(FormulaConfidenceStrategy.class);

    @Override
    public ConfidenceResult score(ConfidenceInput input, AgentSettings settings) {
        AgentSettings.FormulaWeights weights = settings.confidence().formulaWeights();
        AgentSettings.FormulaTuning tuning = settings.confidence().formula();
        List<ContextPassage> passages = input.passages();

        if (passages.isEmpty()) {
            log.warn("No context documents - formula confidence=0.0");
            Map<String, Object> breakdown = new LinkedHashMap<>();
            breakdown.put("reason", "no_context_documents");
            breakdown.put("similarity_score", 0.0);
            breakdown.put("source_boost", 0.0);
            breakdown.put("length_boost", 0.0);
            return new ConfidenceResult(0.0, ConfidenceMethod.FORMULA, breakdown);
        }

        double similarityScore = similarityScore(passages);
        int highQualityCount = (int) passages.stream()
                .filter(p -> p.similarity() > tuning.highQualitySimilarity())
                .count();
        double sourceBoost = sourceBoost(highQualityCount);
        int responseLength = input.response().length();
        double lengthBoost = responseLength >= tuning.fullLengthChars() ? 1.0
                : responseLength >= tuning.partialLengthChars() ? 0.5
                : 0.0;

        double confidence = Math.min(1.0,
                similarityScore * weights.similarity()
                        + sourceBoost * weights.sourceQuality()
                        + lengthBoost * weights.responseLength());

        log.info("Formula confidence: {} (similarity={}@{}, sources={}@{}, length={}@{})",
                String.format(Locale.ROOT, "%.3f", confidence),
                String.format(Locale.ROOT, "%.3f", similarityScore), weights.similarity(),
                sourceBoost, weights.sourceQuality(),
                lengthBoost, weights.responseLength());

        Map<String, Object> weightMap = new LinkedHashMap<>();
        weightMap.put("similarity", weights.similarity());
        weightMap.put("source_quality", weights.sourceQuality());
        weightMap.put("response_length", weights.responseLength());

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("similarity_score", similarityScore);
        breakdown.put("source_boost", sourceBoost);
        breakdown.put("length_boost", lengthBoost);
        breakdown.put("high_quality_source_count", highQualityCount);
        breakdown.put("response_length", responseLength);
        breakdown.put("weights", weightMap);
        return new ConfidenceResult(confidence, ConfidenceMethod.FORMULA, breakdown);
    }

    static double similarityScore(List<ContextPassage> passages) {
        if (passages.size() >= 3) {
            return passages.get(0).similarity() * 0.6
                    + passages.get(1).similarity() * 0.3
                    + passages.get(2).similarity() * 0.1;
        }
        if (passages.size() == 2) {
            return passages.get(0).similarity() * 0.7 + passages.get(1).similarity() * 0.3;
        }
        return passages.get(0).similarity();
    }

    static double sourceBoost(int highQualityCount) {
        if (highQualityCount >= 3) {
            return 1.0;
        }
        if (highQualityCount == 2) {
            return 0.6;
        }
        return highQualityCount == 1 ? 0.3 : 0.0;
    }
}
