package com.jreinhal.hragent.confidence;

import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Weighted blend of the formula and LLM-judged scores.
 *
 * <p>The LLM branch runs on {@code scoringExecutor} while the formula is computed on the calling
 * thread. When the LLM branch degrades to the formula, only the formula score is reported, tagged
 * {@link ConfidenceMethod#HYBRID_FALLBACK_FORMULA}.</p>
 */
@Component
public class HybridConfidenceStrategy implements ConfidenceStrategy {

    private static final Logger log = LoggerFactory.getLogger(HybridConfidenceStrategy.class);

    // Slack over the LLM call timeout before the branch is abandoned.
    static final long BRANCH_GRACE_MS = 1000L;

    private final FormulaConfidenceStrategy formula;
    private final LlmConfidenceStrategy llm;
    private final ExecutorService scoringExecutor;

    public HybridConfidenceStrategy(FormulaConfidenceStrategy formula, LlmConfidenceStrategy llm,
                                    @Qualifier("scoringExecutor") ExecutorService scoringExecutor) {
        this.formula = formula;
        this.llm = llm;
        this.scoringExecutor = scoringExecutor;
    }

    @Override
    public ConfidenceResult score(ConfidenceInput input, AgentSettings settings) {
        AgentSettings.HybridWeights weights = settings.confidence().hybridWeights();
        log.info("Calculating hybrid confidence (formula={}, llm={})", weights.formula(), weights.llm());

        CompletableFuture<ConfidenceResult> llmFuture;
        try {
            llmFuture = CompletableFuture.supplyAsync(() -> this.llm.score(input, settings), this.scoringExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("LLM confidence branch rejected: {}", e.getMessage());
            llmFuture = null;
        }

        ConfidenceResult formulaResult = this.formula.score(input, settings);
        ConfidenceResult llmResult = llmFuture == null
                ? null
                : await(llmFuture, settings.confidence().llm().timeoutMs() + BRANCH_GRACE_MS);

        if (llmResult == null || llmResult.method() == ConfidenceMethod.FORMULA) {
            log.warn("LLM confidence unavailable, using formula-only for hybrid");
            Map<String, Object> breakdown = new LinkedHashMap<>(formulaResult.breakdown());
            breakdown.put("hybrid_note", "LLM unavailable, used formula-only");
            return new ConfidenceResult(formulaResult.score(), ConfidenceMethod.HYBRID_FALLBACK_FORMULA, breakdown,
                    llmResult == null ? null : llmResult.usage());
        }

        double combined = formulaResult.score() * weights.formula() + llmResult.score() * weights.llm();
        log.info("Hybrid confidence: {} (formula={}@{}, llm={}@{})", String.format(Locale.ROOT, "%.3f", combined),
                String.format(Locale.ROOT, "%.3f", formulaResult.score()), weights.formula(),
                String.format(Locale.ROOT, "%.3f", llmResult.score()), weights.llm());

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("formula_score", formulaResult.score());
        breakdown.put("llm_score", llmResult.score());
        breakdown.put("formula_weight", weights.formula());
        breakdown.put("llm_weight", weights.llm());
        breakdown.put("formula_details", formulaResult.breakdown());
        breakdown.put("llm_details", llmResult.breakdown());
        return new ConfidenceResult(combined, ConfidenceMethod.HYBRID, breakdown, llmResult.usage());
    }

    private static ConfidenceResult await(CompletableFuture<ConfidenceResult> future, long waitMs) {
        try {
            return future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("LLM confidence branch did not finish within {}ms", waitMs);
            return null;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("LLM confidence branch failed: {}", LogSanitizer.sanitize(cause.getMessage()), cause);
            return null;
        }
    }
}
