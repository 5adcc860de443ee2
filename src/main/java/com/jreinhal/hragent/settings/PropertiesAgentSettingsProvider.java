package com.jreinhal.hragent.settings;

import com.jreinhal.hragent.config.HrAgentProperties;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds settings snapshots from the bound {@code hragent.*} properties.
 */
@Component
public class PropertiesAgentSettingsProvider implements AgentSettingsProvider {

    private final HrAgentProperties properties;

    public PropertiesAgentSettingsProvider(HrAgentProperties properties) {
        this.properties = properties;
    }

    @Override
    public AgentSettings load() {
        HrAgentProperties.Thresholds t = properties.getThresholds();
        HrAgentProperties.Model m = properties.getModel();
        HrAgentProperties.Analysis a = properties.getAnalysis();
        HrAgentProperties.Search s = properties.getSearch();
        HrAgentProperties.Confidence c = properties.getConfidence();
        HrAgentProperties.Tools tools = properties.getTools();

        AgentSettings.ConfidenceSettings confidence = new AgentSettings.ConfidenceSettings(
                c.getMethod(),
                new AgentSettings.FormulaWeights(
                        c.getFormulaWeights().getSimilarity(),
                        c.getFormulaWeights().getSourceQuality(),
                        c.getFormulaWeights().getResponseLength()),
                new AgentSettings.HybridWeights(c.getHybridWeights().getFormula(), c.getHybridWeights().getLlm()),
                new AgentSettings.LlmJudgeSettings(
                        c.getLlm().getModel(),
                        c.getLlm().getTemperature(),
                        c.getLlm().getMaxTokens(),
                        c.getLlm().getTimeoutMs()),
                new AgentSettings.FormulaTuning(
                        c.getFormula().getHighQualitySimilarity(),
                        c.getFormula().getFullLengthChars(),
                        c.getFormula().getPartialLengthChars()));

        return new AgentSettings(
                new AgentSettings.Thresholds(t.getEscalation(), t.getHigh(), t.getMedium(), t.getLow()),
                new AgentSettings.ModelSettings(m.getModel(), m.getTemperature(), m.getMaxTokens(), m.getTopP(),
                        m.getFrequencyPenalty(), m.getPresencePenalty()),
                new AgentSettings.AnalysisSettings(a.getModel(), a.getTemperature(), a.getMaxTokens()),
                new AgentSettings.SearchSettings(s.getSimilarityThreshold(), s.getMaxResults(),
                        s.getSuggestedThresholdCap()),
                confidence,
                properties.getExcerpt().getMaxLength(),
                new AgentSettings.ToolSettings(
                        tools.getEnabled() == null ? List.of() : tools.getEnabled(),
                        tools.getPlanningTemperature()),
                properties.getPrompts() == null ? Map.of() : properties.getPrompts());
    }
}
