package com.jreinhal.hragent.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Static defaults for the agent, bound from {@code hragent.*}.
 *
 * <p>These values are not read by pipeline stages directly. They seed the
 * {@code PropertiesAgentSettingsProvider}, whose snapshots are validated and cached.</p>
 */
@Component
@ConfigurationProperties(prefix = "hragent")
public class HrAgentProperties {

    private Thresholds thresholds = new Thresholds();
    private Model model = new Model();
    private Analysis analysis = new Analysis();
    private Search search = new Search();
    private Confidence confidence = new Confidence();
    private Excerpt excerpt = new Excerpt();
    private Tools tools = new Tools();
    private Cache cache = new Cache();

    /**
     * Prompt overrides keyed by prompt name (e.g. {@code main_system}). Missing names use built-in text.
     */
    private Map<String, String> prompts = new HashMap<>();

    public Thresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Model getModel() {
        return model;
    }

    public void setModel(Model model) {
        this.model = model;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public void setConfidence(Confidence confidence) {
        this.confidence = confidence;
    }

    public Excerpt getExcerpt() {
        return excerpt;
    }

    public void setExcerpt(Excerpt excerpt) {
        this.excerpt = excerpt;
    }

    public Tools getTools() {
        return tools;
    }

    public void setTools(Tools tools) {
        this.tools = tools;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Map<String, String> getPrompts() {
        return prompts;
    }

    public void setPrompts(Map<String, String> prompts) {
        this.prompts = prompts;
    }

    public static class Thresholds {
        /**
         * Answers scoring below this value are routed to a human specialist.
         */
        private double escalation = 0.95;
        private double high = 0.85;
        private double medium = 0.70;
        private double low = 0.50;

        public double getEscalation() {
            return escalation;
        }

        public void setEscalation(double escalation) {
            this.escalation = escalation;
        }

        public double getHigh() {
            return high;
        }

        public void setHigh(double high) {
            this.high = high;
        }

        public double getMedium() {
            return medium;
        }

        public void setMedium(double medium) {
            this.medium = medium;
        }

        public double getLow() {
            return low;
        }

        public void setLow(double low) {
            this.low = low;
        }
    }

    public static class Model {
        /**
         * Model name passed with every generation call. Blank uses the chat model's default.
         */
        private String model;
        private double temperature = 0.7;
        private int maxTokens = 1000;
        private double topP = 1.0;
        private double frequencyPenalty = 0.0;
        private double presencePenalty = 0.0;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTopP() {
            return topP;
        }

        public void setTopP(double topP) {
            this.topP = topP;
        }

        public double getFrequencyPenalty() {
            return frequencyPenalty;
        }

        public void setFrequencyPenalty(double frequencyPenalty) {
            this.frequencyPenalty = frequencyPenalty;
        }

        public double getPresencePenalty() {
            return presencePenalty;
        }

        public void setPresencePenalty(double presencePenalty) {
            this.presencePenalty = presencePenalty;
        }
    }

    public static class Analysis {
        private String model;
        private double temperature = 0.3;
        private int maxTokens = 1000;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    public static class Search {
        private double similarityThreshold = 0.7;
        private int maxResults = 5;

        /**
         * Upper bound applied to the threshold suggested by query analysis. Strict suggested
         * thresholds otherwise suppress keyword matches in hybrid stores.
         */
        private double suggestedThresholdCap = 0.5;

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }

        public double getSuggestedThresholdCap() {
            return suggestedThresholdCap;
        }

        public void setSuggestedThresholdCap(double suggestedThresholdCap) {
            this.suggestedThresholdCap = suggestedThresholdCap;
        }
    }

    public static class Confidence {
        /**
         * One of {@code formula}, {@code llm}, {@code hybrid}.
         */
        private String method = "formula";
        private FormulaWeights formulaWeights = new FormulaWeights();
        private HybridWeights hybridWeights = new HybridWeights();
        private Llm llm = new Llm();
        private Formula formula = new Formula();

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public FormulaWeights getFormulaWeights() {
            return formulaWeights;
        }

        public void setFormulaWeights(FormulaWeights formulaWeights) {
            this.formulaWeights = formulaWeights;
        }

        public HybridWeights getHybridWeights() {
            return hybridWeights;
        }

        public void setHybridWeights(HybridWeights hybridWeights) {
            this.hybridWeights = hybridWeights;
        }

        public Llm getLlm() {
            return llm;
        }

        public void setLlm(Llm llm) {
            this.llm = llm;
        }

        public Formula getFormula() {
            return formula;
        }

        public void setFormula(Formula formula) {
            this.formula = formula;
        }
    }

    public static class FormulaWeights {
        private double similarity = 0.80;
        private double sourceQuality = 0.10;
        private double responseLength = 0.10;

        public double getSimilarity() {
            return similarity;
        }

        public void setSimilarity(double similarity) {
            this.similarity = similarity;
        }

        public double getSourceQuality() {
            return sourceQuality;
        }

        public void setSourceQuality(double sourceQuality) {
            this.sourceQuality = sourceQuality;
        }

        public double getResponseLength() {
            return responseLength;
        }

        public void setResponseLength(double responseLength) {
            this.responseLength = responseLength;
        }
    }

    public static class HybridWeights {
        private double formula = 0.60;
        private double llm = 0.40;

        public double getFormula() {
            return formula;
        }

        public void setFormula(double formula) {
            this.formula = formula;
        }

        public double getLlm() {
            return llm;
        }

        public void setLlm(double llm) {
            this.llm = llm;
        }
    }

    public static class Llm {
        private String model;
        private double temperature = 0.1;
        private int maxTokens = 100;
        private long timeoutMs = 2000;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Formula {
        /**
         * Passages above this similarity count towards the source-quality boost.
         */
        private double highQualitySimilarity = 0.75;
        private int fullLengthChars = 200;
        private int partialLengthChars = 100;

        public double getHighQualitySimilarity() {
            return highQualitySimilarity;
        }

        public void setHighQualitySimilarity(double highQualitySimilarity) {
            this.highQualitySimilarity = highQualitySimilarity;
        }

        public int getFullLengthChars() {
            return fullLengthChars;
        }

        public void setFullLengthChars(int fullLengthChars) {
            this.fullLengthChars = fullLengthChars;
        }

        public int getPartialLengthChars() {
            return partialLengthChars;
        }

        public void setPartialLengthChars(int partialLengthChars) {
            this.partialLengthChars = partialLengthChars;
        }
    }

    public static class Excerpt {
        private int maxLength = 300;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }
    }

    public static class Tools {
        /**
         * Built-in tools offered to the planner. Tools from {@code ToolCallbackProvider} beans are always offered.
         */
        private List<String> enabled = new ArrayList<>(List.of("calculator", "current_time"));
        private double planningTemperature = 0.3;

        public List<String> getEnabled() {
            return enabled;
        }

        public void setEnabled(List<String> enabled) {
            this.enabled = enabled;
        }

        public double getPlanningTemperature() {
            return planningTemperature;
        }

        public void setPlanningTemperature(double planningTemperature) {
            this.planningTemperature = planningTemperature;
        }
    }

    public static class Cache {
        private Duration settingsTtl = Duration.ofMinutes(5);

        public Duration getSettingsTtl() {
            return settingsTtl;
        }

        public void setSettingsTtl(Duration settingsTtl) {
            this.settingsTtl = settingsTtl;
        }
    }
}
