package com.jreinhal.hragent.prompt;

import com.jreinhal.hragent.settings.AgentSettings;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Named prompts with built-in defaults. A non-blank {@code hragent.prompts.<name>} entry in the
 * active settings replaces the default text.
 */
@Component
public class PromptCatalog {

    public static final String MAIN_SYSTEM = "main_system";
    public static final String RETRIEVAL_CONTEXT = "retrieval_context";
    public static final String QUERY_ANALYSIS_SYSTEM = "query_analysis_system";
    public static final String QUERY_ANALYSIS_USER = "query_analysis_user";
    public static final String CONFIDENCE_EVALUATION = "confidence_evaluation";
    public static final String TOOL_INVOCATION_SYSTEM = "tool_invocation_system";

    static final String DEFAULT_MAIN_SYSTEM = """
            You are a Canadian Employment Standards HR Assistant specializing in provincial employment law.
            Your role is to answer questions accurately based on the provided context from official employment standards documents.

            If the context contains relevant information, use it to provide a detailed answer with specific references.
            If the context is insufficient, clearly state what information is missing.

            Always be professional, accurate, and cite specific sections or sources when possible.
            Never provide legal advice - only informational guidance based on the documents provided.""";

    static final String DEFAULT_QUERY_ANALYSIS_SYSTEM =
            "You are an expert query analyzer for a Canadian employment-standards HR assistant. "
            + "Analyze queries precisely and return ONLY valid JSON - no other text, no markdown formatting, just raw JSON.";

    static final String DEFAULT_QUERY_ANALYSIS_USER = """
            Analyze the following user query for an employment-standards HR assistant.

            Query: "{query}"

            Provide a comprehensive analysis including:

            1. INTENT CLASSIFICATION:
               - factual: Simple fact retrieval
               - procedural: How-to, step-by-step instructions
               - troubleshooting: Problem-solving
               - comparison: Comparing options or rules
               - definition: Defining terms or concepts
               - conceptual: Explaining abstract concepts
               - navigational: Finding specific resources
               - transactional: Action-oriented requests
               - unknown: Unable to classify

            2. COMPLEXITY ASSESSMENT:
               - simple: Single fact, direct answer
               - moderate: Synthesis of 2-5 facts
               - complex: Multi-step reasoning, 5+ facts
               - very_complex: Deep analysis, extensive reasoning

            3. ENTITY EXTRACTION:
               Extract entities (legislation, jurisdiction, organization, role, amount, date, duration, concept).

            4. ROUTING DECISION:
               - standard_rag: Normal retrieval + generation
               - tool_invocation: Requires external tools (calculator, current time)
               - multi_step_reasoning: Complex reasoning chain
               - direct_escalation: Out of scope, escalate immediately
               - cached_response: Check semantic cache first

            5. CONTEXT REQUIREMENTS:
               - Does it need recent/updated information?
               - Does it need multiple document sources?
               - How many documents should be retrieved? (1-20)
               - What similarity threshold? (0.4-0.6)

            6. TOOL REQUIREMENTS:
               - Does it require external tools?
               - Which tools might be useful?

            Respond in valid JSON format with this structure:
            {
              "intent": "intent_value",
              "intent_confidence": 0.0-1.0,
              "complexity": "complexity_value",
              "complexity_score": 0.0-1.0,
              "entities": [
                {"text": "entity_text", "type": "entity_type", "confidence": 0.0-1.0, "metadata": {}}
              ],
              "routing": "routing_decision",
              "routing_confidence": 0.0-1.0,
              "requires_recent_context": true/false,
              "requires_multiple_sources": true/false,
              "suggested_doc_count": 1-20,
              "suggested_similarity_threshold": 0.4-0.6,
              "requires_tools": true/false,
              "suggested_tools": ["tool1", "tool2"],
              "key_concepts": ["concept1", "concept2"],
              "query_topics": ["topic1", "topic2"],
              "analysis_reasoning": "Explanation of analysis decisions"
            }""";

    static final String DEFAULT_CONFIDENCE_EVALUATION = """
            Evaluate how well the response answers the user's question using only the provided context.
            Consider query understanding, context relevance, response quality and knowledge gaps.

            Question: {query}

            Context:
            {context}

            Response: {response}

            Provide a score between 0.0 and 1.0. Respond with ONLY a number (e.g., '0.85').""";

    static final String DEFAULT_TOOL_INVOCATION_SYSTEM = """
            You are a helpful assistant with access to tools. Analyze the user's query and determine which tools to use, if any.

            Available tools:
            {tools}

            Respond with ONLY a JSON object of the form
            {"tool_calls": [{"name": "tool_name", "arguments": {"arg": "value"}}]}
            Use an empty "tool_calls" list when no tool is needed.""";

    private static final Map<String, String> DEFAULTS = Map.of(
            MAIN_SYSTEM, DEFAULT_MAIN_SYSTEM,
            QUERY_ANALYSIS_SYSTEM, DEFAULT_QUERY_ANALYSIS_SYSTEM,
            QUERY_ANALYSIS_USER, DEFAULT_QUERY_ANALYSIS_USER,
            CONFIDENCE_EVALUATION, DEFAULT_CONFIDENCE_EVALUATION,
            TOOL_INVOCATION_SYSTEM, DEFAULT_TOOL_INVOCATION_SYSTEM);

    /**
     * Overridden text if configured, otherwise the built-in default; {@code null} for a name
     * without a built-in default that is not overridden.
     */
    public PromptTemplate template(String name, AgentSettings settings) {
        String override = override(name, settings);
        if (override != null) {
            return new PromptTemplate(override);
        }
        String text = DEFAULTS.get(name);
        return text == null ? null : new PromptTemplate(text);
    }

    public String render(String name, AgentSettings settings, Map<String, String> variables) {
        PromptTemplate template = template(name, settings);
        return template == null ? "" : template.render(variables);
    }

    /**
     * {@code retrieval_context} has no single default: without an override the generator
     * picks one of two built-in layouts depending on conversation history.
     */
    public boolean isOverridden(String name, AgentSettings settings) {
        return override(name, settings) != null;
    }

    private static String override(String name, AgentSettings settings) {
        if (settings == null || settings.prompts() == null) {
            return null;
        }
        String value = settings.prompts().get(name);
        return value == null || value.isBlank() ? null : value;
    }
}
