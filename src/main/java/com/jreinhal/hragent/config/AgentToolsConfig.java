package com.jreinhal.hragent.config;

import com.jreinhal.hragent.tools.ExpressionCalculator;
import com.jreinhal.hragent.util.LogSanitizer;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.function.FunctionToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Built-in tools offered to the tool planner. Which of them are used is decided per request by
 * {@code hragent.tools.enabled}.
 */
@Configuration
public class AgentToolsConfig {
    private static final Logger log = LoggerFactory.getLogger(AgentToolsConfig.class);

    public static final String CALCULATOR = "calculator";
    public static final String CURRENT_TIME = "current_time";

    @Bean
    public ToolCallback calculatorTool() {
        ExpressionCalculator calculator = new ExpressionCalculator();
        Function<CalculatorRequest, String> fn = request -> {
            String expression = request == null ? null : request.expression();
            log.info("Agent Tool Invoked: calculator({})", LogSanitizer.sanitize(expression));
            return calculator.evaluate(expression);
        };
        return FunctionToolCallback.builder(CALCULATOR, fn)
                .description("Evaluate a mathematical expression. Supports basic arithmetic (+, -, *, /) and parentheses. "
                        + "Use for pay, hours, overtime and notice-period calculations.")
                .inputType(CalculatorRequest.class)
                .toolCallResultConverter((result, returnType) -> String.valueOf(result))
                .build();
    }

    @Bean
    public ToolCallback currentTimeTool() {
        Function<CurrentTimeRequest, String> fn = request -> {
            String zone = request == null ? null : request.timezone();
            String now = currentTime(zone);
            log.info("Agent Tool Invoked: current_time({}) -> {}", LogSanitizer.sanitize(zone), now);
            return now;
        };
        return FunctionToolCallback.builder(CURRENT_TIME, fn)
                .description("Get the current date and time in ISO-8601 format. Optionally pass an IANA time zone "
                        + "such as America/Winnipeg; defaults to UTC.")
                .inputType(CurrentTimeRequest.class)
                .toolCallResultConverter((result, returnType) -> String.valueOf(result))
                .build();
    }

    static String currentTime(String zone) {
        ZoneId zoneId;
        try {
            zoneId = zone == null || zone.isBlank() ? ZoneOffset.UTC : ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            return "Error: Unknown time zone '" + zone + "'.";
        }
        return ZonedDateTime.now(zoneId).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public record CalculatorRequest(String expression) {
    }

    public record CurrentTimeRequest(String timezone) {
    }
}
