package com.learnguard.core.coordinator;

import com.learnguard.common.model.QueryType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rule-based classification for requests that arrive without a query type.
 * Patterns are tried in order; the first match wins.
 */
@Component
@Slf4j
public class QueryClassifier {

    private static final Map<QueryType, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(QueryType.CODE_ASSISTANCE, Pattern.compile(
            "(?i)\\b(code|coding|program|programming|function|java|python|javascript|algorithm|debug|compile|syntax|bug)\\b"));
        PATTERNS.put(QueryType.MATH_PROBLEM, Pattern.compile(
            "(?i)(\\b(equation|calculate|math|algebra|geometry|fraction|fractions|integral|derivative|percent)\\b|\\d+\\s*[-+*/x^]\\s*\\d+)"));
        PATTERNS.put(QueryType.CREATIVE_WRITING, Pattern.compile(
            "(?i)\\b(story|poem|poetry|essay|creative|imagine|write a|character)\\b"));
        PATTERNS.put(QueryType.HOMEWORK_HELP, Pattern.compile(
            "(?i)\\b(homework|assignment|worksheet|due tomorrow|my teacher asked)\\b"));
        PATTERNS.put(QueryType.CONCEPT_EXPLANATION, Pattern.compile(
            "(?i)\\b(what is|what are|explain|define|definition|meaning of|how does|why does|why do)\\b"));
        PATTERNS.put(QueryType.PROBLEM_SOLVING, Pattern.compile(
            "(?i)\\b(solve|how do i|how can i|steps to|figure out|problem)\\b"));
        PATTERNS.put(QueryType.LANGUAGE_LEARNING, Pattern.compile(
            "(?i)\\b(translate|grammar|vocabulary|pronounce|pronunciation|conjugate|spanish|french|german)\\b"));
    }

    public QueryType classify(String query) {
        if (query == null || query.isBlank()) {
            return QueryType.GENERAL_QUESTION;
        }
        for (Map.Entry<QueryType, Pattern> entry : PATTERNS.entrySet()) {
            if (entry.getValue().matcher(query).find()) {
                log.debug("[COORDINATOR] Query classified | type={}", entry.getKey());
                return entry.getKey();
            }
        }
        return QueryType.GENERAL_QUESTION;
    }
}
