package com.learnguard.core.coordinator;

import com.learnguard.common.model.QueryType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryClassifierTest {

    private final QueryClassifier classifier = new QueryClassifier();

    @Test
    void classifiesBySubject() {
        assertEquals(QueryType.CODE_ASSISTANCE, classifier.classify("Why does my Python function return None?"));
        assertEquals(QueryType.MATH_PROBLEM, classifier.classify("What is 12 * 7?"));
        assertEquals(QueryType.CREATIVE_WRITING, classifier.classify("Help me start a poem about autumn"));
        assertEquals(QueryType.HOMEWORK_HELP, classifier.classify("Can you check my homework on rivers"));
        assertEquals(QueryType.CONCEPT_EXPLANATION, classifier.classify("Explain photosynthesis"));
        assertEquals(QueryType.PROBLEM_SOLVING, classifier.classify("How do I study for a test?"));
        assertEquals(QueryType.LANGUAGE_LEARNING, classifier.classify("Translate hello into Spanish"));
    }

    @Test
    void earlierPatternsWin() {
        assertEquals(QueryType.CODE_ASSISTANCE, classifier.classify("Explain this java algorithm"));
    }

    @Test
    void fallsBackToGeneral() {
        assertEquals(QueryType.GENERAL_QUESTION, classifier.classify("Tell me about volcanoes"));
        assertEquals(QueryType.GENERAL_QUESTION, classifier.classify("  "));
        assertEquals(QueryType.GENERAL_QUESTION, classifier.classify(null));
    }
}
