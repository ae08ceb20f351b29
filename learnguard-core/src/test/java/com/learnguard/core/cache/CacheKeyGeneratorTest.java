package com.learnguard.core.cache;

import com.learnguard.common.model.CourseContext;
import com.learnguard.common.model.InputType;
import com.learnguard.common.model.LearnerProfile;
import com.learnguard.common.model.QueryType;
import com.learnguard.core.config.CacheProperties;
import org.junit.jupiter.api.Test;

import static com.learnguard.core.support.TestRequests.request;
import static org.junit.jupiter.api.Assertions.*;

class CacheKeyGeneratorTest {

    private final CacheKeyGenerator generator = new CacheKeyGenerator(new CacheProperties());

    @Test
    void keyIgnoresCaseWhitespaceAndPunctuation() {
        String messy = generator.keyFor(request(" What is  photosynthesis? ").build());
        String clean = generator.keyFor(request("what is photosynthesis").build());

        assertEquals(clean, messy);
        assertEquals(messy, generator.keyFor(request(" What is  photosynthesis? ").build()));
    }

    @Test
    void keyHasScopedFormat() {
        String key = generator.keyFor(request("What is photosynthesis?").build());

        assertTrue(key.matches("llm:response:[0-9a-f]{64}:user:student-1:session:session-1"), key);
    }

    @Test
    void contextThatChangesTheAnswerChangesTheKey() {
        String base = generator.fingerprint(request("What is photosynthesis?").build());

        assertNotEquals(base, generator.fingerprint(request("What is photosynthesis?")
            .queryType(QueryType.HOMEWORK_HELP).build()));
        assertNotEquals(base, generator.fingerprint(request("What is photosynthesis?")
            .inputType(InputType.VOICE).build()));
        assertNotEquals(base, generator.fingerprint(request("What is photosynthesis?")
            .courseContext(CourseContext.builder().courseId("bio-101").currentLesson("Leaves").build()).build()));
        assertNotEquals(base, generator.fingerprint(request("What is photosynthesis?")
            .userProfile(LearnerProfile.builder().userId("student-1").age(9).build()).build()));
    }

    @Test
    void identityFieldsDoNotChangeTheFingerprint() {
        String base = generator.fingerprint(request("What is photosynthesis?").build());

        assertEquals(base, generator.fingerprint(request("What is photosynthesis?").id("req-2").userId("other").build()));
    }

    @Test
    void invalidationPatternsEscapeGlobCharacters() {
        assertEquals("llm:response:*:user:\\*:*", generator.userPattern("*"));
        assertEquals("llm:response:*:session:a\\?b\\[1\\]", generator.sessionPattern("a?b[1]"));
        assertEquals("llm:response:*:user:student-1:*", generator.userPattern("student-1"));
    }
}
