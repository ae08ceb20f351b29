package com.learnguard.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnguard.common.model.CourseContext;
import com.learnguard.common.model.LearnerProfile;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.util.QueryNormalizer;
import com.learnguard.core.config.CacheProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fingerprint of a request: SHA-256 over the normalized question and the parts of the
 * context that change the answer, scoped by user and session so entries never cross learners.
 * <p>
 * Format: {@code llm:response:{sha256}:user:{userId}:session:{sessionId}}
 */
@Component
public class CacheKeyGenerator {

    private final ObjectMapper mapper = new ObjectMapper();
    private final String prefix;

    public CacheKeyGenerator(CacheProperties properties) {
        this.prefix = properties.getKeyPrefix();
    }

    public String keyFor(LearningRequest request) {
        return prefix + fingerprint(request) + ":user:" + request.getUserId() + ":session:" + request.getSessionId();
    }

    public String userPattern(String userId) {
        return prefix + "*:user:" + escapeGlob(userId) + ":*";
    }

    public String sessionPattern(String sessionId) {
        return prefix + "*:session:" + escapeGlob(sessionId);
    }

    public String allPattern() {
        return prefix + "*";
    }

    String fingerprint(LearningRequest request) {
        Map<String, Object> components = new LinkedHashMap<>();
        components.put("query", QueryNormalizer.normalize(request.getQuery()));
        components.put("queryType", request.getQueryType() == null ? null : request.getQueryType().getCode());
        components.put("inputType", request.getInputType() == null ? null : request.getInputType().getCode());

        CourseContext course = request.getCourseContext();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("courseId", course == null ? null : course.getCourseId());
        context.put("subject", course == null ? null : course.getSubject());
        context.put("gradeLevel", course == null ? null : course.getGradeLevel());
        context.put("currentLesson", course == null ? null : course.getCurrentLesson());
        components.put("context", context);

        LearnerProfile profile = request.getUserProfile();
        Map<String, Object> learner = new LinkedHashMap<>();
        learner.put("age", profile == null ? null : profile.getAge());
        learner.put("gradeLevel", profile == null ? null : profile.getGradeLevel());
        learner.put("learningStyle", profile == null ? null : profile.getLearningStyle());
        learner.put("language", profile == null ? null : profile.getLanguage());
        components.put("userProfile", learner);

        try {
            return sha256(mapper.writeValueAsString(components));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cache key components", e);
        }
    }

    /** Backslash-escapes glob metacharacters so an id only ever matches itself. */
    static String escapeGlob(String id) {
        StringBuilder escaped = new StringBuilder(id.length());
        for (char c : id.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
