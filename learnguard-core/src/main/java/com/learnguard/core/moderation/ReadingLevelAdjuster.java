package com.learnguard.core.moderation;

import com.learnguard.common.model.LearnerProfile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rewrites answers for younger readers: plain words below age 13 (or grade 5 and under),
 * "foundational" instead of "basic" below 16 (or grade 8 and under).
 */
@Component
public class ReadingLevelAdjuster {

    private static final Map<Pattern, String> SIMPLER_WORDS = new LinkedHashMap<>();
    private static final Pattern COMPLEX_CONCEPTS = Pattern.compile(
        "\\b(quantum|molecular|cellular|atomic|theoretical|hypothetical|abstract|sophisticated|intricate|elaborate)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTRY_LEVEL = Pattern.compile("\\b(elementary|basic)\\b", Pattern.CASE_INSENSITIVE);

    static {
        // multi-word phrases first
        simpler("chemical compounds", "simple materials");
        simpler("utilize", "use");
        simpler("demonstrate", "show");
        simpler("comprehend", "understand");
        simpler("acquire", "get");
        simpler("construct", "build");
        simpler("examine", "look at");
        simpler("investigate", "study");
        simpler("molecular", "simple");
        simpler("complex", "simple");
        simpler("various", "different");
    }

    private static void simpler(String word, String replacement) {
        SIMPLER_WORDS.put(Pattern.compile("\\b" + word + "\\b", Pattern.CASE_INSENSITIVE), replacement);
    }

    public String adjust(String text, LearnerProfile profile) {
        if (text == null || profile == null) {
            return text;
        }
        return switch (levelFor(profile)) {
            case ELEMENTARY -> simplify(text);
            case MIDDLE -> ENTRY_LEVEL.matcher(text).replaceAll("foundational");
            case UNCHANGED -> text;
        };
    }

    Level levelFor(LearnerProfile profile) {
        Integer age = profile.getAge();
        if (age != null) {
            if (age < 13) {
                return Level.ELEMENTARY;
            }
            return age < 16 ? Level.MIDDLE : Level.UNCHANGED;
        }
        Integer grade = profile.numericGrade();
        if (grade == null) {
            return Level.UNCHANGED;
        }
        if (grade <= 5) {
            return Level.ELEMENTARY;
        }
        return grade <= 8 ? Level.MIDDLE : Level.UNCHANGED;
    }

    private static String simplify(String text) {
        String result = text;
        for (Map.Entry<Pattern, String> entry : SIMPLER_WORDS.entrySet()) {
            result = entry.getKey().matcher(result).replaceAll(entry.getValue());
        }
        return COMPLEX_CONCEPTS.matcher(result).replaceAll("advanced");
    }

    enum Level {
        ELEMENTARY,
        MIDDLE,
        UNCHANGED
    }
}
