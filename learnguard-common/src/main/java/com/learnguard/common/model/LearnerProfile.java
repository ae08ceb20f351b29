package com.learnguard.common.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Learner attributes supplied by the identity service. Never fetched by this core.
 */
@Value
@Builder
@Jacksonized
public class LearnerProfile {

    String userId;
    Integer age;
    String gradeLevel;
    String learningStyle;
    @Singular
    List<String> subjects;
    @Builder.Default
    String language = "en";
    String timezone;
    ParentalControls parentalControls;

    public boolean hasParentalControls() {
        return parentalControls != null && parentalControls.isEnabled();
    }

    /**
     * Age if known, otherwise derived from the grade (kindergarten = 5, grade 1 = 6, ...).
     */
    public Integer effectiveAge() {
        if (age != null) {
            return age;
        }
        Integer grade = numericGrade();
        return grade == null ? null : Math.max(5 + grade, 5);
    }

    public Integer numericGrade() {
        if (gradeLevel == null) {
            return null;
        }
        String digits = gradeLevel.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
