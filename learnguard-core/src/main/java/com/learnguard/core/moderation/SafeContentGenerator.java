package com.learnguard.core.moderation;

import com.learnguard.common.model.LearnerProfile;
import com.learnguard.common.model.ModerationResult;
import com.learnguard.core.moderation.checks.AcademicIntegrityChecker;
import com.learnguard.core.moderation.checks.AgeAppropriatenessChecker;
import com.learnguard.core.moderation.checks.InappropriateTopicChecker;
import com.learnguard.core.moderation.checks.PersonalInformationChecker;
import com.learnguard.core.moderation.checks.ProfanityChecker;
import com.learnguard.core.moderation.checks.ResponseContentChecker;
import org.springframework.stereotype.Component;

/**
 * Non-judgmental redirect messages keyed by the dominant moderation category.
 * Deterministic: the same category and age always produce the same text.
 */
@Component
public class SafeContentGenerator {

    static final String AGE_OLDER = "I'd like to help you learn about this topic, but let's approach it in an "
        + "age-appropriate way. What specific aspect would you like to understand better?";
    static final String AGE_YOUNG = "That's a grown-up topic! Let's talk about something fun you're learning in "
        + "school instead. What's your favorite subject?";
    static final String AGE_MIDDLE = "That topic is a bit advanced for now. Let's focus on concepts that are perfect "
        + "for your grade level. What are you studying in class that I can help with?";
    static final String ACADEMIC_INTEGRITY = "I'd love to help you learn! Instead of giving you the solution directly, "
        + "let me guide you through the problem step by step. This way, you'll understand the concepts and be able "
        + "to solve similar problems on your own. What part would you like to start with?";
    static final String PROFANITY = "I notice some inappropriate language in your message. Let's keep our "
        + "conversation respectful and focused on learning. I'm here to help with your studies - what subject can "
        + "I assist you with today?";
    static final String INAPPROPRIATE_TOPIC = "That topic isn't something I can help with in an educational context. "
        + "I'm designed to assist with schoolwork and learning. What academic subject would you like to explore "
        + "instead?";
    static final String PERSONAL_INFORMATION = "I notice you might be sharing personal information. For your safety, "
        + "please don't share personal details. Let's focus on your learning goals instead. What subject can I help "
        + "you with?";
    static final String DEFAULT = "I'd be happy to help you learn! Could you please rephrase your question in a way "
        + "that focuses on understanding the concepts? I'm here to guide you through your learning journey.";

    private static final int YOUNG_AGE = 10;
    private static final int OLDER_AGE = 16;

    public String generateSafeContent(String original, ModerationResult moderation, LearnerProfile profile) {
        String category = moderation == null ? null : moderation.primaryCategory();
        if (category == null) {
            return DEFAULT;
        }
        return switch (category) {
            case AgeAppropriatenessChecker.TYPE -> ageRedirect(profile == null ? null : profile.effectiveAge());
            case AcademicIntegrityChecker.TYPE -> ACADEMIC_INTEGRITY;
            case ProfanityChecker.TYPE -> PROFANITY;
            case InappropriateTopicChecker.TYPE, ResponseContentChecker.TYPE -> INAPPROPRIATE_TOPIC;
            case PersonalInformationChecker.TYPE -> PERSONAL_INFORMATION;
            default -> DEFAULT;
        };
    }

    private static String ageRedirect(Integer age) {
        if (age == null || age >= OLDER_AGE) {
            return AGE_OLDER;
        }
        return age < YOUNG_AGE ? AGE_YOUNG : AGE_MIDDLE;
    }
}
