package com.learnguard.llm.prompt;

import com.learnguard.common.model.ConversationContext;
import com.learnguard.common.model.ConversationMessage;
import com.learnguard.common.model.CourseContext;
import com.learnguard.common.model.LearningRequest;

import java.util.List;
import java.util.regex.Pattern;

public final class EducationalPrompts {

    public static final int MAX_HISTORY_MESSAGES = 10;
    public static final int YOUNG_LEARNER_AGE = 13;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1F\\x7F]");

    public static final String GUIDELINES = """
            Guidelines:
            - Provide clear, educational explanations
            - Encourage critical thinking
            - Ask follow-up questions to check understanding
            - If you're unsure about something, say so
            - Avoid doing homework for students - guide them to find answers
            - Keep responses appropriate for the student's age and grade level
            - If asked about inappropriate topics, politely redirect to educational content""";

    private EducationalPrompts() {}

    public static String buildSystemPrompt(LearningRequest request) {
        StringBuilder prompt = new StringBuilder(
            "You are a learning assistant designed to help students learn effectively. ");

        Integer age = request.learnerAge();
        if (age != null && age < YOUNG_LEARNER_AGE) {
            prompt.append("You are speaking with a young student (age ").append(age)
                  .append("). Use age-appropriate language and explanations. ");
        }

        CourseContext course = request.getCourseContext();
        if (course != null) {
            prompt.append("The student is currently studying ").append(course.getSubject())
                  .append(" at ").append(course.getGradeLevel()).append(" level. ");
            if (course.getCurrentLesson() != null && !course.getCurrentLesson().isBlank()) {
                prompt.append("They are working on: ").append(course.getCurrentLesson()).append(". ");
            }
        }

        prompt.append(GUIDELINES);
        return prompt.toString();
    }

    /**
     * Last {@value #MAX_HISTORY_MESSAGES} prior messages, oldest first, without system turns.
     */
    public static List<ConversationMessage> recentHistory(LearningRequest request) {
        ConversationContext conversation = request.getConversation();
        if (conversation == null || conversation.getHistory().isEmpty()) {
            return List.of();
        }
        List<ConversationMessage> history = conversation.getHistory().stream()
            .filter(message -> message.getRole() != ConversationMessage.Role.SYSTEM)
            .toList();
        int from = Math.max(0, history.size() - MAX_HISTORY_MESSAGES);
        return history.subList(from, history.size());
    }

    public static String sanitize(String input) {
        if (input == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(input.trim()).replaceAll("");
    }
}
