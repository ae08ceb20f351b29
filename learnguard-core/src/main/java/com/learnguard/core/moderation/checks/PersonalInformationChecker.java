package com.learnguard.core.moderation.checks;

import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.core.moderation.CheckContext;
import com.learnguard.core.moderation.ModerationStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Component
@Order(60)
public class PersonalInformationChecker extends BaseSafetyChecker {

    public static final String TYPE = "personal_information";

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("ssn", Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"));
        PATTERNS.put("email", Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"));
        PATTERNS.put("phone", Pattern.compile("\\b\\d{3}-\\d{3}-\\d{4}\\b"));
        PATTERNS.put("address", Pattern.compile(
            "\\b\\d{1,5}\\s\\w+\\s(street|st|avenue|ave|road|rd|drive|dr)\\b", Pattern.CASE_INSENSITIVE));
    }

    public PersonalInformationChecker() {
        super(TYPE, SafetyLevel.HIGH, SuggestedAction.BLOCK, ModerationStage.INPUT);
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        String content = text == null ? "" : text;
        List<String> kinds = PATTERNS.entrySet().stream()
            .filter(entry -> entry.getValue().matcher(content).find())
            .map(Map.Entry::getKey)
            .toList();
        if (kinds.isEmpty()) {
            return SafetyCheck.passed(TYPE, 0.1, "No personal information detected");
        }
        return SafetyCheck.failed(TYPE, 0.9, "Personal information detected: " + String.join(", ", kinds));
    }
}
