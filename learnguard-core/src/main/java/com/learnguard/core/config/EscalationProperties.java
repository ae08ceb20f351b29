package com.learnguard.core.config;

import com.learnguard.common.model.SafetyLevel;
import com.learnguard.core.escalation.rules.ConditionType;
import com.learnguard.core.escalation.rules.EscalationAction;
import com.learnguard.core.escalation.rules.EscalationCondition;
import com.learnguard.core.escalation.rules.EscalationRule;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optional rule table override, bound from {@code learnguard.escalation.rules}.
 * When empty the built-in rules apply.
 */
@Configuration
@ConfigurationProperties(prefix = "learnguard.escalation")
@Getter
@Setter
public class EscalationProperties {

    private List<Rule> rules = new ArrayList<>();

    public List<EscalationRule> toRules() {
        return rules.stream().map(Rule::toRule).toList();
    }

    @Getter
    @Setter
    public static class Rule {
        private String id;
        private String name;
        private boolean enabled = true;
        private List<Condition> conditions = new ArrayList<>();
        private String action = "notify_teacher";
        private Map<String, String> actionParameters = new LinkedHashMap<>();
        private String priority = "medium";
        private List<String> channels = new ArrayList<>();

        EscalationRule toRule() {
            return EscalationRule.builder()
                .id(id)
                .name(name == null ? id : name)
                .enabled(enabled)
                .conditions(conditions.stream().map(Condition::toCondition).toList())
                .action(EscalationAction.builder()
                    .type(EscalationAction.Type.fromString(action))
                    .parameters(actionParameters)
                    .build())
                .priority(SafetyLevel.fromString(priority))
                .channels(channels)
                .build();
        }
    }

    @Getter
    @Setter
    public static class Condition {
        private String type;
        private double threshold;
        private Duration timeWindow;

        EscalationCondition toCondition() {
            return EscalationCondition.builder()
                .type(ConditionType.fromString(type))
                .threshold(threshold)
                .timeWindow(timeWindow)
                .build();
        }
    }
}
