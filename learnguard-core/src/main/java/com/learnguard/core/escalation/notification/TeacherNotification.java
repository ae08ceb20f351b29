package com.learnguard.core.escalation.notification;

import com.learnguard.common.model.SafetyLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TeacherNotification {

    String escalationId;
    /** Null when the learner has no assigned teacher; channels route it to the on-call queue. */
    String teacherId;
    String studentId;
    SafetyLevel severity;
    String subject;
    String message;
    Instant createdAt;
}
