package com.learnguard.core.escalation;

public class EscalationUnauthorizedException extends RuntimeException {

    public EscalationUnauthorizedException(String escalationId, String teacherId) {
        super("Teacher " + teacherId + " is not assigned to escalation " + escalationId);
    }
}
