package com.learnguard.core.escalation;

public class EscalationNotFoundException extends RuntimeException {

    public EscalationNotFoundException(String escalationId) {
        super("Active escalation not found: " + escalationId);
    }
}
