package com.learnguard.common.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class ConversationMessage {

    String id;
    Role role;
    String content;
    Instant timestamp;

    public enum Role {
        USER,
        ASSISTANT,
        SYSTEM
    }
}
