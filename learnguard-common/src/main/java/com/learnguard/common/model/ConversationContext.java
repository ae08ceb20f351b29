package com.learnguard.common.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ConversationContext {

    String conversationId;
    @Singular("message")
    List<ConversationMessage> history;
    String topic;
    String subject;
    String gradeLevel;
}
