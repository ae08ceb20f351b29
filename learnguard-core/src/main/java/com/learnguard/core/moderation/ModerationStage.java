package com.learnguard.core.moderation;

public enum ModerationStage {
    INPUT,
    OUTPUT
}
