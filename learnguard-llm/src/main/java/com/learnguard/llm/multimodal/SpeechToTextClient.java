package com.learnguard.llm.multimodal;

/**
 * External transcription service.
 */
public interface SpeechToTextClient {

    String transcribe(byte[] audio, String format);
}
