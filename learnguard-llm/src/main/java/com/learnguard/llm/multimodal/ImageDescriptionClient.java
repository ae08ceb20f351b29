package com.learnguard.llm.multimodal;

/**
 * External vision service that turns an image into a textual description.
 */
public interface ImageDescriptionClient {

    String describe(byte[] image, String format);
}
