package com.learnguard.common.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Citation {

    String source;
    String title;
    String url;
    double relevance;
}
