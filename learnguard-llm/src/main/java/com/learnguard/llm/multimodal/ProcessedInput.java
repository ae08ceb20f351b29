package com.learnguard.llm.multimodal;

import com.learnguard.common.model.InputType;
import lombok.Value;

@Value
public class ProcessedInput {

    String queryText;
    InputType inputType;
}
