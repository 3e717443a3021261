package com.privatedocs.qa.service.synthesis;

public interface LlmClient {

    LlmResponse generate(LlmRequest request);

    String modelName();
}
