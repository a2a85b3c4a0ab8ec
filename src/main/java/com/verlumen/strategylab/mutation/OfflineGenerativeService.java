package com.verlumen.strategylab.mutation;

import com.google.inject.Inject;

/** Stand-in for dry runs: always unavailable, so every mutation takes the fallback path. */
final class OfflineGenerativeService implements GenerativeService {
  @Inject
  OfflineGenerativeService() {}

  @Override
  public GenerationResult generate(String systemPrompt, String userPrompt, SamplingParams params) {
    return GenerationResult.failure("Generative service is offline", false);
  }
}
