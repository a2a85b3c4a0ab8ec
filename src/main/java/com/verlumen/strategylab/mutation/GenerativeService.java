package com.verlumen.strategylab.mutation;

/** External text generator that proposes mutated source code. */
public interface GenerativeService {
  /** Never throws; unreachable services and bad responses come back as failed results. */
  GenerationResult generate(String systemPrompt, String userPrompt, SamplingParams params);
}
