package dev.ragservice.summary;

/** Generative backend producing a streamed summary for a prompt. */
public interface SummaryGenerator {

  /**
   * Starts generation and returns immediately.
   *
   * @param prompt the complete user prompt
   * @return a stream of output fragments, which the caller must close
   */
  GenerationStream generate(String prompt);
}
