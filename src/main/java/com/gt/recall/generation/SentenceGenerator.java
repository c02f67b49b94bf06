package com.gt.recall.generation;

import java.util.concurrent.CompletableFuture;

/**
 * Produces a natural sentence that uses a term. Implementations complete the future exceptionally with
 * {@link com.gt.recall.exception.SentenceGenerationException} when no sentence can be produced.
 */
public interface SentenceGenerator {

    CompletableFuture<String> generateSentence(String term, String context);

    boolean isAvailable();
}
