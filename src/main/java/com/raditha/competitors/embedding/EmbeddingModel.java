package com.raditha.competitors.embedding;

import java.util.List;
import java.util.OptionalInt;

/**
 * Text-to-vector capability used by the fuser.
 * Implementations must be safe to call from several worker threads at once.
 */
public interface EmbeddingModel {

    /**
     * Identifier recorded in the run metadata.
     */
    String modelId();

    /**
     * Embed a batch of texts.
     *
     * @param texts Non-empty normalized texts
     * @return One vector per text, in the same order
     * @throws com.raditha.competitors.exception.EmbeddingException if the call fails;
     *         the caller may retry
     */
    List<float[]> embed(List<String> texts);

    /**
     * Output width when known up front.
     */
    default OptionalInt declaredDimension() {
        return OptionalInt.empty();
    }
}
