package org.clerasense.application.port;

import java.util.List;

/** Turns drug profile text into dense vectors for semantic search. */
public interface EmbeddingPort {

    /** @throws IllegalStateException when the model cannot be reached */
    float[] embed(String text);

    /** One vector per input, in input order. */
    List<float[]> embedBatch(List<String> texts);

    String modelName();
}
