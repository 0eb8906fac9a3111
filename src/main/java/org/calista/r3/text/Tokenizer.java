package org.calista.r3.text;

import java.util.List;

/**
 * Splits raw text into surface tokens. Implementations must be deterministic.
 */
public interface Tokenizer {

    List<String> tokenize(String text);
}
