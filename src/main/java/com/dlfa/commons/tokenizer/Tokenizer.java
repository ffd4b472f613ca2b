package com.dlfa.commons.tokenizer;

import java.io.Serializable;
import java.util.List;

/**
 * Splits raw text into word tokens.<br>
 * Implementations are shared between instances, so they must not keep state between calls.
 * They are serialized together with the instances holding them.
 */
public interface Tokenizer extends Serializable {

	public List<String> tokenize(String text);

}
