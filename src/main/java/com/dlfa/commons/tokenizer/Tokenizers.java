package com.dlfa.commons.tokenizer;

/**
 * Holds the tokenizer used whenever an instance is created without one.
 */
public class Tokenizers {

	/** The process-wide default tokenizer, created once and shared by every instance */
	public static final Tokenizer DEFAULT = new SimpleTokenizer();

	private Tokenizers(){}

}
