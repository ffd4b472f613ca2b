package com.dlfa.commons.types;

import java.util.List;

import com.dlfa.commons.tokenizer.Tokenizer;
import com.dlfa.commons.tokenizer.Tokenizers;
import com.dlfa.commons.types.indexed.IndexedInstance;
import com.dlfa.data.DataIndexer;

/**
 * An instance that has some attached text, typically either a sentence or a logical form.<br>
 * The tokens here are strings, and {@link #words()} lists the words showing up in the instance.
 * These instances are used to fit a {@link DataIndexer}; to use them in training or testing they
 * first need to be converted into {@link IndexedInstance}s with {@link #toIndexedInstance(DataIndexer)}.
 *
 * @param <L> The type of the label
 */
public abstract class TextInstance<L> extends Instance<L> {

	private static final long serialVersionUID = -7386240553713049117L;

	/** Shared with other instances, never owned; serialized along with the instance */
	protected Tokenizer tokenizer;

	public TextInstance(L label, Integer index){
		this(label, index, Tokenizers.DEFAULT);
	}

	public TextInstance(L label, Integer index, Tokenizer tokenizer){
		super(label, index);
		this.tokenizer = tokenizer;
	}

	public Tokenizer getTokenizer(){
		return this.tokenizer;
	}

	/**
	 * Lowercases and tokenizes the given text with this instance's tokenizer.
	 * @param text
	 * @return
	 */
	protected List<String> tokenizeLowercased(String text){
		return this.tokenizer.tokenize(text.toLowerCase());
	}

	/**
	 * Returns all of the words in this instance, as a new list on every call.<br>
	 * This is mainly used for computing word counts when fitting a vocabulary on a dataset.
	 * @return
	 */
	public abstract List<String> words();

	/**
	 * Converts the words in this instance into indices using the given data indexer.<br>
	 * The indexer is only read, so it must be fitted before this is called.
	 * @param dataIndexer
	 * @return
	 */
	public abstract IndexedInstance<L> toIndexedInstance(DataIndexer dataIndexer);

}
