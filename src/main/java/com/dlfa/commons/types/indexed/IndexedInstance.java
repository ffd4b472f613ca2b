package com.dlfa.commons.types.indexed;

import java.util.Map;

import com.dlfa.commons.types.Instance;

/**
 * An instance whose words have been converted into integer indices by a
 * {@link com.dlfa.data.DataIndexer}.<br>
 * Indexed instances report the natural sizes of their variable-length fields with
 * {@link #getPaddingLengths()}, and are stretched or cut to fixed sizes with {@link #pad(Map)}, which
 * is the only operation modifying them after construction.
 *
 * @param <L> The type of the label
 */
public abstract class IndexedInstance<L> extends Instance<L> {

	private static final long serialVersionUID = -4430811029735315208L;

	/** The number of words in a sentence (or elements in a logical form) */
	public static final String NUM_SENTENCE_WORDS = "num_sentence_words";
	/** The number of transitions of a logical form */
	public static final String NUM_TRANSITIONS = "num_transitions";
	/** The number of background sentences */
	public static final String NUM_BACKGROUND_SENTENCES = "num_background_sentences";
	/** The number of options of a question */
	public static final String NUM_OPTIONS = "num_options";

	/** The index used for padding */
	public static final int PADDING_INDEX = 0;

	public IndexedInstance(L label, Integer index){
		super(label, index);
	}

	/**
	 * Returns the length of each dimension of this instance that needs padding.
	 * @return
	 */
	public abstract Map<String, Integer> getPaddingLengths();

	/**
	 * Pads (on the left) or truncates (keeping the last items) each dimension of this instance to the
	 * given length. Padding again to the same lengths changes nothing.
	 * @param lengths The required length of each dimension, typically the maximum over a dataset
	 * @throws IllegalArgumentException if a dimension of this instance has no length in the map
	 */
	public abstract void pad(Map<String, Integer> lengths);

	/**
	 * Returns an instance of the same kind with empty sequences and no label.
	 * @return
	 */
	public abstract IndexedInstance<L> emptyInstance();

}
