package com.dlfa.commons.types.indexed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.dlfa.util.PaddingUtils;

/**
 * An indexed instance together with the indices of its background sentences.<br>
 * The background sentences share the {@value #NUM_SENTENCE_WORDS} dimension with the wrapped instance.
 *
 * @param <L> The label type of the wrapped instance
 */
public class IndexedBackgroundInstance<L> extends IndexedInstance<L> {

	private static final long serialVersionUID = 5100338297815146802L;

	private final IndexedInstance<L> indexedInstance;
	private List<List<Integer>> backgroundIndices;

	public IndexedBackgroundInstance(IndexedInstance<L> indexedInstance, List<List<Integer>> backgroundIndices){
		super(indexedInstance.getLabel(), indexedInstance.getIndex());
		this.indexedInstance = indexedInstance;
		this.backgroundIndices = new ArrayList<List<Integer>>();
		for(List<Integer> sentence: backgroundIndices){
			this.backgroundIndices.add(new ArrayList<Integer>(sentence));
		}
	}

	public IndexedInstance<L> getIndexedInstance(){
		return this.indexedInstance;
	}

	public List<List<Integer>> getBackgroundIndices(){
		List<List<Integer>> result = new ArrayList<List<Integer>>();
		for(List<Integer> sentence: this.backgroundIndices){
			result.add(Collections.unmodifiableList(sentence));
		}
		return Collections.unmodifiableList(result);
	}

	/**
	 * Returns the lengths of the wrapped instance, with the sentence length raised to the longest
	 * background sentence and the number of background sentences added.
	 */
	@Override
	public Map<String, Integer> getPaddingLengths() {
		Map<String, Integer> lengths = this.indexedInstance.getPaddingLengths();
		int maxSentenceLength = 0;
		for(List<Integer> sentence: this.backgroundIndices){
			maxSentenceLength = Math.max(maxSentenceLength, sentence.size());
		}
		lengths.merge(NUM_SENTENCE_WORDS, maxSentenceLength, Math::max);
		lengths.put(NUM_BACKGROUND_SENTENCES, this.backgroundIndices.size());
		return lengths;
	}

	@Override
	public void pad(Map<String, Integer> lengths) {
		this.indexedInstance.pad(lengths);
		int numSentences = PaddingUtils.getRequiredLength(lengths, NUM_BACKGROUND_SENTENCES);
		int numWords = PaddingUtils.getRequiredLength(lengths, NUM_SENTENCE_WORDS);
		List<List<Integer>> sentences = PaddingUtils.padSequenceToLength(this.backgroundIndices, numSentences, ArrayList::new);
		List<List<Integer>> padded = new ArrayList<List<Integer>>();
		for(List<Integer> sentence: sentences){
			padded.add(PaddingUtils.padSequenceToLength(sentence, numWords, () -> PADDING_INDEX));
		}
		this.backgroundIndices = padded;
	}

	@Override
	public IndexedBackgroundInstance<L> emptyInstance() {
		return new IndexedBackgroundInstance<L>(this.indexedInstance.emptyInstance(), new ArrayList<List<Integer>>());
	}

	@Override
	public String toString(){
		return "IndexedBackgroundInstance("+this.indexedInstance+", "+this.backgroundIndices+")";
	}

}
