package com.dlfa.commons.types.indexed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.dlfa.util.PaddingUtils;

public class IndexedTrueFalseInstance extends IndexedInstance<Boolean> {

	private static final long serialVersionUID = -609227383580224358L;

	protected List<Integer> wordIndices;

	public IndexedTrueFalseInstance(List<Integer> wordIndices, Boolean label){
		this(wordIndices, label, null);
	}

	public IndexedTrueFalseInstance(List<Integer> wordIndices, Boolean label, Integer index){
		super(label, index);
		this.wordIndices = new ArrayList<Integer>(wordIndices);
	}

	public List<Integer> getWordIndices(){
		return Collections.unmodifiableList(this.wordIndices);
	}

	@Override
	public Map<String, Integer> getPaddingLengths() {
		Map<String, Integer> lengths = new HashMap<String, Integer>();
		lengths.put(NUM_SENTENCE_WORDS, this.wordIndices.size());
		return lengths;
	}

	@Override
	public void pad(Map<String, Integer> lengths) {
		int numWords = PaddingUtils.getRequiredLength(lengths, NUM_SENTENCE_WORDS);
		this.wordIndices = PaddingUtils.padSequenceToLength(this.wordIndices, numWords, () -> PADDING_INDEX);
	}

	@Override
	public IndexedTrueFalseInstance emptyInstance() {
		return new IndexedTrueFalseInstance(new ArrayList<Integer>(), null);
	}

	@Override
	public String toString(){
		return "IndexedTrueFalseInstance("+this.wordIndices+", "+this._label+", "+this._index+")";
	}

}
