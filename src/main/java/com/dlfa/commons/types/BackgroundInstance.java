package com.dlfa.commons.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.dlfa.commons.types.indexed.IndexedBackgroundInstance;
import com.dlfa.commons.types.indexed.IndexedInstance;
import com.dlfa.data.DataIndexer;

/**
 * An instance that has background knowledge associated with it.<br>
 * The background knowledge is a list of sentences, each tokenized on its own and never merged with
 * the text of the wrapped instance.<br>
 * The label, the index and the tokenizer are those of the wrapped instance.
 *
 * @param <L> The label type of the wrapped instance
 */
public class BackgroundInstance<L> extends TextInstance<L> {

	private static final long serialVersionUID = 6306231180473347268L;

	private final TextInstance<L> instance;
	private final List<String> background;

	public BackgroundInstance(TextInstance<L> instance, List<String> background){
		super(instance.getLabel(), instance.getIndex(), instance.getTokenizer());
		this.instance = instance;
		this.background = Collections.unmodifiableList(new ArrayList<String>(background));
	}

	public TextInstance<L> getInstance(){
		return this.instance;
	}

	public List<String> getBackground(){
		return this.background;
	}

	@Override
	public List<String> words() {
		List<String> words = new ArrayList<String>();
		words.addAll(this.instance.words());
		for(String backgroundText: this.background){
			words.addAll(tokenizeLowercased(backgroundText));
		}
		return words;
	}

	@Override
	public IndexedBackgroundInstance<L> toIndexedInstance(DataIndexer dataIndexer) {
		IndexedInstance<L> indexedInstance = this.instance.toIndexedInstance(dataIndexer);
		List<List<Integer>> backgroundIndices = new ArrayList<List<Integer>>();
		for(String backgroundText: this.background){
			List<Integer> indices = new ArrayList<Integer>();
			for(String word: tokenizeLowercased(backgroundText)){
				indices.add(dataIndexer.getWordIndex(word));
			}
			backgroundIndices.add(indices);
		}
		return new IndexedBackgroundInstance<L>(indexedInstance, backgroundIndices);
	}

	@Override
	public String toString(){
		return "BackgroundInstance("+this.instance+", "+this.background+")";
	}

}
