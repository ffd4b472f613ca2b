package com.dlfa.commons.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.dlfa.commons.InvalidQuestionException;
import com.dlfa.commons.types.indexed.IndexedInstance;
import com.dlfa.commons.types.indexed.IndexedQuestionInstance;
import com.dlfa.data.DataIndexer;

/**
 * A grouping of other instances, exactly one of which has label true.<br>
 * When converted to training data, all of the options are grouped into a single training instance,
 * whose label is the position of the correct option.
 */
public class QuestionInstance extends TextInstance<Integer> {

	private static final long serialVersionUID = -1068213554806327153L;

	private final List<TextInstance<Boolean>> options;

	/**
	 * Creates a question from its answer options.
	 * @param options The options, each labeled, exactly one of them true
	 * @throws InvalidQuestionException if zero or more than one option is labeled true
	 */
	public QuestionInstance(List<? extends TextInstance<Boolean>> options){
		super(findCorrectOption(options), null, options.isEmpty() ? null : options.get(0).getTokenizer());
		this.options = Collections.unmodifiableList(new ArrayList<TextInstance<Boolean>>(options));
	}

	private static Integer findCorrectOption(List<? extends TextInstance<Boolean>> options){
		List<Integer> positiveIndices = new ArrayList<Integer>();
		for(int i=0; i<options.size(); i++){
			if(Boolean.TRUE.equals(options.get(i).getLabel())){
				positiveIndices.add(i);
			}
		}
		if(positiveIndices.size() != 1){
			throw new InvalidQuestionException("A question needs exactly one option labeled true, found "
					+positiveIndices.size()+" among "+options);
		}
		return positiveIndices.get(0);
	}

	public List<TextInstance<Boolean>> getOptions(){
		return this.options;
	}

	@Override
	public List<String> words() {
		List<String> words = new ArrayList<String>();
		for(TextInstance<Boolean> option: this.options){
			words.addAll(option.words());
		}
		return words;
	}

	@Override
	public IndexedQuestionInstance toIndexedInstance(DataIndexer dataIndexer) {
		List<IndexedInstance<Boolean>> indexedOptions = new ArrayList<IndexedInstance<Boolean>>();
		for(TextInstance<Boolean> option: this.options){
			indexedOptions.add(option.toIndexedInstance(dataIndexer));
		}
		return new IndexedQuestionInstance(indexedOptions, this._label);
	}

	@Override
	public String toString(){
		return "QuestionInstance("+this.options+", "+this._label+")";
	}

}
