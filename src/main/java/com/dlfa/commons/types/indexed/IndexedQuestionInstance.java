package com.dlfa.commons.types.indexed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.dlfa.util.PaddingUtils;

/**
 * The indexed options of a question, labeled with the position of the correct option.
 */
public class IndexedQuestionInstance extends IndexedInstance<Integer> {

	private static final long serialVersionUID = -2855310949185032046L;

	private final List<IndexedInstance<Boolean>> options;

	public IndexedQuestionInstance(List<IndexedInstance<Boolean>> options, Integer label){
		super(label, null);
		this.options = new ArrayList<IndexedInstance<Boolean>>(options);
	}

	public List<IndexedInstance<Boolean>> getOptions(){
		return Collections.unmodifiableList(this.options);
	}

	/**
	 * Returns the maximum length over the options for each of their dimensions, together with the
	 * number of options.
	 */
	@Override
	public Map<String, Integer> getPaddingLengths() {
		Map<String, Integer> lengths = new HashMap<String, Integer>();
		for(IndexedInstance<Boolean> option: this.options){
			PaddingUtils.updateMaxLengths(lengths, option.getPaddingLengths());
		}
		lengths.put(NUM_OPTIONS, this.options.size());
		return lengths;
	}

	/**
	 * Pads every option, after appending empty options up to {@value #NUM_OPTIONS}.<br>
	 * Options are added on the right so that the label still points to the correct option.
	 * @throws IllegalArgumentException if fewer options than this question has are requested
	 */
	@Override
	public void pad(Map<String, Integer> lengths) {
		int numOptions = PaddingUtils.getRequiredLength(lengths, NUM_OPTIONS);
		if(numOptions < this.options.size()){
			throw new IllegalArgumentException("Cannot pad a question with "+this.options.size()
					+" options down to "+numOptions);
		}
		if(this.options.isEmpty() && numOptions > 0){
			throw new IllegalStateException("Cannot create empty options for a question without options");
		}
		while(this.options.size() < numOptions){
			this.options.add(this.options.get(0).emptyInstance());
		}
		for(IndexedInstance<Boolean> option: this.options){
			option.pad(lengths);
		}
	}

	@Override
	public IndexedQuestionInstance emptyInstance() {
		return new IndexedQuestionInstance(new ArrayList<IndexedInstance<Boolean>>(), null);
	}

	@Override
	public String toString(){
		return "IndexedQuestionInstance("+this.options+", "+this._label+")";
	}

}
