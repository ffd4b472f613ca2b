package com.dlfa.commons.types.indexed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.dlfa.util.PaddingUtils;

/**
 * An indexed logical form: the indices of its elements, in the order they appear, together with the
 * shift and reduce operations that rebuild the tree from them.
 */
public class IndexedLogicalFormInstance extends IndexedTrueFalseInstance {

	private static final long serialVersionUID = 3378061252990151875L;

	protected List<Transition> transitions;

	public IndexedLogicalFormInstance(List<Integer> elementIndices, List<Transition> transitions, Boolean label){
		this(elementIndices, transitions, label, null);
	}

	public IndexedLogicalFormInstance(List<Integer> elementIndices, List<Transition> transitions, Boolean label, Integer index){
		super(elementIndices, label, index);
		this.transitions = new ArrayList<Transition>(transitions);
	}

	public List<Transition> getTransitions(){
		return Collections.unmodifiableList(this.transitions);
	}

	/**
	 * The transitions as the integer codes fed to the tree encoder.
	 * @return
	 */
	public int[] getTransitionCodes(){
		int[] codes = new int[this.transitions.size()];
		for(int i=0; i<codes.length; i++){
			codes[i] = this.transitions.get(i).getCode();
		}
		return codes;
	}

	@Override
	public Map<String, Integer> getPaddingLengths() {
		Map<String, Integer> lengths = super.getPaddingLengths();
		lengths.put(NUM_TRANSITIONS, this.transitions.size());
		return lengths;
	}

	@Override
	public void pad(Map<String, Integer> lengths) {
		super.pad(lengths);
		int numTransitions = PaddingUtils.getRequiredLength(lengths, NUM_TRANSITIONS);
		this.transitions = PaddingUtils.padSequenceToLength(this.transitions, numTransitions, () -> Transition.NO_OP);
	}

	@Override
	public IndexedLogicalFormInstance emptyInstance() {
		return new IndexedLogicalFormInstance(new ArrayList<Integer>(), new ArrayList<Transition>(), null);
	}

	@Override
	public String toString(){
		return "IndexedLogicalFormInstance("+this.wordIndices+", "+this.transitions+", "+this._label+", "+this._index+")";
	}

}
