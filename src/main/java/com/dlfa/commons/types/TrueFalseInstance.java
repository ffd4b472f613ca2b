package com.dlfa.commons.types;

import java.util.ArrayList;
import java.util.List;

import com.dlfa.commons.tokenizer.Tokenizer;
import com.dlfa.commons.tokenizer.Tokenizers;
import com.dlfa.commons.types.indexed.IndexedTrueFalseInstance;
import com.dlfa.data.DataIndexer;
import com.dlfa.util.instance_parser.TrueFalseInstanceParser;

/**
 * A sentence (or any other piece of text) labeled as true or false.
 */
public class TrueFalseInstance extends TextInstance<Boolean> {

	private static final long serialVersionUID = 1851514046050983662L;

	protected final String text;

	public TrueFalseInstance(String text, Boolean label){
		this(text, label, null, Tokenizers.DEFAULT);
	}

	public TrueFalseInstance(String text, Boolean label, Integer index){
		this(text, label, index, Tokenizers.DEFAULT);
	}

	public TrueFalseInstance(String text, Boolean label, Integer index, Tokenizer tokenizer){
		super(label, index, tokenizer);
		this.text = text;
	}

	public String getText(){
		return this.text;
	}

	@Override
	public List<String> words() {
		return tokenizeLowercased(this.text);
	}

	@Override
	public IndexedTrueFalseInstance toIndexedInstance(DataIndexer dataIndexer) {
		List<Integer> indices = new ArrayList<Integer>();
		for(String word: words()){
			indices.add(dataIndexer.getWordIndex(word));
		}
		return new IndexedTrueFalseInstance(indices, this._label, this._index);
	}

	/**
	 * Reads a true/false instance from a line, with the default tokenizer and no default label.
	 * @param line
	 * @return
	 * @see TrueFalseInstanceParser#parseLine(String)
	 */
	public static TrueFalseInstance readFromLine(String line){
		return readFromLine(line, null, Tokenizers.DEFAULT);
	}

	/**
	 * Reads a true/false instance from a line in one of the four formats accepted by
	 * {@link TrueFalseInstanceParser#parseLine(String)}.
	 * @param line
	 * @param defaultLabel The label to use when the line has none, which must match the line's label otherwise
	 * @param tokenizer
	 * @return
	 */
	public static TrueFalseInstance readFromLine(String line, Boolean defaultLabel, Tokenizer tokenizer){
		return new TrueFalseInstanceParser<TrueFalseInstance>(TrueFalseInstance::new, defaultLabel, tokenizer)
				.parseLine(line);
	}

	@Override
	public String toString(){
		return "TrueFalseInstance("+this.text+", "+this._label+", "+this._index+")";
	}

}
