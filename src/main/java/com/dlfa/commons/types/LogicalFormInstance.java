package com.dlfa.commons.types;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;

import com.dlfa.commons.MalformedTreeException;
import com.dlfa.commons.tokenizer.Tokenizer;
import com.dlfa.commons.tokenizer.Tokenizers;
import com.dlfa.commons.types.indexed.IndexedLogicalFormInstance;
import com.dlfa.commons.types.indexed.Transition;
import com.dlfa.data.DataIndexer;
import com.dlfa.util.instance_parser.TrueFalseInstanceParser;

/**
 * An instance for use with tree-structured encoders.<br>
 * Instead of a sequence of words, the text is a tree-structured logical form, written as something
 * like <code>for(depend_on(human, plant), oxygen)</code>.
 */
public class LogicalFormInstance extends TrueFalseInstance {

	private static final long serialVersionUID = -2297581467264416302L;

	public LogicalFormInstance(String text, Boolean label){
		this(text, label, null, Tokenizers.DEFAULT);
	}

	public LogicalFormInstance(String text, Boolean label, Integer index){
		this(text, label, index, Tokenizers.DEFAULT);
	}

	public LogicalFormInstance(String text, Boolean label, Integer index, Tokenizer tokenizer){
		super(text, label, index, tokenizer);
	}

	/**
	 * Returns the predicate names and arguments, without commas and parentheses.
	 */
	@Override
	public List<String> words() {
		List<String> words = new ArrayList<String>();
		for(String token: tokens()){
			if(!isStructural(token)){
				words.add(token);
			}
		}
		return words;
	}

	/**
	 * Splits the logical form into lowercased tokens, including commas and parentheses.<br>
	 * Each of <code>(</code>, <code>)</code> and <code>,</code> is a token on its own; whitespace only
	 * separates atoms.
	 * @return
	 */
	public List<String> tokens(){
		List<String> tokens = new ArrayList<String>();
		StringBuilder atom = new StringBuilder();
		for(char c: this.text.toLowerCase().toCharArray()){
			if(c == '(' || c == ')' || c == ','){
				flush(atom, tokens);
				tokens.add(String.valueOf(c));
			} else if(Character.isWhitespace(c)){
				flush(atom, tokens);
			} else {
				atom.append(c);
			}
		}
		flush(atom, tokens);
		return tokens;
	}

	private static void flush(StringBuilder atom, List<String> tokens){
		if(atom.length() > 0){
			tokens.add(atom.toString());
			atom.setLength(0);
		}
	}

	private static boolean isStructural(String token){
		return token.equals("(") || token.equals(")") || token.equals(",");
	}

	/**
	 * Splits the logical form into two sequences, one with the elements (predicates and arguments)
	 * and the other with the shift and reduce operations building the tree from them.<br>
	 * For example, <code>a(b(c), d(e, f))</code> gives the elements <code>[a, b, c, d, e, f]</code> and
	 * the transitions <code>[S, S, S, R2, S, S, S, R3, R3]</code>.<br>
	 * The elements are then mapped through the data indexer.
	 * @throws MalformedTreeException if the parentheses and commas do not balance
	 */
	@Override
	public IndexedLogicalFormInstance toIndexedInstance(DataIndexer dataIndexer) {
		// Only commas and open parens are ever pushed
		Deque<String> lastSymbols = new LinkedList<String>();
		List<Transition> transitions = new ArrayList<Transition>();
		List<String> elements = new ArrayList<String>();
		boolean isMalformed = false;
		for(String token: tokens()){
			if(token.equals(",") || token.equals("(")){
				lastSymbols.push(token);
			} else if(token.equals(")")){
				if(lastSymbols.isEmpty()){
					// closing paren without an opening one
					isMalformed = true;
					break;
				}
				String lastSymbol = lastSymbols.pop();
				if(lastSymbol.equals("(")){
					transitions.add(Transition.REDUCE2);
				} else {
					// a comma, so the open paren before it goes as well
					if(lastSymbols.isEmpty() || !lastSymbols.pop().equals("(")){
						isMalformed = true;
						break;
					}
					transitions.add(Transition.REDUCE3);
				}
			} else {
				transitions.add(Transition.SHIFT);
				elements.add(token);
			}
		}
		if(!lastSymbols.isEmpty() || isMalformed){
			throw new MalformedTreeException(this.text);
		}
		List<Integer> indices = new ArrayList<Integer>();
		for(String element: elements){
			indices.add(dataIndexer.getWordIndex(element));
		}
		return new IndexedLogicalFormInstance(indices, transitions, this._label, this._index);
	}

	/**
	 * Reads a logical form instance from a line, in the same formats as
	 * {@link TrueFalseInstance#readFromLine(String, Boolean, Tokenizer)}.
	 * @param line
	 * @param defaultLabel
	 * @param tokenizer
	 * @return
	 */
	public static LogicalFormInstance readFromLine(String line, Boolean defaultLabel, Tokenizer tokenizer){
		return new TrueFalseInstanceParser<LogicalFormInstance>(LogicalFormInstance::new, defaultLabel, tokenizer)
				.parseLine(line);
	}

	@Override
	public String toString(){
		return "LogicalFormInstance("+this.text+", "+this._label+", "+this._index+")";
	}

}
