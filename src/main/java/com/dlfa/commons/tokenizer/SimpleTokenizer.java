package com.dlfa.commons.tokenizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
 * A rule-based tokenizer.<br>
 * The text is split on whitespace, then punctuation is peeled off the beginning and the end of each
 * field and contractions are split off the end of the word, so that "isn't." becomes
 * <code>is</code>, <code>n't</code>, <code>.</code>.<br>
 * A few common abbreviations ending with a period are kept whole.
 */
public class SimpleTokenizer implements Tokenizer {

	private static final long serialVersionUID = 8321460915734270358L;

	private static final Set<String> SPECIAL_CASES = new HashSet<String>(Arrays.asList(
			"mr.", "mrs.", "etc.", "e.g.", "cf.", "c.f.", "eg.", "al."));
	private static final Set<String> CONTRACTIONS = new HashSet<String>(Arrays.asList(
			"n't", "'s", "'ve", "'re", "'ll", "'d", "'m",
			"n’t", "’s", "’ve", "’re", "’ll", "’d", "’m"));
	private static final String BEGINNING_PUNCTUATION = "\"'([{#$“‘";
	private static final String ENDING_PUNCTUATION = "\"'.,;)]}:!?%”’";

	@Override
	public List<String> tokenize(String text) {
		List<String> tokens = new ArrayList<String>();
		for(String field: text.trim().split("\\s+")){
			if(field.isEmpty()){
				continue;
			}
			tokens.addAll(tokenizeField(field));
		}
		return tokens;
	}

	private List<String> tokenizeField(String field){
		List<String> tokens = new ArrayList<String>();
		if(SPECIAL_CASES.contains(field.toLowerCase())){
			tokens.add(field);
			return tokens;
		}
		int start = 0;
		while(start < field.length() && BEGINNING_PUNCTUATION.indexOf(field.charAt(start)) >= 0){
			tokens.add(field.substring(start, start+1));
			start++;
		}
		int end = field.length();
		LinkedList<String> endTokens = new LinkedList<String>();
		while(end > start && ENDING_PUNCTUATION.indexOf(field.charAt(end-1)) >= 0){
			endTokens.addFirst(field.substring(end-1, end));
			end--;
		}
		String word = field.substring(start, end);
		String contraction = null;
		for(String candidate: CONTRACTIONS){
			if(word.length() > candidate.length() && word.toLowerCase().endsWith(candidate)){
				contraction = word.substring(word.length()-candidate.length());
				word = word.substring(0, word.length()-candidate.length());
				break;
			}
		}
		if(!word.isEmpty()){
			tokens.add(word);
		}
		if(contraction != null){
			tokens.add(contraction);
		}
		tokens.addAll(endTokens);
		return tokens;
	}

}
