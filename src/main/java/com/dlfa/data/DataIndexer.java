package com.dlfa.data;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.Logger;

import com.dlfa.commons.types.TextInstance;
import com.dlfa.util.GeneralUtils;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

/**
 * The mapping between words and their integer indices.<br>
 * Index {@value #PADDING_INDEX} is reserved for padding and index {@value #OOV_INDEX} for words not in
 * the vocabulary, so {@link #getWordIndex(String)} never fails.<br>
 * The vocabulary is fitted (or grown with {@link #addWordToIndex(String)}) before any instance is
 * indexed; during indexing it is only read, so it can then be shared between threads.
 */
public class DataIndexer implements Serializable {

	private static final long serialVersionUID = 6065466652568298006L;

	private static final Logger LOGGER = GeneralUtils.createLogger(DataIndexer.class);

	public static final int PADDING_INDEX = 0;
	public static final int OOV_INDEX = 1;

	private final TObjectIntMap<String> wordToIndex;
	private final List<String> indexToWord;

	public DataIndexer(){
		wordToIndex = new TObjectIntHashMap<String>(16, 0.5f, -1);
		indexToWord = new ArrayList<String>();
		addWordToIndex(DataConfig.PADDING_TOKEN);
		addWordToIndex(DataConfig.OOV_TOKEN);
	}

	/**
	 * Counts the words of all the instances and adds to the vocabulary those seen at least
	 * <code>minCount</code> times, the most frequent first.
	 * @param instances
	 * @param minCount
	 */
	public void fitWordDictionary(Iterable<? extends TextInstance<?>> instances, int minCount){
		TObjectIntMap<String> wordCounts = new TObjectIntHashMap<String>();
		for(TextInstance<?> instance: instances){
			for(String word: instance.words()){
				wordCounts.adjustOrPutValue(word, 1, 1);
			}
		}
		List<String> words = new ArrayList<String>(wordCounts.keySet());
		Collections.sort(words, (word1, word2) -> {
			int result = Integer.compare(wordCounts.get(word2), wordCounts.get(word1));
			return result != 0 ? result : word1.compareTo(word2);
		});
		int sizeBefore = getVocabSize();
		for(String word: words){
			if(wordCounts.get(word) >= minCount){
				addWordToIndex(word);
			}
		}
		LOGGER.info("Fitted vocabulary on %d distinct words, added %d with count >= %d, size is now %d",
				words.size(), getVocabSize()-sizeBefore, minCount, getVocabSize());
	}

	/**
	 * Adds the word to the vocabulary if it is not there yet.
	 * @param word
	 * @return The index of the word
	 */
	public int addWordToIndex(String word){
		int index = wordToIndex.get(word);
		if(index == wordToIndex.getNoEntryValue()){
			index = indexToWord.size();
			wordToIndex.put(word, index);
			indexToWord.add(word);
		}
		return index;
	}

	/**
	 * Returns the index of the word, or {@value #OOV_INDEX} if the word is not in the vocabulary.
	 * @param word
	 * @return
	 */
	public int getWordIndex(String word){
		int index = wordToIndex.get(word);
		if(index == wordToIndex.getNoEntryValue()){
			return OOV_INDEX;
		}
		return index;
	}

	public String getWordFromIndex(int index){
		return indexToWord.get(index);
	}

	public boolean containsWord(String word){
		return wordToIndex.containsKey(word);
	}

	/**
	 * The number of words in the vocabulary, including the padding and unknown tokens.
	 * @return
	 */
	public int getVocabSize(){
		return indexToWord.size();
	}

}
