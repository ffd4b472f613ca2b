package com.dlfa.commons.types.indexed;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class IndexedTrueFalseInstanceTest {

	private static Map<String, Integer> sentenceLength(int length){
		return Collections.singletonMap(IndexedInstance.NUM_SENTENCE_WORDS, length);
	}

	@Test
	public void getPaddingLengthsReturnsLengthOfWordIndices() {
		IndexedTrueFalseInstance instance = new IndexedTrueFalseInstance(Arrays.asList(1, 2, 3, 4), true);
		assertEquals(sentenceLength(4), instance.getPaddingLengths());
	}

	@Test
	public void padAddsZerosOnLeft() {
		IndexedTrueFalseInstance instance = new IndexedTrueFalseInstance(Arrays.asList(1, 2, 3, 4), true);
		instance.pad(sentenceLength(5));
		assertEquals(Arrays.asList(0, 1, 2, 3, 4), instance.getWordIndices());
	}

	@Test
	public void padTruncatesOldestWords() {
		IndexedTrueFalseInstance instance = new IndexedTrueFalseInstance(Arrays.asList(1, 2, 3, 4), true);
		instance.pad(sentenceLength(3));
		assertEquals(Arrays.asList(2, 3, 4), instance.getWordIndices());
	}

	@Test
	public void padTwiceToSameLengthChangesNothing() {
		IndexedTrueFalseInstance instance = new IndexedTrueFalseInstance(Arrays.asList(1, 2, 3, 4), true);
		instance.pad(sentenceLength(6));
		instance.pad(sentenceLength(6));
		assertEquals(Arrays.asList(0, 0, 1, 2, 3, 4), instance.getWordIndices());
		instance.pad(sentenceLength(2));
		instance.pad(sentenceLength(2));
		assertEquals(Arrays.asList(3, 4), instance.getWordIndices());
	}

	@Test(expected = IllegalArgumentException.class)
	public void padRejectsMissingDimension() {
		new IndexedTrueFalseInstance(Arrays.asList(1, 2), true).pad(new HashMap<String, Integer>());
	}

	@Test
	public void emptyInstanceHasNoWordsAndNoLabel() {
		IndexedTrueFalseInstance empty = new IndexedTrueFalseInstance(Arrays.asList(1, 2), true, 3).emptyInstance();
		assertEquals(sentenceLength(0), empty.getPaddingLengths());
		assertNull(empty.getLabel());
	}

}
