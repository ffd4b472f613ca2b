package com.dlfa.commons.types;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Arrays;

import org.junit.Test;

import com.dlfa.commons.InstanceFormatException;
import com.dlfa.commons.LabelMismatchException;
import com.dlfa.commons.tokenizer.Tokenizers;
import com.dlfa.commons.types.indexed.IndexedTrueFalseInstance;
import com.dlfa.data.DataIndexer;

public class TrueFalseInstanceTest {

	private static String instanceToLine(String text, Boolean label, Integer index){
		StringBuilder line = new StringBuilder();
		if(index != null){
			line.append(index).append('\t');
		}
		line.append(text);
		if(label != null){
			line.append('\t').append(label ? "1" : "0");
		}
		return line.toString();
	}

	@Test
	public void readFromLineHandlesOneColumn() {
		TrueFalseInstance instance = TrueFalseInstance.readFromLine("this is a sentence");
		assertEquals("this is a sentence", instance.getText());
		assertNull(instance.getLabel());
		assertNull(instance.getIndex());
	}

	@Test
	public void readFromLineHandlesThreeColumns() {
		TrueFalseInstance instance = TrueFalseInstance.readFromLine(instanceToLine("this is a sentence", true, 23));
		assertEquals("this is a sentence", instance.getText());
		assertEquals(Boolean.TRUE, instance.getLabel());
		assertEquals(Integer.valueOf(23), instance.getIndex());
	}

	@Test
	public void readFromLineHandlesTwoColumnsWithLabel() {
		TrueFalseInstance instance = TrueFalseInstance.readFromLine(instanceToLine("this is a sentence", false, null));
		assertEquals("this is a sentence", instance.getText());
		assertEquals(Boolean.FALSE, instance.getLabel());
		assertNull(instance.getIndex());
	}

	@Test
	public void readFromLineHandlesTwoColumnsWithIndex() {
		TrueFalseInstance instance = TrueFalseInstance.readFromLine(instanceToLine("this is a sentence", null, 23));
		assertEquals("this is a sentence", instance.getText());
		assertNull(instance.getLabel());
		assertEquals(Integer.valueOf(23), instance.getIndex());
	}

	@Test
	public void readFromLineUsesDefaultLabelWhenLineHasNone() {
		TrueFalseInstance instance = TrueFalseInstance.readFromLine("7\tsome text", true, Tokenizers.DEFAULT);
		assertEquals(Boolean.TRUE, instance.getLabel());
		assertEquals(Integer.valueOf(7), instance.getIndex());
	}

	@Test
	public void readFromLineAcceptsMatchingDefaultLabel() {
		TrueFalseInstance instance = TrueFalseInstance.readFromLine("3\tsome text\t0", false, Tokenizers.DEFAULT);
		assertEquals(Boolean.FALSE, instance.getLabel());
	}

	@Test(expected = LabelMismatchException.class)
	public void readFromLineRejectsLabelDifferentFromDefault() {
		TrueFalseInstance.readFromLine("3\tsome text\t1", false, Tokenizers.DEFAULT);
	}

	@Test(expected = LabelMismatchException.class)
	public void readFromLineRejectsTwoColumnLabelDifferentFromDefault() {
		TrueFalseInstance.readFromLine("some text\t0", true, Tokenizers.DEFAULT);
	}

	@Test
	public void readFromLineChecksIndexBeforeLabel() {
		TrueFalseInstance instance = TrueFalseInstance.readFromLine("1\t0");
		assertEquals("0", instance.getText());
		assertEquals(Integer.valueOf(1), instance.getIndex());
		assertNull(instance.getLabel());
	}

	@Test(expected = InstanceFormatException.class)
	public void readFromLineRejectsTwoColumnsWithoutNumbers() {
		TrueFalseInstance.readFromLine("some text\tmore text");
	}

	@Test(expected = InstanceFormatException.class)
	public void readFromLineRejectsTooManyColumns() {
		TrueFalseInstance.readFromLine("1\tsome text\t1\textra");
	}

	@Test(expected = InstanceFormatException.class)
	public void readFromLineRejectsNonNumericIndex() {
		TrueFalseInstance.readFromLine("first\tsome text\t1");
	}

	@Test
	public void wordsTokenizesTheSentenceCorrectly() {
		assertEquals(Arrays.asList("this", "is", "a", "sentence", "."),
				new TrueFalseInstance("This is a sentence.", null).words());
		assertEquals(Arrays.asList("this", "is", "n't", "a", "sentence", "."),
				new TrueFalseInstance("This isn't a sentence.", null).words());
		assertEquals(Arrays.asList("and", ",", "i", "have", "commas", "."),
				new TrueFalseInstance("And, I have commas.", null).words());
	}

	@SuppressWarnings("unchecked")
	static <T> T serializeAndRead(T object) throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		ObjectOutputStream oos = new ObjectOutputStream(bytes);
		oos.writeObject(object);
		oos.close();
		ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()));
		T result = (T)ois.readObject();
		ois.close();
		return result;
	}

	@Test
	public void keepsTokenizerAfterSerialization() throws Exception {
		TrueFalseInstance copy = serializeAndRead(new TrueFalseInstance("A b, c.", true, 2));
		assertEquals("A b, c.", copy.getText());
		assertEquals(Boolean.TRUE, copy.getLabel());
		assertEquals(Integer.valueOf(2), copy.getIndex());
		assertEquals(Arrays.asList("a", "b", ",", "c", "."), copy.words());
		DataIndexer dataIndexer = new DataIndexer();
		int b = dataIndexer.addWordToIndex("b");
		assertEquals(Arrays.asList(DataIndexer.OOV_INDEX, b, DataIndexer.OOV_INDEX, DataIndexer.OOV_INDEX, DataIndexer.OOV_INDEX),
				copy.toIndexedInstance(dataIndexer).getWordIndices());
	}

	@Test
	public void toIndexedInstanceMapsWordsThroughTheIndexer() {
		DataIndexer dataIndexer = new DataIndexer();
		int first = dataIndexer.addWordToIndex("first");
		int sentence = dataIndexer.addWordToIndex("sentence");
		TrueFalseInstance instance = new TrueFalseInstance("First unseen sentence", true, 4);
		IndexedTrueFalseInstance indexed = instance.toIndexedInstance(dataIndexer);
		assertEquals(Arrays.asList(first, DataIndexer.OOV_INDEX, sentence), indexed.getWordIndices());
		assertEquals(Boolean.TRUE, indexed.getLabel());
		assertEquals(Integer.valueOf(4), indexed.getIndex());
	}

}
