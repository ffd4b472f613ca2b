package com.dlfa.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.dlfa.commons.InstanceFormatException;
import com.dlfa.commons.InvalidQuestionException;
import com.dlfa.commons.LabelMismatchException;
import com.dlfa.commons.tokenizer.Tokenizers;
import com.dlfa.commons.types.BackgroundInstance;
import com.dlfa.commons.types.LogicalFormInstance;
import com.dlfa.commons.types.QuestionInstance;
import com.dlfa.commons.types.indexed.IndexedInstance;

public class TextDatasetTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private String writeLines(String name, String... lines) throws IOException {
		File file = folder.newFile(name);
		Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
		return file.getPath();
	}

	@Test
	public void readFromFileSkipsEmptyLines() throws IOException {
		String path = writeLines("train.tsv", "1\tThe sky is blue.\t1", "", "2\tThe sky is green.\t0");
		TextDataset dataset = TextDataset.readFromFile(path, null, Tokenizers.DEFAULT, false);
		assertEquals(2, dataset.size());
		assertEquals(Boolean.TRUE, dataset.getInstances().get(0).getLabel());
		assertEquals(Integer.valueOf(2), dataset.getInstances().get(1).getIndex());
	}

	@Test
	public void readFromFileReadsLogicalForms() throws IOException {
		String path = writeLines("train.tsv", "color(sky, blue)\t1");
		TextDataset dataset = TextDataset.readFromFile(path, true, Tokenizers.DEFAULT, true);
		assertTrue(dataset.getInstances().get(0) instanceof LogicalFormInstance);
	}

	@Test(expected = InstanceFormatException.class)
	public void readFromFileReportsBadLine() throws IOException {
		String path = writeLines("train.tsv", "1\tfine\t1", "not\ta\tvalid\tline");
		TextDataset.readFromFile(path, null, Tokenizers.DEFAULT, false);
	}

	@Test
	public void readFromFileReportsLineOfLabelMismatch() throws IOException {
		String path = writeLines("train.tsv", "1\tfine\t1", "2\tnot fine\t0");
		try {
			TextDataset.readFromFile(path, true, Tokenizers.DEFAULT, false);
		} catch (LabelMismatchException e) {
			assertTrue(e.getMessage().startsWith(path+":2:"));
			assertTrue(e.getCause() instanceof LabelMismatchException);
			return;
		}
		throw new AssertionError("Expected LabelMismatchException");
	}

	@Test
	public void withBackgroundWrapsInstancesByIndex() throws IOException {
		String path = writeLines("train.tsv", "1\tThe sky is blue.\t1", "2\tThe sky is green.\t0");
		String backgroundPath = writeLines("background.tsv", "1\tBlue is a color.\tThe sky has a color.");
		TextDataset dataset = TextDataset.readFromFile(path, null, Tokenizers.DEFAULT, false).withBackground(backgroundPath);

		BackgroundInstance<?> first = (BackgroundInstance<?>)dataset.getInstances().get(0);
		BackgroundInstance<?> second = (BackgroundInstance<?>)dataset.getInstances().get(1);
		assertEquals(Arrays.asList("Blue is a color.", "The sky has a color."), first.getBackground());
		assertTrue(second.getBackground().isEmpty());
		assertEquals(Boolean.FALSE, second.getLabel());
	}

	@Test
	public void toQuestionDatasetGroupsConsecutiveInstances() throws IOException {
		String path = writeLines("train.tsv", "a\t0", "b\t1", "c\t1", "d\t0");
		TextDataset questions = TextDataset.readFromFile(path, null, Tokenizers.DEFAULT, false).toQuestionDataset(2);
		assertEquals(2, questions.size());
		assertEquals(Integer.valueOf(1), questions.getInstances().get(0).getLabel());
		assertEquals(Integer.valueOf(0), questions.getInstances().get(1).getLabel());
		assertEquals(2, ((QuestionInstance)questions.getInstances().get(0)).getOptions().size());
	}

	@Test(expected = InvalidQuestionException.class)
	public void toQuestionDatasetRejectsPartialGroup() throws IOException {
		String path = writeLines("train.tsv", "a\t0", "b\t1", "c\t1");
		TextDataset.readFromFile(path, null, Tokenizers.DEFAULT, false).toQuestionDataset(2);
	}

	@Test(expected = InvalidQuestionException.class)
	public void toQuestionDatasetRejectsUnlabeledOptions() throws IOException {
		String path = writeLines("train.tsv", "a", "b");
		TextDataset.readFromFile(path, null, Tokenizers.DEFAULT, false).toQuestionDataset(2);
	}

	@Test
	public void indexesAndPadsWholeDataset() throws IOException {
		String path = writeLines("train.tsv", "the sky is blue\t1", "grass is green\t0");
		TextDataset dataset = TextDataset.readFromFile(path, null, Tokenizers.DEFAULT, false);
		DataIndexer dataIndexer = dataset.fitDataIndexer(1);
		assertEquals(2+6, dataIndexer.getVocabSize());

		IndexedDataset indexed = dataset.toIndexedDataset(dataIndexer);
		Map<String, Integer> lengths = indexed.getPaddingLengths();
		assertEquals(Integer.valueOf(4), lengths.get(IndexedInstance.NUM_SENTENCE_WORDS));

		indexed.padInstances();
		for(IndexedInstance<?> instance: indexed.getInstances()){
			assertEquals(lengths, instance.getPaddingLengths());
		}
	}

}
