package com.dlfa.util;

import java.io.IOException;
import java.util.Map;

import org.apache.logging.log4j.Logger;

import com.dlfa.commons.tokenizer.Tokenizers;
import com.dlfa.data.DataConfig;
import com.dlfa.data.DataIndexer;
import com.dlfa.data.IndexedDataset;
import com.dlfa.data.TextDataset;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Reads a dataset, fits a vocabulary on it, then indexes and pads all of its instances.<br>
 * Example:
 * <pre>
 * --trainPath data/train.tsv --backgroundPath data/train.background.tsv --numOptions 4 --logPath index.log
 * </pre>
 */
public class IndexingPipeline {

	public static final Logger LOGGER = GeneralUtils.createLogger(IndexingPipeline.class);

	private final ArgumentParser argParser;

	public IndexingPipeline(){
		argParser = ArgumentParsers.newFor("IndexingPipeline").build()
				.defaultHelp(true)
				.description("Index and pad training instances read from a tab-separated file.");
		argParser.addArgument("--trainPath")
				.type(String.class)
				.required(true)
				.help("The path to the instances, one per line.");
		argParser.addArgument("--backgroundPath")
				.type(String.class)
				.help("The path to background sentences, each line starting with the index of its instance.");
		argParser.addArgument("--logicalForms")
				.type(Boolean.class)
				.action(Arguments.storeTrue())
				.help("Whether the lines hold logical forms instead of sentences.");
		argParser.addArgument("--defaultLabel")
				.type(Arguments.booleanType())
				.help("The label of every instance read; labels in the file must match it.");
		argParser.addArgument("--numOptions")
				.type(Integer.class)
				.metavar("n")
				.help("Group every n consecutive instances into a multiple-choice question.");
		argParser.addArgument("--minCount")
				.type(Integer.class)
				.setDefault(DataConfig.MIN_WORD_COUNT)
				.help("Words seen fewer times are mapped to the unknown token.");
		argParser.addArgument("--logPath")
				.type(String.class)
				.help("The path to log all information related to this pipeline execution.");
	}

	/**
	 * Parses the arguments and runs the pipeline.
	 * @param args
	 * @return The padded indexed dataset
	 * @throws ArgumentParserException if the arguments are not valid
	 * @throws IOException if a file cannot be read
	 */
	public IndexedDataset run(String... args) throws ArgumentParserException, IOException {
		Namespace ns = argParser.parseArgs(args);
		String logPath = ns.getString("logPath");
		if(logPath != null){
			GeneralUtils.updateLogger(logPath);
		}
		Boolean defaultLabel = ns.getBoolean("defaultLabel");
		TextDataset dataset = TextDataset.readFromFile(ns.getString("trainPath"), defaultLabel, Tokenizers.DEFAULT,
				ns.getBoolean("logicalForms"));
		String backgroundPath = ns.getString("backgroundPath");
		if(backgroundPath != null){
			dataset = dataset.withBackground(backgroundPath);
		}
		Integer numOptions = ns.getInt("numOptions");
		if(numOptions != null){
			dataset = dataset.toQuestionDataset(numOptions);
		}
		DataIndexer dataIndexer = dataset.fitDataIndexer(ns.getInt("minCount"));
		IndexedDataset indexedDataset = dataset.toIndexedDataset(dataIndexer);
		Map<String, Integer> lengths = indexedDataset.getPaddingLengths();
		indexedDataset.padInstances(lengths);
		LOGGER.info("Indexed %d instances with a vocabulary of %d words, padding lengths %s",
				indexedDataset.size(), dataIndexer.getVocabSize(), lengths);
		return indexedDataset;
	}

	public static void main(String[] args) throws IOException {
		IndexingPipeline pipeline = new IndexingPipeline();
		try{
			pipeline.run(args);
		} catch (ArgumentParserException e){
			pipeline.argParser.handleError(e);
			System.exit(1);
		}
	}

}
