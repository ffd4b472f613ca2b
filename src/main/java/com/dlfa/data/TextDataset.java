package com.dlfa.data;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.Logger;

import com.dlfa.commons.InvalidQuestionException;
import com.dlfa.commons.tokenizer.Tokenizer;
import com.dlfa.commons.types.QuestionInstance;
import com.dlfa.commons.types.TextInstance;
import com.dlfa.commons.types.indexed.IndexedInstance;
import com.dlfa.commons.types.LogicalFormInstance;
import com.dlfa.commons.types.TrueFalseInstance;
import com.dlfa.util.GeneralUtils;
import com.dlfa.util.instance_parser.BackgroundInstanceParser;
import com.dlfa.util.instance_parser.TrueFalseInstanceParser;

/**
 * An ordered collection of text instances, which can fit a {@link DataIndexer} and then be converted
 * into an {@link IndexedDataset}.
 */
public class TextDataset {

	private static final Logger LOGGER = GeneralUtils.createLogger(TextDataset.class);

	private final List<TextInstance<?>> instances;

	public TextDataset(List<? extends TextInstance<?>> instances){
		this.instances = Collections.unmodifiableList(new ArrayList<TextInstance<?>>(instances));
	}

	public List<TextInstance<?>> getInstances(){
		return this.instances;
	}

	public int size(){
		return this.instances.size();
	}

	/**
	 * Reads a dataset with one true/false (or logical form) instance per line.
	 * @param path
	 * @param defaultLabel The label of every instance, or null to use the labels in the file
	 * @param tokenizer
	 * @param logicalForms Whether the lines hold logical forms rather than sentences
	 * @return
	 * @throws IOException
	 * @see TrueFalseInstanceParser
	 */
	public static TextDataset readFromFile(String path, Boolean defaultLabel, Tokenizer tokenizer, boolean logicalForms) throws IOException {
		List<? extends TrueFalseInstance> instances;
		if(logicalForms){
			instances = new TrueFalseInstanceParser<LogicalFormInstance>(LogicalFormInstance::new, defaultLabel, tokenizer)
					.buildInstances(path);
		} else {
			instances = new TrueFalseInstanceParser<TrueFalseInstance>(TrueFalseInstance::new, defaultLabel, tokenizer)
					.buildInstances(path);
		}
		return new TextDataset(instances);
	}

	/**
	 * Returns a dataset where every instance is wrapped with its background sentences from the given file.
	 * @param backgroundPath
	 * @return
	 * @throws IOException
	 * @see BackgroundInstanceParser
	 */
	public TextDataset withBackground(String backgroundPath) throws IOException {
		return new TextDataset(new BackgroundInstanceParser(this.instances).buildInstances(backgroundPath));
	}

	/**
	 * Groups consecutive instances into questions of <code>numOptions</code> options each.
	 * @param numOptions
	 * @return
	 * @throws InvalidQuestionException if the instances cannot be split evenly, if an option is not
	 * 		   labeled true or false, or if a group does not have exactly one true option
	 */
	@SuppressWarnings("unchecked")
	public TextDataset toQuestionDataset(int numOptions){
		if(numOptions <= 0 || this.instances.size() % numOptions != 0){
			throw new InvalidQuestionException("Cannot group "+this.instances.size()+" instances into questions of "
					+numOptions+" options");
		}
		List<QuestionInstance> questions = new ArrayList<QuestionInstance>();
		for(int start=0; start<this.instances.size(); start+=numOptions){
			List<TextInstance<Boolean>> options = new ArrayList<TextInstance<Boolean>>();
			for(TextInstance<?> instance: this.instances.subList(start, start+numOptions)){
				if(!(instance.getLabel() instanceof Boolean)){
					throw new InvalidQuestionException("Question options must be labeled true or false: "+instance);
				}
				options.add((TextInstance<Boolean>)instance);
			}
			questions.add(new QuestionInstance(options));
		}
		LOGGER.info("Grouped %d instances into %d questions", this.instances.size(), questions.size());
		return new TextDataset(questions);
	}

	/**
	 * Creates a data indexer fitted on the words of this dataset.
	 * @param minCount
	 * @return
	 */
	public DataIndexer fitDataIndexer(int minCount){
		DataIndexer dataIndexer = new DataIndexer();
		dataIndexer.fitWordDictionary(this.instances, minCount);
		return dataIndexer;
	}

	/**
	 * Converts every instance with the given (already fitted) data indexer.
	 * @param dataIndexer
	 * @return
	 */
	public IndexedDataset toIndexedDataset(DataIndexer dataIndexer){
		List<IndexedInstance<?>> indexedInstances = new ArrayList<IndexedInstance<?>>();
		for(TextInstance<?> instance: this.instances){
			indexedInstances.add(instance.toIndexedInstance(dataIndexer));
		}
		return new IndexedDataset(indexedInstances);
	}

}
