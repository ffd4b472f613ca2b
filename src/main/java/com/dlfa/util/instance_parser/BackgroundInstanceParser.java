package com.dlfa.util.instance_parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.Logger;

import com.dlfa.commons.InstanceFormatException;
import com.dlfa.commons.types.BackgroundInstance;
import com.dlfa.commons.types.TextInstance;
import com.dlfa.data.DataConfig;
import com.dlfa.util.GeneralUtils;

/**
 * The instance parser attaching background sentences to already-read instances.<br>
 * Each line of a background file is <code>[instance index][tab][sentence][tab][sentence]...</code>,
 * and the sentences are attached to the instance with that index. Instances without a background
 * line get an empty background.
 */
public class BackgroundInstanceParser extends InstanceParser<BackgroundInstance<?>> {

	private static final long serialVersionUID = -4678360022097844920L;

	private static final Logger LOGGER = GeneralUtils.createLogger(BackgroundInstanceParser.class);

	private final List<? extends TextInstance<?>> instances;

	/**
	 * @param instances The instances to wrap, each of which must have an index
	 */
	public BackgroundInstanceParser(List<? extends TextInstance<?>> instances){
		this.instances = instances;
	}

	@Override
	public List<BackgroundInstance<?>> buildInstances(String... sources) throws IOException {
		Map<Integer, List<String>> background = new HashMap<Integer, List<String>>();
		for(String source: sources){
			background.putAll(readBackground(source));
		}
		List<BackgroundInstance<?>> result = new ArrayList<BackgroundInstance<?>>();
		int numWithBackground = 0;
		for(TextInstance<?> instance: instances){
			if(!instance.hasIndex()){
				throw new InstanceFormatException("Cannot attach background to an instance without index: "+instance);
			}
			List<String> sentences = background.get(instance.getIndex());
			if(sentences == null){
				sentences = new ArrayList<String>();
			} else {
				numWithBackground++;
			}
			result.add(wrap(instance, sentences));
		}
		LOGGER.info("Attached background to %d of %d instances", numWithBackground, result.size());
		return result;
	}

	private static <L> BackgroundInstance<L> wrap(TextInstance<L> instance, List<String> background){
		return new BackgroundInstance<L>(instance, background);
	}

	/**
	 * Reads the background sentences of a file, keyed by instance index.
	 * @param path
	 * @return
	 * @throws IOException
	 * @throws InstanceFormatException if a line does not start with an index
	 */
	public static Map<Integer, List<String>> readBackground(String path) throws IOException {
		Map<Integer, List<String>> background = new HashMap<Integer, List<String>>();
		int lineNumber = 0;
		try(BufferedReader br = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8)){
			String line;
			while((line = br.readLine()) != null){
				lineNumber++;
				if(line.trim().isEmpty()){
					continue;
				}
				String[] fields = line.split(DataConfig.FIELD_SEPARATOR);
				if(!TrueFalseInstanceParser.isDecimal(fields[0])){
					throw new InstanceFormatException(path+":"+lineNumber+": Background line must start with an index: "+line);
				}
				int index = Integer.parseInt(fields[0]);
				List<String> sentences = background.get(index);
				if(sentences == null){
					sentences = new ArrayList<String>();
					background.put(index, sentences);
				}
				sentences.addAll(Arrays.asList(fields).subList(1, fields.length));
			}
		}
		LOGGER.debug("Read background for %d instances from %s", background.size(), path);
		return background;
	}

}
