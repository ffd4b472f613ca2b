package com.dlfa.util.instance_parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.Logger;

import com.dlfa.commons.InstanceFormatException;
import com.dlfa.commons.LabelMismatchException;
import com.dlfa.commons.tokenizer.Tokenizer;
import com.dlfa.commons.types.TrueFalseInstance;
import com.dlfa.data.DataConfig;
import com.dlfa.util.GeneralUtils;

/**
 * The instance parser building true/false instances from tab-separated lines.<br>
 * Each line has one of four formats:
 * <ol>
 * <li>[sentence]</li>
 * <li>[sentence index][tab][sentence]</li>
 * <li>[sentence][tab][label]</li>
 * <li>[sentence index][tab][sentence][tab][label]</li>
 * </ol>
 * For formats 1 and 2 the default label is used (and may be absent). For formats 3 and 4, the label
 * in the line must match the default label if one is given: passing a default label means
 * everything being read should have that label.<br>
 * With two fields, the first one is taken as an index if it is all digits, otherwise the second one
 * is taken as a label if it is all digits.
 *
 * @param <T> The type of the instances built
 */
public class TrueFalseInstanceParser<T extends TrueFalseInstance> extends InstanceParser<T> {

	private static final long serialVersionUID = -4113323166917321677L;

	private static final Logger LOGGER = GeneralUtils.createLogger(TrueFalseInstanceParser.class);

	/**
	 * Creates the instance once the fields of a line are known.
	 */
	@FunctionalInterface
	public static interface InstanceFactory<T extends TrueFalseInstance> extends Serializable {
		public T create(String text, Boolean label, Integer index, Tokenizer tokenizer);
	}

	private final InstanceFactory<T> factory;
	/** The label of every instance read, or null if not known in advance */
	public final Boolean defaultLabel;
	public final Tokenizer tokenizer;

	public TrueFalseInstanceParser(InstanceFactory<T> factory, Boolean defaultLabel, Tokenizer tokenizer){
		this.factory = factory;
		this.defaultLabel = defaultLabel;
		this.tokenizer = tokenizer;
	}

	/**
	 * Reads the instances from the given files, one instance per non-empty line.
	 * @throws InstanceFormatException if a line is not valid, with the file and line number in the message
	 * @throws LabelMismatchException if a label differs from the default label
	 */
	@Override
	public List<T> buildInstances(String... sources) throws IOException {
		List<T> instances = new ArrayList<T>();
		for(String source: sources){
			int lineNumber = 0;
			try(BufferedReader br = Files.newBufferedReader(Paths.get(source), StandardCharsets.UTF_8)){
				String line;
				while((line = br.readLine()) != null){
					lineNumber++;
					if(line.trim().isEmpty()){
						continue;
					}
					try{
						instances.add(parseLine(line));
					} catch (InstanceFormatException e){
						throw new InstanceFormatException(source+":"+lineNumber+": "+e.getMessage(), e);
					} catch (LabelMismatchException e){
						throw new LabelMismatchException(source+":"+lineNumber+": "+e.getMessage(), e);
					}
				}
			}
			LOGGER.info("Read %d lines from %s", lineNumber, source);
		}
		LOGGER.info("Total: %d instances", instances.size());
		return instances;
	}

	/**
	 * Parses a single line.
	 * @param line
	 * @return
	 * @throws InstanceFormatException if the line has none of the four formats
	 * @throws LabelMismatchException if the label in the line differs from the default label
	 */
	public T parseLine(String line){
		String[] fields = line.split(DataConfig.FIELD_SEPARATOR, -1);
		if(fields.length == 3){
			Boolean label = checkLabel(parseLabel(fields[2], line), line);
			return factory.create(fields[1], label, parseIndex(fields[0], line), tokenizer);
		} else if(fields.length == 2){
			if(isDecimal(fields[0])){
				return factory.create(fields[1], checkLabel(null, line), parseIndex(fields[0], line), tokenizer);
			} else if(isDecimal(fields[1])){
				Boolean label = checkLabel(parseLabel(fields[1], line), line);
				return factory.create(fields[0], label, null, tokenizer);
			} else {
				throw new InstanceFormatException("Unrecognized line format: "+line);
			}
		} else if(fields.length == 1){
			return factory.create(fields[0], checkLabel(null, line), null, tokenizer);
		} else {
			throw new InstanceFormatException("Unrecognized line format: "+line);
		}
	}

	/**
	 * Returns the label to use given the label read from the line (null if none).
	 */
	private Boolean checkLabel(Boolean label, String line){
		if(label == null){
			return defaultLabel;
		}
		if(defaultLabel != null && !defaultLabel.equals(label)){
			throw new LabelMismatchException("Label "+label+" in line does not match the default label "
					+defaultLabel+": "+line);
		}
		return label;
	}

	private static Boolean parseLabel(String labelString, String line){
		if(labelString.equals(DataConfig.POSITIVE_LABEL)){
			return true;
		} else if(labelString.equals(DataConfig.NEGATIVE_LABEL)){
			return false;
		}
		throw new InstanceFormatException("Label must be "+DataConfig.POSITIVE_LABEL+" or "
				+DataConfig.NEGATIVE_LABEL+", got '"+labelString+"': "+line);
	}

	private static Integer parseIndex(String indexString, String line){
		if(!isDecimal(indexString)){
			throw new InstanceFormatException("Index must be a non-negative integer, got '"+indexString+"': "+line);
		}
		try{
			return Integer.valueOf(indexString);
		} catch (NumberFormatException e){
			throw new InstanceFormatException("Index out of range, got '"+indexString+"': "+line, e);
		}
	}

	static boolean isDecimal(String field){
		if(field.isEmpty()){
			return false;
		}
		for(int i=0; i<field.length(); i++){
			char c = field.charAt(i);
			if(c < '0' || c > '9'){
				return false;
			}
		}
		return true;
	}

}
