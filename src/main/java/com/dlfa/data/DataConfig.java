package com.dlfa.data;

/**
 * Global settings shared by the readers, the indexer and the pipeline.
 */
public class DataConfig {

	/** The token reserved for index 0, used when padding sequences */
	public static final String PADDING_TOKEN = "@@PADDING@@";
	/** The token reserved for index 1, returned for any word not in the vocabulary */
	public static final String OOV_TOKEN = "@@UNKNOWN@@";

	/** The separator between fields of a line record */
	public static final String FIELD_SEPARATOR = "\t";
	/** How a true label is written in a line record */
	public static final String POSITIVE_LABEL = "1";
	/** How a false label is written in a line record */
	public static final String NEGATIVE_LABEL = "0";

	/** Words seen fewer times than this while fitting the vocabulary map to the unknown token */
	public static int MIN_WORD_COUNT = 1;

}
