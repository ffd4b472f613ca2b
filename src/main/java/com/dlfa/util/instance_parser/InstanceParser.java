package com.dlfa.util.instance_parser;

import java.io.IOException;
import java.io.Serializable;
import java.util.List;

import com.dlfa.commons.types.TextInstance;

/**
 * The base class for readers building instances from text files.
 *
 * @param <T> The type of the instances built
 */
public abstract class InstanceParser<T extends TextInstance<?>> implements Serializable {

	private static final long serialVersionUID = 5237466917323162081L;

	/**
	 * Builds the instances from the given sources, typically file paths.
	 * @param sources
	 * @return
	 * @throws IOException if a source cannot be read
	 */
	public abstract List<T> buildInstances(String... sources) throws IOException;

}
