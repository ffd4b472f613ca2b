package com.dlfa.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.Logger;

import com.dlfa.commons.types.indexed.IndexedInstance;
import com.dlfa.util.GeneralUtils;
import com.dlfa.util.PaddingUtils;

/**
 * A collection of indexed instances, padded together to common lengths.
 */
public class IndexedDataset {

	private static final Logger LOGGER = GeneralUtils.createLogger(IndexedDataset.class);

	private final List<IndexedInstance<?>> instances;

	public IndexedDataset(List<? extends IndexedInstance<?>> instances){
		this.instances = new ArrayList<IndexedInstance<?>>(instances);
	}

	public List<IndexedInstance<?>> getInstances(){
		return Collections.unmodifiableList(this.instances);
	}

	public int size(){
		return this.instances.size();
	}

	/**
	 * Returns the maximum length over all instances for each padding dimension.
	 * @return
	 */
	public Map<String, Integer> getPaddingLengths(){
		Map<String, Integer> maxLengths = new HashMap<String, Integer>();
		for(IndexedInstance<?> instance: this.instances){
			PaddingUtils.updateMaxLengths(maxLengths, instance.getPaddingLengths());
		}
		return maxLengths;
	}

	/**
	 * Pads every instance to the maximum lengths found in this dataset.
	 */
	public void padInstances(){
		padInstances(getPaddingLengths());
	}

	/**
	 * Pads every instance to the given lengths.
	 * @param lengths
	 */
	public void padInstances(Map<String, Integer> lengths){
		LOGGER.info("Padding %d instances to %s", this.instances.size(), lengths);
		for(IndexedInstance<?> instance: this.instances){
			instance.pad(lengths);
		}
	}

}
