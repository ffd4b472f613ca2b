package com.dlfa.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Collection of static methods for padding sequences to a fixed length.
 */
public class PaddingUtils {

	private PaddingUtils(){}

	/**
	 * Returns a copy of the sequence with exactly the desired length.<br>
	 * A longer sequence keeps its last <code>desiredLength</code> items, a shorter one is padded on the
	 * left with values from the supplier. The order of the kept items never changes.
	 * @param sequence
	 * @param desiredLength
	 * @param defaultValue
	 * @return
	 */
	public static <T> List<T> padSequenceToLength(List<T> sequence, int desiredLength, Supplier<T> defaultValue){
		if(desiredLength < 0){
			throw new IllegalArgumentException("Cannot pad to a negative length: "+desiredLength);
		}
		int keepFrom = Math.max(0, sequence.size()-desiredLength);
		List<T> padded = new ArrayList<T>(desiredLength);
		for(int i=sequence.size()-keepFrom; i<desiredLength; i++){
			padded.add(defaultValue.get());
		}
		padded.addAll(sequence.subList(keepFrom, sequence.size()));
		return padded;
	}

	/**
	 * Returns the length requested for the given dimension.
	 * @param lengths
	 * @param dimension
	 * @return
	 * @throws IllegalArgumentException if the dimension is not in the map
	 */
	public static int getRequiredLength(Map<String, Integer> lengths, String dimension){
		Integer length = lengths.get(dimension);
		if(length == null){
			throw new IllegalArgumentException("No padding length given for "+dimension+" in "+lengths);
		}
		return length;
	}

	/**
	 * Merges the lengths into the running maximum for each dimension.
	 * @param maxLengths
	 * @param lengths
	 */
	public static void updateMaxLengths(Map<String, Integer> maxLengths, Map<String, Integer> lengths){
		for(Map.Entry<String, Integer> entry: lengths.entrySet()){
			maxLengths.merge(entry.getKey(), entry.getValue(), Math::max);
		}
	}

}
