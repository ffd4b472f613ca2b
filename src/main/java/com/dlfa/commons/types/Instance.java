/** Statistical Natural Language Processing System
    Copyright (C) 2014-2016  Lu, Wei

    This program is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    This program is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.dlfa.commons.types;

import java.io.Serializable;

/**
 * A base class representing an instance, holding the label of a training or test example and an
 * optional index identifying it (e.g., its line number in the source file).<br>
 * The label is absent (<code>null</code>) when it is unknown, as in test data.<br>
 * Text instances are converted into indexed instances using a {@link com.dlfa.data.DataIndexer}.
 *
 * @param <L> The type of the label: {@link Boolean} for true/false instances, {@link Integer} for
 * 			  the index of the correct option of a question
 */
public abstract class Instance<L> implements Serializable {

	private static final long serialVersionUID = -6164285710958273354L;

	protected L _label;
	protected Integer _index;

	/**
	 * Create an instance.
	 * @param label The label, or null if unknown
	 * @param index The index of this instance, or null if it has none
	 */
	public Instance(L label, Integer index){
		if(index != null && index < 0)
			throw new IllegalArgumentException("The instance index is "+index);
		this._label = label;
		this._index = index;
	}

	public L getLabel(){
		return this._label;
	}

	public Integer getIndex(){
		return this._index;
	}

	public boolean hasIndex(){
		return this._index != null;
	}

}
