package com.dlfa.commons.types.indexed;

/**
 * The operations of the stack machine building a tree from its elements.
 */
public enum Transition {

	/** Filler used when padding a transition sequence */
	NO_OP(0, "-"),
	/** Pushes the next element */
	SHIFT(1, "S"),
	/** Combines the top two items of the stack */
	REDUCE2(2, "R2"),
	/** Combines the top three items of the stack */
	REDUCE3(3, "R3"),
	;

	private final int code;
	private final String symbol;

	private Transition(int code, String symbol){
		this.code = code;
		this.symbol = symbol;
	}

	/**
	 * The integer fed to the tree encoder for this operation.
	 * @return
	 */
	public int getCode(){
		return this.code;
	}

	/**
	 * The short symbol of this operation, e.g. <code>R2</code>.
	 */
	@Override
	public String toString(){
		return this.symbol;
	}

}
