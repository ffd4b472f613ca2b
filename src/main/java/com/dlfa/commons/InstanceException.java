package com.dlfa.commons;

/**
 * Base class for the fatal data problems found while building or indexing instances.<br>
 * None of these are recoverable for the instance or record in question.
 */
public class InstanceException extends RuntimeException {

	private static final long serialVersionUID = -3120948511742098817L;

	public InstanceException(String message) {
		super(message);
	}

	public InstanceException(String message, Throwable cause) {
		super(message, cause);
	}

}
