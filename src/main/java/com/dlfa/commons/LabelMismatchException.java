package com.dlfa.commons;

/**
 * Thrown when the default label given by the caller conflicts with the label written in a record.<br>
 * If a default label is passed, everything being read should carry that label, so a mismatch
 * means some parameter was set up wrongly somewhere else.
 */
public class LabelMismatchException extends InstanceException {

	private static final long serialVersionUID = 2270859338015424690L;

	public LabelMismatchException(String message) {
		super(message);
	}

	public LabelMismatchException(String message, Throwable cause) {
		super(message, cause);
	}

}
