package com.dlfa.commons;

/** for questions built from options that do not have exactly one true label */
public class InvalidQuestionException extends InstanceException {

	private static final long serialVersionUID = 4417093125385740923L;

	public InvalidQuestionException(String message) {
		super(message);
	}

}
