package com.dlfa.commons;

/** for records that do not match any of the accepted line shapes */
public class InstanceFormatException extends InstanceException {

	private static final long serialVersionUID = 7742616853412217021L;

	public InstanceFormatException(String message) {
		super(message);
	}

	public InstanceFormatException(String message, Throwable cause) {
		super(message, cause);
	}

}
