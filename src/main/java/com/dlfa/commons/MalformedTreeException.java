package com.dlfa.commons;

/** for logical forms whose parentheses and commas do not balance */
public class MalformedTreeException extends InstanceException {

	private static final long serialVersionUID = -5891245770218933641L;

	private final String text;

	public MalformedTreeException(String text) {
		super("Malformed binary semantic parse: " + text);
		this.text = text;
	}

	/**
	 * The logical form that failed to linearize.
	 * @return
	 */
	public String getText() {
		return text;
	}

}
