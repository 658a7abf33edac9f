package com.dynamicdto.exception;

/**
 * Raised when an attribute name is empty, not a string or numeric.
 */
public class DtoInvalidKeyException extends DtoException {

	private static final long serialVersionUID = 1L;
	private final String property;

	public DtoInvalidKeyException(String property) {
		super("Property [" + property + "] is not a valid attribute name.");
		this.property = property;
	}

	public String getProperty() {
		return property;
	}
}
