package com.dynamicdto.exception;

/**
 * Raised when reading a property that was never set, unless unknown reads are ignored.
 */
public class DtoInvalidAttributeException extends DtoException {

	private static final long serialVersionUID = 1L;
	private final String property;

	public DtoInvalidAttributeException(String property) {
		super("Property [" + property + "] was not found in this object.");
		this.property = property;
	}

	public String getProperty() {
		return property;
	}
}
