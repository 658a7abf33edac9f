package com.dynamicdto.exception;

/**
 * Raised when an initialized read-only Dto is mutated.
 */
public class DtoReadOnlyException extends DtoException {

	private static final long serialVersionUID = 1L;
	private final String property;

	public DtoReadOnlyException(String property) {
		super("Dto object is read only. Unable to set property [" + property + "].");
		this.property = property;
	}

	public String getProperty() {
		return property;
	}
}
