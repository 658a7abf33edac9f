package com.dynamicdto.exception;

/**
 * Raised when a property outside the fillable whitelist is assigned.
 */
public class DtoPropertyNonFillableException extends DtoException {

	private static final long serialVersionUID = 1L;
	private final String property;

	public DtoPropertyNonFillableException(String property) {
		super("Property [" + property + "] is not fillable, thus unable to be set.");
		this.property = property;
	}

	public String getProperty() {
		return property;
	}
}
