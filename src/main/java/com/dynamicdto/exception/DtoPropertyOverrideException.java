package com.dynamicdto.exception;

/**
 * Raised when an existing property is reassigned on a Dto that forbids overrides.
 */
public class DtoPropertyOverrideException extends DtoException {

	private static final long serialVersionUID = 1L;
	private final String property;

	public DtoPropertyOverrideException(String property) {
		super("Property [" + property + "] is already set and can not be overridden.");
		this.property = property;
	}

	public String getProperty() {
		return property;
	}
}
