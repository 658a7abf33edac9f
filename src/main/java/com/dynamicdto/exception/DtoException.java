package com.dynamicdto.exception;

/**
 * Base type for every failure raised by a Dto or the factory.
 */
public class DtoException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public DtoException(String message) {
		super(message);
	}

	public DtoException(String message, Throwable cause) {
		super(message, cause);
	}
}
