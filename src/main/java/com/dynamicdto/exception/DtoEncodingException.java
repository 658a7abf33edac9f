package com.dynamicdto.exception;

/**
 * Wraps the JSON encoder's failure; the original exception is kept as cause.
 */
public class DtoEncodingException extends DtoException {

	private static final long serialVersionUID = 1L;

	public DtoEncodingException(String dtoName, Throwable cause) {
		super("Unable to encode Dto [" + dtoName + "] as JSON: " + cause.getMessage(), cause);
	}
}
