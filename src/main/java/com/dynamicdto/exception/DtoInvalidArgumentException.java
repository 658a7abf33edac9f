package com.dynamicdto.exception;

/**
 * Structural problem with a factory call: bad target type or unusable source data.
 * Never raised for individual attribute rejections.
 */
public class DtoInvalidArgumentException extends DtoException {

	private static final long serialVersionUID = 1L;

	public DtoInvalidArgumentException(String message) {
		super(message);
	}

	public DtoInvalidArgumentException(String message, Throwable cause) {
		super(message, cause);
	}
}
