package com.dynamicdto.exception;

public class DtoNotFoundException extends DtoInvalidArgumentException {

	private static final long serialVersionUID = 1L;
	private final String className;

	public DtoNotFoundException(String className, Throwable cause) {
		super("Dto object for class [" + className + "] not found.", cause);
		this.className = className;
	}

	public String getClassName() {
		return className;
	}
}
