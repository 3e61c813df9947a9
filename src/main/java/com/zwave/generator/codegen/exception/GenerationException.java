package com.zwave.generator.codegen.exception;

/**
 * Fatal failure of a generation run: unreadable input, malformed XML or a
 * template that cannot be rendered.
 */
public class GenerationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public GenerationException(String message) {
		super(message);
	}

	public GenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
