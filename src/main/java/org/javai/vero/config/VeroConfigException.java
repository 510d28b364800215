package org.javai.vero.config;

/**
 * Exception thrown when configuration or source files cannot be read.
 */
public class VeroConfigException extends RuntimeException {

	public VeroConfigException(String message) {
		super(message);
	}

	public VeroConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
