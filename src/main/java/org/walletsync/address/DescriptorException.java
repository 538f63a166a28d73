package org.walletsync.address;

@SuppressWarnings("serial")
public class DescriptorException extends Exception {

	public DescriptorException(String message) {
		super(message);
	}

	public DescriptorException(String message, Throwable cause) {
		super(message, cause);
	}

}
