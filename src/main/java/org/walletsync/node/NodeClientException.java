package org.walletsync.node;

@SuppressWarnings("serial")
public class NodeClientException extends Exception {

	public NodeClientException() {
		super();
	}

	public NodeClientException(String message) {
		super(message);
	}

	public NodeClientException(String message, Throwable cause) {
		super(message, cause);
	}

	public NodeClientException(Throwable cause) {
		super(cause);
	}

	public static class NetworkException extends NodeClientException {
		private final Integer daemonErrorCode;
		private final Object server;

		public NetworkException() {
			super();
			this.daemonErrorCode = null;
			this.server = null;
		}

		public NetworkException(String message) {
			super(message);
			this.daemonErrorCode = null;
			this.server = null;
		}

		public NetworkException(int errorCode, String message, Object server) {
			super(message);
			this.daemonErrorCode = errorCode;
			this.server = server;
		}

		public NetworkException(String message, Object server) {
			super(message);
			this.daemonErrorCode = null;
			this.server = server;
		}

		public Integer getDaemonErrorCode() {
			return this.daemonErrorCode;
		}

		public Object getServer() {
			return server;
		}
	}

	public static class NotFoundException extends NodeClientException {
		public NotFoundException() {
			super();
		}

		public NotFoundException(String message) {
			super(message);
		}
	}

}
