package com.teaglu.dnsclient.dns.exception;

public class DnsTransportException extends DnsException {
	private static final long serialVersionUID = 1L;

	public DnsTransportException(String message) {
		super(DnsErrorKind.TRANSPORT, message);
	}

	public DnsTransportException(String message, Throwable cause) {
		super(DnsErrorKind.TRANSPORT, message, cause);
	}
}
