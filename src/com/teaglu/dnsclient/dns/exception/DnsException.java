package com.teaglu.dnsclient.dns.exception;

import org.eclipse.jdt.annotation.NonNull;

public class DnsException extends Exception {
	private static final long serialVersionUID = 1L;
	
	private final @NonNull DnsErrorKind kind;

	public DnsException(@NonNull DnsErrorKind kind, String message) {
		super(message);
		this.kind= kind;
	}
	
	public DnsException(@NonNull DnsErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind= kind;
	}
	
	public @NonNull DnsErrorKind getKind() {
		return kind;
	}
}
