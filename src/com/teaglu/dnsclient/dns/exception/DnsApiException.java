package com.teaglu.dnsclient.dns.exception;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;

/**
 * DnsApiException
 * 
 * Failure reported by the provider, or a provider response that could not be understood.  When
 * the provider sent an error envelope its result marker is kept alongside the message.
 */
public class DnsApiException extends DnsException {
	private static final long serialVersionUID = 1L;
	
	private final @Nullable String result;

	public DnsApiException(String message) {
		super(DnsErrorKind.GENERIC, message);
		this.result= null;
	}

	public DnsApiException(String message, Throwable cause) {
		super(DnsErrorKind.GENERIC, message, cause);
		this.result= null;
	}
	
	public DnsApiException(@Nullable String result, String message) {
		super(DnsErrorKind.GENERIC, message);
		this.result= result;
	}
	
	protected DnsApiException(
			@NonNull DnsErrorKind kind,
			@Nullable String result,
			String message)
	{
		super(kind, message);
		this.result= result;
	}
	
	/**
	 * getResult
	 * 
	 * The "result" marker of the provider envelope, or null if the failure did not come from
	 * an error envelope.
	 * 
	 * @return							Result marker
	 */
	public @Nullable String getResult() {
		return result;
	}
}
