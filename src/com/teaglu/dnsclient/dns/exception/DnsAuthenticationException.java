package com.teaglu.dnsclient.dns.exception;

import org.eclipse.jdt.annotation.Nullable;

/**
 * DnsAuthenticationException
 * 
 * Provider rejected the supplied credentials.
 */
public class DnsAuthenticationException extends DnsApiException {
	private static final long serialVersionUID = 1L;

	public DnsAuthenticationException(@Nullable String result, String message) {
		super(DnsErrorKind.AUTHENTICATION, result, message);
	}
}
