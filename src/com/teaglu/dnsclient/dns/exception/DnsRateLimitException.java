package com.teaglu.dnsclient.dns.exception;

import org.eclipse.jdt.annotation.Nullable;

/**
 * DnsRateLimitException
 * 
 * Provider refused the call because the API call limit was reached.
 */
public class DnsRateLimitException extends DnsApiException {
	private static final long serialVersionUID = 1L;

	public DnsRateLimitException(@Nullable String result, String message) {
		super(DnsErrorKind.RATE_LIMIT, result, message);
	}
}
