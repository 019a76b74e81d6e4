package com.teaglu.dnsclient.dns.exception;

import org.eclipse.jdt.annotation.Nullable;

/**
 * DnsInvalidInputException
 * 
 * Input rejected locally before any call, or flagged as invalid by the provider.
 */
public class DnsInvalidInputException extends DnsApiException {
	private static final long serialVersionUID = 1L;

	// Marker used for input rejected before any call was made
	public static final String LOCAL_RESULT= "error";
	
	public DnsInvalidInputException(String message) {
		super(DnsErrorKind.INVALID_INPUT, LOCAL_RESULT, message);
	}

	public DnsInvalidInputException(@Nullable String result, String message) {
		super(DnsErrorKind.INVALID_INPUT, result, message);
	}
}
