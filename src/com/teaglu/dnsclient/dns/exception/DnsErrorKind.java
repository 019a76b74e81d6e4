package com.teaglu.dnsclient.dns.exception;

/**
 * DnsErrorKind
 * 
 * Coarse classification of a failed operation, so callers can branch on the kind of failure
 * without testing the exception class.
 */
public enum DnsErrorKind {
	// Bad caller input, or input the provider flagged as invalid
	INVALID_INPUT,
	
	// Bad or missing credentials
	AUTHENTICATION,
	
	// Provider call-volume limit reached
	RATE_LIMIT,
	
	// Any other failure reported by the provider
	GENERIC,
	
	// Network or timeout failure before any provider response was obtained
	TRANSPORT
}
