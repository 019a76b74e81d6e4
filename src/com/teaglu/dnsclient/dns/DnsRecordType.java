package com.teaglu.dnsclient.dns;

import java.util.Locale;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;

import com.teaglu.dnsclient.dns.exception.DnsInvalidInputException;

/**
 * DnsRecordType
 * 
 * Record types the provider accepts through the legacy API
 */
public enum DnsRecordType {
	A,
	CNAME,
	MX,
	TXT,
	SPF,
	AAAA,
	NS,
	SRV,
	LOC;
	
	/**
	 * parse
	 * 
	 * Parse a caller-supplied type name, ignoring case.
	 * 
	 * @param value						Type name, i.e. "cname"
	 * @return							Matching type
	 * 
	 * @throws DnsInvalidInputException	Not one of the known types
	 */
	public static @NonNull DnsRecordType parse(
			@NonNull String value) throws DnsInvalidInputException
	{
		String normalized= value.trim().toUpperCase(Locale.ROOT);
		for (DnsRecordType type : values()) {
			if (type.name().equals(normalized)) {
				return type;
			}
		}
		
		throw new DnsInvalidInputException("The record type " + value + " is not valid");
	}
	
	/**
	 * parseOptional
	 * 
	 * Same as parse, but a null or blank value means no type was given.
	 */
	public static @Nullable DnsRecordType parseOptional(
			@Nullable String value) throws DnsInvalidInputException
	{
		if ((value == null) || value.isBlank()) {
			return null;
		}
		return parse(value);
	}
}
