package com.teaglu.dnsclient.dns;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.eclipse.jdt.annotation.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DomainNameParser
 * 
 * Splits a fully qualified name into the registrable domain (the zone at the provider) and the
 * subdomain part in front of it.  This is a pattern match, not a public suffix lookup: the TLD
 * part may hold dots as long as it stays within six characters, so www.contoso.co.uk yields
 * contoso.co.uk but a longer suffix is not recognized.
 */
public final class DomainNameParser {
	private static final Logger log= LoggerFactory.getLogger(DomainNameParser.class);
	
	// Label of 2-64 characters followed by a 2-6 character TLD, which may contain dots
	private static final Pattern DOMAIN_PATTERN= Pattern.compile(
			"(?<domain>[a-z0-9][a-z0-9\\-]{1,63}\\.[a-z\\.]{2,6})$",
			Pattern.CASE_INSENSITIVE);
	
	private DomainNameParser() {}
	
	/**
	 * extractDomain
	 * 
	 * Return the registrable domain with its TLD, with case preserved.  If the input doesn't look
	 * like a domain at all it is returned unchanged.
	 * 
	 * @param name						Full name, i.e. a.b.contoso.com
	 * @return							Domain, i.e. contoso.com
	 */
	public static @NonNull String extractDomain(@NonNull String name) {
		Matcher matcher= DOMAIN_PATTERN.matcher(name);
		if (matcher.find()) {
			String domain= matcher.group("domain");
			if (domain != null) {
				return domain;
			}
		}
		
		log.warn("Unable to find a registrable domain in " + name + ", using it as is");
		return name;
	}
	
	/**
	 * extractSubdomain
	 * 
	 * Return everything in front of the registrable domain without the trailing dot, or an
	 * empty string if the name is the domain itself.
	 * 
	 * @param name						Full name, i.e. a.b.contoso.com
	 * @return							Subdomain, i.e. a.b
	 */
	public static @NonNull String extractSubdomain(@NonNull String name) {
		String domain= extractDomain(name);
		
		int position= name.indexOf(domain);
		if (position <= 0) {
			return "";
		}
		
		int end= position;
		while ((end > 0) && (name.charAt(end - 1) == '.')) {
			end--;
		}
		
		return name.substring(0, end);
	}
}
