package com.teaglu.dnsclient.dns.cloudflare;

import static com.teaglu.dnsclient.dns.cloudflare.FakeCloudflareTransport.error;
import static com.teaglu.dnsclient.dns.cloudflare.FakeCloudflareTransport.page;
import static com.teaglu.dnsclient.dns.cloudflare.FakeCloudflareTransport.record;
import static com.teaglu.dnsclient.dns.cloudflare.FakeCloudflareTransport.success;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.teaglu.dnsclient.config.ClientConfig;
import com.teaglu.dnsclient.dns.DnsRecord;
import com.teaglu.dnsclient.dns.DnsRecordType;
import com.teaglu.dnsclient.dns.exception.DnsApiException;
import com.teaglu.dnsclient.dns.exception.DnsAuthenticationException;
import com.teaglu.dnsclient.dns.exception.DnsErrorKind;
import com.teaglu.dnsclient.dns.exception.DnsException;
import com.teaglu.dnsclient.dns.exception.DnsInvalidInputException;

public class CloudflareDnsClientImplTest {
	private static final String CREDENTIALS= "tkn=KEY&email=ops%40contoso.com";
	
	private FakeCloudflareTransport transport;
	private CloudflareDnsClient client;
	
	@BeforeEach
	void setUp() throws Exception {
		transport= new FakeCloudflareTransport();
		client= CloudflareDnsClientImpl.Create(
				ClientConfig.Create("https://api.test/api_json.html", "ops@contoso.com", "KEY"),
				transport);
	}
	
	@Test
	void listAggregatesPagesWithoutDuplicates() throws Exception {
		transport.respond(page(true,
				record("1", "A", "example.com", "10.0.0.1"),
				record("2", "A", "www.example.com", "10.0.0.2")));
		transport.respond(page(false,
				record("3", "TXT", "www.example.com", "hello"),
				record("4", "A", "api.example.com", "10.0.0.4")));
		
		List<DnsRecord> records= client.listRecords("example.com");
		
		assertThat(records).extracting(DnsRecord::getName)
				.containsExactly("example.com", "www.example.com", "api.example.com");
		assertThat(records).extracting(DnsRecord::getId).containsExactly("1", "2", "4");
		
		assertThat(transport.getQueries()).containsExactly(
				"?a=rec_load_all&" + CREDENTIALS + "&z=example.com",
				"?a=rec_load_all&" + CREDENTIALS + "&z=example.com&o=2");
	}
	
	@Test
	void offsetAccumulatesAcrossPages() throws Exception {
		transport.respond(page(true, record("1", "A", "a.example.com", "10.0.0.1")));
		transport.respond(page(true,
				record("2", "A", "b.example.com", "10.0.0.2"),
				record("3", "A", "c.example.com", "10.0.0.3")));
		transport.respond(page(false));
		
		assertThat(client.listRecords("example.com")).hasSize(3);
		assertThat(transport.getQueries().get(1)).endsWith("&o=1");
		assertThat(transport.getQueries().get(2)).endsWith("&o=3");
	}
	
	@Test
	void listFiltersByTypeForSubdomain() throws Exception {
		transport.respond(page(false,
				record("7", "CNAME", "sub.example.com", "target.example.net"),
				record("8", "A", "sub.example.com", "10.1.1.1"),
				record("9", "A", "www.example.com", "10.1.1.2")));
		
		List<DnsRecord> records= client.listRecords("sub.example.com", "a");
		
		assertThat(records).hasSize(1);
		assertThat(records.get(0).getId()).isEqualTo("8");
		assertThat(records.get(0).getType()).isEqualTo(DnsRecordType.A);
		assertThat(records.get(0).getContent()).isEqualTo("10.1.1.1");
		
		// The zone is always the registrable domain
		assertThat(transport.getQueries().get(0)).endsWith("&z=example.com");
	}
	
	@Test
	void listUsesPlainSubstringMatch() throws Exception {
		transport.respond(page(false,
				record("1", "A", "example.com", "10.0.0.1"),
				record("2", "A", "notexample.com", "10.0.0.2")));
		
		assertThat(client.listRecords("example.com")).extracting(DnsRecord::getId)
				.containsExactly("1", "2");
	}
	
	@Test
	void listStopsAtPageLimit() throws Exception {
		client= CloudflareDnsClientImpl.Create(
				ClientConfig.Create("https://api.test/api_json.html", "ops@contoso.com", "KEY", 2),
				transport);
		
		transport.respond(page(true, record("1", "A", "a.example.com", "10.0.0.1")));
		transport.respond(page(true, record("2", "A", "b.example.com", "10.0.0.2")));
		transport.respond(page(false, record("3", "A", "c.example.com", "10.0.0.3")));
		
		assertThatThrownBy(() -> client.listRecords("example.com"))
				.isExactlyInstanceOf(DnsApiException.class)
				.hasMessageContaining("more than 2 pages");
		assertThat(transport.getQueries()).hasSize(2);
	}
	
	@Test
	void listRejectsMorePagesWithoutRecords() {
		transport.respond(success("{\"recs\":{\"has_more\":true,\"count\":0,\"objs\":[]}}"));
		
		assertThatThrownBy(() -> client.listRecords("example.com"))
				.isExactlyInstanceOf(DnsApiException.class);
		assertThat(transport.getQueries()).hasSize(1);
	}
	
	@Test
	void listSurfacesAuthenticationError() {
		transport.respond(error("Invalid credentials", "E_UNAUTH"));
		
		assertThatThrownBy(() -> client.listRecords("example.com"))
				.isInstanceOfSatisfying(DnsAuthenticationException.class, e -> {
					assertThat(e.getMessage()).isEqualTo("Invalid credentials");
					assertThat(e.getKind()).isEqualTo(DnsErrorKind.AUTHENTICATION);
				});
	}
	
	@Test
	void transportFailureIsTransportKind() {
		assertThatThrownBy(() -> client.listRecords("example.com"))
				.isInstanceOfSatisfying(DnsException.class,
						e -> assertThat(e.getKind()).isEqualTo(DnsErrorKind.TRANSPORT));
	}
	
	@ParameterizedTest
	@ValueSource(strings= { "PTR", "SOA", "bogus" })
	void unknownTypesFailBeforeAnyRequest(String type) {
		assertThatThrownBy(() -> client.listRecords("www.example.com", type))
				.isInstanceOf(DnsInvalidInputException.class);
		assertThatThrownBy(() -> client.createRecord("www.example.com", "10.0.0.1", type, 1, 0))
				.isInstanceOf(DnsInvalidInputException.class);
		assertThatThrownBy(() -> client.deleteRecords("www.example.com", type))
				.isInstanceOf(DnsInvalidInputException.class);
		
		assertThat(transport.getQueries()).isEmpty();
	}
	
	@Test
	void createSendsRecordAndListsAfterwards() throws Exception {
		transport.respond(success("{\"rec\":{\"obj\":{\"rec_id\":\"55\"}}}"));
		transport.respond(page(false, record("55", "A", "www.example.com", "10.0.0.5")));
		
		List<DnsRecord> records= client.createRecord("WWW.Example.com", "10.0.0.5");
		
		assertThat(transport.getQueries()).hasSize(2);
		assertThat(transport.getQueries().get(0)).isEqualTo(
				"?a=rec_new&" + CREDENTIALS + "&z=example.com&type=A&name=www" +
				"&content=10.0.0.5&ttl=1");
		assertThat(transport.getQueries().get(1)).startsWith("?a=rec_load_all&");
		
		// The listing searches for the name as given, and provider names are lower case
		assertThat(records).isEmpty();
	}
	
	@Test
	void createReturnsCurrentStateOfName() throws Exception {
		transport.respond(success("{}"));
		transport.respond(page(false,
				record("55", "AAAA", "v6.example.com", "2001:db8::5"),
				record("56", "A", "www.example.com", "10.0.0.6")));
		
		List<DnsRecord> records= client.createRecord(
				"v6.example.com", "2001:db8::5", "aaaa", 300, 0);
		
		assertThat(records).extracting(DnsRecord::getId).containsExactly("55");
		assertThat(transport.getQueries().get(0)).contains("&type=AAAA&name=v6&")
				.endsWith("&ttl=300");
	}
	
	@Test
	void createSendsPriorityOnlyWhenNonZero() throws Exception {
		transport.respond(success("{}"));
		transport.respond(page(false));
		
		client.createRecord("mail.example.com", "10.0.0.9", "MX", 1, 10);
		
		assertThat(transport.getQueries().get(0)).endsWith("&ttl=1&prio=10");
	}
	
	@ParameterizedTest
	@ValueSource(strings= { "A", "CNAME", "TXT" })
	void createRequiresAddressLiteralForEveryType(String type) {
		assertThatThrownBy(() -> client.createRecord("www.example.com", "target.example.net", type, 1, 0))
				.isInstanceOf(DnsInvalidInputException.class)
				.hasMessageContaining("IP address");
		
		assertThat(transport.getQueries()).isEmpty();
	}
	
	@Test
	void createRequiresNameAndContent() {
		assertThatThrownBy(() -> client.createRecord("", "10.0.0.1"))
				.isInstanceOf(DnsInvalidInputException.class);
		assertThatThrownBy(() -> client.createRecord("www.example.com", ""))
				.isInstanceOf(DnsInvalidInputException.class);
		
		assertThat(transport.getQueries()).isEmpty();
	}
	
	@Test
	void addressLiteralCheckDoesNoLookup() {
		assertThat(CloudflareDnsClientImpl.isAddressLiteral("192.168.1.10")).isTrue();
		assertThat(CloudflareDnsClientImpl.isAddressLiteral("::1")).isTrue();
		assertThat(CloudflareDnsClientImpl.isAddressLiteral("2001:db8::1")).isTrue();
		assertThat(CloudflareDnsClientImpl.isAddressLiteral("256.1.1.1")).isFalse();
		assertThat(CloudflareDnsClientImpl.isAddressLiteral("localhost")).isFalse();
	}
	
	@ParameterizedTest
	@ValueSource(strings= { "", "A", "a" })
	void deleteOfBareDomainARecordIsRefused(String type) {
		assertThatThrownBy(() -> client.deleteRecords("example.com", type.isEmpty() ? null : type))
				.isInstanceOf(DnsInvalidInputException.class);
		assertThatThrownBy(() -> client.deleteRecords("Example.com", type.isEmpty() ? null : type))
				.isInstanceOf(DnsInvalidInputException.class);
		
		assertThat(transport.getQueries()).isEmpty();
	}
	
	@Test
	void deleteOfOtherTypeOnBareDomainIsAllowed() throws Exception {
		transport.respond(page(false,
				record("11", "MX", "example.com", "mx.example.com"),
				record("12", "A", "www.example.com", "10.0.0.2")));
		transport.respond(success("{}"));
		
		assertThat(client.deleteRecords("example.com", "MX")).isEmpty();
		assertThat(transport.getQueries()).containsExactly(
				"?a=rec_load_all&" + CREDENTIALS + "&z=example.com",
				"?a=rec_delete&" + CREDENTIALS + "&z=example.com&id=11");
	}
	
	@Test
	void deleteRemovesEachMatchingRecord() throws Exception {
		transport.respond(page(false,
				record("21", "A", "www.example.com", "10.0.0.1"),
				record("22", "CNAME", "cdn.www.example.com", "edge.example.net"),
				record("23", "A", "api.example.com", "10.0.0.3")));
		transport.respond(success("{}"));
		transport.respond(success("{}"));
		
		List<DnsRecord> result= client.deleteRecords("www.example.com");
		
		assertThat(result).isEmpty();
		assertThat(transport.getQueries()).hasSize(3);
		assertThat(transport.getQueries().get(1)).endsWith("&id=21");
		assertThat(transport.getQueries().get(2)).endsWith("&id=22");
	}
	
	@Test
	void deleteStopsAtFirstFailure() {
		transport.respond(page(false,
				record("31", "A", "old.example.com", "10.0.0.1"),
				record("32", "A", "x.old.example.com", "10.0.0.2")));
		transport.respond(error("Too many calls", "E_MAXAPI"));
		transport.respond(success("{}"));
		
		assertThatThrownBy(() -> client.deleteRecords("old.example.com", "A"))
				.isInstanceOfSatisfying(DnsException.class,
						e -> assertThat(e.getKind()).isEqualTo(DnsErrorKind.RATE_LIMIT));
		assertThat(transport.getQueries()).hasSize(2);
	}
}
