package com.teaglu.dnsclient.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.teaglu.dnsclient.dns.DnsRecord;
import com.teaglu.dnsclient.dns.DnsRecordType;
import com.teaglu.dnsclient.dns.exception.DnsAuthenticationException;
import com.teaglu.dnsclient.dns.exception.DnsTransportException;

public class JsonSerializerTest {
	@Test
	void recordsLeaveOutMissingMembers() {
		JsonArray array= JsonSerializer.serialize(List.of(
				DnsRecord.Create("1", DnsRecordType.A, "www.example.com", 1, "10.0.0.1", null),
				DnsRecord.Create("2", DnsRecordType.MX, "example.com", 300, "mx.example.com", 10)));
		
		JsonObject first= array.get(0).getAsJsonObject();
		assertThat(first.get("rec_id").getAsString()).isEqualTo("1");
		assertThat(first.get("type").getAsString()).isEqualTo("A");
		assertThat(first.has("prio")).isFalse();
		
		JsonObject second= array.get(1).getAsJsonObject();
		assertThat(second.get("ttl").getAsInt()).isEqualTo(300);
		assertThat(second.get("prio").getAsInt()).isEqualTo(10);
	}
	
	@Test
	void exceptionsCarryKindAndResult() {
		JsonObject obj= JsonSerializer.serialize(
				new DnsAuthenticationException("error", "Invalid API key"));
		
		assertThat(obj.get("message").getAsString()).isEqualTo("Invalid API key");
		assertThat(obj.get("kind").getAsString()).isEqualTo("AUTHENTICATION");
		assertThat(obj.get("result").getAsString()).isEqualTo("error");
	}
	
	@Test
	void causesAreNested() {
		JsonObject obj= JsonSerializer.serialize(
				new DnsTransportException("Unable to reach API", new java.io.IOException("refused")));
		
		assertThat(obj.get("kind").getAsString()).isEqualTo("TRANSPORT");
		assertThat(obj.has("result")).isFalse();
		assertThat(obj.getAsJsonObject("cause").get("message").getAsString()).isEqualTo("refused");
	}
}
