/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import io.authflow.http.ClientRequest;
import io.authflow.http.HttpHeaders;
import io.authflow.http.HttpMethod;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the OAuth 1.0a signature against the RFC 5849 example and the Twitter
 * developer documentation example.
 */
class OAuth1SignatureTests {

	private static final OAuth1Consumer TWITTER_CONSUMER = new OAuth1Consumer("xvz1evFS4wEEPTGEFPHBog",
			"kAcSOqF21Fu85e7zjz7ZN2U4ZRhfV3WpwPAoE3Z7kBw");

	private static final OAuth1Token TWITTER_TOKEN = new OAuth1Token(
			"370773112-GmHxMAgYyLbNEtIKZeRNFsMKPR9EyMZeS9weJAEb", "LswwdoUaIvS8ltyTt5jkRh4J50vUPVVHtR2YPi5kE");

	private static final String TWITTER_NONCE = "kYjzVBB8Y0ZFabxSWbWovY3uYSQ2pTgmZeNu2VS4cg";

	private static final long TWITTER_TIMESTAMP = 1318622958L;

	@Test
	void baseStringMatchesRfc5849Example() {
		List<Map.Entry<String, String>> params = List.of(Map.entry("b5", "=%3D"), Map.entry("a3", "a"),
				Map.entry("c@", ""), Map.entry("a2", "r b"), Map.entry("oauth_consumer_key", "9djdj82h48djs9d2"),
				Map.entry("oauth_token", "kkk9d7dh3k39sjv7"), Map.entry("oauth_signature_method", "HMAC-SHA1"),
				Map.entry("oauth_timestamp", "137131201"), Map.entry("oauth_nonce", "7d8f3e4a"),
				Map.entry("c2", ""), Map.entry("a3", "2 q"));

		String baseString = OAuth1Signature.signatureBaseString(HttpMethod.POST,
				URI.create("http://example.com/request?b5=%3D%253D&a3=a&c%40=&a2=r%20b"), params);

		assertThat(baseString).isEqualTo("POST&http%3A%2F%2Fexample.com%2Frequest&a2%3Dr%2520b%26a3%3D2%2520q"
				+ "%26a3%3Da%26b5%3D%253D%25253D%26c%2540%3D%26c2%3D%26oauth_consumer_key%3D9djdj82h48djs9d2"
				+ "%26oauth_nonce%3D7d8f3e4a%26oauth_signature_method%3DHMAC-SHA1%26oauth_timestamp%3D137131201"
				+ "%26oauth_token%3Dkkk9d7dh3k39sjv7");
	}

	@Test
	void baseStringUriIsNormalized() {
		assertThat(OAuth1Signature.baseStringUri(URI.create("HTTP://Example.COM:80/r%20v/X?id=123")))
			.isEqualTo("http://example.com/r%20v/X");
		assertThat(OAuth1Signature.baseStringUri(URI.create("https://www.example.net:8080/?q=1")))
			.isEqualTo("https://www.example.net:8080/");
		assertThat(OAuth1Signature.baseStringUri(URI.create("https://example.net"))).isEqualTo("https://example.net/");
	}

	@Test
	void percentEncodingFollowsRfc3986() {
		assertThat(OAuth1Signature.percentEncode("Ladies + Gentlemen")).isEqualTo("Ladies%20%2B%20Gentlemen");
		assertThat(OAuth1Signature.percentEncode("An encoded string!")).isEqualTo("An%20encoded%20string%21");
		assertThat(OAuth1Signature.percentEncode("Dogs, Cats & Mice")).isEqualTo("Dogs%2C%20Cats%20%26%20Mice");
		assertThat(OAuth1Signature.percentEncode("a*b~c")).isEqualTo("a%2Ab~c");
		assertThat(OAuth1Signature.percentEncode("☃")).isEqualTo("%E2%98%83");
	}

	@Test
	void signatureMatchesTwitterExample() {
		String header = OAuth1Signature.authorizationHeader(TWITTER_CONSUMER, TWITTER_TOKEN, HttpMethod.POST,
				URI.create("https://api.twitter.com/1.1/statuses/update.json?include_entities=true"),
				"status=Hello%20Ladies%20%2B%20Gentlemen%2C%20a%20signed%20OAuth%20request%21", TWITTER_NONCE,
				TWITTER_TIMESTAMP);

		assertThat(header).startsWith("OAuth ")
			.contains("oauth_consumer_key=\"xvz1evFS4wEEPTGEFPHBog\"")
			.contains("oauth_nonce=\"kYjzVBB8Y0ZFabxSWbWovY3uYSQ2pTgmZeNu2VS4cg\"")
			.contains("oauth_signature=\"hCtSmYh%2BiHYCEqBWrE7C7hYmtUk%3D\"")
			.contains("oauth_signature_method=\"HMAC-SHA1\"")
			.contains("oauth_timestamp=\"1318622958\"")
			.contains("oauth_token=\"370773112-GmHxMAgYyLbNEtIKZeRNFsMKPR9EyMZeS9weJAEb\"")
			.contains("oauth_version=\"1.0\"")
			.doesNotContain("include_entities")
			.doesNotContain("status");
	}

	@Test
	void basicSignatureSignsFormBody() {
		ClientRequest request = ClientRequest
			.post(URI.create("https://api.twitter.com/1.1/statuses/update.json?include_entities=true"))
			.formBody(Map.of("status", "Hello Ladies + Gentlemen, a signed OAuth request!"))
			.build();

		ClientRequest signed = new BasicSignature(TWITTER_CONSUMER, TWITTER_TOKEN).sign(request, TWITTER_NONCE,
				TWITTER_TIMESTAMP);

		assertThat(signed.header(HttpHeaders.AUTHORIZATION))
			.hasValueSatisfying(value -> assertThat(value).contains("oauth_signature=\"hCtSmYh%2BiHYCEqBWrE7C7hYmtUk%3D\""));
		assertThat(signed.body()).isEqualTo(request.body());
	}

	@Test
	void upperCaseFormContentTypeIsSignedUnderTurkishLocale() {
		ClientRequest form = ClientRequest.post(URI.create("https://api.example.com/items"))
			.formBody(Map.of("status", "hello"))
			.build();
		ClientRequest upperCase = ClientRequest.post(form.uri())
			.body(form.body(), "APPLICATION/X-WWW-FORM-URLENCODED")
			.build();
		BasicSignature signature = new BasicSignature(TWITTER_CONSUMER);
		Locale defaultLocale = Locale.getDefault();
		Locale.setDefault(Locale.forLanguageTag("tr-TR"));
		try {
			assertThat(signature.sign(upperCase, "nonce", 1L).header(HttpHeaders.AUTHORIZATION))
				.isEqualTo(signature.sign(form, "nonce", 1L).header(HttpHeaders.AUTHORIZATION));
		}
		finally {
			Locale.setDefault(defaultLocale);
		}
	}

	@Test
	void bodyIsIgnoredWhenNotFormEncoded() {
		URI uri = URI.create("https://api.example.com/items");
		ClientRequest json = ClientRequest.post(uri).body("status=x", HttpHeaders.APPLICATION_JSON).build();
		ClientRequest empty = ClientRequest.post(uri).build();
		BasicSignature signature = new BasicSignature(TWITTER_CONSUMER);

		assertThat(signature.sign(json, "nonce", 1L).header(HttpHeaders.AUTHORIZATION))
			.isEqualTo(signature.sign(empty, "nonce", 1L).header(HttpHeaders.AUTHORIZATION));
	}

	@Test
	void signingWithoutTokenOmitsTokenParameter() {
		ClientRequest signed = new BasicSignature(TWITTER_CONSUMER)
			.sign(ClientRequest.get(URI.create("https://api.example.com/items")).build());

		assertThat(signed.header(HttpHeaders.AUTHORIZATION)).hasValueSatisfying(
				value -> assertThat(value).startsWith("OAuth ").contains("oauth_signature=").doesNotContain("oauth_token"));
	}

}
