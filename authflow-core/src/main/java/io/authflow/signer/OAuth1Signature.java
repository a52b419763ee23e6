/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import io.authflow.http.HttpMethod;
import reactor.util.annotation.Nullable;

/**
 * OAuth 1.0a {@code HMAC-SHA1} signature computation.
 * <p>
 * All functions are pure: the nonce and timestamp are inputs, so the same arguments
 * always yield the same header.
 *
 * @see <a href="https://tools.ietf.org/html/rfc5849#section-3.4">RFC 5849 section
 * 3.4</a>
 */
public final class OAuth1Signature {

	public static final String SIGNATURE_METHOD = "HMAC-SHA1";

	public static final String VERSION = "1.0";

	private static final String HMAC_SHA1 = "HmacSHA1";

	private OAuth1Signature() {
	}

	/**
	 * Computes the {@code Authorization} header value for a request.
	 * @param consumer the client credentials
	 * @param token the token credentials, or {@code null} when signing without a token
	 * @param method the HTTP method
	 * @param uri the request URI, query included
	 * @param formBody the {@code application/x-www-form-urlencoded} body, or {@code null}
	 * when the request has no form body
	 * @param nonce a random string unique to this request
	 * @param timestamp seconds since the epoch
	 * @return the {@code OAuth ...} header value
	 */
	public static String authorizationHeader(OAuth1Consumer consumer, @Nullable OAuth1Token token, HttpMethod method,
			URI uri, @Nullable String formBody, String nonce, long timestamp) {

		List<Map.Entry<String, String>> protocolParams = new ArrayList<>();
		protocolParams.add(Map.entry("oauth_consumer_key", consumer.key()));
		protocolParams.add(Map.entry("oauth_nonce", nonce));
		protocolParams.add(Map.entry("oauth_signature_method", SIGNATURE_METHOD));
		protocolParams.add(Map.entry("oauth_timestamp", Long.toString(timestamp)));
		if (token != null) {
			protocolParams.add(Map.entry("oauth_token", token.value()));
		}
		protocolParams.add(Map.entry("oauth_version", VERSION));

		List<Map.Entry<String, String>> params = new ArrayList<>(protocolParams);
		params.addAll(decodePairs(uri.getRawQuery()));
		params.addAll(decodePairs(formBody));

		String baseString = signatureBaseString(method, uri, params);
		String signature = sign(baseString, consumer.secret(), token != null ? token.secret() : null);

		protocolParams.add(Map.entry("oauth_signature", signature));
		return "OAuth " + protocolParams.stream()
			.sorted(Map.Entry.comparingByKey())
			.map(e -> percentEncode(e.getKey()) + "=\"" + percentEncode(e.getValue()) + "\"")
			.collect(Collectors.joining(", "));
	}

	/**
	 * Builds the signature base string: {@code METHOD&enc(base-uri)&enc(params)}.
	 * @param method the HTTP method
	 * @param uri the request URI; its query is ignored here, pass query parameters in
	 * {@code params}
	 * @param params every decoded parameter taking part in the signature
	 * @return the signature base string
	 */
	public static String signatureBaseString(HttpMethod method, URI uri, List<Map.Entry<String, String>> params) {
		return method.name() + "&" + percentEncode(baseStringUri(uri)) + "&"
				+ percentEncode(normalizeParameters(params));
	}

	/**
	 * Normalizes parameters: each name and value percent-encoded, sorted by name then
	 * value, joined as {@code name=value} pairs with {@code &}.
	 * @param params the decoded parameters
	 * @return the normalized parameter string
	 */
	public static String normalizeParameters(List<Map.Entry<String, String>> params) {
		return params.stream()
			.map(e -> Map.entry(percentEncode(e.getKey()), percentEncode(e.getValue())))
			.sorted(Comparator.<Map.Entry<String, String>, String>comparing(Map.Entry::getKey)
				.thenComparing(Map.Entry::getValue))
			.map(e -> e.getKey() + "=" + e.getValue())
			.collect(Collectors.joining("&"));
	}

	/**
	 * The base string URI: lowercase scheme and host, default ports dropped, no query or
	 * fragment.
	 * @param uri the request URI
	 * @return the base string URI
	 */
	public static String baseStringUri(URI uri) {
		String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
		String host = uri.getHost().toLowerCase(Locale.ROOT);
		int port = uri.getPort();
		boolean defaultPort = port == -1 || ("http".equals(scheme) && port == 80)
				|| ("https".equals(scheme) && port == 443);
		String path = uri.getRawPath();
		if (path == null || path.isEmpty()) {
			path = "/";
		}
		return scheme + "://" + host + (defaultPort ? "" : ":" + port) + path;
	}

	/**
	 * Signs a base string with {@code HMAC-SHA1}.
	 * @param baseString the signature base string
	 * @param consumerSecret the consumer secret
	 * @param tokenSecret the token secret, or {@code null}
	 * @return the base64 encoded signature
	 */
	public static String sign(String baseString, String consumerSecret, @Nullable String tokenSecret) {
		String key = percentEncode(consumerSecret) + "&" + (tokenSecret != null ? percentEncode(tokenSecret) : "");
		try {
			Mac mac = Mac.getInstance(HMAC_SHA1);
			mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_SHA1));
			byte[] digest = mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
			return Base64.getEncoder().encodeToString(digest);
		}
		catch (NoSuchAlgorithmException | InvalidKeyException e) {
			throw new IllegalStateException("HMAC-SHA1 signing not available", e);
		}
	}

	/**
	 * RFC 3986 percent-encoding, leaving only unreserved characters as they are.
	 * @param value the value to encode
	 * @return the encoded value
	 */
	public static String percentEncode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8)
			.replace("+", "%20")
			.replace("*", "%2A")
			.replace("%7E", "~");
	}

	// Repeated names are all kept, they all take part in the signature.
	private static List<Map.Entry<String, String>> decodePairs(@Nullable String encoded) {
		List<Map.Entry<String, String>> pairs = new ArrayList<>();
		if (encoded == null || encoded.isEmpty()) {
			return pairs;
		}
		for (String pair : encoded.split("&")) {
			if (pair.isEmpty()) {
				continue;
			}
			int idx = pair.indexOf('=');
			String name = (idx >= 0) ? pair.substring(0, idx) : pair;
			String value = (idx >= 0) ? pair.substring(idx + 1) : "";
			pairs.add(Map.entry(URLDecoder.decode(name, StandardCharsets.UTF_8),
					URLDecoder.decode(value, StandardCharsets.UTF_8)));
		}
		return pairs;
	}

}
