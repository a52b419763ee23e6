/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

import io.authflow.auth.ClientPassword;
import io.authflow.client.transport.JdkHttpTransport;
import io.authflow.json.JsonMapper;
import io.authflow.signer.BasicSignature;
import io.authflow.signer.ClientPasswordAuthentication;
import io.authflow.signer.OAuth1Consumer;
import io.authflow.signer.OAuth1Token;
import io.authflow.signer.Signer;
import io.authflow.util.Assert;
import io.authflow.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Settings of an {@link OAuthHttpClient}: user agent, initial signer, timeouts and JSON
 * mapper. Instances are immutable; use {@link #builder(UserAgent)} or
 * {@link #fromProperties(Properties, String)}.
 */
public final class OAuthClientConfig {

	public static final String DEFAULT_PREFIX = "authflow";

	public static final Duration DEFAULT_BLOCK_TIMEOUT = Duration.ofSeconds(60);

	private final UserAgent userAgent;

	private final Signer signer;

	private final Duration connectTimeout;

	private final Duration requestTimeout;

	private final Duration blockTimeout;

	@Nullable
	private final JsonMapper jsonMapper;

	private OAuthClientConfig(Builder builder) {
		this.userAgent = builder.userAgent;
		this.signer = builder.signer;
		this.connectTimeout = builder.connectTimeout;
		this.requestTimeout = builder.requestTimeout;
		this.blockTimeout = builder.blockTimeout;
		this.jsonMapper = builder.jsonMapper;
	}

	public static Builder builder(UserAgent userAgent) {
		return new Builder(userAgent);
	}

	/**
	 * Reads a configuration from properties. Recognized keys, under the given prefix:
	 * <ul>
	 * <li>{@code app-name} (required), {@code app-version}, {@code app-url}: the user
	 * agent;</li>
	 * <li>{@code consumer.key} and {@code consumer.secret}, optionally
	 * {@code token.value} and {@code token.secret}: an OAuth 1.0a
	 * {@link BasicSignature};</li>
	 * <li>{@code client.id} and {@code client.secret}: a
	 * {@link ClientPasswordAuthentication}, used when no consumer is configured.</li>
	 * </ul>
	 * Without credentials requests are sent unsigned.
	 * @param properties the properties
	 * @param prefix the key prefix, without trailing dot
	 * @return the configuration
	 * @throws IllegalArgumentException when {@code app-name} is missing or a credential
	 * pair is incomplete
	 */
	public static OAuthClientConfig fromProperties(Properties properties, String prefix) {
		Assert.notNull(properties, "properties must not be null");
		Assert.hasText(prefix, "prefix must not be empty");
		String appName = properties.getProperty(prefix + ".app-name");
		Assert.hasText(appName, "Missing required property: " + prefix + ".app-name");
		UserAgent userAgent = new UserAgent(appName, properties.getProperty(prefix + ".app-version"),
				properties.getProperty(prefix + ".app-url"));
		return builder(userAgent).signer(signerFromProperties(properties, prefix)).build();
	}

	/**
	 * Reads a configuration from a properties file on the classpath.
	 * @param resource the resource name, for example {@code authflow.properties}
	 * @param prefix the key prefix
	 * @return the configuration
	 * @throws IllegalArgumentException when the resource does not exist
	 * @throws UncheckedIOException when the resource cannot be read
	 * @see #fromProperties(Properties, String)
	 */
	public static OAuthClientConfig fromClasspath(String resource, String prefix) {
		Assert.hasText(resource, "resource must not be empty");
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		if (classLoader == null) {
			classLoader = OAuthClientConfig.class.getClassLoader();
		}
		try (InputStream in = classLoader.getResourceAsStream(resource)) {
			Assert.notNull(in, "Resource not found: " + resource);
			Properties properties = new Properties();
			properties.load(in);
			return fromProperties(properties, prefix);
		}
		catch (IOException ex) {
			throw new UncheckedIOException("Failed to read " + resource, ex);
		}
	}

	private static Signer signerFromProperties(Properties properties, String prefix) {
		String consumerKey = properties.getProperty(prefix + ".consumer.key");
		if (Utils.hasText(consumerKey)) {
			String consumerSecret = required(properties, prefix + ".consumer.secret");
			OAuth1Consumer consumer = new OAuth1Consumer(consumerKey, consumerSecret);
			String tokenValue = properties.getProperty(prefix + ".token.value");
			if (Utils.hasText(tokenValue)) {
				return new BasicSignature(consumer,
						new OAuth1Token(tokenValue, required(properties, prefix + ".token.secret")));
			}
			return new BasicSignature(consumer);
		}
		String clientId = properties.getProperty(prefix + ".client.id");
		if (Utils.hasText(clientId)) {
			return new ClientPasswordAuthentication(
					new ClientPassword(clientId, required(properties, prefix + ".client.secret")));
		}
		return Signer.disabled();
	}

	private static String required(Properties properties, String key) {
		String value = properties.getProperty(key);
		Assert.hasText(value, "Missing required property: " + key);
		return value;
	}

	public UserAgent userAgent() {
		return this.userAgent;
	}

	public Signer signer() {
		return this.signer;
	}

	public Duration connectTimeout() {
		return this.connectTimeout;
	}

	public Duration requestTimeout() {
		return this.requestTimeout;
	}

	/**
	 * @return how long {@link SyncOAuthHttpClient} waits for a result
	 */
	public Duration blockTimeout() {
		return this.blockTimeout;
	}

	/**
	 * Returns the configured mapper, or the one found on the classpath.
	 * @return the JSON mapper
	 */
	public JsonMapper jsonMapper() {
		return (this.jsonMapper != null) ? this.jsonMapper : JsonMapper.createDefault();
	}

	/**
	 * @return a copy of this configuration with another signer
	 */
	public OAuthClientConfig withSigner(Signer signer) {
		return toBuilder().signer(signer).build();
	}

	public Builder toBuilder() {
		Builder builder = new Builder(this.userAgent);
		builder.signer = this.signer;
		builder.connectTimeout = this.connectTimeout;
		builder.requestTimeout = this.requestTimeout;
		builder.blockTimeout = this.blockTimeout;
		builder.jsonMapper = this.jsonMapper;
		return builder;
	}

	@Override
	public String toString() {
		return "OAuthClientConfig{userAgent=" + this.userAgent.headerValue() + ", signer="
				+ this.signer.getClass().getSimpleName() + "}";
	}

	/**
	 * Builder for {@link OAuthClientConfig}.
	 */
	public static final class Builder {

		private final UserAgent userAgent;

		private Signer signer = Signer.disabled();

		private Duration connectTimeout = JdkHttpTransport.DEFAULT_CONNECT_TIMEOUT;

		private Duration requestTimeout = JdkHttpTransport.DEFAULT_REQUEST_TIMEOUT;

		private Duration blockTimeout = DEFAULT_BLOCK_TIMEOUT;

		private JsonMapper jsonMapper;

		private Builder(UserAgent userAgent) {
			Assert.notNull(userAgent, "userAgent must not be null");
			this.userAgent = userAgent;
		}

		public Builder signer(Signer signer) {
			Assert.notNull(signer, "signer must not be null");
			this.signer = signer;
			return this;
		}

		public Builder connectTimeout(Duration connectTimeout) {
			Assert.notNull(connectTimeout, "connectTimeout must not be null");
			this.connectTimeout = connectTimeout;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder blockTimeout(Duration blockTimeout) {
			Assert.notNull(blockTimeout, "blockTimeout must not be null");
			this.blockTimeout = blockTimeout;
			return this;
		}

		public Builder jsonMapper(JsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public OAuthClientConfig build() {
			return new OAuthClientConfig(this);
		}

	}

}
