/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import io.authflow.auth.ClientPassword;
import io.authflow.client.transport.HttpTransport;
import io.authflow.http.ClientRequest;
import io.authflow.http.HttpHeaders;
import io.authflow.http.RawResponse;
import io.authflow.http.ResponseHeaders;
import io.authflow.json.JsonMapper;
import io.authflow.signer.ClientPasswordAuthentication;
import io.authflow.signer.Signer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RequestPipelineTests {

	private static final URI RESOURCE_URI = URI.create("https://api.example.com/me");

	@Mock
	private HttpTransport transport;

	private RequestPipeline pipeline;

	private final ResponseDecoder<String> errorDecoder = ResponseDecoders.errorMessage(JsonMapper.createDefault());

	@BeforeEach
	void setUp() {
		pipeline = new RequestPipeline(transport);
	}

	private static RawResponse textResponse(int status, String body) {
		return new RawResponse(status, ResponseHeaders.of(Map.of("Content-Type", List.of("text/plain"))),
				body.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void signsBeforeSending() {
		when(transport.send(any())).thenReturn(Mono.just(textResponse(200, "hello")));
		Signer signer = new ClientPasswordAuthentication(new ClientPassword("abc", "xyz"));

		StepVerifier.create(pipeline.execute(signer, ClientRequest.get(RESOURCE_URI).build(),
				ResponseDecoders.plainText(), errorDecoder))
			.assertNext(result -> assertThat(result.toOptional()).hasValue("hello"))
			.verifyComplete();

		ArgumentCaptor<ClientRequest> sent = ArgumentCaptor.forClass(ClientRequest.class);
		verify(transport).send(sent.capture());
		assertThat(sent.getValue().header(HttpHeaders.AUTHORIZATION)).hasValue("Basic YWJjOnh5eg==");
	}

	@Test
	void nothingIsSentBeforeSubscription() {
		Mono<HttpResult<String>> result = pipeline.execute(Signer.disabled(), ClientRequest.get(RESOURCE_URI).build(),
				ResponseDecoders.plainText(), errorDecoder);

		verify(transport, never()).send(any());
		assertThat(result).isNotNull();
	}

	@Test
	void transportErrorBecomesTransportFailure() {
		when(transport.send(any())).thenReturn(Mono.error(new IOException("connection reset")));

		StepVerifier.create(pipeline.execute(Signer.disabled(), ClientRequest.get(RESOURCE_URI).build(),
				ResponseDecoders.plainText(), errorDecoder))
			.assertNext(result -> {
				assertThat(result.failure()).hasValueSatisfying(error -> {
					assertThat(error.kind()).isEqualTo(ErrorKind.TRANSPORT_FAILURE);
					assertThat(error.status()).isEqualTo(500);
				});
			})
			.verifyComplete();
	}

	@Test
	void transportThrowingBecomesTransportFailure() {
		when(transport.send(any())).thenThrow(new IllegalStateException("client closed"));

		StepVerifier.create(pipeline.execute(Signer.disabled(), ClientRequest.get(RESOURCE_URI).build(),
				ResponseDecoders.plainText(), errorDecoder))
			.assertNext(result -> assertThat(result.failure().map(HttpError::kind))
				.hasValue(ErrorKind.TRANSPORT_FAILURE))
			.verifyComplete();
	}

	@Test
	void emptyTransportSignalBecomesTransportFailure() {
		when(transport.send(any())).thenReturn(Mono.empty());

		StepVerifier.create(pipeline.execute(Signer.disabled(), ClientRequest.get(RESOURCE_URI).build(),
				ResponseDecoders.plainText(), errorDecoder))
			.assertNext(result -> assertThat(result.failure().map(HttpError::kind))
				.hasValue(ErrorKind.TRANSPORT_FAILURE))
			.verifyComplete();
	}

	@Test
	void errorStatusUsesErrorDecoder() {
		when(transport.send(any())).thenReturn(Mono.just(textResponse(403, "Forbidden for this client")));

		StepVerifier.create(pipeline.execute(Signer.disabled(), ClientRequest.get(RESOURCE_URI).build(),
				ResponseDecoders.plainText(), errorDecoder))
			.assertNext(result -> assertThat(result.failure()).hasValueSatisfying(error -> {
				assertThat(error.kind()).isEqualTo(ErrorKind.ERROR_RESPONSE);
				assertThat(error.status()).isEqualTo(403);
				assertThat(error.message()).isEqualTo("Forbidden for this client");
			}))
			.verifyComplete();
	}

	@Test
	void eachSubscriptionSendsAgain() {
		AtomicInteger calls = new AtomicInteger();
		when(transport.send(any())).thenAnswer(invocation -> Mono.fromSupplier(() -> {
			calls.incrementAndGet();
			return textResponse(200, "ok");
		}));
		Mono<HttpResult<String>> result = pipeline.execute(Signer.disabled(), ClientRequest.get(RESOURCE_URI).build(),
				ResponseDecoders.plainText(), errorDecoder);

		StepVerifier.create(result).expectNextCount(1).verifyComplete();
		StepVerifier.create(result).expectNextCount(1).verifyComplete();

		assertThat(calls).hasValue(2);
	}

	@Test
	void authorizationIsMaskedInLogs() {
		ClientRequest request = ClientRequest.get(RESOURCE_URI)
			.header(HttpHeaders.AUTHORIZATION, "Bearer secret-token")
			.header(HttpHeaders.ACCEPT, "text/plain")
			.build();

		Map<String, String> masked = RequestPipeline.maskedHeaders(request);

		assertThat(masked.get(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer ******");
		assertThat(masked.get(HttpHeaders.ACCEPT)).isEqualTo("text/plain");
	}

}
