/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

/**
 * Error codes produced locally while parsing authorization redirects. Errors returned by
 * the authorization server are passed through as they are.
 */
public final class AuthorizationErrors {

	public static final String MISSING_REQUIRED_STATE_PARAMETER = "missing_required_state_parameter";

	public static final String STATE_PARAMETER_MISMATCH = "state_parameter_mismatch";

	public static final String MISSING_REQUIRED_QUERY_PARAMETERS = "missing_required_query_parameters";

	public static final String MISSING_ACCESS_TOKEN = "missing_access_token";

	public static final String MISSING_TOKEN_TYPE = "missing_token_type";

	public static final String MISSING_EXPIRES_IN = "missing_expires_in";

	public static final String INVALID_EXPIRES_IN = "invalid_expires_in";

	private AuthorizationErrors() {
	}

}
