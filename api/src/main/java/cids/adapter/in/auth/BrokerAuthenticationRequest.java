package cids.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

/**
 * A bearer token presented to the admin surface.
 *
 * <p>A request without a token only exists in dangerous-noop mode.
 */
public class BrokerAuthenticationRequest extends BaseAuthenticationRequest {

    private final String token;

    private BrokerAuthenticationRequest(String token) {
        this.token = token;
    }

    public static BrokerAuthenticationRequest bearer(String token) {
        return new BrokerAuthenticationRequest(token);
    }

    public static BrokerAuthenticationRequest noop() {
        return new BrokerAuthenticationRequest(null);
    }

    public String getToken() {
        return token;
    }

    public boolean isNoop() {
        return token == null;
    }
}
