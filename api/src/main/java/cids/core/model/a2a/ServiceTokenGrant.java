package cids.core.model.a2a;

import java.util.Set;

import cids.core.model.token.IssuedToken;

/**
 * A service token issued to a source application for a target application.
 */
public record ServiceTokenGrant(
        IssuedToken token, String a2aId, String sourceClientId, String targetClientId, Set<String> scopes) {}
