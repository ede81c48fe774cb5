package decentralabs.handoff.service.auth;

import decentralabs.handoff.dto.JsonWebKeySet;
import decentralabs.handoff.exception.AssertionVerificationException;

/**
 * Source of the identity provider's published key set.
 */
@FunctionalInterface
public interface JwksClient {

    JsonWebKeySet fetch() throws AssertionVerificationException;
}
