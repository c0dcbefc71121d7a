package com.al.graphsubscriptions.service.auth;

import com.al.graphsubscriptions.exception.TokenAcquisitionException;

public interface TokenProvider {

    /**
     * Credential acting on behalf of the session's user.
     *
     * @throws TokenAcquisitionException if no usable credential is available
     */
    AccessToken getDelegatedToken(UserSession session);

    /**
     * Credential acting as the service itself, independent of any user.
     *
     * @throws TokenAcquisitionException if the identity platform refuses or cannot be reached
     */
    AccessToken getApplicationToken();
}
