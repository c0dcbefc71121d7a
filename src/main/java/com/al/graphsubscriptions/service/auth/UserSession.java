package com.al.graphsubscriptions.service.auth;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The signed-in caller as seen by this service: the application's user id and the bearer token the client
 * obtained for Graph on the user's behalf.
 */
@Getter
@AllArgsConstructor
public class UserSession {

    private final String userId;
    private final String bearerToken;
}
