package com.example.chat.realtime.service.auth;

import reactor.core.publisher.Mono;

/**
 * Resolves a bearer credential to the id of the user it was issued to.
 */
public interface TokenVerifier {

    /**
     * @return the user id, or an error of type
     * {@link com.example.chat.shared.exception.AuthenticationException} if the token is missing,
     * malformed, expired or not trusted
     */
    Mono<String> verify(String token);
}
