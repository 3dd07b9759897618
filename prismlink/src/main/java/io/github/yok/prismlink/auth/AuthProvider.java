package io.github.yok.prismlink.auth;

/**
 * Supplies bearer tokens for Prism REST calls.
 *
 * <p>
 * Implementations own the refresh policy. Callers ask for a token before each request and never
 * refresh it themselves; a returned token may still be rejected by the service, in which case
 * {@link #invalidate()} forces a refresh on the next request.
 * </p>
 */
public interface AuthProvider {

    /**
     * Returns a bearer token, refreshing the session first when the policy requires it.
     *
     * @return bearer token, or an empty string when no token could be obtained
     */
    String bearerToken();

    /**
     * Drops the current session so that the next {@link #bearerToken()} call refreshes it.
     */
    void invalidate();
}
