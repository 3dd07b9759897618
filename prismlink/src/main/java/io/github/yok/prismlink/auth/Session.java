package io.github.yok.prismlink.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.NonNull;
import lombok.Value;

/**
 * An authenticated session: the bearer token and the instant it was issued.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class Session {

    @NonNull
    String bearerToken;

    @NonNull
    Instant issuedAt;

    /**
     * Returns whether this session is older than the given maximum age.
     *
     * @param maxAge maximum session age
     * @param clock clock supplying the current instant
     * @return {@code true} if the session must be refreshed
     */
    public boolean isOlderThan(Duration maxAge, Clock clock) {
        return Duration.between(issuedAt, clock.instant()).compareTo(maxAge) > 0;
    }

    @Override
    public String toString() {
        return "Session(bearerToken=***, issuedAt=" + issuedAt + ")";
    }
}
