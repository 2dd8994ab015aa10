package com.twinforge.core.verification;

/**
 * Result of a single {@link VerificationCheck}.
 *
 * @param reason diagnostic on failure, short confirmation on success
 */
public record CheckVerdict(String name, boolean ok, String reason) {

    public static CheckVerdict ok(String name, String reason) {
        return new CheckVerdict(name, true, reason);
    }

    public static CheckVerdict fail(String name, String reason) {
        return new CheckVerdict(name, false, reason);
    }
}
