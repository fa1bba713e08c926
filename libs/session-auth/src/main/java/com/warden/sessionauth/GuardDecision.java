package com.warden.sessionauth;

/**
 * Outcome of an {@link AccessGuard} check.
 *
 * @param passed         whether the request may proceed to its handler
 * @param redirectTarget where to send the client with a 302 (null when passed)
 */
public record GuardDecision(boolean passed, String redirectTarget) {

    private static final GuardDecision PASSED = new GuardDecision(true, null);

    /** The request proceeds unmodified. */
    public static GuardDecision pass() {
        return PASSED;
    }

    /** The request is short-circuited with a redirect to {@code target}. */
    public static GuardDecision redirect(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("redirect target must not be null or blank");
        }
        return new GuardDecision(false, target);
    }

    public boolean redirected() {
        return !passed;
    }
}
