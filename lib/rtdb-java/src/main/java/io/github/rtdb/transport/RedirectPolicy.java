package io.github.rtdb.transport;

import io.github.rtdb.errors.DatabaseException;

import java.util.Set;

/**
 * Redirect handling applied by {@link JdkHttpTransport}.
 * <p>
 * Every hop carries the headers of the original request, also across hosts.
 * Exceeding {@link #getMaxHops()} raises {@link io.github.rtdb.errors.RedirectLimitError}.
 */
public final class RedirectPolicy {

    /** default number of redirects followed */
    public static final int DEFAULT_MAX_HOPS = 30;

    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);

    private final int maxHops;

    private RedirectPolicy(int maxHops) {
        this.maxHops = maxHops;
    }

    /**
     * Returns the default policy.
     *
     * @return a policy following up to {@value #DEFAULT_MAX_HOPS} redirects
     */
    public static RedirectPolicy defaults() {
        return new RedirectPolicy(DEFAULT_MAX_HOPS);
    }

    /**
     * Returns a policy following up to {@code maxHops} redirects.
     *
     * @param maxHops the number of redirects to follow (0 or more)
     * @return the policy
     * @throws DatabaseException if maxHops is negative
     */
    public static RedirectPolicy maxHops(int maxHops) {
        if (maxHops < 0) {
            throw new DatabaseException("redirect limit cannot be negative");
        }
        return new RedirectPolicy(maxHops);
    }

    public int getMaxHops() {
        return maxHops;
    }

    boolean isRedirect(int status) {
        return REDIRECT_STATUSES.contains(status);
    }

    /**
     * Returns the method to use for the next hop.
     */
    String redirectMethod(int status, String method) {
        if (status == 303 && !"HEAD".equals(method)) {
            return "GET";
        }
        if ((status == 301 || status == 302) && "POST".equals(method)) {
            return "GET";
        }
        return method;
    }
}
