package io.github.rtdb.errors;

/**
 * Thrown when a request needs more redirect hops than the transport allows.
 */
public class RedirectLimitError extends DatabaseException {

    private final int hops;

    /**
     * Creates a new RedirectLimitError.
     *
     * @param hops the number of consecutive redirects seen
     */
    public RedirectLimitError(int hops) {
        super(ErrorKind.REDIRECT_LIMIT, hops + " consecutive requests (redirects)", null);
        this.hops = hops;
    }

    /**
     * Returns the number of consecutive redirects seen.
     *
     * @return the hop count
     */
    public int getHops() {
        return hops;
    }
}
