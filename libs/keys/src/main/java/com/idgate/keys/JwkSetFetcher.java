package com.idgate.keys;

/**
 * Retrieves the provider's published JWK set.
 */
@FunctionalInterface
public interface JwkSetFetcher {

    /**
     * Performs one fetch. No retries.
     *
     * @return the response, including non-2xx responses
     * @throws JwkFetchException if the endpoint could not be reached or the body is unreadable
     */
    JwkSetResponse fetch();
}
