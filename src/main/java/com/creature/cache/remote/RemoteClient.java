package com.creature.cache.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Client for the remote GraphQL data source.
 * Implementations are long-lived and safe to share between threads.
 */
public interface RemoteClient {

    /**
     * Runs a GraphQL query.
     *
     * @param query     the query document
     * @param variables query variables
     * @return the {@code data} member of the response
     * @throws RemoteClientException on transport failure, a non-success status,
     *                               GraphQL errors, or an unreadable response
     */
    JsonNode execute(String query, Map<String, Object> variables);

    /**
     * Endpoint the client talks to, for logs and health reporting.
     */
    String getEndpoint();
}
