package com.dbseed.configuration.model;

/**
 * Yields JDBC connection URL of a database resource. May fail or return null if the resource cannot provide it yet.
 */
@FunctionalInterface
public interface ConnectionUrlProvider {
    String getConnectionUrl() throws Exception;
}
