package com.delta.adinsights.search.model;

/**
 * A domain whose provider call failed. {@code statusCode} is {@code null} for transport failures
 * and undecodable responses.
 */
public record DomainFailure(String domain, Integer statusCode, String message) {
}
