package com.delta.adinsights.search.model;

/**
 * A keyphrase with a back-reference to the ad it was extracted from.
 */
public record PhraseInfo(String phrase, String adTitle, String adUrl, String creativeId) {
}
