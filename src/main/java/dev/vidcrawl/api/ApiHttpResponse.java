package dev.vidcrawl.api;

/** Status and raw body of one HTTP exchange, before any classification. */
public record ApiHttpResponse(int statusCode, String body) {}
