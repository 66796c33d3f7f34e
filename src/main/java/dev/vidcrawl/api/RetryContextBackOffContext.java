package dev.vidcrawl.api;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;

/** Gives a back-off policy access to the failure and attempt count of the current retry. */
record RetryContextBackOffContext(RetryContext retryContext) implements BackOffContext {}
