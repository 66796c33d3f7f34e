package dev.vidcrawl.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserInfoRequest(@JsonProperty("username") String username) {}
