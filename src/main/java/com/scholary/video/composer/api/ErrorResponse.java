package com.scholary.video.composer.api;

/** Error body returned for every rejected request. */
public record ErrorResponse(String error, String message) {}
