package com.chainindexer.ingest.api;

public record CredentialTestResponse(boolean success, String message) {}
