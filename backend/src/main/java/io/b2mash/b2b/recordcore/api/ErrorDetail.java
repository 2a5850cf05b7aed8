package io.b2mash.b2b.recordcore.api;

public record ErrorDetail(String field, String message) {}
