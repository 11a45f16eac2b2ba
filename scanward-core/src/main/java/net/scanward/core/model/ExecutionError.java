package net.scanward.core.model;

public record ExecutionError(String message, String code) {}
