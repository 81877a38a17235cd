package com.lexgate.core.verify;

/**
 * Result of one external check.
 *
 * @param exitCode process exit code, or -1 when the process did not exit on its own
 * @param output   tail of the combined stdout and stderr
 */
public record CheckOutcome(String name, VerifyStatus status, int exitCode, String output, long durationMs) {}
