package com.lexgate.core.scanner;

/**
 * A task function could not examine one file. The file is skipped for that function only.
 */
public record DetectorFailure(String tfId, String file, String reason) {}
