package io.trackimport.pipeline.ir;

/**
 * Result of one invocation: objects the remote side reported as processed, the confirmed offset reached
 * and whether the whole blob has been imported.
 */
public record ImportOutcome(long objectsSent, long bytesRead, boolean finished) {}
