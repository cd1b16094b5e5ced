package dev.ragservice.summary;

/** Why a summary is missing or incomplete. */
public enum DegradationReason {
  CIRCUIT_OPEN,
  TIMEOUT,
  GENERATION_FAILED,
  CANCELLED
}
