package com.verlumen.strategylab.registry;

/** A registry read or write failed. Lineage data may be incomplete, so callers should not retry. */
public final class RegistryException extends RuntimeException {
  public RegistryException(String message) {
    super(message);
  }

  public RegistryException(String message, Throwable cause) {
    super(message, cause);
  }
}
