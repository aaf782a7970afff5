package com.acme.verify.persistence.jdbc;

/**
 * A database failure that retrying will not fix: missing tables, constraint or syntax errors, bad
 * data. Reachability problems surface as {@link com.acme.verify.core.TransportException} instead.
 */
public class PersistenceException extends RuntimeException {

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
