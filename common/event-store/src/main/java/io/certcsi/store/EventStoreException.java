package io.certcsi.store;

/**
 * Raised when the event store cannot complete a read or write.
 */
public class EventStoreException extends RuntimeException {

  public EventStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
