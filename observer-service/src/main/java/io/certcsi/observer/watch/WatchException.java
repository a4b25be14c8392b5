package io.certcsi.observer.watch;

public class WatchException extends RuntimeException {

  public WatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
