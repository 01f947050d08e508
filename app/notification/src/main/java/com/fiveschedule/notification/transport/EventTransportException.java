package com.fiveschedule.notification.transport;

/** Raised by an {@link EventTransport} when the backing broker cannot be reached. */
public class EventTransportException extends Exception {

  private static final long serialVersionUID = 1L;

  public EventTransportException(String message) {
    super(message);
  }

  public EventTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
