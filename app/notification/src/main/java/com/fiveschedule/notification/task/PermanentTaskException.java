/*
 * Where: background tasks
 * What: marks a failure that retrying cannot fix
 * Why: the runner fails such tasks at once instead of spending its retry budget
 */
package com.fiveschedule.notification.task;

public class PermanentTaskException extends RuntimeException {
  public PermanentTaskException(String message, Throwable cause) {
    super(message, cause);
  }
}
