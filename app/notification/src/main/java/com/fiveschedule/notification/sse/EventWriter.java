package com.fiveschedule.notification.sse;

import java.io.IOException;

/** Writes one frame to the client; an IOException means the client is gone. */
@FunctionalInterface
public interface EventWriter {
  void write(ServerEvent event) throws IOException;
}
