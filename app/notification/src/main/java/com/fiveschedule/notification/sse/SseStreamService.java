/*
 * Where: SSE fan-out
 * What: binds a Spring SseEmitter to a registered connection and pumps it on a stream thread
 * Why: each open stream blocks one thread on its queue, off the servlet request threads
 */
package com.fiveschedule.notification.sse;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Service
public class SseStreamService {

  private static final Logger logger = LoggerFactory.getLogger(SseStreamService.class);
  private static final long NO_TIMEOUT = 0L;

  private final SseConnectionManager connectionManager;
  private final SseStreamPump pump;
  private final ExecutorService streamExecutor =
      Executors.newCachedThreadPool(
          new ThreadFactoryBuilder().setNameFormat("sse-stream-%d").setDaemon(true).build());

  public SseStreamService(SseConnectionManager connectionManager, SseStreamPump pump) {
    this.connectionManager = connectionManager;
    this.pump = pump;
  }

  public SseEmitter open(String userId) {
    final SseEmitter emitter = new SseEmitter(NO_TIMEOUT);
    final SseConnection connection = connectionManager.connect(userId);
    emitter.onCompletion(connection::close);
    emitter.onTimeout(connection::close);
    emitter.onError(ex -> connection.close());
    try {
      streamExecutor.execute(() -> pump.run(connection, event -> send(emitter, event)));
    } catch (RejectedExecutionException ex) {
      connectionManager.disconnect(userId, connection);
      throw new IllegalStateException("sse stream executor is shut down", ex);
    }
    return emitter;
  }

  private void send(SseEmitter emitter, ServerEvent event) throws IOException {
    try {
      emitter.send(SseEmitter.event().name(event.name()).data(event.data(), MediaType.APPLICATION_JSON));
    } catch (IllegalStateException ex) {
      // emitter already completed by the container
      throw new IOException("sse emitter closed", ex);
    }
  }

  @PreDestroy
  public void shutdown() {
    logger.info("sse stream executor shutting down open={}", connectionManager.connectionCount());
    streamExecutor.shutdownNow();
  }
}
