package com.fiveschedule.notification.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LocalEventTransportTest {

  private static final Duration SHORT = Duration.ofMillis(50);

  private final LocalEventTransport transport = new LocalEventTransport();

  @Test
  void deliversOnlyToMatchingSubscriptions() throws Exception {
    try (TransportSubscription all = transport.subscribe("events.*");
        TransportSubscription user = transport.subscribe("events.user.u_1")) {
      transport.publish("events.notification:sent", bytes("a"));
      transport.publish("events.user.u_1", bytes("b"));

      assertThat(text(all.poll(SHORT))).isEqualTo("a");
      assertThat(all.poll(SHORT)).isEmpty();
      assertThat(text(user.poll(SHORT))).isEqualTo("b");
    }
    assertThat(transport.subscriptionCount()).isZero();
  }

  @Test
  void unavailableTransportFailsEveryOperation() throws Exception {
    final TransportSubscription subscription = transport.subscribe("events.*");
    transport.setAvailable(false);

    assertThat(transport.ping()).isFalse();
    assertThatThrownBy(() -> transport.publish("events.x", bytes("a")))
        .isInstanceOf(EventTransportException.class);
    assertThatThrownBy(() -> transport.subscribe("events.*"))
        .isInstanceOf(EventTransportException.class);
    assertThatThrownBy(() -> subscription.poll(SHORT)).isInstanceOf(EventTransportException.class);
    subscription.close();
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  private static String text(Optional<byte[]> body) {
    assertThat(body).isPresent();
    return new String(body.get(), StandardCharsets.UTF_8);
  }
}
