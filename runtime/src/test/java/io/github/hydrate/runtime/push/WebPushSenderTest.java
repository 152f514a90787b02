package io.github.hydrate.runtime.push;

import io.github.hydrate.protocol.api.PushSubscription;
import io.github.hydrate.runtime.config.HydrateProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebPushSenderTest {

    @Test
    void withoutKeysSenderIsNotConfiguredAndRefusesToSend() {
        WebPushSender sender = new WebPushSender(new HydrateProperties());

        assertThat(sender.isConfigured()).isFalse();
        assertThatThrownBy(() -> sender.send(
                new PushSubscription("https://push/1", null, new PushSubscription.Keys("k", "a")),
                "{}", Duration.ofSeconds(1)))
                .isInstanceOf(PushSendException.class)
                .hasMessage("VAPID keys missing");
    }

    @Test
    void blankKeysCountAsMissing() {
        HydrateProperties properties = new HydrateProperties();
        properties.getVapid().setPublicKey(" ");
        properties.getVapid().setPrivateKey("");

        assertThat(properties.getVapid().hasKeys()).isFalse();
        assertThat(new WebPushSender(properties).isConfigured()).isFalse();
    }
}
