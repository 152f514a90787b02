package io.github.hydrate.runtime.push;

import io.github.hydrate.protocol.api.PushSubscription;
import io.github.hydrate.runtime.config.HydrateProperties;
import nl.martijndwars.webpush.Notification;
import nl.martijndwars.webpush.PushService;
import nl.martijndwars.webpush.Subscription;
import org.apache.http.HttpResponse;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.Security;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link PushSender} backed by the web-push library, signing requests with the configured VAPID keys.
 */
@Component
public class WebPushSender implements PushSender {

    private static final Logger log = LoggerFactory.getLogger(WebPushSender.class);

    private final PushService pushService;

    public WebPushSender(HydrateProperties properties) {
        this.pushService = createPushService(properties.getVapid());
    }

    @Override
    public boolean isConfigured() {
        return pushService != null;
    }

    @Override
    public int send(PushSubscription subscription, String payload, Duration timeout)
            throws PushSendException, TimeoutException {
        if (pushService == null) {
            throw new PushSendException("VAPID keys missing");
        }
        if (subscription.keys() == null) {
            throw new PushSendException("subscription has no encryption keys");
        }

        Future<HttpResponse> pending;
        try {
            Subscription target = new Subscription(subscription.endpoint(),
                    new Subscription.Keys(subscription.keys().p256dh(), subscription.keys().auth()));
            pending = pushService.sendAsync(new Notification(target, payload));
        } catch (Exception e) {
            throw new PushSendException("could not prepare push message: " + e.getMessage(), e);
        }

        try {
            HttpResponse response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return response.getStatusLine().getStatusCode();
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PushSendException("push request failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new PushSendException("interrupted while waiting for push service", e);
        }
    }

    private static PushService createPushService(HydrateProperties.Vapid vapid) {
        if (!vapid.hasKeys()) {
            log.warn("VAPID keys are not set. Push will fail until configured.");
            return null;
        }
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        try {
            PushService service = new PushService(vapid.getPublicKey(), vapid.getPrivateKey(), vapid.getSubject());
            log.info("VAPID keys loaded");
            return service;
        } catch (GeneralSecurityException | RuntimeException e) {
            log.warn("Failed to set VAPID details: {}", e.getMessage());
            return null;
        }
    }
}
