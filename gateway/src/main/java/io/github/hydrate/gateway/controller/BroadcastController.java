package io.github.hydrate.gateway.controller;

import io.github.hydrate.protocol.api.BroadcastResponse;
import io.github.hydrate.protocol.api.SendNotificationRequest;
import io.github.hydrate.runtime.push.BroadcastService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BroadcastController {

    private final BroadcastService broadcastService;

    public BroadcastController(BroadcastService broadcastService) {
        this.broadcastService = broadcastService;
    }

    /** Sends to every subscriber; an absent payload means the default hydration message. */
    @PostMapping("/sendNotification")
    public BroadcastResponse sendNotification(@RequestBody(required = false) SendNotificationRequest req) {
        return new BroadcastResponse(true, broadcastService.broadcast(req != null ? req.payload() : null));
    }
}
