package io.github.hydrate.gateway.controller;

import io.github.hydrate.protocol.api.HealthResponse;
import io.github.hydrate.runtime.config.HydrateProperties;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;

@RestController
public class StatusController {

    private static final String PAGE = """
            <html>
              <head><title>Hydrate Backend</title>
                <meta name="viewport" content="width=device-width,initial-scale=1" />
                <style>
                  body{font-family:system-ui,Segoe UI,Roboto,Arial;margin:24px;background:#071021;color:#e6eef8}
                  a{color:#9be7ff}
                  .box{max-width:780px;padding:24px;border-radius:12px;background:#071a2b;}
                </style>
              </head>
              <body>
                <div class="box">
                  <h1>Hydrate Backend</h1>
                  <p>Push reminder service is running.</p>
                  <ul>
                    <li><a href="/vapidPublicKey" target="_blank">/vapidPublicKey</a> - public VAPID key</li>
                    <li>POST <code>/subscribe</code>, <code>/addReminder</code>, <code>/deleteReminder</code>, <code>/sendNotification</code></li>
                    <li>GET <code>/user/:id/reminders</code> - reminders for a specific user</li>
                    <li>GET <code>/subs</code> - subscriber summary</li>
                    <li>GET <code>/health</code> - health check</li>
                  </ul>
                  <p>Frontend URL used in notifications: <code>%s</code></p>
                </div>
              </body>
            </html>
            """;

    private final Clock clock;
    private final HydrateProperties properties;

    public StatusController(Clock clock, HydrateProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse(true, clock.millis());
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public String index() {
        String url = properties.getFrontendUrl() != null ? properties.getFrontendUrl() : "";
        return PAGE.formatted(HtmlUtils.htmlEscape(url));
    }
}
