package io.github.hydrate.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings bound from {@code hydrate.*}; the defaults in {@code application.yml} map them to
 * the {@code VAPID_*}, {@code FRONTEND_URL} and {@code HYDRATE_DB_PATH} environment variables.
 */
@ConfigurationProperties(prefix = "hydrate")
public class HydrateProperties {

    private String frontendUrl = "https://rahulmm22.github.io/hydrate-frontend";

    private final Vapid vapid = new Vapid();
    private final Store store = new Store();
    private final Push push = new Push();
    private final Scheduler scheduler = new Scheduler();
    private final Http http = new Http();

    public String getFrontendUrl() { return frontendUrl; }
    public void setFrontendUrl(String frontendUrl) { this.frontendUrl = frontendUrl; }

    public Vapid getVapid() { return vapid; }
    public Store getStore() { return store; }
    public Push getPush() { return push; }
    public Scheduler getScheduler() { return scheduler; }
    public Http getHttp() { return http; }

    public static class Vapid {
        private String publicKey;
        private String privateKey;
        private String subject = "mailto:you@example.com";

        public String getPublicKey() { return publicKey; }
        public void setPublicKey(String publicKey) { this.publicKey = publicKey; }

        public String getPrivateKey() { return privateKey; }
        public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }

        public String getSubject() { return subject; }
        public void setSubject(String subject) { this.subject = subject; }

        public boolean hasKeys() {
            return publicKey != null && !publicKey.isBlank()
                    && privateKey != null && !privateKey.isBlank();
        }
    }

    public static class Store {
        private Path path = Path.of("/data/db.json");

        public Path getPath() { return path; }
        public void setPath(Path path) { this.path = path; }
    }

    public static class Push {
        private Duration sendTimeout = Duration.ofSeconds(10);

        public Duration getSendTimeout() { return sendTimeout; }
        public void setSendTimeout(Duration sendTimeout) { this.sendTimeout = sendTimeout; }
    }

    public static class Scheduler {
        private String cron = "0 * * * * *";
        private Duration tickBudget = Duration.ofSeconds(50);

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }

        public Duration getTickBudget() { return tickBudget; }
        public void setTickBudget(Duration tickBudget) { this.tickBudget = tickBudget; }
    }

    public static class Http {
        private DataSize maxBodySize = DataSize.ofKilobytes(256);

        public DataSize getMaxBodySize() { return maxBodySize; }
        public void setMaxBodySize(DataSize maxBodySize) { this.maxBodySize = maxBodySize; }
    }
}
