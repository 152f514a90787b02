package io.github.hydrate.gateway.config;

import io.github.hydrate.persistence.store.JsonFileStore;
import io.github.hydrate.persistence.store.ReminderStore;
import io.github.hydrate.runtime.config.HydrateProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StoreConfig {

    @Bean
    JsonFileStore jsonFileStore(HydrateProperties properties) {
        return new JsonFileStore(properties.getStore().getPath());
    }

    @Bean
    ReminderStore reminderStore(JsonFileStore jsonFileStore) {
        return new ReminderStore(jsonFileStore);
    }
}
