package io.github.hydrate.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliveryResultDto(
        String endpoint,
        boolean success,
        String error
) {
    public static DeliveryResultDto delivered(String endpoint) {
        return new DeliveryResultDto(endpoint, true, null);
    }

    public static DeliveryResultDto failed(String endpoint, String error) {
        return new DeliveryResultDto(endpoint, false, error);
    }
}
