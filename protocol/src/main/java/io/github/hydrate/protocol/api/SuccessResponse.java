package io.github.hydrate.protocol.api;

public record SuccessResponse(boolean success) {

    public static SuccessResponse ok() {
        return new SuccessResponse(true);
    }
}
