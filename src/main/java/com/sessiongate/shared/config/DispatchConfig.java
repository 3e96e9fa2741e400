package com.sessiongate.shared.config;

public record DispatchConfig(int consumerBufferCapacity, int threads) {
    public static DispatchConfig defaults() {
        return new DispatchConfig(1000, 4);
    }
}
