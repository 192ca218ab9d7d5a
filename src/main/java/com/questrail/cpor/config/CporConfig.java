package com.questrail.cpor.config;

import com.questrail.cpor.crypto.HardwareFallbackPolicy;
import com.questrail.cpor.crypto.KeyStorageKind;
import com.questrail.cpor.protocol.codec.KindResolution;

import java.util.Objects;

/**
 * Aggregated configuration for the CPOR protocol core.
 *
 * <p>Loading values from files or the environment is the caller's concern;
 * this type only holds and validates them.</p>
 */
public record CporConfig(
    CodecConfig codec,
    CryptoConfig crypto
) {
    public CporConfig {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(crypto, "crypto");
    }

    public static CporConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxMessageSize = CodecConfig.DEFAULT_MAX_MESSAGE_SIZE;
        private KindResolution kindResolution = KindResolution.DISCRIMINANT_REQUIRED;
        private KeyStorageKind defaultStorage = KeyStorageKind.SOFTWARE;
        private HardwareFallbackPolicy fallbackPolicy = HardwareFallbackPolicy.FALL_BACK_TO_SOFTWARE;
        private int nonceSize = 16;

        public Builder withMaxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder withKindResolution(KindResolution kindResolution) {
            this.kindResolution = kindResolution;
            return this;
        }

        public Builder withDefaultStorage(KeyStorageKind defaultStorage) {
            this.defaultStorage = defaultStorage;
            return this;
        }

        public Builder withFallbackPolicy(HardwareFallbackPolicy fallbackPolicy) {
            this.fallbackPolicy = fallbackPolicy;
            return this;
        }

        public Builder withNonceSize(int nonceSize) {
            this.nonceSize = nonceSize;
            return this;
        }

        public CporConfig build() {
            return new CporConfig(
                new CodecConfig(maxMessageSize, kindResolution),
                new CryptoConfig(defaultStorage, fallbackPolicy, nonceSize));
        }
    }
}
