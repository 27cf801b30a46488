package com.questrail.penman.config;

import com.questrail.penman.codec.PenmanFormat;
import com.questrail.penman.internal.time.SystemWallClock;
import com.questrail.penman.internal.time.WallClock;
import com.questrail.penman.observability.CodecObservabilitySink;
import com.questrail.penman.observability.Slf4jCodecObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for {@link com.questrail.penman.PenmanPointerCodec}.
 *
 * <p>{@code penmanFormat} applies to Penman text the codec produces for
 * people ({@code toPenman}, {@code encodePenman}); pointer notation is always
 * written on one line.</p>
 */
public record PointerCodecConfig(
    PenmanFormat penmanFormat,
    boolean reuseZPrefixVariables,
    CodecObservabilitySink observabilitySink,
    WallClock clock
) {
    public PointerCodecConfig {
        Objects.requireNonNull(penmanFormat, "penmanFormat");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(clock, "clock");
    }

    public static PointerCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PenmanFormat penmanFormat = PenmanFormat.adaptive();
        private boolean reuseZPrefixVariables = true;
        private CodecObservabilitySink observabilitySink = new Slf4jCodecObservabilitySink();
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withPenmanFormat(PenmanFormat penmanFormat) {
            this.penmanFormat = penmanFormat;
            return this;
        }

        public Builder withReuseZPrefixVariables(boolean reuse) {
            this.reuseZPrefixVariables = reuse;
            return this;
        }

        public Builder withObservabilitySink(CodecObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public PointerCodecConfig build() {
            return new PointerCodecConfig(penmanFormat, reuseZPrefixVariables, observabilitySink, clock);
        }
    }
}
