package com.phillippitts.callagent.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for outbound audio pacing.
 */
@Validated
@ConfigurationProperties(prefix = "call.streaming")
public class StreamingProperties {

    /** Bytes of mu-law audio per media frame (8000 bytes is one second). */
    @Min(160)
    @Max(64_000)
    private final int chunkBytes;

    /** Delay between consecutive frames. */
    @Min(0)
    @Max(1_000)
    private final int frameDelayMs;

    /** Pause after the final response before the call is terminated. */
    @Min(0)
    @Max(10_000)
    private final int disconnectGraceMs;

    @ConstructorBinding
    public StreamingProperties(Integer chunkBytes, Integer frameDelayMs, Integer disconnectGraceMs) {
        this.chunkBytes = chunkBytes == null ? 8_000 : chunkBytes;
        this.frameDelayMs = frameDelayMs == null ? 20 : frameDelayMs;
        this.disconnectGraceMs = disconnectGraceMs == null ? 1_000 : disconnectGraceMs;
    }

    public static StreamingProperties defaults() {
        return new StreamingProperties(null, null, null);
    }

    public int getChunkBytes() { return chunkBytes; }
    public int getFrameDelayMs() { return frameDelayMs; }
    public int getDisconnectGraceMs() { return disconnectGraceMs; }
}
