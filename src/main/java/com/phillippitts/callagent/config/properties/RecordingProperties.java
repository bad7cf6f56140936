package com.phillippitts.callagent.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for dual-stream call recording.
 */
@Validated
@ConfigurationProperties(prefix = "call.recording")
public class RecordingProperties {

    /** When recording starts for a call. */
    public enum Mode {
        /** Record every call from stream start. */
        ALWAYS,
        /** Record once the caller grants permission. */
        ON_CONSENT
    }

    private final boolean enabled;

    @NotBlank
    private final String directory;

    private final Mode mode;

    @ConstructorBinding
    public RecordingProperties(Boolean enabled, String directory, Mode mode) {
        this.enabled = enabled == null || enabled;
        this.directory = (directory == null || directory.isBlank()) ? "call_recordings" : directory;
        this.mode = mode == null ? Mode.ALWAYS : mode;
    }

    public boolean isEnabled() { return enabled; }
    public String getDirectory() { return directory; }
    public Mode getMode() { return mode; }

    public Path directoryPath() {
        return Path.of(directory);
    }
}
