package com.phillippitts.callagent.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the pre-recorded snippet library.
 *
 * <p>Manifest filenames use {@code sourceExtension}; the pre-encoded payloads on disk use
 * {@code payloadExtension}.
 */
@Validated
@ConfigurationProperties(prefix = "call.audio-library")
public class AudioLibraryProperties {

    @NotBlank
    private final String manifestPath;

    @NotBlank
    private final String audioDirectory;

    private final String sourceExtension;

    private final String payloadExtension;

    @ConstructorBinding
    public AudioLibraryProperties(String manifestPath,
                                  String audioDirectory,
                                  String sourceExtension,
                                  String payloadExtension) {
        this.manifestPath = (manifestPath == null || manifestPath.isBlank())
                ? "audio_snippets.json" : manifestPath;
        this.audioDirectory = (audioDirectory == null || audioDirectory.isBlank())
                ? "audio_ulaw" : audioDirectory;
        this.sourceExtension = sourceExtension == null ? ".mp3" : sourceExtension;
        this.payloadExtension = payloadExtension == null ? ".ulaw" : payloadExtension;
    }

    public String getManifestPath() { return manifestPath; }
    public String getAudioDirectory() { return audioDirectory; }
    public String getSourceExtension() { return sourceExtension; }
    public String getPayloadExtension() { return payloadExtension; }
}
