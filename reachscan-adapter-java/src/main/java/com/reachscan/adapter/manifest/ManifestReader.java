package com.reachscan.adapter.manifest;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class ManifestReader {

    public static final String DEFAULT_FILE_NAME = "reachscan.json";

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes reachscan.json from the given path.
     *
     * @throws ManifestReadException if the file is missing or malformed
     */
    public ManifestConfig read(Path manifestPath) {
        if (!manifestPath.toFile().exists()) {
            throw new ManifestReadException("Manifest file not found: " + manifestPath);
        }
        try (Reader reader = Files.newBufferedReader(manifestPath, StandardCharsets.UTF_8)) {
            ManifestConfig config = GSON.fromJson(reader, ManifestConfig.class);
            if (config == null) {
                throw new ManifestReadException("Manifest file is empty or invalid JSON: " + manifestPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ManifestReadException("Malformed manifest " + manifestPath + ": " + e.getMessage(), e);
        } catch (NoSuchFileException e) {
            throw new ManifestReadException("Manifest file not found: " + manifestPath, e);
        } catch (IOException e) {
            throw new ManifestReadException("Failed to read manifest: " + manifestPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads {@code <projectRoot>/reachscan.json} when present; a project without one gets the
     * default configuration.
     */
    public ManifestConfig readOrDefault(Path projectRoot) {
        Path manifest = projectRoot.resolve(DEFAULT_FILE_NAME);
        return Files.exists(manifest) ? read(manifest) : new ManifestConfig();
    }

    public static class ManifestReadException extends RuntimeException {
        public ManifestReadException(String message) { super(message); }
        public ManifestReadException(String message, Throwable cause) { super(message, cause); }
    }
}
