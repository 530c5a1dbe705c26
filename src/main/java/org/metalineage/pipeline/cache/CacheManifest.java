package org.metalineage.pipeline.cache;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Ready manifest stored as {@code manifest.json} in every completed cache entry.
 * <p>
 * The manifest is the last file written before the entry directory is renamed into place;
 * a directory without a readable READY manifest is treated as absent.
 */
final class CacheManifest {

    static final String FILE_NAME = "manifest.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    String cacheKey;
    CacheStatus status;
    String fasta;
    String taxonomyMap;
    String createdAt;
    List<String> candidates;

    CacheManifest() {
    }

    CacheManifest(String cacheKey, CacheStatus status, String fasta, String taxonomyMap,
                  String createdAt, List<String> candidates) {
        this.cacheKey = cacheKey;
        this.status = status;
        this.fasta = fasta;
        this.taxonomyMap = taxonomyMap;
        this.createdAt = createdAt;
        this.candidates = candidates;
    }

    void write(Path directory) throws IOException {
        try (Writer writer = Files.newBufferedWriter(directory.resolve(FILE_NAME), StandardCharsets.UTF_8)) {
            GSON.toJson(this, writer);
        }
    }

    /**
     * @return the manifest, or {@code null} if the directory has none or it cannot be parsed
     */
    static CacheManifest read(Path directory) throws IOException {
        Path file = directory.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return GSON.fromJson(reader, CacheManifest.class);
        } catch (JsonParseException e) {
            return null;
        }
    }
}
