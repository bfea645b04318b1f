package com.m3w.store.mirror.cache;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * One file per entry in a flat directory. The filename is the URL-encoded key,
 * so {@code /api/songs/42/stream} lives in {@code %2Fapi%2Fsongs%2F42%2Fstream}.
 */
public class DirectoryBinaryCache implements BinaryCache {

    private static final String TMP_PREFIX = ".put-";

    private final Path directory;

    public DirectoryBinaryCache(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheException("Cannot create cache directory " + directory, e);
        }
    }

    Path pathOf(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key must not be empty");
        }
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8));
    }

    @Override
    public void put(String key, byte[] data) {
        Path target = pathOf(key);
        try {
            Path tmp = Files.createTempFile(directory, TMP_PREFIX, ".tmp");
            try {
                Files.write(tmp, data);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new CacheException("Failed to cache " + key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.of(Files.readAllBytes(pathOf(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheException("Failed to read cached " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(pathOf(key));
        } catch (IOException e) {
            throw new CacheException("Failed to evict " + key, e);
        }
    }

    @Override
    public Set<String> keys() {
        Set<String> keys = new TreeSet<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> !name.startsWith(TMP_PREFIX))
                    .map(name -> URLDecoder.decode(name, StandardCharsets.UTF_8))
                    .forEach(keys::add);
        } catch (IOException e) {
            throw new CacheException("Failed to list cache directory " + directory, e);
        }
        return keys;
    }
}
