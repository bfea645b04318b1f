package com.m3w.store.core.storage;

import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Filesystem-backed ObjectStorage for development and testing.
 *
 * <p>Layout: {@code {root}/{dir}/{tier1}/{tier2}/{name}} for a key
 * {@code {dir}/{name}}, where tier1 = name[0:2], tier2 = name[2:4].
 * The content type sits next to the object in a {@code .content-type} sidecar.
 */
@ApplicationScoped
@IfBuildProperty(name = "m3w.object-store.type", stringValue = "filesystem")
public class FilesystemObjectStorage implements ObjectStorage {

    private static final String CONTENT_TYPE_SUFFIX = ".content-type";

    @ConfigProperty(name = "m3w.object-store.filesystem.root")
    String root;

    public FilesystemObjectStorage() {
    }

    public FilesystemObjectStorage(Path root) {
        this.root = root.toString();
    }

    Path resolvePath(String key) {
        if (key == null || key.isEmpty() || key.startsWith("/") || key.contains("..")) {
            throw new IllegalArgumentException("Invalid object key: " + key);
        }
        int slash = key.lastIndexOf('/');
        String dir = slash < 0 ? "" : key.substring(0, slash);
        String name = key.substring(slash + 1);
        Path base = dir.isEmpty() ? Path.of(root) : Path.of(root, dir);
        if (name.length() < 4) {
            return base.resolve(name);
        }
        return base.resolve(name.substring(0, 2)).resolve(name.substring(2, 4)).resolve(name);
    }

    private static Path sidecar(Path path) {
        return path.resolveSibling(path.getFileName() + CONTENT_TYPE_SUFFIX);
    }

    @Override
    public Uni<Void> put(String key, byte[] data, String contentType) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(key);
            try {
                Files.createDirectories(path.getParent());
                Path tmp = Files.createTempFile(path.getParent(), ".upload-", ".tmp");
                try {
                    Files.write(tmp, data);
                    moveIntoPlace(tmp, path);
                } finally {
                    Files.deleteIfExists(tmp);
                }
                if (contentType != null) {
                    Files.writeString(sidecar(path), contentType, StandardCharsets.UTF_8);
                }
            } catch (IOException e) {
                throw new StorageException("write object", key, e);
            }
        });
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public Uni<byte[]> get(String key) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(key);
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                throw new ObjectNotFoundException(key);
            } catch (IOException e) {
                throw new StorageException("read object", key, e);
            }
        });
    }

    @Override
    public Uni<InputStream> streamRange(String key, long start, Long end) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(key);
            InputStream in = null;
            try {
                long size = Files.size(path);
                long last = end == null ? size - 1 : Math.min(end, size - 1);
                if (start < 0 || start > last + 1) {
                    throw new IllegalArgumentException("Invalid range " + start + "-" + end + " for " + key);
                }
                in = Files.newInputStream(path);
                in.skipNBytes(start);
                return (InputStream) new RangeInputStream(in, last - start + 1);
            } catch (NoSuchFileException e) {
                throw new ObjectNotFoundException(key);
            } catch (IOException e) {
                closeQuietly(in);
                throw new StorageException("open range of object", key, e);
            }
        });
    }

    private static void closeQuietly(InputStream in) {
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException suppressed) {
            // the original failure is the one reported
        }
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(key);
            try {
                boolean deleted = Files.deleteIfExists(path);
                Files.deleteIfExists(sidecar(path));
                if (deleted) {
                    pruneEmptyParents(path.getParent(), Path.of(root));
                }
                return deleted;
            } catch (IOException e) {
                throw new StorageException("delete object", key, e);
            }
        });
    }

    private void pruneEmptyParents(Path dir, Path stop) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(stop)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> Files.isRegularFile(resolvePath(key)));
    }

    @Override
    public Uni<ObjectMetadata> getMetadata(String key) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(key);
            try {
                long size = Files.size(path);
                Path typeFile = sidecar(path);
                String contentType = Files.exists(typeFile)
                        ? Files.readString(typeFile, StandardCharsets.UTF_8)
                        : "application/octet-stream";
                return new ObjectMetadata(size, contentType,
                        Files.getLastModifiedTime(path).toInstant());
            } catch (NoSuchFileException e) {
                throw new ObjectNotFoundException(key);
            } catch (IOException e) {
                throw new StorageException("stat object", key, e);
            }
        });
    }

    @Override
    public Multi<String> list(String prefix) {
        return Multi.createFrom().items(() -> {
            Path rootPath = Path.of(root);
            if (!Files.isDirectory(rootPath)) {
                return Stream.<String>empty();
            }
            List<String> keys = new ArrayList<>();
            try (Stream<Path> files = Files.walk(rootPath)) {
                files.filter(Files::isRegularFile)
                        .filter(p -> !p.getFileName().toString().endsWith(CONTENT_TYPE_SUFFIX))
                        .filter(p -> !p.getFileName().toString().startsWith(".upload-"))
                        .map(p -> toKey(rootPath.relativize(p)))
                        .filter(k -> k.startsWith(prefix))
                        .forEach(keys::add);
            } catch (IOException e) {
                throw new StorageException("list objects under", prefix, e);
            }
            keys.sort(null);
            return keys.stream();
        });
    }

    // Reverses resolvePath: drops the two tier directories.
    private static String toKey(Path relative) {
        List<String> segments = new ArrayList<>();
        for (Path p : relative) {
            segments.add(p.toString());
        }
        int n = segments.size();
        String name = segments.get(n - 1);
        List<String> dirs;
        if (name.length() >= 4 && n >= 3
                && segments.get(n - 3).equals(name.substring(0, 2))
                && segments.get(n - 2).equals(name.substring(2, 4))) {
            dirs = segments.subList(0, n - 3);
        } else {
            dirs = segments.subList(0, n - 1);
        }
        return dirs.isEmpty() ? name : String.join("/", dirs) + "/" + name;
    }
}
