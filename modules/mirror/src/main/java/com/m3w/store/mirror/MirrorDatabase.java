package com.m3w.store.mirror;

import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * SQLite bootstrapper for the offline mirror.
 *
 * <p>Every handle opens its own connection; WAL plus a busy timeout lets
 * readers proceed while one writer holds the lock.
 */
public final class MirrorDatabase {

    private static final Logger log = Logger.getLogger(MirrorDatabase.class);

    private static final String SCHEMA = "/mirror/schema.sql";

    private final Path file;
    private final Jdbi jdbi;

    private MirrorDatabase(Path file, Jdbi jdbi) {
        this.file = file;
        this.jdbi = jdbi;
    }

    /**
     * Opens (creating if needed) the database file and applies the schema.
     */
    public static MirrorDatabase open(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create mirror directory " + parent, e);
        }

        Properties pragmas = new Properties();
        pragmas.setProperty("journal_mode", "WAL");
        pragmas.setProperty("busy_timeout", "10000");
        Jdbi jdbi = Jdbi.create("jdbc:sqlite:" + file.toAbsolutePath(), pragmas)
                .installPlugin(new SqlObjectPlugin());

        String schema = readSchema();
        jdbi.useHandle(h -> h.createScript(schema).execute());
        log.infof("Mirror database opened: %s", file.toAbsolutePath());
        return new MirrorDatabase(file, jdbi);
    }

    private static String readSchema() {
        try (InputStream in = MirrorDatabase.class.getResourceAsStream(SCHEMA)) {
            if (in == null) {
                throw new IllegalStateException("Missing " + SCHEMA);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Path file() {
        return file;
    }

    public Jdbi jdbi() {
        return jdbi;
    }
}
