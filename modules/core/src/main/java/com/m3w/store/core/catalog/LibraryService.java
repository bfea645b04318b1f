package com.m3w.store.core.catalog;

import com.m3w.store.core.dao.LibraryDao;
import com.m3w.store.core.dao.LibraryRecord;
import com.m3w.store.core.dao.SongDao;
import com.m3w.store.core.dao.SongRecord;
import com.m3w.store.dedup.CascadeDeleter;
import com.m3w.store.dedup.CascadeResult;
import com.m3w.store.dedup.DeleteProgressListener;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner-scoped library operations. A library that does not exist and one owned
 * by someone else look the same to the caller: empty or null.
 */
@ApplicationScoped
public class LibraryService {

    private static final Logger log = Logger.getLogger(LibraryService.class);

    @Inject
    Jdbi jdbi;

    @Inject
    CascadeDeleter cascadeDeleter;

    public LibraryRecord create(String ownerId, String name) {
        return create(ownerId, name, true);
    }

    /**
     * @param canDelete false for libraries the owner may not remove, such as a default library
     */
    public LibraryRecord create(String ownerId, String name, boolean canDelete) {
        String id = UUID.randomUUID().toString();
        return jdbi.inTransaction(h -> {
            LibraryDao dao = h.attach(LibraryDao.class);
            dao.insert(id, ownerId, name, canDelete);
            return dao.findById(id).orElseThrow();
        });
    }

    public Optional<LibraryRecord> find(String ownerId, String libraryId) {
        return jdbi.withHandle(h -> h.attach(LibraryDao.class).findById(libraryId))
                .filter(l -> l.ownerId().equals(ownerId));
    }

    public List<LibraryRecord> list(String ownerId) {
        return jdbi.withHandle(h -> h.attach(LibraryDao.class).findByOwner(ownerId));
    }

    public Optional<List<SongRecord>> songs(String ownerId, String libraryId) {
        return find(ownerId, libraryId)
                .map(l -> jdbi.withHandle(h -> h.attach(SongDao.class).findByLibrary(l.id())));
    }

    public Optional<Integer> songCount(String ownerId, String libraryId) {
        return find(ownerId, libraryId)
                .map(l -> jdbi.withHandle(h -> h.attach(LibraryDao.class).songCount(l.id())));
    }

    public CascadeResult delete(String ownerId, String libraryId) {
        return delete(ownerId, libraryId, DeleteProgressListener.NONE);
    }

    /**
     * Deletes the library with all of its songs.
     *
     * @return null when the library does not exist or is not owned by {@code ownerId}
     * @throws IllegalStateException if the library is marked as not deletable
     */
    public CascadeResult delete(String ownerId, String libraryId, DeleteProgressListener listener) {
        Optional<LibraryRecord> library = find(ownerId, libraryId);
        if (library.isEmpty()) {
            log.debugf("Library %s not found for owner %s", libraryId, ownerId);
            return null;
        }
        if (!library.get().canDelete()) {
            throw new IllegalStateException("Library " + libraryId + " cannot be deleted");
        }
        return cascadeDeleter.deleteLibrary(libraryId, listener);
    }
}
