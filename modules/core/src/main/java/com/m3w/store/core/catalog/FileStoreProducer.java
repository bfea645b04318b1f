package com.m3w.store.core.catalog;

import com.m3w.store.dedup.CascadeDeleter;
import com.m3w.store.dedup.CascadePolicy;
import com.m3w.store.dedup.DedupUploader;
import com.m3w.store.formats.TagExtractor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Wires the tier-agnostic uploader and cascade onto the server tier.
 */
@ApplicationScoped
public class FileStoreProducer {

    private static final Logger log = Logger.getLogger(FileStoreProducer.class);

    @ConfigProperty(name = "m3w.cascade.policy", defaultValue = "best-effort")
    String cascadePolicy;

    @Produces
    @Singleton
    public DedupUploader dedupUploader(ServerTier tier, TagExtractor tagExtractor) {
        return new DedupUploader(tier, tagExtractor);
    }

    @Produces
    @Singleton
    public CascadeDeleter cascadeDeleter(ServerTier tier) {
        CascadePolicy policy = CascadePolicy.parse(cascadePolicy);
        log.infof("Server cascade policy: %s", policy);
        return new CascadeDeleter(tier, policy);
    }
}
