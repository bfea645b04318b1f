package com.m3w.store.core.db;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

@ApplicationScoped
public class JdbiProducer {

    @ConfigProperty(name = "quarkus.datasource.db-kind", defaultValue = "postgresql")
    String dbKind;

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource) {
        Jdbi jdbi = configure(Jdbi.create(dataSource));
        if (dbKind.startsWith("postgres")) {
            jdbi.installPlugin(new PostgresPlugin());
        }
        return jdbi;
    }

    /**
     * Plugins and logging shared by every Jdbi instance of the server tier.
     */
    public static Jdbi configure(Jdbi jdbi) {
        return jdbi.installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
    }
}
