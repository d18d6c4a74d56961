package com.acme.events.pg;

import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@code schema.sql} on startup. Every statement in it is idempotent.
 */
@Singleton
@Requires(property = "storage.init-schema", value = "true")
public class SchemaInitializer implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaInitializer.class);

    private final ConnectionOperations<Connection> connectionOps;

    public SchemaInitializer(ConnectionOperations<Connection> connectionOps) {
        this.connectionOps = connectionOps;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        String sql = load("schema.sql");
        connectionOps.executeWrite(status -> {
            try (var stmt = status.getConnection().createStatement()) {
                for (String statement : sql.split(";")) {
                    if (!statement.isBlank()) {
                        stmt.execute(statement.trim());
                    }
                }
            } catch (SQLException e) {
                throw new IllegalStateException("Failed to initialize schema", e);
            }
            return null;
        });
        LOG.info("Database schema initialized");
    }

    private String load(String resource) {
        var in = getClass().getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Missing classpath resource " + resource);
        }
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return reader.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
