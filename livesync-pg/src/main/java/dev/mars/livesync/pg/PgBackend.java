/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.livesync.pg;

import dev.mars.livesync.api.lifecycle.ReactiveCloseable;
import dev.mars.livesync.core.LiveSync;
import dev.mars.livesync.core.config.LiveSyncConfiguration;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL backend for LiveSync: one reactive pool for baseline queries and
 * mutations, plus dedicated LISTEN connections for the change stream.
 *
 * <pre>{@code
 * PgBackend backend = PgBackend.create(vertx, configuration.getDatabaseConfig());
 * LiveSync liveSync = backend.configure(LiveSync.builder().vertx(vertx))
 *     .configuration(configuration)
 *     .identityEvents(identity)
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class PgBackend implements ReactiveCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PgBackend.class);

    private final Pool pool;
    private final PgChangeStreamClient changeStreamClient;
    private final PgRowQueryClient queryClient;
    private final PgRowMutationClient mutationClient;
    private final ChangeTriggerInstaller triggerInstaller;
    private volatile Future<Void> closeFuture;

    PgBackend(Pool pool, PgChangeStreamClient changeStreamClient, String channel) {
        this.pool = pool;
        this.changeStreamClient = changeStreamClient;
        this.queryClient = new PgRowQueryClient(pool);
        this.mutationClient = new PgRowMutationClient(pool);
        this.triggerInstaller = new ChangeTriggerInstaller(pool, channel);
    }

    public static PgBackend create(Vertx vertx, LiveSyncConfiguration.DatabaseConfig config) {
        Objects.requireNonNull(vertx, "vertx cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(config.getHost(), "host");
        Objects.requireNonNull(config.getDatabase(), "database");
        Objects.requireNonNull(config.getUsername(), "username");

        PgConnectOptions connectOptions = connectOptions(config);
        PoolOptions poolOptions = new PoolOptions().setMaxSize(config.getPoolMaxSize());

        Pool pool = PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();

        logger.info("Created LiveSync PostgreSQL backend for host: {}, database: {}, channel: {}",
            config.getHost(), config.getDatabase(), config.getChannel());
        return new PgBackend(pool,
            new PgChangeStreamClient(vertx, connectOptions, config.getChannel()),
            config.getChannel());
    }

    static PgConnectOptions connectOptions(LiveSyncConfiguration.DatabaseConfig config) {
        return new PgConnectOptions()
            .setHost(config.getHost())
            .setPort(config.getPort())
            .setDatabase(config.getDatabase())
            .setUser(config.getUsername())
            .setPassword(config.getPassword());
    }

    /**
     * Wires the three backend clients into a LiveSync builder and registers
     * nothing else; the caller still supplies identity and configuration.
     */
    public LiveSync.Builder configure(LiveSync.Builder builder) {
        return builder
            .changeStreamClient(changeStreamClient)
            .queryClient(queryClient)
            .mutationClient(mutationClient);
    }

    /**
     * Installs the change triggers on the given tables.
     */
    public Future<Void> installTriggers(List<String> tables) {
        return triggerInstaller.install(tables);
    }

    public Pool pool() {
        return pool;
    }

    public PgChangeStreamClient changeStreamClient() {
        return changeStreamClient;
    }

    public PgRowQueryClient queryClient() {
        return queryClient;
    }

    public PgRowMutationClient mutationClient() {
        return mutationClient;
    }

    @Override
    public String name() {
        return "pg-backend";
    }

    @Override
    public synchronized Future<Void> closeReactive() {
        if (closeFuture == null) {
            closeFuture = changeStreamClient.closeReactive()
                .eventually(() -> pool.close())
                .onSuccess(v -> logger.info("LiveSync PostgreSQL backend closed"));
        }
        return closeFuture;
    }
}
