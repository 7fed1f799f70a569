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

import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Installs the {@code livesync_notify_change()} trigger function and attaches
 * it to the synced tables. Requires PostgreSQL 14 or later.
 */
public class ChangeTriggerInstaller {

    private static final Logger logger = LoggerFactory.getLogger(ChangeTriggerInstaller.class);

    static final String FUNCTION_RESOURCE = "livesync-change-trigger.sql";

    private final Pool pool;
    private final String channel;

    public ChangeTriggerInstaller(Pool pool, String channel) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        PgIdentifiers.quoteChannel(channel);
        this.channel = channel;
    }

    /**
     * Creates or replaces the trigger function, then one row-level trigger per table.
     *
     * @param tables the tables to publish
     * @return a future completing once every trigger is in place
     */
    public Future<Void> install(List<String> tables) {
        String functionSql;
        List<String> triggerStatements;
        try {
            functionSql = loadFunctionSql();
            triggerStatements = tables.stream().map(table -> triggerSql(table, channel)).toList();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
        Future<Void> chain = pool.query(functionSql).execute().mapEmpty();
        for (String sql : triggerStatements) {
            chain = chain.compose(v -> pool.query(sql).execute().<Void>mapEmpty());
        }
        return chain
            .onSuccess(v -> logger.info("Installed change triggers on {} publishing to '{}'", tables, channel))
            .onFailure(e -> logger.error("Failed to install change triggers on {}: {}", tables, e.getMessage()));
    }

    static String triggerSql(String table, String channel) {
        PgIdentifiers.quoteChannel(channel);
        String quotedTable = PgIdentifiers.quote(table);
        String triggerName = PgIdentifiers.quote("livesync_" + table + "_changes");
        return "CREATE OR REPLACE TRIGGER " + triggerName
            + " AFTER INSERT OR UPDATE OR DELETE ON " + quotedTable
            + " FOR EACH ROW EXECUTE FUNCTION livesync_notify_change('" + channel + "')";
    }

    static String loadFunctionSql() {
        try (InputStream in = ChangeTriggerInstaller.class.getClassLoader().getResourceAsStream(FUNCTION_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Resource not found: " + FUNCTION_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + FUNCTION_RESOURCE, e);
        }
    }
}
