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

import dev.mars.livesync.api.change.ChangeOperation;
import dev.mars.livesync.api.change.ChangeSubscription;
import dev.mars.livesync.api.change.ChannelStatus;
import dev.mars.livesync.api.change.SubscriptionHandle;
import dev.mars.livesync.api.model.NotificationRow;
import dev.mars.livesync.api.model.PostRow;
import dev.mars.livesync.test.PostgreSQLTestConstants;
import dev.mars.livesync.test.categories.TestCategories;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Trigger installation and shutdown of the PostgreSQL backend.
 */
@Tag(TestCategories.INTEGRATION)
@ExtendWith(VertxExtension.class)
@Testcontainers
class PgBackendLifecycleIT {

    @Container
    @SuppressWarnings("resource")
    static PostgreSQLContainer<?> postgres = PostgreSQLTestConstants.createStandardContainer();

    private PgBackend backend;

    @BeforeEach
    void setUp(Vertx vertx) {
        backend = PgBackend.create(vertx, PgTestSupport.databaseConfig(postgres));
        PgTestSupport.createSchema(backend.pool());
    }

    @Test
    @DisplayName("installing triggers twice replaces them")
    void installIsRepeatable(VertxTestContext testContext) {
        List<String> tables = List.of(NotificationRow.TABLE, PostRow.TABLE);
        backend.installTriggers(tables)
            .compose(v -> backend.installTriggers(tables))
            .compose(v -> backend.pool()
                .query("SELECT count(*) AS triggers FROM pg_trigger WHERE tgname LIKE 'livesync_%_changes'")
                .execute())
            .onComplete(testContext.succeeding(rows -> testContext.verify(() -> {
                assertEquals(2L, rows.iterator().next().getLong("triggers"));
                backend.closeReactive().onComplete(ar -> testContext.completeNow());
            })));
    }

    @Test
    void installingOnAMissingTableFails(VertxTestContext testContext) {
        backend.installTriggers(List.of("no_such_table"))
            .onComplete(testContext.failing(error -> testContext.verify(() -> {
                assertTrue(error.getMessage().contains("no_such_table"));
                backend.closeReactive().onComplete(ar -> testContext.completeNow());
            })));
    }

    @Test
    @DisplayName("closing the backend closes open subscriptions and is idempotent")
    void closeReleasesSubscriptions(VertxTestContext testContext) {
        List<ChannelStatus> statuses = new CopyOnWriteArrayList<>();
        SubscriptionHandle handle = backend.changeStreamClient().subscribe(
            ChangeSubscription.forTable(PostRow.TABLE, EnumSet.of(ChangeOperation.INSERT)),
            event -> { }, statuses::add);

        backend.closeReactive()
            .compose(v -> backend.closeReactive())
            .onComplete(testContext.succeeding(v -> testContext.verify(() -> {
                assertEquals(ChannelStatus.CLOSED, handle.status());
                assertTrue(statuses.contains(ChannelStatus.CLOSED));
                assertEquals(0, backend.changeStreamClient().activeHandles());
                testContext.completeNow();
            })));
    }

    @Test
    void unsubscribingAForeignHandleFails(VertxTestContext testContext) {
        SubscriptionHandle foreign = new SubscriptionHandle() {
            @Override
            public String id() {
                return "foreign";
            }

            @Override
            public ChangeSubscription subscription() {
                return ChangeSubscription.forTable(PostRow.TABLE, EnumSet.of(ChangeOperation.INSERT));
            }

            @Override
            public ChannelStatus status() {
                return ChannelStatus.SUBSCRIBED;
            }
        };

        backend.changeStreamClient().unsubscribe(foreign)
            .onComplete(testContext.failing(error -> testContext.verify(() -> {
                assertInstanceOf(IllegalArgumentException.class, error);
                backend.closeReactive().onComplete(ar -> testContext.completeNow());
            })));
    }
}
