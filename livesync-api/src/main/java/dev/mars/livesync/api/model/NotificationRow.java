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
package dev.mars.livesync.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * A row of the {@code notifications} table.
 *
 * @param id            primary key
 * @param userId        owning user
 * @param type          notification type, e.g. {@code comment} or {@code like}
 * @param title         short title
 * @param body          optional body text
 * @param referenceType type of the referenced entity, may be null
 * @param referenceId   id of the referenced entity, may be null
 * @param metadata      free-form metadata, may be null
 * @param read          whether the user has read the notification
 * @param readAt        when the notification was read, null while unread
 * @param createdAt     creation time
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationRow(
    @JsonProperty("id") long id,
    @JsonProperty("user_id") String userId,
    @JsonProperty("type") String type,
    @JsonProperty("title") String title,
    @JsonProperty("body") String body,
    @JsonProperty("reference_type") String referenceType,
    @JsonProperty("reference_id") String referenceId,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("is_read") boolean read,
    @JsonProperty("read_at") Instant readAt,
    @JsonProperty("created_at") Instant createdAt
) {
    public static final String TABLE = "notifications";
    public static final String ID = "id";
    public static final String USER_ID = "user_id";
    public static final String IS_READ = "is_read";
    public static final String READ_AT = "read_at";
    public static final String CREATED_AT = "created_at";
}
