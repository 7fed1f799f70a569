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
import java.util.List;

/**
 * A row of the {@code posts} table. Hidden posts are moderated out of the feed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PostRow(
    @JsonProperty("id") long id,
    @JsonProperty("author_id") String authorId,
    @JsonProperty("content") String content,
    @JsonProperty("media_urls") List<String> mediaUrls,
    @JsonProperty("like_count") int likeCount,
    @JsonProperty("comment_count") int commentCount,
    @JsonProperty("is_pinned") boolean pinned,
    @JsonProperty("is_hidden") boolean hidden,
    @JsonProperty("hidden_reason") String hiddenReason,
    @JsonProperty("hidden_by") String hiddenBy,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {
    public static final String TABLE = "posts";
    public static final String ID = "id";
    public static final String IS_HIDDEN = "is_hidden";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    public PostRow {
        mediaUrls = mediaUrls != null ? List.copyOf(mediaUrls) : List.of();
    }
}
