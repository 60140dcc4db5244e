package com.twitchapi.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Channel information as returned by {@code GET /helix/channels}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Channel(
        @JsonProperty("broadcaster_id") String broadcasterId,
        @JsonProperty("broadcaster_login") String broadcasterLogin,
        @JsonProperty("broadcaster_name") String broadcasterName,
        @JsonProperty("broadcaster_language") String broadcasterLanguage,
        @JsonProperty("game_id") String gameId,
        @JsonProperty("game_name") String gameName,
        @JsonProperty("title") String title,
        @JsonProperty("delay") int delay,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("content_classification_labels") List<String> contentClassificationLabels,
        @JsonProperty("is_branded_content") boolean brandedContent
) {
}
