package com.twitchapi.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Game (category) as returned by {@code GET /helix/games}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Game(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("box_art_url") String boxArtUrl,
        @JsonProperty("igdb_id") String igdbId
) {
}
