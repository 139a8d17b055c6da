package com.concierge.core.retrieval;

import java.util.Map;

/**
 * One searchable schedule entry.
 *
 * @param id       talk guid, code or id; {@code date_room_start} when none is present
 * @param text     the text block that gets embedded
 * @param metadata room, date, start, track and title (title capped at 200 chars)
 */
public record TalkDocument(
    String id,
    String text,
    Map<String, String> metadata
) {

    public TalkDocument {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
