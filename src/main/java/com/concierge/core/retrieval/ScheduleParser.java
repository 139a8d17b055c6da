package com.concierge.core.retrieval;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads pretalx-style schedule JSON.
 * <p>
 * Accepted shapes: {@code {"schedule": {"conference": {"title", "days"}}}},
 * the same without the {@code schedule} wrapper, or a bare {@code {"days": [...]}}.
 * Each day holds {@code rooms}, a map of room name to a list of talks.
 */
public final class ScheduleParser {

    static final int DESCRIPTION_LIMIT = 4000;
    static final int BIOGRAPHY_LIMIT = 1500;
    static final int TITLE_LIMIT = 200;

    private ScheduleParser() {}

    /** The list of days, empty when the document has none or is not an object. */
    public static List<JsonNode> days(JsonNode root) {
        JsonNode schedule = schedule(root);
        JsonNode days = schedule.path("conference").path("days");
        if (!nonEmptyArray(days)) {
            days = schedule.path("days");
        }
        List<JsonNode> result = new ArrayList<>();
        if (days.isArray()) {
            days.forEach(result::add);
        }
        return result;
    }

    /** One document per talk, in day, then room (document order), then talk order. */
    public static List<TalkDocument> documents(JsonNode root) {
        List<TalkDocument> documents = new ArrayList<>();
        for (JsonNode day : days(root)) {
            String date = text(day, "date");
            Iterator<Map.Entry<String, JsonNode>> rooms = day.path("rooms").fields();
            while (rooms.hasNext()) {
                Map.Entry<String, JsonNode> room = rooms.next();
                for (JsonNode talk : room.getValue()) {
                    documents.add(document(talk, date, room.getKey()));
                }
            }
        }
        return documents;
    }

    /**
     * Compact overview of the whole program: a title header, one {@code ##} header
     * per day, and per talk a {@code - start | room | track} line followed by the
     * indented title. Rooms are listed in lexicographic order.
     */
    public static String overview(JsonNode root) {
        JsonNode schedule = schedule(root);
        String title = text(schedule.path("conference"), "title");
        List<String> lines = new ArrayList<>();
        lines.add("# " + (title.isEmpty() ? "Conference" : title));
        lines.add("");
        for (JsonNode day : days(root)) {
            lines.add("## " + text(day, "date") + "\n");
            Map<String, JsonNode> rooms = new TreeMap<>();
            day.path("rooms").fields().forEachRemaining(e -> rooms.put(e.getKey(), e.getValue()));
            rooms.forEach((roomName, talks) -> {
                for (JsonNode talk : talks) {
                    lines.add("- " + text(talk, "start") + " | " + roomName + " | " + text(talk, "track"));
                    lines.add("  " + text(talk, "title"));
                }
            });
            lines.add("");
        }
        return String.join("\n", lines);
    }

    static TalkDocument document(JsonNode talk, String date, String room) {
        String id = firstNonEmpty(text(talk, "guid"), text(talk, "code"), text(talk, "id"));
        if (id.isEmpty()) {
            id = date + "_" + room + "_" + text(talk, "start");
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("room", room);
        metadata.put("date", date);
        metadata.put("start", text(talk, "start"));
        metadata.put("track", text(talk, "track"));
        metadata.put("title", truncate(text(talk, "title"), TITLE_LIMIT));
        return new TalkDocument(id, talkText(talk, date, room), metadata);
    }

    /**
     * The embedded text block. Room and date come from the enclosing day and room
     * entry when the talk itself does not carry them.
     */
    static String talkText(JsonNode talk, String date, String room) {
        List<String> parts = new ArrayList<>();
        parts.add("Title: " + text(talk, "title"));
        parts.add("Track: " + text(talk, "track"));
        parts.add("Type: " + text(talk, "type"));
        parts.add("Room: " + firstNonEmpty(text(talk, "room"), room));
        parts.add("Date: " + firstNonEmpty(text(talk, "date"), date));
        parts.add("Start: " + text(talk, "start"));
        parts.add("Duration: " + text(talk, "duration"));
        parts.add("Abstract: " + text(talk, "abstract"));
        parts.add("Description: " + truncate(text(talk, "description"), DESCRIPTION_LIMIT));
        int speaker = 1;
        for (JsonNode person : talk.path("persons")) {
            parts.add("Speaker " + speaker++ + ": " + firstNonEmpty(text(person, "public_name"), text(person, "name")));
            String biography = text(person, "biography");
            if (!biography.isEmpty()) {
                parts.add("  Biography: " + truncate(biography, BIOGRAPHY_LIMIT));
            }
        }
        return String.join("\n", parts);
    }

    private static JsonNode schedule(JsonNode root) {
        JsonNode wrapped = root.path("schedule");
        return wrapped.isObject() && !wrapped.isEmpty() ? wrapped : root;
    }

    /** Field as text; missing and null fields read as empty, non-scalar values as JSON. */
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static boolean nonEmptyArray(JsonNode node) {
        return node.isArray() && !node.isEmpty();
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
