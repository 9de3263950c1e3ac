package jsonutils.internal.json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jsonutils.json.JsonNode;
import jsonutils.json.JsonObject;

/// JsonObject implementation. The maps handed in by the parser are frozen here
/// and must not be touched by the caller afterwards.
record JsonObjectImpl(Map<String, JsonNode> members, Map<String, List<Integer>> duplicates, int sourceLine)
        implements JsonObject {

    JsonObjectImpl {
        members = Collections.unmodifiableMap(members);
        final var frozen = new LinkedHashMap<String, List<Integer>>();
        duplicates.forEach((key, lines) -> frozen.put(key, List.copyOf(lines)));
        duplicates = Collections.unmodifiableMap(frozen);
    }

    @Override
    public List<Integer> duplicateLines(String key) {
        return duplicates.getOrDefault(key, List.of());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonObject other && members.equals(other.members());
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }
}
