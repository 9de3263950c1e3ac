package jsonutils.lint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import jsonutils.json.JsonNode;
import jsonutils.json.JsonObject;

/// Collects every duplicate key recorded anywhere in a parsed tree, ordered by line.
final class DuplicateKeyFinder {

    private static final Logger LOG = Logger.getLogger(DuplicateKeyFinder.class.getName());

    private DuplicateKeyFinder() {
    }

    static List<DuplicateKey> find(JsonNode root) {
        final List<DuplicateKey> found = new ArrayList<>();
        walk(root, "", found);
        found.sort(Comparator.comparingInt(DuplicateKey::line).thenComparing(DuplicateKey::pointer));
        LOG.fine(() -> "Found " + found.size() + " duplicate key occurrences");
        return found;
    }

    private static void walk(JsonNode node, String pointer, List<DuplicateKey> found) {
        switch (node.kind()) {
            case OBJECT -> {
                final JsonObject obj = (JsonObject) node;
                for (Map.Entry<String, List<Integer>> entry : obj.duplicates().entrySet()) {
                    final String key = entry.getKey();
                    final int firstLine = obj.members().get(key).sourceLine();
                    for (int line : entry.getValue()) {
                        found.add(new DuplicateKey(pointer, key, firstLine, line));
                    }
                }
                obj.members().forEach((key, child) -> walk(child, pointer + "/" + escape(key), found));
            }
            case ARRAY -> {
                final List<JsonNode> elements = node.elements();
                for (int i = 0; i < elements.size(); i++) {
                    walk(elements.get(i), pointer + "/" + i, found);
                }
            }
            default -> {
                // scalars hold no keys
            }
        }
    }

    /// RFC 6901 reference token escaping.
    static String escape(String key) {
        return key.replace("~", "~0").replace("/", "~1");
    }
}
