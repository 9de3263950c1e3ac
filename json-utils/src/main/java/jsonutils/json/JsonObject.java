package jsonutils.json;

import java.util.List;
import java.util.Map;

/// The interface that represents a JSON object.
///
/// Members keep the order in which their keys first appeared in the source.
/// When a key occurs more than once, the first occurrence's value is kept and
/// every later occurrence only contributes the line it appeared on to
/// {@link #duplicateLines(String)}; its value is discarded.
///
/// ## Example Usage
/// ```java
/// JsonObject obj = (JsonObject) Json.parse("{\"a\":1,\n\"a\":2}");
/// obj.get("a").number().intValue(); // 1
/// obj.duplicateLines("a");          // [2]
/// ```
public non-sealed interface JsonObject extends JsonNode {

    /// {@return an unmodifiable, insertion-ordered map of the members of this object}
    @Override
    Map<String, JsonNode> members();

    /// {@return the lines on which `key` reappeared after its first definition}
    /// The list is empty if the key never repeated or is not a member.
    ///
    /// @param key the member name
    List<Integer> duplicateLines(String key);

    /// {@return an unmodifiable map from each repeated key to its duplicate lines}
    /// Keys that occurred only once are absent.
    Map<String, List<Integer>> duplicates();

    @Override
    default JsonKind kind() {
        return JsonKind.OBJECT;
    }
}
