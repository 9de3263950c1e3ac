package jsonutils.internal.json;

import java.util.Collections;
import java.util.List;

import jsonutils.json.JsonArray;
import jsonutils.json.JsonNode;

record JsonArrayImpl(List<JsonNode> elements, int sourceLine) implements JsonArray {

    JsonArrayImpl {
        elements = Collections.unmodifiableList(elements);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonArray other && elements.equals(other.elements());
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
