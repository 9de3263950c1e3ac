package jsonutils.internal.json;

import jsonutils.json.JsonString;

record JsonStringImpl(String string, int sourceLine) implements JsonString {

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonString other && string.equals(other.string());
    }

    @Override
    public int hashCode() {
        return string.hashCode();
    }
}
