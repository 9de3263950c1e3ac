package jsonutils.internal.json;

import jsonutils.json.JsonBoolean;

record JsonBooleanImpl(boolean bool, int sourceLine) implements JsonBoolean {

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonBoolean other && bool == other.bool();
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(bool);
    }
}
