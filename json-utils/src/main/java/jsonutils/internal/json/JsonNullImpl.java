package jsonutils.internal.json;

import jsonutils.json.JsonNull;

record JsonNullImpl(int sourceLine) implements JsonNull {

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonNull;
    }

    @Override
    public int hashCode() {
        return JsonNull.class.hashCode();
    }
}
