package com.yerin.flowq.domain.data;

import com.fasterxml.jackson.databind.JsonNode;

public final class JobDataSchema {

    public static final int LATEST_VERSION = 4;

    public static final String SCHEMA_VERSION = "schemaVersion";

    private JobDataSchema() {}

    /**
     * schemaVersion 이 없으면 v1 로 본다.
     */
    public static int versionOf(JsonNode data) {
        JsonNode v = data == null ? null : data.get(SCHEMA_VERSION);
        if (v == null || v.isNull()) return 1;
        return v.asInt(1);
    }

    public static boolean isLatest(JsonNode data) {
        JsonNode v = data == null ? null : data.get(SCHEMA_VERSION);
        return v != null && v.canConvertToInt() && v.asInt() == LATEST_VERSION;
    }
}
