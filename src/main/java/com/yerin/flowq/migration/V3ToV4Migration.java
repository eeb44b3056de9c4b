package com.yerin.flowq.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yerin.flowq.domain.BrokerJob;
import com.yerin.flowq.domain.data.ExecutionType;
import com.yerin.flowq.domain.data.RepeatableJobType;

import java.util.Optional;

/**
 * executionType → jobType (BEGIN → EXECUTE_TRIGGER, RESUME → DELAYED_FLOW). 항상 v4 로 올라간다.
 */
public class V3ToV4Migration implements JobDataMigration {

    @Override
    public int fromVersion() {
        return 3;
    }

    @Override
    public Optional<ObjectNode> migrate(BrokerJob job, ObjectNode data) {
        return Optional.of(toJobType(data));
    }

    static ObjectNode toJobType(ObjectNode v3) {
        ObjectNode v4 = v3.deepCopy();
        v4.put("schemaVersion", 4);
        RepeatableJobType jobType = RepeatableJobType.fromExecutionType(executionType(v3.get("executionType")));
        if (jobType != null) {
            v4.put("jobType", jobType.name());
        }
        v4.remove("executionType");
        return v4;
    }

    private static ExecutionType executionType(JsonNode node) {
        if (node == null || !node.isTextual()) return null;
        for (ExecutionType t : ExecutionType.values()) {
            if (t.name().equals(node.asText())) return t;
        }
        return null;
    }
}
