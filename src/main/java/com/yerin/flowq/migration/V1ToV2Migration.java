package com.yerin.flowq.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yerin.flowq.domain.BrokerJob;
import com.yerin.flowq.domain.data.ExecutionType;
import com.yerin.flowq.domain.data.RunEnvironment;

import java.util.Optional;

/**
 * 내장된 flowVersion 객체를 flowVersionId / flowId 참조로 정규화한다.
 */
public class V1ToV2Migration implements JobDataMigration {

    @Override
    public int fromVersion() {
        return 1;
    }

    @Override
    public Optional<ObjectNode> migrate(BrokerJob job, ObjectNode data) {
        return Optional.of(normalize(data));
    }

    static ObjectNode normalize(ObjectNode v1) {
        JsonNode flowVersion = v1.get("flowVersion");
        if (flowVersion == null || !flowVersion.isObject() || !flowVersion.hasNonNull("id")) {
            throw new IllegalStateException("v1 job data has no embedded flowVersion");
        }
        ObjectNode v2 = JsonNodeFactory.instance.objectNode();
        v2.put("schemaVersion", 2);
        v2.put("flowVersionId", flowVersion.get("id").asText());
        v2.set("flowId", flowVersion.get("flowId"));
        v2.set("projectId", v1.get("projectId"));
        v2.put("environment", RunEnvironment.PRODUCTION.name());
        v2.put("executionType", ExecutionType.BEGIN.name());
        v2.set("triggerType", v1.get("triggerType"));
        return v2;
    }
}
