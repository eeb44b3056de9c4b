package com.yerin.flowq.application;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class FlowJobHandlerRegistry {
    private final Map<String, FlowJobHandler> map;
    public FlowJobHandlerRegistry(List<FlowJobHandler> handlers) {
        this.map = handlers.stream().collect(Collectors.toMap(FlowJobHandler::queue, h -> h));
    }
    public FlowJobHandler get(String queue) { return map.get(queue); }
}
