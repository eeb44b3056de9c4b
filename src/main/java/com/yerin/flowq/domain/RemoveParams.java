package com.yerin.flowq.domain;

public record RemoveParams(String id) {
    public RemoveParams {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }
}
