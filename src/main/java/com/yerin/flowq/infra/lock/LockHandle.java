package com.yerin.flowq.infra.lock;

public record LockHandle(String key, String token) {}
