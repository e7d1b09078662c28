package com.policyframe.api.policy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

class StubRequest implements PolicyRequest {

    private final Map<String, Object> attributes = new HashMap<>();

    @Override
    public String getMethod() {
        return "GET";
    }

    @Override
    public String getPath() {
        return "/";
    }

    @Override
    public String getHeader(String name) {
        return null;
    }

    @Override
    public List<?> getRoutePolicies() {
        return null;
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }
}
