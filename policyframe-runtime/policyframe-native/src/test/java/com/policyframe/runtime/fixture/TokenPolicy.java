package com.policyframe.runtime.fixture;

import com.policyframe.api.policy.CallbackPolicy;
import com.policyframe.api.policy.PolicyCallback;
import com.policyframe.api.policy.PolicyRequest;

/**
 * 要求请求携带 X-Token 头
 */
public class TokenPolicy implements CallbackPolicy {

    @Override
    public void apply(PolicyRequest request, PolicyCallback callback) {
        String token = request.getHeader("X-Token");
        if (token == null) {
            callback.deny("token required");
            return;
        }
        request.getAttributes().put("token", token);
        callback.allow();
    }

    @Override
    public String applyPoint() {
        return "onPreAuth";
    }
}
