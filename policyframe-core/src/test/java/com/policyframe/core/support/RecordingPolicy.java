package com.policyframe.core.support;

import com.policyframe.api.policy.Policy;
import com.policyframe.api.policy.PolicyDecision;
import com.policyframe.api.policy.PolicyRequest;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * 记录调用顺序的策略
 */
public class RecordingPolicy implements Policy {

    private final String id;
    private final List<String> journal;
    private final PolicyDecision decision;
    private final String applyPoint;

    public RecordingPolicy(String id, List<String> journal, PolicyDecision decision) {
        this(id, journal, decision, null);
    }

    public RecordingPolicy(String id, List<String> journal, PolicyDecision decision, String applyPoint) {
        this.id = id;
        this.journal = journal;
        this.decision = decision;
        this.applyPoint = applyPoint;
    }

    public static RecordingPolicy allowing(String id, List<String> journal) {
        return new RecordingPolicy(id, journal, PolicyDecision.allow());
    }

    public static RecordingPolicy denying(String id, List<String> journal, String reason) {
        return new RecordingPolicy(id, journal, PolicyDecision.deny(reason));
    }

    @Override
    public CompletionStage<PolicyDecision> check(PolicyRequest request) {
        journal.add(id);
        return decision.asStage();
    }

    @Override
    public String applyPoint() {
        return applyPoint;
    }

    @Override
    public String toString() {
        return "RecordingPolicy(" + id + ")";
    }
}
