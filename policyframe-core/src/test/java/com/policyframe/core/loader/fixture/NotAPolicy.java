package com.policyframe.core.loader.fixture;

public class NotAPolicy {
}
