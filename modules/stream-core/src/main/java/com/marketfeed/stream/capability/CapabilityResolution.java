package com.marketfeed.stream.capability;

public record CapabilityResolution(String capability, RuleType ruleType, ResolutionMethod method) {}
