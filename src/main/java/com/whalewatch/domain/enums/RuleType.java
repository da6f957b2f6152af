package com.whalewatch.domain.enums;

public enum RuleType {
    SINGLE,
    CUMULATIVE
}
