package com.whalewatch.domain.model;

import com.whalewatch.domain.enums.RuleType;
import java.math.BigDecimal;

/**
 * A global threshold rule. Entities may override the threshold but not the enabled flag.
 */
public record AlertRule(RuleType type, BigDecimal threshold, boolean enabled) {}
