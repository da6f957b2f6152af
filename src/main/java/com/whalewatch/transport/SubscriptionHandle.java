package com.whalewatch.transport;

import java.util.List;

public record SubscriptionHandle(String entityId, List<String> channels) {}
