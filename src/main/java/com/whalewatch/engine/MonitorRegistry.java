package com.whalewatch.engine;

import com.whalewatch.config.MonitorProperties;
import com.whalewatch.domain.enums.RuleType;
import com.whalewatch.domain.model.AlertRule;
import com.whalewatch.domain.model.WatchedEntity;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the watched entities and the global rules, built once at startup.
 *
 * <p>Entity ids are matched case-insensitively (addresses arrive in mixed case from the provider).
 */
public class MonitorRegistry {

    private final Map<String, WatchedEntity> entities;
    private final Map<RuleType, AlertRule> rules;

    public MonitorRegistry(List<WatchedEntity> entities, List<AlertRule> rules) {
        Map<String, WatchedEntity> byId = new LinkedHashMap<>();
        for (WatchedEntity entity : entities) {
            byId.put(normalizeId(entity.getId()), entity);
        }
        Map<RuleType, AlertRule> byType = new EnumMap<>(RuleType.class);
        for (AlertRule rule : rules) {
            byType.put(rule.type(), rule);
        }
        this.entities = Collections.unmodifiableMap(byId);
        this.rules = Collections.unmodifiableMap(byType);
    }

    public static MonitorRegistry fromProperties(MonitorProperties monitorProperties) {
        List<WatchedEntity> entities = monitorProperties.getEntities().stream()
                .map(entity -> WatchedEntity.builder()
                        .id(normalizeId(entity.getId()))
                        .label(entity.getLabel() != null ? entity.getLabel() : entity.getId())
                        .active(entity.isActive())
                        .singleThreshold(entity.getSingleThreshold())
                        .cumulativeThreshold(entity.getCumulativeThreshold())
                        .build())
                .toList();

        MonitorProperties.Rules configured = monitorProperties.getRules();
        List<AlertRule> rules = List.of(
                new AlertRule(
                        RuleType.SINGLE,
                        configured.getSingle().getThreshold(),
                        configured.getSingle().isEnabled()),
                new AlertRule(
                        RuleType.CUMULATIVE,
                        configured.getCumulative().getThreshold(),
                        configured.getCumulative().isEnabled()));

        return new MonitorRegistry(entities, rules);
    }

    public Optional<WatchedEntity> find(String entityId) {
        if (entityId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(normalizeId(entityId)));
    }

    public Collection<WatchedEntity> getEntities() {
        return entities.values();
    }

    public List<WatchedEntity> getActiveEntities() {
        return entities.values().stream().filter(WatchedEntity::isActive).toList();
    }

    /** The rule of the given type, if configured and enabled. */
    public Optional<AlertRule> enabledRule(RuleType type) {
        AlertRule rule = rules.get(type);
        return rule != null && rule.enabled() ? Optional.of(rule) : Optional.empty();
    }

    public int getActiveRuleCount() {
        return (int) rules.values().stream().filter(AlertRule::enabled).count();
    }

    public static String normalizeId(String entityId) {
        return entityId.trim().toLowerCase(Locale.ROOT);
    }
}
