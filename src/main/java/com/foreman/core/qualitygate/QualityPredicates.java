package com.foreman.core.qualitygate;

import com.foreman.core.model.Role;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-role registry of {@link QualityPredicate}s. Immutable; {@link #with} returns a copy.
 */
public final class QualityPredicates {

    private final Map<Role, QualityPredicate> predicates;

    private QualityPredicates(Map<Role, QualityPredicate> predicates) {
        this.predicates = predicates;
    }

    /**
     * Built-in criteria: test output for the tester, a review score for the quality
     * checker, a clean artifact summary for everyone else.
     */
    public static QualityPredicates defaults() {
        var map = new EnumMap<Role, QualityPredicate>(Role.class);
        var artifact = new ArtifactPredicate();
        for (Role role : Role.values()) {
            map.put(role, artifact);
        }
        map.put(Role.TESTER, new TestOutputPredicate());
        map.put(Role.QUALITY_CHECKER, new ReviewScorePredicate());
        return new QualityPredicates(map);
    }

    /** Accepts every claim; used when validation is done entirely outside the core. */
    public static QualityPredicates acceptAll() {
        var map = new EnumMap<Role, QualityPredicate>(Role.class);
        for (Role role : Role.values()) {
            map.put(role, (task, claimed) -> QualityPredicate.Result.accept());
        }
        return new QualityPredicates(map);
    }

    public QualityPredicates with(Role role, QualityPredicate predicate) {
        var copy = new EnumMap<>(predicates);
        copy.put(role, predicate);
        return new QualityPredicates(copy);
    }

    public QualityPredicate forRole(Role role) {
        return predicates.get(role);
    }
}
