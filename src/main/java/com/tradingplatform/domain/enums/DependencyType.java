package com.tradingplatform.domain.enums;

/**
 * Relationship between a parent order and a child order.
 * ONE_TRIGGERS_OTHER: the child is submitted once the parent completes.
 * ONE_CANCELS_OTHER: the child is cancelled once the parent completes.
 */
public enum DependencyType {
    ONE_TRIGGERS_OTHER,
    ONE_CANCELS_OTHER
}
