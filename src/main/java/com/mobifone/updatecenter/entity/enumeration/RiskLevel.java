package com.mobifone.updatecenter.entity.enumeration;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
