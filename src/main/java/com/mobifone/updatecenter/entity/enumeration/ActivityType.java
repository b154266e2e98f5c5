package com.mobifone.updatecenter.entity.enumeration;

public enum ActivityType {
    INFO,
    SUCCESS,
    WARNING,
    ERROR,
    PROGRESS,
    START,
    COMPLETE,
    MILESTONE
}
