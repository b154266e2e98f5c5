package com.mobifone.updatecenter.entity.enumeration;

public enum UpdateLevel {
    MAJOR,
    MINOR,
    PATCH
}
