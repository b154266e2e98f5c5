package com.mobifone.updatecenter.entity.enumeration;

public enum ActivityPhase {
    PREPARATION,
    VALIDATION,
    DOWNLOAD,
    INSTALLATION,
    POST_INSTALL,
    CLEANUP
}
