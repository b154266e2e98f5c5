package com.mobifone.updatecenter.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

@Getter
public enum ErrorCode {
    UNCATEGORIZED_EXCEPTION(9999, "Uncategorized error", ErrorType.UNCATEGORIZED, HttpStatus.INTERNAL_SERVER_ERROR),

    EMPTY_CANDIDATE_SET(2001, "At least one package must be selected", ErrorType.VALIDATION, HttpStatus.BAD_REQUEST),
    UNKNOWN_CANDIDATE(2002, "Package not found in inventory", ErrorType.VALIDATION, HttpStatus.BAD_REQUEST),
    NO_UPDATES_IN_SELECTION(2003, "None of the selected packages has an update available", ErrorType.VALIDATION, HttpStatus.BAD_REQUEST),
    SCHEDULED_START_IN_PAST(2004, "Scheduled start must be in the future", ErrorType.VALIDATION, HttpStatus.BAD_REQUEST),

    BATCH_NOT_FOUND(2010, "Batch request not found", ErrorType.NOT_FOUND, HttpStatus.NOT_FOUND),

    BATCH_ALREADY_RUNNING(2020, "Batch is already running", ErrorType.CONFLICT, HttpStatus.CONFLICT),
    BATCH_NOT_EXECUTABLE(2021, "Batch cannot be executed in its current state", ErrorType.CONFLICT, HttpStatus.CONFLICT),
    BATCH_NOT_CANCELLABLE(2022, "Only a running batch can be cancelled", ErrorType.CONFLICT, HttpStatus.CONFLICT),
    ILLEGAL_STATE_TRANSITION(2023, "Illegal lifecycle transition", ErrorType.CONFLICT, HttpStatus.CONFLICT),
    ITEM_COUNTS_EXCEED_TOTAL(2024, "Item counts exceed batch total", ErrorType.CONFLICT, HttpStatus.CONFLICT),

    INSTALLER_SUBMISSION_FAILED(2030, "Installer rejected the batch manifest", ErrorType.SUBMISSION, HttpStatus.BAD_GATEWAY),
    INVALID_MANIFEST(2031, "Install manifest is not readable", ErrorType.SUBMISSION, HttpStatus.INTERNAL_SERVER_ERROR),
    INSTALLER_UNAVAILABLE(2032, "Installer progress read failed", ErrorType.EXTERNAL_SERVICE, HttpStatus.BAD_GATEWAY),

    MONITOR_TIMEOUT(2040, "Monitor timeout", ErrorType.POLLING_TIMEOUT, HttpStatus.GATEWAY_TIMEOUT),
    PROGRESS_HANDLE_NOT_FOUND(2041, "Progress handle not found", ErrorType.POLLING_TIMEOUT, HttpStatus.GATEWAY_TIMEOUT),
    MONITOR_INTERRUPTED(2042, "Progress monitor interrupted", ErrorType.POLLING_TIMEOUT, HttpStatus.SERVICE_UNAVAILABLE),
    MONITOR_CRASHED(2043, "Progress monitor failed", ErrorType.UNCATEGORIZED, HttpStatus.INTERNAL_SERVER_ERROR),

    VERSION_MISMATCH(2050, "Version mismatch after install", ErrorType.RECONCILIATION_MISMATCH, HttpStatus.CONFLICT),

    INVENTORY_UNAVAILABLE(2060, "Package inventory request failed", ErrorType.EXTERNAL_SERVICE, HttpStatus.BAD_GATEWAY),
    ;

    ErrorCode(int code, String message, ErrorType type, HttpStatusCode statusCode) {
        this.code = code;
        this.message = message;
        this.type = type;
        this.statusCode = statusCode;
    }

    private final int code;
    private final String message;
    private final ErrorType type;
    private final HttpStatusCode statusCode;
}
