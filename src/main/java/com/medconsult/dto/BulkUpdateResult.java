package com.medconsult.dto;

import java.util.List;

/** Count of appointments changed by a bulk command plus the ids it refused. */
public record BulkUpdateResult(int updated, List<Long> rejectedIds) {

    public BulkUpdateResult {
        rejectedIds = List.copyOf(rejectedIds);
    }
}
