package dev.matchengine.web.dto;

import dev.matchengine.model.BackfillSummary;

public record BackfillResponse(String status, BackfillSummary summary) {

    public static BackfillResponse ok(BackfillSummary summary) {
        return new BackfillResponse("ok", summary);
    }
}
