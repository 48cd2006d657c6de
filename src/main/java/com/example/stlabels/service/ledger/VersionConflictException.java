package com.example.stlabels.service.ledger;

import com.example.stlabels.model.VersionNumber;
import lombok.Getter;

/**
 * Запись журнала рассчитана от устаревшей версии этапа.
 * Такая запись не сохраняется: две записи с одним номером версии испортили бы журнал.
 */
@Getter
public class VersionConflictException extends RuntimeException {

    private final String stageId;
    private final VersionNumber expectedVersion;
    private final VersionNumber actualVersion;

    public VersionConflictException(String stageId, VersionNumber expectedVersion, VersionNumber actualVersion) {
        super("Version conflict for stage " + stageId + ": expected current version "
                + expectedVersion + " but was " + actualVersion);
        this.stageId = stageId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
