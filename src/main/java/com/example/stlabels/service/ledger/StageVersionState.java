package com.example.stlabels.service.ledger;

import com.example.stlabels.model.ActionType;
import com.example.stlabels.model.VersionEntry;
import com.example.stlabels.model.VersionNumber;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Текущее состояние версии этапа, вычисляемое сверткой записей журнала.
 */
@Value
public class StageVersionState {

    public static final StageVersionState EMPTY =
            new StageVersionState(VersionNumber.INITIAL, null, null, 0, 0);

    VersionNumber currentVersion;
    ActionType lastAction;
    Instant lastActionAt;
    int totalVersions;
    int validationCount;

    /**
     * Применяет одну запись к состоянию.
     */
    public StageVersionState apply(VersionEntry entry) {
        return new StageVersionState(
                entry.getVersionNumber(),
                entry.getActionType(),
                entry.getTimestamp(),
                totalVersions + 1,
                validationCount + (entry.getActionType() == ActionType.VALIDATE ? 1 : 0));
    }

    /**
     * Свертка записей в хронологическом порядке.
     */
    public static StageVersionState fold(List<VersionEntry> entries) {
        StageVersionState state = EMPTY;
        for (VersionEntry entry : entries) {
            state = state.apply(entry);
        }
        return state;
    }
}
