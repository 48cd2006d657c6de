package com.example.stlabels.dto;

import com.example.stlabels.model.ActionType;
import com.example.stlabels.model.VersionNumber;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Сводка по версиям этапа.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionSummary {

    @JsonProperty("stage_id")
    private String stageId;

    @JsonProperty("current_version")
    private VersionNumber currentVersion;

    @JsonProperty("last_action")
    private ActionType lastAction;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    @JsonProperty("total_versions")
    private int totalVersions;

    /**
     * Последние записи, от новых к старым
     */
    private List<VersionHistoryItem> history;
}
