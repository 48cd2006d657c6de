package com.example.stlabels.dto;

import com.example.stlabels.model.ActionType;
import com.example.stlabels.model.VersionNumber;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Запись истории версий для отчётов (с именем пользователя).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionHistoryItem {
    private String id;

    @JsonProperty("version_number")
    private VersionNumber versionNumber;

    @JsonProperty("action_type")
    private ActionType actionType;

    @JsonProperty("old_text")
    private String oldText;

    @JsonProperty("new_text")
    private String newText;

    private String diff;

    private Instant timestamp;

    @JsonProperty("actor_id")
    private String actorId;

    /**
     * Отображаемое имя пользователя (или его идентификатор, если имя неизвестно)
     */
    @JsonProperty("employee_name")
    private String employeeName;

    private Map<String, Object> metadata;
}
