package com.example.stlabels.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Запись журнала версий этапа. Создаётся один раз и больше не изменяется.
 */
@Value
@Builder
public class VersionEntry {
    /**
     * Идентификатор записи
     */
    String id;

    /**
     * Этап, к которому относится запись
     */
    @JsonProperty("stage_id")
    String stageId;

    /**
     * Версия этапа после действия
     */
    @JsonProperty("version_number")
    VersionNumber versionNumber;

    /**
     * Версия этапа до действия
     */
    @JsonProperty("previous_version")
    VersionNumber previousVersion;

    @JsonProperty("action_type")
    ActionType actionType;

    /**
     * Снимок текста до действия
     */
    @JsonProperty("old_text")
    String oldText;

    /**
     * Снимок текста после действия
     */
    @JsonProperty("new_text")
    String newText;

    /**
     * Unified diff между oldText и newText
     */
    String diff;

    /**
     * Пользователь, выполнивший действие
     */
    @JsonProperty("actor_id")
    String actorId;

    Instant timestamp;

    /**
     * Дополнительные аннотации (результат валидации, уровень риска и т.д.)
     */
    Map<String, Object> metadata;
}
