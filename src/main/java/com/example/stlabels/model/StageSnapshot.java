package com.example.stlabels.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Текущее состояние этапа: логика и разобранный код.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StageSnapshot {
    private String stageId;

    /**
     * Проект, которому принадлежит этап
     */
    private String projectId;

    /**
     * Описание логики этапа (текст, который редактирует пользователь)
     */
    @Builder.Default
    private String logic = "";

    /**
     * Текущий код этапа в разобранном виде
     */
    @Builder.Default
    private ParsedProgram program = ParsedProgram.empty();
}
