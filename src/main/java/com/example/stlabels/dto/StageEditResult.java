package com.example.stlabels.dto;

import com.example.stlabels.model.ParsedProgram;
import com.example.stlabels.model.VersionEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Результат изменения этапа.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageEditResult {
    private String stageId;

    /**
     * Текущий код этапа после изменения
     */
    private ParsedProgram program;

    /**
     * Нормализованный текст кода (результат форматирования)
     */
    private String formattedCode;

    /**
     * Добавленная запись журнала
     */
    private VersionEntry versionEntry;
}
