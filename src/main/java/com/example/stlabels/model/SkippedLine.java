package com.example.stlabels.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Строка, пропущенная при извлечении меток.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkippedLine {
    /**
     * Номер строки (с единицы)
     */
    private int lineNumber;

    /**
     * Исходный текст строки
     */
    private String text;

    /**
     * Секция, в которой находилась строка
     */
    private Section section;

    /**
     * Причина пропуска
     */
    private String reason;
}
