package com.example.stlabels.service.scanner;

import com.example.stlabels.model.Section;
import lombok.Value;

/**
 * Классифицированная строка исходного кода.
 */
@Value
public class ScannedLine {
    /**
     * Номер строки (с единицы)
     */
    int lineNumber;

    /**
     * Текст строки без символа перевода строки
     */
    String text;

    LineKind kind;

    /**
     * Секция, в которой находится строка. Для строк открытия и закрытия
     * блока это секция, которую строка открывает или закрывает.
     */
    Section section;
}
