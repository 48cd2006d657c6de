package com.example.stlabels.service.scanner;

/**
 * Тип строки исходного кода ST.
 */
public enum LineKind {
    /**
     * Открытие блока VAR_GLOBAL (в т.ч. VAR_GLOBAL_RETAIN, VAR_GLOBAL CONSTANT)
     */
    GLOBAL_OPEN,

    /**
     * Открытие локального блока: VAR, VAR_INPUT, VAR_TEMP и т.д.
     */
    LOCAL_OPEN,

    /**
     * Закрытие блока END_VAR
     */
    END_VAR,

    /**
     * Открытие блока внутри уже открытой секции. Игнорируется.
     */
    NESTED_OPEN,

    /**
     * Строка внутри секции объявлений
     */
    DECLARATION,

    /**
     * Строка тела программы
     */
    BODY
}
