package com.example.stlabels.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Класс метки. Определяется блоком объявления, в котором найдена метка.
 */
public enum LabelClass {
    /**
     * Объявлена в блоке VAR_GLOBAL
     */
    GLOBAL("Global"),

    /**
     * Объявлена в блоке VAR (и его разновидностях VAR_INPUT, VAR_TEMP и т.д.)
     */
    LOCAL("Local");

    private final String displayName;

    LabelClass(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
