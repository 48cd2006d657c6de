package com.example.stlabels.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Тип действия, фиксируемого в журнале версий.
 * Новое действие добавляется только вместе с правилом инкремента версии.
 */
public enum ActionType {
    /**
     * Редактирование логики этапа: PATCH + 1
     */
    EDIT_LOGIC("edit_logic", Increment.PATCH),

    /**
     * Валидация этапа: MINOR + 1, PATCH = 0
     */
    VALIDATE("validate", Increment.MINOR),

    /**
     * Генерация кода: MINOR + 1, PATCH = 0
     */
    GENERATE_CODE("generate_code", Increment.MINOR),

    /**
     * Ручное редактирование кода ST: PATCH + 1
     */
    EDIT_CODE("edit_code", Increment.PATCH),

    /**
     * Проверка безопасности: PATCH + 1
     */
    SAFETY_CHECK("safety_check", Increment.PATCH);

    /**
     * Какая часть версии увеличивается.
     */
    public enum Increment {
        MINOR,
        PATCH
    }

    private final String code;
    private final Increment increment;

    ActionType(String code, Increment increment) {
        this.code = code;
        this.increment = increment;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Increment getIncrement() {
        return increment;
    }

    public static ActionType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown action type: " + code));
    }
}
