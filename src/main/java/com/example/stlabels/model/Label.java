package com.example.stlabels.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Метка: одно объявление переменной в программе на Structured Text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Label {
    /**
     * Имя метки (например: START_BUTTON)
     */
    private String name;

    /**
     * Тип данных (BOOL, INT, TIMER ...). Не проверяется.
     */
    @JsonProperty("data_type")
    private String dataType;

    /**
     * Global или Local
     */
    @JsonProperty("class")
    private LabelClass labelClass;

    /**
     * Начальное значение, заданное через :=
     */
    @JsonProperty("initial_value")
    private String initialValue;

    /**
     * Комментарий после //
     */
    private String comment;

    /**
     * Адрес устройства (X0, Y10, M100 ...), только для глобальных меток
     */
    private String device;

    @JsonIgnore
    public boolean isGlobal() {
        return labelClass == LabelClass.GLOBAL;
    }
}
