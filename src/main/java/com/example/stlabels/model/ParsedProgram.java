package com.example.stlabels.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Результат извлечения меток из текста программы.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedProgram {
    /**
     * Глобальные метки в порядке объявления
     */
    @JsonProperty("global_labels")
    @Builder.Default
    private List<Label> globalLabels = new ArrayList<>();

    /**
     * Локальные метки в порядке объявления
     */
    @JsonProperty("local_labels")
    @Builder.Default
    private List<Label> localLabels = new ArrayList<>();

    /**
     * Тело программы без блоков объявлений
     */
    @JsonProperty("program_body")
    @Builder.Default
    private String programBody = "";

    /**
     * Диагностика пропущенных строк. Не участвует в сравнении.
     */
    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    @Builder.Default
    private List<SkippedLine> skippedLines = new ArrayList<>();

    public static ParsedProgram empty() {
        return ParsedProgram.builder().build();
    }

    @JsonIgnore
    public int getTotalLabels() {
        return globalLabels.size() + localLabels.size();
    }
}
