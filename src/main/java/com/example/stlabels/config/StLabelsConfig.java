package com.example.stlabels.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Конфигурация модели меток ST, diff и журнала версий.
 */
@Data
@Configuration
@Validated
@ConfigurationProperties(prefix = "st")
public class StLabelsConfig {

    @Valid
    private LabelsConfig labels = new LabelsConfig();

    @Valid
    private DiffConfig diff = new DiffConfig();

    @Valid
    private LedgerConfig ledger = new LedgerConfig();

    @Data
    public static class LabelsConfig {
        /**
         * Префиксы адресов устройств (вход, выход, реле, регистр, таймер)
         */
        @NotNull
        private String devicePrefixes = "XYMDT";
    }

    @Data
    public static class DiffConfig {
        /**
         * Количество строк контекста вокруг изменений
         */
        @Min(0)
        private int contextLines = 3;

        /**
         * Заголовок исходного текста в diff
         */
        @NotBlank
        private String originalLabel = "original";

        /**
         * Заголовок нового текста в diff
         */
        @NotBlank
        private String revisedLabel = "revised";
    }

    @Data
    public static class LedgerConfig {
        /**
         * Сколько последних записей попадает в сводку по версиям
         */
        @Min(0)
        private int summaryHistorySize = 10;
    }
}
