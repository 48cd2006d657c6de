package com.example.stlabels.service.formatting;

import com.example.stlabels.model.Label;
import com.example.stlabels.model.ParsedProgram;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Сервис для обратного преобразования меток и тела программы в текст ST.
 * <p>
 * Является нормализатором: для программы, извлечённой из корректного текста,
 * повторное извлечение результата форматирования даёт ту же программу.
 */
@Service
public class LabelFormatter {

    private static final String INDENT = "    ";

    public String format(ParsedProgram program) {
        return format(program.getGlobalLabels(), program.getLocalLabels(), program.getProgramBody());
    }

    /**
     * Формирует текст ST. Пустые блоки не выводятся.
     *
     * @param globalLabels глобальные метки (могут быть null)
     * @param localLabels  локальные метки (могут быть null)
     * @param programBody  тело программы, добавляется без изменений
     * @return текст программы
     */
    public String format(List<Label> globalLabels, List<Label> localLabels, String programBody) {
        StringBuilder code = new StringBuilder();

        if (globalLabels != null && !globalLabels.isEmpty()) {
            code.append("VAR_GLOBAL\n");
            globalLabels.forEach(label -> code.append(formatDeclaration(label, true)).append('\n'));
            code.append("END_VAR\n\n");
        }

        if (localLabels != null && !localLabels.isEmpty()) {
            code.append("VAR\n");
            localLabels.forEach(label -> code.append(formatDeclaration(label, false)).append('\n'));
            code.append("END_VAR\n\n");
        }

        if (programBody != null) {
            code.append(programBody);
        }
        return code.toString();
    }

    /**
     * Одна строка объявления: {@code name : type[ := value];[ // [device] [comment]]}
     */
    String formatDeclaration(Label label, boolean withDevice) {
        StringBuilder line = new StringBuilder(INDENT)
                .append(label.getName())
                .append(" : ")
                .append(label.getDataType());

        if (hasText(label.getInitialValue())) {
            line.append(" := ").append(label.getInitialValue());
        }
        line.append(';');

        boolean device = withDevice && hasText(label.getDevice());
        boolean comment = hasText(label.getComment());
        if (device || comment) {
            line.append(" //");
            if (device) {
                line.append(' ').append(label.getDevice());
            }
            if (comment) {
                line.append(' ').append(label.getComment());
            }
        }
        return line.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
