package com.example.stlabels.service.extraction;

import com.example.stlabels.metrics.LabelMetrics;
import com.example.stlabels.model.Label;
import com.example.stlabels.model.LabelClass;
import com.example.stlabels.model.ParsedProgram;
import com.example.stlabels.model.Section;
import com.example.stlabels.model.SkippedLine;
import com.example.stlabels.service.scanner.ScannedLine;
import com.example.stlabels.service.scanner.StScanner;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Сервис для извлечения меток из блоков VAR_GLOBAL и VAR программы на Structured Text.
 * <p>
 * Разбор толерантный: строки, не подходящие под грамматику объявления, пропускаются
 * и попадают в диагностику {@link ParsedProgram#getSkippedLines()}, исключения не
 * выбрасываются.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LabelExtractor {

    private final StScanner scanner;
    private final DeviceAddressMatcher deviceAddressMatcher;
    private final LabelMetrics labelMetrics;

    // name : type [:= value] [;] [// comment]
    private static final Pattern DECLARATION_PATTERN = Pattern.compile(
            "^([A-Za-z0-9_]+)\\s*:\\s*([A-Za-z0-9_]+)\\s*(?::=\\s*((?:(?!//)[^;])*?))?\\s*;?\\s*(?://(.*))?$");

    /**
     * Извлекает глобальные и локальные метки и тело программы.
     *
     * @param source исходный текст ST
     * @return результат разбора (никогда не null)
     */
    public ParsedProgram extract(String source) {
        Timer.Sample sample = labelMetrics.startTimer();
        ExtractionState state = new ExtractionState();

        scanner.scan(source).forEach(line -> {
            switch (line.getKind()) {
                case BODY:
                    state.body.add(line.getText());
                    break;
                case GLOBAL_OPEN:
                case LOCAL_OPEN:
                    state.openSection(line);
                    break;
                case NESTED_OPEN:
                    state.pendingLines.add(line);
                    state.pendingSkipped.add(skippedLine(line, "Nested block open ignored"));
                    break;
                case DECLARATION:
                    state.pendingLines.add(line);
                    parseDeclaration(line, state);
                    break;
                case END_VAR:
                    state.closeSection();
                    break;
                default:
                    throw new IllegalStateException("Unexpected line kind: " + line.getKind());
            }
        });

        state.finish();

        ParsedProgram program = ParsedProgram.builder()
                .globalLabels(state.globals)
                .localLabels(state.locals)
                .programBody(trimBlankLines(state.body))
                .skippedLines(state.skipped)
                .build();

        labelMetrics.recordExtraction(sample, program.getTotalLabels(), state.skipped.size());
        log.debug("Extracted {} global and {} local labels, {} lines skipped",
                state.globals.size(), state.locals.size(), state.skipped.size());
        return program;
    }

    /**
     * Разбирает строку объявления и добавляет метку в текущий блок.
     */
    private void parseDeclaration(ScannedLine line, ExtractionState state) {
        String trimmed = line.getText().trim();
        if (trimmed.isEmpty()) {
            return;
        }

        Matcher matcher = DECLARATION_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            log.debug("Skipping line {}: {}", line.getLineNumber(), trimmed);
            state.pendingSkipped.add(skippedLine(line, "Not a label declaration"));
            return;
        }

        String name = matcher.group(1);
        String dataType = matcher.group(2);
        String initialValue = blankToNull(matcher.group(3));
        String comment = blankToNull(matcher.group(4));

        Label.LabelBuilder label = Label.builder()
                .name(name)
                .dataType(dataType)
                .initialValue(initialValue);

        if (line.getSection() == Section.GLOBAL) {
            String device = deviceAddressMatcher.findDevice(name, comment).orElse(null);
            label.labelClass(LabelClass.GLOBAL)
                    .device(device)
                    .comment(stripLeadingDevice(comment, device));
        } else {
            label.labelClass(LabelClass.LOCAL)
                    .comment(comment);
        }

        state.pendingLabels.add(new PendingLabel(line, label.build()));
    }

    /**
     * Форматтер записывает адрес устройства в начало комментария,
     * поэтому при чтении он оттуда убирается.
     */
    static String stripLeadingDevice(String comment, String device) {
        if (comment == null || device == null) {
            return comment;
        }
        if (!comment.toUpperCase(Locale.ROOT).startsWith(device)) {
            return comment;
        }
        if (comment.length() > device.length() && !Character.isWhitespace(comment.charAt(device.length()))) {
            return comment;
        }
        return blankToNull(comment.substring(device.length()));
    }

    /**
     * Убирает пустые строки в начале и в конце тела.
     */
    static String trimBlankLines(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isBlank()) {
            start++;
        }
        while (end > start && lines.get(end - 1).isBlank()) {
            end--;
        }
        return String.join("\n", lines.subList(start, end));
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static SkippedLine skippedLine(ScannedLine line, String reason) {
        return SkippedLine.builder()
                .lineNumber(line.getLineNumber())
                .text(line.getText())
                .section(line.getSection())
                .reason(reason)
                .build();
    }

    private static final class PendingLabel {
        private final ScannedLine line;
        private final Label label;

        private PendingLabel(ScannedLine line, Label label) {
            this.line = line;
            this.label = label;
        }
    }

    /**
     * Состояние одного прохода. Метки открытого блока копятся отдельно и
     * принимаются только после END_VAR.
     */
    private static final class ExtractionState {
        private final List<Label> globals = new ArrayList<>();
        private final List<Label> locals = new ArrayList<>();
        private final List<String> body = new ArrayList<>();
        private final List<SkippedLine> skipped = new ArrayList<>();
        private final Set<String> globalNames = new HashSet<>();
        private final Set<String> localNames = new HashSet<>();

        private final List<ScannedLine> pendingLines = new ArrayList<>();
        private final List<PendingLabel> pendingLabels = new ArrayList<>();
        private final List<SkippedLine> pendingSkipped = new ArrayList<>();

        private void openSection(ScannedLine line) {
            pendingLines.clear();
            pendingLabels.clear();
            pendingSkipped.clear();
            pendingLines.add(line);
        }

        private void closeSection() {
            skipped.addAll(pendingSkipped);
            for (PendingLabel pending : pendingLabels) {
                Label label = pending.label;
                boolean added = label.isGlobal()
                        ? globalNames.add(label.getName())
                        : localNames.add(label.getName());
                if (!added) {
                    skipped.add(skippedLine(pending.line, "Duplicate label " + label.getName()));
                    continue;
                }
                (label.isGlobal() ? globals : locals).add(label);
            }
            pendingLines.clear();
            pendingLabels.clear();
            pendingSkipped.clear();
        }

        private void finish() {
            if (pendingLines.isEmpty()) {
                return;
            }
            ScannedLine open = pendingLines.get(0);
            List<ScannedLine> lines = new ArrayList<>(pendingLines);
            log.warn("Unterminated {} section at line {}, keeping {} labels and returning {} lines to program body",
                    open.getSection(), open.getLineNumber(), pendingLabels.size(), lines.size());

            // метки принимаются как при END_VAR, строки секции остаются и в теле
            closeSection();
            skipped.add(skippedLine(open, "Unterminated section, lines returned to program body"));
            lines.forEach(line -> body.add(line.getText()));
        }
    }
}
