package com.example.stlabels.service.diff;

import com.example.stlabels.config.StLabelsConfig;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.github.difflib.patch.PatchFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Построчный unified diff между двумя текстами (логика этапа или код ST).
 * <p>
 * Одинаковые входные данные всегда дают побайтно одинаковый результат.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiffEngine {

    private final StLabelsConfig config;

    /**
     * Строит unified diff.
     *
     * @param oldText исходный текст (null рассматривается как пустой)
     * @param newText новый текст (null рассматривается как пустой)
     * @return текст diff или пустая строка, если тексты совпадают
     */
    public String diff(String oldText, String newText) {
        List<String> original = splitLines(oldText);
        List<String> revised = splitLines(newText);

        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        StLabelsConfig.DiffConfig diffConfig = config.getDiff();
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                diffConfig.getOriginalLabel(),
                diffConfig.getRevisedLabel(),
                original,
                patch,
                diffConfig.getContextLines());

        log.debug("Computed diff with {} deltas", patch.getDeltas().size());
        return String.join("\n", unified);
    }

    /**
     * Применяет unified diff к исходному тексту.
     *
     * @param oldText     исходный текст
     * @param unifiedDiff diff, построенный {@link #diff(String, String)}
     * @return восстановленный новый текст
     * @throws IllegalStateException если diff не применяется к тексту
     */
    public String apply(String oldText, String unifiedDiff) {
        if (unifiedDiff == null || unifiedDiff.isEmpty()) {
            return oldText == null ? "" : oldText;
        }

        Patch<String> patch = UnifiedDiffUtils.parseUnifiedDiff(splitLines(unifiedDiff));
        try {
            List<String> patched = DiffUtils.patch(splitLines(oldText), patch);
            return String.join("\n", patched);
        } catch (PatchFailedException e) {
            log.error("Failed to apply diff", e);
            throw new IllegalStateException("Diff does not apply to the given text: " + e.getMessage(), e);
        }
    }

    /**
     * Разбивает текст на строки по \n. Пустой текст не содержит строк,
     * завершающий перевод строки даёт пустую последнюю строку.
     */
    static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(text.split("\n", -1));
    }
}
