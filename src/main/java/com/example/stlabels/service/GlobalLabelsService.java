package com.example.stlabels.service;

import com.example.stlabels.model.Label;
import com.example.stlabels.model.ParsedProgram;
import com.example.stlabels.model.StageSnapshot;
import com.example.stlabels.service.ledger.VersionLedger;
import com.example.stlabels.service.store.StageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Сервис общих глобальных меток проекта.
 * <p>
 * Метка идентифицируется адресом устройства, а при его отсутствии именем.
 * Имена глобальных меток в наборе проекта уникальны.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GlobalLabelsService {

    private final StageStore stageStore;
    private final VersionLedger versionLedger;

    /**
     * Собирает уникальные глобальные метки со всех этапов проекта.
     * При совпадении идентификатора или имени остаётся метка этапа, встреченного первым.
     */
    public List<Label> getProjectGlobalLabels(String projectId) {
        List<Label> labels = new ArrayList<>();
        Set<String> identifiers = new HashSet<>();
        Set<String> names = new HashSet<>();

        for (StageSnapshot stage : stageStore.findByProject(projectId)) {
            for (Label label : stage.getProgram().getGlobalLabels()) {
                String identifier = identifier(label);
                if (identifier == null || identifiers.contains(identifier) || names.contains(label.getName())) {
                    continue;
                }
                identifiers.add(identifier);
                if (hasText(label.getName())) {
                    names.add(label.getName());
                }
                labels.add(label);
            }
        }

        log.info("Retrieved {} unique global labels for project {}", labels.size(), projectId);
        return labels;
    }

    /**
     * Объединяет метки, пропуская новые метки с уже известным адресом или именем.
     */
    public List<Label> mergeGlobalLabels(List<Label> existing, List<Label> additions) {
        List<Label> merged = new ArrayList<>(existing);
        Set<String> devices = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (Label label : existing) {
            if (hasText(label.getDevice())) {
                devices.add(label.getDevice());
            }
            if (hasText(label.getName())) {
                names.add(label.getName());
            }
        }

        for (Label label : additions) {
            String identifier = identifier(label);
            if (identifier == null || devices.contains(identifier) || names.contains(label.getName())) {
                continue;
            }
            merged.add(label);
            if (hasText(label.getDevice())) {
                devices.add(label.getDevice());
            }
            if (hasText(label.getName())) {
                names.add(label.getName());
            }
            log.debug("Added new global label: {}", identifier);
        }

        log.info("Merged labels: {} existing + {} new = {} total",
                existing.size(), additions.size(), merged.size());
        return merged;
    }

    /**
     * Заменяет глобальные метки всех этапов проекта на переданный список.
     * Каждый этап перечитывается и сохраняется под своей блокировкой журнала.
     *
     * @return количество обновлённых этапов
     */
    public int updateAllStagesWithGlobalLabels(String projectId, List<Label> globalLabels) {
        int updated = 0;
        for (StageSnapshot listed : stageStore.findByProject(projectId)) {
            String stageId = listed.getStageId();
            boolean saved = versionLedger.withStageLock(stageId, () -> stageStore.findById(stageId)
                    .map(stage -> {
                        stageStore.save(withGlobalLabels(stage, globalLabels));
                        return true;
                    })
                    .orElse(false));
            if (saved) {
                updated++;
            }
        }
        if (updated > 0) {
            log.info("Updated {} stages with unified global labels", updated);
        }
        return updated;
    }

    /**
     * Приводит все этапы проекта к общему набору глобальных меток.
     * Вызывается после генерации кода для любого этапа.
     */
    public List<Label> ensureCommonGlobalLabels(String projectId) {
        List<Label> labels = getProjectGlobalLabels(projectId);
        updateAllStagesWithGlobalLabels(projectId, labels);
        return labels;
    }

    private static StageSnapshot withGlobalLabels(StageSnapshot stage, List<Label> globalLabels) {
        ParsedProgram current = stage.getProgram();
        ParsedProgram program = ParsedProgram.builder()
                .globalLabels(new ArrayList<>(globalLabels))
                .localLabels(current.getLocalLabels())
                .programBody(current.getProgramBody())
                .build();
        return stage.toBuilder().program(program).build();
    }

    private static String identifier(Label label) {
        if (hasText(label.getDevice())) {
            return label.getDevice();
        }
        return hasText(label.getName()) ? label.getName() : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
