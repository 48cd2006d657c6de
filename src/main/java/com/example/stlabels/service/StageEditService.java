package com.example.stlabels.service;

import com.example.stlabels.dto.StageEditResult;
import com.example.stlabels.model.ActionType;
import com.example.stlabels.model.Actor;
import com.example.stlabels.model.Label;
import com.example.stlabels.model.ParsedProgram;
import com.example.stlabels.model.StageSnapshot;
import com.example.stlabels.model.VersionEntry;
import com.example.stlabels.service.extraction.LabelExtractor;
import com.example.stlabels.service.formatting.LabelFormatter;
import com.example.stlabels.service.ledger.VersionLedger;
import com.example.stlabels.service.store.ActorDirectory;
import com.example.stlabels.service.store.StageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Основной сервис изменения этапа.
 * <p>
 * Отредактированный текст ST разбирается на метки и тело, результат становится
 * текущим состоянием этапа, а изменение фиксируется в журнале версий вместе с diff.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StageEditService {

    private final StageStore stageStore;
    private final LabelExtractor labelExtractor;
    private final LabelFormatter labelFormatter;
    private final VersionLedger versionLedger;
    private final GlobalLabelsService globalLabelsService;
    private final ActorDirectory actorDirectory;

    /**
     * Регистрирует этап с начальной логикой и кодом. Запись в журнал не добавляется.
     */
    public StageSnapshot createStage(String stageId, String projectId, String logic, String code) {
        ParsedProgram program = labelExtractor.extract(code);
        StageSnapshot snapshot = StageSnapshot.builder()
                .stageId(stageId)
                .projectId(projectId)
                .logic(logic == null ? "" : logic)
                .program(program)
                .build();
        stageStore.save(snapshot);
        log.info("Registered stage {} of project {} with {} labels",
                stageId, projectId, program.getTotalLabels());
        return snapshot;
    }

    /**
     * Редактирование описания логики этапа.
     */
    public StageEditResult editLogic(String stageId, Actor actor, String newLogic) {
        return versionLedger.withStageLock(stageId, () -> {
            StageSnapshot stage = getStage(stageId);
            String logic = newLogic == null ? "" : newLogic;

            VersionEntry entry = versionLedger.append(stageId, attribute(actor), ActionType.EDIT_LOGIC,
                    stage.getLogic(), logic, description("Stage logic edited"));
            stageStore.save(stage.toBuilder().logic(logic).build());

            return result(stageId, stage.getProgram(), entry);
        });
    }

    /**
     * Ручное редактирование полного текста ST: метки синхронизируются с телом программы.
     */
    public StageEditResult editCode(String stageId, Actor actor, String code) {
        return versionLedger.withStageLock(stageId, () -> {
            StageSnapshot stage = getStage(stageId);
            ParsedProgram program = labelExtractor.extract(code);

            if (!program.getSkippedLines().isEmpty()) {
                log.warn("Stage {}: {} lines were not recognised as label declarations",
                        stageId, program.getSkippedLines().size());
            }

            String oldCode = labelFormatter.format(stage.getProgram());
            String newCode = labelFormatter.format(program);

            Map<String, Object> metadata = description("Code manually edited");
            metadata.put("global_labels_count", program.getGlobalLabels().size());
            metadata.put("local_labels_count", program.getLocalLabels().size());
            metadata.put("skipped_lines", program.getSkippedLines().size());

            VersionEntry entry = versionLedger.append(stageId, attribute(actor), ActionType.EDIT_CODE,
                    oldCode, newCode, metadata);
            stageStore.save(stage.toBuilder().program(program).build());

            return result(stageId, program, entry);
        });
    }

    /**
     * Структурное редактирование: метки и тело передаются отдельно.
     * Текст собирается форматтером и проходит тот же путь, что и ручное редактирование,
     * поэтому класс и адрес устройства меток всегда выводятся заново.
     */
    public StageEditResult updateLabels(String stageId,
                                        Actor actor,
                                        List<Label> globalLabels,
                                        List<Label> localLabels,
                                        String programBody) {
        String code = labelFormatter.format(globalLabels, localLabels, programBody);
        return editCode(stageId, actor, code);
    }

    /**
     * Фиксирует результат генерации кода. В журнал попадает diff тела программы.
     * После генерации глобальные метки приводятся к общему набору проекта.
     */
    public StageEditResult recordGeneratedCode(String stageId, Actor actor, String generatedCode) {
        StageEditResult result = versionLedger.withStageLock(stageId, () -> {
            StageSnapshot stage = getStage(stageId);
            ParsedProgram program = labelExtractor.extract(generatedCode);

            Map<String, Object> metadata = description("Code generated");
            metadata.put("global_labels_count", program.getGlobalLabels().size());
            metadata.put("local_labels_count", program.getLocalLabels().size());

            VersionEntry entry = versionLedger.append(stageId, attribute(actor), ActionType.GENERATE_CODE,
                    stage.getProgram().getProgramBody(), program.getProgramBody(), metadata);
            stageStore.save(stage.toBuilder().program(program).build());

            return result(stageId, program, entry);
        });

        String projectId = getStage(stageId).getProjectId();
        if (projectId != null) {
            globalLabelsService.ensureCommonGlobalLabels(projectId);
            ParsedProgram synced = getStage(stageId).getProgram();
            result.setProgram(synced);
            result.setFormattedCode(labelFormatter.format(synced));
        }
        return result;
    }

    /**
     * Фиксирует результат валидации логики этапа.
     */
    public StageEditResult recordValidation(String stageId, Actor actor, boolean valid, String status) {
        return versionLedger.withStageLock(stageId, () -> {
            StageSnapshot stage = getStage(stageId);

            Map<String, Object> metadata = description("Stage validated");
            metadata.put("valid", valid);
            if (status != null) {
                metadata.put("validation_status", status);
            }

            VersionEntry entry = versionLedger.append(stageId, attribute(actor), ActionType.VALIDATE,
                    stage.getLogic(), stage.getLogic(), metadata);

            return result(stageId, stage.getProgram(), entry);
        });
    }

    /**
     * Фиксирует результат проверки безопасности кода этапа.
     */
    public StageEditResult recordSafetyCheck(String stageId, Actor actor, boolean passed, String riskLevel) {
        return versionLedger.withStageLock(stageId, () -> {
            StageSnapshot stage = getStage(stageId);

            Map<String, Object> metadata = description("Safety check performed");
            metadata.put("passed", passed);
            if (riskLevel != null) {
                metadata.put("risk_level", riskLevel);
            }

            String code = labelFormatter.format(stage.getProgram());
            VersionEntry entry = versionLedger.append(stageId, attribute(actor), ActionType.SAFETY_CHECK,
                    code, code, metadata);

            return result(stageId, stage.getProgram(), entry);
        });
    }

    public StageSnapshot getStage(String stageId) {
        return stageStore.findById(stageId)
                .orElseThrow(() -> new StageNotFoundException(stageId));
    }

    /**
     * Текущий код этапа в нормализованном виде.
     */
    public String getFormattedCode(String stageId) {
        return labelFormatter.format(getStage(stageId).getProgram());
    }

    /**
     * Запоминает отображаемое имя пользователя и возвращает его идентификатор.
     */
    private String attribute(Actor actor) {
        if (actor == null) {
            throw new IllegalArgumentException("Actor is required to record a version entry");
        }
        actorDirectory.register(actor);
        return actor.getId();
    }

    private StageEditResult result(String stageId, ParsedProgram program, VersionEntry entry) {
        return StageEditResult.builder()
                .stageId(stageId)
                .program(program)
                .formattedCode(labelFormatter.format(program))
                .versionEntry(entry)
                .build();
    }

    private static Map<String, Object> description(String description) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("description", description);
        return metadata;
    }
}
