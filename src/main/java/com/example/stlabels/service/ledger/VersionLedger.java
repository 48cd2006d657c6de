package com.example.stlabels.service.ledger;

import com.example.stlabels.metrics.LabelMetrics;
import com.example.stlabels.model.ActionType;
import com.example.stlabels.model.VersionEntry;
import com.example.stlabels.model.VersionNumber;
import com.example.stlabels.service.diff.DiffEngine;
import com.example.stlabels.service.store.VersionEntryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Журнал версий этапов.
 * <p>
 * Добавление записей для одного этапа выполняется строго последовательно,
 * этапы между собой независимы.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VersionLedger {

    public static final String META_ACTION = "action";
    public static final String META_PREVIOUS_VERSION = "previous_version";
    public static final String META_NEW_VERSION = "new_version";
    public static final String META_VALIDATION_COUNT = "validation_count";

    private final VersionEntryStore versionEntryStore;
    private final DiffEngine diffEngine;
    private final LabelMetrics labelMetrics;

    private final Map<String, ReentrantLock> stageLocks = new ConcurrentHashMap<>();

    /**
     * Добавляет запись о действии и присваивает ей следующую версию.
     *
     * @param stageId    этап
     * @param actorId    пользователь, выполнивший действие
     * @param actionType тип действия
     * @param oldText    текст до действия (может быть null)
     * @param newText    текст после действия (может быть null)
     * @param metadata   дополнительные аннотации (могут быть null)
     * @return сохранённая запись
     * @throws VersionConflictException если версия этапа изменилась в обход журнала
     */
    public VersionEntry append(String stageId,
                               String actorId,
                               ActionType actionType,
                               String oldText,
                               String newText,
                               Map<String, Object> metadata) {
        return withStageLock(stageId, () -> {
            StageVersionState state = currentState(stageId);
            VersionNumber previousVersion = state.getCurrentVersion();
            VersionNumber newVersion = previousVersion.next(actionType);

            String before = oldText == null ? "" : oldText;
            String after = newText == null ? "" : newText;

            // служебные ключи журнала перекрывают одноимённые ключи вызывающего
            Map<String, Object> entryMetadata = new LinkedHashMap<>();
            if (metadata != null) {
                entryMetadata.putAll(metadata);
            }
            entryMetadata.put(META_ACTION, actionType.getCode());
            entryMetadata.put(META_PREVIOUS_VERSION, previousVersion.toString());
            entryMetadata.put(META_NEW_VERSION, newVersion.toString());
            entryMetadata.put(META_VALIDATION_COUNT, state.getValidationCount());

            VersionEntry entry = VersionEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .stageId(stageId)
                    .versionNumber(newVersion)
                    .previousVersion(previousVersion)
                    .actionType(actionType)
                    .oldText(before)
                    .newText(after)
                    .diff(diffEngine.diff(before, after))
                    .actorId(actorId)
                    .timestamp(Instant.now())
                    .metadata(Collections.unmodifiableMap(entryMetadata))
                    .build();

            try {
                versionEntryStore.append(stageId, previousVersion, entry);
            } catch (VersionConflictException e) {
                labelMetrics.recordLedgerConflict();
                log.error("Rejected {} for stage {}: {}", actionType.getCode(), stageId, e.getMessage());
                throw e;
            }

            labelMetrics.recordLedgerAppend(actionType);
            log.info("Stage {}: {} {} -> {} by {}",
                    stageId, actionType.getCode(), previousVersion, newVersion, actorId);
            return entry;
        });
    }

    /**
     * Выполняет действие под блокировкой этапа. Блокировка реентерабельна,
     * поэтому внутри действия можно вызывать {@link #append}.
     */
    public <T> T withStageLock(String stageId, Supplier<T> action) {
        ReentrantLock lock = stageLocks.computeIfAbsent(stageId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Текущее состояние этапа как свертка его журнала.
     */
    public StageVersionState currentState(String stageId) {
        return StageVersionState.fold(versionEntryStore.findByStage(stageId));
    }

    /**
     * Записи этапа в хронологическом порядке.
     */
    public List<VersionEntry> history(String stageId) {
        return versionEntryStore.findByStage(stageId);
    }

    public Optional<VersionEntry> findByVersion(String stageId, VersionNumber versionNumber) {
        return versionEntryStore.findByStage(stageId).stream()
                .filter(entry -> entry.getVersionNumber().equals(versionNumber))
                .findFirst();
    }
}
