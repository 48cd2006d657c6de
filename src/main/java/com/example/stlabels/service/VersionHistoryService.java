package com.example.stlabels.service;

import com.example.stlabels.config.StLabelsConfig;
import com.example.stlabels.dto.VersionHistoryItem;
import com.example.stlabels.dto.VersionSummary;
import com.example.stlabels.model.Actor;
import com.example.stlabels.model.VersionEntry;
import com.example.stlabels.model.VersionNumber;
import com.example.stlabels.service.ledger.StageVersionState;
import com.example.stlabels.service.ledger.VersionLedger;
import com.example.stlabels.service.store.ActorDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Чтение истории версий для отчётов.
 */
@Service
@RequiredArgsConstructor
public class VersionHistoryService {

    private final VersionLedger versionLedger;
    private final ActorDirectory actorDirectory;
    private final StLabelsConfig config;

    /**
     * История этапа в хронологическом порядке с именами пользователей.
     */
    public List<VersionHistoryItem> getStageHistory(String stageId) {
        return versionLedger.history(stageId).stream()
                .map(this::toItem)
                .collect(Collectors.toList());
    }

    public Optional<VersionHistoryItem> getVersion(String stageId, String versionNumber) {
        return versionLedger.findByVersion(stageId, VersionNumber.parse(versionNumber))
                .map(this::toItem);
    }

    /**
     * Сводка: текущая версия, последнее действие и последние записи (от новых к старым).
     */
    public VersionSummary getVersionSummary(String stageId) {
        List<VersionEntry> entries = versionLedger.history(stageId);
        StageVersionState state = StageVersionState.fold(entries);

        List<VersionHistoryItem> recent = new ArrayList<>();
        int limit = Math.max(0, config.getLedger().getSummaryHistorySize());
        for (int i = entries.size() - 1; i >= 0 && recent.size() < limit; i--) {
            recent.add(toItem(entries.get(i)));
        }

        return VersionSummary.builder()
                .stageId(stageId)
                .currentVersion(state.getCurrentVersion())
                .lastAction(state.getLastAction())
                .lastUpdated(state.getLastActionAt())
                .totalVersions(state.getTotalVersions())
                .history(Collections.unmodifiableList(recent))
                .build();
    }

    private VersionHistoryItem toItem(VersionEntry entry) {
        String employeeName = actorDirectory.findById(entry.getActorId())
                .map(Actor::getDisplayName)
                .filter(name -> !name.isBlank())
                .orElse(entry.getActorId());

        return VersionHistoryItem.builder()
                .id(entry.getId())
                .versionNumber(entry.getVersionNumber())
                .actionType(entry.getActionType())
                .oldText(entry.getOldText())
                .newText(entry.getNewText())
                .diff(entry.getDiff())
                .timestamp(entry.getTimestamp())
                .actorId(entry.getActorId())
                .employeeName(employeeName)
                .metadata(entry.getMetadata())
                .build();
    }
}
