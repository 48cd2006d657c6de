package com.example.stlabels.service.store;

import com.example.stlabels.model.StageSnapshot;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Хранилище этапов в памяти.
 */
@Service
public class InMemoryStageStore implements StageStore {
    private final Map<String, StageSnapshot> stages = new ConcurrentHashMap<>();

    @Override
    public Optional<StageSnapshot> findById(String stageId) {
        return Optional.ofNullable(stages.get(stageId));
    }

    @Override
    public List<StageSnapshot> findByProject(String projectId) {
        return stages.values().stream()
                .filter(stage -> Objects.equals(stage.getProjectId(), projectId))
                .sorted(Comparator.comparing(StageSnapshot::getStageId))
                .collect(Collectors.toList());
    }

    @Override
    public void save(StageSnapshot snapshot) {
        stages.put(snapshot.getStageId(), snapshot);
    }
}
