package com.example.stlabels.service.store;

import com.example.stlabels.model.StageSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Хранилище текущего состояния этапов.
 */
public interface StageStore {

    Optional<StageSnapshot> findById(String stageId);

    List<StageSnapshot> findByProject(String projectId);

    void save(StageSnapshot snapshot);
}
