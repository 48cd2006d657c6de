package com.example.stlabels.service.store;

import com.example.stlabels.model.VersionEntry;
import com.example.stlabels.model.VersionNumber;
import com.example.stlabels.service.ledger.VersionConflictException;

import java.util.List;

/**
 * Хранилище журнала версий. Записи только добавляются.
 */
public interface VersionEntryStore {

    /**
     * Записи этапа в порядке добавления.
     */
    List<VersionEntry> findByStage(String stageId);

    /**
     * Добавляет запись, если текущая версия этапа совпадает с ожидаемой.
     *
     * @throws VersionConflictException если версия этапа уже изменилась
     */
    void append(String stageId, VersionNumber expectedCurrentVersion, VersionEntry entry);
}
