package com.example.stlabels.service.store;

import com.example.stlabels.model.VersionEntry;
import com.example.stlabels.model.VersionNumber;
import com.example.stlabels.service.ledger.VersionConflictException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Хранилище журнала версий в памяти.
 */
@Service
public class InMemoryVersionEntryStore implements VersionEntryStore {
    private final Map<String, List<VersionEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public List<VersionEntry> findByStage(String stageId) {
        return entries.getOrDefault(stageId, List.of());
    }

    @Override
    public void append(String stageId, VersionNumber expectedCurrentVersion, VersionEntry entry) {
        entries.compute(stageId, (id, current) -> {
            List<VersionEntry> existing = current == null ? List.of() : current;
            VersionNumber actual = existing.isEmpty()
                    ? VersionNumber.INITIAL
                    : existing.get(existing.size() - 1).getVersionNumber();
            if (!actual.equals(expectedCurrentVersion)) {
                throw new VersionConflictException(stageId, expectedCurrentVersion, actual);
            }
            List<VersionEntry> updated = new ArrayList<>(existing);
            updated.add(entry);
            return List.copyOf(updated);
        });
    }
}
