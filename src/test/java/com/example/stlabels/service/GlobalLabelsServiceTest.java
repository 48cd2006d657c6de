package com.example.stlabels.service;

import com.example.stlabels.config.StLabelsConfig;
import com.example.stlabels.metrics.LabelMetrics;
import com.example.stlabels.model.Label;
import com.example.stlabels.model.LabelClass;
import com.example.stlabels.model.ParsedProgram;
import com.example.stlabels.model.StageSnapshot;
import com.example.stlabels.service.diff.DiffEngine;
import com.example.stlabels.service.ledger.VersionLedger;
import com.example.stlabels.service.store.InMemoryStageStore;
import com.example.stlabels.service.store.InMemoryVersionEntryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GlobalLabelsServiceTest {

    private InMemoryStageStore stageStore;
    private GlobalLabelsService service;

    @BeforeEach
    void setUp() {
        stageStore = new InMemoryStageStore();
        VersionLedger versionLedger = new VersionLedger(new InMemoryVersionEntryStore(),
                new DiffEngine(new StLabelsConfig()), new LabelMetrics(new SimpleMeterRegistry()));
        service = new GlobalLabelsService(stageStore, versionLedger);
    }

    @Test
    void shouldCollectUniqueLabelsAcrossStages() {
        // Given
        saveStage("s1", "p1", List.of(global("START", "X0"), global("STOP", "X1")));
        saveStage("s2", "p1", List.of(global("START2", "X0"), global("LAMP", "Y0"), global("FLAG", null)));
        saveStage("s3", "p2", List.of(global("OTHER", "M5")));

        // When
        List<Label> labels = service.getProjectGlobalLabels("p1");

        // Then
        assertEquals(List.of("START", "STOP", "LAMP", "FLAG"), names(labels));
    }

    @Test
    void shouldKeepNamesUniqueAcrossDevices() {
        // Given
        saveStage("s1", "p1", List.of(global("START", "X0")));
        saveStage("s2", "p1", List.of(global("START", "X1"), global("STOP", "X2")));

        // When
        List<Label> common = service.ensureCommonGlobalLabels("p1");

        // Then
        assertEquals(List.of("START", "STOP"), names(common));
        assertEquals("X0", common.get(0).getDevice());
        assertEquals(List.of("START", "STOP"), names(stageStore.findById("s2").orElseThrow()
                .getProgram().getGlobalLabels()));
    }

    @Test
    void shouldSkipKnownDevicesAndNamesWhenMerging() {
        // Given
        List<Label> existing = List.of(global("START", "X0"));
        List<Label> additions = List.of(
                global("START_COPY", "X0"),
                global("START", null),
                global("LAMP", "Y1"),
                global("FLAG", null));

        // When
        List<Label> merged = service.mergeGlobalLabels(existing, additions);

        // Then
        assertEquals(List.of("START", "LAMP", "FLAG"), names(merged));
    }

    @Test
    void shouldUnifyGlobalLabelsOfProject() {
        // Given
        saveStage("s1", "p1", List.of(global("START", "X0")));
        saveStage("s2", "p1", List.of(global("LAMP", "Y0")));

        // When
        List<Label> common = service.ensureCommonGlobalLabels("p1");

        // Then
        assertEquals(2, common.size());
        assertEquals(List.of("START", "LAMP"), names(stageStore.findById("s1").orElseThrow()
                .getProgram().getGlobalLabels()));
        assertEquals(List.of("START", "LAMP"), names(stageStore.findById("s2").orElseThrow()
                .getProgram().getGlobalLabels()));
    }

    @Test
    void shouldKeepLocalLabelsAndBodyWhenUpdating() {
        // Given
        Label local = Label.builder().name("T1").dataType("TON").labelClass(LabelClass.LOCAL).build();
        ParsedProgram program = ParsedProgram.builder()
                .localLabels(List.of(local))
                .programBody("T1(IN := TRUE);")
                .build();
        stageStore.save(StageSnapshot.builder().stageId("s1").projectId("p1").program(program).build());

        // When
        int updated = service.updateAllStagesWithGlobalLabels("p1", List.of(global("START", "X0")));

        // Then
        assertEquals(1, updated);
        ParsedProgram result = stageStore.findById("s1").orElseThrow().getProgram();
        assertEquals(List.of(local), result.getLocalLabels());
        assertEquals("T1(IN := TRUE);", result.getProgramBody());
        assertEquals(1, result.getGlobalLabels().size());
        assertEquals(0, service.updateAllStagesWithGlobalLabels("unknown", List.of()));
    }

    private void saveStage(String stageId, String projectId, List<Label> globals) {
        ParsedProgram program = ParsedProgram.builder().globalLabels(globals).build();
        stageStore.save(StageSnapshot.builder().stageId(stageId).projectId(projectId).program(program).build());
    }

    private static Label global(String name, String device) {
        return Label.builder()
                .name(name)
                .dataType("BOOL")
                .device(device)
                .labelClass(LabelClass.GLOBAL)
                .build();
    }

    private static List<String> names(List<Label> labels) {
        return labels.stream().map(Label::getName).collect(Collectors.toList());
    }
}
