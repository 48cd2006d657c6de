package com.example.stlabels.service.scanner;

import com.example.stlabels.model.Section;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StScannerTest {

    private StScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new StScanner();
    }

    @Test
    void shouldClassifyGlobalSectionAndBody() {
        // Given
        String source = """
            VAR_GLOBAL
                START : BOOL;
            END_VAR
            IF START THEN
            END_IF;""";

        // When
        List<ScannedLine> lines = scanner.scan(source).collect(Collectors.toList());

        // Then
        assertEquals(List.of(LineKind.GLOBAL_OPEN, LineKind.DECLARATION, LineKind.END_VAR,
                LineKind.BODY, LineKind.BODY), kinds(lines));
        assertEquals(List.of(Section.GLOBAL, Section.GLOBAL, Section.GLOBAL, Section.NONE, Section.NONE),
                lines.stream().map(ScannedLine::getSection).collect(Collectors.toList()));
        assertEquals(1, lines.get(0).getLineNumber());
        assertEquals(5, lines.get(4).getLineNumber());
    }

    @Test
    void shouldRecognizeQualifiedBlockOpens() {
        assertEquals(LineKind.LOCAL_OPEN, StScanner.classify("VAR", Section.NONE));
        assertEquals(LineKind.LOCAL_OPEN, StScanner.classify("  VAR_INPUT", Section.NONE));
        assertEquals(LineKind.LOCAL_OPEN, StScanner.classify("VAR CONSTANT", Section.NONE));
        assertEquals(LineKind.LOCAL_OPEN, StScanner.classify("VAR_TEMP // scratch", Section.NONE));
        assertEquals(LineKind.GLOBAL_OPEN, StScanner.classify("VAR_GLOBAL", Section.NONE));
        assertEquals(LineKind.GLOBAL_OPEN, StScanner.classify("VAR_GLOBAL_RETAIN", Section.NONE));
        assertEquals(LineKind.GLOBAL_OPEN, StScanner.classify("VAR_GLOBAL CONSTANT", Section.NONE));
    }

    @Test
    void shouldTreatVarPrefixedIdentifiersAsBody() {
        assertEquals(LineKind.BODY, StScanner.classify("VARIABLE := 1;", Section.NONE));
        assertEquals(LineKind.BODY, StScanner.classify("VAR_X := 1;", Section.NONE));
        assertEquals(LineKind.BODY, StScanner.classify("var := 1;", Section.NONE));
    }

    @Test
    void shouldAcceptEndVarWithSemicolonAndComment() {
        assertEquals(LineKind.END_VAR, StScanner.classify("END_VAR;", Section.LOCAL));
        assertEquals(LineKind.END_VAR, StScanner.classify("  END_VAR // locals", Section.GLOBAL));
    }

    @Test
    void shouldTreatEndVarOutsideSectionAsBody() {
        List<ScannedLine> lines = scanner.scan("END_VAR\nX := 1;").collect(Collectors.toList());

        assertEquals(List.of(LineKind.BODY, LineKind.BODY), kinds(lines));
    }

    @Test
    void shouldIgnoreNestedOpenUntilEndVar() {
        // Given
        String source = "VAR\nVAR_GLOBAL\n  A : INT;\nEND_VAR\nB;";

        // When
        List<ScannedLine> lines = scanner.scan(source).collect(Collectors.toList());

        // Then
        assertEquals(List.of(LineKind.LOCAL_OPEN, LineKind.NESTED_OPEN, LineKind.DECLARATION,
                LineKind.END_VAR, LineKind.BODY), kinds(lines));
        // вложенное открытие не меняет секцию
        assertEquals(Section.LOCAL, lines.get(2).getSection());
    }

    @Test
    void shouldBeRestartable() {
        String source = "VAR_GLOBAL\n  A : BOOL;\nEND_VAR\nA := TRUE;";

        List<LineKind> first = kinds(scanner.scan(source).collect(Collectors.toList()));
        List<LineKind> second = kinds(scanner.scan(source).collect(Collectors.toList()));

        assertEquals(first, second);
    }

    @Test
    void shouldScanLazily() {
        List<ScannedLine> lines = scanner.scan("VAR\nA : INT;\nEND_VAR\nX;").limit(2).collect(Collectors.toList());

        assertEquals(2, lines.size());
        assertEquals(LineKind.DECLARATION, lines.get(1).getKind());
    }

    @Test
    void shouldHandleEmptyInput() {
        assertEquals(0, scanner.scan(null).count());
        assertEquals(0, scanner.scan("").count());
    }

    @Test
    void shouldStripCarriageReturns() {
        List<ScannedLine> lines = scanner.scan("VAR\r\nA : INT;\r\nEND_VAR\r\n").collect(Collectors.toList());

        assertEquals("A : INT;", lines.get(1).getText());
        assertEquals(LineKind.END_VAR, lines.get(2).getKind());
    }

    private static List<LineKind> kinds(List<ScannedLine> lines) {
        return lines.stream().map(ScannedLine::getKind).collect(Collectors.toList());
    }
}
