package com.example.stlabels.service.formatting;

import com.example.stlabels.config.StLabelsConfig;
import com.example.stlabels.metrics.LabelMetrics;
import com.example.stlabels.model.Label;
import com.example.stlabels.model.LabelClass;
import com.example.stlabels.model.ParsedProgram;
import com.example.stlabels.service.extraction.LabelExtractor;
import com.example.stlabels.service.extraction.PatternDeviceAddressMatcher;
import com.example.stlabels.service.scanner.StScanner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LabelFormatterTest {

    private static final String[] TYPES = {"BOOL", "INT", "REAL", "TIME", "TON", "WORD"};
    private static final String[] VALUES = {"TRUE", "FALSE", "0", "100", "T#5s", "'abc'", "3.14"};
    private static final String[] COMMENTS = {"X0 start", "motor D200 speed", "note", "y5 lamp", "emergency stop"};
    private static final String[] NAMES = {"START", "STOP", "X3_IN", "M10_FLAG", "Motor_Speed", "Counter", "LAMP"};
    private static final String[] BODY = {"IF START THEN", "  Q := TRUE;", "END_IF;", "", "Counter := Counter + 1;",
            "T1(IN := START, PT := T#5s);"};

    private LabelFormatter formatter;
    private LabelExtractor extractor;

    @BeforeEach
    void setUp() {
        formatter = new LabelFormatter();
        extractor = new LabelExtractor(
                new StScanner(),
                new PatternDeviceAddressMatcher(new StLabelsConfig()),
                new LabelMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void shouldReturnBodyWhenNoLabels() {
        assertEquals("X;", formatter.format(List.of(), List.of(), "X;"));
        assertEquals("", formatter.format(null, null, null));
    }

    @Test
    void shouldFormatGlobalLabelWithDevice() {
        // Given
        Label start = Label.builder()
                .name("START")
                .dataType("BOOL")
                .initialValue("FALSE")
                .device("X0")
                .comment("Start button")
                .labelClass(LabelClass.GLOBAL)
                .build();

        // When
        String code = formatter.format(List.of(start), List.of(), "IF START THEN Q:=TRUE; END_IF;");

        // Then
        assertEquals("VAR_GLOBAL\n"
                + "    START : BOOL := FALSE; // X0 Start button\n"
                + "END_VAR\n"
                + "\n"
                + "IF START THEN Q:=TRUE; END_IF;", code);
    }

    @Test
    void shouldOmitDeviceForLocalLabels() {
        Label local = Label.builder().name("T1").dataType("TON").device("X0").labelClass(LabelClass.LOCAL).build();

        assertEquals("    T1 : TON;", formatter.formatDeclaration(local, false));
    }

    @Test
    void shouldFormatMinimalDeclaration() {
        Label label = Label.builder().name("A").dataType("INT").build();

        assertEquals("    A : INT;", formatter.formatDeclaration(label, true));
    }

    @Test
    void shouldWriteGlobalBlockBeforeLocalBlock() {
        Label global = Label.builder().name("G").dataType("BOOL").build();
        Label local = Label.builder().name("L").dataType("INT").comment("counter").build();

        String code = formatter.format(List.of(global), List.of(local), "");

        assertEquals("VAR_GLOBAL\n    G : BOOL;\nEND_VAR\n\nVAR\n    L : INT; // counter\nEND_VAR\n\n", code);
    }

    @Test
    void shouldRoundTripExtractedProgram() {
        // Given
        String source = """
            VAR_GLOBAL
              START:BOOL:=FALSE;//X0 Start button
              Y10_LAMP : BOOL; // lamp
            END_VAR
            VAR
              T1 : TON;
            END_VAR
            IF START THEN Q:=TRUE; END_IF;
            """;
        ParsedProgram program = extractor.extract(source);

        // When
        ParsedProgram reparsed = extractor.extract(formatter.format(program));

        // Then
        assertEquals(program, reparsed);
    }

    @Test
    void shouldRoundTripGeneratedPrograms() {
        Random random = new Random(42);

        for (int i = 0; i < 200; i++) {
            String source = randomSource(random);
            ParsedProgram program = extractor.extract(source);

            String formatted = formatter.format(program);
            ParsedProgram reparsed = extractor.extract(formatted);

            assertEquals(program, reparsed, () -> "Round trip failed for:\n" + source);
            assertTrue(reparsed.getSkippedLines().isEmpty(), () -> "Formatted code has skipped lines:\n" + formatted);
        }
    }

    private static String randomSource(Random random) {
        StringBuilder source = new StringBuilder();
        if (random.nextBoolean()) {
            appendBlock(source, "VAR_GLOBAL", random);
        }
        if (random.nextBoolean()) {
            appendBlock(source, "VAR", random);
        }
        int bodyLines = random.nextInt(5);
        for (int i = 0; i < bodyLines; i++) {
            source.append(pick(BODY, random)).append('\n');
        }
        return source.toString();
    }

    private static void appendBlock(StringBuilder source, String open, Random random) {
        source.append(open).append('\n');
        int count = 1 + random.nextInt(NAMES.length);
        for (int i = 0; i < count; i++) {
            // индекс в имени гарантирует уникальность внутри блока
            String name = pick(NAMES, random) + "_" + i;
            source.append(spaces(random)).append(name)
                    .append(spaces(random)).append(':').append(spaces(random))
                    .append(pick(TYPES, random));
            if (random.nextBoolean()) {
                source.append(spaces(random)).append(":=").append(spaces(random)).append(pick(VALUES, random));
            }
            source.append(spaces(random)).append(';');
            if (random.nextBoolean()) {
                source.append(spaces(random)).append("//").append(spaces(random)).append(pick(COMMENTS, random));
            }
            source.append('\n');
        }
        source.append("END_VAR\n");
    }

    private static String spaces(Random random) {
        return " ".repeat(random.nextInt(3));
    }

    private static String pick(String[] values, Random random) {
        return values[random.nextInt(values.length)];
    }
}
