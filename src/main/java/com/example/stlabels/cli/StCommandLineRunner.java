package com.example.stlabels.cli;

import com.example.stlabels.model.Label;
import com.example.stlabels.model.ParsedProgram;
import com.example.stlabels.model.SkippedLine;
import com.example.stlabels.service.diff.DiffEngine;
import com.example.stlabels.service.extraction.LabelExtractor;
import com.example.stlabels.service.formatting.LabelFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI для нормализации файла ST из командной строки.
 *
 * Примеры использования:
 *
 * java -jar st-labels.jar --st-file=./stage1.st
 *
 * java -jar st-labels.jar --st-file=./stage1.st --output=./stage1.normalized.st
 *
 * java -jar st-labels.jar --st-file=./stage1.st --diff-against=./stage1.old.st
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StCommandLineRunner implements ApplicationRunner {

    private final LabelExtractor labelExtractor;
    private final LabelFormatter labelFormatter;
    private final DiffEngine diffEngine;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!args.containsOption("st-file")) {
            log.info("Starting in service mode. Use --st-file=<path> for CLI mode.");
            return;
        }

        log.info("Starting in CLI mode");

        try {
            runCli(args);
            System.exit(0);
        } catch (Exception e) {
            log.error("CLI execution failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    void runCli(ApplicationArguments args) {
        Path input = Path.of(getRequiredOption(args, "st-file"));
        String output = getOption(args, "output", null);
        String diffAgainst = getOption(args, "diff-against", null);

        ParsedProgram program = labelExtractor.extract(read(input));
        String normalized = labelFormatter.format(program);

        if (output != null) {
            Path outputPath = Path.of(output);
            try {
                Path parent = outputPath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(outputPath, normalized);
                System.out.println("Normalized code saved to: " + outputPath.toAbsolutePath());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to save normalized code: " + e.getMessage(), e);
            }
        } else {
            System.out.println(normalized);
        }

        if (diffAgainst != null) {
            String previous = labelFormatter.format(labelExtractor.extract(read(Path.of(diffAgainst))));
            String diff = diffEngine.diff(previous, normalized);
            System.out.println();
            System.out.println(diff.isEmpty() ? "No differences" : diff);
        }

        printSummary(input, program);
    }

    private void printSummary(Path input, ParsedProgram program) {
        System.out.println();
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("                       LABEL SUMMARY                        ");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println();
        System.out.println("  File:            " + input);
        System.out.println("  Global labels:   " + program.getGlobalLabels().size());
        System.out.println("  Local labels:    " + program.getLocalLabels().size());
        System.out.println("  Skipped lines:   " + program.getSkippedLines().size());
        System.out.println();

        for (Label label : program.getGlobalLabels()) {
            String device = label.getDevice() != null ? " [" + label.getDevice() + "]" : "";
            System.out.println("    G " + label.getName() + " : " + label.getDataType() + device);
        }
        for (Label label : program.getLocalLabels()) {
            System.out.println("    L " + label.getName() + " : " + label.getDataType());
        }
        for (SkippedLine skipped : program.getSkippedLines()) {
            System.out.println("    ! line " + skipped.getLineNumber() + ": " + skipped.getReason());
        }
        System.out.println();
    }

    private static String read(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private String getRequiredOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name) || args.getOptionValues(name).isEmpty()) {
            throw new IllegalArgumentException("Required option --" + name + " is missing");
        }
        return args.getOptionValues(name).get(0);
    }

    private String getOption(ApplicationArguments args, String name, String defaultValue) {
        if (args.containsOption(name) && !args.getOptionValues(name).isEmpty()) {
            return args.getOptionValues(name).get(0);
        }
        return defaultValue;
    }
}
