package com.example.acgarden.cli;

import com.example.acgarden.exception.ArchiveException;
import com.example.acgarden.model.ArchiveReport;
import com.example.acgarden.service.ArchiveService;
import com.example.acgarden.service.EditorLauncher;
import com.example.acgarden.service.GardenConfigStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Dispatches {@code archive}, {@code init [--force]} and {@code edit}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GardenCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: ac-garden <command>",
            "",
            "Commands:",
            "  archive          Archive your AC submissions",
            "  init [-f|--force] Initialize your config",
            "  edit             Edit your config file");

    private final ArchiveService archiveService;
    private final GardenConfigStore configStore;
    private final EditorLauncher editorLauncher;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    int execute(String... args) {
        List<String> arguments = Arrays.asList(args);
        if (arguments.isEmpty()) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        String command = arguments.get(0);
        List<String> options = arguments.subList(1, arguments.size());
        try {
            switch (command) {
                case "archive":
                    ArchiveReport report = archiveService.archive(configStore.load());
                    log.info("Archived {} of {} selected submissions ({} fetched)",
                            report.getArchivedCount(), report.getSelectedCount(), report.getFetchedCount());
                    return EXIT_OK;
                case "init":
                    boolean force = options.contains("-f") || options.contains("--force");
                    configStore.init(force);
                    return EXIT_OK;
                case "edit":
                    editorLauncher.edit();
                    return EXIT_OK;
                default:
                    System.err.println("Unknown command: " + command);
                    System.err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (ArchiveException e) {
            log.error("{} failed: {}", command, e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
