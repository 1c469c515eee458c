package com.example.acgarden.service;

import com.example.acgarden.exception.ConfigException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Opens the config file with $EDITOR, or the desktop's default opener.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EditorLauncher {

    private final GardenConfigStore configStore;

    public void edit() {
        Path file = configStore.configFile();
        if (!Files.isRegularFile(file)) {
            configStore.init(true);
        }

        String editor = System.getenv("EDITOR");
        List<String> command = command(editor, System.getProperty("os.name", ""), file);
        boolean wait = editor != null && !editor.isBlank();
        log.info("Opening {} with {}", file, command.get(0));

        try {
            Process process = new ProcessBuilder(command).inheritIO().start();
            if (wait) {
                int exit = process.waitFor();
                if (exit != 0) {
                    log.warn("Editor exited with status {}", exit);
                }
            }
        } catch (IOException e) {
            throw new ConfigException("Failed to launch " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigException("Interrupted while waiting for the editor", e);
        }
    }

    static List<String> command(String editor, String osName, Path file) {
        String path = file.toString();
        if (editor != null && !editor.isBlank()) {
            return List.of(editor, path);
        }
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac")) {
            return List.of("open", path);
        }
        if (os.contains("win")) {
            return List.of("cmd", "/c", "start", "", path);
        }
        return List.of("xdg-open", path);
    }
}
