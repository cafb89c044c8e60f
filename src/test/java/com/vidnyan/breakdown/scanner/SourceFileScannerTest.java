package com.vidnyan.breakdown.scanner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileScannerTest {

    @TempDir
    Path tempDir;

    private final SourceFileScanner scanner = new SourceFileScanner();

    @Test
    void scanSourceFiles_ShouldFindAcceptedFiles() throws IOException {
        // Arrange
        Path views = tempDir.resolve("src/main/kotlin/com/example/views");
        Files.createDirectories(views);
        Files.writeString(views.resolve("MainView.kt"), "class MainView : View()");
        Files.writeString(views.resolve("LoginView.kt"), "class LoginView : View()");
        Files.writeString(views.resolve("readme.txt"), "documentation");

        // Act
        List<Path> results = scanner.scanSourceFiles(tempDir, p -> p.toString().endsWith(".kt"));

        // Assert
        assertEquals(2, results.size());
        assertTrue(results.get(0).endsWith("LoginView.kt"));
        assertTrue(results.get(1).endsWith("MainView.kt"));
    }

    @Test
    void scanSourceFiles_ShouldSkipBuildAndToolDirectories() throws IOException {
        for (String dir : List.of("target/generated", "build/tmp", ".git/objects", "node_modules/lib", "src")) {
            Path path = tempDir.resolve(dir);
            Files.createDirectories(path);
            Files.writeString(path.resolve("Some.java"), "class Some {}");
        }

        List<Path> results = scanner.scanSourceFiles(tempDir, p -> true);

        assertEquals(1, results.size());
        assertEquals(tempDir.resolve("src/Some.java"), results.get(0));
    }

    @Test
    void scanSourceFiles_RootInsideBuildDirectory_ShouldStillScan() throws IOException {
        Path root = tempDir.resolve("build/sources");
        Files.createDirectories(root);
        Files.writeString(root.resolve("A.java"), "class A {}");

        assertEquals(1, scanner.scanSourceFiles(root, p -> true).size());
    }
}
