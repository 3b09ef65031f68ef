package paytask.gateway.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FeeIniLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsFeesFromClasspathFile() throws IOException, URISyntaxException {
        File file = new File(Objects.requireNonNull(getClass().getResource("/fees.ini")).toURI());

        FeeSchedule fees = FeeIniLoader.load(file).orElseThrow();

        assertEquals(50, fees.addResourceFee());
        assertEquals(10, fees.verifyFee());
        assertEquals(100, fees.addTaskFee());
    }

    @Test
    void missingKeyIsRejected() throws IOException {
        Path file = write("[FEES]\nverify_fee = 10\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> FeeIniLoader.load(file.toFile()));
        assertTrue(e.getMessage().contains("add_task_fee"));
    }

    @Test
    void incompleteFileLeavesRegistryUnset() throws IOException {
        Path file = write("[FEES]\nadd_resource_fee = 5\nverify_fee = 10\n");
        FeeRegistry registry = new FeeRegistry();

        assertThrows(IllegalArgumentException.class,
                () -> FeeIniLoader.load(file.toFile()).ifPresent(registry::initialize));

        assertFalse(registry.isInitialized());
        assertTrue(registry.addTaskFee().isEmpty());
    }

    @Test
    void blankValueIsRejected() throws IOException {
        Path file = write("[FEES]\nadd_resource_fee = 1\nverify_fee = 2\nadd_task_fee =\n");
        assertThrows(IllegalArgumentException.class, () -> FeeIniLoader.load(file.toFile()));
    }

    @Test
    void noSectionGivesEmpty() throws IOException {
        Path file = write("[OTHER]\nkey = value\n");
        assertEquals(Optional.empty(), FeeIniLoader.load(file.toFile()));
    }

    @Test
    void badNumberIsRejected() throws IOException {
        Path file = write("[FEES]\nadd_task_fee = lots\n");
        assertThrows(IllegalArgumentException.class, () -> FeeIniLoader.load(file.toFile()));
    }

    @Test
    void negativeFeeIsRejected() throws IOException {
        Path file = write("[FEES]\nadd_task_fee = -5\n");
        assertThrows(IllegalArgumentException.class, () -> FeeIniLoader.load(file.toFile()));
    }

    @Test
    void missingFileFails() {
        File missing = tempDir.resolve("missing.ini").toFile();
        assertThrows(IOException.class, () -> FeeIniLoader.load(missing));
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("fees-" + System.nanoTime() + ".ini");
        Files.writeString(file, content);
        return file;
    }
}
