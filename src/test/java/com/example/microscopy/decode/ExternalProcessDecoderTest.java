package com.example.microscopy.decode;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ExternalProcessDecoderTest {

    @TempDir
    Path tmp;

    private ExternalProcessDecoder decoder(List<String> command) {
        return decoder(command, 300);
    }

    private ExternalProcessDecoder decoder(List<String> command, long timeoutSeconds) {
        DecoderProperties props = new DecoderProperties();
        props.setCommand(command);
        props.setTimeoutSeconds(timeoutSeconds);
        return new ExternalProcessDecoder(props, new DatasetJsonReader(new ObjectMapper()));
    }

    @Test
    void substitutesAbsoluteFilePath() throws Exception {
        Path file = Files.createFile(tmp.resolve("scan.dm3"));

        List<String> cmd = decoder(List.of("dump", "--in={file}", "-q")).buildCommand(file);

        assertEquals(List.of("dump", "--in=" + file.toAbsolutePath().normalize(), "-q"), cmd);
    }

    @Test
    void emptyCommandFails() throws Exception {
        Path file = Files.createFile(tmp.resolve("scan.dm4"));

        assertThrows(DatasetDecodeException.class, () -> decoder(List.of()).decode(file));
    }

    @Test
    void missingExecutableFails() throws Exception {
        Path file = Files.createFile(tmp.resolve("scan.emd"));

        DatasetDecodeException e = assertThrows(DatasetDecodeException.class,
                () -> decoder(List.of("no-such-em-decoder-binary", "{file}")).decode(file));
        assertNotNull(e.getCause());
    }

    @Test
    void missingInputFails() {
        assertThrows(DatasetDecodeException.class,
                () -> decoder(List.of("dump", "{file}")).decode(tmp.resolve("absent.dm3")));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void readsStdoutOfSuccessfulRun() throws Exception {
        Path file = Files.createFile(tmp.resolve("ok.dm3"));

        List<DecodedDataset> datasets = decoder(List.of("sh", "-c",
                "echo 'Loaded 1 signal'; echo '{\"metadata\":{\"n\":7}}'; echo noise >&2")).decode(file);

        assertEquals(1, datasets.size());
        assertEquals(7, datasets.get(0).structuredMetadata().path("n").intValue());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitFailsWithStderr() throws Exception {
        Path file = Files.createFile(tmp.resolve("bad.dm3"));

        DatasetDecodeException e = assertThrows(DatasetDecodeException.class,
                () -> decoder(List.of("sh", "-c", "echo boom >&2; exit 3")).decode(file));

        assertTrue(e.getMessage().contains("exit=3"));
        assertTrue(e.getMessage().contains("boom"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void hungDecoderIsKilledAfterTimeout() throws Exception {
        Path file = Files.createFile(tmp.resolve("slow.dm3"));
        ExternalProcessDecoder slow = decoder(List.of("sh", "-c", "exec sleep 30"), 1);

        long start = System.nanoTime();
        DatasetDecodeException e = assertThrows(DatasetDecodeException.class, () -> slow.decode(file));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(e.getMessage().contains("timed out"));
        assertTrue(elapsedMs < 10_000, "decode took " + elapsedMs + "ms");
    }
}
