package com.example.microscopy.decode;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonExportDecoderTest {

    private final JsonExportDecoder decoder = new JsonExportDecoder(new DatasetJsonReader(new ObjectMapper()));

    @TempDir
    Path tmp;

    private Path write(String name, String content) throws Exception {
        Path file = tmp.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void readsSingleObject() throws Exception {
        Path file = write("one.json",
                "{\"metadata\":{\"General\":{\"title\":\"a\"}},\"original_metadata\":{\"k\":1}}");

        List<DecodedDataset> datasets = decoder.decode(file);

        assertEquals(1, datasets.size());
        assertEquals("a", datasets.get(0).structuredMetadata().path("General").path("title").asText());
        assertEquals(1, datasets.get(0).rawMetadata().path("k").intValue());
    }

    @Test
    void readsArrayAndSkipsBannerLines() throws Exception {
        Path file = write("stack.json", "WARNING: lazy loading\nLoaded 2 signals\n"
                + "[{\"metadata\":{\"n\":1}},{\"metadata\":{\"n\":2},\"original_metadata\":null}]");

        List<DecodedDataset> datasets = decoder.decode(file);

        assertEquals(2, datasets.size());
        assertEquals(2, datasets.get(1).structuredMetadata().path("n").intValue());
        // 缺失或为 null 的树都变成空对象
        assertTrue(datasets.get(0).rawMetadata().isObject());
        assertTrue(datasets.get(1).rawMetadata().isEmpty());
    }

    @Test
    void missingFileFails() {
        assertThrows(DatasetDecodeException.class, () -> decoder.decode(tmp.resolve("nope.json")));
    }

    @Test
    void malformedJsonFails() throws Exception {
        Path broken = write("broken.json", "{\"metadata\": {");
        Path noJson = write("text.json", "nothing to see here");
        Path scalarEntry = write("scalar.json", "[1, 2]");

        DatasetDecodeException e = assertThrows(DatasetDecodeException.class, () -> decoder.decode(broken));
        assertNotNull(e.getCause());
        assertThrows(DatasetDecodeException.class, () -> decoder.decode(noJson));
        assertThrows(DatasetDecodeException.class, () -> decoder.decode(scalarEntry));
    }
}
