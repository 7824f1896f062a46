package com.example.microscopy.service;

import com.example.microscopy.Application;
import com.example.microscopy.decode.DatasetDecodeException;
import com.example.microscopy.decode.ExternalProcessDecoder;
import com.example.microscopy.decode.JsonExportDecoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = Application.class, properties = {
        "decoder.command[0]=no-such-em-decoder-binary",
        "decoder.command[1]={file}"
})
class MetadataExtractionServiceTests {

    @Autowired
    private MetadataExtractionService service;

    @Autowired
    private ObjectMapper mapper;

    @TempDir
    Path tmp;

    private static Path fixture(String name) throws Exception {
        return Paths.get(MetadataExtractionServiceTests.class.getResource("/fixtures/" + name).toURI());
    }

    private static JsonNode unit(double value, String unit) {
        ObjectNode n = new ObjectMapper().createObjectNode();
        n.put("value", value);
        n.put("unit", unit);
        return n;
    }

    @Test
    void picksDecoderByExtension() {
        assertInstanceOf(JsonExportDecoder.class, service.decoderFor(Path.of("a/b/export.JSON")));
        assertInstanceOf(ExternalProcessDecoder.class, service.decoderFor(Path.of("a/b/scan.dm3")));
    }

    @Test
    void extractsTecnaiExport() throws Exception {
        ObjectNode record = service.extract(fixture("tecnai_stack_export.json"));

        JsonNode em = record.path("electron_microscopy");
        JsonNode general = em.path("General_EM");
        JsonNode tem = em.path("TEM");
        JsonNode eels = em.path("EELS");

        // General / Sample
        assertEquals("lamella_01", em.path("General").path("title").asText());
        assertEquals(mapper.readTree("[\"Si\",\"O\"]"), general.path("elements"));

        // structured metadata 先写
        assertEquals(unit(200.0, "KiloEV"), general.path("beam_energy"));
        assertEquals(unit(12.5, "MilliRAD"), eels.path("collection_angle"));
        assertEquals("GIF Tridiem", eels.path("spectrometer_name").asText());

        // DM tag
        assertEquals(unit(200.0, "KiloEV"), general.path("accelerating_voltage"));
        assertEquals(unit(1.2, "MilliM"), tem.path("spherical_aberration_coefficient"));
        assertEquals("CCD", general.path("detector_name").asText());
        assertEquals("DigitalMicrograph", general.path("acquisition_software_name").asText());
        assertEquals("2.32.888.0", general.path("acquisition_software_version").asText());

        // Tecnai 自由文本覆盖前面的值
        assertEquals("Tecnai F20", general.path("microscope_name").asText());
        assertEquals("TEM HM", tem.path("operation_mode").asText());
        assertEquals(1.5, general.path("emission_current").path("value").doubleValue());
        assertEquals(38000, general.path("magnification_indicated").path("value").intValue());
        assertEquals(unit(12.34, "MicroM"), general.path("stage_position").path("x"));
        assertEquals(unit(10.0, "DEG"), general.path("stage_position").path("tilt_alpha"));
        assertEquals("EFTEM", eels.path("spectrometer_mode").asText());
        assertEquals(unit(2.0, "MilliM"), eels.path("aperture_size"));
        assertEquals(unit(20.0, "EV"), eels.path("total_energy_loss"));

        // 只用第一个数据集
        assertFalse(em.has("SEM"));
        assertEquals(mapper.readTree("[1024,2048]"), record.path("image").path("shape"));
        assertTrue(em.path("raw_metadata").has("ImageList"));
    }

    @Test
    void decodeFailuresPropagate() throws Exception {
        Path binary = Files.createFile(tmp.resolve("scan.dm3"));
        Path empty = Files.writeString(tmp.resolve("empty.json"), "[]");

        assertThrows(DatasetDecodeException.class, () -> service.extract(binary));
        assertThrows(DatasetDecodeException.class, () -> service.extract(tmp.resolve("missing.json")));
        assertThrows(DatasetDecodeException.class, () -> service.extract(empty));
    }
}
