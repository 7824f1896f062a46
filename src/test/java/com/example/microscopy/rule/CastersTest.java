package com.example.microscopy.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CastersTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String s) throws Exception {
        return mapper.readTree(s);
    }

    @Test
    void floatAcceptsNumbersAndNumericText() throws Exception {
        assertEquals(3.0, Casters.FLOAT.cast(json("3")).doubleValue());
        assertEquals(-1.25, Casters.FLOAT.cast(json("\" -1.25 \"")).doubleValue());
        assertThrows(RuntimeException.class, () -> Casters.FLOAT.cast(json("\"abc\"")));
        assertThrows(RuntimeException.class, () -> Casters.FLOAT.cast(json("true")));
        assertThrows(RuntimeException.class, () -> Casters.FLOAT.cast(json("{}")));
    }

    @Test
    void floatRejectsJavaOnlyLiteralForms() throws Exception {
        for (String text : new String[]{"\"1.5f\"", "\"2d\"", "\"0x1p3\"", "\"Infinity\"", "\"NaN\"", "\"\""}) {
            assertThrows(NumberFormatException.class, () -> Casters.FLOAT.cast(json(text)), text);
        }
        assertEquals(1.2e3, Casters.FLOAT.cast(json("\"1.2e3\"")).doubleValue());
        assertEquals(0.5, Casters.FLOAT.cast(json("\".5\"")).doubleValue());
        assertThrows(NumberFormatException.class, () -> Casters.MILLIMETER_LABEL.cast(json("\"2.5f mm\"")));
    }

    @Test
    void intTruncatesFloatsButRejectsDecimalText() throws Exception {
        assertEquals(38000, Casters.INT.cast(json("38000")).intValue());
        assertEquals(2, Casters.INT.cast(json("2.9")).intValue());
        assertEquals(-2, Casters.INT.cast(json("-2.9")).intValue());
        assertEquals(300, Casters.INT.cast(json("\"300\"")).intValue());
        assertThrows(RuntimeException.class, () -> Casters.INT.cast(json("\"12.5\"")));
        assertThrows(RuntimeException.class, () -> Casters.INT.cast(json("[1]")));
        assertThrows(RuntimeException.class, () -> Casters.INT.cast(json("1e12")));
    }

    @Test
    void stringAcceptsAnyScalar() throws Exception {
        assertEquals("JEOL", Casters.STRING.cast(json("\"JEOL\"")).textValue());
        assertEquals("200.0", Casters.STRING.cast(json("200.0")).textValue());
        assertEquals("true", Casters.STRING.cast(json("true")).textValue());
        assertThrows(RuntimeException.class, () -> Casters.STRING.cast(json("{\"a\":1}")));
    }

    @Test
    void boolUnderstandsCommonSpellings() throws Exception {
        assertTrue(Casters.BOOL.cast(json("\"Yes\"")).booleanValue());
        assertTrue(Casters.BOOL.cast(json("\"on\"")).booleanValue());
        assertTrue(Casters.BOOL.cast(json("1")).booleanValue());
        assertFalse(Casters.BOOL.cast(json("\"0\"")).booleanValue());
        assertFalse(Casters.BOOL.cast(json("false")).booleanValue());
        assertThrows(RuntimeException.class, () -> Casters.BOOL.cast(json("\"maybe\"")));
    }

    @Test
    void listOnlyAcceptsArrays() throws Exception {
        JsonNode src = json("[\"Si\",\"O\"]");
        JsonNode copy = Casters.LIST.cast(src);

        assertEquals(src, copy);
        assertNotSame(src, copy);
        assertThrows(RuntimeException.class, () -> Casters.LIST.cast(json("\"Si\"")));
    }

    @Test
    void millimeterLabelStripsUnit() throws Exception {
        assertEquals(2.5, Casters.MILLIMETER_LABEL.cast(json("\"2.5 mm\"")).doubleValue());
        assertEquals(5.0, Casters.MILLIMETER_LABEL.cast(json("\"5\"")).doubleValue());
        assertThrows(RuntimeException.class, () -> Casters.MILLIMETER_LABEL.cast(json("\"open\"")));
        assertThrows(RuntimeException.class, () -> Casters.MILLIMETER_LABEL.cast(json("2.5")));
    }
}
