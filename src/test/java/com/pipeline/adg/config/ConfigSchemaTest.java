package com.pipeline.adg.config;

import com.pipeline.adg.error.ConfigValidationException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ConfigSchemaTest {
    private final ConfigSchema schema = ConfigSchema.builder()
            .required("limit", FieldType.INT)
            .optional("region", FieldType.STRING, "eu")
            .optional("ratio", FieldType.DOUBLE)
            .optional("tags", FieldType.LIST)
            .build();

    @Test
    public void testDefaultsFilledIn() {
        StepConfig config = schema.validate("orders", Map.of("limit", 10));
        assertEquals(10, config.getInt("limit"));
        assertEquals("eu", config.getString("region"));
        assertFalse(config.has("ratio"));
    }

    @Test
    public void testNumbersWidened() {
        StepConfig config = schema.validate("orders", Map.of("limit", 10L, "ratio", 2));
        assertEquals(10, config.getInt("limit"));
        assertEquals(2.0, config.getDouble("ratio"), 0.0);
    }

    @Test
    public void testListWithNullsAccepted() {
        List<String> tags = new ArrayList<>();
        tags.add("a");
        tags.add(null);
        StepConfig config = schema.validate("orders", Map.of("limit", 1, "tags", tags));
        assertEquals(tags, config.get("tags"));
    }

    @Test
    public void testEveryProblemReported() {
        Map<String, Object> values = new HashMap<>();
        values.put("region", 42);
        values.put("colour", "red");
        try {
            schema.validate("orders", values);
            fail("invalid config must be rejected");
        } catch (ConfigValidationException e) {
            assertEquals(3, e.problems().size());
            assertTrue(e.getMessage(), e.getMessage().contains("orders"));
            assertTrue(e.problems().contains("unknown field 'colour'"));
            assertTrue(e.problems().contains("missing required field 'limit'"));
        }
    }

    @Test
    public void testEmptySchemaRejectsAnyField() {
        assertTrue(ConfigSchema.EMPTY.validate("s", null).values().isEmpty());
        try {
            ConfigSchema.EMPTY.validate("s", Map.of("x", 1));
            fail();
        } catch (ConfigValidationException e) {
            assertEquals(List.of("unknown field 'x'"), e.problems());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadDefaultRejected() {
        ConfigSchema.builder().optional("n", FieldType.INT, "ten");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFieldDeclaredTwice() {
        ConfigSchema.builder().required("n", FieldType.INT).optional("n", FieldType.LONG);
    }

    @Test
    public void testRunConfigFromJson() {
        RunConfig run = RunConfig.fromJson("{\"orders\": {\"limit\": 100, \"region\": \"us\"}}");
        StepConfig config = schema.validate("orders", run.forStep("orders"));
        assertEquals(100, config.getInt("limit"));
        assertEquals("us", config.getString("region"));
        assertTrue(run.forStep("other").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedRunConfig() {
        RunConfig.fromJson("{not json");
    }
}
