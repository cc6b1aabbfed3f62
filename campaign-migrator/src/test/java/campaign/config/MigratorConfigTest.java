package campaign.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MigratorConfigTest {

    @Test
    void defaults() {
        MigratorConfig c = MigratorConfig.DEFAULTS;

        assertEquals("schemas", c.schemaLocation());
        assertNull(c.schemaDirectory());
        assertTrue(c.validateRecords());
        assertTrue(c.warnOnUnfilledFields());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
    }

    @Test
    void builderSetsEveryOption() {
        MigratorConfig c = MigratorConfig.builder()
                .schemaLocation("other")
                .schemaDirectory(Path.of("defs"))
                .validateRecords(false)
                .warnOnUnfilledFields(false)
                .alertLevel(AlertLevel.ERROR)
                .build();

        assertEquals("other", c.schemaLocation());
        assertEquals(Path.of("defs"), c.schemaDirectory());
        assertFalse(c.validateRecords());
        assertFalse(c.warnOnUnfilledFields());
        assertEquals(AlertLevel.ERROR, c.alertLevel());
    }

    @Test
    void blankSchemaLocationRejected() {
        assertThrows(IllegalArgumentException.class, () -> MigratorConfig.builder().schemaLocation(" "));
    }
}
