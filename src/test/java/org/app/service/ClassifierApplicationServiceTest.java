package org.app.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClassifierApplicationServiceTest {

    @Test
    void loadResource_whenMissing_throwsClearMessage() {
        ClassifierApplicationService service = new ClassifierApplicationService();

        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> service.loadResource("missing_sample.json")
        );

        assertTrue(ex.getMessage().contains("Missing sample resource"));
    }

    @Test
    void loadResource_readsTestClasspathFixture() {
        ClassifierApplicationService service = new ClassifierApplicationService();

        service.loadResource("fixtures/separable.json");

        assertEquals(4, service.sampleSize());
        assertEquals(List.of("a", "b"), service.attributes());
        assertEquals("a", service.train("1").rootAttribute());
    }
}
