package com.flowgraph.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubjectRefTest {

    @Test
    void of_shouldStoreKindAndId() {
        SubjectRef subject = SubjectRef.of("patient", "p-17");

        assertEquals("patient", subject.kind());
        assertEquals("p-17", subject.id());
        assertEquals("patient/p-17", subject.toString());
        assertEquals(subject, SubjectRef.of("patient", "p-17"));
        assertNotEquals(subject, SubjectRef.of("invoice", "p-17"));
    }

    @Test
    void of_shouldStringifyNonStringIds() {
        assertEquals("42", SubjectRef.of("order", (Object) 42L).id());
    }

    @Test
    void of_shouldRejectBlankParts() {
        assertThrows(IllegalArgumentException.class, () -> SubjectRef.of("", "1"));
        assertThrows(IllegalArgumentException.class, () -> SubjectRef.of("order", " "));
        assertThrows(IllegalArgumentException.class, () -> SubjectRef.of("order", (Object) null));
    }
}
