package com.p14n.eventbroker.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ReferencesTest {

    @Test
    void shouldResolveTopLevelAndNestedClasses() {
        assertSame(ReferenceFixtures.class, References.refToObj("com.p14n.eventbroker.util:ReferenceFixtures"));
        assertSame(ReferenceFixtures.Nested.class,
                References.refToObj("com.p14n.eventbroker.util:ReferenceFixtures.Nested"));
        assertSame(String.class, References.refToObj("java.lang:String"));
    }

    @Test
    void shouldResolveStaticAndInstanceFields() {
        assertEquals("constant", References.refToObj("com.p14n.eventbroker.util:ReferenceFixtures.CONSTANT"));
        assertEquals("inner",
                References.refToObj("com.p14n.eventbroker.util:ReferenceFixtures.Nested.INSTANCE.label"));
    }

    @Test
    void shouldCreateReferencesThatResolveBack() {
        assertEquals("com.p14n.eventbroker.util:ReferenceFixtures.Nested",
                References.objToRef(ReferenceFixtures.Nested.class));
        assertEquals("com.p14n.eventbroker.util:ReferenceFixtures.Colour.RED",
                References.objToRef(ReferenceFixtures.Colour.RED));
        assertSame(ReferenceFixtures.Colour.RED,
                References.refToObj(References.objToRef(ReferenceFixtures.Colour.RED)));
    }

    @Test
    void shouldRejectObjectsWithoutReference() {
        Runnable lambda = () -> {
        };
        Object anonymous = new Object() {
        };

        assertThrows(IllegalArgumentException.class, () -> References.objToRef("plain string"));
        assertThrows(IllegalArgumentException.class, () -> References.objToRef(lambda.getClass()));
        assertThrows(IllegalArgumentException.class, () -> References.objToRef(anonymous.getClass()));
    }

    @Test
    void shouldRejectPathThroughNullField() {
        assertNull(References.refToObj("com.p14n.eventbroker.util:ReferenceFixtures.UNSET"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> References.refToObj("com.p14n.eventbroker.util:ReferenceFixtures.UNSET.length"));
        assertTrue(e.getMessage().contains("UNSET is null"));
    }

    @Test
    void shouldRejectMalformedOrUnknownReferences() {
        assertThrows(IllegalArgumentException.class, () -> References.refToObj("no.colon.Here"));
        assertThrows(IllegalArgumentException.class, () -> References.refToObj("java.lang:"));
        assertThrows(IllegalArgumentException.class, () -> References.refToObj(null));

        IllegalArgumentException notFound = assertThrows(IllegalArgumentException.class,
                () -> References.refToObj("com.p14n.missing:Nothing"));
        assertInstanceOf(ClassNotFoundException.class, notFound.getCause());

        assertThrows(IllegalArgumentException.class,
                () -> References.refToObj("com.p14n.eventbroker.util:ReferenceFixtures.missing"));
        assertThrows(IllegalArgumentException.class,
                () -> References.refToObj("com.p14n.eventbroker.util:ReferenceFixtures.Nested.label"));
    }
}
