package com.al.graphsubscriptions.model.enums;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

public class ChangeTypeTest {

    @Test
    public void testParse_TrimsAndIgnoresCase() {
        assertEquals(EnumSet.of(ChangeType.CREATED, ChangeType.UPDATED), ChangeType.parse(" Created , updated,"));
    }

    @Test
    public void testParse_Blank() {
        assertTrue(ChangeType.parse("  ").isEmpty());
        assertTrue(ChangeType.parse(null).isEmpty());
    }

    @Test
    public void testParse_UnknownValueRejected() {
        assertThrows(IllegalArgumentException.class, () -> ChangeType.parse("created,moved"));
    }

    @Test
    public void testFormat_ProviderWireForm() {
        assertEquals("created,updated", ChangeType.format(EnumSet.of(ChangeType.UPDATED, ChangeType.CREATED)));
    }
}
