package com.questrail.cpor.protocol.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class BytesTest
{
    @Test
    void equalityIsByContent()
    {
        assertEquals(Bytes.of(new byte[] { 1, 2, 3 }), Bytes.of(new byte[] { 1, 2, 3 }));
        assertEquals(Bytes.of(new byte[] { 1, 2, 3 }).hashCode(), Bytes.of(new byte[] { 1, 2, 3 }).hashCode());
        assertNotEquals(Bytes.of(new byte[] { 1, 2, 3 }), Bytes.of(new byte[] { 1, 2 }));
    }

    @Test
    void copiesOnTheWayInAndOut()
    {
        byte[] source = { 9, 9 };
        Bytes bytes = Bytes.of(source);
        source[0] = 0;

        byte[] out = bytes.toByteArray();
        out[1] = 0;

        assertArrayEquals(new byte[] { 9, 9 }, bytes.toByteArray());
    }

    @Test
    void nullInNullOut()
    {
        assertNull(Bytes.of(null));
        assertTrue(Bytes.empty().isEmpty());
        assertEquals("Bytes[0a0a]", Bytes.repeat(10, 2).toString());
    }
}
