package com.synclab.uaengine.opcua.pubsub;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PubSubIdsTest {

    @Test
    void idsAreDeterministic() {
        assertEquals(PubSubIds.publisherId("line1Connection"), PubSubIds.publisherId("line1Connection"));
        assertEquals(PubSubIds.writerId("line1WriterGroup"), PubSubIds.writerId("line1WriterGroup"));
    }

    @Test
    void idsStayInRange() {
        for (int i = 0; i < 500; i++) {
            long publisherId = PubSubIds.publisherId("publisher" + i);
            int writerId = PubSubIds.writerId("writer" + i);

            assertTrue(publisherId >= 0 && publisherId < PubSubIds.PUBLISHER_ID_MODULUS);
            assertTrue(writerId >= 0 && writerId < PubSubIds.WRITER_ID_MODULUS);
        }
    }

    @Test
    void suffixesGiveDifferentIds() {
        assertNotEquals(PubSubIds.writerId("plantWriterGroup"), PubSubIds.writerId("plantDataSetWriter"));
    }

    @Test
    void modulusMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> PubSubIds.of("x", 0));
    }
}
