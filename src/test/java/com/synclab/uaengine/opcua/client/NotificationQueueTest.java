package com.synclab.uaengine.opcua.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NotificationQueueTest {

    @Test
    void overwritesOldestWhenFull() {
        NotificationQueue<Integer> queue = new NotificationQueue<>(2);

        assertFalse(queue.offer(1));
        assertFalse(queue.offer(2));
        assertTrue(queue.offer(3));

        assertEquals(2, queue.size());
        assertEquals(1, queue.getDropped());
        assertEquals(2, queue.poll());
        assertEquals(3, queue.poll());
        assertNull(queue.poll());
    }

    @Test
    void singleSlotKeepsLatest() {
        NotificationQueue<String> queue = new NotificationQueue<>(1);
        queue.offer("a");
        queue.offer("b");
        queue.offer("c");

        assertEquals("c", queue.poll());
        assertEquals(2, queue.getDropped());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new NotificationQueue<>(0));
    }
}
