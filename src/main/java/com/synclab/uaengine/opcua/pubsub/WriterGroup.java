package com.synclab.uaengine.opcua.pubsub;

import com.synclab.uaengine.variable.Variable;
import io.netty.buffer.ByteBuf;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 주기적으로 소속 DataSetWriter 들의 메시지를 하나의 NetworkMessage 로 묶어 보낸다.
 */
public class WriterGroup {

    private static final Logger log = LoggerFactory.getLogger(WriterGroup.class);

    private final String name;
    private final int writerGroupId;
    private final double publishingIntervalMillis;
    private final PubSubConnection connection;
    private final UadpMessageEncoder encoder;
    private final List<DataSetWriter> writers = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService scheduler;
    private int sequenceNumber;
    private volatile boolean operational;

    WriterGroup(String name, int writerGroupId, double publishingIntervalMillis,
                PubSubConnection connection, UadpMessageEncoder encoder) {
        if (!(publishingIntervalMillis > 0)) {
            throw new IllegalArgumentException("publishing interval must be positive: " + publishingIntervalMillis);
        }
        this.name = name;
        this.writerGroupId = writerGroupId;
        this.publishingIntervalMillis = publishingIntervalMillis;
        this.connection = connection;
        this.encoder = encoder;
    }

    void addWriter(DataSetWriter writer) {
        writers.add(writer);
    }

    /** 주기 발행을 시작한다. reader 는 필드 노드의 현재 값을 돌려준다. */
    synchronized void setOperational(Function<NodeId, Variable> reader) {
        if (operational) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "writer-group-" + name);
            t.setDaemon(true);
            return t;
        });
        long periodMicros = Math.max(1L, Math.round(publishingIntervalMillis * 1000));
        scheduler.scheduleAtFixedRate(() -> publishOnce(reader), 0, periodMicros, TimeUnit.MICROSECONDS);
        operational = true;
        log.info("writer group {} (id={}) operational, interval={}ms, writers={}",
                name, writerGroupId, publishingIntervalMillis, writers.size());
    }

    synchronized void disable() {
        if (!operational) {
            return;
        }
        operational = false;
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("writer group {} disabled", name);
    }

    void publishOnce(Function<NodeId, Variable> reader) {
        try {
            List<DataSetMessage> messages = new ArrayList<>(writers.size());
            for (DataSetWriter writer : writers) {
                messages.add(writer.nextMessage(reader));
            }
            ByteBuf message = encoder.encode(connection.getPublisherId(), writerGroupId, sequenceNumber, messages);
            sequenceNumber = (sequenceNumber + 1) & 0xFFFF;
            connection.send(message);
        } catch (IOException e) {
            log.warn("writer group {} send failed: {}", name, e.getMessage());
        } catch (RuntimeException e) {
            log.error("writer group {} publish failed", name, e);
        }
    }

    public boolean isOperational() {
        return operational;
    }

    public String getName() {
        return name;
    }

    public int getWriterGroupId() {
        return writerGroupId;
    }

    public double getPublishingInterval() {
        return publishingIntervalMillis;
    }

    public List<DataSetWriter> getWriters() {
        return Collections.unmodifiableList(writers);
    }
}
