package com.retailsentinel.core.runtime;

import com.retailsentinel.core.model.QueueSample;
import com.retailsentinel.core.model.SensorRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static com.retailsentinel.core.RecordFixtures.queue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RecordQueue} and {@link OverflowPolicy}.
 */
class RecordQueueTest {

    @Test
    @DisplayName("Should discard the oldest record when full under DROP_OLDEST")
    void dropsOldest() throws Exception {
        RecordQueue q = new RecordQueue(2, OverflowPolicy.DROP_OLDEST);
        q.offer(queue("SCC1", 1, 1, 0));
        q.offer(queue("SCC1", 2, 2, 0));
        q.offer(queue("SCC1", 3, 3, 0));

        assertThat(q.getDropped()).isEqualTo(1);
        SensorRecord head = q.poll(10, TimeUnit.MILLISECONDS);
        assertThat(((QueueSample) head).getCustomerCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should give up a blocked offer once closed")
    void blockedOfferReturnsOnClose() throws Exception {
        RecordQueue q = new RecordQueue(1, OverflowPolicy.BLOCK);
        q.offer(queue("SCC1", 1, 1, 0));

        Thread closer = new Thread(() -> {
            try {
                Thread.sleep(150);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            q.close();
        });
        closer.start();

        assertThat(q.offer(queue("SCC1", 2, 2, 0))).isFalse();
        closer.join();
        assertThat(q.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not leave a record behind when close races a blocked offer")
    void closeRacingBlockedOffer() throws Exception {
        RecordQueue q = new RecordQueue(1, OverflowPolicy.BLOCK);
        q.offer(queue("SCC1", 1, 1, 0));

        Thread consumer = new Thread(() -> {
            try {
                Thread.sleep(50);
                q.close();
                q.poll(10, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();

        assertThat(q.offer(queue("SCC1", 2, 2, 0))).isFalse();
        consumer.join();
        assertThat(q.size()).isZero();
    }

    @Test
    @DisplayName("Should refuse records after close")
    void refusesAfterClose() throws Exception {
        RecordQueue q = new RecordQueue(4, OverflowPolicy.BLOCK);
        q.close();

        assertThat(q.isClosed()).isTrue();
        assertThat(q.offer(queue("SCC1", 1, 1, 0))).isFalse();
        assertThat(q.poll(1, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    @DisplayName("Should parse overflow policy names loosely")
    void parsesPolicy() {
        assertThat(OverflowPolicy.parse("block")).isEqualTo(OverflowPolicy.BLOCK);
        assertThat(OverflowPolicy.parse(" drop-oldest ")).isEqualTo(OverflowPolicy.DROP_OLDEST);
        assertThatThrownBy(() -> OverflowPolicy.parse("spill"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
