package com.syncbridge.engine.stream;

import com.syncbridge.core.model.StreamEntry;
import com.syncbridge.core.test.TimeController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryStreamTransportTest {

    private final InMemoryStreamTransport transport = new InMemoryStreamTransport(TimeController.frozen());

    @Test
    @DisplayName("Entries are read back in append order after any offset")
    void readAfterOffset() {
        for (int i = 1; i <= 5; i++) {
            assertThat(transport.append("crm:sync:credits:credit_allocated", "m" + i)).isEqualTo(i);
        }

        List<StreamEntry> page = transport.read("crm:sync:credits:credit_allocated", 2, 2);

        assertThat(page).extracting(StreamEntry::payload).containsExactly("m3", "m4");
        assertThat(page).extracting(StreamEntry::offset).containsExactly(3L, 4L);
        assertThat(transport.read("crm:sync:credits:credit_allocated", 5, 10)).isEmpty();
        assertThat(transport.read("crm:sync:unknown", 0, 10)).isEmpty();
        assertThat(transport.latestOffset("crm:sync:credits:credit_allocated")).isEqualTo(5);
    }

    @Test
    @DisplayName("Partitions keep independent offsets")
    void partitionsAreIndependent() {
        transport.append("crm:sync:credits:credit_allocated", "a");
        transport.append("crm:sync:credits:credit_allocated", "b");
        assertThat(transport.append("crm:sync:role:role_created", "c")).isEqualTo(1);

        assertThat(transport.readAt("crm:sync:credits:credit_allocated", 2)).map(StreamEntry::payload).hasValue("b");
        assertThat(transport.readAt("crm:sync:role:role_created", 2)).isEmpty();
        assertThat(transport.streamKeys("crm:sync:"))
            .containsExactly("crm:sync:credits:credit_allocated", "crm:sync:role:role_created");
    }

    @Test
    @DisplayName("Concurrent appenders to one partition each get a distinct, dense offset")
    void concurrentAppends() throws Exception {
        int threads = 4;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        List<Long> offsets = Collections.synchronizedList(new ArrayList<>());
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < perThread; i++) {
                        offsets.add(transport.append("crm:sync:user:user_updated", "x"));
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(offsets).doesNotHaveDuplicates().hasSize(threads * perThread);
        assertThat(transport.latestOffset("crm:sync:user:user_updated")).isEqualTo((long) threads * perThread);
    }
}
