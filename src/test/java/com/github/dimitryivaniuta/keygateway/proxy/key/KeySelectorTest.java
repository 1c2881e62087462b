package com.github.dimitryivaniuta.keygateway.proxy.key;

import com.github.dimitryivaniuta.keygateway.proxy.GatewayConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeySelectorTest {

    @Test
    void shouldStartAtFirstKeyAndWrapAround() {
        KeySelector selector = new KeySelector(List.of("A", "B", "C"));

        List<String> seen = new ArrayList<>();
        for (int i = 0; i < 7; i++) seen.add(selector.next());

        assertThat(seen).containsExactly("A", "B", "C", "A", "B", "C", "A");
        assertThat(selector.cursor()).isEqualTo(1);
    }

    @Test
    void shouldReturnEachKeyEquallyOftenAndPeriodically() {
        List<String> keys = List.of("k1", "k2", "k3", "k4");
        KeySelector selector = new KeySelector(keys);
        int calls = keys.size() * 25;

        List<String> seen = new ArrayList<>();
        for (int i = 0; i < calls; i++) seen.add(selector.next());

        Map<String, Integer> counts = new HashMap<>();
        seen.forEach(k -> counts.merge(k, 1, Integer::sum));
        assertThat(counts).containsOnlyKeys(keys);
        assertThat(counts.values()).containsOnly(25);

        for (int i = keys.size(); i < seen.size(); i++) {
            assertThat(seen.get(i)).isEqualTo(seen.get(i - keys.size()));
        }
    }

    @Test
    void singleKeyIsAlwaysReturned() {
        KeySelector selector = new KeySelector(List.of("only"));

        for (int i = 0; i < 5; i++) assertThat(selector.next()).isEqualTo("only");
        assertThat(selector.slotsIssued()).isEqualTo(5);
    }

    @Test
    void shouldRejectEmptyKeyList() {
        assertThatThrownBy(() -> new KeySelector(List.of()))
                .isInstanceOf(GatewayConfigurationException.class);
        assertThatThrownBy(() -> new KeySelector(null))
                .isInstanceOf(GatewayConfigurationException.class);
    }

    @Test
    void concurrentCallersShouldEachConsumeOneDistinctSlot() throws Exception {
        List<String> keys = List.of("A", "B", "C", "D", "E", "F", "G", "H");
        KeySelector selector = new KeySelector(keys);

        int threads = 16;
        int callsPerThread = 500;
        int total = threads * callsPerThread;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        Map<String, Integer> counts = new ConcurrentHashMap<>();

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        counts.merge(selector.next(), 1, Integer::sum);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();

        // no slot issued twice or skipped: cursor moved by exactly the number of calls
        // and every key got exactly its share
        assertThat(selector.slotsIssued()).isEqualTo(total);
        assertThat(counts.values()).containsOnly(total / keys.size());
    }

    @Test
    void aliasShouldFollowConfiguredOrder() {
        KeySelector selector = new KeySelector(List.of("first", "second"));

        assertThat(selector.aliasOf("first")).isEqualTo("key-0");
        assertThat(selector.aliasOf("second")).isEqualTo("key-1");
        assertThat(selector.aliasOf("other")).isEqualTo("unknown");
    }
}
