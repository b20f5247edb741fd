package sh.harold.warden.api.data.impl.memory;

import org.junit.jupiter.api.Test;
import sh.harold.warden.api.data.SampleDocument;
import sh.harold.warden.api.data.TestMappers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryDocumentStoreTest {

    @Test
    void storedDocumentIsDetachedFromCaller() {
        InMemoryDocumentStore store = new InMemoryDocumentStore(TestMappers.create());
        List<Instant> timestamps = new ArrayList<>(List.of(Instant.parse("2026-01-01T00:00:00Z")));
        Map<Long, List<Instant>> entries = new HashMap<>();
        entries.put(7L, timestamps);

        store.replace("sample", new SampleDocument("sample", entries));
        timestamps.add(Instant.parse("2026-01-02T00:00:00Z"));

        SampleDocument loaded = store.load("sample", SampleDocument.class).orElseThrow();
        assertThat(loaded.entries().get(7L)).hasSize(1);
        assertThat(store.exists("sample")).isTrue();
        assertThat(store.load("other", SampleDocument.class)).isEmpty();
    }
}
