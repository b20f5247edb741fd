package sh.harold.warden.api.data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SampleDocument(String name, Map<Long, List<Instant>> entries) {
}
