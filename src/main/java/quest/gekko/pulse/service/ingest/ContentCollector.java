package quest.gekko.pulse.service.ingest;

import java.util.stream.Stream;

/**
 * Supplies raw content to the pipeline. Fetching, paging and rate limits are the
 * implementation's concern; the pipeline only drains the stream.
 */
public interface ContentCollector {
    String source();

    Stream<RawContent> collect();
}
