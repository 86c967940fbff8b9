package com.example.ingestionservice.source;

import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.Source;

import java.util.List;

/**
 * Fetches every record of one upstream system inside a window.
 * 
 * CRITICAL DESIGN:
 * - Credentials are checked before the first request (SourceNotConfiguredException)
 * - Each page is one call under the RetryEnvelope; an exhausted page fails the whole fetch
 * - Returned order is stable for the same upstream data, so a resumed batch can skip
 *   the records a previous attempt already processed
 */
public interface RecordSource {

    Source source();

    List<ActivityRecord> fetch(FetchWindow window);
}
