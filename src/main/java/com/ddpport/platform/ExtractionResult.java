package com.ddpport.platform;

import com.ddpport.core.table.ConsentTable;
import org.json.JSONArray;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tables to show for consent and, optionally, the records to donate in their place.
 * <p>
 * When {@code cappedDonations} is present the workflow donates each entry separately instead of the
 * reviewed tables; this lets a platform show a bounded preview of a huge table while still donating all rows.
 */
public record ExtractionResult(List<ConsentTable> tables, Map<String, JSONArray> cappedDonations) {

    public ExtractionResult {
        tables = List.copyOf(tables);
        cappedDonations = cappedDonations == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(cappedDonations));
    }

    public static ExtractionResult of(List<ConsentTable> tables) {
        return new ExtractionResult(tables, null);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), null);
    }

    public Optional<Map<String, JSONArray>> donationMapping() {
        return Optional.ofNullable(cappedDonations);
    }
}
