package io.relaywatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.util.Jsons;

import java.util.ArrayList;
import java.util.List;

public final class RelayLimits {
    private final RelayCache cache;

    RelayLimits(RelayCache cache) {
        this.cache = cache;
    }

    public boolean country(String url, String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            throw new RelayValidationException("Country code is required (example: US)");
        }
        String wanted = countryCode.trim();
        return countries(url).stream().anyMatch(wanted::equalsIgnoreCase);
    }

    /**
     * Countries the relay declares in NIP-11 {@code relay_countries}; a top-level
     * {@code relay_countries} field is read when the info document has none.
     */
    public List<String> countries(String url) {
        List<String> out = new ArrayList<>();
        cache.one(url).ifPresent(record -> {
            JsonNode countries = Jsons.at(record.document(), RelayRecord.INFO + ".relay_countries");
            if (countries == null || !countries.isArray()) {
                countries = record.document().get("relay_countries");
            }
            if (countries != null && countries.isArray()) {
                countries.forEach(code -> out.add(code.asText()));
            }
        });
        return out;
    }
}
