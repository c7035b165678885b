package com.aigreentick.services.merchantonboarding.dto.response;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic wrapper around payment platform API responses.
 *
 * The platform answers every creation call with a flat JSON object. The field that
 * carries the new identifier depends on the endpoint:
 *
 *   1. Most entities:          { "id": "LE322..." }
 *   2. Split configurations:   { "splitConfigurationId": "SCNF4..." }
 *   3. Onboarding links:       { "url": "https://..." }
 *   4. PATCH calls:            the updated entity, or an empty body
 *
 * All top-level fields land in {@code fields} via @JsonAnySetter.
 */
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlatformApiResponse {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public static PlatformApiResponse of(Map<String, Object> body) {
        PlatformApiResponse response = new PlatformApiResponse();
        if (body != null) {
            response.fields.putAll(body);
        }
        return response;
    }

    @JsonAnySetter
    public void setField(String key, Object value) {
        fields.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    public String getString(String key) {
        Object value = fields.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    public String getId() {
        return getString("id");
    }

    public String getUrl() {
        return getString("url");
    }

    public String getSplitConfigurationId() {
        return getString("splitConfigurationId");
    }
}
