package com.hcpbridge.leadwebhook.interfaces.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.hcpbridge.leadwebhook.domain.exception.LeadValidationException;
import com.hcpbridge.leadwebhook.domain.model.FormField;
import com.hcpbridge.leadwebhook.domain.model.FormSubmission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a webhook body into a {@link FormSubmission}. Accepts the widget's array of
 * {@code {"id", "name", "value", "type"}} objects, or a flat object of field name to value for manual testing.
 */
@Component
public class SubmissionPayloadParser {

    public FormSubmission parse(JsonNode payload) {
        if (payload == null || payload.isNull() || (payload.isContainerNode() && payload.isEmpty())) {
            throw new LeadValidationException("Empty payload");
        }

        List<FormField> fields = new ArrayList<>();
        if (payload.isArray()) {
            for (JsonNode field : payload) {
                String name = field.path("name").asText("");
                if (name.isBlank()) {
                    name = field.path("id").asText("");
                }
                fields.add(new FormField(name, values(field.get("value"))));
            }
        } else if (payload.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = payload.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                fields.add(new FormField(entry.getKey(), values(entry.getValue())));
            }
        } else {
            throw new LeadValidationException("Payload must be a JSON array or object");
        }
        return new FormSubmission(fields);
    }

    private static List<String> values(JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isArray()) {
            List<String> values = new ArrayList<>();
            value.forEach(v -> values.add(v.asText()));
            return values;
        }
        return List.of(value.asText());
    }
}
