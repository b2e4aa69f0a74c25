package com.star.eximscanner.event;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * An event handed to the mediator's sink. The parser does not keep a
 * reference after emission.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NormalizedEvent {

    public static final String GENERIC_DATA_TYPE = "exim4:line";

    String dataType;  // exim4:line, syslog:ssh:login, ...

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    @Singular
    Map<String, Object> attributes;

    public static NormalizedEvent generic(Instant timestamp, Map<String, Object> attributes) {
        return NormalizedEvent.builder()
                .dataType(GENERIC_DATA_TYPE)
                .timestamp(timestamp)
                .attributes(attributes)
                .build();
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }
}
