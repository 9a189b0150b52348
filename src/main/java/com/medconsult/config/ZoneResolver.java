package com.medconsult.config;

import com.medconsult.utils.TimeFormats;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * Turns the {@code X-Timezone} header of a request into the zone every time
 * conversion of that request uses. Unknown or missing ids fall back to the
 * configured default zone.
 */
@Component
public class ZoneResolver {

    private static final Logger log = LoggerFactory.getLogger(ZoneResolver.class);

    public static final String TIMEZONE_HEADER = "X-Timezone";

    private final ZoneId defaultZone;

    public ZoneResolver(@Value("${medconsult.scheduling.default-zone:UTC}") String defaultZone) {
        this.defaultZone = ZoneId.of(defaultZone);
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }

    public ZoneId resolve(String header) {
        if (StringUtils.isBlank(header)) return defaultZone;
        ZoneId zone = TimeFormats.zoneOrDefault(header, null);
        if (zone == null) {
            log.warn("Ignoring unknown timezone '{}', using {}", header, defaultZone);
            return defaultZone;
        }
        return zone;
    }
}
