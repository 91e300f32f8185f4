package com.leadfunnel.backend.converters;

import com.leadfunnel.backend.enums.SocialPlatform;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Stores {@link SocialPlatform} by enum name. A stored value that no longer
 * matches a platform is read as {@code null} instead of failing the whole
 * load, so reports over old rows keep working and simply leave that row out
 * of per-platform figures.
 */
@Converter(autoApply = false)
@Slf4j
public class SocialPlatformConverter implements AttributeConverter<SocialPlatform, String> {

    @Override
    public String convertToDatabaseColumn(SocialPlatform attribute) {
        if (attribute == null) {
            return null;
        }
        return attribute.name();
    }

    @Override
    public SocialPlatform convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        try {
            return SocialPlatform.valueOf(dbData.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown stored platform value '{}', reading it as no platform", dbData);
            return null;
        }
    }
}
