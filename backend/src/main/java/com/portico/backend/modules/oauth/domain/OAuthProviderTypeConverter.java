package com.portico.backend.modules.oauth.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class OAuthProviderTypeConverter implements AttributeConverter<OAuthProviderType, String> {

    @Override
    public String convertToDatabaseColumn(OAuthProviderType attribute) {
        return attribute == null ? null : attribute.code();
    }

    @Override
    public OAuthProviderType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : OAuthProviderType.fromCode(dbData);
    }
}
