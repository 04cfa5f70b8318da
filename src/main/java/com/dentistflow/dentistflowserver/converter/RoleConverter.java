package com.dentistflow.dentistflowserver.converter;

import com.dentistflow.dentistflowserver.entity.Role;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class RoleConverter
        implements AttributeConverter<Role, String> {

    @Override
    public String convertToDatabaseColumn(Role attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public Role convertToEntityAttribute(String dbData) {
        return Role.fromValue(dbData);
    }
}
