package quest.gekko.dataflag.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import quest.gekko.dataflag.domain.Decision;

@Converter(autoApply = true)
public class DecisionConverter implements AttributeConverter<Decision, String> {

    @Override
    public String convertToDatabaseColumn(Decision attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public Decision convertToEntityAttribute(String dbData) {
        return dbData == null ? null : Decision.fromValue(dbData);
    }
}
