package io.b2mash.b2b.recordcore.status;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class RecordStatusConverter implements AttributeConverter<RecordStatus, Integer> {

  @Override
  public Integer convertToDatabaseColumn(RecordStatus status) {
    return status != null ? status.code() : null;
  }

  @Override
  public RecordStatus convertToEntityAttribute(Integer code) {
    return code != null ? RecordStatus.of(code) : null;
  }
}
