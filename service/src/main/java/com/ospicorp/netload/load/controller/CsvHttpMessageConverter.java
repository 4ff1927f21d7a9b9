package com.ospicorp.netload.load.controller;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes collections of load points or row maps as {@code text/csv} with a header line.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  protected boolean canRead(MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    var writer = mapper.writer(schemaFor(rows)).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      writer.write(row);
    }
    writer.flush();
  }

  private CsvSchema schemaFor(Collection<?> rows) {
    Object sample = rows.stream().filter(Objects::nonNull).findFirst().orElse(null);
    if (sample instanceof Map<?, ?>) {
      Set<String> columns = new LinkedHashSet<>();
      for (Object row : rows) {
        if (row instanceof Map<?, ?> map) {
          map.keySet().forEach(key -> columns.add(String.valueOf(key)));
        }
      }
      CsvSchema.Builder builder = CsvSchema.builder();
      columns.forEach(builder::addColumn);
      return builder.setUseHeader(true).build();
    }
    if (sample != null) {
      return mapper.schemaFor(sample.getClass()).withHeader();
    }
    return CsvSchema.emptySchema().withHeader();
  }
}
