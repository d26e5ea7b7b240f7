package org.umsforge.codegen.service.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.umsforge.model.Measure;

/**
 * Jackson binding of UMS measure documents and of the result objects returned over the wire.
 */
public class UmsJsonReader {
	private final ObjectMapper mapper;

	public UmsJsonReader() {
		this.mapper = new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
	}

	/**
	 * Reads a measure. Unknown properties are ignored so documents produced by newer tooling still load.
	 *
	 * @throws JsonProcessingException when the text is not a valid UMS document
	 */
	public Measure readMeasure(String json) throws JsonProcessingException {
		if (json == null || json.isBlank()) throw new IllegalArgumentException("The measure document is empty");
		return mapper.readValue(json, Measure.class);
	}

	public String write(Object value) throws JsonProcessingException {
		return mapper.writeValueAsString(value);
	}

	public ObjectMapper getMapper() {
		return mapper;
	}
}
