package org.javai.text2sql.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;

/**
 * JSON codec for the structured schema records.
 *
 * <p>The table list is stored as a plain JSON array whose field names are the record component
 * names of {@link TableInfo}, {@link ColumnInfo} and {@link ForeignKeyInfo}. Embedding texts
 * saved to the vector index are the JSON form of {@link SchemaEmbedding}.</p>
 */
public class SchemaCodec {

	private static final TypeReference<List<TableInfo>> TABLE_LIST = new TypeReference<>() {};

	private final ObjectMapper mapper;

	public SchemaCodec() {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
	}

	public List<TableInfo> readTables(String json) {
		if (json == null || json.isBlank()) {
			return List.of();
		}
		try {
			List<TableInfo> tables = mapper.readValue(json, TABLE_LIST);
			return tables != null ? List.copyOf(tables) : List.of();
		}
		catch (JsonProcessingException e) {
			throw new SchemaCodecException("Failed to read table list: " + e.getOriginalMessage(), e);
		}
	}

	public String writeTables(List<TableInfo> tables) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tables != null ? tables : List.of());
		}
		catch (JsonProcessingException e) {
			throw new SchemaCodecException("Failed to write table list", e);
		}
	}

	public SchemaEmbedding readEmbedding(String json) {
		if (json == null || json.isBlank()) {
			throw new SchemaCodecException("Embedding text is empty", null);
		}
		try {
			return mapper.readValue(json, SchemaEmbedding.class);
		}
		catch (JsonProcessingException e) {
			throw new SchemaCodecException("Failed to read schema embedding: " + e.getOriginalMessage(), e);
		}
	}

	public String writeEmbedding(SchemaEmbedding embedding) {
		try {
			return mapper.writeValueAsString(embedding);
		}
		catch (JsonProcessingException e) {
			throw new SchemaCodecException("Failed to write schema embedding " + embedding.id(), e);
		}
	}
}
