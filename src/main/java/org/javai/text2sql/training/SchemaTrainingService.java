package org.javai.text2sql.training;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.text2sql.schema.SchemaCodec;
import org.javai.text2sql.schema.SchemaEmbedding;
import org.javai.text2sql.schema.SchemaRepository;
import org.javai.text2sql.schema.TableInfo;
import org.javai.text2sql.vector.VectorSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trains a connection's tables into the vector index and keeps the stored schema in step.
 *
 * <p>Each trained table owns exactly one index item, saved in the collection named after the
 * connection under id {@code connectionId + "_" + tableName}. The item text is the JSON form of a
 * {@link SchemaEmbedding} whose description covers only enabled columns. Existing items of a
 * table are always removed before the table is embedded again.</p>
 */
public class SchemaTrainingService {

	private static final Logger logger = LoggerFactory.getLogger(SchemaTrainingService.class);

	private final SchemaRepository schemaRepository;
	private final SchemaEmbeddingRepository embeddingRepository;
	private final VectorSearch vectorSearch;
	private final SchemaCodec codec;
	private final SchemaDescriptionBuilder descriptionBuilder;

	public SchemaTrainingService(SchemaRepository schemaRepository,
			SchemaEmbeddingRepository embeddingRepository,
			VectorSearch vectorSearch,
			SchemaCodec codec) {
		this(schemaRepository, embeddingRepository, vectorSearch, codec, new SchemaDescriptionBuilder());
	}

	public SchemaTrainingService(SchemaRepository schemaRepository,
			SchemaEmbeddingRepository embeddingRepository,
			VectorSearch vectorSearch,
			SchemaCodec codec,
			SchemaDescriptionBuilder descriptionBuilder) {
		this.schemaRepository = Objects.requireNonNull(schemaRepository, "schemaRepository must not be null");
		this.embeddingRepository = Objects.requireNonNull(embeddingRepository, "embeddingRepository must not be null");
		this.vectorSearch = Objects.requireNonNull(vectorSearch, "vectorSearch must not be null");
		this.codec = Objects.requireNonNull(codec, "codec must not be null");
		this.descriptionBuilder = Objects.requireNonNull(descriptionBuilder, "descriptionBuilder must not be null");
	}

	/**
	 * Replaces everything trained for a connection with the given tables.
	 *
	 * @return the embeddings saved, one per table
	 */
	public List<SchemaEmbedding> train(String connectionId, List<TableInfo> tables) {
		Objects.requireNonNull(tables, "tables must not be null");
		logger.info("Training {} tables for connection {}", tables.size(), connectionId);

		removeAllEmbeddings(connectionId);
		List<SchemaEmbedding> saved = new ArrayList<>();
		for (TableInfo table : tables) {
			saved.add(embed(connectionId, table));
		}
		schemaRepository.save(connectionId, tables);
		return saved;
	}

	/**
	 * Trains or retrains selected tables, leaving the rest of the connection untouched. The stored
	 * table list is merged by table name.
	 */
	public List<SchemaEmbedding> trainTables(String connectionId, List<TableInfo> tables) {
		Objects.requireNonNull(tables, "tables must not be null");
		List<TableInfo> merged = new ArrayList<>(trainedTables(connectionId));
		List<SchemaEmbedding> saved = new ArrayList<>();
		for (TableInfo table : tables) {
			removeTableEmbeddings(connectionId, table.tableName());
			saved.add(embed(connectionId, table));
			replaceOrAppend(merged, table);
		}
		schemaRepository.save(connectionId, merged);
		logger.info("Trained {} tables for connection {}", tables.size(), connectionId);
		return saved;
	}

	/**
	 * Retrains one table after its description, columns or enabled flags were edited.
	 */
	public SchemaEmbedding retrainTable(String connectionId, TableInfo table) {
		return trainTables(connectionId, List.of(table)).get(0);
	}

	/**
	 * Drops a table from training.
	 *
	 * @return true if the table was part of the stored schema
	 */
	public boolean removeTable(String connectionId, String tableName) {
		removeTableEmbeddings(connectionId, tableName);
		List<TableInfo> remaining = new ArrayList<>(trainedTables(connectionId));
		boolean removed = remaining.removeIf(t -> t.hasName(tableName));
		if (removed) {
			schemaRepository.save(connectionId, remaining);
			logger.info("Removed table {} from connection {}", tableName, connectionId);
		}
		return removed;
	}

	/**
	 * Forgets everything trained for a connection, e.g. after its critical fields changed.
	 */
	public void resetConnection(String connectionId) {
		removeAllEmbeddings(connectionId);
		schemaRepository.delete(connectionId);
		logger.info("Reset training for connection {}", connectionId);
	}

	public List<TableInfo> trainedTables(String connectionId) {
		return schemaRepository.findTables(connectionId).orElse(List.of());
	}

	public Optional<TableInfo> tableDetail(String connectionId, String tableName) {
		return TableInfo.find(trainedTables(connectionId), tableName);
	}

	private SchemaEmbedding embed(String connectionId, TableInfo table) {
		SchemaEmbedding embedding = SchemaEmbedding.forTable(
				connectionId, table.tableName(), descriptionBuilder.describe(table));
		vectorSearch.save(connectionId, embedding.id(), codec.writeEmbedding(embedding));
		embeddingRepository.save(embedding);
		logger.debug("Embedded table {} of connection {}", table.tableName(), connectionId);
		return embedding;
	}

	private void removeTableEmbeddings(String connectionId, String tableName) {
		for (SchemaEmbedding stale : embeddingRepository.findByTable(connectionId, tableName)) {
			vectorSearch.remove(connectionId, stale.id());
		}
		embeddingRepository.deleteByTable(connectionId, tableName);
	}

	private void removeAllEmbeddings(String connectionId) {
		List<SchemaEmbedding> stale = embeddingRepository.findByConnectionId(connectionId);
		for (SchemaEmbedding embedding : stale) {
			vectorSearch.remove(connectionId, embedding.id());
		}
		embeddingRepository.deleteByConnectionId(connectionId);
		if (!stale.isEmpty()) {
			logger.debug("Removed {} embeddings of connection {}", stale.size(), connectionId);
		}
	}

	private static void replaceOrAppend(List<TableInfo> tables, TableInfo table) {
		for (int i = 0; i < tables.size(); i++) {
			if (tables.get(i).hasName(table.tableName())) {
				tables.set(i, table);
				return;
			}
		}
		tables.add(table);
	}
}
