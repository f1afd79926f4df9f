package org.javai.text2sql.linking;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.text2sql.schema.SchemaCodec;
import org.javai.text2sql.schema.SchemaCodecException;
import org.javai.text2sql.schema.SchemaEmbedding;
import org.javai.text2sql.schema.SchemaNotFoundException;
import org.javai.text2sql.schema.SchemaRepository;
import org.javai.text2sql.schema.TableInfo;
import org.javai.text2sql.schema.graph.SchemaGraph;
import org.javai.text2sql.schema.graph.SchemaGraphBuilder;
import org.javai.text2sql.vector.VectorHit;
import org.javai.text2sql.vector.VectorSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the tables relevant to a question.
 *
 * <h2>Dynamic-threshold search</h2>
 * <p>The vector index is searched at the starting relevance threshold. Hits are parsed back into
 * table identities, deduplicated and kept only if the table exists in the current schema. While
 * fewer than {@code minTablesRequired} tables resolve, the threshold is lowered by one step and the
 * search repeats; it never goes below the floor. Threshold arithmetic is decimal, so the default
 * descent is exactly 0.7, 0.6, 0.5, 0.4.</p>
 *
 * <p>When nothing resolves even at the floor, the full schema is returned with
 * {@code usedFallback = true}. Otherwise the matched tables are expanded along foreign keys by
 * {@link RelatedTableInferrer} and stripped of disabled columns.</p>
 *
 * <p>Searches are sequential; each call blocks on the index.</p>
 */
public class SchemaLinker {

	private static final Logger logger = LoggerFactory.getLogger(SchemaLinker.class);

	private final SchemaRepository schemaRepository;
	private final VectorSearch vectorSearch;
	private final SchemaCodec codec;
	private final SchemaLinkingConfig config;
	private final RelatedTableInferrer inferrer;
	private final SchemaGraphBuilder graphBuilder;

	public SchemaLinker(SchemaRepository schemaRepository, VectorSearch vectorSearch, SchemaCodec codec) {
		this(schemaRepository, vectorSearch, codec, SchemaLinkingConfig.defaults());
	}

	public SchemaLinker(SchemaRepository schemaRepository, VectorSearch vectorSearch, SchemaCodec codec,
			SchemaLinkingConfig config) {
		this.schemaRepository = Objects.requireNonNull(schemaRepository, "schemaRepository must not be null");
		this.vectorSearch = Objects.requireNonNull(vectorSearch, "vectorSearch must not be null");
		this.codec = Objects.requireNonNull(codec, "codec must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.inferrer = new RelatedTableInferrer(config.maxRelatedTables());
		this.graphBuilder = new SchemaGraphBuilder();
	}

	public SchemaLinkingResult getRelevantSchema(String connectionId, String question) {
		return getRelevantSchema(connectionId, question, config.relevanceThreshold(), config.maxTables());
	}

	/**
	 * Selects the tables relevant to a question.
	 *
	 * @param relevanceThreshold threshold the search starts at
	 * @param maxTables maximum number of hits per search
	 * @throws SchemaNotFoundException if the connection has no stored schema
	 */
	public SchemaLinkingResult getRelevantSchema(String connectionId, String question,
			double relevanceThreshold, int maxTables) {
		Objects.requireNonNull(question, "question must not be null");
		if (maxTables < 1) {
			throw new IllegalArgumentException("maxTables must be at least 1");
		}
		List<TableInfo> allTables = schemaRepository.tables(connectionId);

		SearchOutcome outcome = searchWithDescendingThreshold(connectionId, question, allTables,
				relevanceThreshold, maxTables);

		if (outcome.matches().isEmpty()) {
			logger.warn("No relevant tables found for question '{}' on connection {}; using the full schema",
					question, connectionId);
			return new SchemaLinkingResult(allTables, List.of(), true,
					schemaRepository.toJson(allTables), outcome.thresholdsTried());
		}

		List<TableInfo> matched = outcome.matches().values().stream().map(Match::table).toList();
		RelatedTableInferrer.Expansion expansion = inferrer.expand(matched, allTables);

		List<TableInfo> tables = expansion.tables().stream()
				.map(TableInfo::withoutDisabledColumns)
				.toList();
		List<SchemaMatchDetail> details = new ArrayList<>();
		outcome.matches().values().forEach(m ->
				details.add(SchemaMatchDetail.semantic(m.table().tableName(), m.score(), m.threshold())));
		details.addAll(expansion.additions());

		return new SchemaLinkingResult(tables, details, false,
				schemaRepository.toJson(tables), outcome.thresholdsTried());
	}

	/**
	 * Builds the typed graph of a connection's full schema.
	 *
	 * @throws SchemaNotFoundException if the connection has no stored schema
	 */
	public SchemaGraph buildSchemaGraph(String connectionId) {
		return graphBuilder.build(schemaRepository.tables(connectionId));
	}

	private SearchOutcome searchWithDescendingThreshold(String connectionId, String question,
			List<TableInfo> allTables, double startThreshold, int maxTables) {
		BigDecimal threshold = BigDecimal.valueOf(startThreshold);
		BigDecimal step = BigDecimal.valueOf(config.thresholdStep());
		BigDecimal floor = BigDecimal.valueOf(config.thresholdFloor());

		List<Double> tried = new ArrayList<>();
		Map<String, Match> matches = new LinkedHashMap<>();

		while (threshold.compareTo(floor) >= 0) {
			double current = threshold.doubleValue();
			tried.add(current);
			logger.info("Searching schema of connection {} with relevance threshold {}", connectionId, threshold);

			matches = resolve(vectorSearch.search(connectionId, question, maxTables, current), allTables, current);
			if (matches.size() >= config.minTablesRequired()) {
				break;
			}
			BigDecimal next = threshold.subtract(step);
			if (next.compareTo(floor) < 0) {
				break;
			}
			threshold = next;
		}
		return new SearchOutcome(matches, tried);
	}

	private Map<String, Match> resolve(List<VectorHit> hits, List<TableInfo> allTables, double threshold) {
		Map<String, Match> resolved = new LinkedHashMap<>();
		for (VectorHit hit : hits) {
			Optional<SchemaEmbedding> embedding = parse(hit);
			if (embedding.isEmpty() || !embedding.get().isTable() || embedding.get().tableName() == null) {
				continue;
			}
			String key = embedding.get().tableName().toLowerCase(Locale.ROOT);
			if (resolved.containsKey(key)) {
				continue;
			}
			TableInfo.find(allTables, embedding.get().tableName()).ifPresentOrElse(
					table -> {
						logger.info("Found relevant table {} (score {})", table.tableName(), hit.score());
						resolved.put(key, new Match(table, hit.score(), threshold));
					},
					() -> logger.debug("Hit for table {} is not part of the current schema",
							embedding.get().tableName()));
		}
		return resolved;
	}

	private Optional<SchemaEmbedding> parse(VectorHit hit) {
		try {
			return Optional.ofNullable(codec.readEmbedding(hit.text()));
		}
		catch (SchemaCodecException e) {
			logger.warn("Skipping unreadable schema embedding hit: {}", e.getMessage());
			return Optional.empty();
		}
	}

	private record Match(TableInfo table, double score, double threshold) {
	}

	private record SearchOutcome(Map<String, Match> matches, List<Double> thresholdsTried) {
	}
}
