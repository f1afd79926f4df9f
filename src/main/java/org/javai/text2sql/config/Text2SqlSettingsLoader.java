package org.javai.text2sql.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.javai.text2sql.conversation.ConversationConfig;
import org.javai.text2sql.feedback.FeedbackOptimizerConfig;
import org.javai.text2sql.linking.SchemaLinkingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link Text2SqlSettings} from YAML. Absent sections and keys keep their defaults.
 *
 * <pre>
 * linking:
 *   relevance_threshold: 0.7
 *   threshold_step: 0.1
 *   threshold_floor: 0.4
 *   max_tables: 5
 *   min_tables_required: 1
 *   max_related_tables: 10
 * optimization:
 *   max_iterations: 3
 *   iteration_timeout_ms: 30000
 *   max_result_rows: 10000
 *   max_limited_result_rows: 100
 * conversation:
 *   max_history_size: 10
 *   entity_lookback_turns: 3
 * completion:
 *   dialect: PostgreSQL
 *   temperature: 0.1
 * </pre>
 */
public class Text2SqlSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(Text2SqlSettingsLoader.class);

	public static final String DEFAULT_RESOURCE = "text2sql.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if it is absent.
	 */
	public Text2SqlSettings load() {
		try (InputStream stream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
			if (stream == null) {
				logger.info("No {} on the classpath; using default settings", DEFAULT_RESOURCE);
				return Text2SqlSettings.defaults();
			}
			return load(stream);
		}
		catch (IOException e) {
			throw new SettingsException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public Text2SqlSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		}
		catch (IOException | YAMLException | ClassCastException e) {
			throw new SettingsException("Failed to read settings from " + path, e);
		}
	}

	public Text2SqlSettings load(InputStream stream) {
		try {
			return build(yaml.load(stream));
		}
		catch (YAMLException | ClassCastException e) {
			throw new SettingsException("Failed to read settings from stream", e);
		}
	}

	public Text2SqlSettings parseString(String content) {
		try {
			return build(yaml.load(content));
		}
		catch (YAMLException | ClassCastException e) {
			throw new SettingsException("Failed to read settings", e);
		}
	}

	@SuppressWarnings("unchecked")
	private Text2SqlSettings build(Object document) {
		if (document == null) {
			return Text2SqlSettings.defaults();
		}
		if (!(document instanceof Map<?, ?>)) {
			throw new SettingsException("Settings document must be a mapping");
		}
		Map<String, Object> data = (Map<String, Object>) document;
		try {
			Map<String, Object> completion = section(data, "completion");
			return new Text2SqlSettings(
					linking(section(data, "linking")),
					optimization(section(data, "optimization")),
					conversation(section(data, "conversation")),
					(String) completion.getOrDefault("dialect", Text2SqlSettings.DEFAULT_DIALECT),
					completion.containsKey("temperature")
							? number(completion, "temperature", Text2SqlSettings.DEFAULT_TEMPERATURE).doubleValue()
							: Text2SqlSettings.DEFAULT_TEMPERATURE);
		}
		catch (IllegalArgumentException e) {
			throw new SettingsException("Invalid settings: " + e.getMessage(), e);
		}
	}

	private static SchemaLinkingConfig linking(Map<String, Object> section) {
		return SchemaLinkingConfig.builder()
				.relevanceThreshold(number(section, "relevance_threshold", SchemaLinkingConfig.DEFAULT_RELEVANCE_THRESHOLD).doubleValue())
				.thresholdStep(number(section, "threshold_step", SchemaLinkingConfig.DEFAULT_THRESHOLD_STEP).doubleValue())
				.thresholdFloor(number(section, "threshold_floor", SchemaLinkingConfig.DEFAULT_THRESHOLD_FLOOR).doubleValue())
				.maxTables(number(section, "max_tables", SchemaLinkingConfig.DEFAULT_MAX_TABLES).intValue())
				.minTablesRequired(number(section, "min_tables_required", SchemaLinkingConfig.DEFAULT_MIN_TABLES_REQUIRED).intValue())
				.maxRelatedTables(number(section, "max_related_tables", SchemaLinkingConfig.DEFAULT_MAX_RELATED_TABLES).intValue())
				.build();
	}

	private static FeedbackOptimizerConfig optimization(Map<String, Object> section) {
		FeedbackOptimizerConfig.Builder builder = FeedbackOptimizerConfig.builder()
				.maxIterations(number(section, "max_iterations", FeedbackOptimizerConfig.DEFAULT_MAX_ITERATIONS).intValue())
				.maxResultRows(number(section, "max_result_rows", FeedbackOptimizerConfig.DEFAULT_MAX_RESULT_ROWS).intValue())
				.maxLimitedResultRows(number(section, "max_limited_result_rows", FeedbackOptimizerConfig.DEFAULT_MAX_LIMITED_RESULT_ROWS).intValue());
		if (section.get("iteration_timeout_ms") != null) {
			builder.iterationTimeout(Duration.ofMillis(number(section, "iteration_timeout_ms", 0).longValue()));
		}
		return builder.build();
	}

	private static ConversationConfig conversation(Map<String, Object> section) {
		return ConversationConfig.builder()
				.maxHistorySize(number(section, "max_history_size", ConversationConfig.DEFAULT_MAX_HISTORY_SIZE).intValue())
				.entityLookbackTurns(number(section, "entity_lookback_turns", ConversationConfig.DEFAULT_ENTITY_LOOKBACK_TURNS).intValue())
				.build();
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Map<String, Object> data, String name) {
		Object value = data.get(name);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?>)) {
			throw new SettingsException("Section '" + name + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static Number number(Map<String, Object> section, String key, Number defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (!(value instanceof Number number)) {
			throw new SettingsException("'" + key + "' must be a number, got: " + value);
		}
		return number;
	}
}
