package org.javai.text2sql.completion;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt templates from the classpath and fills their placeholders.
 *
 * <p>Templates live at {@code prompts/<name>.txt}. A placeholder is an argument name in braces,
 * e.g. {@code {schemaInfo}}; any other text, including braces in JSON, is left as is.</p>
 */
public class PromptTemplates {

	private static final String RESOURCE_PATTERN = "prompts/%s.txt";

	private final ClassLoader loader;
	private final ConcurrentHashMap<String, String> cache = new ConcurrentHashMap<>();

	public PromptTemplates() {
		this(PromptTemplates.class.getClassLoader());
	}

	public PromptTemplates(ClassLoader loader) {
		this.loader = Objects.requireNonNull(loader, "loader must not be null");
	}

	public String render(String templateName, Map<String, String> args) {
		String rendered = template(templateName);
		for (Map.Entry<String, String> arg : args.entrySet()) {
			rendered = rendered.replace("{" + arg.getKey() + "}", arg.getValue() != null ? arg.getValue() : "");
		}
		return rendered;
	}

	String template(String templateName) {
		Objects.requireNonNull(templateName, "templateName must not be null");
		return cache.computeIfAbsent(templateName, this::load);
	}

	private String load(String templateName) {
		String resource = RESOURCE_PATTERN.formatted(templateName);
		try (InputStream stream = loader.getResourceAsStream(resource)) {
			if (stream == null) {
				throw new TextCompletionException("Prompt template not found: " + resource);
			}
			return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new TextCompletionException("Failed to load prompt template: " + resource, e);
		}
	}
}
