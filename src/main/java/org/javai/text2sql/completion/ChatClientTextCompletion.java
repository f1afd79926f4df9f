package org.javai.text2sql.completion;

import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * {@link TextCompletion} that renders a classpath template and sends it to a Spring AI
 * {@link ChatClient} as the user message.
 */
public class ChatClientTextCompletion implements TextCompletion {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientTextCompletion.class);

	private final ChatClient chatClient;
	private final PromptTemplates templates;
	private final Double temperature;

	public ChatClientTextCompletion(ChatClient chatClient) {
		this(chatClient, new PromptTemplates(), null);
	}

	/**
	 * @param temperature sampling temperature sent with every call; null keeps the client's default
	 */
	public ChatClientTextCompletion(ChatClient chatClient, PromptTemplates templates, Double temperature) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.templates = Objects.requireNonNull(templates, "templates must not be null");
		this.temperature = temperature;
	}

	@Override
	public String complete(String templateName, Map<String, String> args) {
		Objects.requireNonNull(args, "args must not be null");
		String prompt = templates.render(templateName, args);
		logger.debug("Rendered prompt {}:\n{}", templateName, prompt);

		String content;
		try {
			ChatClient.ChatClientRequestSpec request = chatClient.prompt().user(prompt);
			if (temperature != null) {
				request = request.options(ChatOptions.builder().temperature(temperature).build());
			}
			content = request.call().content();
		}
		catch (RuntimeException e) {
			throw new TextCompletionException("Completion failed for template " + templateName, e);
		}
		if (content == null || content.isBlank()) {
			throw new TextCompletionException("Model returned an empty response for template " + templateName);
		}
		logger.debug("Model response for {}:\n{}", templateName, content);
		return content;
	}
}
