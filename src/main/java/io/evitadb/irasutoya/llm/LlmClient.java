package io.evitadb.irasutoya.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wraps a ChatModel with credential failure detection shared by all worker threads.
 *
 * Once the endpoint rejects the credentials ({@link AuthenticationException}), every following call fails
 * fast with a {@link NonRetriableException} instead of sending another request. Records translated after
 * that point are reported as failed without retries, and the run continues with downloads.
 *
 * Other failures are propagated as-is; retrying is up to the caller.
 */
public final class LlmClient {

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final AtomicBoolean permanentFailure = new AtomicBoolean(false);
	@Nonnull
	private final AtomicReference<NonRetriableException> failureCause = new AtomicReference<>();

	/**
	 * Creates an LLM client wrapping the given ChatModel.
	 *
	 * @param model the underlying chat model
	 */
	public LlmClient(@Nonnull ChatModel model) {
		this.model = Objects.requireNonNull(model, "model must not be null");
	}

	/**
	 * Sends messages to the LLM.
	 *
	 * @param messages the messages to send
	 * @return the chat response
	 * @throws NonRetriableException if the credentials were rejected by this or an earlier call
	 */
	@Nonnull
	public ChatResponse chat(@Nonnull List<ChatMessage> messages) {
		Objects.requireNonNull(messages, "messages must not be null");

		if (this.permanentFailure.get()) {
			final NonRetriableException cause = this.failureCause.get();
			throw new NonRetriableException(
				"LLM client disabled due to previous permanent failure" +
					(cause != null ? ": " + cause.getMessage() : ""),
				cause
			);
		}

		try {
			return this.model.chat(messages);
		} catch (AuthenticationException e) {
			signalShutdown(e);
			throw e;
		}
	}

	/**
	 * Checks if a permanent failure has occurred.
	 * When true, all subsequent calls to {@link #chat(List)} will fail immediately.
	 *
	 * @return true if permanent failure, false otherwise
	 */
	public boolean hasPermanentFailure() {
		return this.permanentFailure.get();
	}

	/**
	 * Returns the cause of the permanent failure, if any.
	 *
	 * @return the permanent failure exception or null
	 */
	@Nullable
	public NonRetriableException getFailureCause() {
		return this.failureCause.get();
	}

	/**
	 * Disables the client with a specific cause.
	 *
	 * @param cause the permanent failure that disabled the client
	 */
	public void signalShutdown(@Nonnull NonRetriableException cause) {
		this.failureCause.compareAndSet(null, cause);
		this.permanentFailure.set(true);
	}
}
