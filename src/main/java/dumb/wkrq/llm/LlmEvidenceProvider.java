package dumb.wkrq.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dumb.wkrq.EvidenceProvider;
import dumb.wkrq.Term;
import dumb.wkrq.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Bilateral evidence from a chat model. For {@code R(a)} the model is asked separately whether there
 * is evidence that R(a) holds and whether there is evidence that it fails, so it can report a glut or
 * a gap instead of forcing a classical answer. Answers are cached per ground atom.
 */
public class LlmEvidenceProvider implements EvidenceProvider {
    private static final Logger logger = LoggerFactory.getLogger(LlmEvidenceProvider.class);

    public static final String DEFAULT_URL = "http://localhost:11434";
    public static final String DEFAULT_MODEL = "hf.co/bartowski/Meta-Llama-3.1-8B-Instruct-GGUF:Q8_0";
    static final int HTTP_TIMEOUT_SECONDS = 90;

    static final String SYSTEM_PROMPT = """
            You assess factual evidence for logical atoms. Reply with a single JSON object and nothing else:
            {"positive": "supported" | "refuted" | "unknown", "negative": "supported" | "refuted" | "unknown"}
            "positive" is whether there is evidence that the statement is true.
            "negative" is whether there is evidence that the statement is false.
            Both may be "supported" when sources conflict, and both may be "unknown" when nothing is known.""";

    private final ChatLanguageModel chat;
    private final Map<String, BilateralEvidence> cache = new ConcurrentHashMap<>();

    public LlmEvidenceProvider(ChatLanguageModel chat) {
        this.chat = requireNonNull(chat);
    }

    public static LlmEvidenceProvider ollama(String baseUrl, String model) {
        return new LlmEvidenceProvider(OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(model)
                .temperature(0.0)
                .timeout(Duration.ofSeconds(HTTP_TIMEOUT_SECONDS))
                .build());
    }

    public static LlmEvidenceProvider ollama() {
        return ollama(DEFAULT_URL, DEFAULT_MODEL);
    }

    @Override
    public BilateralEvidence evaluate(String name, List<Term.Const> terms) {
        var atom = terms.isEmpty() ? name
                : name + terms.stream().map(Term.Const::name).collect(Collectors.joining(", ", "(", ")"));
        var cached = cache.get(atom);
        if (cached != null) return cached;

        String reply;
        try {
            List<ChatMessage> messages = List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(question(name, terms, atom)));
            reply = chat.generate(messages).content().text();
        } catch (RuntimeException e) {
            throw new ProviderFailure("Chat model failed on " + atom + ": " + e.getMessage(), e);
        }
        var evidence = parse(atom, reply);
        logger.debug("LLM evidence for {}: {}", atom, evidence);
        cache.put(atom, evidence);
        return evidence;
    }

    private static String question(String name, List<Term.Const> terms, String atom) {
        var readable = switch (terms.size()) {
            case 0 -> name;
            case 1 -> terms.get(0).name() + " is " + name;
            default -> name + " holds of " + terms.stream().map(Term.Const::name).collect(Collectors.joining(", "));
        };
        return "Statement: " + atom + " (" + readable + ")";
    }

    static BilateralEvidence parse(String atom, String reply) {
        if (reply == null || reply.isBlank()) throw new ProviderFailure("Empty reply for " + atom);
        var start = reply.indexOf('{');
        var end = reply.lastIndexOf('}');
        if (start < 0 || end < start) throw new ProviderFailure("No JSON object in reply for " + atom + ": " + reply);
        try {
            var node = Json.tree(reply.substring(start, end + 1));
            return new BilateralEvidence(evidence(atom, node.path("positive").asText()), evidence(atom, node.path("negative").asText()));
        } catch (JsonProcessingException e) {
            throw new ProviderFailure("Malformed JSON in reply for " + atom + ": " + e.getOriginalMessage(), e);
        }
    }

    private static Evidence evidence(String atom, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "supported", "true", "yes" -> Evidence.SUPPORTED;
            case "refuted", "false", "no" -> Evidence.REFUTED;
            case "unknown", "" -> Evidence.UNKNOWN;
            default -> throw new ProviderFailure("Unrecognized evidence value '" + value + "' for " + atom);
        };
    }
}
