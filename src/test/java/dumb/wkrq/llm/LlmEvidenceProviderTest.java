package dumb.wkrq.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import dumb.wkrq.Config;
import dumb.wkrq.EvidenceProvider.BilateralEvidence;
import dumb.wkrq.EvidenceProvider.Evidence;
import dumb.wkrq.EvidenceProvider.ProviderFailure;
import dumb.wkrq.Formula;
import dumb.wkrq.Sign;
import dumb.wkrq.TableauResult;
import dumb.wkrq.Term;
import dumb.wkrq.Wkrq;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmEvidenceProviderTest {

    private final List<List<ChatMessage>> requests = new ArrayList<>();

    /** A chat model that answers from a function of the user message text. */
    private ChatLanguageModel scripted(Function<String, String> reply) {
        return new ChatLanguageModel() {
            @Override
            public Response<AiMessage> generate(List<ChatMessage> messages) {
                requests.add(messages);
                var question = ((UserMessage) messages.get(messages.size() - 1)).singleText();
                return Response.from(AiMessage.from(reply.apply(question)));
            }
        };
    }

    @Test
    void readsBilateralAnswer() {
        var provider = new LlmEvidenceProvider(scripted(q -> "{\"positive\": \"supported\", \"negative\": \"refuted\"}"));
        var e = provider.evaluate("Human", List.of(new Term.Const("socrates")));
        assertEquals(new BilateralEvidence(Evidence.SUPPORTED, Evidence.REFUTED), e);

        var messages = requests.get(0);
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertTrue(((UserMessage) messages.get(1)).singleText().contains("Human(socrates)"));
    }

    @Test
    void toleratesProseAroundTheObject() {
        var e = LlmEvidenceProvider.parse("Flies(tweety)",
                "Sure. Here is my assessment:\n{\"positive\": \"TRUE\", \"negative\": \"unknown\"}\nHope that helps.");
        assertEquals(new BilateralEvidence(Evidence.SUPPORTED, Evidence.UNKNOWN), e);
        assertEquals(BilateralEvidence.UNKNOWN, LlmEvidenceProvider.parse("p", "{}"));
    }

    @Test
    void malformedRepliesAreFailures() {
        assertThrows(ProviderFailure.class, () -> LlmEvidenceProvider.parse("p", ""));
        assertThrows(ProviderFailure.class, () -> LlmEvidenceProvider.parse("p", "I cannot say."));
        assertThrows(ProviderFailure.class, () -> LlmEvidenceProvider.parse("p", "{\"positive\": \"supported\", "));
        assertThrows(ProviderFailure.class, () -> LlmEvidenceProvider.parse("p", "{\"positive\": \"maybe\"}"));
    }

    @Test
    void answersAreCachedPerAtom() {
        var provider = new LlmEvidenceProvider(scripted(q -> "{\"positive\": \"yes\", \"negative\": \"no\"}"));
        provider.evaluate("Bird", List.of(new Term.Const("tweety")));
        provider.evaluate("Bird", List.of(new Term.Const("tweety")));
        provider.evaluate("Bird", List.of(new Term.Const("polly")));
        assertEquals(2, requests.size());
    }

    @Test
    void chatErrorsBecomeProviderFailures() {
        var provider = new LlmEvidenceProvider(scripted(q -> {
            throw new IllegalStateException("connection refused");
        }));
        var e = assertThrows(ProviderFailure.class, () -> provider.evaluate("p", List.of()));
        assertTrue(e.getMessage().contains("connection refused"));
    }

    @Test
    void drivesAcrqReasoning() {
        var provider = new LlmEvidenceProvider(scripted(q -> q.contains("Penguin(pingu)")
                ? "{\"positive\": \"supported\", \"negative\": \"refuted\"}"
                : q.contains("Flies(pingu)")
                ? "{\"positive\": \"supported\", \"negative\": \"supported\"}"
                : "{\"positive\": \"unknown\", \"negative\": \"unknown\"}"));
        var wkrq = new Wkrq(Config.DEFAULT.withLogic(Config.Logic.ACRQ), provider, null);

        var flies = wkrq.solve(Formula.pred("Flies", "pingu"), Sign.T);
        assertEquals(TableauResult.Status.SATISFIABLE, flies.status());
        assertTrue(flies.models().get(0).isGlut(Formula.pred("Flies", "pingu")));

        assertEquals(TableauResult.Status.UNSATISFIABLE, wkrq.solve(Formula.pred("Penguin", "pingu"), Sign.F).status());
        assertEquals(TableauResult.Status.UNSATISFIABLE, wkrq.solve(Formula.pred("Swims", "pingu"), Sign.T).status());
    }
}
