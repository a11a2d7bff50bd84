package ch.so.arp.appliedai.chat;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import ch.so.arp.appliedai.memory.ChatMessage;

/**
 * Builds the message sequence sent to the language model: the retrieved
 * context as a leading system message (only when something was retrieved),
 * then the prior turns oldest first, then the new user message. The context
 * message always comes first, however long the history is.
 */
@Component
public class PromptAssembler {

    static final String CONTEXT_PREAMBLE = "Use the following document excerpts as context when answering.\n\n";

    static final String FRAGMENT_SEPARATOR = "\n\n---\n\n";

    public List<ChatMessage> assemble(List<String> fragments, List<ChatMessage> history, String userMessage) {
        List<ChatMessage> messages = new ArrayList<>(history.size() + 2);
        if (!fragments.isEmpty()) {
            messages.add(ChatMessage.system(CONTEXT_PREAMBLE + String.join(FRAGMENT_SEPARATOR, fragments)));
        }
        messages.addAll(history);
        messages.add(ChatMessage.user(userMessage));
        return messages;
    }
}
