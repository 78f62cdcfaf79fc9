package net.spookly.exthost.prompt;

import java.util.List;

import net.spookly.exthost.protocol.PromptMessages;

/**
 * Interactive input source behind the prompt service. Callers hold the {@link PromptLock}.
 */
public interface Prompter {
    boolean confirm(PromptMessages.ConfirmRequest request);

    String prompt(PromptMessages.PromptRequest request);

    /**
     * @return index of the chosen entry in {@code request.choices}
     */
    int select(PromptMessages.SelectRequest request);

    List<PromptMessages.Choice> multiSelect(PromptMessages.MultiSelectRequest request);
}
