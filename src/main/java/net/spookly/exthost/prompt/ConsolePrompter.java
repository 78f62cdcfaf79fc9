package net.spookly.exthost.prompt;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import io.grpc.Status;
import net.spookly.exthost.error.ExtensionHostException;
import net.spookly.exthost.protocol.PromptMessages;

/**
 * Line based prompter on the host's terminal.
 */
public final class ConsolePrompter implements Prompter {
    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompter() {
        this(System.in, System.out);
    }

    public ConsolePrompter(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public boolean confirm(PromptMessages.ConfirmRequest request) {
        String hint = request.defaultValue == null ? "y/n" : (request.defaultValue ? "Y/n" : "y/N");
        while (true) {
            String line = ask(request.message + " (" + hint + ")", request.helpMessage).toLowerCase(Locale.ROOT);
            if (line.isEmpty() && request.defaultValue != null) {
                return request.defaultValue;
            }
            if (line.equals("y") || line.equals("yes")) {
                return true;
            }
            if (line.equals("n") || line.equals("no")) {
                return false;
            }
            out.println("Please answer y or n.");
        }
    }

    @Override
    public String prompt(PromptMessages.PromptRequest request) {
        String label = request.message;
        if (request.defaultValue != null && !request.defaultValue.isEmpty() && !request.secret) {
            label += " [" + request.defaultValue + "]";
        }
        while (true) {
            String line = ask(label, request.helpMessage);
            if (line.isEmpty() && request.defaultValue != null) {
                line = request.defaultValue;
            }
            if (!line.isEmpty() || !request.required) {
                return line;
            }
            out.println("A value is required.");
        }
    }

    @Override
    public int select(PromptMessages.SelectRequest request) {
        List<PromptMessages.Choice> choices = request.choices == null ? List.of() : request.choices;
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("select prompt '" + request.message + "' has no choices");
        }
        printChoices(choices);
        while (true) {
            String hint = request.selectedIndex == null ? "" : " [" + (request.selectedIndex + 1) + "]";
            String line = ask(request.message + hint, request.helpMessage);
            if (line.isEmpty() && request.selectedIndex != null) {
                return request.selectedIndex;
            }
            Integer index = parseIndex(line, choices.size());
            if (index != null) {
                return index;
            }
            out.println("Enter a number between 1 and " + choices.size() + ".");
        }
    }

    @Override
    public List<PromptMessages.Choice> multiSelect(PromptMessages.MultiSelectRequest request) {
        List<PromptMessages.Choice> choices = request.choices == null ? List.of() : request.choices;
        printChoices(choices);
        while (true) {
            String line = ask(request.message + " (comma separated numbers)", request.helpMessage);
            if (line.isEmpty()) {
                List<PromptMessages.Choice> preselected = new ArrayList<>();
                for (PromptMessages.Choice choice : choices) {
                    if (choice.selected) {
                        preselected.add(choice);
                    }
                }
                return preselected;
            }
            List<PromptMessages.Choice> picked = new ArrayList<>();
            boolean valid = true;
            for (String part : line.split(",")) {
                Integer index = parseIndex(part.trim(), choices.size());
                if (index == null) {
                    valid = false;
                    break;
                }
                PromptMessages.Choice choice = choices.get(index);
                picked.add(new PromptMessages.Choice(choice.value, choice.label, true));
            }
            if (valid) {
                return picked;
            }
            out.println("Enter numbers between 1 and " + choices.size() + ".");
        }
    }

    private void printChoices(List<PromptMessages.Choice> choices) {
        for (int i = 0; i < choices.size(); i++) {
            PromptMessages.Choice choice = choices.get(i);
            String label = choice.label == null || choice.label.isBlank() ? choice.value : choice.label;
            out.println("  " + (i + 1) + ") " + label);
        }
    }

    private String ask(String message, String helpMessage) {
        if (helpMessage != null && !helpMessage.isBlank()) {
            out.println(helpMessage);
        }
        out.print("? " + message + ": ");
        out.flush();
        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            throw new ExtensionHostException(Status.Code.UNAVAILABLE, "failed to read from terminal", e);
        }
        if (line == null) {
            throw new ExtensionHostException(Status.Code.UNAVAILABLE, "terminal input closed");
        }
        return line.trim();
    }

    private static Integer parseIndex(String raw, int size) {
        try {
            int value = Integer.parseInt(raw);
            if (value >= 1 && value <= size) {
                return value - 1;
            }
        } catch (NumberFormatException ignored) {
            // falls through to the retry message
        }
        return null;
    }
}
