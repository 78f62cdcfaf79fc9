package net.spookly.exthost.protocol;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

/**
 * Request and response bodies of the unary prompt RPCs.
 */
public final class PromptMessages {
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class ConfirmRequest {
        public String message;
        public String helpMessage;
        public Boolean defaultValue;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class ConfirmResponse {
        public Boolean value;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class PromptRequest {
        public String message;
        public String helpMessage;
        public String defaultValue;
        public boolean required;
        public boolean secret;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class PromptResponse {
        public String value;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class SelectRequest {
        public String message;
        public String helpMessage;
        public List<Choice> choices;
        public Integer selectedIndex;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class SelectResponse {
        public Integer value;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class MultiSelectRequest {
        public String message;
        public String helpMessage;
        public List<Choice> choices;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class MultiSelectResponse {
        public List<Choice> values;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class Choice {
        public String value;
        public String label;
        public boolean selected;
    }

    private PromptMessages() {
    }
}
