package me.golemcore.orchestrator.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.exception.ConfigurationException;
import me.golemcore.orchestrator.domain.exception.MissingVariableException;
import me.golemcore.orchestrator.domain.state.StateView;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders agent instructions by substituting {@code {key}} placeholders with
 * values from session state.
 *
 * <p>
 * Only identifiers ({@code [A-Za-z_][A-Za-z0-9_]*}) form placeholders, so JSON
 * examples and other brace text pass through unchanged. A trailing {@code ?}
 * ({@code {key?}}) makes the placeholder optional: it renders as empty text
 * when the key is absent. Strings are inserted verbatim, other scalars through
 * {@code toString()}, structured values as JSON.
 */
@Component
@RequiredArgsConstructor
public class InstructionTemplateRenderer {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)(\\?)?}");

    private final ObjectMapper objectMapper;

    /**
     * Renders the template against the given state.
     *
     * @param template
     *            instruction text with {@code {key}} placeholders
     * @param state
     *            state visible to the rendering component
     * @return the rendered text
     * @throws MissingVariableException
     *             if a required placeholder has no value in state
     */
    public String render(String template, StateView state) {
        if (template == null || template.isEmpty()) {
            return "";
        }

        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            boolean optional = matcher.group(2) != null;
            Optional<Object> value = state.get(key);
            if (value.isEmpty() && !optional) {
                throw new MissingVariableException(key);
            }
            String replacement = value.map(v -> toText(key, v)).orElse("");
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);

        return result.toString();
    }

    private String toText(String key, Object value) {
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character
                || value instanceof Enum<?>) {
            return value.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("State value under '" + key + "' cannot be rendered as JSON", e);
        }
    }
}
