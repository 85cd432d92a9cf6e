package br.edu.ifba.agentflow.prompt;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder scanning and substitution for prompt templates.
 *
 * <p>A placeholder is {@code {letters:id}} or {@code {letters@id}}, case-insensitive,
 * where the id is made of letters, digits, {@code _} and {@code -}.</p>
 */
public final class PromptTemplate {

    public static final Pattern PLACEHOLDER =
        Pattern.compile("\\{([a-z]+[:@][a-z0-9_-]+)\\}", Pattern.CASE_INSENSITIVE);

    public static final String INPUT_PLACEHOLDER = "{input}";

    private static final String BEGIN_PREFIX = "begin@";
    private static final String BULLET = "  - ";

    private PromptTemplate() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Scans the template left to right. The first occurrence of each placeholder is kept.
     *
     * @return {@link PromptInputElement#USER} followed by one element per distinct placeholder
     */
    @NotNull
    public static List<PromptInputElement> extractInputElements(@NotNull String template) {
        List<PromptInputElement> elements = new ArrayList<>();
        elements.add(PromptInputElement.USER);

        Set<String> seen = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            String key = matcher.group(1);
            if (!seen.add(key)) {
                continue;
            }
            PromptInputElement.Kind kind = key.toLowerCase(Locale.ROOT).startsWith(BEGIN_PREFIX)
                ? PromptInputElement.Kind.BEGIN_PARAM_REF
                : PromptInputElement.Kind.NODE_REF;
            elements.add(new PromptInputElement(kind, key, null));
        }
        return elements;
    }

    /**
     * @return ids of the data dependencies, answer and begin anchors excluded
     */
    @NotNull
    public static List<String> dependencies(@NotNull List<PromptInputElement> elements) {
        Set<String> ids = new LinkedHashSet<>();
        for (PromptInputElement element : elements) {
            if (element.isSchedulingDependency()) {
                ids.add(element.key());
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * Replaces every {@code {key}} with its value, literally.
     */
    @NotNull
    public static String substitute(@NotNull String template, @NotNull Map<String, String> values) {
        String result = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            result = replacePlaceholder(result, entry.getKey(), Objects.toString(entry.getValue(), ""));
        }
        return result;
    }

    @NotNull
    public static String replacePlaceholder(@NotNull String template, @NotNull String key, @NotNull String value) {
        Pattern placeholder = Pattern.compile("\\{" + Pattern.quote(key) + "\\}");
        return placeholder.matcher(template).replaceAll(Matcher.quoteReplacement(value));
    }

    /**
     * Renders contents as a bulleted block, one {@code "  - "} line per value.
     */
    @NotNull
    public static String bullets(@NotNull List<String> contents) {
        List<String> values = contents.stream().filter(Objects::nonNull).toList();
        if (values.isEmpty()) {
            return "";
        }
        return BULLET + String.join("\n" + BULLET, values);
    }
}
