package com.dogfold.scaffold.codegen.template;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.exception.TemplateNotFoundException;
import com.dogfold.scaffold.codegen.exception.UnknownPlaceholderException;

/**
 * Loads target templates and substitutes placeholders.
 *
 * Substitution is textual and happens in a single pass, so a bound value that happens to contain
 * another token is never substituted again.
 */
public class TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);

    private static final Pattern PLACEHOLDER_SHAPE = Pattern.compile("\\{[A-Z][A-Z0-9_]*}");

    private final boolean strictPlaceholders;

    public TemplateEngine() {
        this(false);
    }

    public TemplateEngine(boolean strictPlaceholders) {
        this.strictPlaceholders = strictPlaceholders;
    }

    /**
     * Returns the text of {@code specificPath} if it exists, else of {@code genericPath}.
     *
     * @throws TemplateNotFoundException naming {@code genericPath} if neither exists
     */
    public String loadTemplate(Path specificPath, Path genericPath) throws IOException {
        return load(locate(specificPath, genericPath));
    }

    /**
     * Picks the first existing candidate.
     *
     * @param candidates template paths, most specific first
     * @throws TemplateNotFoundException naming the last candidate if none exists
     */
    public TemplateReference locate(Path... candidates) {
        if (candidates.length == 0) {
            throw new IllegalArgumentException("At least one template candidate is required");
        }
        List<Path> ordered = Arrays.asList(candidates);
        for (Path candidate : ordered) {
            if (Files.isRegularFile(candidate)) {
                log.debug("Using template {}", candidate);
                return new TemplateReference(List.copyOf(ordered), candidate);
            }
        }
        throw new TemplateNotFoundException(candidates[candidates.length - 1]);
    }

    public String load(TemplateReference reference) throws IOException {
        return Files.readString(reference.getPath(), StandardCharsets.UTF_8);
    }

    /**
     * Replaces every occurrence of each bound placeholder. Tokens without a binding are left untouched.
     */
    public String substitute(String text, Map<Placeholder, String> bindings) {
        if (bindings.isEmpty()) {
            return text;
        }
        Map<String, String> byToken = bindings.entrySet().stream()
                .collect(Collectors.toMap(e -> e.getKey().getToken(), Map.Entry::getValue));
        Pattern tokens = Pattern.compile(byToken.keySet().stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|")));

        Matcher matcher = tokens.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(byToken.get(matcher.group())));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Substitutes the bindings and checks the result for placeholder-shaped tokens that are not
     * allowed for the template kind. Such tokens are logged and kept, or rejected in strict mode.
     *
     * @throws UnknownPlaceholderException in strict mode when unknown tokens remain
     */
    public String render(TemplateKind kind, TemplateReference reference, Map<Placeholder, String> bindings)
            throws IOException {
        String rendered = substitute(load(reference), bindings);
        Set<String> unknown = unknownPlaceholders(kind, rendered);
        if (!unknown.isEmpty()) {
            if (strictPlaceholders) {
                throw new UnknownPlaceholderException(reference.getPath(), unknown);
            }
            log.warn("Template {} contains unknown placeholder(s) {}; left as-is", reference.getPath(), unknown);
        }
        return rendered;
    }

    Set<String> unknownPlaceholders(TemplateKind kind, String text) {
        Set<String> unknown = new TreeSet<>();
        Matcher matcher = PLACEHOLDER_SHAPE.matcher(text);
        while (matcher.find()) {
            if (!kind.allows(matcher.group())) {
                unknown.add(matcher.group());
            }
        }
        return unknown;
    }
}
