package com.conclave.core.analysis;

import com.conclave.core.error.InputParseException;
import com.conclave.core.model.TaskInput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads task inputs from {@code .json}, {@code .yaml}/{@code .yml} and {@code .md} files.
 *
 * <p>Markdown files are prompt files: optional YAML front matter carries the structured
 * fields and the body becomes the description. When no target files are declared they are
 * extracted from back-quoted path tokens in the body.
 */
@Component
public class TaskInputParser {

    private static final Logger log = LoggerFactory.getLogger(TaskInputParser.class);

    private static final Pattern HEADING = Pattern.compile("^#\\s+(.+)$", Pattern.MULTILINE);
    private static final Pattern BACKQUOTED = Pattern.compile("`([^`\\s]+)`");
    private static final Pattern PATH_LIKE = Pattern.compile("[\\w.\\-]+(/[\\w.\\-]+)*");
    private static final Pattern HAS_EXTENSION = Pattern.compile(".*\\.[A-Za-z0-9]{1,8}$");

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper = new YAMLMapper();

    public TaskInputParser(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    /**
     * Parses every file in order and validates the combined set.
     */
    public List<TaskInput> parseAll(List<Path> files) {
        var inputs = new ArrayList<TaskInput>();
        for (Path file : files) {
            inputs.addAll(parse(file));
        }
        validate(inputs);
        return inputs;
    }

    /**
     * Parses one file into one or more inputs. Keys default to the file stem, suffixed
     * {@code -N} (1-based) for elements of an array.
     */
    public List<TaskInput> parse(Path file) {
        String source = file.toString();
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputParseException(source, "cannot read file: " + e.getMessage(), e);
        }

        String name = file.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        String stem = name.contains(".") ? name.substring(0, name.lastIndexOf('.')) : name;

        List<TaskInput> inputs;
        if (lower.endsWith(".json")) {
            inputs = parseStructured(jsonMapper, content, stem, source);
        } else if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            inputs = parseStructured(yamlMapper, content, stem, source);
        } else if (lower.endsWith(".md")) {
            inputs = List.of(parseMarkdown(content, stem, source));
        } else {
            throw new InputParseException(source, "unsupported file type (expected .json, .yaml, .yml or .md)");
        }
        log.debug("Parsed {} task input(s) from {}", inputs.size(), source);
        return inputs;
    }

    /**
     * Rejects blank descriptions, duplicate keys and references to unknown keys.
     */
    public void validate(List<TaskInput> inputs) {
        Map<String, TaskInput> byKey = new HashMap<>();
        for (TaskInput input : inputs) {
            String source = sourceOf(input);
            if (input.key() == null || input.key().isBlank()) {
                throw new InputParseException(source, "task key is missing");
            }
            if (input.description() == null || input.description().isBlank()) {
                throw new InputParseException(source, "task '" + input.key() + "' has no description");
            }
            TaskInput previous = byKey.putIfAbsent(input.key(), input);
            if (previous != null) {
                throw new InputParseException(source, "duplicate task key '" + input.key()
                        + "' (also defined in " + sourceOf(previous) + ")");
            }
        }
        for (TaskInput input : inputs) {
            for (String dep : input.dependsOn()) {
                if (!byKey.containsKey(dep)) {
                    throw new InputParseException(sourceOf(input),
                            "task '" + input.key() + "' depends on unknown task '" + dep + "'");
                }
            }
        }
    }

    private List<TaskInput> parseStructured(ObjectMapper mapper, String content, String stem, String source) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new InputParseException(source, "malformed content: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new InputParseException(source, "file is empty");
        }

        var inputs = new ArrayList<TaskInput>();
        if (root.isArray()) {
            int index = 1;
            for (JsonNode element : root) {
                inputs.add(toInput(element, stem + "-" + index, source));
                index++;
            }
        } else if (root.isObject()) {
            inputs.add(toInput(root, stem, source));
        } else {
            throw new InputParseException(source, "expected an object or a list of objects");
        }
        return inputs;
    }

    private TaskInput toInput(JsonNode node, String defaultKey, String source) {
        if (!node.isObject()) {
            throw new InputParseException(source, "expected an object for task '" + defaultKey + "'");
        }
        TaskInput input;
        try {
            input = jsonMapper.treeToValue(node, TaskInput.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InputParseException(source, "invalid task fields: " + e.getMessage(), e);
        }
        if (input.key() == null || input.key().isBlank()) {
            input = input.withKey(defaultKey);
        }
        if (input.title() == null || input.title().isBlank()) {
            input = input.withTitle(input.key());
        }
        return input.withSource(source);
    }

    private TaskInput parseMarkdown(String content, String stem, String source) {
        String normalized = content.replace("\r\n", "\n");
        String body = normalized;
        TaskInput input = null;

        if (normalized.startsWith("---\n")) {
            int end = normalized.indexOf("\n---", 3);
            if (end < 0) {
                throw new InputParseException(source, "front matter is not terminated");
            }
            String frontMatter = normalized.substring(4, end);
            int bodyStart = normalized.indexOf('\n', end + 4);
            body = bodyStart < 0 ? "" : normalized.substring(bodyStart + 1);
            if (!frontMatter.isBlank()) {
                JsonNode node;
                try {
                    node = yamlMapper.readTree(frontMatter);
                } catch (JsonProcessingException e) {
                    throw new InputParseException(source, "malformed front matter: " + e.getOriginalMessage(), e);
                }
                if (node != null && node.isObject()) {
                    input = toInput(node, stem, source);
                } else if (node != null && !node.isNull() && !node.isMissingNode()) {
                    throw new InputParseException(source, "front matter must be a mapping");
                }
            }
        }

        if (input == null) {
            input = TaskInput.of(stem, null, null, null).withSource(source);
        }

        String trimmedBody = body.strip();
        if (!trimmedBody.isEmpty()) {
            input = input.withDescription(trimmedBody);
        }

        boolean titleFromFrontMatter = input.title() != null && !input.title().equals(input.key());
        if (!titleFromFrontMatter) {
            Matcher heading = HEADING.matcher(trimmedBody);
            input = input.withTitle(heading.find() ? heading.group(1).strip() : stem);
        }

        if (input.targetFiles().isEmpty()) {
            input = input.withTargetFiles(extractPaths(trimmedBody));
        }
        return input;
    }

    /**
     * Back-quoted tokens that look like file paths, in order of first appearance.
     */
    static List<String> extractPaths(String text) {
        var paths = new LinkedHashSet<String>();
        Matcher matcher = BACKQUOTED.matcher(text);
        while (matcher.find()) {
            String token = matcher.group(1);
            if (token.startsWith("./")) {
                token = token.substring(2);
            }
            if (token.contains("://") || !PATH_LIKE.matcher(token).matches()) {
                continue;
            }
            if (token.contains("/") || HAS_EXTENSION.matcher(token).matches()) {
                paths.add(token);
            }
        }
        return List.copyOf(paths);
    }

    private static String sourceOf(TaskInput input) {
        return input.source() != null ? input.source() : "<input " + input.key() + ">";
    }
}
