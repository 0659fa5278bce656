package com.keacast.assistant.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keacast tools by name, plus the function list advertised to the model.
 * <p>
 * A tool's parameter schema describes only what the model chooses (dates, paging, filters).
 * The caller scope ({@link ToolCallContext#SCOPE_ARGUMENTS}) is injected by
 * {@link AiToolExecutor}; a schema that advertises it would invite the model to pick another
 * user's ids, so registration fails.
 */
@Component
@Slf4j
public class ToolRegistry {

    private static final Pattern FUNCTION_NAME = Pattern.compile("[a-zA-Z0-9_-]{1,64}");

    // key 为小写名；启动后只读
    private final Map<String, AiTool> byName;
    private final List<Map<String, Object>> functions;

    public ToolRegistry(List<AiTool> tools) {
        Map<String, AiTool> registered = new LinkedHashMap<>();
        List<Map<String, Object>> advertised = new ArrayList<>();
        for (AiTool tool : tools) {
            String name = checkName(tool);
            Map<String, Object> parameters = checkParameters(name, tool.parametersSchema());
            AiTool previous = registered.putIfAbsent(name.toLowerCase(Locale.ROOT), tool);
            if (previous != null) {
                throw new IllegalStateException("Tool '" + name + "' clashes with '" + previous.name() + "'");
            }
            advertised.add(Map.of("type", "function", "function", Map.of(
                    "name", name,
                    "description", tool.description() == null ? "" : tool.description(),
                    "parameters", parameters)));
        }
        this.byName = Map.copyOf(registered);
        this.functions = List.copyOf(advertised);
        log.info("[TOOLS] registered {}", names());
    }

    /** 大小写不敏感 */
    public Optional<AiTool> get(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /** [{type:function, function:{name, description, parameters}}]，首轮和最终轮都发同一份 */
    public List<Map<String, Object>> openAiToolsSchema() {
        return functions;
    }

    public List<String> names() {
        return functions.stream()
                .map(f -> String.valueOf(((Map<?, ?>) f.get("function")).get("name")))
                .toList();
    }

    private static String checkName(AiTool tool) {
        String name = tool.name() == null ? "" : tool.name().trim();
        if (!FUNCTION_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Tool " + tool.getClass().getSimpleName()
                    + " has an invalid function name '" + name + "'");
        }
        return name;
    }

    private static Map<String, Object> checkParameters(String name, Map<String, Object> schema) {
        if (schema == null || !"object".equals(schema.get("type"))) {
            throw new IllegalStateException("Tool '" + name + "' must take an object of parameters");
        }
        List<String> leaked = new ArrayList<>();
        if (schema.get("properties") instanceof Map<?, ?> properties) {
            properties.keySet().stream().map(String::valueOf)
                    .filter(ToolCallContext.SCOPE_ARGUMENTS::contains)
                    .forEach(leaked::add);
        }
        if (schema.get("required") instanceof Collection<?> required) {
            required.stream().map(String::valueOf)
                    .filter(ToolCallContext.SCOPE_ARGUMENTS::contains)
                    .filter(k -> !leaked.contains(k))
                    .forEach(leaked::add);
        }
        if (!leaked.isEmpty()) {
            throw new IllegalStateException("Tool '" + name + "' declares caller-scope parameters " + leaked);
        }
        return schema;
    }
}
