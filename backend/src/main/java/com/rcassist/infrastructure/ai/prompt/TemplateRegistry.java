package com.rcassist.infrastructure.ai.prompt;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Analysis templates and domain contexts, loaded once from
 * {@code prompts/templates/*.txt} and {@code prompts/contexts/*.txt}. The file name without
 * extension is the id.
 */
@Slf4j
@Component
public class TemplateRegistry {

    static final String TEMPLATE_PATTERN = "classpath*:prompts/templates/*.txt";
    static final String CONTEXT_PATTERN = "classpath*:prompts/contexts/*.txt";

    private final Map<String, AnalysisTemplate> templates;
    private final Map<String, String> contexts;

    @Autowired
    public TemplateRegistry(ResourceLoader resourceLoader) {
        this(ResourcePatternUtils.getResourcePatternResolver(resourceLoader));
    }

    TemplateRegistry(ResourcePatternResolver resolver) {
        this(load(resolver, TEMPLATE_PATTERN), load(resolver, CONTEXT_PATTERN));
        log.info("Loaded {} analysis template(s) {} and {} domain context(s)",
                templates.size(), templates.keySet(), contexts.size());
    }

    public TemplateRegistry(Map<String, String> templates, Map<String, String> contexts) {
        Map<String, AnalysisTemplate> byId = new LinkedHashMap<>();
        templates.forEach((id, body) -> byId.put(id, new AnalysisTemplate(id, body)));
        this.templates = Collections.unmodifiableMap(byId);
        this.contexts = Collections.unmodifiableMap(new LinkedHashMap<>(contexts));
    }

    public AnalysisTemplate require(String templateId) {
        AnalysisTemplate template = templateId == null ? null : templates.get(templateId);
        if (template == null) {
            throw new TemplateNotFoundException("Unknown analysis template: " + templateId
                    + " (available: " + templates.keySet() + ")");
        }
        return template;
    }

    public Optional<String> context(String contextId) {
        if (contextId == null || contextId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(contexts.get(contextId));
    }

    public Collection<AnalysisTemplate> all() {
        return templates.values();
    }

    private static Map<String, String> load(ResourcePatternResolver resolver, String pattern) {
        try {
            Resource[] resources = resolver.getResources(pattern);
            Arrays.sort(resources, Comparator.comparing(r -> String.valueOf(r.getFilename())));
            Map<String, String> loaded = new LinkedHashMap<>();
            for (Resource resource : resources) {
                String filename = resource.getFilename();
                if (filename == null) {
                    continue;
                }
                String id = filename.substring(0, filename.length() - ".txt".length());
                loaded.put(id, resource.getContentAsString(StandardCharsets.UTF_8));
            }
            return loaded;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load prompt resources " + pattern, e);
        }
    }
}
