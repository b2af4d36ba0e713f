package com.techtrends.news.topic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered set of category rules. Order is significant: the first matching rule wins.
 */
public final class CategoryRules {

    private final List<CategoryRule> rules;

    private CategoryRules(List<CategoryRule> rules) {
        Set<String> labels = new HashSet<>();
        for (CategoryRule rule : rules) {
            if (!labels.add(rule.label())) {
                throw new IllegalArgumentException("Duplicate category label: " + rule.label());
            }
        }
        this.rules = List.copyOf(rules);
    }

    public static CategoryRules of(List<CategoryRule> rules) {
        return new CategoryRules(rules);
    }

    /**
     * Build from an ordered label → phrases mapping (iteration order is kept).
     */
    public static CategoryRules fromMap(Map<String, List<String>> mapping) {
        List<CategoryRule> rules = new ArrayList<>();
        mapping.forEach((label, keywords) -> rules.add(new CategoryRule(label, keywords)));
        return new CategoryRules(rules);
    }

    public List<CategoryRule> asList() {
        return rules;
    }

    public List<String> labels() {
        return rules.stream().map(CategoryRule::label).toList();
    }

    public Map<String, List<String>> toMap() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        rules.forEach(r -> map.put(r.label(), r.keywords()));
        return Collections.unmodifiableMap(map);
    }

    /**
     * Default technology taxonomy.
     */
    public static CategoryRules defaults() {
        return fromMap(defaultMapping());
    }

    public static Map<String, List<String>> defaultMapping() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("AI", List.of("ai", "artificial intelligence", "machine learning", "deep learning",
            "llm", "gpt", "chatgpt"));
        map.put("Python", List.of("python", "django", "flask", "fastapi", "pandas", "numpy"));
        map.put("JavaScript", List.of("javascript", "nodejs", "react", "vue", "angular", "typescript"));
        map.put("DevOps", List.of("docker", "kubernetes", "ci/cd", "jenkins", "github actions", "terraform"));
        map.put("Web", List.of("web development", "frontend", "backend", "api", "rest", "graphql"));
        map.put("Data", List.of("data science", "data analysis", "big data", "analytics", "visualization"));
        map.put("Cloud", List.of("aws", "azure", "gcp", "cloud computing", "serverless"));
        map.put("Security", List.of("cybersecurity", "security", "encryption", "vulnerability",
            "penetration testing"));
        return map;
    }
}
