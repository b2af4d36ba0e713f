package com.techtrends.news.topic;

import com.techtrends.news.model.Article;
import com.techtrends.news.model.NewsSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategorizerTest {

    private static final List<CategoryRule> RULES = List.of(
        CategoryRule.of("Python", "python", "django"),
        CategoryRule.of("DevOps", "docker", "kubernetes")
    );

    private static Article article(String title, String description) {
        return Article.builder()
            .id("a1")
            .source(NewsSource.DEV_TO)
            .title(title)
            .description(description)
            .publishedAt(Instant.EPOCH)
            .build();
    }

    @Nested
    @DisplayName("Rule order")
    class RuleOrderTests {

        @Test
        @DisplayName("First matching rule wins even when a later rule also matches")
        void firstMatchWins() {
            // When
            String category = Categorizer.classify("Python Docker Tutorial", "", RULES);

            // Then
            assertEquals("Python", category);
        }

        @Test
        @DisplayName("Reordering rules changes the winner")
        void orderMatters() {
            List<CategoryRule> reversed = List.of(RULES.get(1), RULES.get(0));

            assertEquals("DevOps", Categorizer.classify("Python Docker Tutorial", "", reversed));
        }

        @Test
        @DisplayName("A later rule matching more keywords does not win")
        void noBestMatchScoring() {
            String category = Categorizer.classify("Python on docker and kubernetes", "", RULES);

            assertEquals("Python", category);
        }
    }

    @Nested
    @DisplayName("Matching")
    class MatchingTests {

        @Test
        @DisplayName("Matching is case-insensitive")
        void caseInsensitive() {
            assertEquals("DevOps", Categorizer.classify("KUBERNETES at scale", null, RULES));
        }

        @Test
        @DisplayName("Description is searched as well as the title")
        void matchesDescription() {
            assertEquals("Python", Categorizer.classify("Weekly roundup", "New Django release", RULES));
        }

        @Test
        @DisplayName("Matching is substring based")
        void substringMatch() {
            assertEquals("Python", Categorizer.classify("Micropython on microcontrollers", "", RULES));
        }

        @Test
        @DisplayName("Multi-word phrases match as a whole")
        void phraseMatch() {
            List<CategoryRule> rules = List.of(CategoryRule.of("Data", "data science"));

            assertEquals("Data", Categorizer.classify("Intro to Data Science", "", rules));
            assertNull(Categorizer.classify("Science of data", "", rules));
        }

        @Test
        @DisplayName("No match leaves the article uncategorized")
        void noMatch() {
            Article result = Categorizer.categorize(article("Woodworking for beginners", ""), RULES);

            assertNull(result.category());
            assertEquals(Article.UNCATEGORIZED, result.categoryOrDefault());
        }

        @Test
        @DisplayName("Empty rule list categorizes nothing")
        void emptyRules() {
            assertNull(Categorizer.classify("Python Docker Tutorial", "", List.of()));
        }
    }

    @Test
    @DisplayName("Categorizing is deterministic")
    void deterministic() {
        Article input = article("Deploying Django with Docker", "step by step");

        Article first = Categorizer.categorize(input, RULES);
        Article second = Categorizer.categorize(input, RULES);

        assertEquals(first, second);
        assertEquals("Python", first.category());
    }

    @Test
    @DisplayName("Default rules classify a Python tutorial as Python")
    void defaultRules() {
        String category = Categorizer.classify("Python Docker Tutorial", "", CategoryRules.defaults().asList());

        assertEquals("Python", category);
    }
}
